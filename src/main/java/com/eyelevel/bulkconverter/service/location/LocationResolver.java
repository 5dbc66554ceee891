package com.eyelevel.bulkconverter.service.location;

import com.eyelevel.bulkconverter.config.ConversionProperties;
import com.eyelevel.bulkconverter.exception.MalformedLocationException;
import com.eyelevel.bulkconverter.model.LocationDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;

/**
 * Parses raw storage-location descriptors (a URL whose query component is the access token) into a
 * {@link LocationDescriptor}. The first path segment is the root container; the remaining segments form
 * the path prefix under which the control, work and output folders live.
 * <p>
 * Three shapes are recognized:
 * <ol>
 *     <li>{@code https://host/container?token} - no prefix, folders live directly under the container.</li>
 *     <li>{@code https://host/container/root/folder1?token} - prefix {@code [root, folder1]}.</li>
 *     <li>{@code https://host/container/root/folder1/config?token} - the trailing control-folder name is kept
 *     as part of the prefix, so the control folder is re-appended beneath it
 *     ({@code root/folder1/config/config}). Downstream folder construction relies on this.</li>
 * </ol>
 * No network access happens here.
 */
@Slf4j
@Component
public class LocationResolver {

    private final String controlFolder;

    @Autowired
    public LocationResolver(ConversionProperties properties) {
        this(properties.folders().control());
    }

    LocationResolver(String controlFolder) {
        this.controlFolder = controlFolder;
    }

    /**
     * Resolves a raw descriptor.
     *
     * @param rawDescriptor The descriptor, e.g. {@code https://account.blob.core.windows.net/container/path?sv=...}.
     * @return The resolved, immutable location.
     * @throws MalformedLocationException if the descriptor is blank, unparseable or has no root segment.
     */
    public LocationDescriptor resolve(final String rawDescriptor) {
        if (!StringUtils.hasText(rawDescriptor)) {
            throw new MalformedLocationException("Location descriptor is empty.");
        }

        final String trimmed = rawDescriptor.trim();
        final int queryStart = trimmed.indexOf('?');
        final String base = queryStart >= 0 ? trimmed.substring(0, queryStart) : trimmed;
        final String accessToken = queryStart >= 0 ? trimmed.substring(queryStart + 1) : "";

        final URI uri;
        try {
            uri = new URI(base);
        } catch (URISyntaxException e) {
            throw new MalformedLocationException("Location descriptor is not a valid URL: " + mask(trimmed), e);
        }
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            throw new MalformedLocationException("Location descriptor has no scheme or host: " + mask(trimmed));
        }

        final List<String> segments = Arrays.stream(nullToEmpty(uri.getPath()).split("/"))
                                            .filter(StringUtils::hasText)
                                            .toList();
        if (segments.isEmpty()) {
            throw new MalformedLocationException("Location descriptor has no container segment: " + mask(trimmed));
        }

        final String endpoint = uri.getScheme() + "://" + uri.getRawAuthority();
        final String root = segments.get(0);
        final List<String> pathPrefix = segments.subList(1, segments.size());

        if (!pathPrefix.isEmpty() && controlFolder.equals(pathPrefix.get(pathPrefix.size() - 1))) {
            log.debug("Descriptor path ends with the control folder '{}'; keeping it in the prefix.", controlFolder);
        }

        final LocationDescriptor descriptor = new LocationDescriptor(endpoint, root, pathPrefix, accessToken);
        log.debug("Resolved location descriptor to {}", descriptor.describe());
        return descriptor;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String mask(String descriptor) {
        final int queryStart = descriptor.indexOf('?');
        return queryStart >= 0 ? descriptor.substring(0, queryStart) + "?<token>" : descriptor;
    }
}
