package com.eyelevel.bulkconverter.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A resolved storage location: the service endpoint, the root container, an optional nested
 * path prefix and the access token that authorizes calls against it.
 * <p>
 * Instances are immutable and are recomputed per job from a raw descriptor string.
 *
 * @param endpoint    The scheme and authority of the store, e.g. {@code https://account.blob.core.windows.net}.
 * @param root        The root container (bucket) name.
 * @param pathPrefix  The nested path segments under the root. Never {@code null}; empty when the
 *                    descriptor points directly at the container.
 * @param accessToken The raw query component of the descriptor. Empty when none was given.
 */
public record LocationDescriptor(String endpoint, String root, List<String> pathPrefix, String accessToken) {

    public LocationDescriptor {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(root, "root");
        pathPrefix = pathPrefix == null ? List.of() : List.copyOf(pathPrefix);
        accessToken = accessToken == null ? "" : accessToken;
    }

    /**
     * Builds the key of a folder under this location's prefix, e.g. {@code root/folder1/files}.
     */
    public String folderPath(String folder) {
        List<String> segments = new ArrayList<>(pathPrefix);
        segments.add(folder);
        return String.join("/", segments);
    }

    /**
     * Builds the full object key of {@code name} inside {@code folder}.
     */
    public String objectKey(String folder, String name) {
        return folderPath(folder) + "/" + name;
    }

    public boolean hasPathPrefix() {
        return !pathPrefix.isEmpty();
    }

    /**
     * A loggable representation that never exposes the access token.
     */
    public String describe() {
        String path = hasPathPrefix() ? "/" + String.join("/", pathPrefix) : "";
        return endpoint + "/" + root + path + (accessToken.isEmpty() ? "" : "?<token>");
    }

    @Override
    public String toString() {
        return "LocationDescriptor[" + describe() + "]";
    }
}
