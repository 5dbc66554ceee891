package com.eyelevel.bulkconverter.service.location;

import com.eyelevel.bulkconverter.exception.MalformedLocationException;
import com.eyelevel.bulkconverter.model.LocationDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocationResolverTest {

    private final LocationResolver resolver = new LocationResolver("config");

    @Test
    void containerOnlyDescriptorHasNoPrefix() {
        LocationDescriptor location = resolver.resolve("https://acct.blob.core.windows.net/container?sv=2020&sig=abc");

        assertThat(location.endpoint()).isEqualTo("https://acct.blob.core.windows.net");
        assertThat(location.root()).isEqualTo("container");
        assertThat(location.pathPrefix()).isEmpty();
        assertThat(location.accessToken()).isEqualTo("sv=2020&sig=abc");
        assertThat(location.folderPath("files")).isEqualTo("files");
    }

    @Test
    void nestedDescriptorKeepsEverySegmentAfterTheContainer() {
        LocationDescriptor location = resolver.resolve("https://acct.blob.core.windows.net/container/root/folder1?t=1");

        assertThat(location.root()).isEqualTo("container");
        assertThat(location.pathPrefix()).containsExactly("root", "folder1");
        assertThat(location.folderPath("converted")).isEqualTo("root/folder1/converted");
        assertThat(location.objectKey("files", "a.docx")).isEqualTo("root/folder1/files/a.docx");
    }

    @Test
    void trailingControlFolderStaysInThePrefix() {
        LocationDescriptor location = resolver.resolve(
                "https://acct.blob.core.windows.net/container/root/folder1/config?t=1");

        assertThat(location.pathPrefix()).containsExactly("root", "folder1", "config");
        assertThat(location.folderPath("config")).isEqualTo("root/folder1/config/config");
    }

    @Test
    void descriptorWithoutTokenResolvesWithEmptyToken() {
        LocationDescriptor location = resolver.resolve("https://s3.us-east-1.amazonaws.com/bucket/a/");

        assertThat(location.accessToken()).isEmpty();
        assertThat(location.pathPrefix()).isEqualTo(List.of("a"));
    }

    @Test
    void resolvingTheSameDescriptorTwiceYieldsEqualLocations() {
        String raw = "https://acct.blob.core.windows.net/container/root//folder1/?sig=x";

        assertThat(resolver.resolve(raw)).isEqualTo(resolver.resolve(raw));
        assertThat(resolver.resolve(raw).pathPrefix()).containsExactly("root", "folder1");
    }

    @Test
    void describeNeverExposesTheToken() {
        LocationDescriptor location = resolver.resolve("https://acct.blob.core.windows.net/container/p?sig=secret");

        assertThat(location.describe()).isEqualTo("https://acct.blob.core.windows.net/container/p?<token>");
        assertThat(location.toString()).doesNotContain("secret");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "not a url", "container/only?sig=1", "https://acct.blob.core.windows.net/?sig=1",
            "https://acct.blob.core.windows.net"})
    void malformedDescriptorsAreRejected(String raw) {
        assertThatThrownBy(() -> resolver.resolve(raw)).isInstanceOf(MalformedLocationException.class);
    }

    @Test
    void rejectionMessageMasksTheToken() {
        assertThatThrownBy(() -> resolver.resolve("https://acct.blob.core.windows.net?sig=secret"))
                .isInstanceOf(MalformedLocationException.class)
                .hasMessageContaining("?<token>")
                .hasMessageNotContaining("secret");
    }
}
