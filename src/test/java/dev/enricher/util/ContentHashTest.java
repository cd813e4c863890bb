package dev.enricher.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHashTest {

    @Test
    void shouldProduceLowercaseSha256() {
        assertThat(ContentHash.sha256Hex("abc".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void shouldMapMimeTypesAndExtensions() {
        assertThat(MimeTypes.extensionFor("image/JPEG")).isEqualTo("jpg");
        assertThat(MimeTypes.extensionFor("application/x-unknown")).isEqualTo("bin");
        assertThat(MimeTypes.fromUrl("https://img.example/p/poster.PNG?w=500")).isEqualTo("image/png");
        assertThat(MimeTypes.fromUrl("https://img.example/p/poster")).isEqualTo("application/octet-stream");
        assertThat(MimeTypes.fromImageFormat("JPG")).isEqualTo("image/jpeg");
    }
}
