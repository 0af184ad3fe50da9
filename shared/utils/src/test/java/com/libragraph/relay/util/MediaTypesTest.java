package com.libragraph.relay.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MediaTypesTest {

    @Test
    void knownExtensions() {
        assertThat(MediaTypes.forFileName("a1b2c3d4_00001.mp4")).isEqualTo("video/mp4");
        assertThat(MediaTypes.forFileName("clip.WEBM")).isEqualTo("video/webm");
        assertThat(MediaTypes.forFileName("loop.gif")).isEqualTo("image/gif");
        assertThat(MediaTypes.forFileName("frame.png")).isEqualTo("image/png");
    }

    @Test
    void unknownFallsBackToOctetStream() {
        assertThat(MediaTypes.forFileName("weights.safetensors")).isEqualTo(MediaTypes.OCTET_STREAM);
        assertThat(MediaTypes.forFileName("README")).isEqualTo(MediaTypes.OCTET_STREAM);
    }

    @Test
    void extensionIgnoresDotsInDirectories() {
        assertThat(MediaTypes.extension("out.v2/result")).isEmpty();
        assertThat(MediaTypes.extension("td_output/abc.PNG")).isEqualTo(".png");
        assertThat(MediaTypes.extension(".hidden")).isEmpty();
        assertThat(MediaTypes.extension("trailing.")).isEmpty();
        assertThat(MediaTypes.extension(null)).isEmpty();
    }
}
