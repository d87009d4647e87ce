package com.libragraph.drivereport.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class ContentHashTest {

    @Test
    void shouldHashContentDeterministically() {
        byte[] report = "Hard Disk Serial Number : WD-WCC6Y0123456".getBytes(StandardCharsets.UTF_8);

        ContentHash first = ContentHash.of(report);
        ContentHash second = ContentHash.of(report.clone());

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(first.toHex()).hasSize(32);
    }

    @Test
    void shouldDistinguishDifferentContent() {
        ContentHash a = ContentHash.of("report-a".getBytes(StandardCharsets.UTF_8));
        ContentHash b = ContentHash.of("report-b".getBytes(StandardCharsets.UTF_8));

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void shouldDefensiveCopyOnConstruction() {
        byte[] bytes = new byte[16];
        bytes[0] = (byte) 0x01;
        ContentHash hash = new ContentHash(bytes);

        bytes[0] = (byte) 0xFF;
        assertThat(hash.bytes()[0]).isEqualTo((byte) 0x01);
    }

    @Test
    void shouldRejectWrongLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new ContentHash(new byte[8]))
                .withMessageContaining("16 bytes");
    }
}
