package de.mirkosertic.mcp.vaultsearch.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HumanReadable Tests")
class HumanReadableTest {

    @Test
    @DisplayName("Should format durations by component")
    void shouldFormatDurations() {
        assertThat(HumanReadable.duration(Duration.ZERO)).isEqualTo("0s");
        assertThat(HumanReadable.duration(Duration.ofMillis(900))).isEqualTo("0s");
        assertThat(HumanReadable.duration(Duration.ofSeconds(-5))).isEqualTo("0s");
        assertThat(HumanReadable.duration(Duration.ofSeconds(42))).isEqualTo("42s");
        assertThat(HumanReadable.duration(Duration.ofMinutes(3))).isEqualTo("3m");
        assertThat(HumanReadable.duration(Duration.ofSeconds(93_784))).isEqualTo("1d 2h 3m 4s");
        assertThat(HumanReadable.duration(Duration.ofHours(49))).isEqualTo("2d 1h");
    }

    @Test
    @DisplayName("Should format byte counts with SI units")
    void shouldFormatBytes() {
        assertThat(HumanReadable.bytes(0)).isEqualTo("0 B");
        assertThat(HumanReadable.bytes(512)).isEqualTo("512 B");
        assertThat(HumanReadable.bytes(1_500)).isEqualTo("1.5 kB");
        assertThat(HumanReadable.bytes(1_200_000)).isEqualTo("1.2 MB");
        assertThat(HumanReadable.bytes(82_854_982)).isEqualTo("83 MB");
        assertThat(HumanReadable.bytes(3_000_000_000L)).isEqualTo("3.0 GB");
    }
}
