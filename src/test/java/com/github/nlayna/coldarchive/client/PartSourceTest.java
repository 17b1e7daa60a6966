package com.github.nlayna.coldarchive.client;

import com.github.nlayna.coldarchive.model.PartRange;
import com.github.nlayna.coldarchive.service.BandwidthLimiter;
import com.github.nlayna.coldarchive.service.ThrottledInputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class PartSourceTest {

    @TempDir
    Path tempDir;

    private Path fileOf(int size) throws Exception {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) i;
        }
        return Files.write(tempDir.resolve("clip.mov"), data);
    }

    @Test
    void openStream_readsOnlyTheRange() throws Exception {
        Path file = fileOf(1000);
        PartSource source = PartSource.of(file, new PartRange(2, 300, 200), null);

        byte[] read;
        try (InputStream in = source.openStream()) {
            read = in.readAllBytes();
        }

        assertThat(read).hasSize(200);
        assertThat(read[0]).isEqualTo((byte) 300);
        assertThat(read[199]).isEqualTo((byte) 499);
    }

    @Test
    void openStream_calledTwice_startsOverEachTime() throws Exception {
        PartSource source = PartSource.of(fileOf(1000), new PartRange(1, 0, 500), null);

        byte[] first;
        byte[] second;
        try (InputStream in = source.openStream()) {
            first = in.readAllBytes();
        }
        try (InputStream in = source.openStream()) {
            second = in.readAllBytes();
        }

        assertThat(Arrays.equals(first, second)).isTrue();
    }

    @Test
    void openStream_lastPartShorterThanBuffer_stopsAtFileEnd() throws Exception {
        PartSource source = PartSource.of(fileOf(1000), new PartRange(3, 900, 100), null);

        try (InputStream in = source.openStream()) {
            assertThat(in.readAllBytes()).hasSize(100);
            assertThat(in.read()).isEqualTo(-1);
        }
    }

    @Test
    void openStream_withLimiter_wrapsInThrottledStream() throws Exception {
        PartSource source = PartSource.of(fileOf(10), new PartRange(1, 0, 10), new BandwidthLimiter(1024 * 1024));

        try (InputStream in = source.openStream()) {
            assertThat(in).isInstanceOf(ThrottledInputStream.class);
            assertThat(in.readAllBytes()).hasSize(10);
        }
    }
}
