package com.editflow.orchestrator.resource;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SystemResourceSamplerTest {

    static final Instant NOW   = Instant.parse("2025-03-01T12:00:00Z");
    static final Clock   CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir Path tmp;

    @Test
    void parse_typicalCsvLine() {
        var reading = SystemResourceSampler.parseNvidiaSmiLine("67, 2048, 8192");

        assertThat(reading).isPresent();
        assertThat(reading.get().tempC()).isEqualTo(67.0);
        assertThat(reading.get().usedMb()).isEqualTo(2048);
        assertThat(reading.get().totalMb()).isEqualTo(8192);
    }

    @Test
    void parse_garbage_isEmpty() {
        assertThat(SystemResourceSampler.parseNvidiaSmiLine(null)).isEmpty();
        assertThat(SystemResourceSampler.parseNvidiaSmiLine("")).isEmpty();
        assertThat(SystemResourceSampler.parseNvidiaSmiLine("No devices were found")).isEmpty();
        assertThat(SystemResourceSampler.parseNvidiaSmiLine("[N/A], 10, 20")).isEmpty();
    }

    @Test
    void sample_missingTool_reportsNoAccelerator() {
        SystemResourceSampler sampler = new SystemResourceSampler(
                "/nonexistent/nvidia-smi-for-tests", 3_000, CLOCK);

        ResourceSnapshot snap = sampler.sample();

        assertThat(snap.hasAccelerator()).isFalse();
        assertThat(snap.sampledAt()).isEqualTo(NOW);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void sample_toolPrintsReading_snapshotCarriesAccelerator() throws IOException {
        Path tool = script("ok-smi.sh", "echo '71, 1024, 8192'");
        SystemResourceSampler sampler = new SystemResourceSampler(tool.toString(), 3_000, CLOCK);

        ResourceSnapshot snap = sampler.sample();

        assertThat(snap.hasAccelerator()).isTrue();
        assertThat(snap.acceleratorTempC()).isEqualTo(71.0);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void sample_silentHangingTool_boundedByTimeout() throws IOException {
        Path tool = script("hang-smi.sh", "exec sleep 30");
        SystemResourceSampler sampler = new SystemResourceSampler(tool.toString(), 300, CLOCK);

        long start = System.nanoTime();
        ResourceSnapshot snap = sampler.sample();
        long tookMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(tookMs).isLessThan(5_000);
        assertThat(snap.hasAccelerator()).isFalse();
    }

    private Path script(String name, String body) throws IOException {
        Path file = tmp.resolve(name);
        Files.writeString(file, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        assertThat(file.toFile().setExecutable(true)).isTrue();
        return file;
    }
}
