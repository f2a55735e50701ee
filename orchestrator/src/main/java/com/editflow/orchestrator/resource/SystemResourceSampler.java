package com.editflow.orchestrator.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Samples the local host.
 *
 * CPU comes from the JVM's {@code com.sun.management.OperatingSystemMXBean}.
 * Accelerator temperature and memory come from {@code nvidia-smi}; if the tool
 * is missing or fails, the snapshot carries no accelerator reading and the
 * governor does not gate on it.
 */
@Component
public class SystemResourceSampler implements ResourceSampler {

    private static final Logger log = LoggerFactory.getLogger(SystemResourceSampler.class);

    private final String   nvidiaSmi;
    private final Duration probeTimeout;
    private final Clock    clock;

    // Flips to false after the first failed probe so a host without an
    // accelerator does not fork a process every sample.
    private volatile boolean acceleratorProbeEnabled = true;

    public SystemResourceSampler(@Value("${editflow.resources.nvidia-smi:nvidia-smi}") String nvidiaSmi,
                                 @Value("${editflow.resources.nvidia-smi-timeout-ms:3000}") long probeTimeoutMs,
                                 Clock clock) {
        this.nvidiaSmi    = nvidiaSmi;
        this.probeTimeout = Duration.ofMillis(probeTimeoutMs);
        this.clock        = clock;
    }

    @Override
    public ResourceSnapshot sample() {
        double cpu = cpuPercent();
        Optional<AcceleratorReading> acc = acceleratorProbeEnabled ? probeAccelerator() : Optional.empty();
        return acc.map(a -> new ResourceSnapshot(clock.instant(), cpu, a.tempC(), a.usedMb(), a.totalMb()))
                  .orElseGet(() -> ResourceSnapshot.cpuOnly(clock.instant(), cpu));
    }

    private static double cpuPercent() {
        if (ManagementFactory.getOperatingSystemMXBean() instanceof com.sun.management.OperatingSystemMXBean os) {
            double load = os.getCpuLoad();
            return load < 0 ? -1 : load * 100.0;
        }
        return -1;
    }

    private Optional<AcceleratorReading> probeAccelerator() {
        ProcessBuilder pb = new ProcessBuilder(nvidiaSmi,
                "--query-gpu=temperature.gpu,memory.used,memory.total",
                "--format=csv,noheader,nounits");
        pb.redirectErrorStream(true);
        try {
            Process process = pb.start();
            // The output is a single short line, so it fits in the pipe buffer
            // and can be read after the process has exited. Reading first would
            // block past the timeout on a tool that hangs without printing.
            if (!process.waitFor(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("{} did not answer within {} ms", nvidiaSmi, probeTimeout.toMillis());
                return Optional.empty();
            }
            if (process.exitValue() != 0) {
                disableProbe("exit code " + process.exitValue());
                return Optional.empty();
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            return parseNvidiaSmiLine(output.lines().findFirst().orElse(null));
        } catch (IOException e) {
            disableProbe(e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private void disableProbe(String reason) {
        acceleratorProbeEnabled = false;
        log.info("No accelerator readings available ({}); accelerator gating disabled", reason);
    }

    /** Parse one {@code "temp, used, total"} line as printed by nvidia-smi in CSV mode. */
    static Optional<AcceleratorReading> parseNvidiaSmiLine(String line) {
        if (line == null || line.isBlank()) return Optional.empty();
        String[] parts = line.split(",");
        if (parts.length < 3) return Optional.empty();
        try {
            return Optional.of(new AcceleratorReading(
                    Double.parseDouble(parts[0].trim()),
                    Long.parseLong(parts[1].trim()),
                    Long.parseLong(parts[2].trim())));
        } catch (NumberFormatException e) {
            log.debug("Unparseable nvidia-smi line '{}'", line);
            return Optional.empty();
        }
    }

    record AcceleratorReading(double tempC, long usedMb, long totalMb) {}
}
