package org.nowstart.signalforge.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class CalibrationConfigTest {

    private final CalibrationConfig config = new CalibrationConfig();

    @Test
    void clock_usesUtc() {
        assertThat(config.clock().getZone()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void calibrationExecutor_runsOnNamedDaemonThread() throws Exception {
        ExecutorService executor = config.calibrationExecutor();
        try {
            CompletableFuture<Thread> worker = CompletableFuture.supplyAsync(Thread::currentThread, executor);

            Thread thread = worker.get(5, TimeUnit.SECONDS);

            assertThat(thread.getName()).isEqualTo("calibration-fetch");
            assertThat(thread.isDaemon()).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }
}
