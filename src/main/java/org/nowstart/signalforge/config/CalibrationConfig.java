package org.nowstart.signalforge.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CalibrationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "calibrationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService calibrationExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "calibration-fetch");
            thread.setDaemon(true);
            return thread;
        });
    }
}
