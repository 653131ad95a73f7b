package com.opsagent.config;

import com.opsagent.executor.ProcessLauncher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class DispatchConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProcessLauncher processLauncher() {
        return ProcessLauncher.system();
    }

    /**
     * Stream drainers, two per running agent process.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentStreamExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService incidentExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnProperty(prefix = "dispatch.worker", name = "enabled", havingValue = "true")
    public ScheduledExecutorService workerScheduler() {
        return Executors.newScheduledThreadPool(2);
    }
}
