package com.company.clientpulse.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools outside the evaluation queue: reachability probes and cron triggers.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    /**
     * Bounded pool for SSH probes. When saturated the calling worker probes itself.
     */
    @Bean(name = "probeExecutor")
    public Executor probeExecutor(ProbeProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getParallelism());
        executor.setMaxPoolSize(properties.getParallelism());
        executor.setQueueCapacity(properties.getParallelism() * 4);
        executor.setThreadNamePrefix("probe-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        log.info("Probe executor configured with parallelism {}", properties.getParallelism());
        return executor;
    }

    @Bean(name = "evaluationTaskScheduler")
    public TaskScheduler evaluationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("evaluation-scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
