package com.company.clientpulse.scheduled;

import com.company.clientpulse.domain.EnqueueResult;
import com.company.clientpulse.domain.EvaluationRequest;
import com.company.clientpulse.domain.MonitoredTarget;
import com.company.clientpulse.repository.MonitorRepository;
import com.company.clientpulse.service.EvaluationQueue;
import com.company.clientpulse.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * One cron job per enabled monitor. Each tick enqueues an evaluation; a tick that finds the
 * target still queued or running is dropped by the queue.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "pulse.scheduler.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class EvaluationScheduler {

    private final TaskScheduler taskScheduler;
    private final EvaluationQueue evaluationQueue;
    private final MonitorRepository monitorRepository;
    private final MeterRegistry meterRegistry;
    private final String defaultCron;

    private final Map<String, ScheduledFuture<?>> jobs = new ConcurrentHashMap<>();

    public EvaluationScheduler(@Qualifier("evaluationTaskScheduler") TaskScheduler taskScheduler,
                               EvaluationQueue evaluationQueue,
                               MonitorRepository monitorRepository,
                               MeterRegistry meterRegistry,
                               @Value("${pulse.scheduler.default-cron:0 */30 * * * *}") String defaultCron) {
        this.taskScheduler = taskScheduler;
        this.evaluationQueue = evaluationQueue;
        this.monitorRepository = monitorRepository;
        this.meterRegistry = meterRegistry;
        this.defaultCron = defaultCron;
    }

    /**
     * Schedule every stored monitor once the application is up
     */
    @EventListener(ApplicationReadyEvent.class)
    public void loadMonitors() {
        try {
            List<MonitoredTarget> targets = monitorRepository.list();
            targets.forEach(this::schedule);
            log.info("Scheduled {} of {} stored monitor(s)", jobs.size(), targets.size());
        } catch (Exception e) {
            log.error("Failed to load monitors for scheduling", e);
            meterRegistry.counter("pulse.scheduler.load.failures").increment();
        }
    }

    /**
     * (Re)schedule a target. Disabled targets are only unscheduled.
     */
    public void schedule(MonitoredTarget target) {
        String key = target.targetKey();
        unschedule(key);

        if (!target.isEnabled()) {
            log.debug("Monitor {} disabled, not scheduling", key);
            return;
        }

        String cron = TimeUtils.toSpringCron(
                target.getSchedule() == null || target.getSchedule().isBlank() ? defaultCron : target.getSchedule());

        CronTrigger trigger;
        try {
            trigger = new CronTrigger(cron);
        } catch (IllegalArgumentException e) {
            log.error("Invalid schedule '{}' for monitor {}, not scheduling", cron, key);
            return;
        }

        EvaluationRequest request = EvaluationRequest.of(target);
        ScheduledFuture<?> job = taskScheduler.schedule(() -> trigger(request), trigger);
        if (job != null) {
            jobs.put(key, job);
        }
        log.info("Monitor {} scheduled with '{}'", key, cron);
    }

    public void unschedule(String targetKey) {
        ScheduledFuture<?> job = jobs.remove(targetKey);
        if (job != null) {
            job.cancel(false);
            log.info("Monitor {} unscheduled", targetKey);
        }
    }

    public boolean isScheduled(String targetKey) {
        return jobs.containsKey(targetKey);
    }

    void trigger(EvaluationRequest request) {
        EnqueueResult result = evaluationQueue.enqueue(request);

        meterRegistry.counter("pulse.scheduler.triggers",
                "status", result.getStatus().name().toLowerCase()
        ).increment();

        if (!result.isAccepted()) {
            log.info("Scheduled evaluation for {} not enqueued: {}",
                    request.targetKey(), result.getStatus().getDescription());
        }
    }

    @PreDestroy
    public void cancelAll() {
        jobs.values().forEach(job -> job.cancel(false));
        jobs.clear();
    }
}
