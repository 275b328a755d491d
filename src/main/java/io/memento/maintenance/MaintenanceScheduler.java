package io.memento.maintenance;

import io.memento.config.MementoProperties;
import org.jobrunr.jobs.JobId;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Registers the recurring maintenance jobs with JobRunr.
 * On application startup, schedules decay every few hours and the daily decay + consolidation run.
 */
@Service
public class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    static final String DECAY_JOB_ID = "memento-decay";
    static final String DAILY_JOB_ID = "memento-daily";

    private final JobScheduler jobScheduler;
    private final MementoProperties.Maintenance settings;

    public MaintenanceScheduler(JobScheduler jobScheduler, MementoProperties properties) {
        this.jobScheduler = jobScheduler;
        this.settings = properties.maintenance();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!settings.enabled()) {
            log.info("Memory maintenance disabled via configuration");
            return;
        }

        jobScheduler.<MaintenanceJob>scheduleRecurrently(DECAY_JOB_ID, settings.decayCron(), x -> x.runDecay());
        jobScheduler.<MaintenanceJob>scheduleRecurrently(DAILY_JOB_ID, settings.dailyCron(), x -> x.runDaily());
        log.info("Maintenance jobs registered: decay '{}', daily '{}'", settings.decayCron(), settings.dailyCron());
    }

    /**
     * Enqueues a decay run outside the schedule.
     */
    public JobId triggerDecayNow() {
        log.info("Enqueuing immediate decay run");
        return jobScheduler.<MaintenanceJob>enqueue(x -> x.runDecay());
    }

    public JobId triggerDailyNow() {
        log.info("Enqueuing immediate daily maintenance run");
        return jobScheduler.<MaintenanceJob>enqueue(x -> x.runDaily());
    }

    /**
     * Enqueues an embedding backfill across all workspaces.
     */
    public JobId triggerBackfillNow() {
        log.info("Enqueuing embedding backfill");
        return jobScheduler.<MaintenanceJob>enqueue(x -> x.runBackfill());
    }

    /**
     * Removes both recurring jobs.
     */
    public void stop() {
        jobScheduler.deleteRecurringJob(DECAY_JOB_ID);
        jobScheduler.deleteRecurringJob(DAILY_JOB_ID);
        log.info("Maintenance jobs stopped");
    }

    public boolean isEnabled() {
        return settings.enabled();
    }
}
