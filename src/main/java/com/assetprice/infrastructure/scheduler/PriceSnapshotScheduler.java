package com.assetprice.infrastructure.scheduler;

import com.assetprice.domain.usecase.RecordDailySnapshotUseCase;
import com.assetprice.infrastructure.config.KeepAliveConfig;
import com.assetprice.infrastructure.config.SnapshotConfig;
import com.assetprice.infrastructure.keepalive.KeepAlivePinger;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.quarkus.scheduler.Scheduler;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Registers the daily snapshot job and the keep-alive job with the Quarkus scheduler
 */
@ApplicationScoped
public class PriceSnapshotScheduler {

    private static final Logger log = LoggerFactory.getLogger(PriceSnapshotScheduler.class);
    public static final String SNAPSHOT_JOB = "daily-price-snapshot";
    public static final String KEEP_ALIVE_JOB = "keep-alive-ping";

    @Inject
    Scheduler scheduler;

    @Inject
    RecordDailySnapshotUseCase recordDailySnapshotUseCase;

    @Inject
    KeepAlivePinger keepAlivePinger;

    @Inject
    SnapshotConfig snapshotConfig;

    @Inject
    KeepAliveConfig keepAliveConfig;

    @Inject
    Clock clock;

    private boolean started;
    private boolean keepAliveScheduled;

    void onStart(@Observes StartupEvent ev) {
        start();
    }

    void onStop(@Observes ShutdownEvent ev) {
        stop();
    }

    /**
     * Schedule the jobs; calling it again while started has no effect
     */
    public synchronized void start() {
        if (started) {
            log.debug("Price snapshot scheduler already started");
            return;
        }

        String cron = dailyCron(snapshotConfig.fireAt());
        scheduler.newJob(SNAPSHOT_JOB)
                .setCron(cron)
                .setTimeZone(snapshotConfig.timeZone())
                .setConcurrentExecution(Scheduled.ConcurrentExecution.SKIP)
                .setAsyncTask(execution -> triggerDailySnapshot())
                .schedule();
        log.info("Scheduled {} with cron '{}' in {}", SNAPSHOT_JOB, cron, snapshotConfig.timeZone());

        keepAliveScheduled = keepAliveConfig.url().filter(url -> !url.isBlank()).isPresent();
        if (keepAliveScheduled) {
            scheduler.newJob(KEEP_ALIVE_JOB)
                    .setInterval(keepAliveConfig.interval().toString())
                    .setConcurrentExecution(Scheduled.ConcurrentExecution.SKIP)
                    .setAsyncTask(execution -> keepAlivePinger.ping())
                    .schedule();
            log.info("Scheduled {} every {}", KEEP_ALIVE_JOB, keepAliveConfig.interval());
        } else {
            log.info("Keep-alive URL not configured, {} disabled", KEEP_ALIVE_JOB);
        }

        started = true;
    }

    /**
     * Unschedule the jobs; calling it again while stopped has no effect
     */
    public synchronized void stop() {
        if (!started) {
            return;
        }
        scheduler.unscheduleJob(SNAPSHOT_JOB);
        if (keepAliveScheduled) {
            scheduler.unscheduleJob(KEEP_ALIVE_JOB);
        }
        started = false;
        keepAliveScheduled = false;
        log.info("Price snapshot scheduler stopped");
    }

    public synchronized boolean isStarted() {
        return started;
    }

    /**
     * Run the snapshot for today's date in the configured time zone
     */
    public Uni<Void> triggerDailySnapshot() {
        LocalDate runDate = LocalDate.now(clock.withZone(ZoneId.of(snapshotConfig.timeZone())));
        log.info("Daily snapshot triggered for {}", runDate);

        return recordDailySnapshotUseCase.execute(new RecordDailySnapshotUseCase.Command(runDate))
                .onItem().invoke(result -> {
                    if (result instanceof RecordDailySnapshotUseCase.Result.Skipped skipped) {
                        log.info("Daily snapshot for {} skipped: {}", runDate, skipped.reason());
                    }
                })
                .onFailure().invoke(throwable -> log.error("Daily snapshot for {} failed", runDate, throwable))
                .onFailure().recoverWithNull()
                .replaceWithVoid();
    }

    /**
     * Quartz cron expression firing daily at the given local time
     * @param fireAt Time as HH:mm
     */
    static String dailyCron(String fireAt) {
        LocalTime time = LocalTime.parse(fireAt);
        return String.format("0 %d %d * * ?", time.getMinute(), time.getHour());
    }
}
