package io.github.drompincen.postscheduler.runtime.schedule;

import io.github.drompincen.postscheduler.persistence.document.ScheduleDocument;
import io.github.drompincen.postscheduler.persistence.repository.ScheduleRepository;
import io.github.drompincen.postscheduler.persistence.repository.ScheduleStoreException;
import io.github.drompincen.postscheduler.protocol.api.ScheduleKind;
import io.github.drompincen.postscheduler.runtime.dispatch.DispatchPolicy;
import io.github.drompincen.postscheduler.runtime.trigger.TriggerEngine;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Rebuilds live triggers from the schedule store once at startup, before requests are served.
 * Recurring records are always re-armed; one-shot records only when their time is still ahead.
 * Past one-shot records stay in the store untouched. Bad records are logged and skipped.
 */
@Service
public class ScheduleRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleRecoveryService.class);

    private final ScheduleRepository repository;
    private final TriggerEngine triggerEngine;
    private final ScheduleService scheduleService;
    private final ScheduleTimeParser timeParser;
    private final Clock clock;

    public ScheduleRecoveryService(ScheduleRepository repository, TriggerEngine triggerEngine,
                                   ScheduleService scheduleService, ScheduleTimeParser timeParser, Clock clock) {
        this.repository = repository;
        this.triggerEngine = triggerEngine;
        this.scheduleService = scheduleService;
        this.timeParser = timeParser;
        this.clock = clock;
    }

    @PostConstruct
    public void recoverOnStartup() {
        try {
            RecoveryReport report = recover();
            log.info("Restored {} schedules ({} past one-shot skipped, {} failed)",
                    report.registered(), report.skippedPast(), report.failed());
        } catch (ScheduleStoreException e) {
            log.error("Schedule store unreadable, no schedules restored", e);
        }
    }

    public RecoveryReport recover() {
        Instant now = clock.instant();
        int registered = 0;
        int skippedPast = 0;
        int failed = 0;

        for (ScheduleDocument doc : repository.findAll()) {
            try {
                if (doc.getKind() == ScheduleKind.RECURRING && doc.getCronExpr() != null) {
                    triggerEngine.scheduleRecurring(doc.getId(), doc.getCronExpr(), ScheduleService.commandOf(doc),
                            scheduleService.callbackFor(DispatchPolicy.UNPACED));
                    registered++;
                } else if (doc.getKind() == ScheduleKind.ONCE && doc.getFireAt() != null) {
                    Instant fireAt;
                    try {
                        fireAt = timeParser.parseStored(doc.getFireAt());
                    } catch (DateTimeParseException e) {
                        log.warn("Skipping schedule {}: unreadable fire time '{}'", doc.getId(), doc.getFireAt());
                        failed++;
                        continue;
                    }
                    if (fireAt.isAfter(now)) {
                        triggerEngine.scheduleOnce(doc.getId(), fireAt, ScheduleService.commandOf(doc),
                                scheduleService.callbackFor(DispatchPolicy.UNPACED));
                        registered++;
                    } else {
                        skippedPast++;
                    }
                } else {
                    log.warn("Skipping schedule {}: kind {} without matching timing", doc.getId(), doc.getKind());
                    failed++;
                }
            } catch (Exception e) {
                log.error("Failed to restore schedule {}", doc.getId(), e);
                failed++;
            }
        }
        return new RecoveryReport(registered, skippedPast, failed);
    }
}
