package io.github.drompincen.postscheduler.runtime.schedule;

import io.github.drompincen.postscheduler.persistence.document.ScheduleDocument;
import io.github.drompincen.postscheduler.persistence.repository.ScheduleRepository;
import io.github.drompincen.postscheduler.persistence.repository.ScheduleStoreException;
import io.github.drompincen.postscheduler.protocol.api.ScheduleKind;
import io.github.drompincen.postscheduler.protocol.api.ScheduleStatus;
import io.github.drompincen.postscheduler.runtime.dispatch.DispatchCommand;
import io.github.drompincen.postscheduler.runtime.dispatch.DispatchGate;
import io.github.drompincen.postscheduler.runtime.dispatch.DispatchOutcome;
import io.github.drompincen.postscheduler.runtime.dispatch.DispatchPolicy;
import io.github.drompincen.postscheduler.runtime.trigger.TriggerCallback;
import io.github.drompincen.postscheduler.runtime.trigger.TriggerEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Create, edit and delete scheduled posts. Every change is written to the schedule store and
 * mirrored in the trigger engine; fired triggers are delivered through the dispatch gate and
 * their outcome recorded on the stored record.
 */
@Service
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);
    static final int MAX_CONTENT_LENGTH = 1800;

    private final ScheduleRepository repository;
    private final TriggerEngine triggerEngine;
    private final DispatchGate dispatchGate;
    private final ScheduleTimeParser timeParser;
    private final Clock clock;

    private final TriggerCallback pacedCallback = (id, command) -> onFire(id, command, DispatchPolicy.PACED);
    private final TriggerCallback unpacedCallback = (id, command) -> onFire(id, command, DispatchPolicy.UNPACED);

    public ScheduleService(ScheduleRepository repository, TriggerEngine triggerEngine, DispatchGate dispatchGate,
                           ScheduleTimeParser timeParser, Clock clock) {
        this.repository = repository;
        this.triggerEngine = triggerEngine;
        this.dispatchGate = dispatchGate;
        this.timeParser = timeParser;
        this.clock = clock;
    }

    public ScheduleDocument create(String destinationId, String content, String when) {
        requireDestination(destinationId);
        requireContent(content);
        ZonedDateTime fireAt = timeParser.parseWhen(when)
                .orElseThrow(() -> new ScheduleValidationException("Invalid date/time format: " + when));

        ScheduleDocument doc = newDocument(destinationId, content);
        doc.setKind(ScheduleKind.ONCE);
        doc.setFireAt(timeParser.format(fireAt));
        doc.setStatus(ScheduleStatus.PENDING);
        repository.save(doc);

        triggerEngine.scheduleOnce(doc.getId(), fireAt.toInstant(), commandOf(doc), pacedCallback);
        log.info("Scheduled post {} to destination {} at {}", doc.getId(), destinationId, doc.getFireAt());
        return doc;
    }

    public ScheduleDocument createRecurring(String destinationId, String content, String cronExpr) {
        requireDestination(destinationId);
        requireContent(content);
        String cron = timeParser.validateCron(cronExpr);

        ScheduleDocument doc = newDocument(destinationId, content);
        doc.setKind(ScheduleKind.RECURRING);
        doc.setCronExpr(cron);
        doc.setStatus(ScheduleStatus.ACTIVE);
        repository.save(doc);

        triggerEngine.scheduleRecurring(doc.getId(), cron, commandOf(doc), unpacedCallback);
        log.info("Scheduled recurring post {} to destination {} with cron '{}'", doc.getId(), destinationId, cron);
        return doc;
    }

    public List<ScheduleDocument> list() {
        return repository.findAll();
    }

    public Optional<ScheduleDocument> get(String id) {
        return repository.findById(id);
    }

    /**
     * Replaces the content and, when {@code newWhen} is not blank, re-times the record as a
     * one-shot post. A trigger that was still live is re-registered so that it carries the new
     * content; a one-shot post that has already started firing is not sent again unless re-timed.
     * If the record cannot be written, the cancelled trigger is restored before the error is thrown.
     *
     * @return the updated record, or empty if no record exists under {@code id}
     */
    public Optional<ScheduleDocument> edit(String id, String newContent, String newWhen) {
        Optional<ScheduleDocument> existing = repository.findById(id);
        if (existing.isEmpty()) return Optional.empty();
        requireContent(newContent);

        String retimedAt = null;
        if (newWhen != null && !newWhen.isBlank()) {
            ZonedDateTime parsed = timeParser.parseWhen(newWhen)
                    .orElseThrow(() -> new ScheduleValidationException("Invalid date/time format: " + newWhen));
            retimedAt = timeParser.format(parsed);
        }
        String fireAt = retimedAt;

        boolean wasLive = triggerEngine.remove(id);
        boolean rearm = wasLive || fireAt != null;
        Optional<ScheduleDocument> updated;
        try {
            updated = repository.update(id, doc -> {
                doc.setContent(newContent);
                if (fireAt != null) doc.retimeOnce(fireAt);
                doc.setUpdatedAt(clock.instant());
                if (rearm) arm(doc, DispatchPolicy.PACED);
            });
        } catch (RuntimeException e) {
            triggerEngine.remove(id);
            if (wasLive) restore(existing.get(), e);
            throw e;
        }

        updated.ifPresent(doc -> log.info("Edited schedule {} (retimed={}, rearmed={})", id, fireAt != null, rearm));
        return updated;
    }

    public boolean delete(String id) {
        triggerEngine.remove(id);
        boolean existed = repository.deleteById(id);
        if (existed) log.info("Deleted schedule {}", id);
        return existed;
    }

    /**
     * Status as callers should see it: a pending one-shot record whose time has passed without a
     * live trigger is reported as {@link ScheduleStatus#MISSED}.
     */
    public ScheduleStatus effectiveStatus(ScheduleDocument doc) {
        if (doc.getKind() != ScheduleKind.ONCE || doc.getStatus() != ScheduleStatus.PENDING) return doc.getStatus();
        if (triggerEngine.exists(doc.getId()) || doc.getFireAt() == null) return doc.getStatus();
        try {
            return timeParser.parseStored(doc.getFireAt()).isAfter(clock.instant())
                    ? ScheduleStatus.PENDING : ScheduleStatus.MISSED;
        } catch (DateTimeParseException e) {
            return ScheduleStatus.MISSED;
        }
    }

    public Optional<Instant> nextFireTime(String id) {
        return triggerEngine.nextFireTime(id);
    }

    public TriggerCallback callbackFor(DispatchPolicy policy) {
        return policy == DispatchPolicy.PACED ? pacedCallback : unpacedCallback;
    }

    void arm(ScheduleDocument doc, DispatchPolicy oncePolicy) {
        if (doc.getKind() == ScheduleKind.RECURRING) {
            triggerEngine.scheduleRecurring(doc.getId(), doc.getCronExpr(), commandOf(doc), unpacedCallback);
        } else {
            triggerEngine.scheduleOnce(doc.getId(), timeParser.parseStored(doc.getFireAt()), commandOf(doc),
                    callbackFor(oncePolicy));
        }
    }

    private void restore(ScheduleDocument previous, RuntimeException cause) {
        try {
            arm(previous, DispatchPolicy.UNPACED);
            log.warn("Edit of schedule {} failed, previous trigger restored", previous.getId());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("Edit of schedule {} failed and its previous trigger could not be restored", previous.getId(), e);
        }
    }

    void onFire(String id, DispatchCommand command, DispatchPolicy policy) {
        DispatchOutcome outcome = dispatchGate.dispatch(command, policy);
        Instant firedAt = clock.instant();
        try {
            repository.update(id, doc -> {
                doc.setLastFiredAt(firedAt);
                // a live trigger here belongs to a re-timed edit made while this one was sending
                if (doc.getKind() == ScheduleKind.ONCE && !triggerEngine.exists(id)) doc.setStatus(statusOf(outcome));
            });
        } catch (ScheduleStoreException e) {
            log.error("Could not record outcome {} of schedule {}", outcome, id, e);
        }
        log.info("Schedule {} fired: {}", id, outcome);
    }

    static DispatchCommand commandOf(ScheduleDocument doc) {
        return new DispatchCommand(doc.getDestinationId(), doc.getContent());
    }

    private static ScheduleStatus statusOf(DispatchOutcome outcome) {
        return switch (outcome) {
            case DELIVERED -> ScheduleStatus.DELIVERED;
            case SUPPRESSED -> ScheduleStatus.SUPPRESSED;
            case PERMISSION_DENIED, FAILED -> ScheduleStatus.FAILED;
        };
    }

    private ScheduleDocument newDocument(String destinationId, String content) {
        Instant now = clock.instant();
        ScheduleDocument doc = new ScheduleDocument();
        doc.setId(newId());
        doc.setDestinationId(destinationId.trim());
        doc.setContent(content);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        return doc;
    }

    private String newId() {
        String id;
        do {
            id = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        } while (repository.findById(id).isPresent());
        return id;
    }

    private static void requireDestination(String destinationId) {
        if (destinationId == null || destinationId.isBlank()) {
            throw new ScheduleValidationException("Destination is required");
        }
    }

    private static void requireContent(String content) {
        if (content == null || content.isEmpty() || content.length() > MAX_CONTENT_LENGTH) {
            throw new ScheduleValidationException("Message length must be between 1 and " + MAX_CONTENT_LENGTH + " characters");
        }
    }
}
