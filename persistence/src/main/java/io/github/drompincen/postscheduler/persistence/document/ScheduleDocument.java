package io.github.drompincen.postscheduler.persistence.document;

import io.github.drompincen.postscheduler.protocol.api.ScheduleKind;
import io.github.drompincen.postscheduler.protocol.api.ScheduleStatus;

import java.time.Instant;

/**
 * A requested delivery as persisted in the schedule store.
 * Exactly one of {@code fireAt} / {@code cronExpr} is set, matching {@code kind}.
 * {@code fireAt} is kept as the stored ISO-8601 text so that recovery can skip unreadable values.
 */
public class ScheduleDocument {

    private String id;
    private String destinationId;
    private String content;
    private ScheduleKind kind;
    private String fireAt;
    private String cronExpr;
    private ScheduleStatus status;
    private Instant lastFiredAt;
    private Instant createdAt;
    private Instant updatedAt;

    public ScheduleDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getDestinationId() { return destinationId; }
    public void setDestinationId(String destinationId) { this.destinationId = destinationId; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public ScheduleKind getKind() { return kind; }
    public void setKind(ScheduleKind kind) { this.kind = kind; }

    public String getFireAt() { return fireAt; }
    public void setFireAt(String fireAt) { this.fireAt = fireAt; }

    public String getCronExpr() { return cronExpr; }
    public void setCronExpr(String cronExpr) { this.cronExpr = cronExpr; }

    public ScheduleStatus getStatus() { return status; }
    public void setStatus(ScheduleStatus status) { this.status = status; }

    public Instant getLastFiredAt() { return lastFiredAt; }
    public void setLastFiredAt(Instant lastFiredAt) { this.lastFiredAt = lastFiredAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public void retimeOnce(String fireAt) {
        this.kind = ScheduleKind.ONCE;
        this.fireAt = fireAt;
        this.cronExpr = null;
        this.status = ScheduleStatus.PENDING;
    }
}
