package io.github.drompincen.postscheduler.runtime.trigger;

import io.github.drompincen.postscheduler.protocol.api.ScheduleKind;
import io.github.drompincen.postscheduler.runtime.dispatch.DispatchCommand;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Function;

/**
 * Live one-shot and recurring triggers keyed by schedule id.
 *
 * <p>Timers run on the {@link TaskScheduler}; when one is due its callback is handed to the
 * dispatch executor so that a slow delivery never holds a scheduler thread. Registering under an
 * id that is already live replaces the old trigger, and a removed or replaced trigger never starts
 * its callback afterwards. A callback that has already started is left to finish.
 */
@Service
public class TriggerEngine {

    private static final Logger log = LoggerFactory.getLogger(TriggerEngine.class);

    private final TaskScheduler taskScheduler;
    private final Executor dispatchExecutor;
    private final ZoneId zone;
    private final Clock clock;
    private final Map<String, LiveTrigger> triggers = new ConcurrentHashMap<>();

    public TriggerEngine(@Qualifier("taskScheduler") TaskScheduler taskScheduler,
                         @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                         ZoneId zone, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.dispatchExecutor = dispatchExecutor;
        this.zone = zone;
        this.clock = clock;
    }

    /** Fires once at {@code fireAt}; an instant already in the past fires immediately. */
    public void scheduleOnce(String id, Instant fireAt, DispatchCommand command, TriggerCallback callback) {
        LiveTrigger trigger = new LiveTrigger(id, ScheduleKind.ONCE, command, callback, fireAt, null);
        register(trigger, t -> taskScheduler.schedule(() -> fire(t), fireAt));
        log.info("Registered one-shot trigger {} at {}", id, fireAt.atZone(zone));
    }

    /**
     * Fires every time the 5-field {@code cronExpr} matches in the engine's zone until removed.
     *
     * @throws IllegalArgumentException if the expression is malformed
     */
    public void scheduleRecurring(String id, String cronExpr, DispatchCommand command, TriggerCallback callback) {
        CronExpression expression = Crontab.parse(cronExpr);
        CronTrigger cronTrigger = new CronTrigger(Crontab.toSpring(cronExpr), zone);
        LiveTrigger trigger = new LiveTrigger(id, ScheduleKind.RECURRING, command, callback, null, expression);
        register(trigger, t -> taskScheduler.schedule(() -> fire(t), cronTrigger));
        log.info("Registered recurring trigger {} with cron '{}' ({})", id, cronExpr, zone);
    }

    /**
     * Cancels the trigger registered under {@code id}. A one-shot trigger whose callback has
     * already been claimed is no longer registered, so it is not reported.
     *
     * @return true if a live trigger was cancelled and will never start its callback
     */
    public boolean remove(String id) {
        LiveTrigger removed;
        synchronized (this) {
            removed = triggers.remove(id);
            if (removed != null) removed.cancel();
        }
        if (removed != null) {
            log.info("Removed trigger {}", id);
        }
        return removed != null;
    }

    public boolean exists(String id) {
        return triggers.containsKey(id);
    }

    public Optional<Instant> nextFireTime(String id) {
        LiveTrigger trigger = triggers.get(id);
        if (trigger == null) return Optional.empty();
        if (trigger.kind == ScheduleKind.ONCE) return Optional.of(trigger.fireAt);
        ZonedDateTime next = trigger.cron.next(ZonedDateTime.now(clock.withZone(zone)));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }

    public int activeCount() {
        return triggers.size();
    }

    public ZoneId getZone() {
        return zone;
    }

    @PreDestroy
    public void shutdown() {
        synchronized (this) {
            triggers.values().forEach(LiveTrigger::cancel);
            triggers.clear();
        }
    }

    private synchronized void register(LiveTrigger trigger, Function<LiveTrigger, ScheduledFuture<?>> scheduling) {
        LiveTrigger previous = triggers.put(trigger.id, trigger);
        if (previous != null) {
            previous.cancel();
            log.debug("Replaced existing trigger {}", trigger.id);
        }
        try {
            trigger.attach(scheduling.apply(trigger));
        } catch (RuntimeException e) {
            triggers.remove(trigger.id, trigger);
            throw e;
        }
    }

    private void fire(LiveTrigger trigger) {
        if (trigger.isCancelled() || triggers.get(trigger.id) != trigger) return;
        dispatchExecutor.execute(() -> runCallback(trigger));
    }

    private void runCallback(LiveTrigger trigger) {
        synchronized (this) {
            if (!trigger.claim()) return;
            if (trigger.kind == ScheduleKind.ONCE) triggers.remove(trigger.id, trigger);
        }
        try {
            trigger.callback.onFire(trigger.id, trigger.command);
        } catch (RuntimeException e) {
            log.error("Callback for trigger {} failed", trigger.id, e);
        }
    }

    private static final class LiveTrigger {

        private final String id;
        private final ScheduleKind kind;
        private final DispatchCommand command;
        private final TriggerCallback callback;
        private final Instant fireAt;
        private final CronExpression cron;
        private ScheduledFuture<?> future;
        private boolean cancelled;
        private boolean fired;

        private LiveTrigger(String id, ScheduleKind kind, DispatchCommand command, TriggerCallback callback,
                            Instant fireAt, CronExpression cron) {
            this.id = id;
            this.kind = kind;
            this.command = command;
            this.callback = callback;
            this.fireAt = fireAt;
            this.cron = cron;
        }

        synchronized void attach(ScheduledFuture<?> future) {
            this.future = future;
            if (cancelled && future != null) future.cancel(false);
        }

        synchronized boolean isCancelled() {
            return cancelled;
        }

        // A one-shot trigger may start its callback at most once.
        synchronized boolean claim() {
            if (cancelled || (kind == ScheduleKind.ONCE && fired)) return false;
            fired = true;
            return true;
        }

        synchronized void cancel() {
            cancelled = true;
            if (future != null) future.cancel(false);
        }
    }
}
