package io.github.drompincen.postscheduler.runtime.schedule;

import io.github.drompincen.postscheduler.persistence.document.ScheduleDocument;
import io.github.drompincen.postscheduler.persistence.repository.JsonFileScheduleRepository;
import io.github.drompincen.postscheduler.persistence.repository.ScheduleStoreException;
import io.github.drompincen.postscheduler.protocol.api.DeliveryResult;
import io.github.drompincen.postscheduler.protocol.api.ScheduleStatus;
import io.github.drompincen.postscheduler.runtime.dispatch.DispatchGate;
import io.github.drompincen.postscheduler.runtime.trigger.TriggerEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Store, engine, gate and service wired together the way the application wires them.
 */
class ScheduleLifecycleTest {

    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");

    @TempDir
    Path tempDir;

    private final List<String> delivered = new CopyOnWriteArrayList<>();
    private final CountDownLatch sending = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);
    private final List<Stack> stacks = new ArrayList<>();

    private final class Stack {
        final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        final JsonFileScheduleRepository repository;
        final TriggerEngine engine;
        final ScheduleService service;
        final ScheduleRecoveryService recovery;

        Stack() {
            this(JsonFileScheduleRepository::new);
        }

        Stack(Function<Path, JsonFileScheduleRepository> storeFactory) {
            scheduler.setPoolSize(2);
            scheduler.initialize();
            executor.setCorePoolSize(2);
            executor.initialize();
            Clock clock = Clock.system(TOKYO);
            ScheduleTimeParser parser = new ScheduleTimeParser(clock, TOKYO);
            repository = storeFactory.apply(tempDir.resolve("data/schedules.json"));
            engine = new TriggerEngine(scheduler, executor, TOKYO, clock);
            DispatchGate gate = new DispatchGate((dest, content) -> {
                if (content.startsWith("hold")) awaitRelease();
                delivered.add(dest + ":" + content);
                return DeliveryResult.OK;
            }, clock, Duration.ofSeconds(5));
            service = new ScheduleService(repository, engine, gate, parser, clock);
            recovery = new ScheduleRecoveryService(repository, engine, service, parser, clock);
            stacks.add(this);
        }

        void stop() {
            engine.shutdown();
            scheduler.shutdown();
            executor.shutdown();
        }
    }

    private Stack stack;

    private void awaitRelease() {
        sending.countDown();
        try {
            release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @BeforeEach
    void setUp() {
        stack = new Stack();
    }

    @AfterEach
    void tearDown() {
        stacks.forEach(Stack::stop);
    }

    private ScheduleStatus awaitStatus(String id, ScheduleStatus expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        ScheduleStatus status = null;
        while (System.currentTimeMillis() < deadline) {
            status = stack.repository.findById(id).map(ScheduleDocument::getStatus).orElse(null);
            if (status == expected) break;
            Thread.sleep(50);
        }
        return status;
    }

    @Test
    void getAfterCreateReturnsTheStoredRecord() {
        ScheduleDocument created = stack.service.create("chan-1", "Release notes", "2099-01-02 03:04");

        assertThat(stack.service.get(created.getId())).get()
                .usingRecursiveComparison()
                .isEqualTo(created);
        assertThat(stack.service.nextFireTime(created.getId())).isPresent();
    }

    @Test
    void pastTimeFiresImmediatelyAndRecordsDelivery() throws Exception {
        ScheduleDocument created = stack.service.create("chan-1", "overdue", "2020-01-01 00:00");

        assertThat(awaitStatus(created.getId(), ScheduleStatus.DELIVERED)).isEqualTo(ScheduleStatus.DELIVERED);
        assertThat(delivered).containsExactly("chan-1:overdue");
        ScheduleDocument stored = stack.repository.findById(created.getId()).orElseThrow();
        assertThat(stored.getLastFiredAt()).isNotNull();
        assertThat(stack.engine.exists(created.getId())).isFalse();
    }

    @Test
    void deletedScheduleIsGoneAndNeverFires() throws Exception {
        ScheduleDocument created = stack.service.create("chan-1", "cancel me", "2099-01-02 03:04");

        assertThat(stack.service.delete(created.getId())).isTrue();

        assertThat(stack.service.get(created.getId())).isEmpty();
        assertThat(stack.engine.exists(created.getId())).isFalse();
        assertThat(stack.service.delete(created.getId())).isFalse();
        Thread.sleep(200);
        assertThat(delivered).isEmpty();
    }

    @Test
    void restartRestoresFutureAndRecurringSchedules() {
        ScheduleDocument future = stack.service.create("chan-1", "later", "2099-06-01 09:00");
        ScheduleDocument daily = stack.service.createRecurring("chan-2", "standup", "0 9 * * *");
        stack.stop();

        Stack restarted = new Stack();
        stack = restarted;
        RecoveryReport report = restarted.recovery.recover();

        assertThat(report).isEqualTo(new RecoveryReport(2, 0, 0));
        assertThat(restarted.engine.exists(future.getId())).isTrue();
        assertThat(restarted.engine.exists(daily.getId())).isTrue();
        assertThat(restarted.service.list()).hasSize(2);
    }

    @Test
    void oneShotMissedDuringDowntimeIsKeptAndReportedMissed() throws Exception {
        ScheduleDocument created = stack.service.create("chan-1", "during downtime", "2099-06-01 09:00");
        stack.stop();
        stack.repository.update(created.getId(), doc -> doc.setFireAt("2020-06-01T09:00:00+09:00"));

        Stack restarted = new Stack();
        stack = restarted;
        RecoveryReport report = restarted.recovery.recover();

        assertThat(report).isEqualTo(new RecoveryReport(0, 1, 0));
        ScheduleDocument stored = restarted.service.get(created.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(ScheduleStatus.PENDING);
        assertThat(restarted.service.effectiveStatus(stored)).isEqualTo(ScheduleStatus.MISSED);
        Thread.sleep(200);
        assertThat(delivered).isEmpty();
    }

    @Test
    void editWhileOneShotIsBeingSentDoesNotSendItAgain() throws Exception {
        ScheduleDocument created = stack.service.create("chan-1", "hold: hello", "2020-01-01 00:00");
        assertThat(sending.await(5, TimeUnit.SECONDS)).isTrue();

        Optional<ScheduleDocument> edited = stack.service.edit(created.getId(), "hold: hello (typo fixed)", null);
        release.countDown();

        assertThat(edited).isPresent();
        assertThat(awaitStatus(created.getId(), ScheduleStatus.DELIVERED)).isEqualTo(ScheduleStatus.DELIVERED);
        Thread.sleep(300);
        assertThat(delivered).containsExactly("chan-1:hold: hello");
        assertThat(stack.engine.exists(created.getId())).isFalse();
        assertThat(stack.service.get(created.getId()).orElseThrow().getContent()).isEqualTo("hold: hello (typo fixed)");
    }

    @Test
    void failedEditKeepsTheScheduleArmed() {
        AtomicBoolean failWrites = new AtomicBoolean();
        stack.stop();
        stack = new Stack(path -> new JsonFileScheduleRepository(path) {
            @Override
            public Optional<ScheduleDocument> update(String id, Consumer<ScheduleDocument> mutator) {
                if (failWrites.get()) throw new ScheduleStoreException("disk full", new IOException("ENOSPC"));
                return super.update(id, mutator);
            }
        });
        ScheduleDocument created = stack.service.create("chan-1", "hello", "2099-06-01 09:00");
        Optional<Instant> armedAt = stack.service.nextFireTime(created.getId());
        failWrites.set(true);

        assertThatThrownBy(() -> stack.service.edit(created.getId(), "hello (typo fixed)", "2099-07-01 09:00"))
                .isInstanceOf(ScheduleStoreException.class);

        assertThat(stack.engine.exists(created.getId())).isTrue();
        assertThat(stack.service.nextFireTime(created.getId())).isEqualTo(armedAt);
        ScheduleDocument stored = stack.repository.findById(created.getId()).orElseThrow();
        assertThat(stored.getContent()).isEqualTo("hello");
        assertThat(stored.getStatus()).isEqualTo(ScheduleStatus.PENDING);
    }
}
