package com.jarvis.core.task;

import com.jarvis.core.TestClock;
import com.jarvis.core.model.Priority;
import com.jarvis.core.model.Task;
import com.jarvis.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private TestClock clock;
    private InMemoryTaskStore store;
    private Task task;

    @BeforeEach
    void setUp() {
        clock = new TestClock(NOW);
        store = new InMemoryTaskStore(clock);
        task = store.save(Task.create("ops.report.weekly", Priority.LOW, Map.of("week", 9), "user-1"));
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("pending, approval, in progress, completed")
        void happyPath() {
            store.transition(task.id(), TaskStatus.PENDING_APPROVAL);
            store.transition(task.id(), TaskStatus.IN_PROGRESS);
            clock.advance(Duration.ofSeconds(3));

            Task done = store.complete(task.id(), TaskStatus.COMPLETED, Map.of("rows", 12), null);

            assertEquals(TaskStatus.COMPLETED, done.status());
            assertEquals(12, done.result().get("rows"));
            assertEquals(NOW.plusSeconds(3), done.updatedAt());
        }

        @Test
        @DisplayName("a failure keeps the error")
        void failure() {
            Task failed = store.complete(task.id(), TaskStatus.FAILED, null, "boom");

            assertEquals(TaskStatus.FAILED, failed.status());
            assertEquals("boom", failed.error());
        }

        @Test
        @DisplayName("a second terminal status is refused and the first stands")
        void terminalOnce() {
            store.transition(task.id(), TaskStatus.IN_PROGRESS);
            store.complete(task.id(), TaskStatus.COMPLETED, Map.of(), null);

            assertThrows(IllegalStateException.class,
                    () -> store.complete(task.id(), TaskStatus.FAILED, null, "late"));
            assertThrows(IllegalStateException.class, () -> store.transition(task.id(), TaskStatus.IN_PROGRESS));
            assertEquals(TaskStatus.COMPLETED, store.get(task.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("saving a known id again is refused and cannot reset a finished task")
        void duplicateSave() {
            store.transition(task.id(), TaskStatus.IN_PROGRESS);
            store.complete(task.id(), TaskStatus.COMPLETED, Map.of("rows", 3), null);

            assertThrows(IllegalArgumentException.class, () -> store.save(task));

            Task stored = store.get(task.id()).orElseThrow();
            assertEquals(TaskStatus.COMPLETED, stored.status());
            assertEquals(3, stored.result().get("rows"));
            assertThrows(IllegalStateException.class,
                    () -> store.complete(task.id(), TaskStatus.FAILED, null, "second outcome"));
        }

        @Test
        @DisplayName("completing straight from pending is refused")
        void completeFromPending() {
            assertThrows(IllegalStateException.class,
                    () -> store.complete(task.id(), TaskStatus.COMPLETED, Map.of(), null));
        }

        @Test
        @DisplayName("terminal statuses only go through complete and non-terminal ones only through transition")
        void wrongOperation() {
            assertThrows(IllegalArgumentException.class, () -> store.transition(task.id(), TaskStatus.FAILED));
            assertThrows(IllegalArgumentException.class,
                    () -> store.complete(task.id(), TaskStatus.IN_PROGRESS, null, null));
        }

        @Test
        @DisplayName("transition to the current status is a no-op")
        void sameStatus() {
            store.transition(task.id(), TaskStatus.IN_PROGRESS);

            assertEquals(TaskStatus.IN_PROGRESS, store.transition(task.id(), TaskStatus.IN_PROGRESS).status());
        }

        @Test
        @DisplayName("of concurrent completions exactly one succeeds")
        void concurrentCompletion() throws Exception {
            store.transition(task.id(), TaskStatus.IN_PROGRESS);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger wins = new AtomicInteger();
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<?>> futures = new java.util.ArrayList<>();
                for (int i = 0; i < 4; i++) {
                    TaskStatus terminal = i % 2 == 0 ? TaskStatus.COMPLETED : TaskStatus.FAILED;
                    futures.add(pool.submit(() -> {
                        start.await();
                        try {
                            store.complete(task.id(), terminal, null, null);
                            wins.incrementAndGet();
                        } catch (IllegalStateException e) {
                            // lost the race
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(5, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }
            assertEquals(1, wins.get());
        }
    }

    @Test
    @DisplayName("unknown tasks are reported")
    void unknownTask() {
        assertTrue(store.get("task_missing").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> store.assign("task_missing", "agent"));
    }

    @Test
    @DisplayName("assign and updateData keep the status")
    void assignAndUpdate() {
        store.assign(task.id(), "reporter");
        Task updated = store.updateData(task.id(), Map.of("week", 10));

        assertEquals("reporter", updated.agentId());
        assertEquals(10, updated.data().get("week"));
        assertEquals(TaskStatus.PENDING, updated.status());
    }

    @Test
    @DisplayName("findByStatus filters by status")
    void findByStatus() {
        Task other = store.save(Task.create("ops.report.daily", Priority.LOW, Map.of(), "user-1"));
        store.transition(other.id(), TaskStatus.IN_PROGRESS);

        assertEquals(List.of(task.id()), store.findByStatus(TaskStatus.PENDING).stream().map(Task::id).toList());
        assertEquals(List.of(other.id()), store.findByStatus(TaskStatus.IN_PROGRESS).stream().map(Task::id).toList());
    }
}
