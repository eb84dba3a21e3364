package io.stagemesh.storage;

import io.stagemesh.error.LockTimeoutException;
import io.stagemesh.model.ExecutionState;
import io.stagemesh.model.ProgressEvent;
import io.stagemesh.model.ProgressEventType;
import io.stagemesh.model.Session;
import io.stagemesh.model.UnitStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class SessionRepositoryTest {

    @Test
    void concurrentWritersAcrossStoreInstancesConvergeToEveryUpdate() throws Exception {
        Path root = Files.createTempDirectory("stagemesh-test-repo-writers-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            SessionRepository left = new SessionRepository(new FileStore(root), 10_000L, 30_000L);
            SessionRepository right = new SessionRepository(new FileStore(root), 10_000L, 30_000L);
            left.compute("ses_writers", current -> Session.create("ses_writers", Map.of(), "trace", 1L));

            int writers = 40;
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                SessionRepository repo = i % 2 == 0 ? left : right;
                String message = "writer-" + i;
                futures.add(pool.submit(() -> repo.update("ses_writers", s ->
                        s.appendEvent(ProgressEvent.session(ProgressEventType.SESSION_RESUMED, 2L, message)))));
            }
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }

            Session finalState = left.load("ses_writers").orElseThrow();
            Assertions.assertEquals(writers, finalState.eventSeq());
            Assertions.assertEquals(writers, finalState.events().size());
            Assertions.assertEquals(writers, finalState.events().stream().map(ProgressEvent::message).distinct().count());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void sessionRoundTripsThroughTheStore() {
        SessionRepository repo = new SessionRepository(new InMemoryStore());
        Map<String, ExecutionState> states = new LinkedHashMap<>();
        states.put("A", ExecutionState.initial(false));
        states.put("B", ExecutionState.initial(true));

        repo.compute("ses_1", current -> {
            Assertions.assertTrue(current.isEmpty());
            return Session.create("ses_1", states, "trace-1", 100L);
        });
        Session updated = repo.update("ses_1", s -> s.withUnitState("A", s.unitState("A").claimed("own_1", 150L), 150L));

        Optional<Session> loaded = repo.load("ses_1");
        Assertions.assertTrue(loaded.isPresent());
        Assertions.assertEquals(updated, loaded.get());
        Assertions.assertEquals(UnitStatus.RUNNING, loaded.get().unitState("A").status());
        Assertions.assertEquals(UnitStatus.BLOCKED, loaded.get().unitState("B").status());
        Assertions.assertEquals(1, loaded.get().statistics().running());
        Assertions.assertEquals(List.of("ses_1"), repo.listSessionIds());
    }

    @Test
    void updateOfMissingSessionFailsAndDeleteReportsAbsence() {
        SessionRepository repo = new SessionRepository(new InMemoryStore());

        Assertions.assertThrows(IllegalArgumentException.class, () -> repo.update("nope", s -> s));
        Assertions.assertFalse(repo.delete("nope"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> repo.load("a/b"));

        repo.compute("ses_2", current -> Session.create("ses_2", Map.of(), null, 1L));
        Assertions.assertTrue(repo.delete("ses_2"));
        Assertions.assertTrue(repo.load("ses_2").isEmpty());
    }

    @Test
    void heldLockSurfacesAsLockTimeout() {
        InMemoryStore store = new InMemoryStore();
        SessionRepository repo = new SessionRepository(store, 10_000L, 20L);
        repo.compute("ses_3", current -> Session.create("ses_3", Map.of(), null, 1L));

        Lock foreign = store.acquireLock(SessionRepository.lockKey("ses_3"), 60_000L, 0L);
        try {
            LockTimeoutException error = Assertions.assertThrows(LockTimeoutException.class,
                    () -> repo.update("ses_3", s -> s.withTraceId("changed")));
            Assertions.assertEquals("locks/sessions/ses_3", error.lockKey());
        } finally {
            store.releaseLock(foreign);
        }
        Assertions.assertEquals("changed", repo.update("ses_3", s -> s.withTraceId("changed")).traceId());
    }

    @Test
    void inProcessLocksAreDroppedOnceIdle() throws Exception {
        InMemoryStore store = new InMemoryStore();
        SessionRepository repo = new SessionRepository(store, 10_000L, 20L);
        for (int i = 0; i < 200; i++) {
            String id = "ses_idle_" + i;
            repo.compute(id, current -> Session.create(id, Map.of(), null, 1L));
            repo.update(id, s -> s.withTraceId("t"));
        }
        Assertions.assertEquals(0, repo.localLockCount());

        repo.delete("ses_idle_0");
        Lock foreign = store.acquireLock(SessionRepository.lockKey("ses_idle_1"), 60_000L, 0L);
        try {
            Assertions.assertThrows(LockTimeoutException.class, () -> repo.update("ses_idle_1", s -> s));
        } finally {
            store.releaseLock(foreign);
        }
        Assertions.assertEquals(0, repo.localLockCount());

        ExecutorService pool = Executors.newFixedThreadPool(4);
        SessionRepository patient = repo.withLockSettings(10_000L, 30_000L);
        try {
            List<Future<Session>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                futures.add(pool.submit(() -> patient.update("ses_idle_2", s -> s.withTraceId("busy"))));
            }
            for (Future<Session> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        Assertions.assertEquals(0, repo.localLockCount());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
