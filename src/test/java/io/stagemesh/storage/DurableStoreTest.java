package io.stagemesh.storage;

import io.stagemesh.config.StageMeshConfig;
import io.stagemesh.error.LockTimeoutException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

final class DurableStoreTest {

    @Test
    void inMemoryStoreHonoursTheStoreContract() {
        AtomicLong now = new AtomicLong(10_000L);
        exerciseKeyValues(new InMemoryStore(now::get));
        exerciseLocks(new InMemoryStore(now::get), now);
    }

    @Test
    void fileStoreHonoursTheStoreContract() throws Exception {
        Path root = Files.createTempDirectory("stagemesh-test-file-store-");
        try {
            AtomicLong now = new AtomicLong(10_000L);
            exerciseKeyValues(new FileStore(root.resolve("kv"), now::get));
            exerciseLocks(new FileStore(root.resolve("locks"), now::get), now);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sqliteStoreHonoursTheStoreContract() throws Exception {
        Path root = Files.createTempDirectory("stagemesh-test-sqlite-store-");
        try {
            AtomicLong now = new AtomicLong(10_000L);
            Database db = new Database(StageMeshConfig.fromRoot(root.toString()));
            db.init();
            try (SqliteStore store = new SqliteStore(db, now::get)) {
                exerciseKeyValues(store);
                exerciseLocks(store, now);
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileStoreValuesAreVisibleToASecondInstance() throws Exception {
        Path root = Files.createTempDirectory("stagemesh-test-file-share-");
        try {
            FileStore first = new FileStore(root);
            FileStore second = new FileStore(root);
            first.write("sessions/ses_1", "{\"v\":1}");
            Assertions.assertEquals(Optional.of("{\"v\":1}"), second.read("sessions/ses_1"));

            Lock held = first.acquireLock("locks/sessions/ses_1", 60_000L, 0L);
            Assertions.assertThrows(LockTimeoutException.class,
                    () -> second.acquireLock("locks/sessions/ses_1", 60_000L, 20L));
            Assertions.assertTrue(first.releaseLock(held));
            Assertions.assertTrue(second.releaseLock(second.acquireLock("locks/sessions/ses_1", 60_000L, 0L)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sqliteNamespacesDoNotShareKeys() throws Exception {
        Path root = Files.createTempDirectory("stagemesh-test-sqlite-ns-");
        try {
            Database alpha = new Database(StageMeshConfig.fromRoot(root.toString(), "alpha"));
            Database beta = new Database(StageMeshConfig.fromRoot(root.toString(), "beta"));
            alpha.init();
            beta.init();
            new SqliteStore(alpha).write("sessions/shared", "alpha");

            Assertions.assertTrue(new SqliteStore(beta).read("sessions/shared").isEmpty());
            Assertions.assertEquals(Optional.of("alpha"), new SqliteStore(alpha).read("sessions/shared"));
            Assertions.assertFalse(alpha.listSchemaMigrations().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileStoreAgesUnreadableLockFilesByItsOwnClock() throws Exception {
        Path root = Files.createTempDirectory("stagemesh-test-file-orphan-");
        try {
            AtomicLong now = new AtomicLong(1_000_500L);
            FileStore store = new FileStore(root, now::get);
            String key = "locks/sessions/ses_orphan";
            Path lockFile = root.resolve("locks").resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + ".lock");
            Files.createDirectories(lockFile.getParent());
            Files.writeString(lockFile, "{\"key\":", StandardCharsets.UTF_8);
            Files.setLastModifiedTime(lockFile, FileTime.fromMillis(1_000_000L));

            Assertions.assertThrows(LockTimeoutException.class, () -> store.acquireLock(key, 1_000L, 0L));

            now.set(1_001_000L);
            Lock taken = store.acquireLock(key, 1_000L, 0L);
            Assertions.assertEquals(1_002_000L, taken.expiresAtMs());
            Assertions.assertTrue(store.releaseLock(taken));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void exerciseKeyValues(DurableStore store) {
        Assertions.assertTrue(store.read("sessions/missing").isEmpty());

        store.write("sessions/b", "two");
        store.write("sessions/a", "one");
        store.write("other/x", "x");
        store.write("sessions/a", "uno");

        Assertions.assertEquals(Optional.of("uno"), store.read("sessions/a"));
        Assertions.assertEquals(List.of("sessions/a", "sessions/b"), store.list("sessions/"));
        Assertions.assertEquals(List.of("other/x", "sessions/a", "sessions/b"), store.list(""));

        Assertions.assertTrue(store.delete("sessions/b"));
        Assertions.assertFalse(store.delete("sessions/b"));
        Assertions.assertEquals(List.of("sessions/a"), store.list("sessions/"));

        Assertions.assertThrows(IllegalArgumentException.class, () -> store.write("", "v"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.read("../escape"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.write("/absolute", "v"));
    }

    private static void exerciseLocks(DurableStore store, AtomicLong now) {
        Lock first = store.acquireLock("locks/sessions/s1", 1_000L, 0L);
        Assertions.assertEquals("locks/sessions/s1", first.key());
        Assertions.assertEquals(now.get() + 1_000L, first.expiresAtMs());
        Assertions.assertThrows(LockTimeoutException.class, () -> store.acquireLock("locks/sessions/s1", 1_000L, 30L));

        Lock other = store.acquireLock("locks/sessions/s2", 1_000L, 0L);
        Assertions.assertTrue(store.releaseLock(other));

        Assertions.assertTrue(store.releaseLock(first));
        Assertions.assertFalse(store.releaseLock(first));

        Lock crashed = store.acquireLock("locks/sessions/s1", 1_000L, 0L);
        now.addAndGet(999L);
        Assertions.assertThrows(LockTimeoutException.class, () -> store.acquireLock("locks/sessions/s1", 1_000L, 0L));
        now.addAndGet(1L);
        Lock taken = store.acquireLock("locks/sessions/s1", 1_000L, 0L);
        Assertions.assertNotEquals(crashed.holderToken(), taken.holderToken());

        Assertions.assertThrows(IllegalStateException.class, () -> store.extendLock(crashed, 5_000L));
        Assertions.assertFalse(store.releaseLock(crashed));

        now.addAndGet(500L);
        Lock extended = store.extendLock(taken, 5_000L);
        Assertions.assertEquals(now.get() + 5_000L, extended.expiresAtMs());
        now.addAndGet(1_000L);
        Assertions.assertThrows(LockTimeoutException.class, () -> store.acquireLock("locks/sessions/s1", 1_000L, 0L));
        Assertions.assertTrue(store.releaseLock(extended));
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
