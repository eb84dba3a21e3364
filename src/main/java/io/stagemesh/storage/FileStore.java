package io.stagemesh.storage;

import io.stagemesh.util.Jsons;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.LongSupplier;
import java.util.stream.Stream;

/**
 * Directory-backed store usable by several processes sharing a filesystem.
 *
 * <p>Values live under {@code data/} as one file per key and are replaced through
 * a temp file plus atomic rename. Locks are {@code CREATE_NEW} files under
 * {@code locks/}; an expired lock is stolen by renaming it aside and checking
 * that the renamed file still belongs to the expired holder.
 */
public final class FileStore extends AbstractDurableStore {
    private static final String VALUE_SUFFIX = ".val";
    private static final String LOCK_SUFFIX = ".lock";
    private static final int MAX_FILE_NAME = 240;

    private final Path dataDir;
    private final Path lockDir;

    public FileStore(Path root) {
        this(root, System::currentTimeMillis);
    }

    public FileStore(Path root, LongSupplier clock) {
        super(clock);
        this.dataDir = root.resolve("data");
        this.lockDir = root.resolve("locks");
        try {
            Files.createDirectories(dataDir);
            Files.createDirectories(lockDir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize file store: " + root, e);
        }
    }

    @Override
    public Optional<String> read(String key) {
        Path file = valuePath(key);
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read key: " + key, e);
        }
    }

    @Override
    public void write(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null: " + key);
        }
        Path target = valuePath(key);
        try {
            replaceAtomically(target, value);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write key: " + key, e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        String p = normalizePrefix(prefix);
        List<String> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dataDir)) {
            files.map(f -> f.getFileName().toString())
                    .filter(name -> name.endsWith(VALUE_SUFFIX) && !name.startsWith(".tmp-"))
                    .map(name -> decode(name.substring(0, name.length() - VALUE_SUFFIX.length())))
                    .filter(key -> key.startsWith(p))
                    .forEach(out::add);
        } catch (IOException e) {
            throw new RuntimeException("Failed to list keys with prefix: " + p, e);
        }
        out.sort(null);
        return out;
    }

    @Override
    public boolean delete(String key) {
        try {
            return Files.deleteIfExists(valuePath(key));
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete key: " + key, e);
        }
    }

    @Override
    protected Optional<Lock> tryAcquire(String key, String holderToken, long ttlMs, long nowMs) {
        Path path = lockPath(key);
        Lock candidate = new Lock(key, holderToken, nowMs, ttlMs);
        if (tryCreate(path, candidate)) {
            return Optional.of(candidate);
        }
        Optional<Lock> existing = readLock(path);
        boolean expired = existing.isPresent()
                ? existing.get().isExpired(nowMs)
                : isOrphaned(path, ttlMs, nowMs);
        if (!expired) {
            return Optional.empty();
        }
        if (!steal(path, existing)) {
            return Optional.empty();
        }
        return tryCreate(path, candidate) ? Optional.of(candidate) : Optional.empty();
    }

    @Override
    public Lock extendLock(Lock lock, long ttlMs) {
        Path path = lockPath(lock.key());
        Optional<Lock> current = readLock(path);
        if (current.isEmpty() || !current.get().holderToken().equals(lock.holderToken())) {
            throw new IllegalStateException("Lock no longer held: " + lock.key());
        }
        Lock extended = current.get().extended(clock.getAsLong(), ttlMs);
        try {
            replaceAtomically(path, Jsons.toCompactJson(extended));
        } catch (IOException e) {
            throw new RuntimeException("Failed to extend lock: " + lock.key(), e);
        }
        return extended;
    }

    @Override
    public boolean releaseLock(Lock lock) {
        Path path = lockPath(lock.key());
        Optional<Lock> current = readLock(path);
        if (current.isEmpty() || !current.get().holderToken().equals(lock.holderToken())) {
            return false;
        }
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new RuntimeException("Failed to release lock: " + lock.key(), e);
        }
    }

    private boolean tryCreate(Path path, Lock lock) {
        try {
            Files.writeString(path, Jsons.toCompactJson(lock), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            throw new RuntimeException("Failed to create lock file: " + path, e);
        }
    }

    private boolean steal(Path path, Optional<Lock> expected) {
        Path aside = path.resolveSibling(path.getFileName() + ".stale-" + UUID.randomUUID());
        try {
            Files.move(path, aside, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            // Released or stolen by someone else; the next CREATE_NEW decides.
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to steal expired lock: " + path, e);
        }
        Optional<Lock> moved = readLock(aside);
        String expectedHolder = expected.map(Lock::holderToken).orElse(null);
        String movedHolder = moved.map(Lock::holderToken).orElse(null);
        try {
            if (Objects.equals(expectedHolder, movedHolder)) {
                Files.deleteIfExists(aside);
                return true;
            }
            // A fresh lock replaced the expired one before the rename; hand it back.
            Files.move(aside, path);
            return false;
        } catch (FileAlreadyExistsException e) {
            throw new IllegalStateException("Lock file contention while restoring: " + path, e);
        } catch (IOException e) {
            throw new RuntimeException("Failed to settle stolen lock: " + path, e);
        }
    }

    private Optional<Lock> readLock(Path path) {
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read lock file: " + path, e);
        }
        if (raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.fromJson(raw, Lock.class));
        } catch (RuntimeException e) {
            // Half-written by a crashed holder; treated like an unreadable lock.
            return Optional.empty();
        }
    }

    // An unreadable lock file is abandoned once it is older than the requested ttl.
    private boolean isOrphaned(Path path, long ttlMs, long nowMs) {
        try {
            long modified = Files.getLastModifiedTime(path).toMillis();
            return nowMs - modified >= ttlMs;
        } catch (NoSuchFileException e) {
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to stat lock file: " + path, e);
        }
    }

    private void replaceAtomically(Path target, String value) throws IOException {
        Path temp = target.resolveSibling(".tmp-" + UUID.randomUUID() + ".tmp");
        try {
            Files.writeString(temp, value, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private Path valuePath(String key) {
        validateKey(key);
        return dataDir.resolve(fileName(key, VALUE_SUFFIX));
    }

    private Path lockPath(String key) {
        validateKey(key);
        return lockDir.resolve(fileName(key, LOCK_SUFFIX));
    }

    private static String fileName(String key, String suffix) {
        String encoded = URLEncoder.encode(key, StandardCharsets.UTF_8);
        if (encoded.length() + suffix.length() > MAX_FILE_NAME) {
            throw new IllegalArgumentException("store key too long for file store: " + key);
        }
        return encoded + suffix;
    }

    private static String decode(String encoded) {
        return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
    }
}
