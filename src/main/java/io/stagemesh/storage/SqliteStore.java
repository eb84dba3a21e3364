package io.stagemesh.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * SQLite-backed store. Entries and locks are scoped by the database namespace so
 * several namespaces may share one file.
 */
public final class SqliteStore extends AbstractDurableStore {
    private final Database db;
    private final String namespace;

    public SqliteStore(Database db) {
        this(db, System::currentTimeMillis);
    }

    public SqliteStore(Database db, LongSupplier clock) {
        super(clock);
        this.db = db;
        this.namespace = db.namespace();
    }

    @Override
    public Optional<String> read(String key) {
        validateKey(key);
        String sql = "SELECT entry_value FROM kv_entries WHERE namespace=? AND entry_key=?";
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setString(2, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read key: " + key, e);
        }
    }

    @Override
    public void write(String key, String value) {
        validateKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null: " + key);
        }
        String sql = """
                INSERT INTO kv_entries(namespace,entry_key,entry_value,updated_at_ms) VALUES(?,?,?,?)
                ON CONFLICT(namespace,entry_key) DO UPDATE SET
                    entry_value=excluded.entry_value,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setString(2, key);
            ps.setString(3, value);
            ps.setLong(4, clock.getAsLong());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write key: " + key, e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        String p = normalizePrefix(prefix);
        String sql = """
                SELECT entry_key FROM kv_entries
                WHERE namespace=? AND substr(entry_key,1,?)=?
                """;
        List<String> out = new ArrayList<>();
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setInt(2, p.length());
            ps.setString(3, p);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list keys with prefix: " + p, e);
        }
        out.sort(null);
        return out;
    }

    @Override
    public boolean delete(String key) {
        validateKey(key);
        String sql = "DELETE FROM kv_entries WHERE namespace=? AND entry_key=?";
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setString(2, key);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete key: " + key, e);
        }
    }

    // Both statements write, so the transaction takes the write lock up front.
    @Override
    protected Optional<Lock> tryAcquire(String key, String holderToken, long ttlMs, long nowMs) {
        try (Connection c = db.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement purge = c.prepareStatement(
                    "DELETE FROM locks WHERE namespace=? AND lock_key=? AND expires_at_ms<=?");
                 PreparedStatement insert = c.prepareStatement("""
                         INSERT OR IGNORE INTO locks(namespace,lock_key,holder_token,acquired_at_ms,ttl_ms,expires_at_ms)
                         VALUES(?,?,?,?,?,?)
                         """)) {
                purge.setString(1, namespace);
                purge.setString(2, key);
                purge.setLong(3, nowMs);
                purge.executeUpdate();

                insert.setString(1, namespace);
                insert.setString(2, key);
                insert.setString(3, holderToken);
                insert.setLong(4, nowMs);
                insert.setLong(5, ttlMs);
                insert.setLong(6, nowMs + ttlMs);
                int inserted = insert.executeUpdate();
                c.commit();
                return inserted == 1 ? Optional.of(new Lock(key, holderToken, nowMs, ttlMs)) : Optional.empty();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to acquire lock: " + key, e);
        }
    }

    @Override
    public Lock extendLock(Lock lock, long ttlMs) {
        long nowMs = clock.getAsLong();
        String sql = """
                UPDATE locks SET acquired_at_ms=?, ttl_ms=?, expires_at_ms=?
                WHERE namespace=? AND lock_key=? AND holder_token=?
                """;
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setLong(2, ttlMs);
            ps.setLong(3, nowMs + ttlMs);
            ps.setString(4, namespace);
            ps.setString(5, lock.key());
            ps.setString(6, lock.holderToken());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("Lock no longer held: " + lock.key());
            }
            return lock.extended(nowMs, ttlMs);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to extend lock: " + lock.key(), e);
        }
    }

    @Override
    public boolean releaseLock(Lock lock) {
        String sql = "DELETE FROM locks WHERE namespace=? AND lock_key=? AND holder_token=?";
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setString(2, lock.key());
            ps.setString(3, lock.holderToken());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release lock: " + lock.key(), e);
        }
    }
}
