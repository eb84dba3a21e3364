package io.stagemesh.engine;

import io.stagemesh.error.FailureKind;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative, hierarchical cancellation. Cancelling a token cancels every child
 * with the same kind and reason; a child created from a cancelled parent starts
 * out cancelled.
 */
public final class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile FailureKind kind;
    private volatile String reason;

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public CancellationToken child() {
        CancellationToken token = new CancellationToken();
        children.add(token);
        if (isCancelled()) {
            token.cancel(kind, reason);
        }
        return token;
    }

    public void cancel() {
        cancel(FailureKind.CANCELLED, "cancelled by caller");
    }

    public void cancel(FailureKind cancelKind, String cancelReason) {
        synchronized (this) {
            if (isCancelled()) {
                return;
            }
            this.kind = cancelKind == null ? FailureKind.CANCELLED : cancelKind;
            this.reason = cancelReason == null ? "" : cancelReason;
            cancelled.countDown();
        }
        for (CancellationToken child : children) {
            child.cancel(kind, reason);
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                callback.run();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0L;
    }

    /**
     * Kind passed to {@link #cancel(FailureKind, String)}, or null while not cancelled.
     */
    public FailureKind kind() {
        return kind;
    }

    public String reason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException(reason);
        }
    }

    /**
     * Runs {@code callback} once on cancellation, immediately if already cancelled.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            callback.run();
        }
    }

    /**
     * Sleeps up to {@code millis}; returns true when woken by cancellation.
     */
    public boolean await(long millis) throws InterruptedException {
        if (millis <= 0L) {
            return isCancelled();
        }
        return cancelled.await(millis, TimeUnit.MILLISECONDS);
    }

    void detach(CancellationToken child) {
        children.remove(child);
    }
}
