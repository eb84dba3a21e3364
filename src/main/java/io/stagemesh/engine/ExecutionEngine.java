package io.stagemesh.engine;

import io.stagemesh.error.CircuitOpenException;
import io.stagemesh.error.CriticalStageFailureException;
import io.stagemesh.error.FailureKind;
import io.stagemesh.error.InsufficientPartialResultsException;
import io.stagemesh.error.LockTimeoutException;
import io.stagemesh.error.ParallelExecutionTimeoutException;
import io.stagemesh.error.StageMeshException;
import io.stagemesh.error.StageTimeoutException;
import io.stagemesh.graph.DependencyGraph;
import io.stagemesh.handler.HandlerRegistry;
import io.stagemesh.handler.UnitHandler;
import io.stagemesh.model.ExecutionState;
import io.stagemesh.model.FailureRecord;
import io.stagemesh.model.ProgressEvent;
import io.stagemesh.model.ProgressEventType;
import io.stagemesh.model.RunFailure;
import io.stagemesh.model.RunReport;
import io.stagemesh.model.Session;
import io.stagemesh.model.SessionStatus;
import io.stagemesh.model.UnitStatus;
import io.stagemesh.model.WorkUnit;
import io.stagemesh.observability.AuditLogger;
import io.stagemesh.observability.TraceContextUtil;
import io.stagemesh.resilience.CircuitBreaker;
import io.stagemesh.resilience.CircuitBreakerRegistry;
import io.stagemesh.resilience.RetryDecision;
import io.stagemesh.resilience.RetryPolicy;
import io.stagemesh.storage.DurableStore;
import io.stagemesh.storage.SessionRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Runs a work-unit set wave by wave against a persisted session.
 *
 * <p>Each run owns a fixed dispatcher pool of {@code globalConcurrency} threads,
 * which is the admission gate, and a separate daemon pool for handler calls so a
 * timed-out call can be abandoned without holding a slot. Every unit state change
 * goes through {@link SessionRepository#compute} and is never allowed to overwrite
 * a terminal state or another owner's fresh claim.
 *
 * <p>Circuit breakers are kept per engine instance and shared across its runs.
 */
public final class ExecutionEngine {
    private static final AtomicLong THREAD_SEQ = new AtomicLong();
    private static final long DRAIN_GRACE_MS = 2_000L;

    private final SessionRepository repository;
    private final HandlerRegistry handlers;
    private final AuditLogger auditLogger;
    private final LongSupplier clock;
    private final Map<RunOptions.CircuitBreakerSettings, CircuitBreakerRegistry> breakerRegistries = new ConcurrentHashMap<>();
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();

    public ExecutionEngine(DurableStore store, HandlerRegistry handlers) {
        this(store, handlers, null, System::currentTimeMillis);
    }

    public ExecutionEngine(DurableStore store, HandlerRegistry handlers, AuditLogger auditLogger, LongSupplier clock) {
        if (handlers == null) {
            throw new IllegalArgumentException("handler registry cannot be null");
        }
        this.repository = new SessionRepository(store);
        this.handlers = handlers;
        this.auditLogger = auditLogger;
        this.clock = clock == null ? System::currentTimeMillis : clock;
    }

    public void addListener(ProgressListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ProgressListener listener) {
        listeners.remove(listener);
    }

    public SessionRepository repository() {
        return repository;
    }

    public CircuitBreakerRegistry circuitBreakers(RunOptions.CircuitBreakerSettings settings) {
        return breakerRegistries.computeIfAbsent(settings,
                s -> new CircuitBreakerRegistry(s.failureThreshold(), s.resetTimeoutMs(), clock));
    }

    public RunReport run(Collection<WorkUnit> units, RunOptions options) {
        return run("ses_" + UUID.randomUUID(), units, options, null);
    }

    /**
     * Starts a new session, or resumes it when {@code sessionId} already exists.
     */
    public RunReport run(String sessionId, Collection<WorkUnit> units, RunOptions options) {
        return run(sessionId, units, options, null);
    }

    public RunReport run(String sessionId, Collection<WorkUnit> units, RunOptions options, CancellationToken cancellation) {
        return new Run(sessionId, units, options, cancellation, false).execute();
    }

    /**
     * Resumes an existing session: succeeded units are kept, everything else runs again.
     *
     * @throws IllegalArgumentException when the session does not exist
     */
    public RunReport resume(String sessionId, Collection<WorkUnit> units, RunOptions options) {
        return resume(sessionId, units, options, null);
    }

    public RunReport resume(String sessionId, Collection<WorkUnit> units, RunOptions options, CancellationToken cancellation) {
        return new Run(sessionId, units, options, cancellation, true).execute();
    }

    static FailureKind classify(Throwable error) {
        if (error instanceof StageMeshException sme) {
            return sme.kind();
        }
        if (error instanceof IllegalArgumentException
                || error instanceof IllegalStateException
                || error instanceof NullPointerException) {
            return FailureKind.VALIDATION;
        }
        return FailureKind.TRANSIENT;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }

    private static ExecutorService daemonPool(String prefix, int size) {
        return size > 0
                ? Executors.newFixedThreadPool(size, r -> daemonThread(r, prefix))
                : Executors.newCachedThreadPool(r -> daemonThread(r, prefix));
    }

    private static Thread daemonThread(Runnable runnable, String prefix) {
        Thread thread = new Thread(runnable, prefix + THREAD_SEQ.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }

    private enum ClaimOutcome {
        CLAIMED,
        ADOPTED,
        FOREIGN
    }

    private record Change(String unitId, ExecutionState next, ProgressEvent event) {
    }

    private record Abort(FailureKind kind, String message, StageMeshException cause) {
    }

    private record AttemptOutcome(boolean success, boolean cancelled, String output, FailureKind kind, String error) {
        static AttemptOutcome ok(String output) {
            return new AttemptOutcome(true, false, output, null, null);
        }

        static AttemptOutcome failed(FailureKind kind, String error) {
            return new AttemptOutcome(false, false, null, kind, error);
        }

        static AttemptOutcome cancelledRun() {
            return new AttemptOutcome(false, true, null, null, null);
        }
    }

    private final class Run {
        private final String sessionId;
        private final DependencyGraph graph;
        private final RunOptions options;
        private final boolean resumeOnly;
        private final SessionRepository repo;
        private final CancellationToken callerToken;
        private final CancellationToken runToken;
        private final String traceId = TraceContextUtil.newTraceId();
        private final String ownerToken = "own_" + UUID.randomUUID();
        private final RetryPolicy retryPolicy;
        private final CircuitBreakerRegistry breakers;
        private final Map<String, ExecutionState> view = new ConcurrentHashMap<>();
        private final Set<String> criticalFailures = ConcurrentHashMap.newKeySet();
        private final AtomicInteger executed = new AtomicInteger();
        private final long startedNanos = System.nanoTime();
        private final long deadlineNanos;
        private Abort abort;
        private List<String> timedOutPending = List.of();
        private ExecutorService dispatcher;
        private ExecutorService operations;

        Run(String sessionId, Collection<WorkUnit> units, RunOptions options, CancellationToken cancellation, boolean resumeOnly) {
            if (sessionId == null || sessionId.isBlank()) {
                throw new IllegalArgumentException("sessionId cannot be empty");
            }
            this.options = options == null ? RunOptions.defaults() : options;
            this.graph = DependencyGraph.build(units);
            for (String required : this.options.requiredUnitIds()) {
                if (!graph.contains(required)) {
                    throw new IllegalArgumentException("Unknown required unit: " + required);
                }
            }
            this.sessionId = sessionId.trim();
            this.resumeOnly = resumeOnly;
            this.repo = repository.withLockSettings(this.options.lock().ttlMs(), this.options.lock().waitMs());
            this.callerToken = cancellation;
            this.runToken = cancellation == null ? CancellationToken.create() : cancellation.child();
            RunOptions.RetrySettings retry = this.options.retry();
            this.retryPolicy = new RetryPolicy(retry.maxAttempts(), retry.baseDelayMs(), retry.maxDelayMs(), retry.jitterRatio());
            this.breakers = circuitBreakers(this.options.circuitBreaker());
            this.deadlineNanos = this.options.wholeRunTimeoutMs() > 0L
                    ? startedNanos + TimeUnit.MILLISECONDS.toNanos(this.options.wholeRunTimeoutMs())
                    : 0L;
        }

        RunReport execute() {
            try {
                Session started = startSession();
                view.putAll(started.unitStates());
                ProgressEvent opening = started.lastEvent();
                boolean resumed = opening != null && opening.type() == ProgressEventType.SESSION_RESUMED;
                if (opening != null) {
                    publish(List.of(opening));
                }
                audit("run.start", resumed ? "resumed" : "started", null,
                        Map.of("units", graph.size(), "waves", graph.waves().size()));
                if (allSucceeded()) {
                    return finish();
                }
                return runWaves();
            } finally {
                if (callerToken != null) {
                    callerToken.detach(runToken);
                }
            }
        }

        private RunReport runWaves() {
            dispatcher = daemonPool("stagemesh-dispatch-", options.globalConcurrency());
            operations = daemonPool("stagemesh-op-", 0);
            try {
                for (List<String> wave : graph.waves()) {
                    if (abortState() != null) {
                        break;
                    }
                    if (deadlineExpired()) {
                        onRunTimeout();
                        break;
                    }
                    List<Future<?>> futures = new ArrayList<>();
                    for (String id : prepareWave(wave)) {
                        futures.add(dispatcher.submit(() -> runUnit(id)));
                    }
                    awaitWave(futures);
                }
            } finally {
                dispatcher.shutdownNow();
                operations.shutdownNow();
            }
            return finish();
        }

        private Session startSession() {
            long now = clock.getAsLong();
            return repo.compute(sessionId, current -> {
                if (current.isEmpty()) {
                    if (resumeOnly) {
                        throw new IllegalArgumentException("Session not found: " + sessionId);
                    }
                    Map<String, ExecutionState> states = new LinkedHashMap<>();
                    for (String id : graph.topologicalOrder()) {
                        states.put(id, ExecutionState.initial(!graph.dependenciesOf(id).isEmpty()));
                    }
                    return Session.create(sessionId, states, traceId, now)
                            .withOverallStatus(SessionStatus.RUNNING, null, now)
                            .appendEvent(ProgressEvent.session(ProgressEventType.SESSION_STARTED, now,
                                    "started with " + graph.size() + " unit(s)"));
                }
                Session existing = current.get();
                for (String id : existing.unitStates().keySet()) {
                    if (!graph.contains(id)) {
                        throw new IllegalArgumentException("Session " + sessionId + " has unit not in plan: " + id);
                    }
                }
                Map<String, ExecutionState> states = new LinkedHashMap<>();
                int kept = 0;
                for (String id : graph.topologicalOrder()) {
                    boolean hasDeps = !graph.dependenciesOf(id).isEmpty();
                    ExecutionState prev = existing.unitState(id);
                    if (prev == null) {
                        states.put(id, ExecutionState.initial(hasDeps));
                    } else if (prev.status() == UnitStatus.SUCCEEDED || isForeignClaim(prev, now)) {
                        states.put(id, prev);
                        kept++;
                    } else {
                        states.put(id, prev.resetForResume(hasDeps));
                    }
                }
                return existing.withUnitStates(states, now)
                        .withOverallStatus(SessionStatus.RUNNING, null, now)
                        .withTraceId(traceId)
                        .appendEvent(ProgressEvent.session(ProgressEventType.SESSION_RESUMED, now,
                                "resumed, kept " + kept + " of " + graph.size() + " unit(s)"));
            });
        }

        private boolean allSucceeded() {
            for (ExecutionState state : view.values()) {
                if (state.status() != UnitStatus.SUCCEEDED) {
                    return false;
                }
            }
            return true;
        }

        // Marks the wave's runnable units READY and skips those with an unsatisfied dependency.
        private List<String> prepareWave(List<String> wave) {
            long now = clock.getAsLong();
            List<Change> changes = new ArrayList<>();
            List<String> candidates = new ArrayList<>();
            for (String id : wave) {
                ExecutionState state = view.get(id);
                if (state.status().isTerminal() || state.status() == UnitStatus.RUNNING) {
                    if (state.status() == UnitStatus.RUNNING) {
                        candidates.add(id);
                    }
                    continue;
                }
                Optional<String> blocker = unsatisfiedDependency(id);
                if (blocker.isPresent()) {
                    FailureRecord reason = FailureRecord.of(FailureKind.DEPENDENCY_FAILED, id,
                            "dependency " + blocker.get() + " did not succeed", state.attemptCount());
                    changes.add(new Change(id, state.skipped(reason, now),
                            ProgressEvent.unit(id, state.status(), UnitStatus.SKIPPED, state.attemptCount(), now, reason.cause())));
                    continue;
                }
                changes.add(new Change(id, state.withStatus(UnitStatus.READY),
                        ProgressEvent.unit(id, state.status(), UnitStatus.READY, state.attemptCount(), now, "dependencies satisfied")));
                candidates.add(id);
            }
            record(changes);
            List<String> dispatch = new ArrayList<>();
            for (String id : candidates) {
                ExecutionState state = view.get(id);
                if (state.status() == UnitStatus.READY || state.status() == UnitStatus.RUNNING) {
                    dispatch.add(id);
                } else if (state.status() == UnitStatus.FAILED) {
                    afterFailure(id);
                }
            }
            return dispatch;
        }

        private Optional<String> unsatisfiedDependency(String id) {
            for (String dep : graph.dependenciesOf(id)) {
                ExecutionState state = view.get(dep);
                if (state == null || state.status() != UnitStatus.SUCCEEDED) {
                    return Optional.of(dep);
                }
            }
            return Optional.empty();
        }

        private void awaitWave(List<Future<?>> futures) {
            for (Future<?> future : futures) {
                try {
                    if (deadlineNanos == 0L) {
                        future.get();
                    } else {
                        long remaining = deadlineNanos - System.nanoTime();
                        if (remaining <= 0L) {
                            throw new TimeoutException();
                        }
                        future.get(remaining, TimeUnit.NANOSECONDS);
                    }
                } catch (TimeoutException e) {
                    onRunTimeout();
                    drain(futures);
                    return;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    requestAbort(FailureKind.CANCELLED, "run thread interrupted", null);
                    drain(futures);
                    return;
                } catch (ExecutionException e) {
                    onDispatchError(e.getCause());
                }
            }
        }

        // Gives cancelled dispatchers a bounded window to persist their final state.
        private void drain(List<Future<?>> futures) {
            long graceNanos = TimeUnit.MILLISECONDS.toNanos(options.lock().waitMs() + DRAIN_GRACE_MS);
            long until = System.nanoTime() + graceNanos;
            for (Future<?> future : futures) {
                long remaining = until - System.nanoTime();
                if (remaining <= 0L) {
                    return;
                }
                try {
                    future.get(remaining, TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    audit("run.drain", "timeout", null, Map.of("grace_ms", options.lock().waitMs() + DRAIN_GRACE_MS));
                    return;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (ExecutionException e) {
                    onDispatchError(e.getCause());
                }
            }
        }

        private void onDispatchError(Throwable cause) {
            audit("run.dispatch", "error", null, Map.of("error", describe(cause)));
            requestAbort(FailureKind.CANCELLED, "engine error: " + describe(cause), null);
        }

        private boolean deadlineExpired() {
            return deadlineNanos != 0L && System.nanoTime() >= deadlineNanos;
        }

        private void onRunTimeout() {
            List<String> pending = new ArrayList<>();
            for (String id : graph.topologicalOrder()) {
                if (!view.get(id).status().isTerminal()) {
                    pending.add(id);
                }
            }
            ParallelExecutionTimeoutException timeout = new ParallelExecutionTimeoutException(options.wholeRunTimeoutMs(), pending);
            synchronized (this) {
                if (abort == null) {
                    timedOutPending = List.copyOf(pending);
                }
            }
            requestAbort(FailureKind.RUN_TIMEOUT, timeout.getMessage(), timeout);
        }

        private synchronized Abort abortState() {
            if (abort == null && runToken.isCancelled()) {
                abort = new Abort(runToken.kind(), runToken.reason(), null);
            }
            return abort;
        }

        // First abort wins. A critical failure without failFast lets in-flight units finish.
        private void requestAbort(FailureKind kind, String message, StageMeshException cause) {
            Abort current;
            synchronized (this) {
                current = abortState();
                if (current == null) {
                    abort = new Abort(kind, message, cause);
                    current = abort;
                }
            }
            if (current.kind() != FailureKind.CRITICAL_FAILURE || options.failFast()) {
                runToken.cancel(current.kind(), current.message());
            }
        }

        private void runUnit(String id) {
            CancellationToken unitToken = runToken.child();
            try {
                if (unitToken.isCancelled()) {
                    skipNotStarted(List.of(id));
                    return;
                }
                ClaimOutcome claim = claim(id);
                while (claim == ClaimOutcome.FOREIGN) {
                    claim = awaitForeign(id, unitToken);
                    if (claim == null) {
                        return;
                    }
                }
                if (claim == ClaimOutcome.ADOPTED) {
                    if (view.get(id).status() == UnitStatus.FAILED) {
                        afterFailure(id);
                    }
                    return;
                }
                executeClaimed(id, unitToken);
            } catch (LockTimeoutException e) {
                requestAbort(FailureKind.LOCK_TIMEOUT, e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                requestAbort(FailureKind.CANCELLED, "dispatcher interrupted", null);
            } catch (RuntimeException e) {
                onDispatchError(e);
            } finally {
                runToken.detach(unitToken);
            }
        }

        private ClaimOutcome claim(String id) {
            long now = clock.getAsLong();
            ClaimOutcome[] outcome = {ClaimOutcome.CLAIMED};
            long[] seqBefore = {0L};
            Session session = repo.update(sessionId, current -> {
                seqBefore[0] = current.eventSeq();
                ExecutionState state = current.unitState(id);
                if (state.status().isTerminal()) {
                    outcome[0] = ClaimOutcome.ADOPTED;
                    return current;
                }
                if (isForeignClaim(state, now)) {
                    outcome[0] = ClaimOutcome.FOREIGN;
                    return current;
                }
                outcome[0] = ClaimOutcome.CLAIMED;
                String message = state.status() == UnitStatus.RUNNING && state.ownerToken() != null
                        ? "reclaimed stale claim of " + state.ownerToken()
                        : "claimed";
                return current.withUnitState(id, state.claimed(ownerToken, now), now)
                        .appendEvent(ProgressEvent.unit(id, state.status(), UnitStatus.RUNNING, state.attemptCount(), now, message));
            });
            view.put(id, session.unitState(id));
            publish(session.eventsSince(seqBefore[0]));
            return outcome[0];
        }

        // Polls until the foreign owner finishes (ADOPTED), abandons its claim (CLAIMED), or this run is cancelled (null).
        private ClaimOutcome awaitForeign(String id, CancellationToken unitToken) throws InterruptedException {
            while (true) {
                if (unitToken.await(options.foreignPollMs())) {
                    return null;
                }
                Optional<Session> latest = repo.load(sessionId);
                if (latest.isEmpty()) {
                    throw new IllegalStateException("Session disappeared: " + sessionId);
                }
                ExecutionState state = latest.get().unitState(id);
                view.put(id, state);
                if (state.status().isTerminal()) {
                    return ClaimOutcome.ADOPTED;
                }
                if (!isForeignClaim(state, clock.getAsLong())) {
                    return claim(id);
                }
            }
        }

        private boolean isForeignClaim(ExecutionState state, long now) {
            return state != null
                    && state.status() == UnitStatus.RUNNING
                    && state.ownerToken() != null
                    && !state.ownerToken().equals(ownerToken)
                    && now - state.startedAtMs() < options.staleClaimMs();
        }

        private void executeClaimed(String id, CancellationToken unitToken) throws InterruptedException {
            WorkUnit unit = graph.unit(id);
            executed.incrementAndGet();
            Optional<UnitHandler> handler = handlers.findByKind(unit.kind());
            CircuitBreaker breaker = breakers.forKind(unit.kind());
            long timeoutMs = unit.timeoutOverrideMs() != null ? unit.timeoutOverrideMs() : options.perUnitTimeoutMs();
            int baseAttempts = view.get(id).attemptCount();
            int runAttempts = 0;
            while (true) {
                if (unitToken.isCancelled()) {
                    finishCancelled(id, unitToken, baseAttempts + runAttempts);
                    return;
                }
                runAttempts++;
                int attempt = baseAttempts + runAttempts;
                if (handler.isEmpty()) {
                    finishFailed(id, FailureRecord.of(FailureKind.VALIDATION, id,
                            "No handler registered for kind: " + unit.kind(), attempt));
                    return;
                }
                try {
                    breaker.acquire();
                } catch (CircuitOpenException e) {
                    finishFailed(id, FailureRecord.of(FailureKind.CIRCUIT_OPEN, id, e.getMessage(), attempt));
                    return;
                }
                AttemptOutcome outcome = invoke(unit, handler.get(), attempt, unitToken, timeoutMs);
                if (outcome.cancelled()) {
                    breaker.release();
                    finishCancelled(id, unitToken, attempt);
                    return;
                }
                if (outcome.success()) {
                    breaker.recordSuccess();
                    finishSucceeded(id, attempt, outcome.output());
                    return;
                }
                breaker.recordFailure();
                FailureRecord failure = FailureRecord.of(outcome.kind(), id, outcome.error(), attempt);
                RetryDecision decision = retryPolicy.decide(runAttempts, outcome.kind());
                if (!decision.retry()) {
                    finishFailed(id, failure);
                    return;
                }
                long now = clock.getAsLong();
                ExecutionState state = view.get(id);
                record(List.of(new Change(id, state.attempted(attempt, failure),
                        ProgressEvent.retry(id, attempt, now,
                                "retry in " + decision.delayMs() + "ms after " + failure.kind() + ": " + failure.cause()))));
                if (unitToken.await(decision.delayMs())) {
                    finishCancelled(id, unitToken, attempt);
                    return;
                }
            }
        }

        private AttemptOutcome invoke(WorkUnit unit, UnitHandler handler, int attempt, CancellationToken unitToken, long timeoutMs) {
            CancellationToken attemptToken = unitToken.child();
            String spanId = TraceContextUtil.newSpanId();
            UnitContext context = new UnitContext(sessionId, unit.id(), attempt, attemptToken, traceId, spanId,
                    TraceContextUtil.toTraceParent(traceId, spanId));
            Future<UnitResult> call = operations.submit(() -> handler.execute(unit, context));
            attemptToken.onCancel(() -> call.cancel(true));
            try {
                UnitResult result = timeoutMs > 0L ? call.get(timeoutMs, TimeUnit.MILLISECONDS) : call.get();
                if (result == null) {
                    return AttemptOutcome.failed(FailureKind.VALIDATION, "handler returned no result");
                }
                if (result.success()) {
                    return AttemptOutcome.ok(result.output());
                }
                if (unitToken.isCancelled()) {
                    return AttemptOutcome.cancelledRun();
                }
                return AttemptOutcome.failed(result.failureKind(), result.error());
            } catch (TimeoutException e) {
                StageTimeoutException timeout = new StageTimeoutException(unit.id(), timeoutMs);
                attemptToken.cancel(FailureKind.TIMEOUT, timeout.getMessage());
                if (unitToken.isCancelled()) {
                    return AttemptOutcome.cancelledRun();
                }
                return AttemptOutcome.failed(FailureKind.TIMEOUT, timeout.getMessage());
            } catch (CancellationException e) {
                if (unitToken.isCancelled()) {
                    return AttemptOutcome.cancelledRun();
                }
                return AttemptOutcome.failed(FailureKind.TIMEOUT, new StageTimeoutException(unit.id(), timeoutMs).getMessage());
            } catch (ExecutionException e) {
                if (unitToken.isCancelled()) {
                    return AttemptOutcome.cancelledRun();
                }
                Throwable cause = e.getCause() == null ? e : e.getCause();
                return AttemptOutcome.failed(classify(cause), describe(cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                call.cancel(true);
                return AttemptOutcome.cancelledRun();
            } finally {
                unitToken.detach(attemptToken);
            }
        }

        private void finishSucceeded(String id, int attempts, String output) {
            long now = clock.getAsLong();
            ExecutionState state = view.get(id);
            record(List.of(new Change(id, state.succeeded(attempts, output, now),
                    ProgressEvent.unit(id, state.status(), UnitStatus.SUCCEEDED, attempts, now, "succeeded"))));
        }

        private void finishFailed(String id, FailureRecord failure) {
            long now = clock.getAsLong();
            ExecutionState state = view.get(id);
            record(List.of(new Change(id, state.failed(failure.attempts(), failure, now),
                    ProgressEvent.unit(id, state.status(), UnitStatus.FAILED, failure.attempts(), now,
                            failure.kind() + ": " + failure.cause()))));
            if (view.get(id).status() == UnitStatus.FAILED) {
                afterFailure(id);
            }
        }

        private void finishCancelled(String id, CancellationToken token, int attempts) {
            FailureKind kind = token.kind() == null || token.kind() == FailureKind.CRITICAL_FAILURE
                    ? FailureKind.CANCELLED
                    : token.kind();
            finishFailed(id, FailureRecord.of(kind, id, "cancelled: " + token.reason(), attempts));
        }

        private void afterFailure(String id) {
            long now = clock.getAsLong();
            List<Change> cascade = new ArrayList<>();
            for (String dependent : graph.affectedBy(id)) {
                ExecutionState state = view.get(dependent);
                if (state.status().isTerminal()) {
                    continue;
                }
                FailureRecord reason = FailureRecord.of(FailureKind.DEPENDENCY_FAILED, dependent,
                        "dependency " + id + " failed", state.attemptCount());
                cascade.add(new Change(dependent, state.skipped(reason, now),
                        ProgressEvent.unit(dependent, state.status(), UnitStatus.SKIPPED, state.attemptCount(), now, reason.cause())));
            }
            record(cascade);
            if (options.requiredUnitIds().contains(id)) {
                criticalFailures.add(id);
                CriticalStageFailureException critical = new CriticalStageFailureException(List.of(id));
                requestAbort(FailureKind.CRITICAL_FAILURE, critical.getMessage(), critical);
            }
        }

        private void skipNotStarted(Collection<String> ids) {
            Abort current = abortState();
            FailureKind kind = current == null ? FailureKind.CANCELLED : current.kind();
            String message = current == null ? "run ended before unit started" : "not started: " + current.message();
            long now = clock.getAsLong();
            List<Change> changes = new ArrayList<>();
            for (String id : ids) {
                ExecutionState state = view.get(id);
                if (state.status().isTerminal()) {
                    continue;
                }
                FailureRecord reason = FailureRecord.of(kind, id, message, state.attemptCount());
                changes.add(new Change(id, state.skipped(reason, now),
                        ProgressEvent.unit(id, state.status(), UnitStatus.SKIPPED, state.attemptCount(), now, message)));
            }
            record(changes);
        }

        /**
         * Persists changes in one critical section. A change is dropped when the
         * stored state is terminal or freshly claimed by another owner; the local
         * view then takes the stored state.
         */
        private void record(List<Change> changes) {
            if (changes.isEmpty()) {
                return;
            }
            long now = clock.getAsLong();
            long[] seqBefore = {0L};
            Session session;
            try {
                session = repo.update(sessionId, current -> {
                    seqBefore[0] = current.eventSeq();
                    Session next = current;
                    for (Change change : changes) {
                        ExecutionState stored = next.unitState(change.unitId());
                        if (stored != null && (stored.status().isTerminal() || isForeignClaim(stored, now))) {
                            continue;
                        }
                        next = next.withUnitState(change.unitId(), change.next(), now).appendEvent(change.event());
                    }
                    return next;
                });
            } catch (LockTimeoutException e) {
                requestAbort(FailureKind.LOCK_TIMEOUT, e.getMessage(), e);
                for (Change change : changes) {
                    view.computeIfPresent(change.unitId(),
                            (k, v) -> v.status().isTerminal() ? v : change.next());
                }
                audit("session.persist", "lock_timeout", null, Map.of("units", changes.size(), "error", e.getMessage()));
                return;
            }
            for (Change change : changes) {
                view.put(change.unitId(), session.unitState(change.unitId()));
            }
            publish(session.eventsSince(seqBefore[0]));
        }

        private RunReport finish() {
            List<String> remaining = new ArrayList<>();
            for (String id : graph.topologicalOrder()) {
                if (!view.get(id).status().isTerminal()) {
                    remaining.add(id);
                }
            }
            skipNotStarted(remaining);

            int total = graph.size();
            int succeeded = 0;
            List<String> failedIds = new ArrayList<>();
            for (String id : graph.topologicalOrder()) {
                UnitStatus status = view.get(id).status();
                if (status == UnitStatus.SUCCEEDED) {
                    succeeded++;
                } else if (status == UnitStatus.FAILED) {
                    failedIds.add(id);
                }
            }

            SessionStatus status;
            RunFailure failure;
            Abort current = abortState();
            if (current != null) {
                switch (current.kind()) {
                    case RUN_TIMEOUT -> {
                        status = SessionStatus.FAILED;
                        failure = RunFailure.from(new ParallelExecutionTimeoutException(options.wholeRunTimeoutMs(), timedOutPending));
                    }
                    case CRITICAL_FAILURE -> {
                        status = SessionStatus.FAILED;
                        failure = RunFailure.from(new CriticalStageFailureException(List.copyOf(new TreeSet<>(criticalFailures))));
                    }
                    case LOCK_TIMEOUT -> {
                        status = SessionStatus.ABORTED;
                        failure = current.cause() != null
                                ? RunFailure.from(current.cause())
                                : new RunFailure(FailureKind.LOCK_TIMEOUT, current.message(), List.of(), 0L, 0, 0, 0.0);
                    }
                    default -> {
                        status = SessionStatus.ABORTED;
                        failure = RunFailure.cancelled(current.message());
                    }
                }
            } else if (succeeded == total) {
                status = SessionStatus.COMPLETED;
                failure = null;
            } else if (options.allowPartialResults() && (double) succeeded / total >= options.minSuccessRatio()) {
                status = SessionStatus.PARTIAL;
                failure = null;
            } else if (options.allowPartialResults()) {
                status = SessionStatus.FAILED;
                failure = RunFailure.from(new InsufficientPartialResultsException(succeeded, total, options.minSuccessRatio()));
            } else {
                status = SessionStatus.FAILED;
                failure = new RunFailure(FailureKind.EXECUTION,
                        (total - succeeded) + " of " + total + " unit(s) did not succeed; failed: " + failedIds,
                        failedIds, 0L, succeeded, total, options.minSuccessRatio());
            }

            long now = clock.getAsLong();
            SessionStatus finalStatus = status;
            RunFailure finalFailure = failure;
            try {
                long[] seqBefore = {0L};
                Session session = repo.update(sessionId, current2 -> {
                    seqBefore[0] = current2.eventSeq();
                    return current2.withOverallStatus(finalStatus, finalFailure, now)
                            .appendEvent(ProgressEvent.session(ProgressEventType.SESSION_FINISHED, now,
                                    finalStatus.name().toLowerCase()));
                });
                publish(session.eventsSince(seqBefore[0]));
            } catch (LockTimeoutException e) {
                audit("run.finish", "persist_failed", null, Map.of("status", finalStatus.name(), "error", e.getMessage()));
                if (current == null || current.kind() != FailureKind.LOCK_TIMEOUT) {
                    status = SessionStatus.ABORTED;
                    failure = RunFailure.from(e);
                }
            }
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
            RunReport report = RunReports.build(sessionId, status, Map.copyOf(view), graph.topologicalOrder(),
                    failure, graph, traceId, executed.get(), durationMs);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("status", status.name());
            details.put("succeeded", report.statistics().succeeded());
            details.put("failed", report.statistics().failed());
            details.put("skipped", report.statistics().skipped());
            details.put("executed", executed.get());
            details.put("duration_ms", durationMs);
            if (failure != null) {
                details.put("run_failure", failure.kind().name());
            }
            audit("run.finish", status.name().toLowerCase(), null, details);
            return report;
        }

        private void publish(List<ProgressEvent> events) {
            for (ProgressEvent event : events) {
                if (event.unitId() != null) {
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("seq", event.seq());
                    details.put("type", event.type().name());
                    details.put("from", event.fromStatus() == null ? null : event.fromStatus().name());
                    details.put("to", event.toStatus() == null ? null : event.toStatus().name());
                    details.put("attempt", event.attempt());
                    details.put("message", event.message());
                    audit(event.type() == ProgressEventType.UNIT_RETRY ? "unit.retry" : "unit.transition",
                            event.toStatus() == null ? "" : event.toStatus().name().toLowerCase(), event.unitId(), details);
                }
                for (ProgressListener listener : listeners) {
                    try {
                        listener.onEvent(event);
                    } catch (RuntimeException e) {
                        audit("listener.error", "error", event.unitId(), Map.of("seq", event.seq(), "error", describe(e)));
                    }
                }
            }
        }

        private void audit(String action, String result, String unitId, Map<String, Object> details) {
            if (auditLogger == null) {
                return;
            }
            auditLogger.log(AuditLogger.AuditEvent.of(
                    action,
                    "engine",
                    "session/" + sessionId,
                    result,
                    traceId,
                    null,
                    sessionId,
                    unitId,
                    details
            ));
        }
    }
}
