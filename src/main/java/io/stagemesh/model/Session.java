package io.stagemesh.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted run state. Instances are immutable; every mutation returns a copy
 * with {@code updatedAtMs}, statistics and the event log brought forward.
 */
public record Session(
        String sessionId,
        long createdAtMs,
        long updatedAtMs,
        SessionStatus overallStatus,
        Map<String, ExecutionState> unitStates,
        SessionStatistics statistics,
        long eventSeq,
        List<ProgressEvent> events,
        RunFailure runFailure,
        String traceId
) {
    public static final int MAX_RETAINED_EVENTS = 5_000;

    public Session {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be empty");
        }
        overallStatus = overallStatus == null ? SessionStatus.PENDING : overallStatus;
        unitStates = unitStates == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(unitStates));
        statistics = statistics == null ? SessionStatistics.of(unitStates) : statistics;
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static Session create(String sessionId, Map<String, ExecutionState> unitStates, String traceId, long nowMs) {
        return new Session(sessionId, nowMs, nowMs, SessionStatus.PENDING, unitStates,
                SessionStatistics.of(unitStates), 0L, List.of(), null, traceId);
    }

    public ExecutionState unitState(String unitId) {
        return unitStates.get(unitId);
    }

    public Session withUnitState(String unitId, ExecutionState state, long nowMs) {
        Map<String, ExecutionState> next = new LinkedHashMap<>(unitStates);
        next.put(unitId, state);
        return new Session(sessionId, createdAtMs, nowMs, overallStatus, next,
                SessionStatistics.of(next), eventSeq, events, runFailure, traceId);
    }

    public Session withUnitStates(Map<String, ExecutionState> states, long nowMs) {
        return new Session(sessionId, createdAtMs, nowMs, overallStatus, states,
                SessionStatistics.of(states), eventSeq, events, runFailure, traceId);
    }

    public Session withOverallStatus(SessionStatus status, RunFailure failure, long nowMs) {
        return new Session(sessionId, createdAtMs, nowMs, status, unitStates, statistics, eventSeq, events, failure, traceId);
    }

    public Session withTraceId(String value) {
        return new Session(sessionId, createdAtMs, updatedAtMs, overallStatus, unitStates, statistics, eventSeq, events, runFailure, value);
    }

    public Session appendEvent(ProgressEvent event) {
        long seq = eventSeq + 1L;
        List<ProgressEvent> next = new ArrayList<>(events.size() + 1);
        int from = Math.max(0, events.size() + 1 - MAX_RETAINED_EVENTS);
        next.addAll(events.subList(Math.min(from, events.size()), events.size()));
        next.add(event.sequenced(seq, sessionId));
        return new Session(sessionId, createdAtMs, updatedAtMs, overallStatus, unitStates, statistics, seq, next, runFailure, traceId);
    }

    public ProgressEvent lastEvent() {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    /**
     * Events with a sequence number strictly greater than {@code seq}, oldest first.
     */
    public List<ProgressEvent> eventsSince(long seq) {
        List<ProgressEvent> out = new ArrayList<>();
        for (ProgressEvent event : events) {
            if (event.seq() > seq) {
                out.add(event);
            }
        }
        return out;
    }
}
