package org.javai.recovery.ledger;

import org.javai.recovery.FailureContext;
import org.javai.recovery.IncidentId;
import org.javai.recovery.RecoverySettings;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded, append-only history of failure incidents.
 *
 * <p>The ledger owns every recorded {@link FailureContext}; incidents refer to
 * their predecessors by {@link IncidentId} and are resolved here. When the
 * capacity is exceeded the oldest incidents are evicted first.
 *
 * <p>Appends are serialized behind a write lock; reads share a read lock and
 * always observe a consistent state, so eviction never races with an append.
 */
public final class IncidentLedger {

    private final int capacity;
    private final Duration recentWindow;
    private final int recentLimit;
    private final Clock clock;
    private final Deque<FailureContext> incidents = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public IncidentLedger() {
        this(RecoverySettings.defaults());
    }

    public IncidentLedger(int capacity) {
        this(RecoverySettings.defaults().withLedgerCapacity(capacity));
    }

    public IncidentLedger(RecoverySettings settings) {
        this(settings, Clock.systemUTC());
    }

    public IncidentLedger(RecoverySettings settings, Clock clock) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.capacity = settings.ledgerCapacity();
        this.recentWindow = settings.recentWindow();
        this.recentLimit = settings.recentLimit();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Records an incident at the tail, evicting from the head while over capacity.
     */
    public void append(FailureContext incident) {
        Objects.requireNonNull(incident, "incident must not be null");
        lock.writeLock().lock();
        try {
            incidents.addLast(incident);
            while (incidents.size() > capacity) {
                incidents.removeFirst();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Identifiers of the retained incidents for a tool and target, oldest first.
     */
    public List<IncidentId> lineage(String tool, String target) {
        return lineage(tool, target, Integer.MAX_VALUE);
    }

    /**
     * Identifiers of the latest {@code limit} retained incidents for a tool and target, oldest first.
     */
    public List<IncidentId> lineage(String tool, String target, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, was: " + limit);
        }
        lock.readLock().lock();
        try {
            Deque<IncidentId> ids = new ArrayDeque<>();
            Iterator<FailureContext> newestFirst = incidents.descendingIterator();
            while (newestFirst.hasNext() && ids.size() < limit) {
                FailureContext incident = newestFirst.next();
                if (incident.sameLineage(tool, target)) {
                    ids.addFirst(incident.id());
                }
            }
            return new ArrayList<>(ids);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<FailureContext> find(IncidentId id) {
        lock.readLock().lock();
        try {
            return incidents.stream().filter(incident -> incident.id().equals(id)).findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Resolves identifiers to the incidents still held, in the order given.
     * Identifiers of evicted incidents are skipped.
     */
    public List<FailureContext> resolve(Collection<IncidentId> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            Map<IncidentId, FailureContext> byId = new LinkedHashMap<>();
            for (FailureContext incident : incidents) {
                byId.put(incident.id(), incident);
            }
            List<FailureContext> resolved = new ArrayList<>();
            for (IncidentId id : ids) {
                FailureContext incident = byId.get(id);
                if (incident != null) {
                    resolved.add(incident);
                }
            }
            return resolved;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * A copy of all held incidents, oldest first.
     */
    public List<FailureContext> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(incidents);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return incidents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            incidents.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Computes statistics over the held incidents. Nothing is cached.
     */
    public LedgerStatistics statistics() {
        lock.readLock().lock();
        try {
            if (incidents.isEmpty()) {
                return LedgerStatistics.empty();
            }
            Instant now = clock.instant();
            Map<String, Long> byKind = new LinkedHashMap<>();
            Map<String, Long> byTool = new LinkedHashMap<>();
            List<RecentIncident> recent = new ArrayList<>();
            for (FailureContext incident : incidents) {
                byKind.merge(incident.errorKind().value(), 1L, Long::sum);
                byTool.merge(incident.toolName(), 1L, Long::sum);
                if (Duration.between(incident.occurredAt(), now).compareTo(recentWindow) < 0) {
                    recent.add(new RecentIncident(incident.toolName(), incident.errorKind(), incident.occurredAt()));
                }
            }
            List<RecentIncident> shown = recent.subList(Math.max(0, recent.size() - recentLimit), recent.size());
            return new LedgerStatistics(incidents.size(), byKind, byTool, recent.size(), shown);
        } finally {
            lock.readLock().unlock();
        }
    }
}
