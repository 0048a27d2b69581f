package com.riskfactor.batch;

import com.riskfactor.config.BatchProperties;
import com.riskfactor.domain.enums.ActivityLevel;
import com.riskfactor.domain.enums.BatchPhase;
import com.riskfactor.domain.enums.PhaseStatus;
import com.riskfactor.domain.model.ActivityLogEntry;
import com.riskfactor.domain.model.PhaseProgress;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Phase progress and activity feed of the current (or most recent) batch run, for the status poll.
 *
 * <p>Kept apart from {@link BatchRunTracker} so that the tracker's state has no mutators besides
 * start and complete. Entries of a finished run remain readable until the next run resets the log.
 * The feed is bounded by {@code riskfactor.batch.full-activity-limit}; the oldest entries are
 * dropped first.
 */
@Component
public class BatchActivityLog {

    private final int fullActivityLimit;
    private final Clock clock;

    private final Deque<ActivityLogEntry> entries = new ArrayDeque<>();
    private final Map<BatchPhase, PhaseProgress> phases = new EnumMap<>(BatchPhase.class);
    private String runId;

    @Autowired
    public BatchActivityLog(BatchProperties batchProperties) {
        this(batchProperties.getFullActivityLimit(), Clock.systemUTC());
    }

    public BatchActivityLog(int fullActivityLimit, Clock clock) {
        this.fullActivityLimit = Math.max(1, fullActivityLimit);
        this.clock = clock;
    }

    public synchronized void reset(String runId, List<BatchPhase> runPhases, int totalPortfolios) {
        this.runId = runId;
        entries.clear();
        phases.clear();
        for (BatchPhase phase : runPhases) {
            phases.put(phase, PhaseProgress.builder()
                    .phase(phase)
                    .status(PhaseStatus.PENDING)
                    .total(totalPortfolios)
                    .build());
        }
    }

    public synchronized void phaseStarted(BatchPhase phase) {
        PhaseProgress progress = phases.get(phase);
        if (progress != null) {
            progress.setStatus(PhaseStatus.RUNNING);
            progress.setStartedAt(clock.instant());
        }
    }

    public synchronized void portfolioProcessed(BatchPhase phase) {
        PhaseProgress progress = phases.get(phase);
        if (progress != null) {
            progress.setCurrent(progress.getCurrent() + 1);
        }
    }

    public synchronized void phaseFinished(BatchPhase phase, PhaseStatus status) {
        PhaseProgress progress = phases.get(phase);
        if (progress != null) {
            progress.setStatus(status);
            progress.setCompletedAt(clock.instant());
        }
    }

    public void info(String message) {
        add(ActivityLevel.INFO, message);
    }

    public void warning(String message) {
        add(ActivityLevel.WARNING, message);
    }

    public void error(String message) {
        add(ActivityLevel.ERROR, message);
    }

    public synchronized String getRunId() {
        return runId;
    }

    /** Snapshot of phase progress in phase order. */
    public synchronized List<PhaseProgress> getPhaseProgress() {
        List<PhaseProgress> snapshot = new ArrayList<>();
        phases.values().forEach(p -> snapshot.add(p.toBuilder().build()));
        return snapshot;
    }

    /** The most recent {@code limit} entries, oldest first. */
    public synchronized List<ActivityLogEntry> getRecentEntries(int limit) {
        List<ActivityLogEntry> all = new ArrayList<>(entries);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    public synchronized List<ActivityLogEntry> getAllEntries() {
        return List.copyOf(entries);
    }

    private synchronized void add(ActivityLevel level, String message) {
        Instant now = clock.instant();
        entries.addLast(new ActivityLogEntry(now, level, message));
        while (entries.size() > fullActivityLimit) {
            entries.removeFirst();
        }
    }
}
