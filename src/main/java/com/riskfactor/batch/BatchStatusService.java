package com.riskfactor.batch;

import com.riskfactor.config.BatchProperties;
import com.riskfactor.domain.enums.BatchRunState;
import com.riskfactor.domain.model.ActivityLogEntry;
import com.riskfactor.domain.model.BatchRunStatus;
import com.riskfactor.domain.model.BatchStatusView;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Status polling interface for an API or admin layer. Recommended poll interval: 2-5 seconds.
 *
 * <p>Reads are lock-free on the tracker side; once a run has ended the state is COMPLETED or
 * IDLE, never RUNNING.
 */
@Service
public class BatchStatusService {

    private final BatchRunTracker batchRunTracker;
    private final BatchActivityLog batchActivityLog;
    private final BatchProperties batchProperties;

    public BatchStatusService(
            BatchRunTracker batchRunTracker, BatchActivityLog batchActivityLog, BatchProperties batchProperties) {
        this.batchRunTracker = batchRunTracker;
        this.batchActivityLog = batchActivityLog;
        this.batchProperties = batchProperties;
    }

    public BatchStatusView getStatus() {
        BatchRunStatus status = batchRunTracker.getStatus();
        if (status.getState() == BatchRunState.IDLE || !status.getRunId().equals(batchActivityLog.getRunId())) {
            return BatchStatusView.builder()
                    .run(status)
                    .phases(List.of())
                    .recentActivity(List.of())
                    .build();
        }
        return BatchStatusView.builder()
                .run(status)
                .phases(batchActivityLog.getPhaseProgress())
                .recentActivity(batchActivityLog.getRecentEntries(batchProperties.getRecentActivityLimit()))
                .build();
    }

    public List<ActivityLogEntry> getFullActivityLog() {
        return batchActivityLog.getAllEntries();
    }
}
