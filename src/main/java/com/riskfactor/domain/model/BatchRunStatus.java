package com.riskfactor.domain.model;

import com.riskfactor.domain.enums.BatchRunState;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Poll view of the run tracker. {@code success} is only set in the COMPLETED state;
 * every field except {@code state} is null while IDLE.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRunStatus {

    private BatchRunState state;
    private String runId;
    private LocalDate calculationDate;
    private String triggeredBy;
    private Instant startedAt;
    private Instant completedAt;
    private Long elapsedSeconds;
    private Boolean success;

    public static BatchRunStatus idle() {
        return BatchRunStatus.builder().state(BatchRunState.IDLE).build();
    }
}
