package com.riskfactor.domain.model;

import com.riskfactor.domain.enums.BatchPhase;
import com.riskfactor.domain.enums.PhaseStatus;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PhaseProgress {

    private BatchPhase phase;
    private PhaseStatus status;
    private int current;
    private int total;
    private Instant startedAt;
    private Instant completedAt;

    public Long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
