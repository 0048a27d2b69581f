package com.riskfactor.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Everything a status poll returns: tracker state, phase progress and the recent activity feed. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchStatusView {

    private BatchRunStatus run;
    private List<PhaseProgress> phases;
    private List<ActivityLogEntry> recentActivity;
}
