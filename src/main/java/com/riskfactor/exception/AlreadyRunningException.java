package com.riskfactor.exception;

import java.util.Map;
import lombok.Getter;

/**
 * A batch run was requested while another one is active. Retryable once the active run
 * has finished.
 */
@Getter
public class AlreadyRunningException extends BaseException {

    private final String activeRunId;

    public AlreadyRunningException(String activeRunId) {
        super(
                ErrorCode.BATCH_ALREADY_RUNNING,
                "A batch run is already in progress: " + activeRunId,
                Map.of("activeRunId", activeRunId));
        this.activeRunId = activeRunId;
    }
}
