package com.riskfactor.batch;

import com.riskfactor.domain.enums.BatchPhase;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One phase of the daily batch, executed once per portfolio.
 *
 * <p>Implementations are Spring beans; the orchestrator picks them up and runs them in
 * {@link BatchPhase#getOrder()} order. An exception thrown from {@link #execute} fails this
 * (portfolio, phase) unit only. Other calculation engines join the batch by implementing
 * this interface with a new {@link BatchPhase}.
 */
public interface BatchPhaseHandler {

    BatchPhase phase();

    /**
     * Runs the phase for one portfolio.
     *
     * @return a short summary for the run result and activity feed
     */
    String execute(UUID portfolioId, LocalDate calculationDate);
}
