package com.riskfactor.domain.model;

import com.riskfactor.domain.enums.ActivityLevel;
import java.time.Instant;

public record ActivityLogEntry(Instant timestamp, ActivityLevel level, String message) {}
