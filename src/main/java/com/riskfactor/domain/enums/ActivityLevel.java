package com.riskfactor.domain.enums;

public enum ActivityLevel {
    INFO,
    WARNING,
    ERROR
}
