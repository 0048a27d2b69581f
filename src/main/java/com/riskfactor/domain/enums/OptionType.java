package com.riskfactor.domain.enums;

public enum OptionType {
    CALL,
    PUT
}
