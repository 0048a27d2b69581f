package com.riskfactor.exception;

import java.util.Map;
import lombok.Getter;

/**
 * The return series accessor could not supply any series for a symbol the factor
 * computation requires. Fatal for one portfolio's factor computation only.
 */
@Getter
public class NoReturnDataAvailableException extends BaseException {

    private final String symbol;

    public NoReturnDataAvailableException(String symbol, String message) {
        super(ErrorCode.NO_RETURN_DATA, message, Map.of("symbol", symbol));
        this.symbol = symbol;
    }

    public NoReturnDataAvailableException(String symbol, String message, Throwable cause) {
        super(ErrorCode.NO_RETURN_DATA, message, Map.of("symbol", symbol), cause);
        this.symbol = symbol;
    }
}
