package com.mass.simulator.protocol;

/**
 * Codes reported in the <code>failCode</code> field of a failure response.
 */
public enum FailCode {
    INVALID_REQUEST(100),
    MISSING_PARAMETER(101),
    INVALID_PARAMETER(102),
    UNSUPPORTED_OPERATION(103),
    UNSUPPORTED_DIRECTIVE(104),
    UNKNOWN_METER(105),
    UNKNOWN_RELAY(106),
    DUPLICATE_KEY(107),
    INTERNAL_ERROR(199);

    private final int code;

    FailCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
