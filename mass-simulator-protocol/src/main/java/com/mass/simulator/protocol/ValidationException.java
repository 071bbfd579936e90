package com.mass.simulator.protocol;

/**
 * A well framed request that cannot be honoured. The request is still acknowledged and the
 * failure is reported back with its code and description.
 */
public class ValidationException extends Exception {

    private final FailCode failCode;

    public ValidationException(FailCode failCode, String description) {
        super(description);
        this.failCode = failCode;
    }

    public FailCode getFailCode() {
        return failCode;
    }
}
