package com.mass.simulator.device;

import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.ValidationException;

/**
 * Raised when adding an entry whose key is already present. State is left unchanged.
 */
public class DuplicateKeyException extends ValidationException {

    public DuplicateKeyException(String description) {
        super(FailCode.DUPLICATE_KEY, description);
    }
}
