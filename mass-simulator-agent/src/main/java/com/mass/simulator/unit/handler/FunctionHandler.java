package com.mass.simulator.unit.handler;

import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;

import java.util.List;

/**
 * Handles one protocol function.
 */
public interface FunctionHandler {

    ProtocolFunction handles();

    /**
     * @return false when the function is only ever pushed by the device and a client may not request it
     */
    boolean acceptsPull();

    /**
     * Process a request. A request with a reference id is answered with correlated responses,
     * one without (heartbeat timer, http triggers) with pushes.
     *
     * @param state
     * @param request
     * @return messages to publish, in order
     * @throws ValidationException when the request cannot be honoured
     */
    List<Envelope> handle(DeviceState state, Envelope request) throws ValidationException;
}
