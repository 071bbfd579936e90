package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.ProtocolFunction;

import java.util.List;

/**
 * Soft reset: telemetry and device clock go back to their startup values.
 */
public class ResetHandler extends AbstractFunctionHandler {

    public ResetHandler(HandlerContext context) {
        super(context);
    }

    @Override
    public ProtocolFunction handles() {
        return ProtocolFunction.RESET;
    }

    @Override
    public List<Envelope> handle(DeviceState state, Envelope request) {
        state.resetTelemetry();
        ObjectNode response = newObject();
        response.put("type", "info");
        response.put("message", "Device reset");
        response.put("date", format(state.getDeviceTime()));
        return single(request, response);
    }
}
