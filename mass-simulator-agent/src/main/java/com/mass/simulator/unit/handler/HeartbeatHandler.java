package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.device.Telemetry;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.ProtocolFunction;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Liveness report with current signal strength, device clock and cpu temperature.
 */
public class HeartbeatHandler extends AbstractFunctionHandler {

    public HeartbeatHandler(HandlerContext context) {
        super(context);
    }

    @Override
    public ProtocolFunction handles() {
        return ProtocolFunction.HEARTBEAT;
    }

    @Override
    public List<Envelope> handle(DeviceState state, Envelope request) {
        Telemetry telemetry;
        LocalDateTime now;
        synchronized (state) {
            telemetry = state.getTelemetry();
            now = state.getDeviceTime();
        }
        ObjectNode body = newObject();
        body.put("signal", telemetry.getSignal());
        body.put("deviceDate", format(now));
        body.put("cpuTemp", telemetry.getCpuTemp());
        return single(request, body);
    }
}
