package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mass.simulator.device.DeviceSnapshot;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.ProtocolFunction;

import java.util.List;

/**
 * Reports identity, telemetry, network profile, meters and schedules of the unit. Pushed on
 * every broker connect and answered on request.
 */
public class IdentificationHandler extends AbstractFunctionHandler {

    public IdentificationHandler(HandlerContext context) {
        super(context);
    }

    @Override
    public ProtocolFunction handles() {
        return ProtocolFunction.IDENTIFICATION;
    }

    @Override
    public List<Envelope> handle(DeviceState state, Envelope request) {
        DeviceSnapshot snapshot = state.getSnapshot();

        ObjectNode body = newObject();
        body.put("registered", snapshot.getTelemetry().isRegistered());
        body.put("flag", snapshot.getIdentity().getFlag());
        body.put("serialNumber", snapshot.getIdentity().getSerialNumber());
        body.put("brand", snapshot.getIdentity().getBrand());
        body.put("model", snapshot.getIdentity().getModel());
        body.put("protocolVersion", snapshot.getIdentity().getProtocolVersion());
        body.put("manufactureDate", snapshot.getIdentity().getManufactureDate());
        body.put("firmware", snapshot.getIdentity().getFirmwareVersion());
        body.put("signal", snapshot.getTelemetry().getSignal());
        body.put("cpuTemp", snapshot.getTelemetry().getCpuTemp());
        body.put("deviceDate", snapshot.getDeviceDate());
        body.setAll(context.getProfile().getProfile());
        body.set("meters", context.getMapper().valueToTree(snapshot.getMeters()));
        body.set("schedules", context.getMapper().valueToTree(snapshot.getSchedules()));
        return single(request, body);
    }
}
