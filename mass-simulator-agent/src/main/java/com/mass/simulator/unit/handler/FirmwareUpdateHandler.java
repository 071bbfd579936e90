package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;

import java.util.List;

public class FirmwareUpdateHandler extends AbstractFunctionHandler {

    public FirmwareUpdateHandler(HandlerContext context) {
        super(context);
    }

    @Override
    public ProtocolFunction handles() {
        return ProtocolFunction.FIRMWARE_UPDATE;
    }

    @Override
    public List<Envelope> handle(DeviceState state, Envelope request) throws ValidationException {
        String version = requireText(requestBody(request), "version");
        String previous = state.updateFirmware(version);

        ObjectNode response = newObject();
        response.put("previousVersion", previous);
        response.put("version", version);
        response.put("result", "success");
        response.put("date", format(state.getDeviceTime()));
        return single(request, response);
    }
}
