package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.device.MeterDescriptor;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;

import java.util.List;

/**
 * Writes a register of an attached meter. The write always succeeds, nothing is stored.
 */
public class WriteHandler extends AbstractFunctionHandler {

    static final String OBIS_CODE = "obisCode";
    static final String REGISTER = "register";

    public WriteHandler(HandlerContext context) {
        super(context);
    }

    @Override
    public ProtocolFunction handles() {
        return ProtocolFunction.WRITE;
    }

    @Override
    public List<Envelope> handle(DeviceState state, Envelope request) throws ValidationException {
        ObjectNode body = requestBody(request);
        MeterDescriptor meter = requireMeter(state, body, "meterSerialNumber");
        String obisCode = optionalText(body, OBIS_CODE);
        if (obisCode == null) {
            obisCode = optionalText(body, REGISTER);
        }
        if (obisCode == null) {
            throw new ValidationException(FailCode.MISSING_PARAMETER, OBIS_CODE + " is required");
        }
        String value = requireText(body, "value");

        ObjectNode response = newObject();
        response.put("meterSerialNumber", meter.getSerialNumber());
        response.put("obisCode", obisCode);
        response.put("value", value);
        response.put("result", "success");
        response.put("date", format(state.getDeviceTime()));
        return single(request, response);
    }
}
