package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.device.MeterDescriptor;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;
import com.mass.simulator.unit.sample.Readout;
import com.mass.simulator.unit.sample.ReadoutSampleGenerator;

import java.time.LocalDateTime;
import java.util.List;

import static com.google.common.collect.Lists.newArrayList;

/**
 * Meter readout. Supports full readout, short readout and a list of obis codes.
 */
public class ReadHandler extends AbstractFunctionHandler {

    public ReadHandler(HandlerContext context) {
        super(context);
    }

    @Override
    public ProtocolFunction handles() {
        return ProtocolFunction.READ;
    }

    @Override
    public List<Envelope> handle(DeviceState state, Envelope request) throws ValidationException {
        ObjectNode body = requestBody(request);
        String directive = requireText(body, "directive");
        ReadoutSampleGenerator readouts = context.getReadouts();
        if (!readouts.supports(directive)) {
            throw new ValidationException(FailCode.UNSUPPORTED_DIRECTIVE, "directive " + directive + " is not supported");
        }

        List<String> obisCodes = newArrayList();
        if (ReadoutSampleGenerator.OBIS_READOUT.equals(directive)) {
            obisCodes = obisCodes(body);
        }
        MeterDescriptor meter = optionalMeter(state, body, "meterSerialNumber");

        LocalDateTime now = state.getDeviceTime();
        Readout readout = readouts.generate(directive, obisCodes, meter, now);

        ObjectNode response = newObject();
        response.put("readDate", format(now));
        response.put("directive", directive);
        if (meter != null) {
            response.put("meterSerialNumber", meter.getSerialNumber());
        }
        ObjectNode data = response.putObject("data");
        data.put("id", readout.getId());
        data.put("rawData", readout.getRawData());
        return single(request, response);
    }

    private static List<String> obisCodes(ObjectNode body) throws ValidationException {
        JsonNode codes = body.path("parameters").path("obisCodes");
        if (codes.isMissingNode() || codes.isNull()) {
            throw new ValidationException(FailCode.MISSING_PARAMETER, "parameters.obisCodes is required for the obis directive");
        }
        if (!codes.isArray() || codes.size() == 0) {
            throw new ValidationException(FailCode.INVALID_PARAMETER, "parameters.obisCodes must be a non-empty array");
        }
        List<String> result = newArrayList();
        for (JsonNode code : codes) {
            if (!code.isTextual() || code.asText().trim().isEmpty()) {
                throw new ValidationException(FailCode.INVALID_PARAMETER, "parameters.obisCodes must contain obis code strings");
            }
            result.add(code.asText());
        }
        return result;
    }
}
