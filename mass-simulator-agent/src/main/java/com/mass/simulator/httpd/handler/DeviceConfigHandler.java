package com.mass.simulator.httpd.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.primitives.Ints;
import com.mass.simulator.device.DeviceSettingsUpdate;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.ValidationException;
import com.mass.simulator.unit.TriggerSurface;
import com.sun.net.httpserver.HttpExchange;

import java.util.List;
import java.util.Map;

/**
 * Telemetry update from query parameters <code>signal</code>, <code>cpu_temp</code> and
 * <code>registered</code>.
 */
public class DeviceConfigHandler extends AbstractJsonHandler {

    private final TriggerSurface triggers;

    public DeviceConfigHandler(ObjectMapper mapper, TriggerSurface triggers) {
        super(mapper, "POST");
        this.triggers = triggers;
    }

    @Override
    protected Object process(HttpExchange httpExchange) throws ValidationException {
        Map<String, String> params = queryParameters(httpExchange);
        DeviceSettingsUpdate update = new DeviceSettingsUpdate()
                .setSignal(intParam(params, "signal"))
                .setCpuTemp(intParam(params, "cpu_temp"));
        String registered = params.get("registered");
        if (registered != null) {
            if (!"true".equalsIgnoreCase(registered) && !"false".equalsIgnoreCase(registered)) {
                throw new ValidationException(FailCode.INVALID_PARAMETER, "registered must be true or false");
            }
            update.setRegistered(Boolean.parseBoolean(registered));
        }

        if (update.isEmpty()) {
            ObjectNode result = status("updated");
            result.putArray("fields");
            return result;
        }

        List<String> fields = triggers.applySettings(update);
        ObjectNode result = status("updated");
        result.set("fields", mapper.valueToTree(fields));
        return result;
    }

    private static Integer intParam(Map<String, String> params, String name) throws ValidationException {
        String value = params.get(name);
        if (value == null) {
            return null;
        }
        Integer parsed = Ints.tryParse(value);
        if (parsed == null) {
            throw new ValidationException(FailCode.INVALID_PARAMETER, name + " must be an integer");
        }
        return parsed;
    }
}
