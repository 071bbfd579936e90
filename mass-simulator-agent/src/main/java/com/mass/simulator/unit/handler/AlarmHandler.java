package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.MessageHeaderBuilder;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;

import java.util.List;
import java.util.Set;

/**
 * Raises an alarm. Alarms originate on the device only, a client cannot request one.
 */
public class AlarmHandler extends AbstractFunctionHandler {

    public static final Set<String> TYPES = ImmutableSet.of("alarm", "info", "danger");
    public static final Set<String> LEVELS = ImmutableSet.of("critical", "warning", "info");

    public AlarmHandler(HandlerContext context) {
        super(context);
    }

    @Override
    public ProtocolFunction handles() {
        return ProtocolFunction.ALARM;
    }

    @Override
    public boolean acceptsPull() {
        return false;
    }

    @Override
    public List<Envelope> handle(DeviceState state, Envelope request) throws ValidationException {
        ObjectNode body = requestBody(request);
        String type = requireText(body, "type");
        if (!TYPES.contains(type)) {
            throw new ValidationException(FailCode.INVALID_PARAMETER, "type must be one of " + TYPES);
        }
        String level = requireText(body, "level");
        if (!LEVELS.contains(level)) {
            throw new ValidationException(FailCode.INVALID_PARAMETER, "level must be one of " + LEVELS);
        }
        int incidentCode = requireInt(body, "incidentCode");
        String description = requireText(body, "description");

        ObjectNode alarm = newObject();
        alarm.put("type", type);
        alarm.put("level", level);
        alarm.put("incidentCode", incidentCode);
        alarm.put("description", description);
        alarm.put("date", format(state.getDeviceTime()));

        JsonNode meter = body.get("meter");
        if (meter != null && !meter.isNull()) {
            if (!meter.isObject()) {
                throw new ValidationException(FailCode.INVALID_PARAMETER, "meter must be an object");
            }
            ObjectNode meterInfo = newObject();
            meterInfo.put("brand", requireText((ObjectNode) meter, "brand"));
            meterInfo.put("serialNumber", requireText((ObjectNode) meter, "serialNumber"));
            alarm.set("meter", meterInfo);
        }

        ArrayNode alarms = newArray();
        alarms.add(alarm);
        Envelope envelope = respond(request, alarms);
        envelope.setMessageStatus(MessageHeaderBuilder.STATUS_SUCCESS);
        return ImmutableList.of(envelope);
    }
}
