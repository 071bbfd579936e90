package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.mass.simulator.device.DeviceSettingsUpdate;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;

import java.util.Iterator;
import java.util.List;
import java.util.Set;

import static com.google.common.collect.Lists.newArrayList;

/**
 * Partial update of registration, clock, telemetry and addressing. Every applied update is
 * announced with a notification push; a client request additionally gets a response listing
 * the updated and ignored fields.
 */
public class ConfigurationHandler extends AbstractFunctionHandler {

    public static final String CHANGE_MESSAGE = "Configuration updated";

    static final Set<String> SUPPORTED = ImmutableSet.of(DeviceSettingsUpdate.REGISTERED, DeviceSettingsUpdate.DEVICE_DATE,
            DeviceSettingsUpdate.SIGNAL, DeviceSettingsUpdate.CPU_TEMP, DeviceSettingsUpdate.FLAG, DeviceSettingsUpdate.SERIAL_NUMBER);

    public ConfigurationHandler(HandlerContext context) {
        super(context);
    }

    @Override
    public ProtocolFunction handles() {
        return ProtocolFunction.CONFIGURATION;
    }

    @Override
    public List<Envelope> handle(DeviceState state, Envelope request) throws ValidationException {
        ObjectNode body = requestBody(request);
        DeviceSettingsUpdate update = parse(body);
        if (update.isEmpty()) {
            throw new ValidationException(FailCode.MISSING_PARAMETER, "at least one of " + SUPPORTED + " is required");
        }

        List<String> updated = state.applySettings(update);

        ObjectNode change = newObject();
        change.put("type", "info");
        change.put("message", CHANGE_MESSAGE);
        change.set("fields", toArray(updated));
        change.put("date", format(state.getDeviceTime()));
        Envelope notification = push(change);

        if (!request.isCorrelated()) {
            return ImmutableList.of(notification);
        }

        List<String> ignored = newArrayList();
        Iterator<String> names = body.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!SUPPORTED.contains(name)) {
                ignored.add(name);
            }
        }
        ObjectNode result = newObject();
        result.set("updated", toArray(updated));
        result.set("ignored", toArray(ignored));
        return ImmutableList.of(notification, respond(request, result));
    }

    /**
     * Request body equivalent of a settings update, for synthetic invocations.
     *
     * @param update
     * @param mapper
     * @return
     */
    public static ObjectNode toRequest(DeviceSettingsUpdate update, ObjectMapper mapper) {
        ObjectNode body = mapper.createObjectNode();
        if (update.getRegistered() != null) {
            body.put(DeviceSettingsUpdate.REGISTERED, update.getRegistered());
        }
        if (update.getDeviceDate() != null) {
            body.put(DeviceSettingsUpdate.DEVICE_DATE, format(update.getDeviceDate()));
        }
        if (update.getSignal() != null) {
            body.put(DeviceSettingsUpdate.SIGNAL, update.getSignal());
        }
        if (update.getCpuTemp() != null) {
            body.put(DeviceSettingsUpdate.CPU_TEMP, update.getCpuTemp());
        }
        if (update.getFlag() != null) {
            body.put(DeviceSettingsUpdate.FLAG, update.getFlag());
        }
        if (update.getSerialNumber() != null) {
            body.put(DeviceSettingsUpdate.SERIAL_NUMBER, update.getSerialNumber());
        }
        return body;
    }

    private static DeviceSettingsUpdate parse(ObjectNode body) throws ValidationException {
        DeviceSettingsUpdate update = new DeviceSettingsUpdate();
        JsonNode registered = body.get(DeviceSettingsUpdate.REGISTERED);
        if (registered != null && !registered.isNull()) {
            if (!registered.isBoolean()) {
                throw new ValidationException(FailCode.INVALID_PARAMETER, "registered must be true or false");
            }
            update.setRegistered(registered.booleanValue());
        }
        if (body.hasNonNull(DeviceSettingsUpdate.DEVICE_DATE)) {
            update.setDeviceDate(requireDate(body, DeviceSettingsUpdate.DEVICE_DATE));
        }
        update.setSignal(optionalInt(body, DeviceSettingsUpdate.SIGNAL));
        update.setCpuTemp(optionalInt(body, DeviceSettingsUpdate.CPU_TEMP));
        update.setFlag(optionalText(body, DeviceSettingsUpdate.FLAG));
        update.setSerialNumber(optionalText(body, DeviceSettingsUpdate.SERIAL_NUMBER));
        return update;
    }

    private ArrayNode toArray(List<String> values) {
        ArrayNode array = newArray();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }
}
