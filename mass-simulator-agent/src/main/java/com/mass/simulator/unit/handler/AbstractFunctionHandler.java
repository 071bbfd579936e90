package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.device.MeterDescriptor;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.MassProtocol;
import com.mass.simulator.protocol.ValidationException;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Request parsing and reply building shared by the function handlers.
 */
public abstract class AbstractFunctionHandler implements FunctionHandler {

    protected final HandlerContext context;

    protected AbstractFunctionHandler(HandlerContext context) {
        this.context = context;
    }

    @Override
    public boolean acceptsPull() {
        return true;
    }

    /**
     * Answer a request with a single body: a correlated response when the request has a
     * reference id, otherwise a push.
     */
    protected Envelope respond(Envelope request, JsonNode body) {
        String function = handles().getWireName();
        if (request.isCorrelated()) {
            Envelope reply = context.getHeaders().reply(function, request.getReferenceId());
            reply.setResponse(body);
            return reply;
        }
        return push(body);
    }

    protected Envelope push(JsonNode body) {
        Envelope push = context.getHeaders().push(handles().getWireName());
        push.setNotification(body);
        return push;
    }

    protected List<Envelope> single(Envelope request, JsonNode body) {
        return ImmutableList.of(respond(request, body));
    }

    protected ObjectNode newObject() {
        return context.getMapper().createObjectNode();
    }

    protected ArrayNode newArray() {
        return context.getMapper().createArrayNode();
    }

    /**
     * @return the request body, an empty object when the request carries none
     * @throws ValidationException when the body is not an object
     */
    protected static ObjectNode requestBody(Envelope request) throws ValidationException {
        JsonNode body = request.getRequest();
        if (body == null || body.isNull()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!body.isObject()) {
            throw new ValidationException(FailCode.INVALID_REQUEST, "request must be a JSON object");
        }
        return (ObjectNode) body;
    }

    protected static String requireText(ObjectNode body, String field) throws ValidationException {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            throw new ValidationException(FailCode.MISSING_PARAMETER, field + " is required");
        }
        if (!node.isValueNode() || node.asText().trim().isEmpty()) {
            throw new ValidationException(FailCode.INVALID_PARAMETER, field + " must be a non-blank value");
        }
        return node.asText();
    }

    protected static String optionalText(ObjectNode body, String field) throws ValidationException {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return requireText(body, field);
    }

    /**
     * @return the integer value of the field, or null when the field is absent
     */
    protected static Integer optionalInt(ObjectNode body, String field) throws ValidationException {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ValidationException(FailCode.INVALID_PARAMETER, field + " must be an integer");
        }
        return node.intValue();
    }

    protected static int requireInt(ObjectNode body, String field) throws ValidationException {
        Integer value = optionalInt(body, field);
        if (value == null) {
            throw new ValidationException(FailCode.MISSING_PARAMETER, field + " is required");
        }
        return value;
    }

    protected static LocalDateTime requireDate(ObjectNode body, String field) throws ValidationException {
        String text = requireText(body, field);
        try {
            return LocalDateTime.parse(text, MassProtocol.DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new ValidationException(FailCode.INVALID_PARAMETER,
                    field + " must be formatted " + MassProtocol.DATE_PATTERN);
        }
    }

    /**
     * @return the attached meter named by the field, or null when the field is absent
     * @throws ValidationException when the named meter is not attached
     */
    protected static MeterDescriptor optionalMeter(DeviceState state, ObjectNode body, String field) throws ValidationException {
        String serial = optionalText(body, field);
        if (serial == null) {
            return null;
        }
        Optional<MeterDescriptor> meter = state.findMeter(serial);
        if (!meter.isPresent()) {
            throw new ValidationException(FailCode.UNKNOWN_METER, "meter " + serial + " is not attached");
        }
        return meter.get();
    }

    protected static MeterDescriptor requireMeter(DeviceState state, ObjectNode body, String field) throws ValidationException {
        requireText(body, field);
        return optionalMeter(state, body, field);
    }

    protected static String format(LocalDateTime date) {
        return date.format(MassProtocol.DATE_FORMAT);
    }
}
