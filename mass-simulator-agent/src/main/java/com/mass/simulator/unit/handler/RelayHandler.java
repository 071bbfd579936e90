package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableSet;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;

import java.util.List;
import java.util.Set;

/**
 * Switches one of the relays listed in the unit profile.
 */
public class RelayHandler extends AbstractFunctionHandler {

    public static final Set<String> STATES = ImmutableSet.of("on", "off");

    public RelayHandler(HandlerContext context) {
        super(context);
    }

    @Override
    public ProtocolFunction handles() {
        return ProtocolFunction.RELAY;
    }

    @Override
    public List<Envelope> handle(DeviceState state, Envelope request) throws ValidationException {
        ObjectNode body = requestBody(request);
        String name = requireText(body, "name");
        if (!context.getProfile().getRelayNames().contains(name)) {
            throw new ValidationException(FailCode.UNKNOWN_RELAY, "relay " + name + " does not exist");
        }
        String relayState = requireText(body, "state");
        if (!STATES.contains(relayState)) {
            throw new ValidationException(FailCode.INVALID_PARAMETER, "state must be on or off");
        }

        ObjectNode response = newObject();
        response.put("name", name);
        response.put("state", relayState);
        response.put("date", format(state.getDeviceTime()));
        return single(request, response);
    }
}
