package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;

import java.util.List;

/**
 * Accepts any directive without acting on it.
 */
public class DirectiveHandler extends AbstractFunctionHandler {

    public DirectiveHandler(HandlerContext context) {
        super(context);
    }

    @Override
    public ProtocolFunction handles() {
        return ProtocolFunction.DIRECTIVE;
    }

    @Override
    public List<Envelope> handle(DeviceState state, Envelope request) throws ValidationException {
        String directive = optionalText(requestBody(request), "directive");
        ObjectNode response = newObject();
        if (directive != null) {
            response.put("directive", directive);
        }
        response.put("status", "accepted");
        return single(request, response);
    }
}
