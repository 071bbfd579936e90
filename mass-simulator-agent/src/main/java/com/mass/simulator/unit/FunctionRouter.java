package com.mass.simulator.unit;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.MessageHeaderBuilder;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;
import com.mass.simulator.unit.handler.FunctionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.collect.Lists.newArrayList;

/**
 * Dispatches requests to the handler registered for their function. Every client request is
 * acknowledged before anything else is sent back, whatever the outcome of handling it.
 */
public class FunctionRouter {

    private static final Logger log = LoggerFactory.getLogger(FunctionRouter.class);

    private final DeviceState state;
    private final MessageHeaderBuilder headers;
    private final Map<String, FunctionHandler> handlers = new ConcurrentHashMap<>();

    public FunctionRouter(DeviceState state, MessageHeaderBuilder headers) {
        this.state = state;
        this.headers = headers;
    }

    public void registerHandler(FunctionHandler handler) {
        String name = handler.handles().getWireName();
        if (handlers.putIfAbsent(name, handler) != null) {
            throw new IllegalStateException("a handler for " + name + " is already registered");
        }
        log.info("registering function handler for {}", name);
    }

    public boolean isRegistered(ProtocolFunction function) {
        return handlers.containsKey(function.getWireName());
    }

    /**
     * Handle a client request.
     *
     * @param request
     * @return the ack followed by the handler's replies
     */
    public List<Envelope> route(Envelope request) {
        String function = request.getFunction();
        if (ProtocolFunction.ACK.getWireName().equals(function)) {
            log.info("server acknowledged {}", request.getReferenceId());
            return ImmutableList.of();
        }

        List<Envelope> out = newArrayList();
        out.add(headers.ack(request.getReferenceId()));

        FunctionHandler handler = handlers.get(function);
        if (handler == null) {
            log.warn("unhandled function {} (ref: {})", function, request.getReferenceId());
            return out;
        }
        if (!handler.acceptsPull()) {
            out.add(headers.failure(function, request.getReferenceId(),
                    new ValidationException(FailCode.UNSUPPORTED_OPERATION, function + " cannot be requested")));
            return out;
        }

        try {
            out.addAll(handler.handle(state, request));
        } catch (ValidationException e) {
            log.info("rejected {} (ref: {}): {}", function, request.getReferenceId(), e.getMessage());
            out.add(headers.failure(function, request.getReferenceId(), e));
        } catch (RuntimeException e) {
            log.error("handler for {} failed (ref: {})", function, request.getReferenceId(), e);
            out.add(headers.failure(function, request.getReferenceId(),
                    new ValidationException(FailCode.INTERNAL_ERROR, "internal error")));
        }
        return out;
    }

    /**
     * Run a handler on behalf of the device itself. Nothing is acknowledged and the handler
     * answers with pushes.
     *
     * @param function
     * @param body request body, may be null
     * @return messages to publish
     * @throws ValidationException
     */
    public List<Envelope> invoke(ProtocolFunction function, ObjectNode body) throws ValidationException {
        FunctionHandler handler = handlers.get(function.getWireName());
        if (handler == null) {
            throw new IllegalStateException("no handler registered for " + function.getWireName());
        }
        Envelope request = new Envelope();
        request.setFunction(function.getWireName());
        request.setRequest(body);
        return handler.handle(state, request);
    }
}
