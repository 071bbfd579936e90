package com.mass.simulator.httpd.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mass.simulator.agent.TransportException;
import com.mass.simulator.protocol.ValidationException;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;

/**
 * Fires a push from the simulated unit.
 *
 * @param <T> request body type, Void for triggers without a body
 */
public class TriggerHandler<T> extends AbstractJsonHandler {

    /**
     * @param <T>
     */
    public interface TriggerAction<T> {
        void fire(T payload) throws TransportException, ValidationException;
    }

    private final Class<T> payloadType;
    private final TriggerAction<T> action;

    /**
     * Constructor
     *
     * @param mapper
     * @param payloadType type of the request body, null when the trigger takes none
     * @param action
     */
    public TriggerHandler(ObjectMapper mapper, Class<T> payloadType, TriggerAction<T> action) {
        super(mapper, "POST");
        this.payloadType = payloadType;
        this.action = action;
    }

    @Override
    protected Object process(HttpExchange httpExchange) throws IOException, ValidationException, TransportException {
        T payload = payloadType != null ? readBody(httpExchange, payloadType) : null;
        action.fire(payload);
        return status("sent");
    }
}
