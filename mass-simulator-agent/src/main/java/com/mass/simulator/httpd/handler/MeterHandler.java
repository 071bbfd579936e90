package com.mass.simulator.httpd.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mass.simulator.device.MeterDescriptor;
import com.mass.simulator.protocol.ValidationException;
import com.mass.simulator.unit.TriggerSurface;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;

/**
 * Attach a meter to the unit.
 */
public class MeterHandler extends AbstractJsonHandler {

    private final TriggerSurface triggers;

    public MeterHandler(ObjectMapper mapper, TriggerSurface triggers) {
        super(mapper, "POST");
        this.triggers = triggers;
    }

    @Override
    protected Object process(HttpExchange httpExchange) throws IOException, ValidationException {
        MeterDescriptor meter = readBody(httpExchange, MeterDescriptor.class);
        triggers.addMeter(meter);
        ObjectNode result = status("added");
        result.put("serialNumber", meter.getSerialNumber());
        return result;
    }
}
