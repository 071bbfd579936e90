package com.mass.simulator.httpd.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mass.simulator.unit.DeviceStatusHolder;
import com.sun.net.httpserver.HttpExchange;

public class DeviceStateHandler extends AbstractJsonHandler {

    private final DeviceStatusHolder status;

    public DeviceStateHandler(ObjectMapper mapper, DeviceStatusHolder status) {
        super(mapper, "GET");
        this.status = status;
    }

    @Override
    protected Object process(HttpExchange httpExchange) {
        return status.getSnapshot();
    }
}
