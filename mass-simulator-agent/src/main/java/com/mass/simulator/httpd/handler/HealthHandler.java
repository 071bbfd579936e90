package com.mass.simulator.httpd.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mass.simulator.device.DeviceIdentity;
import com.mass.simulator.unit.DeviceStatusHolder;
import com.sun.net.httpserver.HttpExchange;

/**
 * Liveness of the simulator and its broker connection.
 */
public class HealthHandler extends AbstractJsonHandler {

    private final DeviceStatusHolder status;

    public HealthHandler(ObjectMapper mapper, DeviceStatusHolder status) {
        super(mapper, "GET");
        this.status = status;
    }

    @Override
    protected Object process(HttpExchange httpExchange) {
        DeviceIdentity identity = status.getSnapshot().getIdentity();
        ObjectNode health = status("healthy");
        health.put("mqtt_connected", status.isTransportConnected());
        health.put("device", identity.getFlag() + "/" + identity.getSerialNumber());
        health.put("broker", status.getBrokerAddress());
        return health;
    }
}
