package com.mass.simulator.unit;

import com.mass.simulator.device.DeviceSnapshot;

/**
 * Read only view of the simulator for status reporting.
 */
public interface DeviceStatusHolder {

    DeviceSnapshot getSnapshot();

    boolean isTransportConnected();

    String getBrokerAddress();
}
