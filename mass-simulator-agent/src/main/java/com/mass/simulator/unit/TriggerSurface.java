package com.mass.simulator.unit;

import com.mass.simulator.agent.TransportException;
import com.mass.simulator.device.DeviceSettingsUpdate;
import com.mass.simulator.device.MeterDescriptor;
import com.mass.simulator.model.AlarmTrigger;
import com.mass.simulator.model.RelayTrigger;
import com.mass.simulator.model.WriteTrigger;
import com.mass.simulator.protocol.ValidationException;

import java.util.List;

/**
 * Manual control of the simulated unit. The push triggers need a connected transport.
 */
public interface TriggerSurface {

    void triggerHeartbeat() throws TransportException, ValidationException;

    void triggerAlarm(AlarmTrigger alarm) throws TransportException, ValidationException;

    void triggerWrite(WriteTrigger write) throws TransportException, ValidationException;

    void triggerReset() throws TransportException, ValidationException;

    void triggerRelay(RelayTrigger relay) throws TransportException, ValidationException;

    /**
     * Update device settings. The change notification is published only when connected, the
     * state is updated either way.
     *
     * @param update
     * @return names of the applied fields
     * @throws ValidationException
     */
    List<String> applySettings(DeviceSettingsUpdate update) throws ValidationException;

    void addMeter(MeterDescriptor meter) throws ValidationException;
}
