package com.mass.simulator.unit.sample;

import com.mass.simulator.device.DeviceSettingsUpdate;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.device.Telemetry;
import com.mass.simulator.protocol.ValidationException;
import com.google.common.base.Throwables;

import java.util.Random;

/**
 * Random walk of signal strength and cpu temperature, one step per call.
 */
public class TelemetryDrift {

    static final int MAX_SIGNAL = 31;
    static final int MIN_CPU_TEMP = 0;
    static final int MAX_CPU_TEMP = 85;

    private final Random random;

    public TelemetryDrift() {
        this(new Random());
    }

    public TelemetryDrift(Random random) {
        this.random = random;
    }

    public void apply(DeviceState state) {
        synchronized (state) {
            Telemetry telemetry = state.getTelemetry();
            int signal = clamp(telemetry.getSignal() + random.nextInt(3) - 1, 0, MAX_SIGNAL);
            int cpuTemp = clamp(telemetry.getCpuTemp() + random.nextInt(3) - 1, MIN_CPU_TEMP, MAX_CPU_TEMP);
            try {
                state.applySettings(new DeviceSettingsUpdate().setSignal(signal).setCpuTemp(cpuTemp));
            } catch (ValidationException e) {
                // only flag and serial number are validated
                throw Throwables.propagate(e);
            }
        }
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
