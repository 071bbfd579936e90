package com.mass.simulator.device;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Immutable telemetry values. The device clock is kept as an offset in seconds from host time.
 */
@JsonPropertyOrder({"registered", "signal", "cpuTemp", "clockOffsetSeconds"})
public final class Telemetry {

    private final boolean registered;
    private final int signal;
    private final int cpuTemp;
    private final long clockOffsetSeconds;

    public Telemetry(boolean registered, int signal, int cpuTemp, long clockOffsetSeconds) {
        this.registered = registered;
        this.signal = signal;
        this.cpuTemp = cpuTemp;
        this.clockOffsetSeconds = clockOffsetSeconds;
    }

    public boolean isRegistered() {
        return registered;
    }

    public int getSignal() {
        return signal;
    }

    public int getCpuTemp() {
        return cpuTemp;
    }

    public long getClockOffsetSeconds() {
        return clockOffsetSeconds;
    }

    Telemetry withRegistered(boolean value) {
        return new Telemetry(value, signal, cpuTemp, clockOffsetSeconds);
    }

    Telemetry withSignal(int value) {
        return new Telemetry(registered, value, cpuTemp, clockOffsetSeconds);
    }

    Telemetry withCpuTemp(int value) {
        return new Telemetry(registered, signal, value, clockOffsetSeconds);
    }

    Telemetry withClockOffsetSeconds(long value) {
        return new Telemetry(registered, signal, cpuTemp, value);
    }
}
