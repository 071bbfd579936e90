package com.mass.simulator.unit.sample;

import com.mass.simulator.device.MeterDescriptor;

import java.time.LocalDateTime;

/**
 * One incident of the unit's event log.
 */
public class LogEntry {

    private final int incidentCode;
    private final String description;
    private final LocalDateTime date;
    private final MeterDescriptor meter;

    public LogEntry(int incidentCode, String description, LocalDateTime date, MeterDescriptor meter) {
        this.incidentCode = incidentCode;
        this.description = description;
        this.date = date;
        this.meter = meter;
    }

    public int getIncidentCode() {
        return incidentCode;
    }

    public String getDescription() {
        return description;
    }

    public LocalDateTime getDate() {
        return date;
    }

    /**
     * @return the meter the incident refers to, or null for unit level incidents
     */
    public MeterDescriptor getMeter() {
        return meter;
    }
}
