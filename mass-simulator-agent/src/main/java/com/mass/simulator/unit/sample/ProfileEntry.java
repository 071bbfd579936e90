package com.mass.simulator.unit.sample;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One load profile interval: register values captured at the end of the interval.
 */
public class ProfileEntry {

    private final LocalDateTime date;
    private final Map<String, String> values;

    public ProfileEntry(LocalDateTime date, Map<String, String> values) {
        this.date = date;
        this.values = values;
    }

    public LocalDateTime getDate() {
        return date;
    }

    public Map<String, String> getValues() {
        return values;
    }
}
