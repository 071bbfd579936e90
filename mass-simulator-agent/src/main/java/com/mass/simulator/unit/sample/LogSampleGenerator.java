package com.mass.simulator.unit.sample;

import com.google.common.collect.ImmutableMap;
import com.mass.simulator.device.MeterDescriptor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Synthesizes event log entries spread over a time range. The same range and filter always
 * produce the same entries.
 */
public class LogSampleGenerator {

    static final int MAX_ENTRIES = 20;

    /** incident catalogue, code to description */
    static final Map<Integer, String> INCIDENTS = ImmutableMap.<Integer, String>builder()
            .put(278, "cover opened")
            .put(439, "relay removed")
            .put(101, "power failure")
            .put(102, "power restored")
            .put(215, "terminal cover opened")
            .put(320, "magnetic interference detected")
            .build();

    /**
     * @param start start of range, inclusive
     * @param end end of range, inclusive, not before start
     * @param incidentCode restrict entries to this incident, or null for any
     * @param meters attached meters, entries reference them round robin
     * @return entries in chronological order
     */
    public List<LogEntry> generate(LocalDateTime start, LocalDateTime end, Integer incidentCode, List<MeterDescriptor> meters) {
        long days = ChronoUnit.DAYS.between(start, end);
        int count = (int) Math.min(MAX_ENTRIES, Math.max(2, days + 1));
        long step = Duration.between(start, end).getSeconds() / count;

        Random random = new Random(Objects.hash(start, end, incidentCode));
        List<Integer> codes = new ArrayList<>(INCIDENTS.keySet());
        List<LogEntry> entries = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            LocalDateTime date = start.plusSeconds(step * i + step / 2).truncatedTo(ChronoUnit.MINUTES);
            if (date.isBefore(start)) {
                date = start;
            }
            int code = incidentCode != null ? incidentCode : codes.get(random.nextInt(codes.size()));
            String description = INCIDENTS.containsKey(code) ? INCIDENTS.get(code) : "incident " + code;
            MeterDescriptor meter = meters.isEmpty() ? null : meters.get(i % meters.size());
            entries.add(new LogEntry(code, description, date, meter));
        }
        return entries;
    }
}
