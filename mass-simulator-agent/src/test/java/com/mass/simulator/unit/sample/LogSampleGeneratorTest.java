package com.mass.simulator.unit.sample;

import com.google.common.collect.ImmutableList;
import com.mass.simulator.device.MeterDescriptor;
import org.junit.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.nullValue;

public class LogSampleGeneratorTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);

    private final LogSampleGenerator generator = new LogSampleGenerator();

    @Test
    public void entriesStayInsideTheRange() {
        LocalDateTime end = START.plusDays(5);
        List<LogEntry> entries = generator.generate(START, end, null, ImmutableList.<MeterDescriptor>of());

        assertThat(entries.size(), is(6));
        LocalDateTime previous = START;
        for (LogEntry entry : entries) {
            assertThat(entry.getDate().isBefore(START), is(false));
            assertThat(entry.getDate().isAfter(end), is(false));
            assertThat(entry.getDate().isBefore(previous), is(false));
            assertThat(entry.getMeter(), is(nullValue()));
            previous = entry.getDate();
        }
    }

    @Test
    public void entryCountIsCapped() {
        List<LogEntry> entries = generator.generate(START, START.plusYears(1), null, ImmutableList.<MeterDescriptor>of());

        assertThat(entries.size(), is(LogSampleGenerator.MAX_ENTRIES));
    }

    @Test
    public void incidentFilterIsHonoured() {
        List<LogEntry> entries = generator.generate(START, START.plusDays(2), 278, ImmutableList.<MeterDescriptor>of());

        assertThat(entries.size(), greaterThanOrEqualTo(2));
        for (LogEntry entry : entries) {
            assertThat(entry.getIncidentCode(), is(278));
            assertThat(entry.getDescription(), equalTo("cover opened"));
        }
    }

    @Test
    public void entriesReferenceAttachedMeters() {
        MeterDescriptor meter = new MeterDescriptor();
        meter.setSerialNumber("M1");
        List<LogEntry> entries = generator.generate(START, START.plusHours(3), null, ImmutableList.of(meter));

        assertThat(entries.size(), lessThanOrEqualTo(LogSampleGenerator.MAX_ENTRIES));
        assertThat(entries.get(0).getMeter().getSerialNumber(), equalTo("M1"));
    }

    @Test
    public void sameQueryGivesSameEntries() {
        List<LogEntry> first = generator.generate(START, START.plusDays(3), null, ImmutableList.<MeterDescriptor>of());
        List<LogEntry> again = generator.generate(START, START.plusDays(3), null, ImmutableList.<MeterDescriptor>of());

        for (int i = 0; i < first.size(); i++) {
            assertThat(again.get(i).getIncidentCode(), is(first.get(i).getIncidentCode()));
            assertThat(again.get(i).getDate(), equalTo(first.get(i).getDate()));
        }
    }
}
