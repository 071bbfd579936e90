package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mass.simulator.protocol.MessageHeaderBuilder;
import com.mass.simulator.unit.DeviceProfile;
import com.mass.simulator.unit.sample.LogSampleGenerator;
import com.mass.simulator.unit.sample.ProfileSampleGenerator;
import com.mass.simulator.unit.sample.ReadoutSampleGenerator;

/**
 * Collaborators shared by all function handlers.
 */
public class HandlerContext {

    private final MessageHeaderBuilder headers;
    private final ObjectMapper mapper;
    private final DeviceProfile profile;
    private final ReadoutSampleGenerator readouts;
    private final LogSampleGenerator logs;
    private final ProfileSampleGenerator profiles;

    public HandlerContext(MessageHeaderBuilder headers, ObjectMapper mapper, DeviceProfile profile) {
        this(headers, mapper, profile, new ReadoutSampleGenerator(), new LogSampleGenerator(), new ProfileSampleGenerator());
    }

    public HandlerContext(MessageHeaderBuilder headers, ObjectMapper mapper, DeviceProfile profile,
                          ReadoutSampleGenerator readouts, LogSampleGenerator logs, ProfileSampleGenerator profiles) {
        this.headers = headers;
        this.mapper = mapper;
        this.profile = profile;
        this.readouts = readouts;
        this.logs = logs;
        this.profiles = profiles;
    }

    public MessageHeaderBuilder getHeaders() {
        return headers;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public DeviceProfile getProfile() {
        return profile;
    }

    public ReadoutSampleGenerator getReadouts() {
        return readouts;
    }

    public LogSampleGenerator getLogs() {
        return logs;
    }

    public ProfileSampleGenerator getProfiles() {
        return profiles;
    }
}
