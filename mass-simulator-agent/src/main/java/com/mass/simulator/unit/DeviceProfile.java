package com.mass.simulator.unit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;

/**
 * Static network profile of the unit: servers, ntp, interfaces, serial ports and i/o points.
 * Read once at startup and never changed.
 */
public class DeviceProfile {

    public static final String DEFAULT_RESOURCE = "/unit-profile.json";

    private static final String RELAY_TYPE = "relay";

    private final ObjectNode profile;
    private final List<String> relayNames;

    public DeviceProfile(ObjectNode profile) {
        this.profile = profile.deepCopy();
        ImmutableList.Builder<String> relays = ImmutableList.builder();
        for (JsonNode io : profile.path("ioInterfaces")) {
            if (RELAY_TYPE.equals(io.path("type").asText())) {
                relays.add(io.path("name").asText());
            }
        }
        this.relayNames = relays.build();
    }

    /**
     * Load the profile from a classpath resource.
     *
     * @param resource
     * @param mapper
     * @return
     */
    public static DeviceProfile load(String resource, ObjectMapper mapper) {
        try (InputStream in = DeviceProfile.class.getResourceAsStream(resource)) {
            checkState(in != null, "unit profile %s not found on classpath", resource);
            JsonNode tree = mapper.readTree(in);
            checkState(tree != null && tree.isObject(), "unit profile %s is not a JSON object", resource);
            return new DeviceProfile((ObjectNode) tree);
        } catch (IOException e) {
            throw Throwables.propagate(e);
        }
    }

    public ObjectNode getProfile() {
        return profile.deepCopy();
    }

    public List<String> getRelayNames() {
        return relayNames;
    }
}
