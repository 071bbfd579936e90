package com.mass.simulator.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Throwables;

import java.io.IOException;
import java.time.format.DateTimeFormatter;

/**
 * Converts envelopes to and from framed wire bytes.
 */
public class MassProtocol {

    public static final String DATE_PATTERN = "yyyy-MM-dd HH:mm:ss";
    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern(DATE_PATTERN);

    private final ObjectMapper mapper;

    public MassProtocol() {
        this(new ObjectMapper());
    }

    public MassProtocol(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    /**
     * Serialize and frame an envelope.
     *
     * @param envelope
     * @return framed UTF-8 JSON
     */
    public byte[] wrap(Envelope envelope) {
        try {
            return FrameCodec.encode(mapper.writeValueAsBytes(envelope));
        } catch (JsonProcessingException e) {
            throw Throwables.propagate(e);
        }
    }

    /**
     * Decode a frame and parse the envelope inside it. An envelope without a function or a
     * reference id cannot be answered and is treated as malformed.
     *
     * @param frame
     * @return the envelope
     * @throws FramingException
     */
    public Envelope unwrap(byte[] frame) throws FramingException {
        byte[] payload = FrameCodec.decode(frame);
        JsonNode tree;
        try {
            tree = mapper.readTree(payload);
        } catch (IOException e) {
            throw new FramingException("frame payload is not valid JSON", e);
        }
        if (tree == null || !tree.isObject()) {
            throw new FramingException("frame payload is not a JSON object");
        }
        if (!hasText(tree, "function")) {
            throw new FramingException("envelope has no function");
        }
        if (!hasText(tree, "referenceId")) {
            throw new FramingException("envelope has no referenceId");
        }
        try {
            return mapper.treeToValue(tree, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new FramingException("envelope is malformed: " + e.getOriginalMessage(), e);
        }
    }

    private static boolean hasText(JsonNode tree, String field) {
        JsonNode node = tree.get(field);
        return node != null && node.isTextual() && !node.asText().trim().isEmpty();
    }
}
