package com.mass.simulator.protocol;

import com.google.common.primitives.Ints;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Length prefixed framing of MASS messages: <code>#&lt;decimal byte length&gt;$&lt;payload&gt;</code>.
 */
public final class FrameCodec {

    private static final byte START = '#';
    private static final byte SEPARATOR = '$';

    private FrameCodec() {
        // utility class
    }

    /**
     * Frame a payload.
     *
     * @param payload raw payload bytes, typically UTF-8 JSON
     * @return the framed bytes
     */
    public static byte[] encode(final byte[] payload) {
        checkNotNull(payload, "payload");
        final byte[] prefix = ("#" + payload.length + "$").getBytes(StandardCharsets.US_ASCII);
        final byte[] frame = Arrays.copyOf(prefix, prefix.length + payload.length);
        System.arraycopy(payload, 0, frame, prefix.length, payload.length);
        return frame;
    }

    /**
     * Strip the frame header and return the payload. The declared length must match the
     * remaining bytes exactly, a frame is never partially delivered.
     *
     * @param frame
     * @return payload bytes
     * @throws FramingException if the frame is malformed
     */
    public static byte[] decode(final byte[] frame) throws FramingException {
        if (frame == null || frame.length == 0 || frame[0] != START) {
            throw new FramingException("frame does not start with '#'");
        }

        int pos = 1;
        while (pos < frame.length && frame[pos] >= '0' && frame[pos] <= '9') {
            pos++;
        }
        if (pos == 1) {
            throw new FramingException("frame length prefix is empty or not numeric");
        }
        if (pos >= frame.length || frame[pos] != SEPARATOR) {
            throw new FramingException("frame length prefix is not terminated by '$'");
        }

        final Integer declared = Ints.tryParse(new String(frame, 1, pos - 1, StandardCharsets.US_ASCII));
        if (declared == null) {
            throw new FramingException("frame length prefix is out of range");
        }

        final int available = frame.length - pos - 1;
        if (declared > available) {
            throw new FramingException("frame declares " + declared + " bytes but only " + available + " are present");
        }
        if (declared < available) {
            throw new FramingException("frame carries " + (available - declared) + " trailing bytes after the declared " + declared);
        }
        return Arrays.copyOfRange(frame, pos + 1, frame.length);
    }
}
