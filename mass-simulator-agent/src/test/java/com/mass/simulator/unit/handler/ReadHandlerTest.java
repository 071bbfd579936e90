package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.ValidationException;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.fail;

public class ReadHandlerTest extends HandlerTestBase {

    private ReadHandler handler;

    @Before
    public void setUp() {
        handler = new ReadHandler(context);
    }

    @Test
    public void itAnswersAFullReadout() throws Exception {
        List<Envelope> out = handler.handle(state, request("read", "r5", "{\"directive\":\"readout\"}"));

        Envelope reply = out.get(0);
        assertThat(reply.getReferenceId(), equalTo("r5"));
        JsonNode body = reply.getResponse();
        assertThat(body.get("readDate").asText(), equalTo(DEVICE_DATE));
        assertThat(body.get("directive").asText(), equalTo("readout"));
        assertThat(body.get("data").get("rawData").asText(), startsWith("0.0.0("));
        assertThat(body.has("meterSerialNumber"), is(false));
    }

    @Test
    public void itReadsObisCodesOfAnAttachedMeter() throws Exception {
        attachMeter("M1");
        List<Envelope> out = handler.handle(state, request("read", "r6",
                "{\"directive\":\"obis\",\"meterSerialNumber\":\"M1\",\"parameters\":{\"obisCodes\":[\"1.8.0\",\"2.8.0\"]}}"));

        JsonNode body = out.get(0).getResponse();
        assertThat(body.get("meterSerialNumber").asText(), equalTo("M1"));
        assertThat(body.get("data").get("rawData").asText(), startsWith("1.8.0("));
    }

    @Test
    public void itIsDeterministic() throws Exception {
        JsonNode first = handler.handle(state, request("read", "a", "{\"directive\":\"shortReadout\"}")).get(0).getResponse();
        JsonNode second = handler.handle(state, request("read", "b", "{\"directive\":\"shortReadout\"}")).get(0).getResponse();

        assertThat(second, equalTo(first));
    }

    @Test
    public void itRejectsBadRequests() throws Exception {
        assertFailure("{}", FailCode.MISSING_PARAMETER);
        assertFailure("{\"directive\":\"loadCurve\"}", FailCode.UNSUPPORTED_DIRECTIVE);
        assertFailure("{\"directive\":\"obis\"}", FailCode.MISSING_PARAMETER);
        assertFailure("{\"directive\":\"readout\",\"meterSerialNumber\":\"nope\"}", FailCode.UNKNOWN_METER);
    }

    private void assertFailure(String body, FailCode expected) throws Exception {
        try {
            handler.handle(state, request("read", "r", body));
            fail("expected " + expected);
        } catch (ValidationException e) {
            assertThat(e.getFailCode(), is(expected));
        }
    }
}
