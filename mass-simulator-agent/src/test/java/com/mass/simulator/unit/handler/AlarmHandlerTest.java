package com.mass.simulator.unit.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.MessageHeaderBuilder;
import com.mass.simulator.protocol.ValidationException;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class AlarmHandlerTest extends HandlerTestBase {

    private AlarmHandler handler;

    @Before
    public void setUp() {
        handler = new AlarmHandler(context);
    }

    @Test
    public void alarmsCannotBePulled() {
        assertThat(handler.acceptsPull(), is(false));
    }

    @Test
    public void itPushesOneAlarm() throws Exception {
        List<Envelope> out = handler.handle(state, request("alarm", null,
                "{\"type\":\"alarm\",\"level\":\"critical\",\"incidentCode\":278,\"description\":\"cover opened\","
                        + "\"meter\":{\"brand\":\"LGZ\",\"serialNumber\":\"M1\"}}"));

        assertThat(out, hasSize(1));
        Envelope alarm = out.get(0);
        assertThat(alarm.getFunction(), equalTo("alarm"));
        assertThat(alarm.getReferenceId(), equalTo("push-1"));
        assertThat(alarm.getMessageStatus(), equalTo(MessageHeaderBuilder.STATUS_SUCCESS));
        JsonNode body = alarm.getNotification();
        assertThat(body.isArray(), is(true));
        assertThat(body.get(0).get("incidentCode").asInt(), is(278));
        assertThat(body.get(0).get("date").asText(), equalTo(DEVICE_DATE));
        assertThat(body.get(0).get("meter").get("serialNumber").asText(), equalTo("M1"));
    }

    @Test
    public void itLeavesStateAlone() throws Exception {
        String before = mapper.writeValueAsString(state.getSnapshot());
        handler.handle(state, request("alarm", null,
                "{\"type\":\"info\",\"level\":\"info\",\"incidentCode\":1,\"description\":\"x\"}"));

        assertThat(mapper.writeValueAsString(state.getSnapshot()), equalTo(before));
    }

    @Test
    public void itValidatesTypeAndLevel() throws Exception {
        assertFailure("{\"type\":\"oops\",\"level\":\"info\",\"incidentCode\":1,\"description\":\"x\"}", FailCode.INVALID_PARAMETER);
        assertFailure("{\"type\":\"info\",\"level\":\"loud\",\"incidentCode\":1,\"description\":\"x\"}", FailCode.INVALID_PARAMETER);
        assertFailure("{\"type\":\"info\",\"level\":\"info\",\"description\":\"x\"}", FailCode.MISSING_PARAMETER);
    }

    private void assertFailure(String body, FailCode expected) throws Exception {
        try {
            handler.handle(state, request("alarm", null, body));
            fail("expected " + expected);
        } catch (ValidationException e) {
            assertThat(e.getFailCode(), is(expected));
        }
    }
}
