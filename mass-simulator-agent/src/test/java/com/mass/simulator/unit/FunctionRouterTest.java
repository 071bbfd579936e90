package com.mass.simulator.unit;

import com.google.common.collect.ImmutableList;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.MessageHeaderBuilder;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;
import com.mass.simulator.unit.handler.AlarmHandler;
import com.mass.simulator.unit.handler.ConfigurationHandler;
import com.mass.simulator.unit.handler.FunctionHandler;
import com.mass.simulator.unit.handler.HandlerTestBase;
import com.mass.simulator.unit.handler.HeartbeatHandler;
import com.mass.simulator.unit.handler.IdentificationHandler;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class FunctionRouterTest extends HandlerTestBase {

    private FunctionRouter router;

    @Before
    public void setUp() {
        router = new FunctionRouter(state, context.getHeaders());
        router.registerHandler(new IdentificationHandler(context));
        router.registerHandler(new HeartbeatHandler(context));
        router.registerHandler(new AlarmHandler(context));
        router.registerHandler(new ConfigurationHandler(context));
    }

    @Test
    public void identificationIsAckedThenAnswered() throws Exception {
        List<Envelope> out = router.route(request("identification", "r1", "{}"));

        assertThat(out, hasSize(2));
        assertThat(out.get(0).getFunction(), equalTo("ack"));
        assertThat(out.get(0).getReferenceId(), equalTo("r1"));
        assertThat(out.get(0).getResponse(), is(nullValue()));
        assertThat(out.get(1).getFunction(), equalTo("identification"));
        assertThat(out.get(1).getReferenceId(), equalTo("r1"));
        assertThat(out.get(1).getResponse().get("serialNumber").asText(), equalTo("0123456789ABCDE"));
    }

    @Test
    public void configurationIsAckedNotifiedAndAnswered() throws Exception {
        List<Envelope> out = router.route(request("configuration", "r2", "{\"registered\":true}"));

        assertThat(state.getTelemetry().isRegistered(), is(true));
        assertThat(out, hasSize(3));
        assertThat(out.get(0).getFunction(), equalTo("ack"));
        assertThat(out.get(0).getReferenceId(), equalTo("r2"));
        assertThat(out.get(1).getNotification().get("fields").get(0).asText(), equalTo("registered"));
        assertThat(out.get(2).getReferenceId(), equalTo("r2"));
    }

    @Test
    public void unknownFunctionsAreOnlyAcked() throws Exception {
        List<Envelope> out = router.route(request("teleport", "r3", "{}"));

        assertThat(out, hasSize(1));
        assertThat(out.get(0).getFunction(), equalTo("ack"));
        assertThat(out.get(0).getReferenceId(), equalTo("r3"));

        assertThat(router.route(request("heartbeat", "r4", null)), hasSize(2));
    }

    @Test
    public void serverAcksAreNotAcked() throws Exception {
        assertThat(router.route(request("ack", "push-7", null)), is(empty()));
    }

    @Test
    public void alarmsCannotBeRequested() throws Exception {
        List<Envelope> out = router.route(request("alarm", "r5",
                "{\"type\":\"info\",\"level\":\"info\",\"incidentCode\":1,\"description\":\"x\"}"));

        assertThat(out, hasSize(2));
        assertFailure(out.get(1), "r5", FailCode.UNSUPPORTED_OPERATION);
    }

    @Test
    public void validationFailuresAreReported() throws Exception {
        List<Envelope> out = router.route(request("configuration", "r6", "{}"));

        assertThat(out, hasSize(2));
        assertThat(out.get(0).getFunction(), equalTo("ack"));
        assertFailure(out.get(1), "r6", FailCode.MISSING_PARAMETER);
    }

    @Test
    public void unexpectedErrorsBecomeInternalErrors() throws Exception {
        FunctionHandler broken = mock(FunctionHandler.class);
        when(broken.handles()).thenReturn(ProtocolFunction.LOG);
        when(broken.acceptsPull()).thenReturn(true);
        when(broken.handle(any(DeviceState.class), any(Envelope.class))).thenThrow(new IllegalStateException("boom"));
        router.registerHandler(broken);

        List<Envelope> out = router.route(request("log", "r7", "{}"));

        assertFailure(out.get(1), "r7", FailCode.INTERNAL_ERROR);
    }

    @Test
    public void stateRejectionsKeepTheirFailCode() throws Exception {
        FunctionHandler careless = mock(FunctionHandler.class);
        when(careless.handles()).thenReturn(ProtocolFunction.LOG);
        when(careless.acceptsPull()).thenReturn(true);
        when(careless.handle(any(DeviceState.class), any(Envelope.class))).thenAnswer(invocation -> {
            state.addSchedules(ImmutableList.of(mapper.createObjectNode().put("cron", "0 * * * *")));
            return ImmutableList.of();
        });
        router.registerHandler(careless);

        List<Envelope> out = router.route(request("log", "r8", "{}"));

        assertFailure(out.get(1), "r8", FailCode.INVALID_PARAMETER);
        assertThat(state.listSchedules(), is(empty()));
    }

    @Test(expected = IllegalStateException.class)
    public void duplicateRegistrationFails() {
        router.registerHandler(new HeartbeatHandler(context));
    }

    @Test
    public void invokeProducesPushesWithoutAck() throws Exception {
        List<Envelope> out = router.invoke(ProtocolFunction.HEARTBEAT, null);

        assertThat(out, hasSize(1));
        assertThat(out.get(0).getFunction(), equalTo("heartbeat"));
        assertThat(out.get(0).getReferenceId(), equalTo("push-1"));
        assertThat(out.get(0).getNotification().get("signal").asInt(), is(13));
    }

    @Test(expected = ValidationException.class)
    public void invokePropagatesValidationFailures() throws Exception {
        router.invoke(ProtocolFunction.ALARM, mapper.createObjectNode());
    }

    private static void assertFailure(Envelope envelope, String referenceId, FailCode code) {
        assertThat(envelope.getReferenceId(), equalTo(referenceId));
        assertThat(envelope.getMessageStatus(), equalTo(MessageHeaderBuilder.STATUS_FAIL));
        assertThat(envelope.getResponse().get("failCode").asInt(), is(code.getCode()));
        assertThat(envelope.getResponse().has("failDescrition"), is(true));
    }
}
