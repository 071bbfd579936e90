package com.mass.simulator.unit;

import com.mass.simulator.agent.DeviceEventDispatcher;
import com.mass.simulator.agent.TransportException;
import com.mass.simulator.device.DeviceSettingsUpdate;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.unit.handler.HandlerTestBase;
import com.mass.simulator.unit.handler.HeartbeatHandler;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class HeartbeatSchedulerTest extends HandlerTestBase {

    private FunctionRouter router;
    private DeviceEventDispatcher dispatcher;
    private ScheduledExecutorService executor;

    @Before
    public void setUp() {
        router = new FunctionRouter(state, context.getHeaders());
        router.registerHandler(new HeartbeatHandler(context));
        dispatcher = mock(DeviceEventDispatcher.class);
        executor = Executors.newSingleThreadScheduledExecutor();
    }

    @After
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void itBeatsOnSchedule() throws Exception {
        when(dispatcher.isConnected()).thenReturn(true);
        state.applySettings(new DeviceSettingsUpdate().setSignal(27));
        HeartbeatScheduler scheduler = new HeartbeatScheduler(router, dispatcher, state, null, 100, TimeUnit.MILLISECONDS);

        scheduler.start(executor);
        Thread.sleep(350);
        scheduler.stop();

        ArgumentCaptor<Envelope> sent = ArgumentCaptor.forClass(Envelope.class);
        verify(dispatcher, atLeast(2)).sendMessage(sent.capture());
        List<Envelope> heartbeats = sent.getAllValues();
        assertThat(heartbeats.size(), greaterThanOrEqualTo(2));
        Envelope latest = heartbeats.get(heartbeats.size() - 1);
        assertThat(latest.getNotification().get("signal").asInt(), is(27));
    }

    @Test
    public void itSkipsWhileDisconnected() throws Exception {
        when(dispatcher.isConnected()).thenReturn(false);
        HeartbeatScheduler scheduler = new HeartbeatScheduler(router, dispatcher, state, null, 1, TimeUnit.SECONDS);

        scheduler.tick();

        verify(dispatcher, never()).sendMessage(any(Envelope.class));
    }

    @Test
    public void aFailedPublishDoesNotStopTheSchedule() throws Exception {
        when(dispatcher.isConnected()).thenReturn(true);
        doThrow(new TransportException("down")).when(dispatcher).sendMessage(any(Envelope.class));
        HeartbeatScheduler scheduler = new HeartbeatScheduler(router, dispatcher, state, null, 1, TimeUnit.SECONDS);

        scheduler.tick();
        scheduler.tick();

        verify(dispatcher, times(2)).sendMessage(any(Envelope.class));
    }

    @Test(expected = IllegalArgumentException.class)
    public void intervalMustBePositive() {
        new HeartbeatScheduler(router, dispatcher, state, null, 0, TimeUnit.SECONDS);
    }
}
