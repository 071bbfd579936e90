package com.mass.simulator.unit;

import com.mass.simulator.agent.DeviceEventDispatcher;
import com.mass.simulator.agent.TransportException;
import com.mass.simulator.device.DeviceState;
import com.mass.simulator.protocol.Envelope;
import com.mass.simulator.protocol.ProtocolFunction;
import com.mass.simulator.protocol.ValidationException;
import com.mass.simulator.unit.sample.TelemetryDrift;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Publishes a heartbeat at a fixed delay while the transport is connected.
 */
public class HeartbeatScheduler {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatScheduler.class);

    private final FunctionRouter router;
    private final DeviceEventDispatcher dispatcher;
    private final DeviceState state;
    private final TelemetryDrift drift;
    private final long interval;
    private final TimeUnit unit;
    private ScheduledFuture<?> future;

    /**
     * Constructor
     *
     * @param router
     * @param dispatcher
     * @param state
     * @param drift telemetry drift applied before each heartbeat, null for none
     * @param interval
     * @param unit
     */
    public HeartbeatScheduler(FunctionRouter router, DeviceEventDispatcher dispatcher, DeviceState state,
                              TelemetryDrift drift, long interval, TimeUnit unit) {
        checkArgument(interval > 0, "heartbeat interval must be positive");
        this.router = router;
        this.dispatcher = dispatcher;
        this.state = state;
        this.drift = drift;
        this.interval = interval;
        this.unit = unit;
    }

    public synchronized void start(ScheduledExecutorService executor) {
        if (future == null) {
            future = executor.scheduleWithFixedDelay(this::tick, interval, interval, unit);
            log.info("heartbeat every {} {}", interval, unit.name().toLowerCase());
        }
    }

    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
            future = null;
        }
    }

    void tick() {
        try {
            if (drift != null) {
                drift.apply(state);
            }
            if (!dispatcher.isConnected()) {
                log.warn("transport not connected, skipping heartbeat");
                return;
            }
            for (Envelope heartbeat : router.invoke(ProtocolFunction.HEARTBEAT, null)) {
                dispatcher.sendMessage(heartbeat);
                log.info("sent heartbeat {}", heartbeat.getReferenceId());
            }
        } catch (TransportException e) {
            log.warn("unable to send heartbeat: {}", e.getMessage());
        } catch (ValidationException | RuntimeException e) {
            // a failing tick must not cancel the schedule
            log.error("heartbeat failed", e);
        }
    }
}
