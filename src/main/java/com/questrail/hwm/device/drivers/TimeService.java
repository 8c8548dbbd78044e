package com.questrail.hwm.device.drivers;

import com.questrail.hwm.internal.time.WallClock;
import com.questrail.hwm.pipeline.Service;

import java.time.Instant;
import java.util.Objects;

/**
 * Station time, offered to pipeline members by a {@link StationClockDevice}.
 */
public final class TimeService implements Service
{
    public static final String TYPE = "time";

    private final String id;
    private final WallClock clock;

    public TimeService(String id, WallClock clock) {
        this.id = Objects.requireNonNull(id, "id");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String type() {
        return TYPE;
    }

    public Instant now() {
        return clock.now();
    }
}
