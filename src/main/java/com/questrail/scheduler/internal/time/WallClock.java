package com.questrail.scheduler.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for observability timestamps. Never used for timing decisions.
 */
public interface WallClock
{
    Instant now();
}
