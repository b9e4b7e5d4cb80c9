package com.example.courier.realtime.client;

import reactor.core.Disposable;

import java.time.Duration;

/**
 * Schedules the delayed reconnect attempt. Swapped for virtual time in tests.
 */
public interface ReconnectTimer {

    Disposable schedule(Duration delay, Runnable task);
}
