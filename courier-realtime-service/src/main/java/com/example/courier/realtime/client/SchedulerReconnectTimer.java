package com.example.courier.realtime.client;

import lombok.RequiredArgsConstructor;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@RequiredArgsConstructor
public class SchedulerReconnectTimer implements ReconnectTimer {

    private final Scheduler scheduler;

    @Override
    public Disposable schedule(Duration delay, Runnable task) {
        return scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
    }
}
