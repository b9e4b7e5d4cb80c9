package com.example.courier.realtime.client;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReconnectStateMachineTest {

    private final VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
    private final RecordingTransport transport = new RecordingTransport();

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    void backsOffExponentiallyThenResetsAndResubscribesOnSuccess() {
        ReconnectStateMachine machine = machine(5, Duration.ofSeconds(30));
        machine.subscribe(42);
        machine.connect();
        machine.onOpen();
        assertThat(transport.sent).containsExactly(subscribe(42));

        for (int closure = 0; closure < 3; closure++) {
            machine.onClose(ReconnectStateMachine.ABNORMAL_CLOSURE, "network");
            assertThat(machine.getState()).isEqualTo(ReconnectState.WAITING_TO_RECONNECT);
            scheduler.advanceTimeBy(machine.getReconnectDelays().get(closure));
            assertThat(machine.getState()).isEqualTo(ReconnectState.CONNECTING);
        }
        assertThat(machine.getAttempt()).isEqualTo(3);
        assertThat(transport.opens).isEqualTo(4);

        List<Duration> delays = machine.getReconnectDelays();
        assertThat(delays).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
        assertThat(delays).isSorted().allSatisfy(delay -> assertThat(delay).isLessThanOrEqualTo(Duration.ofSeconds(30)));

        machine.onOpen();

        assertThat(machine.isConnected()).isTrue();
        assertThat(machine.getAttempt()).isZero();
        assertThat(transport.sent).containsExactly(subscribe(42), subscribe(42));
    }

    @Test
    void reconnectWaitsForTheFullDelay() {
        ReconnectStateMachine machine = machine(5, Duration.ofSeconds(30));
        machine.connect();
        machine.onOpen();
        machine.onClose(ReconnectStateMachine.ABNORMAL_CLOSURE, "network");

        scheduler.advanceTimeBy(Duration.ofMillis(999));
        assertThat(transport.opens).isEqualTo(1);

        scheduler.advanceTimeBy(Duration.ofMillis(1));
        assertThat(transport.opens).isEqualTo(2);
    }

    @Test
    void givesUpAfterTheMaximumNumberOfAttempts() {
        ReconnectStateMachine machine = machine(5, Duration.ofSeconds(5));
        machine.connect();

        for (int attempt = 0; attempt < 5; attempt++) {
            machine.onClose(ReconnectStateMachine.ABNORMAL_CLOSURE, "refused");
            scheduler.advanceTimeBy(Duration.ofMinutes(1));
        }
        machine.onClose(ReconnectStateMachine.ABNORMAL_CLOSURE, "refused");

        assertThat(machine.getState()).isEqualTo(ReconnectState.FAILED);
        assertThat(machine.isConnected()).isFalse();
        assertThat(transport.opens).isEqualTo(6);
        assertThat(machine.getReconnectDelays()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2),
                Duration.ofSeconds(4), Duration.ofSeconds(5), Duration.ofSeconds(5));

        scheduler.advanceTimeBy(Duration.ofMinutes(5));
        assertThat(transport.opens).isEqualTo(6);
    }

    @Test
    void normalClosureDoesNotReconnect() {
        ReconnectStateMachine machine = machine(5, Duration.ofSeconds(30));
        machine.connect();
        machine.onOpen();

        machine.onClose(ReconnectStateMachine.NORMAL_CLOSURE, "bye");
        scheduler.advanceTimeBy(Duration.ofMinutes(1));

        assertThat(machine.getState()).isEqualTo(ReconnectState.DISCONNECTED);
        assertThat(machine.getLastCloseCode()).isEqualTo(1000);
        assertThat(transport.opens).isEqualTo(1);
    }

    @Test
    void disconnectCancelsAPendingReconnect() {
        ReconnectStateMachine machine = machine(5, Duration.ofSeconds(30));
        machine.connect();
        machine.onOpen();
        machine.onClose(4001, "Authentication failed");

        machine.disconnect();
        scheduler.advanceTimeBy(Duration.ofMinutes(1));

        assertThat(machine.getState()).isEqualTo(ReconnectState.CLOSED);
        assertThat(transport.opens).isEqualTo(1);
        assertThat(transport.closes).isEmpty();
    }

    @Test
    void disconnectClosesALiveSocketNormally() {
        ReconnectStateMachine machine = machine(5, Duration.ofSeconds(30));
        machine.connect();
        machine.onOpen();

        machine.disconnect();
        machine.onClose(ReconnectStateMachine.NORMAL_CLOSURE, "Normal closure");

        assertThat(transport.closes).containsExactly(ReconnectStateMachine.NORMAL_CLOSURE);
        assertThat(machine.getState()).isEqualTo(ReconnectState.CLOSED);
    }

    @Test
    void subscriptionsAreOnlySentWhileOpen() {
        ReconnectStateMachine machine = machine(5, Duration.ofSeconds(30));
        machine.connect();
        machine.subscribe(42);
        assertThat(transport.sent).isEmpty();
        assertThat(machine.send(Map.of("type", "ping"))).isFalse();

        machine.onOpen();
        machine.subscribe(43);
        machine.unsubscribe(42);

        assertThat(transport.sent).containsExactly(subscribe(42), subscribe(43),
                Map.of("type", "unsubscribe_delivery", "delivery_id", 42L));
        assertThat(machine.getSubscriptions()).containsExactly(43L);
    }

    @Test
    void backoffIsCappedForLargeAttemptNumbers() {
        ReconnectStateMachine machine = machine(5, Duration.ofSeconds(30));

        assertThat(machine.backoff(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(machine.backoff(4)).isEqualTo(Duration.ofSeconds(16));
        assertThat(machine.backoff(5)).isEqualTo(Duration.ofSeconds(30));
        assertThat(machine.backoff(80)).isEqualTo(Duration.ofSeconds(30));
    }

    private ReconnectStateMachine machine(int maxAttempts, Duration cap) {
        return new ReconnectStateMachine(transport, new SchedulerReconnectTimer(scheduler), maxAttempts, cap);
    }

    private static Map<String, Object> subscribe(long deliveryId) {
        return Map.of("type", "subscribe_delivery", "delivery_id", deliveryId);
    }

    private static class RecordingTransport implements ReconnectStateMachine.Transport {
        private int opens;
        private final List<Map<String, Object>> sent = new ArrayList<>();
        private final List<Integer> closes = new ArrayList<>();

        @Override
        public void open() {
            opens++;
        }

        @Override
        public void send(Map<String, Object> command) {
            sent.add(Map.copyOf(command));
        }

        @Override
        public void close(int code, String reason) {
            closes.add(code);
        }
    }
}
