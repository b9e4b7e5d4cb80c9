package com.example.courier.shared.aspect;

import com.example.courier.shared.config.MonitoringConfig;
import com.example.courier.shared.exception.AuthRejectedException;
import com.example.courier.shared.model.UserIdentity;
import com.example.courier.shared.model.UserRole;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonitoringAspectTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MonitoringConfig.RealtimeMetricsCollector collector = new MonitoringConfig.RealtimeMetricsCollector(registry);
    private Gate gate;

    @BeforeEach
    void setUp() {
        AspectJProxyFactory factory = new AspectJProxyFactory(new Gate());
        factory.setProxyTargetClass(true);
        factory.addAspect(new MonitoringAspect(collector));
        gate = factory.getProxy();
    }

    @Test
    void successfulCallsAreTimedAndCounted() {
        assertThat(gate.admit("ok")).isEqualTo(UserIdentity.active(7, UserRole.COURIER));

        assertThat(calls("admit", "success")).isEqualTo(1);
        assertThat(registry.get("courier.realtime.auth.latency").tag("outcome", "success").timer().count()).isEqualTo(1);
    }

    @Test
    void refusedCallersAreCountedAsRejectedNotAsErrors() {
        assertThatThrownBy(() -> gate.admit("bad")).isInstanceOf(AuthRejectedException.class);

        assertThat(calls("admit", "rejected")).isEqualTo(1);
        assertThat(calls("admit", "error")).isZero();
    }

    @Test
    void unexpectedFailuresAreCountedAsErrors() {
        assertThatThrownBy(() -> gate.admit(null)).isInstanceOf(IllegalStateException.class);

        assertThat(calls("admit", "error")).isEqualTo(1);
    }

    @Test
    void unannotatedMethodsAreLeftAlone() {
        assertThat(gate.describe()).isEqualTo("gate");

        assertThat(registry.find("courier.realtime.auth.calls").tag("method", "describe").counter()).isNull();
    }

    private long calls(String method, String outcome) {
        return collector.getCounterValue("courier.realtime.auth.calls",
                "class", "Gate", "method", method, "outcome", outcome);
    }

    static class Gate {

        @Monitored("auth")
        public UserIdentity admit(String token) {
            if (token == null) {
                throw new IllegalStateException("verifier unavailable");
            }
            if (!"ok".equals(token)) {
                throw new AuthRejectedException("Invalid or expired access token");
            }
            return UserIdentity.active(7, UserRole.COURIER);
        }

        public String describe() {
            return "gate";
        }
    }
}
