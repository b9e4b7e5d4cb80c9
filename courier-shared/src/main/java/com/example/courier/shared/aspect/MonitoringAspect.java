package com.example.courier.shared.aspect;

import com.example.courier.shared.config.MonitoringConfig;
import com.example.courier.shared.dto.CorrelatedRequest;
import com.example.courier.shared.exception.AuthRejectedException;
import com.example.courier.shared.exception.ProtocolException;
import com.example.courier.shared.model.UserIdentity;
import io.opentelemetry.api.trace.Span;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.concurrent.TimeUnit;

/**
 * Times {@link Monitored} calls as {@code courier.realtime.<category>.latency} and
 * counts them as {@code courier.realtime.<category>.calls}, tagged with class,
 * method and outcome. Outcomes are {@code success}, {@code rejected} (the caller
 * was refused: bad credentials or a malformed frame) and {@code error}.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    static final String METRIC_PREFIX = "courier.realtime.";

    private final MonitoringConfig.RealtimeMetricsCollector metricsCollector;

    @Around("@within(com.example.courier.shared.aspect.Monitored) || @annotation(com.example.courier.shared.aspect.Monitored)")
    public Object monitorMethod(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Monitored monitored = resolveAnnotation(signature.getMethod());
        if (monitored == null) {
            return joinPoint.proceed();
        }

        String category = monitored.value();
        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = signature.getName();
        Span span = Span.current();
        boolean traced = span.getSpanContext().isValid();
        if (traced) {
            tagCorrelationId(span, joinPoint.getArgs());
        }

        long start = System.nanoTime();
        String outcome = "error";
        try {
            Object result = joinPoint.proceed();
            outcome = "success";
            if (traced && result instanceof UserIdentity identity) {
                span.setAttribute("app.user_id", identity.getUserId());
                span.setAttribute("app.user_role", identity.getRole().getWireName());
            }
            return result;
        } catch (AuthRejectedException | ProtocolException e) {
            outcome = "rejected";
            log.debug("{}.{} ({}) rejected: {}", className, methodName, category, e.getMessage());
            throw e;
        } catch (Exception e) {
            if (traced) {
                span.recordException(e);
            }
            log.warn("{}.{} ({}) failed: {}", className, methodName, category, e.getMessage());
            throw e;
        } finally {
            long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            metricsCollector.recordTimer(METRIC_PREFIX + category + ".latency", durationMillis,
                    "class", className, "method", methodName, "outcome", outcome);
            metricsCollector.incrementCounter(METRIC_PREFIX + category + ".calls",
                    "class", className, "method", methodName, "outcome", outcome);
        }
    }

    // Method-level annotation wins over the class-level one
    private Monitored resolveAnnotation(Method method) {
        Monitored monitored = method.getAnnotation(Monitored.class);
        return monitored != null ? monitored : method.getDeclaringClass().getAnnotation(Monitored.class);
    }

    private void tagCorrelationId(Span span, Object[] args) {
        for (Object arg : args) {
            if (arg instanceof CorrelatedRequest request && request.getCorrelationId() != null) {
                span.setAttribute("app.correlation_id", request.getCorrelationId());
                return;
            }
        }
    }
}
