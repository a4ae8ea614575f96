package com.z254.sentinel.observability;

import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Opens a span around each loop tick and around the detection, rule and escalation entry points.
 * <p>
 * Calls made from inside the same bean are not proxied, so a tick produces one span for the
 * tick plus one per externally invoked operation.
 */
@Slf4j
@Aspect
@Component
public class SentinelTracingAspect {

    private final Tracer tracer;

    public SentinelTracingAspect(Tracer tracer) {
        this.tracer = tracer;
    }

    @Pointcut("execution(public * com.z254.sentinel.scheduling.SentinelScheduler.*Tick())")
    public void loopTicks() {}

    @Pointcut("execution(public * com.z254.sentinel.detection.DetectorRegistry.train*(..))"
            + " || execution(public * com.z254.sentinel.detection.DetectorRegistry.detect*(..))")
    public void detectionOperations() {}

    @Pointcut("execution(public * com.z254.sentinel.alerting.RuleEngine.evaluate*(..))"
            + " || execution(public * com.z254.sentinel.alerting.EscalationScheduler.escalateAll())")
    public void alertingOperations() {}

    @Around("loopTicks()")
    public Object traceLoopTick(ProceedingJoinPoint joinPoint) throws Throwable {
        return traceOperation(joinPoint, "sentinel.loop");
    }

    @Around("detectionOperations()")
    public Object traceDetectionOperation(ProceedingJoinPoint joinPoint) throws Throwable {
        return traceOperation(joinPoint, "sentinel.detection");
    }

    @Around("alertingOperations()")
    public Object traceAlertingOperation(ProceedingJoinPoint joinPoint) throws Throwable {
        return traceOperation(joinPoint, "sentinel.alerting");
    }

    private Object traceOperation(ProceedingJoinPoint joinPoint, String prefix) throws Throwable {
        String spanName = prefix + "." + joinPoint.getSignature().getName();
        Span span = tracer.nextSpan().name(spanName);

        try (Tracer.SpanInScope ws = tracer.withSpan(span.start())) {
            MDC.put(SentinelStructuredLogger.MDC_TRACE_ID, span.context().traceId());
            MDC.put(SentinelStructuredLogger.MDC_SPAN_ID, span.context().spanId());

            span.tag("class", joinPoint.getSignature().getDeclaringType().getSimpleName());
            Object[] args = joinPoint.getArgs();
            if (args.length > 0 && args[0] instanceof String entityId) {
                span.tag("entity.id", entityId);
            }

            return joinPoint.proceed();
        } catch (Throwable t) {
            span.error(t);
            log.debug("Span {} ended with error: {}", spanName, t.getMessage());
            throw t;
        } finally {
            span.end();
            MDC.remove(SentinelStructuredLogger.MDC_TRACE_ID);
            MDC.remove(SentinelStructuredLogger.MDC_SPAN_ID);
        }
    }
}
