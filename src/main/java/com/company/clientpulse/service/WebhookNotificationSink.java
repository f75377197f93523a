package com.company.clientpulse.service;

import com.company.clientpulse.config.NotificationProperties;
import com.company.clientpulse.domain.NotificationPayload;
import com.company.clientpulse.exception.NotificationSendException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Posts alerts as JSON to the configured webhook. Nothing is retried; a failed delivery is dropped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WebhookNotificationSink implements NotificationSink {

    private final RestTemplate restTemplate;
    private final NotificationProperties properties;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;

    @Override
    @CircuitBreaker(name = "notificationWebhook", fallbackMethod = "sendFallback")
    public boolean send(String channel, NotificationPayload payload) {
        String url = properties.getWebhookUrl();
        if (url == null || url.isBlank()) {
            log.warn("No webhook configured, dropping alert for {} on {}", payload.getClient(), payload.getNetwork());
            return false;
        }

        Span span = tracer.spanBuilder("pulse.notification.send")
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("network", payload.getNetwork());
            span.setAttribute("client", payload.getClient());
            span.setAttribute("check.id", String.valueOf(payload.getCheckId()));
            span.setAttribute("channel", String.valueOf(channel));

            Map<String, Object> body = new HashMap<>();
            body.put("channel", channel);
            body.put("alert", payload);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            restTemplate.postForEntity(url, new HttpEntity<>(body, headers), Void.class);

            span.addEvent("Alert delivered",
                    Attributes.of(AttributeKey.longKey("active_issues"), (long) payload.getActiveIssues()));

            meterRegistry.counter("pulse.notifications.sent", "client", payload.getClient()).increment();
            log.info("Alert for {} on {} sent to channel {}", payload.getClient(), payload.getNetwork(), channel);
            return true;

        } catch (RestClientException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to deliver alert");
            throw new NotificationSendException("Failed to deliver alert for " + payload.getClient(), e);
        } finally {
            span.end();
        }
    }

    /**
     * Webhook failing or circuit open. The alert is dropped.
     */
    public boolean sendFallback(String channel, NotificationPayload payload, Exception e) {
        log.error("Dropping alert for {} on {} (channel {}): {}",
                payload.getClient(), payload.getNetwork(), channel, e.getMessage());

        meterRegistry.counter("pulse.notifications.dropped", "client", payload.getClient()).increment();
        return false;
    }
}
