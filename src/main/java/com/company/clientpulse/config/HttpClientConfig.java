package com.company.clientpulse.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;

/**
 * Shared HTTP client for Grafana, the test-result API and the notification webhook
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class HttpClientConfig {

    private final MeterRegistry meterRegistry;

    @Value("${pulse.http.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${pulse.http.read-timeout:30s}")
    private Duration readTimeout;

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        RestTemplate restTemplate = builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .additionalInterceptors(metricsInterceptor(), requestIdInterceptor())
                .build();

        log.info("RestTemplate configured with connect timeout {}ms, read timeout {}ms",
                connectTimeout.toMillis(), readTimeout.toMillis());
        return restTemplate;
    }

    private ClientHttpRequestInterceptor metricsInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.nanoTime();
            String host = request.getURI().getHost();
            String status = "error";

            try {
                ClientHttpResponse response = execution.execute(request, body);
                status = String.valueOf(response.getStatusCode().value());
                return response;
            } catch (IOException e) {
                log.debug("HTTP {} {} failed: {}", request.getMethod(), request.getURI(), e.getMessage());
                throw e;
            } finally {
                meterRegistry.timer("pulse.http.client.requests",
                        "method", request.getMethod().name(),
                        "host", host == null ? "unknown" : host,
                        "status", status
                ).record(Duration.ofNanos(System.nanoTime() - startTime));
            }
        };
    }

    /**
     * Propagates the inbound request id, or the check id on worker threads
     */
    private ClientHttpRequestInterceptor requestIdInterceptor() {
        return (request, body, execution) -> {
            String requestId = MDC.get("requestId") != null ? MDC.get("requestId") : MDC.get("checkId");
            if (requestId != null && !request.getHeaders().containsKey("X-Request-ID")) {
                request.getHeaders().add("X-Request-ID", requestId);
            }
            return execution.execute(request, body);
        };
    }
}
