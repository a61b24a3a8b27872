package com.flagship.medexchange_ledger.provider;

import com.flagship.medexchange_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client for the payment provider. Timeouts are mandatory: a hung
 * provider call must fail and let the caller run its compensation path.
 */
@Configuration
@Slf4j
public class ProviderClientConfig {

    @Bean
    public RestTemplate providerRestTemplate(RestTemplateBuilder builder, ProviderProperties properties) {
        RestTemplate restTemplate = builder
                .setConnectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                .additionalInterceptors(loggingInterceptor(), correlationInterceptor())
                .build();

        log.info("Provider client configured: baseUrl={}, connectTimeout={}ms, readTimeout={}ms",
                properties.getBaseUrl(), properties.getConnectTimeoutMs(), properties.getReadTimeoutMs());
        return restTemplate;
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            log.debug("Provider request: {} {}", request.getMethod(), request.getURI().getPath());

            ClientHttpResponse response = execution.execute(request, body);

            log.debug("Provider response: {} {} - status {} in {}ms",
                    request.getMethod(), request.getURI().getPath(),
                    response.getStatusCode(), System.currentTimeMillis() - startTime);
            return response;
        };
    }

    private ClientHttpRequestInterceptor correlationInterceptor() {
        return (request, body, execution) -> {
            String correlationId = MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY);
            if (correlationId != null) {
                request.getHeaders().add(CorrelationContext.CORRELATION_ID_HEADER, correlationId);
            }
            return execution.execute(request, body);
        };
    }
}
