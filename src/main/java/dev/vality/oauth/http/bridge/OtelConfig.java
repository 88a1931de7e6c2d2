package dev.vality.oauth.http.bridge;

import dev.vality.oauth.http.bridge.properties.OtelConfigProperties;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import io.opentelemetry.semconv.ServiceAttributes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exports the spans of access token lookups over OTLP/HTTP and registers the SDK as the global instance used by
 * {@link dev.vality.oauth.http.bridge.token.RestAccessTokenClient}.
 */
@Slf4j
@Configuration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnProperty(value = "otel.enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(OtelConfigProperties.class)
@RequiredArgsConstructor
public class OtelConfig {

    private final OtelConfigProperties otelConfigProperties;

    @Value("${spring.application.name:oauth-http-bridge}")
    private String applicationName;

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public OpenTelemetrySdk openTelemetrySdk() {
        var resource = Resource.getDefault()
                .merge(Resource.create(Attributes.of(ServiceAttributes.SERVICE_NAME, applicationName)));
        var spanExporter = OtlpHttpSpanExporter.builder()
                .setEndpoint(otelConfigProperties.getResource())
                .setTimeout(otelConfigProperties.getTimeout())
                .build();
        var sdkTracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
                .setSampler(Sampler.alwaysOn())
                .setResource(resource)
                .build();
        var openTelemetrySdk = OpenTelemetrySdk.builder()
                .setTracerProvider(sdkTracerProvider)
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();
        registerGlobalOpenTelemetry(openTelemetrySdk);
        log.info("Exporting access token lookup spans of {} to {}", applicationName,
                otelConfigProperties.getResource());
        return openTelemetrySdk;
    }

    private static void registerGlobalOpenTelemetry(OpenTelemetry openTelemetry) {
        try {
            GlobalOpenTelemetry.set(openTelemetry);
        } catch (IllegalStateException ex) {
            log.warn("GlobalOpenTelemetry was already initialized, replacing it", ex);
            GlobalOpenTelemetry.resetForTest();
            GlobalOpenTelemetry.set(openTelemetry);
        }
    }
}
