package dev.vality.oauth.http.bridge.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Span export settings. {@code resource} is the OTLP/HTTP traces endpoint of the collector.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "otel")
public class OtelConfigProperties {

    @NotBlank
    private String resource;
    @NotNull
    private Duration timeout = Duration.ofSeconds(10);

}
