package dev.vality.oauth.http.bridge.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static dev.vality.oauth.http.bridge.OauthHeadersConstants.ACCESS_TOKEN_PARAM;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "oauth-http-bridge.auth")
public class OauthProperties {

    @Valid
    private Service service = new Service();
    @NotNull
    private Duration timeout = Duration.ofMillis(200);
    @NotBlank
    private String accessTokenParam = ACCESS_TOKEN_PARAM;
    private int filterOrder = -40;
    @Valid
    private List<Endpoint> endpoints = new ArrayList<>();

    /**
     * Location of the authorization service. Unset host and port fall back to the {@code AUTH_SERVICE_HOST} and
     * {@code AUTH_SERVICE_PORT} environment variables, then to {@code localhost:8080}.
     */
    @Getter
    @Setter
    public static class Service {

        private String host;
        private Integer port;
        @NotBlank
        private String scheme = "http";
        /**
         * Resolve the host to an address once at startup and call that address afterwards. Startup fails when the
         * host cannot be resolved.
         */
        private boolean resolveAddress = true;

    }

    /**
     * Restricts authentication to requests arriving on {@code port} (any port when unset) whose path starts with
     * {@code path}.
     */
    @Getter
    @Setter
    public static class Endpoint {

        private Integer port;
        @NotNull
        private String path;

    }

    public boolean appliesTo(int port, String path) {
        if (endpoints.isEmpty()) {
            return true;
        }
        return endpoints.stream().anyMatch(endpoint -> matches(endpoint, port, path));
    }

    private boolean matches(Endpoint endpoint, int port, String path) {
        var portMatches = endpoint.getPort() == null || port == endpoint.getPort();
        var pathMatches = path.startsWith(endpoint.getPath());
        return portMatches && pathMatches;
    }
}
