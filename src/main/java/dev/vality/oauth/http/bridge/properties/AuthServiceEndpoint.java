package dev.vality.oauth.http.bridge.properties;

import dev.vality.oauth.http.bridge.exceptions.OauthHttpBridgeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.PropertyResolver;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

import static dev.vality.oauth.http.bridge.OauthHeadersConstants.AUTH_SERVICE_HOST_ENV;
import static dev.vality.oauth.http.bridge.OauthHeadersConstants.AUTH_SERVICE_PORT_ENV;
import static dev.vality.oauth.http.bridge.OauthHeadersConstants.DEFAULT_AUTH_SERVICE_HOST;
import static dev.vality.oauth.http.bridge.OauthHeadersConstants.DEFAULT_AUTH_SERVICE_PORT;

/**
 * Base URL and timeout of the authorization service, resolved once when the application starts and immutable
 * afterwards.
 */
@Slf4j
public record AuthServiceEndpoint(String baseUrl, Duration timeout) {

    public AuthServiceEndpoint {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
    }

    public static AuthServiceEndpoint resolve(OauthProperties properties, PropertyResolver environment) {
        var service = properties.getService();
        var host = firstNonBlank(service.getHost(), environment.getProperty(AUTH_SERVICE_HOST_ENV),
                DEFAULT_AUTH_SERVICE_HOST);
        var port = service.getPort() != null
                ? service.getPort()
                : parsePort(environment.getProperty(AUTH_SERVICE_PORT_ENV));
        var address = service.isResolveAddress() ? resolveAddress(host) : host;
        var baseUrl = String.format("%s://%s:%d", service.getScheme(), address, port);
        log.info("Authorization service {} base url is {}", host, baseUrl);
        return new AuthServiceEndpoint(baseUrl, properties.getTimeout());
    }

    private static String resolveAddress(String host) {
        final InetAddress[] addresses;
        try {
            addresses = InetAddress.getAllByName(host);
        } catch (UnknownHostException ex) {
            throw new OauthHttpBridgeException("Unable to resolve authorization service host " + host, ex);
        }
        log.info("Authorization service host {} resolved to {}", host, Arrays.toString(addresses));
        var address = Arrays.stream(addresses)
                .filter(Inet4Address.class::isInstance)
                .findFirst()
                .orElse(addresses[0]);
        return address instanceof Inet6Address
                ? "[" + address.getHostAddress() + "]"
                : address.getHostAddress();
    }

    private static int parsePort(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_AUTH_SERVICE_PORT;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new OauthHttpBridgeException("Invalid " + AUTH_SERVICE_PORT_ENV + " value: " + value, ex);
        }
    }

    private static String firstNonBlank(String... values) {
        return Arrays.stream(values)
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .orElseThrow();
    }
}
