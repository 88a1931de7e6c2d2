package dev.vality.oauth.http.bridge.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vality.oauth.http.bridge.properties.OauthProperties;
import dev.vality.oauth.http.bridge.token.RestError;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.FilterChain;
import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static dev.vality.oauth.http.bridge.util.TokenMasker.mask;

/**
 * Runs {@link OauthAuthenticator} for every matching request. Rejected requests are answered with the
 * {@link RestError} as JSON and never reach the rest of the chain; all other requests continue with a
 * {@link TrustedHeadersRequest} whose trust headers come from the authorization service only.
 */
@Slf4j
@RequiredArgsConstructor
public final class OauthAuthenticationFilter extends OncePerRequestFilter {

    public static final String ACCESS_TOKEN_ATTRIBUTE = "oauthAccessToken";

    private static final Set<String> SENSITIVE_HEADERS = Set.of(
            HttpHeaders.AUTHORIZATION.toLowerCase(Locale.ROOT),
            HttpHeaders.COOKIE.toLowerCase(Locale.ROOT),
            HttpHeaders.SET_COOKIE.toLowerCase(Locale.ROOT)
    );

    private final OauthProperties oauthProperties;
    private final OauthAuthenticator oauthAuthenticator;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !oauthProperties.appliesTo(request.getLocalPort(), getOriginalRequestPath(request));
    }

    @Override
    protected boolean shouldNotFilterErrorDispatch() {
        return false;
    }

    @Override
    @SuppressWarnings("NullableProblems")
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        if (request.getDispatcherType() == DispatcherType.ERROR) {
            continueWithoutIdentity(request, response, filterChain);
            return;
        }
        logReceived(request);
        var trustedRequest = new TrustedHeadersRequest(request);
        var outcome = oauthAuthenticator.authenticate(trustedRequest);
        if (outcome.isRejected()) {
            respondWithError(response, getRequestPath(request), outcome.error());
            return;
        }
        if (outcome.token() != null) {
            trustedRequest.setAttribute(ACCESS_TOKEN_ATTRIBUTE, outcome.token());
        }
        filterChain.doFilter(trustedRequest, response);
        logSent(request, response, outcome);
    }

    @Override
    @SuppressWarnings("NullableProblems")
    protected void doFilterNestedErrorDispatch(HttpServletRequest request, HttpServletResponse response,
                                               FilterChain filterChain) throws ServletException, IOException {
        continueWithoutIdentity(request, response, filterChain);
    }

    /**
     * Error pages are rendered from the container's own request, which still carries the caller's trust headers.
     * They are hidden here without a second lookup.
     */
    private void continueWithoutIdentity(HttpServletRequest request, HttpServletResponse response,
                                         FilterChain filterChain) throws ServletException, IOException {
        if (request instanceof TrustedHeadersRequest) {
            filterChain.doFilter(request, response);
            return;
        }
        var trustedRequest = new TrustedHeadersRequest(request);
        trustedRequest.clearTrustHeaders();
        log.debug("Error dispatch for {} continues without identity", getOriginalRequestPath(request));
        filterChain.doFilter(trustedRequest, response);
    }

    private void respondWithError(HttpServletResponse response, String requestPath, RestError restError)
            throws IOException {
        var status = toHttpStatus(restError.status());
        log.warn("<- Sent [{} {}]: {}", status, requestPath, restError.message());
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getOutputStream().write(objectMapper.writeValueAsBytes(restError));
        response.flushBuffer();
    }

    static int toHttpStatus(int status) {
        return status >= 100 && status <= 599 ? status : HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
    }

    private void logReceived(HttpServletRequest request) {
        log.info("-> Received {} {} | params: {}, headers: {}", request.getMethod(), getRequestPath(request),
                extractParams(request), sanitizeHeaders(request));
    }

    private void logSent(HttpServletRequest request, HttpServletResponse response, AuthOutcome outcome) {
        log.info("<- Sent {} {} | status: {}, auth: {}", request.getMethod(), getRequestPath(request),
                response.getStatus(), outcome.kind());
    }

    private String extractParams(HttpServletRequest request) {
        var tokenParam = oauthProperties.getAccessTokenParam();
        return request.getParameterMap().entrySet().stream()
                .map(entry -> entry.getKey() + "=" + (tokenParam.equals(entry.getKey())
                        ? mask(String.join(",", entry.getValue()))
                        : String.join(",", entry.getValue())))
                .collect(Collectors.joining(", "));
    }

    private static Map<String, String> sanitizeHeaders(HttpServletRequest request) {
        var headers = new LinkedHashMap<String, String>();
        var headerNames = request.getHeaderNames();
        if (headerNames != null) {
            while (headerNames.hasMoreElements()) {
                var name = headerNames.nextElement();
                var value = request.getHeader(name);
                if (value != null) {
                    headers.put(name, isSensitive(name) ? "***" : value);
                }
            }
        }
        return headers;
    }

    private static boolean isSensitive(String headerName) {
        return SENSITIVE_HEADERS.contains(headerName.toLowerCase(Locale.ROOT));
    }

    private static String getOriginalRequestPath(HttpServletRequest request) {
        if (request.getDispatcherType() == DispatcherType.ERROR
                && request.getAttribute(RequestDispatcher.ERROR_REQUEST_URI) instanceof String errorRequestUri) {
            return errorRequestUri;
        }
        return getRequestPath(request);
    }

    public static String getRequestPath(HttpServletRequest request) {
        var servletPath = request.getServletPath();
        if (servletPath != null && !servletPath.isBlank()) {
            return servletPath;
        }
        var requestPath = request.getRequestURI();
        if (requestPath != null && !requestPath.isBlank()) {
            return requestPath;
        }
        return "";
    }
}
