package dev.vality.oauth.http.bridge.token;

import dev.vality.oauth.http.bridge.properties.AuthServiceEndpoint;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;
import io.opentelemetry.semconv.HttpAttributes;
import io.opentelemetry.semconv.ServerAttributes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static dev.vality.oauth.http.bridge.OauthHeadersConstants.ACCESS_TOKEN_PATH;
import static dev.vality.oauth.http.bridge.util.TokenMasker.mask;

/**
 * Blocking {@link AccessTokenClient} over Spring {@link RestClient}. The whole exchange, body included, is bounded
 * by the endpoint timeout: a lookup that does not finish in time is abandoned and reported as no response.
 */
@Slf4j
public class RestAccessTokenClient implements AccessTokenClient, AutoCloseable {

    private static final String INSTRUMENTATION_NAME = "dev.vality.oauth-http-bridge";
    private static final String SPAN_NAME = "GET /oauth/access_token";
    private static final int BUFFER_SIZE = 4096;

    private final RestClient restClient;
    private final String serverAddress;
    private final Duration timeout;
    private final ExecutorService lookupExecutor;

    public RestAccessTokenClient(AuthServiceEndpoint endpoint) {
        this(RestClient.builder().requestFactory(requestFactory(endpoint)), endpoint);
    }

    public RestAccessTokenClient(RestClient.Builder restClientBuilder, AuthServiceEndpoint endpoint) {
        this.restClient = restClientBuilder
                .baseUrl(endpoint.baseUrl())
                .build();
        this.serverAddress = URI.create(endpoint.baseUrl()).getHost();
        this.timeout = endpoint.timeout();
        var threadFactory = new CustomizableThreadFactory("oauth-token-lookup-");
        threadFactory.setDaemon(true);
        this.lookupExecutor = Executors.newCachedThreadPool(threadFactory);
    }

    @Override
    @Nullable
    public AccessTokenResponse getAccessToken(String tokenId) {
        var span = GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME)
                .spanBuilder(SPAN_NAME)
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute(HttpAttributes.HTTP_REQUEST_METHOD, HttpMethod.GET.name())
                .setAttribute(ServerAttributes.SERVER_ADDRESS, serverAddress)
                .startSpan();
        try (var ignored = span.makeCurrent()) {
            var response = exchangeWithinTimeout(tokenId);
            recordStatus(span, response);
            log.debug("Access token {} lookup answered with {}", mask(tokenId), response);
            return response;
        } catch (RestClientException | TimeoutException ex) {
            log.warn("Access token {} lookup got no response from {} within {}", mask(tokenId), serverAddress,
                    timeout, ex);
            span.recordException(ex);
            span.setStatus(StatusCode.ERROR);
            return null;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Access token {} lookup was interrupted", mask(tokenId));
            span.recordException(ex);
            span.setStatus(StatusCode.ERROR);
            return null;
        } finally {
            span.end();
        }
    }

    @Override
    public void close() {
        lookupExecutor.shutdownNow();
    }

    private AccessTokenResponse exchangeWithinTimeout(String tokenId) throws TimeoutException, InterruptedException {
        var deadline = System.nanoTime() + timeout.toNanos();
        Callable<AccessTokenResponse> lookup = () -> restClient.get()
                .uri(ACCESS_TOKEN_PATH, tokenId)
                .accept(MediaType.APPLICATION_JSON)
                .exchange((request, clientResponse) -> readResponse(clientResponse, deadline));
        var future = lookupExecutor.submit(Context.current().wrap(lookup));
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException | InterruptedException ex) {
            future.cancel(true);
            throw ex;
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Access token lookup failed", ex.getCause());
        }
    }

    private static AccessTokenResponse readResponse(ClientHttpResponse clientResponse, long deadline)
            throws IOException {
        var statusCode = clientResponse.getStatusCode().value();
        try {
            return new AccessTokenResponse(statusCode, readBody(clientResponse, deadline));
        } catch (InterruptedIOException ex) {
            throw ex;
        } catch (IOException ex) {
            if (statusCode <= 299) {
                throw ex;
            }
            // HttpURLConnection has no error stream for bodiless error answers
            log.debug("Error answer {} carried no readable body", statusCode, ex);
            return new AccessTokenResponse(statusCode, null);
        }
    }

    private static byte[] readBody(ClientHttpResponse clientResponse, long deadline) throws IOException {
        var body = new ByteArrayOutputStream();
        var buffer = new byte[BUFFER_SIZE];
        try (var inputStream = clientResponse.getBody()) {
            int read;
            while ((read = inputStream.read(buffer)) != -1) {
                if (System.nanoTime() > deadline || Thread.currentThread().isInterrupted()) {
                    throw new InterruptedIOException("Access token response body not read in time");
                }
                body.write(buffer, 0, read);
            }
        }
        return body.toByteArray();
    }

    private static void recordStatus(Span span, AccessTokenResponse response) {
        span.setAttribute(HttpAttributes.HTTP_RESPONSE_STATUS_CODE, (long) response.statusCode());
        span.setStatus(response.statusCode() >= 500 ? StatusCode.ERROR : StatusCode.UNSET);
    }

    private static SimpleClientHttpRequestFactory requestFactory(AuthServiceEndpoint endpoint) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        var timeoutMillis = (int) endpoint.timeout().toMillis();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);
        return requestFactory;
    }
}
