package dev.vality.oauth.http.bridge.token;

import com.sun.net.httpserver.HttpServer;
import dev.vality.oauth.http.bridge.properties.AuthServiceEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RestAccessTokenClientHttpServerTest {

    private static final String TOKEN_BODY = "{\"id\": \"5\",\"user_id\": 10,\"client_id\": 5}";

    private HttpServer server;
    private RestAccessTokenClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/oauth/access_token/fast", exchange -> {
            var body = TOKEN_BODY.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        server.createContext("/oauth/access_token/slow", exchange -> {
            var body = TOKEN_BODY.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (var outputStream = exchange.getResponseBody()) {
                for (byte b : body) {
                    outputStream.write(b);
                    outputStream.flush();
                    Thread.sleep(100);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } catch (IOException ex) {
                // client went away
            }
        });
        server.createContext("/oauth/access_token/bodiless", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.start();
        var baseUrl = "http://" + server.getAddress().getHostString() + ":" + server.getAddress().getPort();
        client = new RestAccessTokenClient(new AuthServiceEndpoint(baseUrl, Duration.ofMillis(200)));
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.stop(0);
    }

    @Test
    void shouldReadFastResponse() {
        var response = client.getAccessToken("fast");

        assertNotNull(response);
        assertEquals(200, response.statusCode());
        assertEquals(TOKEN_BODY, new String(response.body(), StandardCharsets.UTF_8));
    }

    @Test
    void shouldGiveUpOnSlowBodyWithinTimeout() {
        var started = System.nanoTime();

        var response = client.getAccessToken("slow");

        var elapsed = Duration.ofNanos(System.nanoTime() - started);
        assertNull(response);
        assertTrue(elapsed.compareTo(Duration.ofMillis(1000)) < 0, "lookup took " + elapsed);
    }

    @Test
    void shouldReadBodilessErrorAsEmptyBody() {
        var response = client.getAccessToken("bodiless");

        assertNotNull(response);
        assertEquals(404, response.statusCode());
        assertEquals(0, response.body().length);
    }
}
