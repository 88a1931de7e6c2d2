package dev.vality.oauth.http.bridge.auth;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.Collections;
import java.util.List;

import static dev.vality.oauth.http.bridge.OauthHeadersConstants.X_CALLER_ID;
import static dev.vality.oauth.http.bridge.OauthHeadersConstants.X_CLIENT_ID;
import static org.junit.jupiter.api.Assertions.*;

class TrustedHeadersRequestTest {

    @Test
    void shouldDelegateBeforeClearing() {
        var request = new MockHttpServletRequest();
        request.addHeader(X_CALLER_ID, "1");

        var trustedRequest = new TrustedHeadersRequest(request);

        assertEquals("1", trustedRequest.getHeader(X_CALLER_ID));
    }

    @Test
    void shouldHideInboundTrustHeadersAfterClearing() {
        var request = new MockHttpServletRequest();
        request.addHeader(X_CALLER_ID, "1");
        request.addHeader("x-client-id", "2");
        request.addHeader("Accept", "application/json");
        var trustedRequest = new TrustedHeadersRequest(request);

        trustedRequest.clearTrustHeaders();

        assertNull(trustedRequest.getHeader("x-caller-id"));
        assertNull(trustedRequest.getHeader(X_CLIENT_ID));
        assertFalse(trustedRequest.getHeaders(X_CALLER_ID).hasMoreElements());
        assertEquals(-1, trustedRequest.getIntHeader(X_CALLER_ID));
        assertEquals(List.of("Accept"), Collections.list(trustedRequest.getHeaderNames()));
        assertEquals("application/json", trustedRequest.getHeader("Accept"));
    }

    @Test
    void shouldExposeWrittenTrustHeaders() {
        var request = new MockHttpServletRequest();
        request.addHeader(X_CALLER_ID, "1");
        var trustedRequest = new TrustedHeadersRequest(request);

        trustedRequest.clearTrustHeaders();
        trustedRequest.setTrustHeader(X_CALLER_ID, "10");
        trustedRequest.setTrustHeader(X_CLIENT_ID, "5");

        assertEquals("10", trustedRequest.getHeader(X_CALLER_ID));
        assertEquals("5", trustedRequest.getHeader("X-CLIENT-ID"));
        assertEquals(10, trustedRequest.getIntHeader(X_CALLER_ID));
        assertEquals(List.of("10"), Collections.list(trustedRequest.getHeaders(X_CALLER_ID)));
        assertTrue(Collections.list(trustedRequest.getHeaderNames()).containsAll(List.of("x-caller-id", "x-client-id")));
    }

    @Test
    void shouldRefuseNonTrustHeaders() {
        var trustedRequest = new TrustedHeadersRequest(new MockHttpServletRequest());

        assertThrows(IllegalArgumentException.class, () -> trustedRequest.setTrustHeader("X-Public", "true"));
    }
}
