package dev.vality.oauth.http.bridge.auth;

import jakarta.servlet.http.HttpServletRequest;
import lombok.experimental.UtilityClass;
import org.springframework.lang.Nullable;

import static dev.vality.oauth.http.bridge.OauthHeadersConstants.PUBLIC_MARKER_VALUE;
import static dev.vality.oauth.http.bridge.OauthHeadersConstants.X_CALLER_ID;
import static dev.vality.oauth.http.bridge.OauthHeadersConstants.X_CLIENT_ID;
import static dev.vality.oauth.http.bridge.OauthHeadersConstants.X_PUBLIC;

/**
 * Read access to the identity the authentication filter attached to a request. Handlers running behind
 * {@link OauthAuthenticationFilter} use these helpers instead of talking to the authorization service. None of them
 * fail: a missing request or header degrades to {@code 0} (ids) or to the public answer.
 */
@UtilityClass
public class TrustHeaders {

    public static boolean isPublic(@Nullable HttpServletRequest request) {
        if (request == null) {
            return true;
        }
        return PUBLIC_MARKER_VALUE.equals(request.getHeader(X_PUBLIC));
    }

    public static long getCallerId(@Nullable HttpServletRequest request) {
        return readId(request, X_CALLER_ID);
    }

    public static long getClientId(@Nullable HttpServletRequest request) {
        return readId(request, X_CLIENT_ID);
    }

    public static void clear(@Nullable TrustedHeadersRequest request) {
        if (request == null) {
            return;
        }
        request.clearTrustHeaders();
    }

    private static long readId(@Nullable HttpServletRequest request, String headerName) {
        if (request == null) {
            return 0;
        }
        var value = request.getHeader(headerName);
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            return 0;
        }
    }
}
