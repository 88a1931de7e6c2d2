package dev.vality.oauth.http.bridge.token;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Raw answer of the authorization service: the HTTP status and the unparsed body.
 * The body is copied on the way in and out, and compared by content.
 */
public record AccessTokenResponse(int statusCode, byte[] body) {

    public AccessTokenResponse {
        body = body == null ? new byte[0] : body.clone();
    }

    public static AccessTokenResponse of(int statusCode, String body) {
        return new AccessTokenResponse(statusCode, body.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public boolean isError() {
        return statusCode > 299;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof AccessTokenResponse other
                && statusCode == other.statusCode
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(statusCode) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "AccessTokenResponse[statusCode=" + statusCode + ", bodyLength=" + body.length + "]";
    }
}
