package dev.vality.oauth.http.bridge.auth;

import dev.vality.oauth.http.bridge.token.AccessToken;
import dev.vality.oauth.http.bridge.token.RestError;
import org.springframework.lang.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of authenticating one request.
 *
 * @param kind  what the authenticator decided
 * @param token the resolved token, present for {@link Kind#AUTHENTICATED} only
 * @param error the typed error, present for {@link Kind#REJECTED} only
 */
public record AuthOutcome(Kind kind, @Nullable AccessToken token, @Nullable RestError error) {

    private static final AuthOutcome PUBLIC = new AuthOutcome(Kind.PUBLIC, null, null);
    private static final AuthOutcome NO_TOKEN = new AuthOutcome(Kind.NO_TOKEN, null, null);

    public AuthOutcome {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public enum Kind {
        /**
         * The request is public or absent; no identity is attached.
         */
        PUBLIC,
        /**
         * No usable credential was presented, or the authorization service does not know it. The request proceeds
         * unauthenticated.
         */
        NO_TOKEN,
        /**
         * The token was resolved and the trust headers were written.
         */
        AUTHENTICATED,
        /**
         * Resolution failed; the request must not be processed further.
         */
        REJECTED
    }

    public static AuthOutcome publicRequest() {
        return PUBLIC;
    }

    public static AuthOutcome noToken() {
        return NO_TOKEN;
    }

    public static AuthOutcome authenticated(AccessToken token) {
        return new AuthOutcome(Kind.AUTHENTICATED, Objects.requireNonNull(token, "token must not be null"), null);
    }

    public static AuthOutcome rejected(RestError error) {
        return new AuthOutcome(Kind.REJECTED, null, Objects.requireNonNull(error, "error must not be null"));
    }

    public Optional<RestError> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isRejected() {
        return kind == Kind.REJECTED;
    }
}
