package dev.vality.oauth.http.bridge.token;

import org.springframework.lang.Nullable;

/**
 * Blocking lookup of an access token by its id against the authorization service.
 *
 * <p>Implementations report every received answer, including error statuses, as an {@link AccessTokenResponse} and
 * return {@code null} when nothing was received at all (connection refused, timeout, broken stream). They do not
 * throw for transport failures so that {@link AccessTokenResponseInterpreter} can classify all outcomes.</p>
 */
public interface AccessTokenClient {

    @Nullable
    AccessTokenResponse getAccessToken(String tokenId);
}
