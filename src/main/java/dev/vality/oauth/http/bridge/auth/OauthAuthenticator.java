package dev.vality.oauth.http.bridge.auth;

import dev.vality.oauth.http.bridge.exceptions.RestErrorException;
import dev.vality.oauth.http.bridge.token.AccessToken;
import dev.vality.oauth.http.bridge.token.AccessTokenClient;
import dev.vality.oauth.http.bridge.token.AccessTokenExtractor;
import dev.vality.oauth.http.bridge.token.AccessTokenResponseInterpreter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import static dev.vality.oauth.http.bridge.OauthHeadersConstants.X_CALLER_ID;
import static dev.vality.oauth.http.bridge.OauthHeadersConstants.X_CLIENT_ID;
import static dev.vality.oauth.http.bridge.util.TokenMasker.mask;

/**
 * Decides whether a request carries a valid access token and, if it does, attaches the caller and client ids as
 * trust headers. Stateless; one instance serves all requests concurrently.
 */
@Slf4j
@RequiredArgsConstructor
public class OauthAuthenticator {

    private final AccessTokenExtractor accessTokenExtractor;
    private final AccessTokenClient accessTokenClient;
    private final AccessTokenResponseInterpreter responseInterpreter;

    /**
     * Authenticates the request and writes the trust headers on success. Trust headers sent by the caller are always
     * discarded first, so after this call they either are absent or come from the authorization service.
     *
     * <p>Only {@link AuthOutcome.Kind#REJECTED} means the request must be aborted. An absent request, a public
     * request, a missing token and a token unknown to the authorization service all let the request proceed without
     * identity.</p>
     */
    public AuthOutcome authenticate(@Nullable TrustedHeadersRequest request) {
        if (request == null) {
            return AuthOutcome.publicRequest();
        }
        TrustHeaders.clear(request);
        if (TrustHeaders.isPublic(request)) {
            return AuthOutcome.publicRequest();
        }
        var tokenId = extractTokenId(request);
        if (tokenId.isEmpty()) {
            return AuthOutcome.noToken();
        }
        final AccessToken accessToken;
        try {
            accessToken = responseInterpreter.interpret(accessTokenClient.getAccessToken(tokenId));
        } catch (RestErrorException ex) {
            var restError = ex.getRestError();
            if (restError.isNotFound()) {
                log.debug("Access token {} is unknown, proceeding unauthenticated", mask(tokenId));
                return AuthOutcome.noToken();
            }
            log.warn("Access token {} rejected: [{}] {}", mask(tokenId), restError.status(), restError.message());
            return AuthOutcome.rejected(restError);
        }
        request.setTrustHeader(X_CALLER_ID, String.valueOf(accessToken.userId()));
        request.setTrustHeader(X_CLIENT_ID, String.valueOf(accessToken.clientId()));
        return AuthOutcome.authenticated(accessToken);
    }

    private String extractTokenId(TrustedHeadersRequest request) {
        var tokenId = accessTokenExtractor.extractTokenId(request);
        return tokenId == null ? "" : tokenId.trim();
    }
}
