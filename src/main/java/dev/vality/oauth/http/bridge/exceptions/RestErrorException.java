package dev.vality.oauth.http.bridge.exceptions;

import dev.vality.oauth.http.bridge.token.RestError;
import lombok.Getter;

/**
 * Carries a {@link RestError} from the access token lookup to the authenticator, which decides whether the error
 * rejects the request.
 */
@Getter
public class RestErrorException extends OauthHttpBridgeException {

    private final RestError restError;

    public RestErrorException(RestError restError) {
        super(restError.message());
        this.restError = restError;
    }

    public RestErrorException(RestError restError, Throwable cause) {
        super(restError.message(), cause);
        this.restError = restError;
    }
}
