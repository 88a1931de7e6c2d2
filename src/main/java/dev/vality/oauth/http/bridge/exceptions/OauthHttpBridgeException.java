package dev.vality.oauth.http.bridge.exceptions;

public class OauthHttpBridgeException extends RuntimeException {

    public OauthHttpBridgeException(String message) {
        super(message);
    }

    public OauthHttpBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
