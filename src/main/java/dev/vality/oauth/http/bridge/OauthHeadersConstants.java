package dev.vality.oauth.http.bridge;

public class OauthHeadersConstants {

    public static final String X_PUBLIC = "X-Public";
    public static final String X_CALLER_ID = "X-Caller-Id";
    public static final String X_CLIENT_ID = "X-Client-Id";

    public static final String PUBLIC_MARKER_VALUE = "true";

    public static final String ACCESS_TOKEN_PARAM = "access_token";

    public static final String ACCESS_TOKEN_PATH = "/oauth/access_token/{tokenId}";

    public static final String AUTH_SERVICE_HOST_ENV = "AUTH_SERVICE_HOST";
    public static final String AUTH_SERVICE_PORT_ENV = "AUTH_SERVICE_PORT";
    public static final String DEFAULT_AUTH_SERVICE_HOST = "localhost";
    public static final int DEFAULT_AUTH_SERVICE_PORT = 8080;

    private OauthHeadersConstants() {
    }
}
