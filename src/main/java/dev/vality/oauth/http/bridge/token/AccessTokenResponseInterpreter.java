package dev.vality.oauth.http.bridge.token;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import dev.vality.oauth.http.bridge.exceptions.RestErrorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.io.IOException;

/**
 * Classifies one {@link AccessTokenResponse} into an {@link AccessToken} or a {@link RestError}.
 *
 * <p>Bodies are decoded strictly: a string is never accepted where a number is expected and vice versa, fractional
 * numbers are not truncated into ids, and required fields must be present. Unknown fields are ignored and field names
 * match regardless of case. A body that does not fit the agreed schema is a contract violation between the two
 * services and is reported as an internal server error rather than passed through.</p>
 */
@Slf4j
public class AccessTokenResponseInterpreter {

    static final String INVALID_RESPONSE = "invalid response";
    static final String CONTRACT_ERROR = "contract error";
    static final String INVALID_RESPONSE_MESSAGE = "invalid restclient response when trying to get access token";
    static final String INVALID_ERROR_MESSAGE = "invalid error interface when trying to get access token";
    static final String INVALID_TOKEN_MESSAGE = "error when trying to unmarshal access token response";

    private final ObjectReader restErrorReader;
    private final ObjectReader accessTokenReader;

    public AccessTokenResponseInterpreter() {
        var mapper = JsonMapper.builder()
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .build();
        mapper.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        this.restErrorReader = mapper.readerFor(RestError.class);
        this.accessTokenReader = mapper.readerFor(AccessToken.class);
    }

    public AccessToken interpret(@Nullable AccessTokenResponse response) {
        if (response == null) {
            throw new RestErrorException(RestError.internalServerError(INVALID_RESPONSE_MESSAGE, INVALID_RESPONSE));
        }
        if (response.isError()) {
            throw new RestErrorException(decodeRestError(response));
        }
        return decodeAccessToken(response);
    }

    private RestError decodeRestError(AccessTokenResponse response) {
        try {
            RestError restError = restErrorReader.readValue(response.body());
            if (restError == null) {
                throw new IOException("Error body is null");
            }
            return restError;
        } catch (IOException ex) {
            log.warn("Authorization service answered {} with an unexpected error body", response.statusCode(), ex);
            throw new RestErrorException(RestError.internalServerError(INVALID_ERROR_MESSAGE, CONTRACT_ERROR), ex);
        }
    }

    private AccessToken decodeAccessToken(AccessTokenResponse response) {
        try {
            AccessToken accessToken = accessTokenReader.readValue(response.body());
            if (accessToken == null) {
                throw new IOException("Access token body is null");
            }
            return accessToken;
        } catch (IOException ex) {
            log.warn("Authorization service answered {} with an unexpected access token body",
                    response.statusCode(), ex);
            throw new RestErrorException(RestError.internalServerError(INVALID_TOKEN_MESSAGE, CONTRACT_ERROR), ex);
        }
    }
}
