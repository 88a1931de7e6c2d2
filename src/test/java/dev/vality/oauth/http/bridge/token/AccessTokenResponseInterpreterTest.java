package dev.vality.oauth.http.bridge.token;

import dev.vality.oauth.http.bridge.exceptions.RestErrorException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.vality.oauth.http.bridge.token.AccessTokenResponseInterpreter.*;
import static org.junit.jupiter.api.Assertions.*;

class AccessTokenResponseInterpreterTest {

    private final AccessTokenResponseInterpreter interpreter = new AccessTokenResponseInterpreter();

    @Test
    void shouldReportInvalidResponseWhenNothingReceived() {
        var restError = interpretError(null);

        assertEquals(500, restError.status());
        assertEquals(INVALID_RESPONSE_MESSAGE, restError.message());
        assertEquals("internal_server_error", restError.error());
        assertEquals(List.of("invalid response"), restError.causes());
    }

    @Test
    void shouldReportContractErrorWhenErrorStatusIsNotNumber() {
        var response = AccessTokenResponse.of(400, """
                {
                  "Message": "Bad Request",
                  "Status": "400",
                  "Error": "API params wrong"
                }
                """);

        var restError = interpretError(response);

        assertEquals(500, restError.status());
        assertEquals(INVALID_ERROR_MESSAGE, restError.message());
        assertEquals("internal_server_error", restError.error());
        assertEquals(List.of("contract error"), restError.causes());
    }

    @Test
    void shouldReportContractErrorWhenErrorBodyIsNotJson() {
        var response = AccessTokenResponse.of(502, "<html>Bad Gateway</html>");

        var restError = interpretError(response);

        assertEquals(500, restError.status());
        assertEquals(List.of(CONTRACT_ERROR), restError.causes());
    }

    @Test
    void shouldReportContractErrorWhenErrorBodyIsEmpty() {
        var restError = interpretError(new AccessTokenResponse(404, null));

        assertEquals(500, restError.status());
        assertEquals(INVALID_ERROR_MESSAGE, restError.message());
    }

    @Test
    void shouldReportContractErrorWhenErrorBodyMissesStatus() {
        var restError = interpretError(AccessTokenResponse.of(400, "{\"message\": \"Bad Request\"}"));

        assertEquals(500, restError.status());
        assertEquals(List.of(CONTRACT_ERROR), restError.causes());
    }

    @Test
    void shouldPropagateWellFormedRemoteError() {
        var response = AccessTokenResponse.of(400, """
                {
                  "Message": "Bad Request",
                  "Status": 400,
                  "Error": "API params wrong"
                }
                """);

        var restError = interpretError(response);

        assertEquals(400, restError.status());
        assertEquals("Bad Request", restError.message());
        assertEquals("API params wrong", restError.error());
        assertTrue(restError.causes().isEmpty());
    }

    @Test
    void shouldPropagateRemoteErrorCauses() {
        var response = AccessTokenResponse.of(503, """
                {"message": "database down", "status": 503, "error": "service_unavailable",
                 "causes": ["connection refused"], "trace": "ignored"}
                """);

        var restError = interpretError(response);

        assertEquals(503, restError.status());
        assertEquals(List.of("connection refused"), restError.causes());
    }

    @Test
    void shouldPropagateNotFoundAsRemoteError() {
        var response = AccessTokenResponse.of(404, """
                {"message": "access token not found", "status": 404, "error": "not_found"}
                """);

        var restError = interpretError(response);

        assertTrue(restError.isNotFound());
        assertEquals("access token not found", restError.message());
    }

    @Test
    void shouldReportContractErrorWhenTokenIdsAreStrings() {
        var response = AccessTokenResponse.of(200, "{\"id\": \"1\",\"user_id\": \"10\",\"client_id\": \"5\"}");

        var restError = interpretError(response);

        assertEquals(500, restError.status());
        assertEquals(INVALID_TOKEN_MESSAGE, restError.message());
        assertEquals("internal_server_error", restError.error());
        assertEquals(List.of("contract error"), restError.causes());
    }

    @Test
    void shouldReportContractErrorWhenTokenFieldIsMissing() {
        var restError = interpretError(AccessTokenResponse.of(200, "{\"id\": \"1\",\"user_id\": 10}"));

        assertEquals(INVALID_TOKEN_MESSAGE, restError.message());
    }

    @Test
    void shouldReportContractErrorWhenTokenIdIsFractional() {
        var restError = interpretError(
                AccessTokenResponse.of(200, "{\"id\": \"1\",\"user_id\": 10.5,\"client_id\": 5}"));

        assertEquals(INVALID_TOKEN_MESSAGE, restError.message());
    }

    @Test
    void shouldReportContractErrorWhenTokenBodyIsNull() {
        var restError = interpretError(AccessTokenResponse.of(200, "null"));

        assertEquals(INVALID_TOKEN_MESSAGE, restError.message());
    }

    @Test
    void shouldDecodeAccessToken() {
        var response = AccessTokenResponse.of(200, "{\"id\": \"1\",\"user_id\": 10,\"client_id\": 5}");

        var accessToken = interpreter.interpret(response);

        assertEquals(new AccessToken("1", 10, 5), accessToken);
    }

    @Test
    void shouldIgnoreUnknownTokenFields() {
        var response = AccessTokenResponse.of(201,
                "{\"id\": \"abc\",\"user_id\": 7,\"client_id\": 3,\"expires\": 1700000000}");

        var accessToken = interpreter.interpret(response);

        assertEquals("abc", accessToken.id());
        assertEquals(7, accessToken.userId());
        assertEquals(3, accessToken.clientId());
    }

    private RestError interpretError(AccessTokenResponse response) {
        var ex = assertThrows(RestErrorException.class, () -> interpreter.interpret(response));
        return ex.getRestError();
    }
}
