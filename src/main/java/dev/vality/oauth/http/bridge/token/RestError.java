package dev.vality.oauth.http.bridge.token;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Error body shared by the services of the mesh. The authorization service answers failed lookups with it and the
 * authentication filter writes it back when a request is rejected.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RestError(@JsonProperty("message") String message,
                        @JsonProperty(value = "status", required = true) int status,
                        @JsonProperty("error") String error,
                        @JsonProperty("causes") List<String> causes) {

    public static final int NOT_FOUND = 404;
    public static final int INTERNAL_SERVER_ERROR = 500;

    public RestError {
        causes = causes == null ? List.of() : List.copyOf(causes);
    }

    public static RestError internalServerError(String message, String cause) {
        return new RestError(message, INTERNAL_SERVER_ERROR, "internal_server_error", List.of(cause));
    }

    public boolean isNotFound() {
        return status == NOT_FOUND;
    }
}
