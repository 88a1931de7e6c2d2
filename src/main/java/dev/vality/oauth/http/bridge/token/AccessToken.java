package dev.vality.oauth.http.bridge.token;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AccessToken(@JsonProperty(value = "id", required = true) String id,
                          @JsonProperty(value = "user_id", required = true) long userId,
                          @JsonProperty(value = "client_id", required = true) long clientId) {
}
