package dev.vality.oauth.http.bridge.token;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class QueryParamAccessTokenExtractor implements AccessTokenExtractor {

    private final String parameterName;

    @Override
    public String extractTokenId(HttpServletRequest request) {
        return request.getParameter(parameterName);
    }
}
