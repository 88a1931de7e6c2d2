package dev.vality.oauth.http.bridge.token;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Strategy used by {@code OauthAuthenticator} to find the access token id presented by the caller. The starter ships
 * with {@link QueryParamAccessTokenExtractor}, which reads the {@code access_token} query parameter, as in
 * {@code GET /users/1?access_token=123abc}. Applications may register their own bean to read the id from another
 * place.
 *
 * <p>Example implementations:</p>
 * <ul>
 *     <li><strong>HTTP header:</strong>
 *     <pre>{@code
 *     @Component
 *     class HeaderAccessTokenExtractor implements AccessTokenExtractor {
 *         @Override
 *         public String extractTokenId(HttpServletRequest request) {
 *             return request.getHeader("X-Access-Token");
 *         }
 *     }
 *     }</pre>
 *     </li>
 *     <li><strong>Path segment:</strong>
 *     <pre>{@code
 *     @Component
 *     class PathAccessTokenExtractor implements AccessTokenExtractor {
 *         @Override
 *         public String extractTokenId(HttpServletRequest request) {
 *             return request.getRequestURI().substring(request.getRequestURI().lastIndexOf('/') + 1);
 *         }
 *     }
 *     }</pre>
 *     </li>
 * </ul>
 *
 * <p>The returned value may be {@code null} or blank; the authenticator trims it and treats an empty id as "no token
 * presented".</p>
 */
public interface AccessTokenExtractor {

    String extractTokenId(HttpServletRequest request);
}
