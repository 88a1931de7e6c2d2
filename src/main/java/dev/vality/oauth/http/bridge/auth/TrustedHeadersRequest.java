package dev.vality.oauth.http.bridge.auth;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;

import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static dev.vality.oauth.http.bridge.OauthHeadersConstants.X_CALLER_ID;
import static dev.vality.oauth.http.bridge.OauthHeadersConstants.X_CLIENT_ID;

/**
 * Request view whose trust headers ({@code X-Caller-Id}, {@code X-Client-Id}) are owned by the authentication filter.
 * Once {@link #clearTrustHeaders()} has run, values sent by the caller are no longer visible and only values written
 * through {@link #setTrustHeader(String, String)} are reported. Other headers are delegated untouched.
 *
 * <p>Instances belong to one request and are not thread safe.</p>
 */
public class TrustedHeadersRequest extends HttpServletRequestWrapper {

    private static final Set<String> TRUST_HEADERS = Set.of(
            X_CALLER_ID.toLowerCase(Locale.ROOT),
            X_CLIENT_ID.toLowerCase(Locale.ROOT)
    );

    private final Map<String, String> trustHeaders = new LinkedHashMap<>();
    private boolean cleared;

    public TrustedHeadersRequest(HttpServletRequest request) {
        super(request);
    }

    public void clearTrustHeaders() {
        cleared = true;
        trustHeaders.clear();
    }

    public void setTrustHeader(String name, String value) {
        var key = name.toLowerCase(Locale.ROOT);
        if (!TRUST_HEADERS.contains(key)) {
            throw new IllegalArgumentException("Not a trust header: " + name);
        }
        trustHeaders.put(key, value);
    }

    @Override
    public String getHeader(String name) {
        if (!isTrustHeader(name) || !cleared) {
            return super.getHeader(name);
        }
        return trustHeaders.get(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public Enumeration<String> getHeaders(String name) {
        if (!isTrustHeader(name) || !cleared) {
            return super.getHeaders(name);
        }
        var value = trustHeaders.get(name.toLowerCase(Locale.ROOT));
        return value == null ? Collections.emptyEnumeration() : Collections.enumeration(Set.of(value));
    }

    @Override
    public Enumeration<String> getHeaderNames() {
        if (!cleared) {
            return super.getHeaderNames();
        }
        var names = new LinkedHashSet<String>();
        var delegateNames = super.getHeaderNames();
        if (delegateNames != null) {
            while (delegateNames.hasMoreElements()) {
                var name = delegateNames.nextElement();
                if (!isTrustHeader(name)) {
                    names.add(name);
                }
            }
        }
        names.addAll(trustHeaders.keySet());
        return Collections.enumeration(names);
    }

    @Override
    public int getIntHeader(String name) {
        if (!isTrustHeader(name) || !cleared) {
            return super.getIntHeader(name);
        }
        var value = getHeader(name);
        return value == null ? -1 : Integer.parseInt(value);
    }

    private static boolean isTrustHeader(String name) {
        return name != null && TRUST_HEADERS.contains(name.toLowerCase(Locale.ROOT));
    }
}
