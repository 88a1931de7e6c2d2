package dev.vality.oauth.http.bridge.util;

import lombok.experimental.UtilityClass;

@UtilityClass
public class TokenMasker {

    private static final int VISIBLE_PREFIX_LENGTH = 4;
    private static final String MASK = "***";

    public static String mask(String token) {
        if (token == null || token.isEmpty()) {
            return "";
        }
        if (token.length() <= VISIBLE_PREFIX_LENGTH) {
            return MASK;
        }
        return token.substring(0, VISIBLE_PREFIX_LENGTH) + MASK;
    }
}
