package com.payment.gateway.compliance;

import java.util.regex.Pattern;

/**
 * Redacts credentials and buyer payment codes so request and response data is safe to log.
 */
public final class SensitiveDataMasker {

    private static final String MASK = "****";
    private static final Pattern SIGN_PARAMETER = Pattern.compile("(^|&)(sign=)[^&]*");
    private static final Pattern AUTH_CODE_JSON = Pattern.compile("(\"auth_code\"\\s*:\\s*\")[^\"]*?([^\"]{0,4})(\")");
    private static final Pattern AUTH_CODE_ENCODED = Pattern.compile("(%22auth_code%22%3A%22)[^%]*?([^%]{0,4})(%22)");

    private SensitiveDataMasker() {}

    /** Keeps the first 6 characters of a signature, enough to correlate log lines. */
    public static String maskSignature(String sign) {
        if (sign == null || sign.isBlank()) return null;
        return sign.length() <= 6 ? MASK : sign.substring(0, 6) + MASK;
    }

    /** Keeps the last 4 digits of a buyer payment code. */
    public static String maskAuthCode(String authCode) {
        if (authCode == null || authCode.isBlank()) return null;
        return authCode.length() <= 4 ? MASK : MASK + authCode.substring(authCode.length() - 4);
    }

    /**
     * Masks the {@code sign} parameter and any buyer auth code inside {@code biz_content}
     * of a URL-encoded parameter string.
     */
    public static String maskParameters(String parameters) {
        if (parameters == null) return null;
        String masked = SIGN_PARAMETER.matcher(parameters).replaceAll("$1$2" + MASK);
        masked = AUTH_CODE_ENCODED.matcher(masked).replaceAll("$1" + MASK + "$2$3");
        return AUTH_CODE_JSON.matcher(masked).replaceAll("$1" + MASK + "$2$3");
    }
}
