package com.subradar.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical forms of raw statement merchant text, used only as grouping and lookup keys.
 */
public final class MerchantNormalizer {

    private static final Pattern WALLET_PREFIX = Pattern.compile("^\\s*(?:aplpay|gglpay)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern CORPORATE_SUFFIX = Pattern.compile(
            "\\s+(?:inc\\.?|llc|ltd\\.?|corp\\.?|limited|subscription|membership|mem)(?=\\W|$).*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern STORE_NUMBER = Pattern.compile("[#*]\\s*\\d+");
    private static final Pattern LOCATION_CLAUSE = Pattern.compile("\\s+(?:in|at)\\s+.*$", Pattern.CASE_INSENSITIVE);
    // Upper-case only: "NY", "CA" after the merchant name
    private static final Pattern STATE_CODE = Pattern.compile("\\s+[A-Z]{2}(?=\\s|$)");

    private MerchantNormalizer() {
    }

    /**
     * Lowercase and keep letters and digits only. Null or empty input yields "".
     */
    public static String normalize(String rawMerchant) {
        if (rawMerchant == null || rawMerchant.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(rawMerchant.length());
        rawMerchant.toLowerCase(Locale.ROOT).codePoints()
                .filter(Character::isLetterOrDigit)
                .forEach(sb::appendCodePoint);
        return sb.toString();
    }

    /**
     * Strips card-statement noise (wallet prefixes, corporate suffixes, store numbers, locations,
     * state codes) before normalizing. Falls back to {@link #normalize(String)} when nothing is left.
     */
    public static String canonicalize(String rawMerchant) {
        if (rawMerchant == null || rawMerchant.isBlank()) {
            return "";
        }
        String s = WALLET_PREFIX.matcher(rawMerchant).replaceFirst("");
        s = CORPORATE_SUFFIX.matcher(s).replaceFirst("");
        s = STORE_NUMBER.matcher(s).replaceAll(" ");
        s = LOCATION_CLAUSE.matcher(s).replaceFirst("");
        s = STATE_CODE.matcher(s).replaceAll(" ");
        String key = normalize(s).replace("amzn", "amazon");
        return key.isEmpty() ? normalize(rawMerchant) : key;
    }
}
