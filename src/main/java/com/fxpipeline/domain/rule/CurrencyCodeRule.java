package com.fxpipeline.domain.rule;

import java.util.Locale;
import java.util.Set;

/**
 * Checks whether a currency code is usable.
 */
public final class CurrencyCodeRule {

    // Most traded ISO 4217 codes
    private static final Set<String> KNOWN_CURRENCIES = Set.of(
            "USD", "EUR", "JPY", "GBP", "AUD", "CAD", "CHF", "CNY", "SEK", "NZD",
            "MXN", "SGD", "HKD", "NOK", "KRW", "TRY", "RUB", "INR", "BRL", "ZAR",
            "DKK", "PLN", "TWD", "THB", "IDR", "HUF", "CZK", "ILS", "CLP", "PHP",
            "AED", "COP", "SAR", "MYR", "RON", "PEN", "PKR", "EGP", "VND", "QAR",
            "KWD", "BHD", "OMR", "JOD", "LBP", "TND", "DZD", "MAD", "IQD", "LYD",
            "AOA", "BWP", "GHS", "KES", "MUR", "NAD", "NGN", "SCR", "TZS", "UGX",
            "XAF", "XOF", "ZMW", "ETB", "MZN", "RWF", "XCD", "BBD", "BZD", "BMD",
            "BND", "KYD", "GYD", "JMD", "SRD", "TTD", "BSD", "CUP", "DOP", "GTQ",
            "HNL", "HTG", "NIO", "PAB", "PYG", "UYU", "BOB", "CRC", "SVC", "AWG",
            "ANG", "FJD", "PGK", "SBD", "TOP", "VUV", "WST", "XPF", "KMF", "MGA",
            "MVR", "SZL", "LSL", "ERN", "GMD", "GNF", "LRD", "SLL", "SLE", "STN",
            "CVE", "AFN", "ALL", "AMD", "AZN", "BYN", "BAM", "BGN", "GEL", "HRK",
            "ISK", "KGS", "KZT", "MDL", "MKD", "RSD", "TJS", "TMT", "UAH", "UZS",
            "BDT", "BTN", "BIF", "KHR", "LKR", "LAK", "MMK", "MNT", "NPR", "IRR",
            "YER", "SOS", "SDG", "SYP", "DJF", "CDF", "MWK", "ZWL"
    );

    private static final int CODE_LENGTH = 3;

    private CurrencyCodeRule() {
    }

    /**
     * Exactly three alphabetic characters, ignoring surrounding whitespace and case.
     */
    public static boolean isWellFormed(String code) {
        if (code == null) {
            return false;
        }
        String trimmed = code.trim();
        if (trimmed.length() != CODE_LENGTH) {
            return false;
        }
        for (int i = 0; i < trimmed.length(); i++) {
            if (!Character.isLetter(trimmed.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Exactly three letters as stored, surrounding whitespace included.
     */
    public static boolean isStrictlyFormed(String code) {
        return code != null && code.length() == CODE_LENGTH && isWellFormed(code);
    }

    public static boolean isRecognized(String code) {
        return isWellFormed(code) && KNOWN_CURRENCIES.contains(normalize(code));
    }

    /**
     * Canonical form of a well-formed code. Returns the input untouched otherwise.
     */
    public static String normalize(String code) {
        if (!isWellFormed(code)) {
            return code;
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
