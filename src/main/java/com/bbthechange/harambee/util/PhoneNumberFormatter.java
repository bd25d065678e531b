package com.bbthechange.harambee.util;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalizes phone numbers to E.164 ({@code +<country><number>}).
 * Local numbers are assumed to be Kenyan unless another default country code is given.
 */
public final class PhoneNumberFormatter {

    public static final String DEFAULT_COUNTRY_CODE = "+254";

    private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{1,14}$");

    private PhoneNumberFormatter() {
    }

    public static boolean isValid(String phoneNumber) {
        return phoneNumber != null && E164.matcher(phoneNumber).matches();
    }

    public static Optional<String> format(String phoneNumber) {
        return format(phoneNumber, DEFAULT_COUNTRY_CODE);
    }

    /**
     * Strips everything but digits and '+', then:
     * <ul>
     *   <li>"+..." is returned as is if valid</li>
     *   <li>"254..." (10+ digits) gets a leading '+'</li>
     *   <li>local numbers (9+ digits) lose a leading 0 and get the default country code</li>
     * </ul>
     */
    public static Optional<String> format(String phoneNumber, String defaultCountryCode) {
        if (phoneNumber == null) {
            return Optional.empty();
        }

        StringBuilder cleaned = new StringBuilder();
        for (char c : phoneNumber.toCharArray()) {
            if (Character.isDigit(c) || c == '+') {
                cleaned.append(c);
            }
        }
        String digits = cleaned.toString();

        String formatted;
        if (digits.startsWith("+")) {
            formatted = digits;
        } else if (digits.startsWith(defaultCountryCode.substring(1)) && digits.length() >= 10) {
            formatted = "+" + digits;
        } else if (digits.length() >= 9) {
            formatted = defaultCountryCode + (digits.startsWith("0") ? digits.substring(1) : digits);
        } else {
            return Optional.empty();
        }

        return isValid(formatted) ? Optional.of(formatted) : Optional.empty();
    }
}
