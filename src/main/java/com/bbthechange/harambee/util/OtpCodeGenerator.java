package com.bbthechange.harambee.util;

import java.security.SecureRandom;
import java.util.Locale;

/**
 * Utility class for generating numeric one-time codes.
 */
public class OtpCodeGenerator {

    private static final SecureRandom random = new SecureRandom();

    private OtpCodeGenerator() {
    }

    /**
     * Generate a uniformly distributed numeric code of the given length, zero-padded.
     * Format for length 6: "000000" through "999999" (e.g., "042917")
     *
     * @param length number of digits, 1 to 9
     * @return the code
     */
    public static String generate(int length) {
        if (length < 1 || length > 9) {
            throw new IllegalArgumentException("OTP length must be between 1 and 9, got " + length);
        }
        int bound = (int) Math.pow(10, length);
        return String.format(Locale.ROOT, "%0" + length + "d", random.nextInt(bound));
    }
}
