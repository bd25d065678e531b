package com.bbthechange.harambee.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 hashing for one-time codes. Only the hash is ever stored.
 */
public final class OtpCodeHasher {

    private OtpCodeHasher() {
    }

    /**
     * Hashes a code using SHA-256.
     *
     * @param code the code to hash
     * @return the hex-encoded SHA-256 hash of the code
     * @throws IllegalStateException if SHA-256 algorithm is not available
     */
    public static String hash(String code) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(code.getBytes(StandardCharsets.UTF_8));

            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Compares a submitted code against a stored hash in constant time.
     */
    public static boolean matches(String providedCode, String storedHash) {
        return MessageDigest.isEqual(hash(providedCode).getBytes(StandardCharsets.UTF_8),
                storedHash.getBytes(StandardCharsets.UTF_8));
    }
}
