package io.shipme.core.vault;

import java.security.SecureRandom;

public final class SecretValues {
    private static final String CHARSET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789!@#$%^&*";
    private static final SecureRandom RANDOM = new SecureRandom();

    private SecretValues() {
    }

    public static String generatePassword(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Password length must be positive");
        }
        StringBuilder password = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            password.append(CHARSET.charAt(RANDOM.nextInt(CHARSET.length())));
        }
        return password.toString();
    }

    public static String mask(String value, int visibleChars) {
        if (value == null) {
            return "";
        }
        int visible = Math.max(0, visibleChars);
        if (value.length() <= visible) {
            return "*".repeat(value.length());
        }
        return value.substring(0, visible) + "*".repeat(value.length() - visible);
    }
}
