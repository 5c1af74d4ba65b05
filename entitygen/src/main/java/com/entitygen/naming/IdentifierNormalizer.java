package com.entitygen.naming;

/**
 * Turns catalog identifiers such as {@code order_line-item} into Java names.
 * <p>
 * Runs of {@code _}, {@code -} and whitespace separate words. Each word is
 * title-cased: a letter directly after a letter is lower-cased, any other letter
 * is upper-cased, so digits and punctuation start a new word
 * ({@code user2name} becomes {@code User2Name}). Other characters are kept.
 */
public final class IdentifierNormalizer {
    private IdentifierNormalizer() {}

    public static String normalize(String name, boolean startLower) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        StringBuilder result = new StringBuilder(name.length());
        boolean previousCased = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (isSeparator(c)) {
                previousCased = false;
                continue;
            }
            if (Character.isLetter(c)) {
                result.append(previousCased ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousCased = true;
            } else {
                result.append(c);
                previousCased = false;
            }
        }
        if (startLower && result.length() > 0) {
            result.setCharAt(0, Character.toLowerCase(result.charAt(0)));
        }
        return result.toString();
    }

    public static String pascalCase(String name) {
        return normalize(name, false);
    }

    public static String camelCase(String name) {
        return normalize(name, true);
    }

    private static boolean isSeparator(char c) {
        return c == '_' || c == '-' || Character.isWhitespace(c);
    }
}
