package com.herzen.quiz.text;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {
    private static final Pattern MEANINGLESS_SYMBOLS = Pattern.compile("[^a-zA-Zа-яА-ЯёЁ0-9]+");

    private TextNormalizer() {}

    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) return "";
        return MEANINGLESS_SYMBOLS.matcher(raw).replaceAll("").toLowerCase(Locale.ROOT);
    }

    public static boolean isCanonical(String value) {
        return value != null && value.equals(normalize(value));
    }
}
