package com.aerojob.survey.support;

import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Key normalization shared by the enum synonym tables: case-folded, trimmed,
 * with dashes and underscores read as spaces and runs of whitespace collapsed.
 */
public final class SynonymKeys {

    private SynonymKeys() {
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[-_]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    /**
     * Anchored regex matching any of {@code forms}, for case-insensitive queries against stored values.
     */
    public static String anyOfPattern(Collection<String> forms, boolean allowBlank) {
        String alternatives = forms.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return "^\\s*(?:" + alternatives + ")" + (allowBlank ? "?" : "") + "\\s*$";
    }
}
