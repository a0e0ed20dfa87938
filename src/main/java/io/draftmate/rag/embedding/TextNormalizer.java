package io.draftmate.rag.embedding;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cleans free text before it is handed to the embedding model.
 * <p>
 * Characters outside letters, digits, underscore, whitespace and basic
 * punctuation are removed first, then whitespace runs are collapsed and the
 * result is trimmed and lower-cased. Applying {@link #normalize(String)} to its
 * own output returns the same string.
 */
public final class TextNormalizer {

    private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\s.,!?;:()\\-'\"]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = DISALLOWED.matcher(text).replaceAll("");
        String collapsed = WHITESPACE.matcher(cleaned).replaceAll(" ");
        return collapsed.trim().toLowerCase(Locale.ROOT);
    }
}
