package fr.lapetina.resilience.domain.validation;

import java.util.regex.Pattern;

/**
 * Best-effort removal of script content from user input. Not an HTML sanitizer.
 */
public final class InputSanitizer {

    private static final Pattern SCRIPT_BLOCK =
            Pattern.compile("<script[^>]*>.*?</script\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern SCRIPT_TAG =
            Pattern.compile("</?script[^>]*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCRIPT_SCHEME =
            Pattern.compile("(javascript|vbscript)\\s*:", Pattern.CASE_INSENSITIVE);

    private InputSanitizer() {
    }

    /**
     * Strips script blocks, stray script tags and script URI schemes.
     * Passes repeat until nothing changes, so removing one tag cannot assemble another.
     */
    public static String stripScripts(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        String previous;
        String result = value;
        do {
            previous = result;
            result = stripOnce(previous);
        } while (!result.equals(previous));
        return result;
    }

    private static String stripOnce(String value) {
        String result = SCRIPT_BLOCK.matcher(value).replaceAll("");
        result = SCRIPT_TAG.matcher(result).replaceAll("");
        return SCRIPT_SCHEME.matcher(result).replaceAll("");
    }
}
