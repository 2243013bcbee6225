package uk.gegc.mathassessment.shared.util;

import org.springframework.stereotype.Component;

/**
 * Plain-text policy for generated item text: coerces any value to a string, drops the
 * control characters that document formats reject and strips surrounding whitespace,
 * Unicode spaces such as U+3000 included. Math markup such as {@code $x<3$} passes
 * through untouched.
 */
@Component
public class TextSanitizer {

    public String sanitize(Object input) {
        if (input == null) {
            return "";
        }
        return stripControlChars(String.valueOf(input)).strip();
    }

    public boolean isBlankAfterSanitizing(Object input) {
        return sanitize(input).isEmpty();
    }

    private String stripControlChars(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        s.codePoints()
                .filter(c -> !isIllegalControlChar(c))
                .forEach(sb::appendCodePoint);
        return sb.toString();
    }

    // Tab, line feed and carriage return are the only C0 characters kept
    private boolean isIllegalControlChar(int c) {
        return c < 0x20 && c != '\t' && c != '\n' && c != '\r';
    }
}
