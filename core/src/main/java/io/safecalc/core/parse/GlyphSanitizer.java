package io.safecalc.core.parse;

/**
 * Rewrites the display glyphs a calculator keypad shows into the ASCII operators the grammar
 * accepts: {@code ×} to {@code *}, {@code ÷} to {@code /} and {@code −} (U+2212) to {@code -}.
 *
 * <p>Works on code points, so characters outside the Basic Multilingual Plane pass through intact.
 * Nothing else is touched. Stateless and thread-safe.
 */
public final class GlyphSanitizer {

    static final int MULTIPLICATION_SIGN = 0x00D7;
    static final int DIVISION_SIGN = 0x00F7;
    static final int MINUS_SIGN = 0x2212;

    private GlyphSanitizer() {
        // utility class
    }

    /**
     * Returns {@code raw} with the three keypad glyphs replaced.
     *
     * @param raw the expression as typed or displayed; must not be null
     * @return the canonical expression
     */
    public static String sanitize(String raw) {
        StringBuilder out = new StringBuilder(raw.length());
        raw.codePoints().forEach(cp -> out.appendCodePoint(replacement(cp)));
        return out.toString();
    }

    private static int replacement(int codePoint) {
        return switch (codePoint) {
            case MULTIPLICATION_SIGN -> '*';
            case DIVISION_SIGN -> '/';
            case MINUS_SIGN -> '-';
            default -> codePoint;
        };
    }
}
