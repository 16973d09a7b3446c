package com.bookforge.core.cleaner;

/**
 * French typography: non-breaking spaces around high punctuation and guillemets.
 *
 * <p>On top of whitespace normalization:
 * <ul>
 *   <li>a space before {@code ? ! ; : »} becomes the nb-char</li>
 *   <li>a space after {@code «} becomes the nb-char</li>
 *   <li>{@code «} and {@code »} glued to a word get an nb-char inserted</li>
 *   <li>a dialogue dash {@code —} opening a line and followed by a space gets the nb-char</li>
 * </ul>
 *
 * <p>Colons and question marks glued to a word are left alone so URLs and times survive.
 */
public final class FrenchCleaner extends DefaultCleaner {

    private static final String HIGH_PUNCTUATION = "?!;:»";

    private final char nbChar;

    public FrenchCleaner(char nbChar) {
        this.nbChar = nbChar;
    }

    /**
     * Returns the character inserted in place of a non-breaking space.
     *
     * @return nb-char
     */
    public char getNbChar() {
        return nbChar;
    }

    @Override
    public String clean(String text, boolean firstRunInLine) {
        String s = collapseWhitespace(text);
        if (s.isEmpty()) {
            return s;
        }
        StringBuilder out = new StringBuilder(s.length() + 8);
        int length = s.length();
        int i = 0;
        while (i < length) {
            char c = s.charAt(i);
            char next = i + 1 < length ? s.charAt(i + 1) : 0;

            if (c == ' ' && HIGH_PUNCTUATION.indexOf(next) >= 0) {
                out.append(nbChar);
                i++;
            } else if (c == '»' && out.length() > 0 && !isSpaceLike(out.charAt(out.length() - 1))) {
                out.append(nbChar).append(c);
                i++;
            } else if (c == '«' && next != 0) {
                out.append(c);
                if (next == ' ') {
                    out.append(nbChar);
                    i += 2;
                } else {
                    if (!isSpaceLike(next)) {
                        out.append(nbChar);
                    }
                    i++;
                }
            } else if (c == '—' && i == 0 && firstRunInLine && next == ' ') {
                out.append(c).append(nbChar);
                i += 2;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private boolean isSpaceLike(char c) {
        return c == ' ' || c == nbChar || c == '\u00A0' || c == '\u202F';
    }

    @Override
    public String toString() {
        return "FrenchCleaner[nbChar=U+" + String.format("%04X", (int) nbChar) + "]";
    }
}
