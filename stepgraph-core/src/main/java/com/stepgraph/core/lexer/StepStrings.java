package com.stepgraph.core.lexer;

/**
 * Encoding and decoding of ISO-10303-21 string literals.
 *
 * <p>Decoding handles the doubled apostrophe and the control directives of the
 * physical file format:
 * <ul>
 *   <li>{@code ''} - one apostrophe</li>
 *   <li>{@code \\} - one reverse solidus</li>
 *   <li>{@code \X2\hhhh...\X0\} - UCS-2 code units, four hex digits each</li>
 *   <li>{@code \X4\hhhhhhhh...\X0\} - UCS-4 code points, eight hex digits each</li>
 *   <li>{@code \X\hh} - one 8-bit character</li>
 *   <li>{@code \S\c} - character {@code c} from the upper half of the current page</li>
 *   <li>{@code \PA\} - alphabet selector, dropped</li>
 * </ul>
 * Malformed directives are kept verbatim.
 *
 * <p>Encoding is the inverse: printable ASCII is written as is, apostrophes and reverse
 * solidi are escaped, everything else goes into a {@code \X2\ ... \X0\} run.
 */
public final class StepStrings {

    private static final char APOSTROPHE = '\'';
    private static final char REVERSE_SOLIDUS = '\\';

    private StepStrings() {
        // Utility class
    }

    /**
     * Decodes the raw text of a {@link TokenKind#STRING} token, quotes included.
     *
     * @param rawToken token text such as {@code 'O''Reilly'}
     * @return decoded value
     * @throws IllegalArgumentException if the text is not quoted
     */
    public static String decodeLiteral(String rawToken) {
        if (rawToken == null || rawToken.length() < 2
            || rawToken.charAt(0) != APOSTROPHE || rawToken.charAt(rawToken.length() - 1) != APOSTROPHE) {
            throw new IllegalArgumentException("Not a quoted STEP string: " + rawToken);
        }
        String body = rawToken.substring(1, rawToken.length() - 1).replace("''", "'");
        return decodeEscapes(body);
    }

    /**
     * Decodes control directives in an unquoted string body.
     *
     * @param value string body with {@code ''} already collapsed
     * @return decoded value
     */
    public static String decodeEscapes(String value) {
        if (value == null || value.indexOf(REVERSE_SOLIDUS) < 0) {
            return value;
        }

        StringBuilder out = new StringBuilder(value.length());
        int len = value.length();
        for (int i = 0; i < len; i++) {
            char c = value.charAt(i);
            if (c != REVERSE_SOLIDUS || i + 1 >= len) {
                out.append(c);
                continue;
            }

            char directive = value.charAt(i + 1);

            // \\
            if (directive == REVERSE_SOLIDUS) {
                out.append(REVERSE_SOLIDUS);
                i += 1;
                continue;
            }

            // \X2\...\X0\ and \X4\...\X0\
            if (directive == 'X' && i + 3 < len
                && (value.charAt(i + 2) == '2' || value.charAt(i + 2) == '4')
                && value.charAt(i + 3) == REVERSE_SOLIDUS) {
                int seqStart = i + 4;
                int endMarker = value.indexOf("\\X0\\", seqStart);
                if (endMarker >= 0) {
                    String decoded = decodeHexRun(value.substring(seqStart, endMarker), value.charAt(i + 2));
                    if (decoded != null) {
                        out.append(decoded);
                        i = endMarker + 3;
                        continue;
                    }
                }
            }

            // \X\hh
            if (directive == 'X' && i + 4 < len && value.charAt(i + 2) == REVERSE_SOLIDUS) {
                int b = hexByte(value.charAt(i + 3), value.charAt(i + 4));
                if (b >= 0) {
                    out.append((char) b);
                    i += 4;
                    continue;
                }
            }

            // \S\c
            if (directive == 'S' && i + 3 < len && value.charAt(i + 2) == REVERSE_SOLIDUS) {
                out.append((char) (value.charAt(i + 3) + 128));
                i += 3;
                continue;
            }

            // \PA\
            if (directive == 'P' && i + 3 < len && value.charAt(i + 3) == REVERSE_SOLIDUS
                && value.charAt(i + 2) >= 'A' && value.charAt(i + 2) <= 'I') {
                i += 3;
                continue;
            }

            out.append(c);
        }
        return out.toString();
    }

    /**
     * Encodes a value as a quoted STEP string literal.
     *
     * @param value decoded value
     * @return literal including surrounding apostrophes
     */
    public static String encodeLiteral(String value) {
        StringBuilder out = new StringBuilder(value.length() + 2);
        out.append(APOSTROPHE);
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == APOSTROPHE) {
                out.append("''");
                i++;
            } else if (c == REVERSE_SOLIDUS) {
                out.append("\\\\");
                i++;
            } else if (c >= 0x20 && c <= 0x7E) {
                out.append(c);
                i++;
            } else {
                out.append("\\X2\\");
                while (i < value.length() && (value.charAt(i) < 0x20 || value.charAt(i) > 0x7E)) {
                    out.append(String.format("%04X", (int) value.charAt(i)));
                    i++;
                }
                out.append("\\X0\\");
            }
        }
        out.append(APOSTROPHE);
        return out.toString();
    }

    private static String decodeHexRun(String hexText, char mode) {
        int group = (mode == '4') ? 8 : 4;
        if (hexText.isEmpty() || hexText.length() % group != 0) {
            return null;
        }

        StringBuilder out = new StringBuilder(hexText.length() / group);
        for (int i = 0; i < hexText.length(); i += group) {
            int codePoint;
            try {
                codePoint = Integer.parseUnsignedInt(hexText.substring(i, i + group), 16);
            } catch (NumberFormatException e) {
                return null;
            }
            if (mode == '4') {
                if (!Character.isValidCodePoint(codePoint)) {
                    return null;
                }
                out.appendCodePoint(codePoint);
            } else {
                out.append((char) codePoint);
            }
        }
        return out.toString();
    }

    private static int hexByte(char hi, char lo) {
        int a = Character.digit(hi, 16);
        int b = Character.digit(lo, 16);
        if (a < 0 || b < 0) {
            return -1;
        }
        return (a << 4) | b;
    }
}
