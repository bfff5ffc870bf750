package max.quorum.engine.utils.notations;

import max.quorum.engine.common.Color;

import java.util.Locale;

/**
 * How boards and plays are written.
 *
 * @param pieces three glyphs: black stone, white stone, empty square
 * @param placement token written for a placement
 * @param fromToSeparator written between the origin and target of a movement
 * @param sep vertical separator between the board and the side panel
 * @param files the eight file labels, a to h
 * @param ranks the eight rank labels, 1 to 8
 */
public record DisplayStyle(String pieces, String placement, String fromToSeparator, String sep,
                           String files, String ranks) {
    public static final DisplayStyle CIRCLES = new DisplayStyle("●○·", "++", "-", "⎸", "abcdefgh", "12345678");
    public static final DisplayStyle LOWERCASE_ASCII = new DisplayStyle("xo.", "+", "", "|", "abcdefgh", "12345678");
    public static final DisplayStyle UPPERCASE_ASCII = new DisplayStyle("XO.", "+", "", "|", "ABCDEFGH", "12345678");
    public static final DisplayStyle GREEK = new DisplayStyle("●○·", "+", "", "⎸", "αβγδεζηθ", "12345678");

    public static final DisplayStyle DEFAULT = CIRCLES;

    public DisplayStyle {
        if(pieces.length() != 3) {
            throw new IllegalArgumentException("pieces should hold 3 glyphs (black, white, empty): '" + pieces + "'");
        }
        if(files.length() != 8 || ranks.length() != 8) {
            throw new IllegalArgumentException("files and ranks should hold 8 labels each");
        }
    }

    public static DisplayStyle byName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "circles" -> CIRCLES;
            case "lowercase_ascii", "ascii" -> LOWERCASE_ASCII;
            case "uppercase_ascii" -> UPPERCASE_ASCII;
            case "greek" -> GREEK;
            default -> throw new IllegalArgumentException("Unknown display style '" + name + "'");
        };
    }

    /** Glyph of a square holding a stone of {@code color}, or of an empty square when {@code null}. */
    public char glyph(Color color) {
        if(color == null) {
            return pieces.charAt(2);
        }
        return color == Color.BLACK ? pieces.charAt(0) : pieces.charAt(1);
    }

    public char file(int file) {
        return files.charAt(file);
    }

    public char rank(int rank) {
        return ranks.charAt(rank);
    }

    /** Column width of one play in a score sheet. */
    public int moveWidth() {
        return Math.max(4 + fromToSeparator.length() + 1, placement.length());
    }
}
