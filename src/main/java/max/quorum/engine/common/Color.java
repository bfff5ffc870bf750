package max.quorum.engine.common;

import java.util.List;

public enum Color {
    WHITE, BLACK;

    private static final List<Square> WHITE_HOME = List.of(
            Square.of(0, 0), Square.of(0, 1), Square.of(1, 0), Square.of(1, 1));
    private static final List<Square> BLACK_HOME = List.of(
            Square.of(7, 7), Square.of(7, 6), Square.of(6, 7), Square.of(6, 6));

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    /** Home squares in a fixed order; membership never changes during a game. */
    public List<Square> homeSquares() {
        return this == WHITE ? WHITE_HOME : BLACK_HOME;
    }
}
