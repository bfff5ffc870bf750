package max.quorum.engine.game.board.utils;

import max.quorum.engine.common.Color;
import max.quorum.engine.common.Square;
import max.quorum.engine.game.GameState;
import max.quorum.engine.game.board.Board;

/**
 * Builds boards from diagrams: eight rows, rank 8 first, file a to h. {@code x}, {@code X} or {@code ●} is a black
 * stone, {@code o}, {@code O} or {@code ○} a white stone, {@code .} or {@code ·} an empty square. Rows are separated
 * by new lines or {@code /}; spaces are ignored.
 */
public class BoardGenerator {
    public static final String STANDARD_BOARD = """
            ....xxxx
            .....xxx
            ......xx
            .......x
            o.......
            oo......
            ooo.....
            oooo....
            """;

    public static Board newStandardBoard() {
        return from(STANDARD_BOARD);
    }

    public static GameState from(String diagram, Color toMove) {
        return GameState.of(from(diagram), toMove);
    }

    public static Board from(String diagram) {
        String[] rows = diagram.strip().split("\\s*[\\n/]\\s*");
        if(rows.length != Square.BOARD_SIZE) {
            throw new IllegalArgumentException("Diagram should have 8 rows, found " + rows.length);
        }

        Board board = new Board();
        for(int row = 0; row < rows.length; row++) {
            String cells = rows[row].replace(" ", "");
            if(cells.length() != Square.BOARD_SIZE) {
                throw new IllegalArgumentException("Diagram row " + (row + 1) + " should have 8 squares: '" + rows[row] + "'");
            }
            int rank = Square.BOARD_SIZE - 1 - row;
            for(int file = 0; file < Square.BOARD_SIZE; file++) {
                board.set(Square.of(file, rank), toColor(cells.charAt(file)));
            }
        }
        return board;
    }

    private static Color toColor(char c) {
        return switch (c) {
            case 'x', 'X', '●' -> Color.BLACK;
            case 'o', 'O', '○' -> Color.WHITE;
            case '.', '·' -> null;
            default -> throw new IllegalArgumentException("Unknown diagram character '" + c + "'");
        };
    }
}
