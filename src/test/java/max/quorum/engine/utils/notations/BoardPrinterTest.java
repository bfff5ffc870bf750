package max.quorum.engine.utils.notations;

import max.quorum.engine.common.Color;
import max.quorum.engine.game.GameController;
import max.quorum.engine.game.GameState;
import max.quorum.engine.game.board.utils.BoardGenerator;
import max.quorum.engine.movegen.Movement;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class BoardPrinterTest {

    @Test
    public void standardBoardInAscii() {
        String printed = BoardPrinter.print(GameState.initial(), DisplayStyle.LOWERCASE_ASCII);

        assertEquals(String.join("\n",
                "  a b c d e f g h  |",
                "8 . . . . x x x x  |  o to move",
                "7 . . . . . x x x  |  Move: 1 (ply 0)",
                "6 . . . . . . x x  |  Last move: -",
                "5 . . . . . . . x  |  Win progress: 0",
                "4 o . . . . . . .  |",
                "3 o o . . . . . .  |",
                "2 o o o . . . . .  |",
                "1 o o o o . . . .  |"), printed);
    }

    @Test
    public void sidePanelAfterAConversion() {
        // Given
        GameState state = BoardGenerator.from("""
                ........
                ........
                ....x.oo
                ....xx..
                ...o.x..
                .....o..
                ........
                ........
                """, Color.WHITE);

        // When
        GameState next = new GameController().apply(state, Movement.of("h6", "g6"));
        String[] lines = BoardPrinter.print(next).split("\n");

        // Then
        assertEquals("  a b c d e f g h  ⎸", lines[0]);
        assertEquals("8 · · · · · · · ·  ⎸  ● to move", lines[1]);
        assertEquals("7 · · · · · · · ·  ⎸  Move: 1 (ply 1)", lines[2]);
        assertEquals("6 · · · · ● ○ ○ ·  ⎸  Last move: h6-f6", lines[3]);
        assertEquals("5 · · · · ○ ● · ·  ⎸  Win progress: 2", lines[4]);
        assertEquals("4 · · · ○ · ● · ·  ⎸  Converted: e5", lines[5]);
        assertEquals("3 · · · · · ○ · ·  ⎸", lines[6]);
    }

    @Test
    public void finishedGameStatus() {
        GameState won = new GameController().apply(BoardGenerator.from("""
                ........
                ........
                ........
                ...oo...
                ..oo....
                ........
                ........
                ........
                """, Color.WHITE), Movement.of("c4", "d4"));

        String printed = BoardPrinter.print(won, DisplayStyle.LOWERCASE_ASCII);

        assertEquals("8 . . . . . . . .  |  o wins by quorum", printed.split("\n")[1]);
    }
}
