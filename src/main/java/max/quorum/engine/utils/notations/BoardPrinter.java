package max.quorum.engine.utils.notations;

import max.quorum.engine.common.Color;
import max.quorum.engine.common.Square;
import max.quorum.engine.effects.Effects;
import max.quorum.engine.game.GameState;
import max.quorum.engine.game.board.Board;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class BoardPrinter {

    public static String print(GameState state) {
        return print(state, DisplayStyle.DEFAULT);
    }

    /**
     * Returns a diagram of the board (ranks 8..1) with a side panel: side to move or result, move number, last play,
     * win progress, and the stones the last play suffocated or converted.
     */
    public static String print(GameState state, DisplayStyle style) {
        Board board = state.board();
        String sep = "  " + style.sep() + "  ";
        List<String> extras = sidePanel(state, style);

        StringBuilder sb = new StringBuilder();
        sb.append("  ");
        for(int file = 0; file < Square.BOARD_SIZE; file++) {
            if(file > 0) {
                sb.append(' ');
            }
            sb.append(style.file(file));
        }
        sb.append(sep.stripTrailing());

        for(int rank = Square.BOARD_SIZE - 1; rank >= 0; rank--) {
            int row = Square.BOARD_SIZE - 1 - rank;
            StringBuilder line = new StringBuilder();
            line.append(style.rank(rank)).append(' ');
            for(int file = 0; file < Square.BOARD_SIZE; file++) {
                if(file > 0) {
                    line.append(' ');
                }
                line.append(style.glyph(board.stoneAt(Square.of(file, rank)).orElse(null)));
            }
            line.append(sep);
            if(row < extras.size()) {
                line.append(extras.get(row));
            }
            sb.append('\n').append(line.toString().stripTrailing());
        }
        return sb.toString();
    }

    private static List<String> sidePanel(GameState state, DisplayStyle style) {
        List<String> extras = new ArrayList<>();
        extras.add(status(state, style));
        extras.add("Move: " + state.wholeMove() + " (ply " + state.ply() + ")");
        extras.add("Last move: " + state.lastPlay().map(play -> PlayIOUtils.writePlay(play, style)).orElse("-"));
        extras.add("Win progress: " + state.winProgress());
        Effects effects = state.lastEffects();
        if(effects.suffocatedBB() != 0) {
            extras.add("Suffocated: " + joinSquares(effects.suffocated()));
        }
        if(effects.convertedBB() != 0) {
            extras.add("Converted: " + joinSquares(effects.converted()));
        }
        return extras;
    }

    private static String status(GameState state, DisplayStyle style) {
        Color toMove = state.currentPlayer();
        return switch (state.playerState()) {
            case IN_PROGRESS -> style.glyph(toMove) + " to move";
            case QUORUM -> style.glyph(state.winner().orElseThrow()) + " wins by quorum";
            case BLOCKED -> style.glyph(state.winner().orElseThrow()) + " wins, " + style.glyph(toMove) + " cannot play";
            case DRAW -> PlayIOUtils.DRAW + " neither player can play";
        };
    }

    private static String joinSquares(List<Square> squares) {
        return squares.stream().map(PlayIOUtils::getSquareFromPosition).collect(Collectors.joining(" "));
    }
}
