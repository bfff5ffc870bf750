package max.quorum.engine.game;

import max.quorum.engine.common.Color;
import max.quorum.engine.game.board.Board;

public final class WinChecker {

    private WinChecker() {
    }

    public static boolean isWinner(GameState state, Color color) {
        return isWinner(state.board(), color);
    }

    public static boolean isWinner(Board board, Color color) {
        return board.isObjectiveOwnedBy(color);
    }
}
