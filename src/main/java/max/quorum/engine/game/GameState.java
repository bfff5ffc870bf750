package max.quorum.engine.game;

import max.quorum.engine.common.Color;
import max.quorum.engine.common.Square;
import max.quorum.engine.effects.Effects;
import max.quorum.engine.game.board.Board;
import max.quorum.engine.game.board.utils.BoardGenerator;
import max.quorum.engine.movegen.Play;
import max.quorum.engine.utils.notations.BoardPrinter;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a game: the board, the color to move, the ply count, the last play with its effects, and the
 * result once the game is over. Only {@link GameController} creates successor states.
 * <p>
 * Ply starts at 0 and grows by one with each play, so the whole move number is {@code ply / 2 + 1}.
 */
public final class GameState {
    private final Board board;
    private final Color currentPlayer;
    private final int ply;
    private final Play lastPlay;
    private final Effects lastEffects;
    private final PlayerState playerState;
    private final Color winner;

    GameState(Board board, Color currentPlayer, int ply, Play lastPlay, Effects lastEffects,
              PlayerState playerState, Color winner) {
        this.board = board.copy();
        this.currentPlayer = Objects.requireNonNull(currentPlayer);
        this.ply = ply;
        this.lastPlay = lastPlay;
        this.lastEffects = lastEffects == null ? Effects.NONE : lastEffects;
        this.playerState = Objects.requireNonNull(playerState);
        this.winner = winner;
    }

    /** The fixed starting layout, white to move. */
    public static GameState initial() {
        return of(BoardGenerator.newStandardBoard(), Color.WHITE);
    }

    /** An in-progress state over an arbitrary board, mostly for analysis and tests. */
    public static GameState of(Board board, Color toMove) {
        return new GameState(board, toMove, 0, null, Effects.NONE, PlayerState.IN_PROGRESS, null);
    }

    /** A copy of the board; changing it does not affect this state. */
    public Board board() {
        return board.copy();
    }

    public Optional<Color> stoneAt(Square square) {
        return board.stoneAt(square);
    }

    public boolean isObjectiveOwnedBy(Color color) {
        return board.isObjectiveOwnedBy(color);
    }

    public Color currentPlayer() {
        return currentPlayer;
    }

    public int ply() {
        return ply;
    }

    public int wholeMove() {
        return ply / 2 + 1;
    }

    public Optional<Play> lastPlay() {
        return Optional.ofNullable(lastPlay);
    }

    public Effects lastEffects() {
        return lastEffects;
    }

    public PlayerState playerState() {
        return playerState;
    }

    public boolean isGameOver() {
        return playerState.isGameOver();
    }

    /** Empty while the game is in progress and after a draw. */
    public Optional<Color> winner() {
        return Optional.ofNullable(winner);
    }

    public int winProgress() {
        return board.winProgress();
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        GameState that = (GameState) o;
        return ply == that.ply && board.equals(that.board) && currentPlayer == that.currentPlayer
                && playerState == that.playerState && winner == that.winner
                && Objects.equals(lastPlay, that.lastPlay) && lastEffects.equals(that.lastEffects);
    }

    @Override
    public int hashCode() {
        return Objects.hash(board, currentPlayer, ply, lastPlay, playerState, winner);
    }

    @Override
    public String toString() {
        return BoardPrinter.print(this);
    }
}
