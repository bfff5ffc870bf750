package max.quorum.engine.game;

import max.quorum.engine.common.Color;
import max.quorum.engine.common.Square;
import max.quorum.engine.effects.EffectResolver;
import max.quorum.engine.effects.Effects;
import max.quorum.engine.game.IllegalPlayException.Rule;
import max.quorum.engine.game.board.Board;
import max.quorum.engine.movegen.MoveGenerator;
import max.quorum.engine.movegen.Movement;
import max.quorum.engine.movegen.Placement;
import max.quorum.engine.movegen.Play;
import max.quorum.engine.utils.notations.PlayIOUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Applies one ply at a time: validate, move or place, resolve effects (movements only), check the win, pass the turn.
 * <p>
 * Validation happens before anything is written, and the input state is never modified: every successful play
 * returns a new {@link GameState}.
 */
public class GameController {
    private final RulesConfig rules;

    public GameController() {
        this(RulesConfig.DEFAULT);
    }

    public GameController(RulesConfig rules) {
        this.rules = Objects.requireNonNull(rules);
    }

    public RulesConfig rules() {
        return rules;
    }

    public GameState initialState() {
        return GameState.initial();
    }

    /**
     * @throws IllegalPlayException if the game is over or the play is not legal for the player to move
     */
    public GameState apply(GameState state, Play play) {
        Objects.requireNonNull(play, "play");
        if(state.isGameOver()) {
            throw new IllegalPlayException(Rule.GAME_OVER, "The game is over, no further play is legal");
        }

        final Color mover = state.currentPlayer();
        final Board board = state.board();
        final Effects effects;
        final boolean checkWin;

        if(play instanceof Movement movement) {
            MoveGenerator.validateMovement(board, mover, movement);
            Square target = movement.target();
            board.set(movement.active(), null);
            board.set(target, mover);
            effects = EffectResolver.resolveAndApply(board, mover, target);
            checkWin = true;
        } else if(play instanceof Placement placement) {
            MoveGenerator.validatePlacement(board, mover, placement);
            for(Square square : placement.squares()) {
                board.set(square, mover);
            }
            effects = Effects.NONE;
            checkWin = rules.winCheckAfterPlacement;
        } else {
            throw new IllegalArgumentException("Unknown play " + play);
        }

        final int ply = state.ply() + 1;
        if(checkWin && WinChecker.isWinner(board, mover)) {
            return new GameState(board, mover, ply, play, effects, PlayerState.QUORUM, mover);
        }

        final Color opponent = mover.getOppositeColor();
        if(MoveGenerator.hasAnyLegalPlay(board, opponent)) {
            return new GameState(board, opponent, ply, play, effects, PlayerState.IN_PROGRESS, null);
        }

        // the opponent is stuck
        return switch (rules.noLegalPlay) {
            case LOSS -> new GameState(board, opponent, ply, play, effects, PlayerState.BLOCKED, mover);
            case PASS -> MoveGenerator.hasAnyLegalPlay(board, mover)
                    ? new GameState(board, mover, ply, play, effects, PlayerState.IN_PROGRESS, null)
                    : new GameState(board, opponent, ply, play, effects, PlayerState.DRAW, null);
        };
    }

    public GameState applyAll(GameState state, List<? extends Play> plays) {
        GameState current = state;
        for(Play play : plays) {
            current = apply(current, play);
        }
        return current;
    }

    /**
     * Plays a space separated list of plays in text notation, for instance {@code "b1-d3 g8-e6 +"}.
     */
    public GameState playMoves(GameState state, String moves) {
        return playMoves(state, Arrays.stream(moves.trim().split("\\s+")).filter(s -> !s.isEmpty()).toList());
    }

    public GameState playMoves(GameState state, List<String> moveList) {
        GameState current = state;
        for(String move : moveList) {
            current = apply(current, PlayIOUtils.parsePlay(move, current));
        }
        return current;
    }
}
