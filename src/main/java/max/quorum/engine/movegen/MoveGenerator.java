package max.quorum.engine.movegen;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.quorum.engine.common.Color;
import max.quorum.engine.common.Square;
import max.quorum.engine.game.GameState;
import max.quorum.engine.game.IllegalPlayException;
import max.quorum.engine.game.IllegalPlayException.Rule;
import max.quorum.engine.game.board.Board;
import max.quorum.engine.utils.BitUtils;
import max.quorum.engine.utils.GeometryUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Enumerates and validates the plays of the side to move.
 * <p>
 * A movement is legal when active and center both hold the mover's stones (ownership), are adjacent (distance), and
 * the reflected target is on the board and empty (space). Movements are generated in ascending (active, center)
 * flat index order.
 */
public class MoveGenerator {
    // Target square index for each (active, center) pair of adjacent squares, -1 when off the board or not adjacent
    private static final int[] REFLECTION_TARGETS = new int[64 * 64];
    static {
        for(int active = 0; active < 64; active++) {
            for(int center = 0; center < 64; center++) {
                Square activeSquare = Square.of(active);
                Square centerSquare = Square.of(center);
                int target = -1;
                if(GeometryUtils.adjacent(activeSquare, centerSquare)) {
                    Square targetSquare = GeometryUtils.reflect(activeSquare, centerSquare);
                    if(targetSquare.isInBounds()) {
                        target = targetSquare.getFlatIndex();
                    }
                }
                REFLECTION_TARGETS[active * 64 + center] = target;
            }
        }
    }

    public static List<Movement> legalMovements(GameState state) {
        return legalMovements(state.board(), state.currentPlayer());
    }

    public static List<Movement> legalMovements(Board board, Color side) {
        IntArrayList moves = new IntArrayList();
        generateMovements(board, side, moves);
        List<Movement> movements = new ArrayList<>(moves.size());
        for(int i = 0; i < moves.size(); i++) {
            movements.add(Movement.fromBytes(moves.getInt(i)));
        }
        return movements;
    }

    // Useful for perft and no-legal-play detection
    public static int countMovements(Board board, Color side) {
        return generateMovements(board, side, null);
    }

    /**
     * Appends the packed legal movements of {@code side} to {@code buffer} (see {@link Movement#toBytes()}).
     * A {@code null} buffer only counts them.
     *
     * @return the number of legal movements
     */
    public static int generateMovements(Board board, Color side, IntArrayList buffer) {
        final long friendlyBB = board.getColorBB(side);
        final long occupiedBB = board.getOccupiedBB();
        int numberOfMoves = 0;

        long activeBB = friendlyBB;
        while(activeBB != 0) {
            int active = BitUtils.bitScanForward(activeBB);
            activeBB &= activeBB - 1;

            long centerBB = GeometryUtils.getNeighboursBB(active) & friendlyBB;
            while(centerBB != 0) {
                int center = BitUtils.bitScanForward(centerBB);
                centerBB &= centerBB - 1;

                int target = REFLECTION_TARGETS[active * 64 + center];
                if(target < 0 || (occupiedBB & BitUtils.getPositionIndexBitMask(target)) != 0) {
                    continue;
                }
                if(buffer != null) {
                    buffer.add(Movement.asBytes(active, center));
                }
                numberOfMoves++;
            }
        }
        return numberOfMoves;
    }

    public static Optional<Placement> legalPlacement(GameState state) {
        return legalPlacement(state.board(), state.currentPlayer());
    }

    public static Optional<Placement> legalPlacement(Board board, Color side) {
        Set<Square> emptyHomeSquares = board.emptyHomeSquares(side);
        if(emptyHomeSquares.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Placement(emptyHomeSquares));
    }

    public static boolean hasAnyLegalPlay(GameState state) {
        return hasAnyLegalPlay(state.board(), state.currentPlayer());
    }

    public static boolean hasAnyLegalPlay(Board board, Color side) {
        return board.hasEmptyHomeSquare(side) || countMovements(board, side) > 0;
    }

    /** Every legal play: movements first, then the placement when there is one. */
    public static List<Play> legalPlays(GameState state) {
        Board board = state.board();
        List<Play> plays = new ArrayList<>(legalMovements(board, state.currentPlayer()));
        legalPlacement(board, state.currentPlayer()).ifPresent(plays::add);
        return plays;
    }

    /**
     * Checks a movement against the ownership, distance and space rules, in that order.
     *
     * @throws IllegalPlayException naming the first rule the movement breaks
     */
    public static void validateMovement(Board board, Color side, Movement movement) {
        Square active = movement.active();
        Square center = movement.center();
        if(!board.hasStone(active, side)) {
            throw new IllegalPlayException(Rule.OWNERSHIP,
                    "Active square " + active + " does not hold a " + side + " stone");
        }
        if(!board.hasStone(center, side)) {
            throw new IllegalPlayException(Rule.OWNERSHIP,
                    "Center square " + center + " does not hold a " + side + " stone");
        }
        if(!GeometryUtils.adjacent(active, center)) {
            throw new IllegalPlayException(Rule.DISTANCE,
                    "Active square " + active + " is not adjacent to center square " + center);
        }
        Square target = movement.target();
        if(!target.isInBounds()) {
            throw new IllegalPlayException(Rule.SPACE, "Target " + target + " is off the board");
        }
        if(!board.isEmpty(target)) {
            throw new IllegalPlayException(Rule.SPACE, "Target square " + target + " is not empty");
        }
    }

    /**
     * @throws IllegalPlayException with {@link Rule#HOME_OCCUPANCY} unless the placement covers exactly the empty
     * home squares of {@code side}, and there is at least one
     */
    public static void validatePlacement(Board board, Color side, Placement placement) {
        Set<Square> emptyHomeSquares = board.emptyHomeSquares(side);
        if(emptyHomeSquares.isEmpty()) {
            throw new IllegalPlayException(Rule.HOME_OCCUPANCY, "No empty home square left for " + side);
        }
        if(!emptyHomeSquares.equals(placement.squares())) {
            throw new IllegalPlayException(Rule.HOME_OCCUPANCY,
                    "Placement must fill exactly " + emptyHomeSquares + ", was " + placement.squares());
        }
    }
}
