package max.quorum.engine.game.board;

import max.quorum.engine.common.Color;
import max.quorum.engine.common.Square;
import max.quorum.engine.utils.BitUtils;
import max.quorum.engine.utils.GeometryUtils;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Occupancy of the 64 squares, one bitboard per color. A square is set in at most one of them.
 * <p>
 * The board does not check any rule: legality belongs to the move generator, and mutation is only driven by the
 * game controller and the effect resolver.
 */
public class Board {
    public static final List<Square> OBJECTIVE_SQUARES = List.of(
            Square.of(3, 3), Square.of(3, 4), Square.of(4, 3), Square.of(4, 4));
    public static final long OBJECTIVE_BB = BitUtils.toBitboard(OBJECTIVE_SQUARES);
    public static final long WHITE_HOME_BB = BitUtils.toBitboard(Color.WHITE.homeSquares());
    public static final long BLACK_HOME_BB = BitUtils.toBitboard(Color.BLACK.homeSquares());

    public long whiteBB = 0;
    public long blackBB = 0;

    public Board() {
    }

    public Board(Board other) {
        this.whiteBB = other.whiteBB;
        this.blackBB = other.blackBB;
    }

    public Board copy() {
        return new Board(this);
    }

    public Optional<Color> stoneAt(Square square) {
        if(!square.isInBounds()) {
            return Optional.empty();
        }
        long bb = square.bitMask();
        if((whiteBB & bb) != 0) {
            return Optional.of(Color.WHITE);
        } else if((blackBB & bb) != 0) {
            return Optional.of(Color.BLACK);
        }
        return Optional.empty();
    }

    public boolean isEmpty(Square square) {
        return (getOccupiedBB() & square.bitMask()) == 0;
    }

    public boolean hasStone(Square square, Color color) {
        return square.isInBounds() && (getColorBB(color) & square.bitMask()) != 0;
    }

    /**
     * Puts a stone of the given color on the square, or clears it when {@code color} is {@code null}.
     */
    public void set(Square square, Color color) {
        if(!square.isInBounds()) {
            throw new IllegalArgumentException("Cannot set a stone on " + square);
        }
        long bb = square.bitMask();
        whiteBB &= ~bb;
        blackBB &= ~bb;
        if(color == Color.WHITE) {
            whiteBB |= bb;
        } else if(color == Color.BLACK) {
            blackBB |= bb;
        }
    }

    public long getColorBB(Color color) {
        return color == Color.WHITE ? whiteBB : blackBB;
    }

    public long getOccupiedBB() {
        return whiteBB | blackBB;
    }

    public static long getHomeBB(Color color) {
        return color == Color.WHITE ? WHITE_HOME_BB : BLACK_HOME_BB;
    }

    /** Home squares of {@code color} without a stone, in the color's home order. */
    public Set<Square> emptyHomeSquares(Color color) {
        Set<Square> empty = new LinkedHashSet<>();
        for(Square home : color.homeSquares()) {
            if(isEmpty(home)) {
                empty.add(home);
            }
        }
        return Collections.unmodifiableSet(empty);
    }

    public boolean hasEmptyHomeSquare(Color color) {
        return (getHomeBB(color) & ~getOccupiedBB()) != 0;
    }

    public boolean isObjectiveOwnedBy(Color color) {
        return (getColorBB(color) & OBJECTIVE_BB) == OBJECTIVE_BB;
    }

    public int count(Color color) {
        return BitUtils.bitCount(getColorBB(color));
    }

    /** Number of in-bounds neighbours of the square holding no stone. Off-board squares never count as empty. */
    public int emptyNeighbourCount(Square square) {
        return BitUtils.bitCount(GeometryUtils.getNeighboursBB(square) & ~getOccupiedBB());
    }

    /** Objective squares held by white minus those held by black, from -4 to 4. */
    public int winProgress() {
        return BitUtils.bitCount(whiteBB & OBJECTIVE_BB) - BitUtils.bitCount(blackBB & OBJECTIVE_BB);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Board board = (Board) o;
        return whiteBB == board.whiteBB && blackBB == board.blackBB;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(whiteBB * 31 + blackBB);
    }
}
