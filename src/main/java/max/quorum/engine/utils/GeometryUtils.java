package max.quorum.engine.utils;

import max.quorum.engine.common.Square;

/**
 * Stateless board geometry. Adjacency counts diagonals (Chebyshev distance 1).
 */
public final class GeometryUtils {
    public static final Square[] DIRECTIONS = {
            Square.of(-1, -1), Square.of(-1, 0), Square.of(-1, 1), Square.of(0, 1),
            Square.of(1, 1), Square.of(1, 0), Square.of(1, -1), Square.of(0, -1)
    };

    // in-bounds neighbours of each square, as bitboards
    private static final long[] NEIGHBOURS_BB = new long[64];
    static {
        for(int index = 0; index < 64; index++) {
            Square square = Square.of(index);
            long bb = 0L;
            for(Square direction : DIRECTIONS) {
                Square neighbour = square.add(direction);
                if(neighbour.isInBounds()) {
                    bb |= neighbour.bitMask();
                }
            }
            NEIGHBOURS_BB[index] = bb;
        }
    }

    private GeometryUtils() {
    }

    public static boolean adjacent(Square p, Square q) {
        int fileDelta = Math.abs(p.getFile() - q.getFile());
        int rankDelta = Math.abs(p.getRank() - q.getRank());
        return p != q && fileDelta <= 1 && rankDelta <= 1;
    }

    public static boolean inBounds(Square square) {
        return square.isInBounds();
    }

    public static boolean inBounds(int file, int rank) {
        return file >= 0 && file < Square.BOARD_SIZE && rank >= 0 && rank < Square.BOARD_SIZE;
    }

    /**
     * Reflection of {@code active} through {@code center}: {@code center + (center - active)} on each axis.
     * No bounds check is made, the result may be off the board.
     */
    public static Square reflect(Square active, Square center) {
        return center.add(center.subtract(active));
    }

    /**
     * Unit delta from {@code from} to {@code to}. Both squares must be adjacent.
     */
    public static Square direction(Square from, Square to) {
        return Square.of(Integer.signum(to.getFile() - from.getFile()), Integer.signum(to.getRank() - from.getRank()));
    }

    public static long getNeighboursBB(Square square) {
        return NEIGHBOURS_BB[square.getFlatIndex()];
    }

    public static long getNeighboursBB(int flatIndex) {
        return NEIGHBOURS_BB[flatIndex];
    }
}
