package max.quorum.engine.common;

/**
 * A board coordinate. Instances are cached, so identity comparison is enough.
 * <p>
 * The cache also holds off-board coordinates and relative vectors (down to -8 and up to 15 on both axes) so that
 * reflections and direction deltas can be expressed as squares; only squares for which {@link #isInBounds()} holds
 * can carry a stone.
 */
public final class Square {
    public static final int BOARD_SIZE = 8;

    private static final int MIN_COORDINATE = -8;
    private static final int MAX_COORDINATE = 15;
    private static final int CACHE_WIDTH = MAX_COORDINATE - MIN_COORDINATE + 1;

    private static final Square[] SQUARE_CACHE = new Square[CACHE_WIDTH * CACHE_WIDTH];
    private static final Square[] BOARD_SQUARES = new Square[BOARD_SIZE * BOARD_SIZE];
    static {
        for(int file = MIN_COORDINATE; file <= MAX_COORDINATE; file++) {
            for(int rank = MIN_COORDINATE; rank <= MAX_COORDINATE; rank++) {
                Square square = new Square(file, rank);
                SQUARE_CACHE[getCacheIndex(file, rank)] = square;
                if(square.isInBounds()) {
                    BOARD_SQUARES[square.flatIndex] = square;
                }
            }
        }
    }

    public static Square of(int file, int rank) {
        if(file < MIN_COORDINATE || file > MAX_COORDINATE || rank < MIN_COORDINATE || rank > MAX_COORDINATE) {
            throw new IllegalArgumentException("Coordinate out of supported range: (" + file + ", " + rank + ")");
        }
        return SQUARE_CACHE[getCacheIndex(file, rank)];
    }

    public static Square of(int flatIndex) {
        if(flatIndex < 0 || flatIndex >= BOARD_SQUARES.length) {
            throw new IllegalArgumentException("Flat index should be in [0-63], was " + flatIndex);
        }
        return BOARD_SQUARES[flatIndex];
    }

    private static int getCacheIndex(int file, int rank) {
        return CACHE_WIDTH * (file - MIN_COORDINATE) + (rank - MIN_COORDINATE);
    }

    private final int file;
    private final int rank;
    // -1 when the square is off the board
    private final int flatIndex;

    private Square(int file, int rank) {
        this.file = file;
        this.rank = rank;
        this.flatIndex = isInBounds(file, rank) ? file + BOARD_SIZE * rank : -1;
    }

    private static boolean isInBounds(int file, int rank) {
        return file >= 0 && file < BOARD_SIZE && rank >= 0 && rank < BOARD_SIZE;
    }

    public boolean isInBounds() {
        return flatIndex >= 0;
    }

    public Square add(Square vector) {
        return Square.of(file + vector.file, rank + vector.rank);
    }

    public Square subtract(Square other) {
        return Square.of(file - other.file, rank - other.rank);
    }

    public int getFile() {
        return file;
    }

    public int getRank() {
        return rank;
    }

    public int getFlatIndex() {
        if(flatIndex < 0) {
            throw new IllegalStateException(this + " is not on the board");
        }
        return flatIndex;
    }

    public long bitMask() {
        return 1L << getFlatIndex();
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this;
    }

    @Override
    public int hashCode() {
        return getCacheIndex(file, rank);
    }

    @Override
    public String toString() {
        if(!isInBounds()) {
            return "<" + file + "," + rank + ">";
        }
        return String.valueOf((char) ('a' + file)) + (rank + 1);
    }
}
