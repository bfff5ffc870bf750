package max.quorum.engine.movegen;

import max.quorum.engine.common.Square;
import max.quorum.engine.utils.GeometryUtils;
import max.quorum.engine.utils.notations.PlayIOUtils;

import java.util.Objects;

/**
 * The active stone jumps over the center stone and lands on the reflection of its square through the center.
 * <p>
 * Legal movements are also handled as packed ints on the generator's hot path: bits 6-11 hold the active square
 * index and bits 0-5 the center square index.
 */
public record Movement(Square active, Square center) implements Play {
    private static final int SQUARE_MASK = 0b111111;

    public Movement {
        Objects.requireNonNull(active, "active");
        Objects.requireNonNull(center, "center");
    }

    public static Movement of(String active, String center) {
        return new Movement(PlayIOUtils.getPositionFromSquare(active), PlayIOUtils.getPositionFromSquare(center));
    }

    public Square target() {
        return GeometryUtils.reflect(active, center);
    }

    public int toBytes() {
        return asBytes(active.getFlatIndex(), center.getFlatIndex());
    }

    public static int asBytes(final int activePosition, final int centerPosition) {
        return (activePosition << 6) | centerPosition;
    }

    public static Movement fromBytes(final int bytes) {
        return new Movement(Square.of(getActivePosition(bytes)), Square.of(getCenterPosition(bytes)));
    }

    public static int getActivePosition(final int bytes) {
        return (bytes >> 6) & SQUARE_MASK;
    }

    public static int getCenterPosition(final int bytes) {
        return bytes & SQUARE_MASK;
    }

    @Override
    public String toString() {
        return PlayIOUtils.writePlay(this);
    }
}
