package max.quorum.engine.effects;

import max.quorum.engine.common.Color;
import max.quorum.engine.common.Square;
import max.quorum.engine.game.board.Board;
import max.quorum.engine.utils.BitUtils;
import max.quorum.engine.utils.GeometryUtils;

/**
 * Suffocation and conversion after a movement.
 * <p>
 * Both sets are computed from a frozen copy of the board taken right after the active stone landed, before any stone
 * is removed or flipped, so neither membership depends on the other. They are then applied in a fixed order:
 * suffocated stones are removed first, converted stones are replaced by the mover's color second. A stone in both
 * sets therefore ends up as a mover's stone.
 */
public final class EffectResolver {

    private EffectResolver() {
    }

    /**
     * @param board the board after the relocation of the active stone to {@code target}; not modified
     * @param mover color of the player who moved
     * @param target square the active stone landed on
     */
    public static Effects resolve(Board board, Color mover, Square target) {
        final Board snapshot = board.copy();
        final long opponentBB = snapshot.getColorBB(mover.getOppositeColor());
        long suffocatedBB = 0L;
        long convertedBB = 0L;

        // only opponent stones next to the landing square can be affected; the mover's own stones never are
        long candidatesBB = GeometryUtils.getNeighboursBB(target) & opponentBB;
        while(candidatesBB != 0) {
            int index = BitUtils.bitScanForward(candidatesBB);
            candidatesBB &= candidatesBB - 1;
            Square candidate = Square.of(index);

            if(snapshot.emptyNeighbourCount(candidate) == 0) {
                suffocatedBB |= candidate.bitMask();
            }

            // (mover, opponent, mover) in a straight line with no gap
            Square beyond = candidate.add(GeometryUtils.direction(target, candidate));
            if(snapshot.hasStone(beyond, mover)) {
                convertedBB |= candidate.bitMask();
            }
        }
        return new Effects(suffocatedBB, convertedBB);
    }

    public static void apply(Board board, Color mover, Effects effects) {
        for(Square suffocated : effects.suffocated()) {
            board.set(suffocated, null);
        }
        for(Square converted : effects.converted()) {
            // set() clears the square before putting the mover's stone
            board.set(converted, mover);
        }
    }

    public static Effects resolveAndApply(Board board, Color mover, Square target) {
        Effects effects = resolve(board, mover, target);
        apply(board, mover, effects);
        return effects;
    }
}
