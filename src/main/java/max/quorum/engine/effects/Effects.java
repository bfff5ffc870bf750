package max.quorum.engine.effects;

import max.quorum.engine.common.Square;
import max.quorum.engine.utils.BitUtils;

import java.util.List;

/**
 * Opponent stones affected by a movement, as bitboards computed from one snapshot.
 */
public record Effects(long suffocatedBB, long convertedBB) {
    public static final Effects NONE = new Effects(0L, 0L);

    public List<Square> suffocated() {
        return BitUtils.toSquares(suffocatedBB);
    }

    public List<Square> converted() {
        return BitUtils.toSquares(convertedBB);
    }

    public boolean isEmpty() {
        return suffocatedBB == 0 && convertedBB == 0;
    }
}
