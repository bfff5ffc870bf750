package max.quorum.engine.movegen;

import max.quorum.engine.common.Square;
import max.quorum.engine.utils.notations.PlayIOUtils;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * New stones on every square of the set. Only legal when the set is exactly the mover's empty home squares.
 */
public record Placement(Set<Square> squares) implements Play {

    public Placement {
        squares = Collections.unmodifiableSet(new LinkedHashSet<>(squares));
    }

    @Override
    public String toString() {
        return PlayIOUtils.writePlay(this);
    }
}
