package max.quorum.engine.movegen;

/**
 * One complete turn: either a {@link Movement} or a {@link Placement}.
 */
public sealed interface Play permits Movement, Placement {
}
