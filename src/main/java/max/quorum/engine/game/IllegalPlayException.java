package max.quorum.engine.game;

/**
 * Thrown when a play is not legal in the state it is applied to. Nothing has been written to the state when this
 * is raised.
 */
public class IllegalPlayException extends RuntimeException {

    public enum Rule {
        /** The game already has a result. */
        GAME_OVER,
        /** Active or center square does not hold one of the mover's stones. */
        OWNERSHIP,
        /** Active and center are not adjacent, or are the same square. */
        DISTANCE,
        /** Target square is off the board or not empty. */
        SPACE,
        /** Placement squares differ from the mover's empty home squares, or there are none. */
        HOME_OCCUPANCY
    }

    private final Rule rule;

    public IllegalPlayException(Rule rule, String message) {
        super(message);
        this.rule = rule;
    }

    public Rule rule() {
        return rule;
    }
}
