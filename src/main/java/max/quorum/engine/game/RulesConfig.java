package max.quorum.engine.game;

import java.util.Locale;

/**
 * Rule variants for the situations the rules leave open.
 * <p>
 * Defaults can be overridden with the {@code quorum.winCheckAfterPlacement} and {@code quorum.noLegalPlay} system
 * properties, see {@link #fromSystemProperties()}.
 */
public final class RulesConfig {

    public enum NoLegalPlayPolicy {
        /** The player left without a legal play loses. */
        LOSS,
        /** The player left without a legal play passes; the game is drawn when both are stuck. */
        PASS
    }

    public static final RulesConfig DEFAULT = new Builder().build();

    public final boolean winCheckAfterPlacement;
    public final NoLegalPlayPolicy noLegalPlay;

    private RulesConfig(Builder b) {
        winCheckAfterPlacement = b.winCheckAfterPlacement;
        noLegalPlay = b.noLegalPlay;
    }

    public static RulesConfig fromSystemProperties() {
        return new Builder()
                .winCheckAfterPlacement(Boolean.parseBoolean(System.getProperty("quorum.winCheckAfterPlacement", "true")))
                .noLegalPlay(parseNoLegalPlay(System.getProperty("quorum.noLegalPlay", "loss")))
                .build();
    }

    public static NoLegalPlayPolicy parseNoLegalPlay(String value) {
        try {
            return NoLegalPlayPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown no-legal-play policy '" + value + "', expected loss or pass", e);
        }
    }

    public Builder toBuilder() {
        return new Builder().winCheckAfterPlacement(winCheckAfterPlacement).noLegalPlay(noLegalPlay);
    }

    @Override
    public String toString() {
        return "RulesConfig{winCheckAfterPlacement=" + winCheckAfterPlacement + ", noLegalPlay=" + noLegalPlay + '}';
    }

    public static class Builder {
        private boolean winCheckAfterPlacement = true;
        private NoLegalPlayPolicy noLegalPlay = NoLegalPlayPolicy.LOSS;

        public Builder winCheckAfterPlacement(boolean v){winCheckAfterPlacement=v;return this;}
        public Builder noLegalPlay(NoLegalPlayPolicy v){noLegalPlay=v;return this;}
        public RulesConfig build(){return new RulesConfig(this);}
    }
}
