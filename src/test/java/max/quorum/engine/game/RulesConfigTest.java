package max.quorum.engine.game;

import max.quorum.engine.game.RulesConfig.NoLegalPlayPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RulesConfigTest {

    @Test
    public void defaults() {
        RulesConfig rules = RulesConfig.DEFAULT;
        assert rules.winCheckAfterPlacement;
        assertEquals(NoLegalPlayPolicy.LOSS, rules.noLegalPlay);
    }

    @Test
    public void builderCopiesAnExistingConfig() {
        RulesConfig rules = new RulesConfig.Builder().noLegalPlay(NoLegalPlayPolicy.PASS).build();

        RulesConfig changed = rules.toBuilder().winCheckAfterPlacement(false).build();

        assert !changed.winCheckAfterPlacement;
        assertEquals(NoLegalPlayPolicy.PASS, changed.noLegalPlay);
        assert rules.winCheckAfterPlacement;
    }

    @Test
    public void policyNames() {
        assertEquals(NoLegalPlayPolicy.PASS, RulesConfig.parseNoLegalPlay(" Pass "));
        assertEquals(NoLegalPlayPolicy.LOSS, RulesConfig.parseNoLegalPlay("loss"));
        assertThrows(IllegalArgumentException.class, () -> RulesConfig.parseNoLegalPlay("draw"));
    }

    @Test
    public void systemProperties() {
        System.setProperty("quorum.noLegalPlay", "pass");
        System.setProperty("quorum.winCheckAfterPlacement", "false");
        try {
            RulesConfig rules = RulesConfig.fromSystemProperties();
            assertEquals(NoLegalPlayPolicy.PASS, rules.noLegalPlay);
            assert !rules.winCheckAfterPlacement;
        } finally {
            System.clearProperty("quorum.noLegalPlay");
            System.clearProperty("quorum.winCheckAfterPlacement");
        }

        RulesConfig rules = RulesConfig.fromSystemProperties();
        assertEquals(NoLegalPlayPolicy.LOSS, rules.noLegalPlay);
        assert rules.winCheckAfterPlacement;
    }
}
