package max.quorum.engine.console;

import max.quorum.engine.game.GameState;
import max.quorum.engine.utils.notations.DisplayStyle;
import max.quorum.engine.utils.notations.PlayIOUtils;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/** Engine returns this once a play has been applied. */
public final class PlayResult {
    public final String play;
    public final List<String> suffocated;
    public final List<String> converted;
    public final String result; // null while the game goes on
    public final String reason; // nullable

    public PlayResult(String play, List<String> suffocated, List<String> converted, String result, String reason) {
        this.play = play;
        this.suffocated = List.copyOf(suffocated);
        this.converted = List.copyOf(converted);
        this.result = result;
        this.reason = reason;
    }

    public static PlayResult of(GameState state, DisplayStyle style) {
        String play = state.lastPlay().map(p -> PlayIOUtils.writePlay(p, style)).orElse("");
        List<String> suffocated = state.lastEffects().suffocated().stream()
                .map(PlayIOUtils::getSquareFromPosition).collect(Collectors.toList());
        List<String> converted = state.lastEffects().converted().stream()
                .map(PlayIOUtils::getSquareFromPosition).collect(Collectors.toList());
        if(!state.isGameOver()) {
            return new PlayResult(play, suffocated, converted, null, null);
        }
        String reason = state.playerState().name().toLowerCase(Locale.ROOT);
        return new PlayResult(play, suffocated, converted, PlayIOUtils.writeResult(state), reason);
    }

    /** Single reply line, e.g. {@code ok f1-f3 suffocated f4 converted e5 result 1-0 quorum}. */
    public String toReply() {
        StringBuilder sb = new StringBuilder("ok ").append(play);
        if(!suffocated.isEmpty()) {
            sb.append(" suffocated ").append(String.join(" ", suffocated));
        }
        if(!converted.isEmpty()) {
            sb.append(" converted ").append(String.join(" ", converted));
        }
        if(result != null) {
            sb.append(" result ").append(result).append(' ').append(reason);
        }
        return sb.toString();
    }
}
