package max.quorum.engine.console;

import max.quorum.engine.common.Color;
import max.quorum.engine.game.GameController;
import max.quorum.engine.game.GameState;
import max.quorum.engine.game.RulesConfig;
import max.quorum.engine.game.board.utils.BoardGenerator;
import max.quorum.engine.movegen.MoveGenerator;
import max.quorum.engine.movegen.Play;
import max.quorum.engine.utils.notations.BoardPrinter;
import max.quorum.engine.utils.notations.DisplayStyle;
import max.quorum.engine.utils.notations.PlayIOUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

public class ConsoleEngineImpl implements ConsoleEngine {
    private GameController controller;
    private DisplayStyle style;
    private GameState state;
    private final List<Play> history = new ArrayList<>();

    public ConsoleEngineImpl() {
        this(RulesConfig.fromSystemProperties(), DisplayStyle.byName(System.getProperty("quorum.style", "circles")));
    }

    public ConsoleEngineImpl(RulesConfig rules, DisplayStyle style) {
        this.controller = new GameController(rules);
        this.style = style;
        this.state = controller.initialState();
    }

    @Override
    public void newGame() {
        state = controller.initialState();
        history.clear();
    }

    @Override
    public void setOption(String name, String value) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "style" -> style = DisplayStyle.byName(value);
            case "nolegalplay" -> controller = new GameController(
                    controller.rules().toBuilder().noLegalPlay(RulesConfig.parseNoLegalPlay(value)).build());
            case "wincheckafterplacement" -> controller = new GameController(
                    controller.rules().toBuilder().winCheckAfterPlacement(Boolean.parseBoolean(value)).build());
            default -> throw new IllegalArgumentException("Unknown option '" + name + "'");
        }
    }

    @Override
    public void setPositionStartpos(List<String> moves) {
        replay(controller.initialState(), moves);
    }

    @Override
    public void setPositionDiagram(String diagram, Color toMove, List<String> moves) {
        replay(BoardGenerator.from(diagram, toMove), moves);
    }

    // all or nothing: the current game is only replaced once every play went through
    private void replay(GameState start, List<String> moves) {
        GameState current = start;
        List<Play> plays = new ArrayList<>(moves.size());
        for(String move : moves) {
            Play play = PlayIOUtils.parsePlay(move, current);
            current = controller.apply(current, play);
            plays.add(play);
        }
        state = current;
        history.clear();
        history.addAll(plays);
    }

    @Override
    public PlayResult play(String notation) {
        Play play = PlayIOUtils.parsePlay(notation, state);
        state = controller.apply(state, play);
        history.add(play);
        return PlayResult.of(state, style);
    }

    @Override
    public List<String> legalPlays() {
        if(state.isGameOver()) {
            return List.of();
        }
        return MoveGenerator.legalPlays(state).stream().map(play -> PlayIOUtils.writePlay(play, style)).toList();
    }

    @Override
    public String scoreSheet() {
        String result = state.isGameOver() ? PlayIOUtils.writeResult(state) : null;
        return PlayIOUtils.writeScoreSheet(history, result, style);
    }

    @Override
    public void debugDump(Consumer<String> out) {
        for(String line : BoardPrinter.print(state, style).split("\n")) {
            out.accept(line);
        }
    }

    public GameState state() {
        return state;
    }

    public DisplayStyle style() {
        return style;
    }

    public RulesConfig rules() {
        return controller.rules();
    }
}
