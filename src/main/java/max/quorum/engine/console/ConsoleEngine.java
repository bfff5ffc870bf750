package max.quorum.engine.console;

import max.quorum.engine.common.Color;

import java.util.List;
import java.util.function.Consumer;

/** Bridge between the console line protocol and a game. */
public interface ConsoleEngine {
    /** Called on "newgame". Back to the starting layout, white to move. */
    void newGame();

    /** Called on "isready". */
    default void onIsReady() {}

    /** Called on "setoption name X value Y". */
    default void setOption(String name, String value) {}

    /** "position startpos [moves ...]" */
    void setPositionStartpos(List<String> moves);

    /** "position diagram &lt;rows&gt; &lt;w|b&gt; [moves ...]" */
    void setPositionDiagram(String diagram, Color toMove, List<String> moves);

    /** "play &lt;play&gt;". Throws when the play is malformed or illegal; the game is then left untouched. */
    PlayResult play(String notation);

    /** "moves": every legal play of the player to move, in notation. */
    List<String> legalPlays();

    /** "history": the score sheet of the game so far. */
    String scoreSheet();

    /** Debug hook for the "print" command. */
    default void debugDump(Consumer<String> out) {}
}
