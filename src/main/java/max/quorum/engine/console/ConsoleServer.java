package max.quorum.engine.console;

import max.quorum.engine.common.Color;
import max.quorum.engine.game.IllegalPlayException;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line based console for playing a game by hand or from a script.
 * <p>
 * Commands: {@code quorum}, {@code isready}, {@code setoption name <id> value <x>}, {@code newgame},
 * {@code position startpos [moves ...]}, {@code position diagram <row/row/...> <w|b> [moves ...]},
 * {@code play <play>}, {@code moves}, {@code history}, {@code print}, {@code quit}.
 * A rejected command is answered by {@code illegal <rule> <reason>} or {@code error <reason>} and the game is left
 * as it was.
 */
public final class ConsoleServer {
    // option names may hold spaces, the value is the rest of the line
    private static final Pattern SET_OPTION = Pattern.compile("setoption\\s+name\\s+(.+?)(?:\\s+value\\s+(.*))?");

    private final String name;
    private final ConsoleEngine engine;

    private final PrintWriter out;
    private final BufferedReader in;

    public ConsoleServer(String name, ConsoleEngine engine) {
        this(name, engine,
                new InputStreamReader(System.in, StandardCharsets.UTF_8),
                new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
    }

    public ConsoleServer(String name, ConsoleEngine engine, Reader in, Writer out) {
        this.name = Objects.requireNonNull(name);
        this.engine = Objects.requireNonNull(engine);
        this.in = new BufferedReader(in);
        this.out = new PrintWriter(out, true);
    }

    /** Run the console loop on the current thread, until "quit" or the end of the input. */
    public void run() {
        try {
            String line;
            while ((line = in.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                if (line.equals("quit")) {
                    break;
                }
                try {
                    handle(line);
                } catch (IllegalPlayException e) {
                    send("illegal " + e.rule().name().toLowerCase(Locale.ROOT) + " " + e.getMessage());
                } catch (IllegalArgumentException | IllegalStateException e) {
                    send("error " + e.getMessage());
                }
            }
        } catch (IOException e) {
            System.err.println("Console input failed: " + e.getMessage());
        } finally {
            out.flush();
        }
    }

    private void handle(String line) {
        if (line.equals("quorum")) {
            send("id name " + name);
            send("quorumok");
        } else if (line.equals("isready")) {
            engine.onIsReady();
            send("readyok");
        } else if (line.startsWith("setoption")) {
            handleSetOption(line);
        } else if (line.equals("newgame")) {
            engine.newGame();
        } else if (line.startsWith("position")) {
            handlePosition(line);
        } else if (line.startsWith("play ")) {
            send(engine.play(line.substring("play".length()).trim()).toReply());
        } else if (line.equals("moves")) {
            send(("moves " + String.join(" ", engine.legalPlays())).trim());
        } else if (line.equals("history")) {
            for (String sheetLine : engine.scoreSheet().split("\n")) {
                if (!sheetLine.isEmpty()) send(sheetLine);
            }
        } else if (line.equals("print")) {
            engine.debugDump(this::send);
        } else {
            send("error unknown command '" + line + "'");
        }
    }

    /* -------------------- command handlers -------------------- */

    private void handleSetOption(String line) {
        Matcher matcher = SET_OPTION.matcher(line);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("expected 'setoption name <id> value <x>'");
        }
        String value = matcher.group(2);
        engine.setOption(matcher.group(1), value == null ? "" : value);
    }

    private void handlePosition(String line) {
        // position [startpos | diagram <rows> <w|b>] [moves <m1> <m2> ...]
        String rest = line.substring("position".length()).trim();
        List<String> moves = List.of();
        int idx = rest.indexOf("moves");
        if (idx >= 0) {
            moves = splitMoves(rest.substring(idx + "moves".length()).trim());
            rest = rest.substring(0, idx).trim();
        }

        if (rest.equals("startpos")) {
            engine.setPositionStartpos(moves);
        } else if (rest.startsWith("diagram")) {
            String[] fields = rest.substring("diagram".length()).trim().split("\\s+");
            if (fields.length != 2) {
                throw new IllegalArgumentException("expected 'position diagram <rows> <w|b>'");
            }
            engine.setPositionDiagram(fields[0], parseColor(fields[1]), moves);
        } else {
            throw new IllegalArgumentException("expected 'position startpos' or 'position diagram'");
        }
    }

    private static Color parseColor(String token) {
        return switch (token) {
            case "w" -> Color.WHITE;
            case "b" -> Color.BLACK;
            default -> throw new IllegalArgumentException("side to move should be 'w' or 'b', was '" + token + "'");
        };
    }

    private static List<String> splitMoves(String s) {
        return s.isEmpty() ? List.of() : List.of(s.split("\\s+"));
    }

    private void send(String line) {
        out.println(line);
    }
}
