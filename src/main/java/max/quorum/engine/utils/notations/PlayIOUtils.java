package max.quorum.engine.utils.notations;

import max.quorum.engine.common.Color;
import max.quorum.engine.common.Square;
import max.quorum.engine.game.GameState;
import max.quorum.engine.game.IllegalPlayException;
import max.quorum.engine.game.IllegalPlayException.Rule;
import max.quorum.engine.movegen.MoveGenerator;
import max.quorum.engine.movegen.Movement;
import max.quorum.engine.movegen.Placement;
import max.quorum.engine.movegen.Play;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text forms of squares, plays and results.
 * <p>
 * A movement is written as its origin and target squares ({@code b1d3}, or {@code b1-d3} with a separator); the
 * center is the square halfway between them. A placement is written {@code +} or {@code ++}.
 */
public class PlayIOUtils {
    public static final String WHITE_WINS = "1-0";
    public static final String BLACK_WINS = "0-1";
    public static final String DRAW = "½-½";
    public static final String IN_PROGRESS = "*";

    private static final Pattern MOVEMENT_PATTERN = Pattern.compile("([a-h][1-8])\\s*-?\\s*([a-h][1-8])");
    private static final Pattern PLACEMENT_PATTERN = Pattern.compile("\\+\\+?");

    public static String getSquareFromPosition(Square square) {
        return getLetterFromPosition(square) + getNumberFromPosition(square);
    }

    public static String getNumberFromPosition(Square square) {
        if(square.getRank() < 0 || square.getRank() > 7) {
            throw new IllegalArgumentException("square rank should be in [0-7], was " + square.getRank());
        }
        return String.valueOf(square.getRank() + 1);
    }

    public static String getLetterFromPosition(Square square) {
        return switch(square.getFile()) {
            case 0 -> "a";
            case 1 -> "b";
            case 2 -> "c";
            case 3 -> "d";
            case 4 -> "e";
            case 5 -> "f";
            case 6 -> "g";
            case 7 -> "h";
            default -> throw new IllegalArgumentException("square file should be in [0-7], was " + square.getFile());
        };
    }

    public static Square getPositionFromSquare(String square) {
        char[] squareChars = square.trim().toLowerCase(Locale.ROOT).toCharArray();
        if(squareChars.length != 2) {
            throw new IllegalArgumentException("square should be format 'a1', was '" + square + "'");
        }

        int x = switch (squareChars[0]) {
            case 'a' -> 0;
            case 'b' -> 1;
            case 'c' -> 2;
            case 'd' -> 3;
            case 'e' -> 4;
            case 'f' -> 5;
            case 'g' -> 6;
            case 'h' -> 7;
            default -> throw new IllegalArgumentException("square letter should be in [a-h], was '" + square + "'");
        };

        int y = squareChars[1] - '1';
        if(y < 0 || y > 7) {
            throw new IllegalArgumentException("square digit should be in [1-8], was '" + square + "'");
        }

        return Square.of(x, y);
    }

    public static String writePlay(Play play) {
        return writePlay(play, DisplayStyle.DEFAULT);
    }

    public static String writePlay(Play play, DisplayStyle style) {
        if(play instanceof Movement movement) {
            Square active = movement.active();
            Square center = movement.center();
            // raw coordinates, the target of a hand-built movement may lie beyond the square cache
            int targetFile = 2 * center.getFile() - active.getFile();
            int targetRank = 2 * center.getRank() - active.getRank();
            return writeSquare(active.getFile(), active.getRank(), style) + style.fromToSeparator()
                    + writeSquare(targetFile, targetRank, style);
        }
        return style.placement();
    }

    private static String writeSquare(int file, int rank, DisplayStyle style) {
        if(file < 0 || file >= Square.BOARD_SIZE || rank < 0 || rank >= Square.BOARD_SIZE) {
            return "<" + file + "," + rank + ">";
        }
        return String.valueOf(style.file(file)) + style.rank(rank);
    }

    /**
     * Reads a play for the player to move in {@code state}. Legality is not checked beyond what the notation itself
     * implies: a placement needs at least one empty home square, and a movement needs a square halfway between its
     * origin and target.
     *
     * @throws IllegalArgumentException if the text is not a play
     * @throws IllegalPlayException if the text cannot denote a legal play
     */
    public static Play parsePlay(String notation, GameState state) {
        String text = notation.trim().toLowerCase(Locale.ROOT);
        if(PLACEMENT_PATTERN.matcher(text).matches()) {
            return MoveGenerator.legalPlacement(state).orElseThrow(() -> new IllegalPlayException(Rule.HOME_OCCUPANCY,
                    "No empty home square left for " + state.currentPlayer()));
        }
        return parseMovement(text);
    }

    public static Movement parseMovement(String notation) {
        Matcher matcher = MOVEMENT_PATTERN.matcher(notation.trim().toLowerCase(Locale.ROOT));
        if(!matcher.matches()) {
            throw new IllegalArgumentException("Cannot parse play notation '" + notation + "'");
        }
        Square origin = getPositionFromSquare(matcher.group(1));
        Square target = getPositionFromSquare(matcher.group(2));

        int fileDelta = target.getFile() - origin.getFile();
        int rankDelta = target.getRank() - origin.getRank();
        if(fileDelta % 2 != 0 || rankDelta % 2 != 0) {
            throw new IllegalPlayException(Rule.DISTANCE,
                    "No square lies halfway between " + origin + " and " + target);
        }
        return new Movement(origin, Square.of(origin.getFile() + fileDelta / 2, origin.getRank() + rankDelta / 2));
    }

    public static String writeResult(GameState state) {
        if(!state.isGameOver()) {
            return IN_PROGRESS;
        }
        return state.winner().map(PlayIOUtils::writeWin).orElse(DRAW);
    }

    public static String writeWin(Color winner) {
        return winner == Color.WHITE ? WHITE_WINS : BLACK_WINS;
    }

    /**
     * Numbered move list, white and black plays side by side:
     * <pre>
     *  1. b1-d3  g8-e6
     *  2. ++     f7-d5
     * </pre>
     *
     * @param result appended after the last play when not {@code null}
     */
    public static String writeScoreSheet(List<? extends Play> plays, String result, DisplayStyle style) {
        List<String> tokens = new ArrayList<>(plays.size() + 1);
        for(Play play : plays) {
            tokens.add(writePlay(play, style));
        }
        if(result != null) {
            tokens.add(result);
        }

        StringBuilder sb = new StringBuilder();
        int width = style.moveWidth();
        for(int i = 0; i < tokens.size(); i += 2) {
            StringBuilder line = new StringBuilder();
            line.append(String.format("%3s ", (i / 2 + 1) + "."));
            line.append(padRight(tokens.get(i), width));
            if(i + 1 < tokens.size()) {
                line.append(' ').append(padRight(tokens.get(i + 1), width));
            }
            if(sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(line.toString().stripTrailing());
        }
        return sb.toString();
    }

    public static String writeScoreSheet(List<? extends Play> plays, String result) {
        return writeScoreSheet(plays, result, DisplayStyle.DEFAULT);
    }

    private static String padRight(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }
}
