package max.quorum.engine.utils.notations;

import max.quorum.engine.common.Color;
import max.quorum.engine.common.Square;
import max.quorum.engine.game.GameState;
import max.quorum.engine.game.IllegalPlayException;
import max.quorum.engine.game.IllegalPlayException.Rule;
import max.quorum.engine.game.board.utils.BoardGenerator;
import max.quorum.engine.movegen.Movement;
import max.quorum.engine.movegen.Placement;
import max.quorum.engine.movegen.Play;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PlayIOUtilsTest {

    @Test
    public void squareNames() {
        for(int index = 0; index < 64; index++) {
            Square square = Square.of(index);
            String name = PlayIOUtils.getSquareFromPosition(square);
            assertSame(square, PlayIOUtils.getPositionFromSquare(name));
        }
        assertEquals("a1", PlayIOUtils.getSquareFromPosition(Square.of(0)));
        assertEquals("h8", PlayIOUtils.getSquareFromPosition(Square.of(63)));
        assertSame(Square.of(4, 3), PlayIOUtils.getPositionFromSquare("E4"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a", "i1", "a0", "a9", "e10", "4e"})
    public void malformedSquares(String square) {
        assertThrows(IllegalArgumentException.class, () -> PlayIOUtils.getPositionFromSquare(square));
    }

    @Test
    public void offBoardSquaresHaveNoName() {
        assertThrows(IllegalArgumentException.class, () -> PlayIOUtils.getSquareFromPosition(Square.of(8, 0)));
        assertThrows(IllegalArgumentException.class, () -> PlayIOUtils.getSquareFromPosition(Square.of(0, -1)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"b1d3", "b1-d3", "B1-D3", " b1 - d3 "})
    public void movementForms(String notation) {
        assertEquals(Movement.of("b1", "c2"), PlayIOUtils.parseMovement(notation));
    }

    @Test
    public void straightMovement() {
        assertEquals(Movement.of("a3", "a4"), PlayIOUtils.parseMovement("a3a5"));
        assertEquals(Movement.of("h8", "g7"), PlayIOUtils.parseMovement("h8-f6"));
    }

    @Test
    public void movementWithoutCenter() {
        IllegalPlayException e = assertThrows(IllegalPlayException.class, () -> PlayIOUtils.parseMovement("a1b2"));
        assertEquals(Rule.DISTANCE, e.rule());
        assertThrows(IllegalArgumentException.class, () -> PlayIOUtils.parseMovement("e4"));
        assertThrows(IllegalArgumentException.class, () -> PlayIOUtils.parseMovement("a1-b2-c3"));
    }

    @Test
    public void placementNotation() {
        GameState state = BoardGenerator.from("......../......../......../......../......../......../o......./.o......",
                Color.WHITE);

        Play single = PlayIOUtils.parsePlay("+", state);
        Play doubled = PlayIOUtils.parsePlay("++", state);

        assertInstanceOf(Placement.class, single);
        assertEquals(single, doubled);
        assertEquals(Set.of(Square.of(0), Square.of(9)), ((Placement) single).squares());
    }

    @Test
    public void placementWithFullHome() {
        IllegalPlayException e = assertThrows(IllegalPlayException.class,
                () -> PlayIOUtils.parsePlay("++", GameState.initial()));
        assertEquals(Rule.HOME_OCCUPANCY, e.rule());
    }

    @Test
    public void playsInEachStyle() {
        Movement movement = Movement.of("b1", "c2");
        Placement placement = new Placement(Set.of(Square.of(0)));

        assertEquals("b1-d3", PlayIOUtils.writePlay(movement));
        assertEquals("++", PlayIOUtils.writePlay(placement));
        assertEquals("b1d3", PlayIOUtils.writePlay(movement, DisplayStyle.LOWERCASE_ASCII));
        assertEquals("+", PlayIOUtils.writePlay(placement, DisplayStyle.LOWERCASE_ASCII));
        assertEquals("B1D3", PlayIOUtils.writePlay(movement, DisplayStyle.UPPERCASE_ASCII));
        assertEquals("β1δ3", PlayIOUtils.writePlay(movement, DisplayStyle.GREEK));
    }

    @Test
    public void results() {
        assertEquals("*", PlayIOUtils.writeResult(GameState.initial()));
        assertEquals("1-0", PlayIOUtils.writeWin(Color.WHITE));
        assertEquals("0-1", PlayIOUtils.writeWin(Color.BLACK));
    }

    @Test
    public void scoreSheetWithoutResult() {
        List<Play> plays = List.of(Movement.of("b1", "c2"), Movement.of("g8", "f7"), new Placement(Set.of(Square.of(1))));

        assertEquals(" 1. b1-d3  g8-e6\n 2. ++", PlayIOUtils.writeScoreSheet(plays, null));
        assertEquals(" 1. b1d3  g8e6\n 2. +", PlayIOUtils.writeScoreSheet(plays, null, DisplayStyle.LOWERCASE_ASCII));
        assertEquals("", PlayIOUtils.writeScoreSheet(List.of(), null));
    }

    @Test
    public void styleNames() {
        assertSame(DisplayStyle.CIRCLES, DisplayStyle.byName("circles"));
        assertSame(DisplayStyle.LOWERCASE_ASCII, DisplayStyle.byName("ascii"));
        assertSame(DisplayStyle.UPPERCASE_ASCII, DisplayStyle.byName("Uppercase-ASCII"));
        assertSame(DisplayStyle.GREEK, DisplayStyle.byName("greek"));
        assertThrows(IllegalArgumentException.class, () -> DisplayStyle.byName("runes"));
    }
}
