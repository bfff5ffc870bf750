package max.quorum.engine.utils;

import max.quorum.engine.common.Square;
import max.quorum.engine.utils.notations.PlayIOUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

public class GeometryUtilsTest {

    private static Square sq(String square) {
        return PlayIOUtils.getPositionFromSquare(square);
    }

    @ParameterizedTest
    @CsvSource({
            "a1, c2, e3",
            "b1, c2, d3",
            "c1, d1, e1",
            "h8, g7, f6",
            "d4, d4, d4",
    })
    public void reflectionThroughTheCenter(String active, String center, String target) {
        assertSame(sq(target), GeometryUtils.reflect(sq(active), sq(center)));
    }

    @Test
    public void reflectionMayLeaveTheBoard() {
        // When
        Square target = GeometryUtils.reflect(sq("b2"), sq("a1"));

        // Then
        assert !target.isInBounds();
        assertEquals(-1, target.getFile());
        assertEquals(-1, target.getRank());
        assert !GeometryUtils.inBounds(target);
    }

    @Test
    public void adjacencyIncludesDiagonals() {
        Square d4 = sq("d4");
        int adjacent = 0;
        for(int index = 0; index < 64; index++) {
            Square other = Square.of(index);
            if(GeometryUtils.adjacent(d4, other)) {
                adjacent++;
                assert Math.abs(other.getFile() - 3) <= 1 && Math.abs(other.getRank() - 3) <= 1;
            }
        }
        assertEquals(8, adjacent);
        assert GeometryUtils.adjacent(d4, sq("e5"));
        assert GeometryUtils.adjacent(d4, sq("c3"));
        assert !GeometryUtils.adjacent(d4, d4);
        assert !GeometryUtils.adjacent(d4, sq("d6"));
        assert !GeometryUtils.adjacent(sq("a1"), sq("c2"));
    }

    @Test
    public void neighboursOfCornersAndEdges() {
        assertEquals(3, BitUtils.bitCount(GeometryUtils.getNeighboursBB(sq("a1"))));
        assertEquals(3, BitUtils.bitCount(GeometryUtils.getNeighboursBB(sq("h8"))));
        assertEquals(5, BitUtils.bitCount(GeometryUtils.getNeighboursBB(sq("a5"))));
        assertEquals(8, BitUtils.bitCount(GeometryUtils.getNeighboursBB(sq("e4"))));
        assertEquals("[a2, b2, b3, a4, b4]", BitUtils.toSquares(GeometryUtils.getNeighboursBB(sq("a3"))).toString());
    }

    @Test
    public void directionIsAUnitVector() {
        assertSame(Square.of(-1, -1), GeometryUtils.direction(sq("f6"), sq("e5")));
        assertSame(Square.of(0, 1), GeometryUtils.direction(sq("f3"), sq("f4")));
        assertSame(Square.of(1, 0), GeometryUtils.direction(sq("a8"), sq("b8")));
    }

    @Test
    public void inBoundsCoordinates() {
        assert GeometryUtils.inBounds(0, 0);
        assert GeometryUtils.inBounds(7, 7);
        assert !GeometryUtils.inBounds(8, 0);
        assert !GeometryUtils.inBounds(0, -1);
    }
}
