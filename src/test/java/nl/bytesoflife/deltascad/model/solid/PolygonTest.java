package nl.bytesoflife.deltascad.model.solid;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;
import nl.bytesoflife.deltascad.model.spatial.Vector2;
import nl.bytesoflife.deltascad.model.spatial.Vector3;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PolygonTest {

    private final Polygon square = new Polygon(
            new Vector2(0, 0), new Vector2(1, 0), new Vector2(1, 1), new Vector2(0, 1));

    @Test
    void boundsSpanPointsInPlane() {
        BoundingBox bounds = square.getBounds();
        assertEquals(new Vector3(0, 0, 0), bounds.getMin());
        assertEquals(new Vector3(1, 1, 0), bounds.getMax());
    }

    @Test
    void boundsOfIrregularPolygon() {
        Polygon triangle = new Polygon(new Vector2(-2, 3), new Vector2(4, -1), new Vector2(0.5, 7));
        BoundingBox bounds = triangle.getBounds();
        assertEquals(new Vector3(-2, -1, 0), bounds.getMin());
        assertEquals(new Vector3(4, 7, 0), bounds.getMax());
    }

    @Test
    void rendersSingleStatementInGivenOrder() {
        assertEquals("polygon([[0,0],[1,0],[1,1],[0,1]]);\n", square.toString());
    }

    @Test
    void rendersPointsAtFullPrecision() {
        Polygon p = new Polygon(new Vector2(0.125, 1.0 / 3), new Vector2(-2.5, 10));
        assertEquals("polygon([[0.125,0.3333333333333333],[-2.5,10]]);\n", p.toString());
    }

    @Test
    void rendersPathsWhenGiven() {
        Polygon p = new Polygon(new Vector2[]{
                new Vector2(0, 0), new Vector2(4, 0), new Vector2(0, 4),
                new Vector2(1, 1), new Vector2(2, 1), new Vector2(1, 2)
        }, new int[][]{{0, 1, 2}, {3, 4, 5}});
        assertEquals("polygon(points = [[0,0],[4,0],[0,4],[1,1],[2,1],[1,2]], paths = [[0,1,2],[3,4,5]]);\n",
                p.toString());
    }

    @Test
    void positionIsOrigin() {
        assertEquals(new Vector3(), square.getPosition());
    }

    @Test
    void copySharesPoints() {
        square.setName("base");
        ScadObject copy = square.copy();
        assertNotSame(square, copy);
        assertNotEquals(square.getId(), copy.getId());
        assertSame(square.getPoints(), ((Polygon) copy).getPoints());
        assertEquals("base", copy.getName());
        assertTrue(square.isSameAs(copy));
    }

    @Test
    void emptyPolygonRendersAndHasOriginBounds() {
        Polygon empty = new Polygon();
        assertEquals("polygon([]);\n", empty.toString());
        assertEquals(new Vector3(), empty.getBounds().getMin());
        assertEquals(new Vector3(), empty.getBounds().getMax());
        assertEquals(new Vector3(), empty.getBounds().getSize());
    }

    @Test
    void rejectsNullPointArray() {
        assertThrows(NullPointerException.class, () -> new Polygon((Vector2[]) null));
    }

    @Test
    void rendersLargeAndNegativeZeroCoordinates() {
        Polygon p = new Polygon(new Vector2(2.82879384806159E17, -0.0));
        assertEquals("polygon([[282879384806159000,-0]]);\n", p.toString());
    }

    @Test
    void hasNoChildren() {
        assertTrue(square.getChildren().isEmpty());
        assertTrue(square.getChildren(false).isEmpty());
    }
}
