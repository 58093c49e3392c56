package nl.bytesoflife.deltascad.model.spatial;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Vector2Test {

    @Test
    void normalizeUsesSumOfAbsoluteValues() {
        Vector2 n = new Vector2(3, 4).normalize();
        assertEquals(3.0 / 7, n.getX(), 1e-12);
        assertEquals(4.0 / 7, n.getY(), 1e-12);
        assertEquals(0.4286, n.getX(), 1e-4);
        assertEquals(0.5714, n.getY(), 1e-4);
    }

    @Test
    void normalizeHandlesNegativeComponents() {
        Vector2 n = new Vector2(-1, 3).normalize();
        assertEquals(-0.25, n.getX(), 1e-12);
        assertEquals(0.75, n.getY(), 1e-12);
    }

    @Test
    void normalizeZeroVectorReturnsItself() {
        Vector2 zero = new Vector2(0, 0);
        assertSame(zero, zero.normalize());
    }

    @Test
    void equalityUsesTwoDecimalPrecision() {
        assertEquals(new Vector2(1.004, 0), new Vector2(1.001, 0));
        assertEquals(new Vector2(1.004, 0).hashCode(), new Vector2(1.001, 0).hashCode());
        assertNotEquals(new Vector2(1.00, 0), new Vector2(1.01, 0));
        assertNotEquals(new Vector2(1, 0), null);
        assertNotEquals(new Vector2(1, 0), "[1.00, 0.00]");
    }

    @Test
    void renderedWithTwoDecimals() {
        assertEquals("[1.00, -2.50]", new Vector2(1, -2.5).toString());
    }

    @Test
    void arithmetic() {
        Vector2 a = new Vector2(2, 4);
        Vector2 b = new Vector2(1, 2);
        assertEquals(new Vector2(3, 6), a.add(b));
        assertEquals(new Vector2(1, 2), a.subtract(b));
        assertEquals(new Vector2(2, 8), a.multiply(b));
        assertEquals(new Vector2(2, 2), a.divide(b));
        assertEquals(new Vector2(4, 8), a.multiply(2));
        assertEquals(new Vector2(4, 8), Vector2.multiply(2, a));
        assertEquals(new Vector2(1, 2), a.divide(2));
        assertEquals(new Vector2(4, 2), Vector2.divide(8, a));
        assertEquals(new Vector2(-2, -4), a.negate());
        assertEquals(10, a.dot(b), 1e-12);
    }

    @Test
    void copyIsEqualButNotSame() {
        Vector2 a = new Vector2(1, 2);
        assertEquals(a, a.copy());
        assertNotSame(a, a.copy());
    }

    @Test
    void average() {
        assertNull(Vector2.average());
        assertNull(Vector2.average((Vector2[]) null));
        Vector2 single = new Vector2(5, 5);
        assertSame(single, Vector2.average(single));
        assertEquals(new Vector2(1, 2), Vector2.average(new Vector2(0, 0), new Vector2(2, 4)));
    }

    @Test
    void toMatrixIsHomogeneousColumn() {
        Matrix m = new Vector2(3, 4).toMatrix();
        assertEquals(4, m.getRows());
        assertEquals(1, m.getColumns());
        assertEquals(0, m.get(2, 0));
        assertEquals(1, m.get(3, 0));
        assertEquals(new Vector3(3, 4, 0), m.toVector3());
        assertEquals(new Vector3(3, 4, 0), new Vector2(3, 4).toVector3());
    }
}
