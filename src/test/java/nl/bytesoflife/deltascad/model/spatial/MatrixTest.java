package nl.bytesoflife.deltascad.model.spatial;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatrixTest {

    @Test
    void identityLeavesPointUnchanged() {
        Vector3 p = new Vector3(1, 2, 3);
        assertEquals(p, Matrix.identity(4).transform(p));
    }

    @Test
    void multiplyChecksDimensions() {
        Matrix a = new Matrix(new double[]{1, 2, 3, 4, 5, 6}, 2, 3);
        Matrix b = new Matrix(new double[]{1, 2, 3, 4}, 2, 2);
        assertThrows(IllegalArgumentException.class, () -> a.multiply(b));
    }

    @Test
    void multiplyProducesProduct() {
        Matrix a = new Matrix(new double[]{1, 2, 3, 4}, 2, 2);
        Matrix b = new Matrix(new double[]{5, 6, 7, 8}, 2, 2);
        assertEquals(new Matrix(new double[]{19, 22, 43, 50}, 2, 2), a.multiply(b));
    }

    @Test
    void constructorRejectsWrongValueCount() {
        assertThrows(IllegalArgumentException.class, () -> new Matrix(new double[]{1, 2, 3}, 2, 2));
    }

    @Test
    void getOutsideGridFails() {
        Matrix m = Matrix.identity(2);
        assertThrows(IndexOutOfBoundsException.class, () -> m.get(2, 0));
    }

    @Test
    void toVector3RequiresColumn() {
        assertThrows(IllegalStateException.class, () -> Matrix.identity(4).toVector3());
    }

    @Test
    void translationAndScaling() {
        Vector3 p = new Vector3(1, 1, 1);
        assertEquals(new Vector3(2, 3, 4), Matrix.translation(new Vector3(1, 2, 3)).transform(p));
        assertEquals(new Vector3(2, 3, 4), Matrix.scaling(new Vector3(2, 3, 4)).transform(p));
    }

    @Test
    void rotationAboutZ() {
        assertEquals(new Vector3(0, 1, 0), Matrix.rotationZ(90).transform(new Vector3(1, 0, 0)));
    }

    @Test
    void eulerRotationAppliesXBeforeZ() {
        // X first: (0,1,0) -> (0,0,1), then Z leaves it. Z first would give (-1,0,0).
        Vector3 rotated = Matrix.rotation(new Vector3(90, 0, 90)).transform(new Vector3(0, 1, 0));
        assertEquals(new Vector3(0, 0, 1), rotated);
    }

    @Test
    void mirrorReflectsThroughPlane() {
        assertEquals(new Vector3(-2, 3, 4), Matrix.mirror(new Vector3(1, 0, 0)).transform(new Vector3(2, 3, 4)));
        assertEquals(new Vector3(0, -1, 0), Matrix.mirror(new Vector3(1, 1, 0)).transform(new Vector3(1, 0, 0)));
    }

    @Test
    void mirrorWithZeroNormalIsIdentity() {
        assertEquals(Matrix.identity(4), Matrix.mirror(new Vector3()));
    }
}
