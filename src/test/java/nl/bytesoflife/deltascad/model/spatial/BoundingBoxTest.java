package nl.bytesoflife.deltascad.model.spatial;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundingBoxTest {

    private final BoundingBox unit = new BoundingBox(new Vector3(0, 0, 0), new Vector3(1, 1, 1));

    @Test
    void sizeAndCenter() {
        BoundingBox box = new BoundingBox(new Vector3(-1, 0, 2), new Vector3(3, 2, 4));
        assertEquals(new Vector3(4, 2, 2), box.getSize());
        assertEquals(new Vector3(1, 1, 3), box.getCenter());
    }

    @Test
    void unionAndIntersection() {
        BoundingBox other = new BoundingBox(new Vector3(0.5, 0.5, 0.5), new Vector3(2, 2, 2));
        assertEquals(new BoundingBox(new Vector3(0, 0, 0), new Vector3(2, 2, 2)), unit.union(other));
        assertEquals(new BoundingBox(new Vector3(0.5, 0.5, 0.5), new Vector3(1, 1, 1)), unit.intersection(other));
    }

    @Test
    void cornersCoverAllCombinations() {
        List<Vector3> corners = unit.corners();
        assertEquals(8, corners.size());
        assertTrue(corners.contains(new Vector3(0, 1, 0)));
        assertTrue(corners.contains(new Vector3(1, 0, 1)));
    }

    @Test
    void transformSpansTransformedCorners() {
        BoundingBox rotated = unit.transform(Matrix.rotationZ(90));
        assertEquals(new Vector3(-1, 0, 0), rotated.getMin());
        assertEquals(new Vector3(0, 1, 1), rotated.getMax());
    }

    @Test
    void spanningRequiresPoints() {
        assertThrows(IllegalArgumentException.class, () -> BoundingBox.spanning(List.of()));
    }

    @Test
    void translate() {
        assertEquals(new BoundingBox(new Vector3(1, 1, 1), new Vector3(2, 2, 2)),
                unit.translate(new Vector3(1, 1, 1)));
    }
}
