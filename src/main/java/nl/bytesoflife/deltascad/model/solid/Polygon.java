package nl.bytesoflife.deltascad.model.solid;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;
import nl.bytesoflife.deltascad.model.spatial.Vector2;
import nl.bytesoflife.deltascad.model.spatial.Vector3;
import nl.bytesoflife.deltascad.renderer.scad.ScadFormat;
import nl.bytesoflife.deltascad.renderer.scad.StatementBuilder;
import org.locationtech.jts.geom.Envelope;

import java.util.Objects;

/**
 * A planar polygon given by an ordered list of points.
 *
 * Points are rendered at full precision, e.g.
 * {@code polygon([[0,0],[1,0],[1,1],[0,1]]);}. When paths are given each path
 * lists point indices, the first one being the outline and the others holes.
 */
public class Polygon extends ScadObject {

    private final Vector2[] points;
    private final int[][] paths;

    public Polygon(Vector2... points) {
        this(points, null);
    }

    public Polygon(Vector2[] points, int[][] paths) {
        this.points = Objects.requireNonNull(points, "points");
        this.paths = paths;
    }

    /**
     * The point array backing this polygon, shared with its copies.
     */
    public Vector2[] getPoints() {
        return points;
    }

    public int[][] getPaths() {
        return paths;
    }

    /**
     * Planar extent of the points at {@code z = 0}. A polygon without points
     * reports a zero-size box at the origin.
     */
    @Override
    public BoundingBox getBounds() {
        if (points.length == 0) {
            return new BoundingBox(new Vector3(), new Vector3());
        }
        Envelope envelope = new Envelope();
        for (Vector2 p : points) {
            envelope.expandToInclude(p.getX(), p.getY());
        }
        return new BoundingBox(
                new Vector3(envelope.getMinX(), envelope.getMinY(), 0),
                new Vector3(envelope.getMaxX(), envelope.getMaxY(), 0));
    }

    /**
     * Polygons carry no centroid; the origin is reported.
     */
    @Override
    public Vector3 getPosition() {
        return new Vector3();
    }

    @Override
    public ScadObject copy() {
        return withNameOf(new Polygon(points, paths));
    }

    @Override
    public String toString() {
        StatementBuilder sb = new StatementBuilder().append("polygon(");
        if (paths == null) {
            sb.append(pointList());
        } else {
            sb.argument("points", pointList()).argument("paths", pathList());
        }
        return sb.append(")").terminate().toString();
    }

    private String pointList() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < points.length; i++) {
            if (i > 0) sb.append(',');
            sb.append('[')
              .append(ScadFormat.number(points[i].getX()))
              .append(',')
              .append(ScadFormat.number(points[i].getY()))
              .append(']');
        }
        return sb.append(']').toString();
    }

    private String pathList() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < paths.length; i++) {
            if (i > 0) sb.append(',');
            sb.append('[');
            for (int j = 0; j < paths[i].length; j++) {
                if (j > 0) sb.append(',');
                sb.append(paths[i][j]);
            }
            sb.append(']');
        }
        return sb.append(']').toString();
    }
}
