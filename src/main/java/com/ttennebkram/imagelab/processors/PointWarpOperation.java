package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.errors.InvalidParameterException;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for warps defined by corresponding point pairs.
 * Points are given in percent of the image size so that one recipe fits any image.
 */
public abstract class PointWarpOperation extends OperationBase {

    private static final double MIN_TRIANGLE_AREA = 1e-6;

    /**
     * Declare srcNx/srcNy/dstNx/dstNy parameters for each point pair.
     *
     * @param defaults rows of {srcX, srcY, dstX, dstY} in percent
     */
    protected static List<ParameterSpec> pointParameters(double[][] defaults) {
        List<ParameterSpec> params = new ArrayList<>();
        for (int i = 0; i < defaults.length; i++) {
            int n = i + 1;
            params.add(ParameterSpec.decimal("src" + n + "x", "Source " + n + " X (%)", 0, 100, defaults[i][0]));
            params.add(ParameterSpec.decimal("src" + n + "y", "Source " + n + " Y (%)", 0, 100, defaults[i][1]));
        }
        for (int i = 0; i < defaults.length; i++) {
            int n = i + 1;
            params.add(ParameterSpec.decimal("dst" + n + "x", "Target " + n + " X (%)", 0, 100, defaults[i][2]));
            params.add(ParameterSpec.decimal("dst" + n + "y", "Target " + n + " Y (%)", 0, 100, defaults[i][3]));
        }
        return params;
    }

    /**
     * Read "src" or "dst" points and convert percentages to pixel coordinates.
     */
    protected static Point[] points(OperationParams params, String prefix, int count, int width, int height) {
        Point[] points = new Point[count];
        for (int i = 0; i < count; i++) {
            int n = i + 1;
            double x = params.getDouble(prefix + n + "x") / 100.0 * (width - 1);
            double y = params.getDouble(prefix + n + "y") / 100.0 * (height - 1);
            points[i] = new Point(x, y);
        }
        return points;
    }

    /**
     * Reject point sets where any three points are (nearly) collinear.
     */
    protected static void requireNonCollinear(Point[] points, String what) {
        for (int i = 0; i < points.length; i++) {
            for (int j = i + 1; j < points.length; j++) {
                for (int k = j + 1; k < points.length; k++) {
                    double area = Math.abs((points[j].x - points[i].x) * (points[k].y - points[i].y)
                            - (points[k].x - points[i].x) * (points[j].y - points[i].y)) / 2.0;
                    if (area < MIN_TRIANGLE_AREA) {
                        throw new InvalidParameterException(what + " points " + (i + 1) + ", " + (j + 1)
                                + " and " + (k + 1) + " are collinear");
                    }
                }
            }
        }
    }

    protected static MatOfPoint2f toMat(Point[] points) {
        return new MatOfPoint2f(points);
    }
}
