package com.project.image.anomalies.DTOs;

import org.opencv.core.Point;

/** Straight segment found by the Hough detector, integer endpoints. */
public record LineSegment(int x1, int y1, int x2, int y2) {

    public Point start() { return new Point(x1, y1); }
    public Point end() { return new Point(x2, y2); }

    public double length() {
        return Math.hypot(x2 - x1, y2 - y1);
    }
}
