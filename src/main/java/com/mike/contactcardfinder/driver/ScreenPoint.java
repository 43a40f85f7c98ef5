package com.mike.contactcardfinder.driver;

/**
 * Viewport coordinate in CSS pixels.
 */
public record ScreenPoint(double x, double y) {

    public ScreenPoint plus(double dx, double dy) {
        return new ScreenPoint(x + dx, y + dy);
    }

    public double distanceTo(ScreenPoint other) {
        return Math.hypot(other.x - x, other.y - y);
    }
}
