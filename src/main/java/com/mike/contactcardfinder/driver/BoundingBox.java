package com.mike.contactcardfinder.driver;

public record BoundingBox(double x, double y, double width, double height) {

    public ScreenPoint center() {
        return new ScreenPoint(x + width / 2, y + height / 2);
    }
}
