package com.mike.contactcardfinder.service.behavior;

import com.mike.contactcardfinder.driver.ScreenPoint;

import java.time.Duration;
import java.util.List;

/**
 * Pointer trajectory computed before anything is sent to the browser.
 *
 * @param segments         one segment for a direct move, two when the pointer overshoots and corrects
 * @param clickPoint       where the click lands, equal to the last point of the last segment
 * @param pauseBeforeClick hover time between the last move and the click
 */
public record MovePlan(List<Segment> segments, ScreenPoint clickPoint, Duration pauseBeforeClick) {

    public MovePlan {
        segments = List.copyOf(segments);
    }

    public int totalPoints() {
        return segments.stream().mapToInt(s -> s.points().size()).sum();
    }

    public record Segment(List<ScreenPoint> points, Duration duration, Duration pauseAfter) {

        public Segment {
            points = List.copyOf(points);
        }

        public Duration perPointDelay() {
            if (points.isEmpty()) return Duration.ZERO;
            return duration.dividedBy(points.size());
        }

        public ScreenPoint last() {
            return points.get(points.size() - 1);
        }
    }
}
