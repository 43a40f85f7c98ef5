package com.mike.contactcardfinder.service.behavior;

import com.mike.contactcardfinder.driver.BoundingBox;
import com.mike.contactcardfinder.driver.ScreenPoint;
import com.mike.contactcardfinder.driver.UiDriver;
import com.mike.contactcardfinder.driver.UiElement;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Moves the pointer along a curved path to an element and clicks it.
 * Planning is pure; {@link #execute(UiDriver, MovePlan)} replays a plan against the driver.
 */
@Slf4j
public class MouseEmulator {

    private static final int DIRECT_STEPS = 50;
    private static final int OVERSHOOT_STEPS = 30;
    private static final int CORRECTION_STEPS = 20;
    private static final double OVERSHOOT_DURATION_SHARE = 0.6;
    private static final double CORRECTION_DURATION_SHARE = 0.4;
    private static final double CURVE_SPREAD = 0.3;

    private static final int CORRECTION_PAUSE_MIN_MS = 50;
    private static final int CORRECTION_PAUSE_MAX_MS = 150;

    private final MouseConfig config;
    private final Random random;
    private final Sleeper sleeper;

    public MouseEmulator(MouseConfig config, Random random, Sleeper sleeper) {
        this.config = config;
        this.random = random;
        this.sleeper = sleeper;
    }

    public void moveAndClick(UiDriver driver, UiElement target, ScreenPoint from) {
        Optional<BoundingBox> box = target.boundingBox();
        if (box.isEmpty()) {
            log.debug("Lookup: no bounding box, plain click");
            target.click();
            return;
        }

        ScreenPoint start = from != null ? from : driver.pointerPosition();
        execute(driver, plan(start, box.get().center()));
    }

    /**
     * @param from   current pointer position
     * @param center center of the element to hit; the click lands within {@code randomOffsetPx} of it
     */
    public MovePlan plan(ScreenPoint from, ScreenPoint center) {
        int offset = config.randomOffsetPx();
        ScreenPoint clickPoint = center.plus(randomInt(-offset, offset), randomInt(-offset, offset));
        Duration total = uniformMs(config.moveDuration().minMs(), config.moveDuration().maxMs());
        Duration pauseBeforeClick = uniformMs(config.pauseBeforeClick().minMs(), config.pauseBeforeClick().maxMs());

        List<MovePlan.Segment> segments = new ArrayList<>();
        if (random.nextDouble() < config.overshootChance()) {
            double factor = uniform(0.05, 0.15);
            ScreenPoint overshoot = new ScreenPoint(
                    clickPoint.x() + (clickPoint.x() - from.x()) * factor,
                    clickPoint.y() + (clickPoint.y() - from.y()) * factor);

            segments.add(new MovePlan.Segment(
                    path(from, overshoot, OVERSHOOT_STEPS),
                    scale(total, OVERSHOOT_DURATION_SHARE),
                    uniformMs(CORRECTION_PAUSE_MIN_MS, CORRECTION_PAUSE_MAX_MS)));
            segments.add(new MovePlan.Segment(
                    path(overshoot, clickPoint, CORRECTION_STEPS),
                    scale(total, CORRECTION_DURATION_SHARE),
                    Duration.ZERO));
        } else {
            segments.add(new MovePlan.Segment(path(from, clickPoint, DIRECT_STEPS), total, Duration.ZERO));
        }

        return new MovePlan(segments, clickPoint, pauseBeforeClick);
    }

    public void execute(UiDriver driver, MovePlan plan) {
        for (MovePlan.Segment segment : plan.segments()) {
            Duration perPoint = segment.perPointDelay();
            for (ScreenPoint p : segment.points()) {
                driver.movePointer(p.x(), p.y());
                sleeper.sleep(perPoint);
            }
            sleeper.sleep(segment.pauseAfter());
        }
        sleeper.sleep(plan.pauseBeforeClick());
        driver.clickPointer(plan.clickPoint().x(), plan.clickPoint().y());
    }

    /**
     * Cubic Bézier from {@code from} to {@code to}. Control points sit at one and two thirds of the straight
     * line, pushed sideways in opposite directions. First and last points are exact.
     */
    List<ScreenPoint> bezierPath(ScreenPoint from, ScreenPoint to, int steps) {
        double dx = to.x() - from.x();
        double dy = to.y() - from.y();
        double bend = uniform(-CURVE_SPREAD, CURVE_SPREAD);

        ScreenPoint c1 = new ScreenPoint(from.x() + dx * 0.33 - dy * bend, from.y() + dy * 0.33 + dx * bend);
        ScreenPoint c2 = new ScreenPoint(from.x() + dx * 0.66 + dy * bend, from.y() + dy * 0.66 - dx * bend);

        int n = Math.max(steps, 2);
        List<ScreenPoint> points = new ArrayList<>(n);
        points.add(from);
        for (int i = 1; i < n - 1; i++) {
            double t = i / (double) (n - 1);
            double u = 1 - t;
            double x = u * u * u * from.x() + 3 * u * u * t * c1.x() + 3 * u * t * t * c2.x() + t * t * t * to.x();
            double y = u * u * u * from.y() + 3 * u * u * t * c1.y() + 3 * u * t * t * c2.y() + t * t * t * to.y();
            points.add(new ScreenPoint(x, y));
        }
        points.add(to);
        return points;
    }

    private List<ScreenPoint> path(ScreenPoint from, ScreenPoint to, int steps) {
        if (!config.bezierCurves()) return List.of(from, to);
        return bezierPath(from, to, steps);
    }

    private Duration scale(Duration d, double share) {
        return Duration.ofMillis(Math.round(d.toMillis() * share));
    }

    private Duration uniformMs(int minMs, int maxMs) {
        return Duration.ofMillis(Math.round(uniform(minMs, maxMs)));
    }

    private double uniform(double a, double b) {
        return a + (b - a) * random.nextDouble();
    }

    private int randomInt(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }
}
