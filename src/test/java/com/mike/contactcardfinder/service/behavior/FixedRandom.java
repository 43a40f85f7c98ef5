package com.mike.contactcardfinder.service.behavior;

import java.util.Random;

/**
 * Random that always returns the same draw.
 */
class FixedRandom extends Random {

    private final double value;

    FixedRandom(double value) {
        this.value = value;
    }

    @Override
    public double nextDouble() {
        return value;
    }

    @Override
    public double nextGaussian() {
        return 0.0;
    }

    @Override
    public int nextInt(int bound) {
        return (int) (value * bound);
    }
}
