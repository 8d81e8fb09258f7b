package com.pixelscript.script.control;

/**
 * Validated {@code loop:} header. Instances only exist for headers whose
 * step is non-zero and points from start toward end.
 */
public final class LoopDescriptor {

    public static final int MAX_ITERATIONS = 1000;
    static final double EPSILON = 1e-10;

    private final String variable;
    private final double start;
    private final double end;
    private final double step;

    LoopDescriptor(String variable, double start, double end, double step) {
        this.variable = variable;
        this.start = start;
        this.end = end;
        this.step = step;
    }

    public String variable() { return variable; }
    public double start() { return start; }
    public double end() { return end; }
    public double step() { return step; }

    /** {@code |ceil((end - start) / step)| + 1}, before the iteration cap. */
    public long requestedIterations() {
        double n = Math.abs(Math.ceil((end - start) / step)) + 1;
        return n >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) n;
    }

    public int iterations() {
        return (int) Math.min(requestedIterations(), MAX_ITERATIONS);
    }

    boolean inRange(double current) {
        return (step > 0 && current <= end + EPSILON) || (step < 0 && current >= end - EPSILON);
    }

    @Override
    public String toString() {
        return variable + " from " + start + " to " + end + " step " + step;
    }
}
