package com.firm.provenance.api;

/**
 * Numerical error estimate of a step's value.
 *
 * @param relativeError Relative error, non-negative.
 * @param absoluteError Absolute error, non-negative. For propagated bounds
 *                      this is {@code |numericValue| * relativeError}.
 */
public record ErrorBounds(double relativeError, double absoluteError) {
    public static final ErrorBounds NONE = new ErrorBounds(0.0, 0.0);

    public ErrorBounds {
        if (!(relativeError >= 0.0) || Double.isInfinite(relativeError))
            throw new IllegalArgumentException("relativeError must be finite and >= 0: " + relativeError);
        if (!(absoluteError >= 0.0) || Double.isInfinite(absoluteError))
            throw new IllegalArgumentException("absoluteError must be finite and >= 0: " + absoluteError);
    }

    /** Bounds for a value known to {@code relativeError}. A null value has no absolute error. */
    public static ErrorBounds ofRelative(double relativeError, Double value) {
        double abs = value == null ? 0.0 : Math.abs(value) * relativeError;
        return new ErrorBounds(relativeError, abs);
    }
}
