package com.dsflow.datasource;

import com.dsflow.common.Sample;

import java.util.Objects;

/**
 * What a controller decided about one sample.
 */
public final class ControllerResult<D, L> {
    public enum Kind { ACCEPT, REPLACE, REJECT }

    private static final ControllerResult<?, ?> ACCEPT = new ControllerResult<>(Kind.ACCEPT, null);
    private static final ControllerResult<?, ?> REJECT = new ControllerResult<>(Kind.REJECT, null);

    private final Kind kind;
    private final Sample<D, L> replacement;

    private ControllerResult(Kind kind, Sample<D, L> replacement) {
        this.kind = kind;
        this.replacement = replacement;
    }

    /** Keep the sample as it is. */
    @SuppressWarnings("unchecked")
    public static <D, L> ControllerResult<D, L> accept() {
        return (ControllerResult<D, L>) ACCEPT;
    }

    @SuppressWarnings("unchecked")
    public static <D, L> ControllerResult<D, L> reject() {
        return (ControllerResult<D, L>) REJECT;
    }

    public static <D, L> ControllerResult<D, L> replace(Sample<D, L> sample) {
        return new ControllerResult<>(Kind.REPLACE, Objects.requireNonNull(sample, "replacement sample"));
    }

    public static <D, L> ControllerResult<D, L> of(boolean accepted) {
        return accepted ? accept() : reject();
    }

    public Kind kind() {
        return kind;
    }

    public boolean isRejected() {
        return kind == Kind.REJECT;
    }

    /** The sample to continue with. */
    Sample<D, L> applyTo(Sample<D, L> current) {
        return kind == Kind.REPLACE ? replacement : current;
    }
}
