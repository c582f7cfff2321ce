package com.dsflow.datasource;

import com.dsflow.common.Sample;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Sample-level accept / transform / reject step.
 * Any exception thrown is treated as a per-sample failure and the sample is dropped.
 */
@FunctionalInterface
public interface Controller<D, L> {

    ControllerResult<D, L> apply(Sample<D, L> sample) throws Exception;

    static <D, L> Controller<D, L> filter(Predicate<? super Sample<D, L>> keep) {
        return s -> ControllerResult.of(keep.test(s));
    }

    static <D, L> Controller<D, L> map(UnaryOperator<Sample<D, L>> transform) {
        return s -> ControllerResult.replace(transform.apply(s));
    }
}
