package com.dsflow.datasource;

import com.dsflow.common.Sample;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Runs controller stages in order. A rejection ends the chain immediately.
 */
final class ControllerChain<D, L> {
    private final List<ControllerStage<D, L>> stages;
    private final Random random;

    ControllerChain(List<ControllerStage<D, L>> stages, Random random) {
        this.stages = List.copyOf(stages);
        this.random = random;
    }

    /**
     * @return the surviving (possibly replaced) sample, or empty when rejected
     */
    Optional<Sample<D, L>> apply(Sample<D, L> sample) throws Exception {
        Sample<D, L> current = sample;
        for (ControllerStage<D, L> stage : stages) {
            ControllerResult<D, L> r = stage.choose(random).apply(current);
            if (r == null || r.isRejected()) {
                return Optional.empty();
            }
            current = r.applyTo(current);
        }
        return Optional.of(current);
    }
}
