package com.dsflow.datasource;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * One position in the controller chain: either a single controller, or a group of
 * alternatives of which one is picked at random for every sample.
 */
public interface ControllerStage<D, L> {

    Controller<D, L> choose(Random random);

    static <D, L> ControllerStage<D, L> single(Controller<D, L> controller) {
        return new Single<>(controller);
    }

    static <D, L> ControllerStage<D, L> oneOf(List<? extends Controller<D, L>> alternatives) {
        return new OneOf<>(alternatives);
    }

    final class Single<D, L> implements ControllerStage<D, L> {
        private final Controller<D, L> controller;

        Single(Controller<D, L> controller) {
            this.controller = Objects.requireNonNull(controller, "controller");
        }

        @Override
        public Controller<D, L> choose(Random random) {
            return controller;
        }
    }

    final class OneOf<D, L> implements ControllerStage<D, L> {
        private final List<Controller<D, L>> alternatives;

        OneOf(List<? extends Controller<D, L>> alternatives) {
            Objects.requireNonNull(alternatives, "alternatives");
            if (alternatives.isEmpty()) {
                throw new IllegalArgumentException("OneOf needs at least one controller");
            }
            this.alternatives = List.copyOf(alternatives);
        }

        @Override
        public Controller<D, L> choose(Random random) {
            return alternatives.get(random.nextInt(alternatives.size()));
        }
    }
}
