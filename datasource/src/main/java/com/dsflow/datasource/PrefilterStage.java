package com.dsflow.datasource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

final class PrefilterStage {
    private static final Logger logger = LoggerFactory.getLogger(PrefilterStage.class);

    private PrefilterStage() {}

    /** Applies each prefilter in order; every pass leaves a materialized store behind. */
    static <D, L> void apply(EntityStore<D, L> store, List<Prefilter<D, L>> prefilters) {
        if (prefilters.isEmpty()) return;
        logger.info("Prefiltering entities");
        for (int i = 0; i < prefilters.size(); i++) {
            Prefilter<D, L> pf = prefilters.get(i);
            int before = store.size();
            logger.info("Filter {} ({}): {} entities before", i, pf, before);
            store.retain(pf::test);
            logger.info("Filter {}: {} entities after", i, store.size());
        }
    }
}
