package com.stayharvest.crawl.session;

import com.stayharvest.crawl.model.SessionMaterial;

/**
 * Source of the capability tokens and header bag that provider requests need. Whatever harvests them
 * from a live client plugs in here.
 */
public interface SessionMaterialProvider {
    SessionMaterial current();

    /**
     * Asks the source for fresh material. Implementations that cannot refresh return {@link #current()}.
     */
    SessionMaterial refresh();
}
