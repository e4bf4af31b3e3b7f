package com.lunaindex.runtime;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToBranchAwareStoreUnderCodebaseDirectory() {
        AppConfig config = new AppConfig();

        assertEquals(".codebase", config.getStore().getDirectory());
        assertTrue(config.getStore().isBranchAware());
        assertEquals(100, config.getCache().getSummaryCapacity());
        assertEquals(100, config.getCache().getQueryCapacity());
        assertEquals(10000, config.getGit().getTimeoutMs());
        assertEquals(10, config.getGraph().getSampleKeyCount());
    }

    @Test
    void shouldReplaceMissingSectionsWithDefaults() {
        AppConfig config = new AppConfig();
        config.setStore(null);
        config.setCache(null);
        config.getStore().setDirectory("  ");

        assertEquals(".codebase", config.getStore().getDirectory());
        assertEquals(100, config.getCache().getQueryCapacity());
    }
}
