package com.lunaindex.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StoreConfig store = new StoreConfig();
    private CacheConfig cache = new CacheConfig();
    private GitConfig git = new GitConfig();
    private GraphConfig graph = new GraphConfig();

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache == null ? new CacheConfig() : cache;
    }

    public GitConfig getGit() {
        return git;
    }

    public void setGit(GitConfig git) {
        this.git = git == null ? new GitConfig() : git;
    }

    public GraphConfig getGraph() {
        return graph;
    }

    public void setGraph(GraphConfig graph) {
        this.graph = graph == null ? new GraphConfig() : graph;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String directory = ".codebase";
        private boolean branchAware = true;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory == null || directory.isBlank() ? ".codebase" : directory;
        }

        public boolean isBranchAware() {
            return branchAware;
        }

        public void setBranchAware(boolean branchAware) {
            this.branchAware = branchAware;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CacheConfig {
        private int summaryCapacity = 100;
        private int queryCapacity = 100;

        public int getSummaryCapacity() {
            return summaryCapacity;
        }

        public void setSummaryCapacity(int summaryCapacity) {
            this.summaryCapacity = summaryCapacity;
        }

        public int getQueryCapacity() {
            return queryCapacity;
        }

        public void setQueryCapacity(int queryCapacity) {
            this.queryCapacity = queryCapacity;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GitConfig {
        private long timeoutMs = 10000;

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GraphConfig {
        private int sampleKeyCount = 10;

        public int getSampleKeyCount() {
            return sampleKeyCount;
        }

        public void setSampleKeyCount(int sampleKeyCount) {
            this.sampleKeyCount = sampleKeyCount;
        }
    }
}
