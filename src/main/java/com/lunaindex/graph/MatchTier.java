package com.lunaindex.graph;

public enum MatchTier {
    EXACT,
    SUFFIX,
    FILENAME,
    NONE
}
