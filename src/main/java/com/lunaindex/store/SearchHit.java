package com.lunaindex.store;

import java.util.List;

public record SearchHit(String file, List<String> matches) {
    public SearchHit {
        matches = List.copyOf(matches);
    }
}
