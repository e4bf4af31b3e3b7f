package com.lunaindex.store;

public record SummaryListing(String file, String generatedAt) {
}
