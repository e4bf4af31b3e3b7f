package com.lunaindex.service;

import com.lunaindex.store.SummaryContent;

public record AnalysisResult(SummaryContent summary, String markdown) {
}
