package com.lunaindex.service;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface Analyzer {
    AnalysisResult analyze(Path workspaceRoot, String filePath) throws IOException;
}
