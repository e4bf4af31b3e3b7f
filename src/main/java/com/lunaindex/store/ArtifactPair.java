package com.lunaindex.store;

import java.nio.file.Path;

public record ArtifactPair(Path json, Path markdown) {
}
