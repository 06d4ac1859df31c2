package com.texture.dedup.ledger;

import com.texture.dedup.core.model.SimilarityDimension;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Location and naming of the ledger files. Every similarity dimension has its own
 * certain, uncertain and rejected files plus a representative map.
 */
public class LedgerLayout {

    private final Path directory;

    public LedgerLayout(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory is required");
    }

    public Path getDirectory() {
        return directory;
    }

    public Path certainFile(SimilarityDimension dimension) {
        return directory.resolve("copy-" + dimension.getKey() + ".json");
    }

    public Path uncertainFile(SimilarityDimension dimension) {
        return directory.resolve("copy-" + dimension.getKey() + "-uncertain.json");
    }

    public Path rejectedFile(SimilarityDimension dimension) {
        return directory.resolve("copy-" + dimension.getKey() + "-rejected.json");
    }

    public Path representativeFile(SimilarityDimension dimension) {
        return directory.resolve("representative-" + dimension.getKey() + ".json");
    }
}
