package com.texture.dedup.ledger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.texture.dedup.core.model.SimilarityDimension;
import com.texture.dedup.equivalence.DifferenceCollection;
import com.texture.dedup.equivalence.EquivalenceCollection;
import com.texture.dedup.equivalence.UnorderedPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Reads and writes the ledger files as JSON.
 *
 * <p>Equivalence classes are stored as an array of sorted identifier arrays ordered by
 * their first member, rejected pairs as sorted {@code [a, b]} arrays and the
 * representative map as an object with sorted keys. Missing files read as empty. Every
 * write goes to a temporary file in the target directory that is then moved over the
 * target, so readers never observe a partially written file.</p>
 */
public class LedgerStore {
    private static final Logger log = LoggerFactory.getLogger(LedgerStore.class);

    private static final TypeReference<List<List<String>>> CLASSES = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> MAPPING = new TypeReference<>() {
    };

    private final LedgerLayout layout;
    private final ObjectMapper mapper;

    public LedgerStore(LedgerLayout layout) {
        this(layout, new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public LedgerStore(LedgerLayout layout, ObjectMapper mapper) {
        this.layout = Objects.requireNonNull(layout, "layout is required");
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
    }

    public LedgerLayout getLayout() {
        return layout;
    }

    /**
     * Loads all three ledgers of a dimension.
     */
    public TriStateLedger load(SimilarityDimension dimension) {
        return new TriStateLedger(
                readClasses(layout.certainFile(dimension)),
                readClasses(layout.uncertainFile(dimension)),
                readPairs(layout.rejectedFile(dimension)));
    }

    public EquivalenceCollection<String> readCertain(SimilarityDimension dimension) {
        return readClasses(layout.certainFile(dimension));
    }

    public EquivalenceCollection<String> readUncertain(SimilarityDimension dimension) {
        return readClasses(layout.uncertainFile(dimension));
    }

    public DifferenceCollection<String> readRejected(SimilarityDimension dimension) {
        return readPairs(layout.rejectedFile(dimension));
    }

    public SortedMap<String, String> readRepresentatives(SimilarityDimension dimension) {
        Path file = layout.representativeFile(dimension);
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            return new TreeMap<>(mapper.readValue(file.toFile(), MAPPING));
        } catch (IOException e) {
            throw new LedgerIOException("Failed to read " + file, e);
        }
    }

    public void writeCertain(SimilarityDimension dimension, EquivalenceCollection<String> certain) {
        writeClasses(layout.certainFile(dimension), certain);
    }

    public void writeUncertain(SimilarityDimension dimension, EquivalenceCollection<String> uncertain) {
        writeClasses(layout.uncertainFile(dimension), uncertain);
    }

    public void writeRejected(SimilarityDimension dimension, DifferenceCollection<String> rejected) {
        List<List<String>> pairs = new ArrayList<>();
        for (UnorderedPair<String> pair : rejected.getPairs()) {
            pairs.add(List.of(pair.first(), pair.second()));
        }
        write(layout.rejectedFile(dimension), pairs);
    }

    public void writeRepresentatives(SimilarityDimension dimension, Map<String, String> representatives) {
        write(layout.representativeFile(dimension), new TreeMap<>(representatives));
    }

    /**
     * Classes in their persisted form: sorted members, sorted by first member.
     */
    static List<List<String>> toSortedClasses(EquivalenceCollection<String> collection) {
        List<List<String>> classes = new ArrayList<>();
        for (Set<String> c : collection.getClasses()) {
            List<String> members = new ArrayList<>(c);
            members.sort(Comparator.naturalOrder());
            classes.add(members);
        }
        classes.sort(Comparator.comparing(c -> c.get(0)));
        return classes;
    }

    private EquivalenceCollection<String> readClasses(Path file) {
        if (!Files.exists(file)) {
            return new EquivalenceCollection<>();
        }
        try {
            return EquivalenceCollection.of(mapper.readValue(file.toFile(), CLASSES));
        } catch (IOException e) {
            throw new LedgerIOException("Failed to read " + file, e);
        }
    }

    private DifferenceCollection<String> readPairs(Path file) {
        DifferenceCollection<String> rejected = new DifferenceCollection<>();
        if (!Files.exists(file)) {
            return rejected;
        }
        List<List<String>> pairs;
        try {
            pairs = mapper.readValue(file.toFile(), CLASSES);
        } catch (IOException e) {
            throw new LedgerIOException("Failed to read " + file, e);
        }
        for (List<String> pair : pairs) {
            if (pair.size() != 2) {
                throw new LedgerIOException("Malformed pair " + pair + " in " + file, null);
            }
            rejected.set(pair.get(0), pair.get(1));
        }
        return rejected;
    }

    private void writeClasses(Path file, EquivalenceCollection<String> collection) {
        write(file, toSortedClasses(collection));
    }

    private void write(Path file, Object value) {
        Path tmp = null;
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("ledger.written file={}", file);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new LedgerIOException("Failed to write " + file, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("ledger.tmp.cleanupFailed file={} error={}", tmp, e.getMessage());
        }
    }
}
