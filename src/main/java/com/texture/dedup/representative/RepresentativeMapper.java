package com.texture.dedup.representative;

import com.texture.dedup.equivalence.EquivalenceCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Derives the item to representative mapping from the certain classes. Representatives
 * themselves are not mapped.
 */
public class RepresentativeMapper {
    private static final Logger log = LoggerFactory.getLogger(RepresentativeMapper.class);

    private final RepresentativeSelector selector;

    public RepresentativeMapper(RepresentativeSelector selector) {
        this.selector = selector;
    }

    public SortedMap<String, String> map(EquivalenceCollection<String> certain) {
        SortedMap<String, String> mapping = new TreeMap<>();
        int classes = 0;
        for (Set<String> c : certain.getClasses()) {
            String representative = selector.select(c);
            for (String item : c) {
                if (!item.equals(representative)) {
                    mapping.put(item, representative);
                }
            }
            classes++;
        }
        log.debug("representative.mapped classes={} mapped={}", classes, mapping.size());
        return mapping;
    }

    /**
     * Resolves an item through a mapping produced by {@link #map}.
     */
    public static String resolve(Map<String, String> mapping, String item) {
        return mapping.getOrDefault(item, item);
    }
}
