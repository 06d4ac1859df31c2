package com.texture.dedup.representative;

import com.texture.dedup.core.model.TextureFormat;
import com.texture.dedup.equivalence.EquivalenceCollection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RepresentativeMapper Tests")
class RepresentativeMapperTest {

    @Test
    @DisplayName("Every non-representative member maps to its representative")
    void mapsMembers() {
        InMemoryTextureCatalog catalog = new InMemoryTextureCatalog()
                .put("x", 1024, 1024, TextureFormat.BC7_UNORM, true)
                .put("y", 512, 512, TextureFormat.BC7_UNORM, true);
        EquivalenceCollection<String> certain = EquivalenceCollection.of(List.of(
                List.of("y", "x", "z"), List.of("p", "q")));

        SortedMap<String, String> mapping = new RepresentativeMapper(new RepresentativeSelector(catalog)).map(certain);

        assertEquals(Map.of("y", "x", "z", "x", "q", "p"), mapping);
        assertEquals(List.of("q", "y", "z"), List.copyOf(mapping.keySet()));
        assertEquals("x", RepresentativeMapper.resolve(mapping, "z"));
        assertEquals("x", RepresentativeMapper.resolve(mapping, "x"));
        assertEquals("alone", RepresentativeMapper.resolve(mapping, "alone"));
    }
}
