package com.texture.dedup.equivalence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EquivalenceCollection Tests")
class EquivalenceCollectionTest {

    @Nested
    @DisplayName("set")
    class SetTests {

        @Test
        @DisplayName("Unknown items form a new class")
        void newClass() {
            EquivalenceCollection<String> eq = new EquivalenceCollection<>();
            eq.set("a", "b");

            assertEquals(Set.of("a", "b"), eq.get("a"));
            assertEquals(1, eq.getClassCount());
        }

        @Test
        @DisplayName("An unknown item joins the class of a known one")
        void joinsClass() {
            EquivalenceCollection<String> eq = new EquivalenceCollection<>();
            eq.set("a", "b");
            eq.set("c", "b");

            assertEquals(Set.of("a", "b", "c"), eq.get("c"));
            assertEquals(1, eq.getClassCount());
        }

        @Test
        @DisplayName("Two known classes are merged into one")
        void mergesClasses() {
            EquivalenceCollection<String> eq = new EquivalenceCollection<>();
            eq.set(List.of("a", "b", "c"));
            eq.set(List.of("x", "y"));
            eq.set("y", "b");

            assertEquals(Set.of("a", "b", "c", "x", "y"), eq.get("x"));
            assertEquals(1, eq.getClassCount());
            assertEquals(5, eq.size());
        }

        @Test
        @DisplayName("A group touching several classes merges all of them")
        void groupMergesAll() {
            EquivalenceCollection<String> eq = EquivalenceCollection.of(List.of(
                    List.of("a", "b"), List.of("c", "d"), List.of("e", "f")));
            eq.set(List.of("b", "d", "f", "g"));

            assertEquals(1, eq.getClassCount());
            assertEquals(7, eq.get("a").size());
        }

        @Test
        @DisplayName("Groups of one item are not materialized")
        void singletonGroup() {
            EquivalenceCollection<String> eq = new EquivalenceCollection<>();
            eq.set(List.of("a", "a"));

            assertFalse(eq.contains("a"));
            assertEquals(Set.of("a"), eq.get("a"));
            assertTrue(eq.isEmpty());
        }
    }

    @Nested
    @DisplayName("add")
    class AddTests {

        @Test
        @DisplayName("Items may join one existing class")
        void joinsOneClass() {
            EquivalenceCollection<String> eq = new EquivalenceCollection<>();
            eq.add("a", "b");
            eq.add(List.of("b", "c"));
            eq.add("a", "c");

            assertEquals(Set.of("a", "b", "c"), eq.get("a"));
        }

        @Test
        @DisplayName("Should fail when items already belong to different classes")
        void inconsistent() {
            EquivalenceCollection<String> eq = new EquivalenceCollection<>();
            eq.add("a", "b");
            eq.add("c", "d");

            assertThrows(InconsistentEquivalenceException.class, () -> eq.add("b", "c"));
            assertFalse(eq.areEqual("a", "d"));
        }
    }

    @Nested
    @DisplayName("Equivalence properties")
    class Properties {

        private final EquivalenceCollection<String> eq = EquivalenceCollection.of(List.of(
                List.of("a", "b"), List.of("b", "c"), List.of("d", "e")));
        private final List<String> items = List.of("a", "b", "c", "d", "e", "f");

        @Test
        @DisplayName("areEqual is reflexive")
        void reflexive() {
            for (String x : items) {
                assertTrue(eq.areEqual(x, x));
            }
        }

        @Test
        @DisplayName("areEqual is symmetric")
        void symmetric() {
            for (String x : items) {
                for (String y : items) {
                    assertEquals(eq.areEqual(x, y), eq.areEqual(y, x));
                }
            }
        }

        @Test
        @DisplayName("areEqual is transitive")
        void transitive() {
            for (String x : items) {
                for (String y : items) {
                    for (String z : items) {
                        if (eq.areEqual(x, y) && eq.areEqual(y, z)) {
                            assertTrue(eq.areEqual(x, z), x + " " + y + " " + z);
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("Class keys identify classes")
        void classKeys() {
            assertEquals(eq.classKey("a"), eq.classKey("c"));
            assertNotEquals(eq.classKey("a"), eq.classKey("d"));
            assertEquals("f", eq.classKey("f"));
        }
    }

    @Test
    @DisplayName("Concurrent merges produce a consistent result")
    void concurrentMerges() throws Exception {
        EquivalenceCollection<Integer> eq = new EquivalenceCollection<>();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 1000; i++) {
                int n = i;
                futures.add(executor.submit(() -> eq.set(n, n + 1)));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            executor.shutdown();
        }

        assertEquals(1, eq.getClassCount());
        assertEquals(1001, eq.size());
        assertTrue(eq.areEqual(0, 1000));
    }
}
