package com.indexedpq.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PriorityQueues Tests")
class PriorityQueuesTest {

    private Map<String, Integer> mapping;

    @BeforeEach
    void setUp() {
        mapping = new LinkedHashMap<>();
        mapping.put("A", 5);
        mapping.put("B", 8);
        mapping.put("C", 7);
        mapping.put("D", 3);
        mapping.put("E", 9);
        mapping.put("F", 12);
        mapping.put("G", 1);
    }

    @Test
    @DisplayName("nLargest should return keys of the largest values, descending")
    void nLargestShouldReturnLargestDescending() {
        assertEquals(Arrays.asList("F", "E", "B"), PriorityQueues.nLargest(3, mapping));
    }

    @Test
    @DisplayName("nSmallest should return keys of the smallest values, ascending")
    void nSmallestShouldReturnSmallestAscending() {
        assertEquals(Arrays.asList("G", "D", "A"), PriorityQueues.nSmallest(3, mapping));
    }

    @ParameterizedTest
    @DisplayName("Should return at most the size of the mapping")
    @CsvSource({
        "0, 0",
        "1, 1",
        "7, 7",
        "10, 7",
        "-2, 0"
    })
    void shouldReturnAtMostTheSizeOfTheMapping(int n, int expectedSize) {
        assertEquals(expectedSize, PriorityQueues.nLargest(n, mapping).size());
        assertEquals(expectedSize, PriorityQueues.nSmallest(n, mapping).size());
    }

    @Test
    @DisplayName("Asking for everything should sort the whole mapping")
    void askingForEverythingShouldSortWholeMapping() {
        assertEquals(Arrays.asList("F", "E", "B", "C", "A", "D", "G"), PriorityQueues.nLargest(100, mapping));
        assertEquals(Arrays.asList("G", "D", "A", "C", "B", "E", "F"), PriorityQueues.nSmallest(100, mapping));
    }

    @Test
    @DisplayName("Should rank by the key function when given")
    void shouldRankByKeyFunction() {
        Map<String, String> words = new LinkedHashMap<>();
        words.put("w1", "pear");
        words.put("w2", "fig");
        words.put("w3", "banana");
        words.put("w4", "kiwifruit");

        assertEquals(Arrays.asList("w4", "w3"), PriorityQueues.nLargest(2, words, String::length));
        assertEquals(Arrays.asList("w2", "w1"), PriorityQueues.nSmallest(2, words, String::length));
    }

    @Test
    @DisplayName("Should agree with a full sort on random data")
    void shouldAgreeWithFullSortOnRandomData() {
        Random random = new Random(42);
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            values.add(i);
        }
        Collections.shuffle(values, random);
        Map<Integer, Integer> data = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            data.put(i, values.get(i));
        }

        List<Integer> byValue = new ArrayList<>(data.keySet());
        byValue.sort(Comparator.comparing(data::get));

        assertEquals(byValue.subList(0, 25), PriorityQueues.nSmallest(25, data));
        List<Integer> reversed = new ArrayList<>(byValue);
        Collections.reverse(reversed);
        assertEquals(reversed.subList(0, 25), PriorityQueues.nLargest(25, data));
    }

    @Test
    @DisplayName("sortedByPriority should order all keys")
    void sortedByPriorityShouldOrderAllKeys() {
        assertEquals(Arrays.asList("G", "D", "A", "C", "B", "E", "F"), PriorityQueues.sortedByPriority(mapping));
        assertEquals(Arrays.asList("F", "E", "B", "C", "A", "D", "G"),
                PriorityQueues.sortedByPriority(mapping, Precedence.<Integer>reverseOrder()));
        assertTrue(PriorityQueues.sortedByPriority(new LinkedHashMap<String, Integer>()).isEmpty());
    }

    @Test
    @DisplayName("Should leave the input mapping untouched")
    void shouldLeaveInputMappingUntouched() {
        Map<String, Integer> before = new LinkedHashMap<>(mapping);

        PriorityQueues.nLargest(3, mapping);
        PriorityQueues.sortedByPriority(mapping);

        assertEquals(before, mapping);
    }
}
