package com.leaderboard.hosted.ranking;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class OrderStatisticTreeTest {

    @Test
    void testEmptyTree() {
        OrderStatisticTree<Integer> tree = new OrderStatisticTree<>(Comparator.naturalOrder());

        assertTrue(tree.isEmpty());
        assertEquals(0, tree.size());
        assertEquals(-1, tree.indexOf(5));
        assertTrue(tree.slice(0, 10).isEmpty());
        assertThrows(IndexOutOfBoundsException.class, () -> tree.get(0));
    }

    @Test
    void testAddRejectsDuplicates() {
        OrderStatisticTree<Integer> tree = new OrderStatisticTree<>(Comparator.naturalOrder());

        assertTrue(tree.add(3));
        assertFalse(tree.add(3));
        assertEquals(1, tree.size());
    }

    @Test
    void testIndexOfAndGetFollowSortOrder() {
        OrderStatisticTree<Integer> tree = new OrderStatisticTree<>(Comparator.reverseOrder());
        for (int value : new int[] {5, 1, 9, 3, 7}) {
            tree.add(value);
        }

        assertEquals(List.of(9, 7, 5, 3, 1), tree.slice(0, 5));
        assertEquals(0, tree.indexOf(9));
        assertEquals(4, tree.indexOf(1));
        assertEquals(5, tree.get(2));
    }

    @Test
    void testSliceIsClampedToBounds() {
        OrderStatisticTree<Integer> tree = new OrderStatisticTree<>(Comparator.naturalOrder());
        for (int i = 0; i < 10; i++) {
            tree.add(i);
        }

        assertEquals(List.of(0, 1, 2), tree.slice(-5, 3));
        assertEquals(List.of(8, 9), tree.slice(8, 50));
        assertTrue(tree.slice(7, 7).isEmpty());
    }

    @Test
    void testRandomOperationsMatchTreeSet() {
        // Arrange
        Random random = new Random(42);
        OrderStatisticTree<Integer> tree = new OrderStatisticTree<>(Comparator.naturalOrder());
        TreeSet<Integer> reference = new TreeSet<>();

        // Act
        for (int i = 0; i < 5000; i++) {
            int value = random.nextInt(500);
            if (random.nextInt(3) == 0) {
                assertEquals(reference.remove(value), tree.remove(value));
            } else {
                assertEquals(reference.add(value), tree.add(value));
            }
        }

        // Assert
        List<Integer> expected = new ArrayList<>(reference);
        assertEquals(expected.size(), tree.size());
        assertEquals(expected, tree.slice(0, tree.size()));
        for (int i = 0; i < expected.size(); i++) {
            assertEquals(i, tree.indexOf(expected.get(i)));
            assertEquals(expected.get(i), tree.get(i));
        }
        assertEquals(expected.subList(100, 120), tree.slice(100, 120));
    }

    @Test
    void testClear() {
        OrderStatisticTree<Integer> tree = new OrderStatisticTree<>(Comparator.naturalOrder());
        tree.add(1);
        tree.add(2);

        tree.clear();

        assertTrue(tree.isEmpty());
        assertFalse(tree.contains(1));
    }
}
