package gr.imsi.athenarc.tsanalysis.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;

import org.junit.jupiter.api.Test;

public class OrderStatisticTreeTest {

    @Test
    public void testSelectWithRepeats() {
        OrderStatisticTree tree = new OrderStatisticTree();
        for (double value : new double[]{5, 1, 3, 3, 9, 1}) {
            tree.add(value);
        }
        assertEquals(6, tree.size());
        assertEquals(1.0, tree.select(0));
        assertEquals(1.0, tree.select(1));
        assertEquals(3.0, tree.select(2));
        assertEquals(3.0, tree.select(3));
        assertEquals(5.0, tree.select(4));
        assertEquals(9.0, tree.select(5));
        assertEquals(1.0, tree.min());
        assertEquals(9.0, tree.max());
    }

    @Test
    public void testRemoveOneOccurrence() {
        OrderStatisticTree tree = new OrderStatisticTree();
        tree.add(2);
        tree.add(2);
        tree.add(7);
        assertTrue(tree.remove(2));
        assertEquals(2, tree.size());
        assertEquals(2.0, tree.min());
        assertFalse(tree.remove(4));
        assertTrue(tree.remove(2));
        assertTrue(tree.remove(7));
        assertTrue(tree.isEmpty());
        assertThrows(NoSuchElementException.class, tree::min);
    }

    @Test
    public void testQuantileInterpolatesBetweenRanks() {
        OrderStatisticTree tree = new OrderStatisticTree();
        for (int i = 1; i <= 5; i++) {
            tree.add(i);
        }
        assertEquals(3.0, tree.quantile(0.5));
        assertEquals(2.0, tree.quantile(0.25));
        assertEquals(1.0, tree.quantile(0.0));
        assertEquals(5.0, tree.quantile(1.0));
        assertEquals(4.6, tree.quantile(0.9), 1e-12);
    }

    @Test
    public void testRandomSlidingWindowAgreesWithSortedList() {
        Random random = new Random(42);
        OrderStatisticTree tree = new OrderStatisticTree(4);
        List<Double> window = new ArrayList<>();
        for (int step = 0; step < 2000; step++) {
            double value = random.nextInt(50);
            tree.add(value);
            window.add(value);
            if (window.size() > 25) {
                assertTrue(tree.remove(window.remove(0)));
            }
            List<Double> sorted = new ArrayList<>(window);
            Collections.sort(sorted);
            assertEquals(sorted.size(), tree.size());
            int rank = random.nextInt(sorted.size());
            assertEquals(sorted.get(rank), tree.select(rank));
            assertEquals(sorted.get(0), tree.min());
            assertEquals(sorted.get(sorted.size() - 1), tree.max());
        }
    }

    @Test
    public void testNaNRejected() {
        assertThrows(IllegalArgumentException.class, () -> new OrderStatisticTree().add(Double.NaN));
    }
}
