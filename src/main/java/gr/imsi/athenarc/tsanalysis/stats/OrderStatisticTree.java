package gr.imsi.athenarc.tsanalysis.stats;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * A multiset of doubles supporting insertion, removal and rank selection in O(log n).
 * <p>
 * Implemented as an AVL tree whose nodes live in parallel arrays (an arena) and are addressed by
 * index, with freed nodes recycled through a free list. Each node keeps the multiplicity of its key
 * and the total multiplicity of its subtree, which drives {@link #select(int)}.
 */
public class OrderStatisticTree {

    private static final int NIL = -1;

    private double[] keys;
    private int[] multiplicity;
    private int[] subtreeSize;
    private int[] height;
    private int[] left;
    private int[] right;

    private int root = NIL;
    private int allocated;
    private int freeList = NIL;

    // Set by delete() when the key was found
    private boolean removed;

    public OrderStatisticTree() {
        this(16);
    }

    public OrderStatisticTree(int initialCapacity) {
        int capacity = Math.max(1, initialCapacity);
        keys = new double[capacity];
        multiplicity = new int[capacity];
        subtreeSize = new int[capacity];
        height = new int[capacity];
        left = new int[capacity];
        right = new int[capacity];
    }

    /**
     * Returns the number of values held, counting repeats.
     */
    public int size() {
        return sizeOf(root);
    }

    public boolean isEmpty() {
        return root == NIL;
    }

    public void add(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("NaN cannot be ranked");
        }
        root = insert(root, value);
    }

    /**
     * Removes one occurrence of {@code value}.
     *
     * @return true if the value was present
     */
    public boolean remove(double value) {
        removed = false;
        root = delete(root, value);
        return removed;
    }

    /**
     * Returns the value of rank {@code rank} (0-based) in ascending order.
     */
    public double select(int rank) {
        if (rank < 0 || rank >= size()) {
            throw new IndexOutOfBoundsException("Rank " + rank + " out of bounds for size " + size());
        }
        int node = root;
        while (true) {
            int leftSize = sizeOf(left[node]);
            if (rank < leftSize) {
                node = left[node];
            } else if (rank < leftSize + multiplicity[node]) {
                return keys[node];
            } else {
                rank -= leftSize + multiplicity[node];
                node = right[node];
            }
        }
    }

    public double min() {
        if (root == NIL) {
            throw new NoSuchElementException("Tree is empty");
        }
        int node = root;
        while (left[node] != NIL) {
            node = left[node];
        }
        return keys[node];
    }

    public double max() {
        if (root == NIL) {
            throw new NoSuchElementException("Tree is empty");
        }
        int node = root;
        while (right[node] != NIL) {
            node = right[node];
        }
        return keys[node];
    }

    /**
     * Returns the continuous quantile of probability {@code p}: with {@code h = (n - 1) * p}, linear
     * interpolation between the values of rank {@code floor(h)} and {@code floor(h) + 1}.
     */
    public double quantile(double p) {
        if (p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("Quantile probability must be in [0, 1], got " + p);
        }
        int n = size();
        if (n == 0) {
            throw new NoSuchElementException("Tree is empty");
        }
        double h = (n - 1) * p;
        int lower = (int) Math.floor(h);
        int upper = Math.min(lower + 1, n - 1);
        double lowerValue = select(lower);
        if (upper == lower) {
            return lowerValue;
        }
        return lowerValue + (h - lower) * (select(upper) - lowerValue);
    }

    public void clear() {
        root = NIL;
        allocated = 0;
        freeList = NIL;
    }

    private int insert(int node, double value) {
        if (node == NIL) {
            return allocate(value);
        }
        int cmp = Double.compare(value, keys[node]);
        if (cmp == 0) {
            multiplicity[node]++;
            subtreeSize[node]++;
            return node;
        }
        if (cmp < 0) {
            left[node] = insert(left[node], value);
        } else {
            right[node] = insert(right[node], value);
        }
        return rebalance(node);
    }

    private int delete(int node, double value) {
        if (node == NIL) {
            return NIL;
        }
        int cmp = Double.compare(value, keys[node]);
        if (cmp < 0) {
            left[node] = delete(left[node], value);
        } else if (cmp > 0) {
            right[node] = delete(right[node], value);
        } else {
            removed = true;
            if (multiplicity[node] > 1) {
                multiplicity[node]--;
                subtreeSize[node]--;
                return node;
            }
            if (left[node] == NIL || right[node] == NIL) {
                int child = left[node] != NIL ? left[node] : right[node];
                release(node);
                return child;
            }
            int successor = right[node];
            while (left[successor] != NIL) {
                successor = left[successor];
            }
            keys[node] = keys[successor];
            multiplicity[node] = multiplicity[successor];
            right[node] = detachMin(right[node]);
        }
        return rebalance(node);
    }

    private int detachMin(int node) {
        if (left[node] == NIL) {
            int child = right[node];
            release(node);
            return child;
        }
        left[node] = detachMin(left[node]);
        return rebalance(node);
    }

    private int rebalance(int node) {
        update(node);
        int balance = heightOf(left[node]) - heightOf(right[node]);
        if (balance > 1) {
            if (heightOf(left[left[node]]) < heightOf(right[left[node]])) {
                left[node] = rotateLeft(left[node]);
            }
            return rotateRight(node);
        }
        if (balance < -1) {
            if (heightOf(right[right[node]]) < heightOf(left[right[node]])) {
                right[node] = rotateRight(right[node]);
            }
            return rotateLeft(node);
        }
        return node;
    }

    private int rotateRight(int node) {
        int pivot = left[node];
        left[node] = right[pivot];
        right[pivot] = node;
        update(node);
        update(pivot);
        return pivot;
    }

    private int rotateLeft(int node) {
        int pivot = right[node];
        right[node] = left[pivot];
        left[pivot] = node;
        update(node);
        update(pivot);
        return pivot;
    }

    private void update(int node) {
        height[node] = 1 + Math.max(heightOf(left[node]), heightOf(right[node]));
        subtreeSize[node] = multiplicity[node] + sizeOf(left[node]) + sizeOf(right[node]);
    }

    private int heightOf(int node) {
        return node == NIL ? 0 : height[node];
    }

    private int sizeOf(int node) {
        return node == NIL ? 0 : subtreeSize[node];
    }

    private int allocate(double value) {
        int node;
        if (freeList != NIL) {
            node = freeList;
            freeList = left[node];
        } else {
            if (allocated == keys.length) {
                grow();
            }
            node = allocated++;
        }
        keys[node] = value;
        multiplicity[node] = 1;
        subtreeSize[node] = 1;
        height[node] = 1;
        left[node] = NIL;
        right[node] = NIL;
        return node;
    }

    private void release(int node) {
        left[node] = freeList;
        right[node] = NIL;
        freeList = node;
    }

    private void grow() {
        int capacity = keys.length + (keys.length >> 1) + 1;
        keys = Arrays.copyOf(keys, capacity);
        multiplicity = Arrays.copyOf(multiplicity, capacity);
        subtreeSize = Arrays.copyOf(subtreeSize, capacity);
        height = Arrays.copyOf(height, capacity);
        left = Arrays.copyOf(left, capacity);
        right = Arrays.copyOf(right, capacity);
    }
}
