package com.leaderboard.hosted.ranking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * AVL tree augmented with subtree sizes, giving O(log n) insert, remove,
 * position lookup and selection by position.
 *
 * <p>Not thread-safe; callers provide their own locking.
 */
public class OrderStatisticTree<E> {

    private final Comparator<? super E> comparator;
    private Node<E> root;

    public OrderStatisticTree(Comparator<? super E> comparator) {
        this.comparator = comparator;
    }

    public int size() {
        return size(root);
    }

    public boolean isEmpty() {
        return root == null;
    }

    public void clear() {
        root = null;
    }

    /**
     * @return false if an equal element was already present
     */
    public boolean add(E element) {
        int before = size();
        root = insert(root, element);
        return size() > before;
    }

    /**
     * @return false if no equal element was present
     */
    public boolean remove(E element) {
        int before = size();
        root = delete(root, element);
        return size() < before;
    }

    public boolean contains(E element) {
        return indexOf(element) >= 0;
    }

    /**
     * Zero-based position of the element in sort order, or -1 when absent.
     */
    public int indexOf(E element) {
        int index = 0;
        Node<E> node = root;
        while (node != null) {
            int cmp = comparator.compare(element, node.value);
            if (cmp < 0) {
                node = node.left;
            } else if (cmp > 0) {
                index += size(node.left) + 1;
                node = node.right;
            } else {
                return index + size(node.left);
            }
        }
        return -1;
    }

    public E get(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for size " + size());
        }
        Node<E> node = root;
        while (true) {
            int leftSize = size(node.left);
            if (index < leftSize) {
                node = node.left;
            } else if (index == leftSize) {
                return node.value;
            } else {
                index -= leftSize + 1;
                node = node.right;
            }
        }
    }

    /**
     * Elements at positions {@code [from, to)}, clamped to the tree bounds.
     */
    public List<E> slice(int from, int to) {
        int start = Math.max(0, from);
        int end = Math.min(size(), to);
        if (start >= end) {
            return Collections.emptyList();
        }
        List<E> out = new ArrayList<>(end - start);
        collect(root, start, end, 0, out);
        return out;
    }

    private void collect(Node<E> node, int from, int to, int offset, List<E> out) {
        if (node == null || to <= offset || from >= offset + node.size) {
            return;
        }
        int nodeIndex = offset + size(node.left);
        collect(node.left, from, to, offset, out);
        if (nodeIndex >= from && nodeIndex < to) {
            out.add(node.value);
        }
        collect(node.right, from, to, nodeIndex + 1, out);
    }

    private Node<E> insert(Node<E> node, E element) {
        if (node == null) {
            return new Node<>(element);
        }
        int cmp = comparator.compare(element, node.value);
        if (cmp < 0) {
            node.left = insert(node.left, element);
        } else if (cmp > 0) {
            node.right = insert(node.right, element);
        } else {
            return node;
        }
        return rebalance(node);
    }

    private Node<E> delete(Node<E> node, E element) {
        if (node == null) {
            return null;
        }
        int cmp = comparator.compare(element, node.value);
        if (cmp < 0) {
            node.left = delete(node.left, element);
        } else if (cmp > 0) {
            node.right = delete(node.right, element);
        } else {
            if (node.left == null) {
                return node.right;
            }
            if (node.right == null) {
                return node.left;
            }
            Node<E> successor = node.right;
            while (successor.left != null) {
                successor = successor.left;
            }
            node.value = successor.value;
            node.right = deleteMin(node.right);
        }
        return rebalance(node);
    }

    private Node<E> deleteMin(Node<E> node) {
        if (node.left == null) {
            return node.right;
        }
        node.left = deleteMin(node.left);
        return rebalance(node);
    }

    private Node<E> rebalance(Node<E> node) {
        update(node);
        int balance = height(node.left) - height(node.right);
        if (balance > 1) {
            if (height(node.left.left) < height(node.left.right)) {
                node.left = rotateLeft(node.left);
            }
            return rotateRight(node);
        }
        if (balance < -1) {
            if (height(node.right.right) < height(node.right.left)) {
                node.right = rotateRight(node.right);
            }
            return rotateLeft(node);
        }
        return node;
    }

    private Node<E> rotateRight(Node<E> node) {
        Node<E> pivot = node.left;
        node.left = pivot.right;
        pivot.right = node;
        update(node);
        update(pivot);
        return pivot;
    }

    private Node<E> rotateLeft(Node<E> node) {
        Node<E> pivot = node.right;
        node.right = pivot.left;
        pivot.left = node;
        update(node);
        update(pivot);
        return pivot;
    }

    private static <E> void update(Node<E> node) {
        node.height = 1 + Math.max(height(node.left), height(node.right));
        node.size = 1 + size(node.left) + size(node.right);
    }

    private static int height(Node<?> node) {
        return node == null ? 0 : node.height;
    }

    private static int size(Node<?> node) {
        return node == null ? 0 : node.size;
    }

    private static final class Node<E> {
        private E value;
        private Node<E> left;
        private Node<E> right;
        private int height = 1;
        private int size = 1;

        private Node(E value) {
            this.value = value;
        }
    }
}
