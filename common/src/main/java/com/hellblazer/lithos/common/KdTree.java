/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Lithos.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.lithos.common;

import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Static k-d tree over indexed points, used for fixed-radius queries on sample locations. The tree is built once and
 * never mutated, so concurrent queries are safe.
 *
 * @author hal.hildebrand
 */
public class KdTree {
    private static class Node {
        private final Point3d coords;
        private final int     index;
        private       Node    left  = null;
        private       Node    right = null;

        Node(Tuple3d p, int index) {
            coords = new Point3d(p);
            this.index = index;
        }

        double distanceSquared(Tuple3d p, int dimensions) {
            double sum = 0;
            for (int i = 0; i < dimensions; i++) {
                double d = get(i) - component(p, i);
                sum += d * d;
            }
            return sum;
        }

        double get(int axis) {
            return component(coords, axis);
        }
    }

    //
    // Quickselect with a middle pivot so that identical inputs always produce the identical tree.
    // See https://en.wikipedia.org/wiki/Quickselect
    //
    static class QuickSelect {
        static <T> T select(List<T> list, int left, int right, int n, Comparator<? super T> cmp) {
            for (;;) {
                if (left == right) {
                    return list.get(left);
                }
                int pivot = partition(list, left, right, left + (right - left) / 2, cmp);
                if (n == pivot) {
                    return list.get(n);
                } else if (n < pivot) {
                    right = pivot - 1;
                } else {
                    left = pivot + 1;
                }
            }
        }

        private static <T> int partition(List<T> list, int left, int right, int pivot, Comparator<? super T> cmp) {
            T pivotValue = list.get(pivot);
            swap(list, pivot, right);
            int store = left;
            for (int i = left; i < right; ++i) {
                if (cmp.compare(list.get(i), pivotValue) < 0) {
                    swap(list, store, i);
                    ++store;
                }
            }
            swap(list, right, store);
            return store;
        }

        private static <T> void swap(List<T> list, int i, int j) {
            T value = list.get(i);
            list.set(i, list.get(j));
            list.set(j, value);
        }
    }

    private final int  dimensions;
    private final Node root;

    /**
     * @param dimensions number of leading coordinates that participate in distance (2 ignores z)
     * @param points     the points; the list index becomes the node index
     */
    public static KdTree of(int dimensions, List<? extends Tuple3d> points) {
        var nodes = new ArrayList<Node>(points.size());
        for (int i = 0; i < points.size(); i++) {
            nodes.add(new Node(points.get(i), i));
        }
        return new KdTree(dimensions, nodes);
    }

    private KdTree(int dimensions, List<Node> nodes) {
        if (dimensions < 1 || dimensions > 3) {
            throw new IllegalArgumentException("dimensions must be 1, 2 or 3: " + dimensions);
        }
        this.dimensions = dimensions;
        root = makeTree(nodes, 0, nodes.size(), 0);
    }

    private static double component(Tuple3d p, int axis) {
        return switch (axis) {
            case 0 -> p.x;
            case 1 -> p.y;
            case 2 -> p.z;
            default -> throw new IllegalArgumentException("Unexpected axis: " + axis);
        };
    }

    /**
     * @return the indices of every node within {@code radius} of the target (inclusive), in ascending index order
     */
    public List<Integer> withinRadius(Tuple3d target, double radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("radius must be non-negative: " + radius);
        }
        var found = new ArrayList<Integer>();
        range(root, target, radius * radius, 0, found);
        found.sort(Comparator.naturalOrder());
        return found;
    }

    private Node makeTree(List<Node> nodes, int begin, int end, int axis) {
        if (end <= begin) {
            return null;
        }
        int n = begin + (end - begin) / 2;
        final int splitAxis = axis;
        Comparator<Node> byAxis = Comparator.<Node>comparingDouble(node -> node.get(splitAxis))
                                            .thenComparingInt(node -> node.index);
        Node node = QuickSelect.select(nodes, begin, end - 1, n, byAxis);
        int next = (axis + 1) % dimensions;
        node.left = makeTree(nodes, begin, n, next);
        node.right = makeTree(nodes, n + 1, end, next);
        return node;
    }

    private void range(Node node, Tuple3d target, double radiusSquared, int axis, List<Integer> found) {
        if (node == null) {
            return;
        }
        if (node.distanceSquared(target, dimensions) <= radiusSquared) {
            found.add(node.index);
        }
        double dx = node.get(axis) - component(target, axis);
        int next = (axis + 1) % dimensions;
        if (dx >= 0 || dx * dx <= radiusSquared) {
            range(node.left, target, radiusSquared, next, found);
        }
        if (dx <= 0 || dx * dx <= radiusSquared) {
            range(node.right, target, radiusSquared, next, found);
        }
    }
}
