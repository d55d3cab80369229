package com.cx.anomaly.engine.lof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Exact brute-force k-nearest-neighbor search under Euclidean distance.
 */
public final class NeighborSearch {

    public static final int NO_EXCLUSION = -1;

    private NeighborSearch() {}

    /**
     * @param excludeIndex training row to skip (the query itself at fit time), or {@link #NO_EXCLUSION}
     * @return the k nearest rows, closest first
     */
    public static List<Neighbor> nearest(double[][] data, double[] query, int k, int excludeIndex) {
        // max-heap on (distance, index): the head is the worst of the current k
        PriorityQueue<Neighbor> heap = new PriorityQueue<>(k + 1, Collections.reverseOrder());
        for (int i = 0; i < data.length; i++) {
            if (i == excludeIndex) continue;
            Neighbor candidate = new Neighbor(i, euclidean(data[i], query));
            if (heap.size() < k) {
                heap.add(candidate);
            } else if (candidate.compareTo(heap.peek()) < 0) {
                heap.poll();
                heap.add(candidate);
            }
        }
        List<Neighbor> result = new ArrayList<>(heap);
        Collections.sort(result);
        return result;
    }

    public static double euclidean(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Expected " + a.length + " features but got " + b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }
}
