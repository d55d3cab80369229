package com.cx.anomaly.engine.lof;

/**
 * A training row at some distance from a query. Ordered by distance, then by row index,
 * so neighbor sets are reproducible when distances tie.
 */
public record Neighbor(int index, double distance) implements Comparable<Neighbor> {

    @Override
    public int compareTo(Neighbor other) {
        int byDistance = Double.compare(distance, other.distance);
        return byDistance != 0 ? byDistance : Integer.compare(index, other.index);
    }
}
