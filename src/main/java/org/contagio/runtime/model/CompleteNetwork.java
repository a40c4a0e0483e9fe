package org.contagio.runtime.model;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;

/**
 * Complete graph represented implicitly: every vertex neighbors every other vertex.
 * <p>
 * Used as the unconstrained, well-mixed population approximation. No edge list is stored;
 * the {@code k}-th neighbor of vertex {@code i} is {@code k} when {@code k < i} and
 * {@code k + 1} otherwise.
 */
public final class CompleteNetwork implements Network {

    private final int[] ids;
    private final Int2IntOpenHashMap indexById;

    /**
     * Creates a complete graph over vertices with ids {@code 0..size-1}.
     *
     * @param size the number of vertices.
     * @return the network.
     */
    public static CompleteNetwork ofSize(int size) {
        int[] ids = new int[size];
        for (int i = 0; i < size; i++) {
            ids[i] = i;
        }
        return new CompleteNetwork(ids);
    }

    /**
     * Creates a complete graph over the given vertex ids.
     *
     * @param ids the distinct vertex ids.
     * @throws org.contagio.runtime.api.MalformedNetworkException if an id repeats.
     */
    public CompleteNetwork(int[] ids) {
        this.ids = ids.clone();
        this.indexById = AdjacencyNetwork.indexIds(this.ids);
    }

    @Override
    public int size() {
        return ids.length;
    }

    @Override
    public int degree(int index) {
        return ids.length - 1;
    }

    @Override
    public int neighborAt(int index, int k) {
        return k < index ? k : k + 1;
    }

    @Override
    public int idOf(int index) {
        return ids[index];
    }

    @Override
    public int indexOf(int id) {
        return indexById.get(id);
    }

    @Override
    public boolean isDirected() {
        return false;
    }

    @Override
    public long edgeCount() {
        long n = ids.length;
        return n * (n - 1) / 2;
    }

    @Override
    public String toString() {
        return "CompleteNetwork{size=" + ids.length + "}";
    }
}
