package org.contagio.runtime.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.contagio.runtime.api.MalformedNetworkException;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Explicit finite graph stored in compressed sparse row form.
 * <p>
 * Neighbor lists are sorted by vertex index so iteration order, and therefore every random
 * draw that depends on it, is independent of edge insertion order.
 */
public final class AdjacencyNetwork implements Network {

    private final int[] ids;
    private final Int2IntOpenHashMap indexById;
    private final int[] offsets;
    private final int[] targets;
    private final boolean directed;

    private AdjacencyNetwork(int[] ids, Int2IntOpenHashMap indexById, int[] offsets, int[] targets, boolean directed) {
        this.ids = ids;
        this.indexById = indexById;
        this.offsets = offsets;
        this.targets = targets;
        this.directed = directed;
    }

    /**
     * @return a builder for an undirected network.
     */
    public static Builder undirected() {
        return new Builder(false);
    }

    /**
     * @return a builder for a directed network.
     */
    public static Builder directed() {
        return new Builder(true);
    }

    @Override
    public int size() {
        return ids.length;
    }

    @Override
    public int degree(int index) {
        return offsets[index + 1] - offsets[index];
    }

    @Override
    public int neighborAt(int index, int k) {
        return targets[offsets[index] + k];
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
        return directed;
    }

    @Override
    public long edgeCount() {
        return directed ? targets.length : targets.length / 2;
    }

    @Override
    public String toString() {
        return "AdjacencyNetwork{size=" + ids.length + ", edges=" + edgeCount() + ", directed=" + directed + "}";
    }

    static Int2IntOpenHashMap indexIds(int[] ids) {
        Int2IntOpenHashMap map = new Int2IntOpenHashMap(ids.length);
        map.defaultReturnValue(-1);
        for (int i = 0; i < ids.length; i++) {
            if (map.put(ids[i], i) != -1) {
                throw new MalformedNetworkException("Duplicate vertex id " + ids[i]);
            }
        }
        return map;
    }

    /**
     * Accumulates vertices and edges. Vertices are indexed in order of first appearance,
     * either through {@link #addVertex(int)} or as an edge endpoint.
     */
    public static final class Builder {

        private final boolean directed;
        private final IntArrayList vertexIds = new IntArrayList();
        private final Int2IntOpenHashMap indexById = new Int2IntOpenHashMap();
        private final List<IntOpenHashSet> adjacency = new ArrayList<>();

        private Builder(boolean directed) {
            this.directed = directed;
            this.indexById.defaultReturnValue(-1);
        }

        /**
         * Adds an isolated vertex, or does nothing if the id is already present.
         *
         * @param id the vertex id.
         * @return this builder.
         */
        public Builder addVertex(int id) {
            vertexIndex(id);
            return this;
        }

        /**
         * Adds an edge between two vertices, creating them on first use. Duplicate edges
         * are ignored.
         *
         * @param fromId the source vertex id.
         * @param toId the target vertex id.
         * @return this builder.
         * @throws MalformedNetworkException if both ids are equal.
         */
        public Builder addEdge(int fromId, int toId) {
            if (fromId == toId) {
                throw new MalformedNetworkException("Self-loop on vertex " + fromId + " is not permitted");
            }
            int from = vertexIndex(fromId);
            int to = vertexIndex(toId);
            adjacency.get(from).add(to);
            if (!directed) {
                adjacency.get(to).add(from);
            }
            return this;
        }

        /**
         * Adds an edge between two vertex indices that were already created.
         * Used by generators that work in index space.
         */
        Builder addEdgeByIndex(int from, int to) {
            return addEdge(vertexIds.getInt(from), vertexIds.getInt(to));
        }

        private int vertexIndex(int id) {
            int index = indexById.get(id);
            if (index < 0) {
                index = vertexIds.size();
                vertexIds.add(id);
                indexById.put(id, index);
                adjacency.add(new IntOpenHashSet());
            }
            return index;
        }

        /**
         * @return the immutable network.
         */
        public AdjacencyNetwork build() {
            int n = vertexIds.size();
            int[] offsets = new int[n + 1];
            for (int i = 0; i < n; i++) {
                offsets[i + 1] = offsets[i] + adjacency.get(i).size();
            }
            int[] targets = new int[offsets[n]];
            for (int i = 0; i < n; i++) {
                int[] sorted = adjacency.get(i).toIntArray();
                Arrays.sort(sorted);
                System.arraycopy(sorted, 0, targets, offsets[i], sorted.length);
            }
            int[] ids = vertexIds.toIntArray();
            return new AdjacencyNetwork(ids, indexIds(ids), offsets, targets, directed);
        }
    }
}
