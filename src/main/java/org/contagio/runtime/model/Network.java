package org.contagio.runtime.model;

/**
 * Read-only graph over the agents of one trial.
 * <p>
 * Vertices are addressed by a dense index in {@code [0, size())}; each index also carries an
 * external id used by configuration and output. Neighbor access is index based so that
 * implicit graphs (see {@link CompleteNetwork}) never need to materialize an edge list.
 * <p>
 * Implementations are immutable and guarantee that the neighbor relation is irreflexive and,
 * unless {@link #isDirected()} returns {@code true}, symmetric.
 */
public interface Network {

    /**
     * @return the number of vertices.
     */
    int size();

    /**
     * Returns the number of neighbors of a vertex (out-degree for directed graphs).
     *
     * @param index the vertex index.
     * @return the degree.
     */
    int degree(int index);

    /**
     * Returns the {@code k}-th neighbor of a vertex.
     *
     * @param index the vertex index.
     * @param k the neighbor position in {@code [0, degree(index))}.
     * @return the neighbor's vertex index.
     */
    int neighborAt(int index, int k);

    /**
     * @param index the vertex index.
     * @return the external id of the vertex.
     */
    int idOf(int index);

    /**
     * @param id an external vertex id.
     * @return the vertex index, or {@code -1} if no vertex has this id.
     */
    int indexOf(int id);

    /**
     * @return {@code true} if edges are one-way (a vertex learns from its out-neighbors).
     */
    boolean isDirected();

    /**
     * @return the total number of undirected edges, or arcs for directed graphs.
     */
    long edgeCount();

    /**
     * Copies the neighbor indices of a vertex into a new array.
     *
     * @param index the vertex index.
     * @return the neighbor indices.
     */
    default int[] neighbors(int index) {
        int degree = degree(index);
        int[] result = new int[degree];
        for (int k = 0; k < degree; k++) {
            result[k] = neighborAt(index, k);
        }
        return result;
    }

    /**
     * @param id an external vertex id.
     * @return {@code true} if a vertex with this id exists.
     */
    default boolean containsId(int id) {
        return indexOf(id) >= 0;
    }
}
