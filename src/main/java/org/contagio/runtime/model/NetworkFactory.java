package org.contagio.runtime.model;

import java.util.List;
import java.util.Locale;

import org.contagio.runtime.api.ConfigurationException;
import org.contagio.runtime.api.MalformedNetworkException;
import org.contagio.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Builds networks, either from explicit definitions or from random graph generators.
 * <p>
 * Generated vertices carry ids {@code 0..n-1}. Random generators draw exclusively from the
 * supplied {@link IRandomProvider}, so a trial that builds its own network from its own stream
 * stays reproducible.
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * network {
 *   type = "watts-strogatz"   # complete | explicit | ring-lattice | erdos-renyi | watts-strogatz | barabasi-albert
 *   size = 100
 *   k = 4
 *   beta = 0.1
 * }
 * network {
 *   type = "explicit"
 *   edges = [[1, 2], [1, 3], [1, 4], [3, 2]]
 *   vertices = [5]            # optional isolated vertices
 *   directed = false
 * }
 * }</pre>
 */
public final class NetworkFactory {

    private NetworkFactory() {
    }

    /**
     * Builds a network from its HOCON definition.
     *
     * @param config the {@code network} block.
     * @param random the stream used by random generators.
     * @return the network.
     * @throws ConfigurationException if the type is unknown or a required key is missing.
     * @throws MalformedNetworkException if the definition cannot produce a valid graph.
     */
    public static Network fromConfig(Config config, IRandomProvider random) {
        String type = config.hasPath("type") ? config.getString("type").trim().toLowerCase(Locale.ROOT) : "complete";
        try {
            return switch (type) {
                case "complete" -> complete(config.getInt("size"));
                case "explicit" -> explicit(config);
                case "ring-lattice" -> ringLattice(config.getInt("size"), config.getInt("k"));
                case "erdos-renyi" -> erdosRenyi(config.getInt("size"), config.getDouble("p"), random);
                case "watts-strogatz" -> wattsStrogatz(config.getInt("size"), config.getInt("k"),
                        config.getDouble("beta"), random);
                case "barabasi-albert" -> barabasiAlbert(config.getInt("size"), config.getInt("m"), random);
                default -> throw new ConfigurationException("Unknown network type: '" + type
                        + "'. Valid types: complete, explicit, ring-lattice, erdos-renyi, watts-strogatz, barabasi-albert");
            };
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid '" + type + "' network definition: " + e.getMessage(), e);
        }
    }

    /**
     * @param size the number of vertices.
     * @return an implicit complete graph.
     */
    public static Network complete(int size) {
        requireNonNegativeSize(size);
        return CompleteNetwork.ofSize(size);
    }

    /**
     * Builds an undirected network from {@code {from, to}} id pairs.
     *
     * @param edges the edges.
     * @return the network.
     */
    public static Network fromEdges(int[]... edges) {
        AdjacencyNetwork.Builder builder = AdjacencyNetwork.undirected();
        for (int[] edge : edges) {
            if (edge.length != 2) {
                throw new MalformedNetworkException("Edge must have exactly two endpoints, got " + edge.length);
            }
            builder.addEdge(edge[0], edge[1]);
        }
        return builder.build();
    }

    private static Network explicit(Config config) {
        boolean directed = config.hasPath("directed") && config.getBoolean("directed");
        AdjacencyNetwork.Builder builder = directed ? AdjacencyNetwork.directed() : AdjacencyNetwork.undirected();
        if (config.hasPath("vertices")) {
            for (int id : config.getIntList("vertices")) {
                builder.addVertex(id);
            }
        }
        if (config.hasPath("edges")) {
            for (Object rawEdge : config.getList("edges").unwrapped()) {
                if (!(rawEdge instanceof List<?> edge) || edge.size() != 2
                        || !(edge.get(0) instanceof Number from) || !(edge.get(1) instanceof Number to)) {
                    throw new MalformedNetworkException("Edge must be a pair of integer ids, got " + rawEdge);
                }
                builder.addEdge(from.intValue(), to.intValue());
            }
        }
        return builder.build();
    }

    /**
     * Builds a ring lattice where every vertex is connected to its {@code k/2} nearest
     * neighbors on each side.
     *
     * @param size the number of vertices.
     * @param k the (even) degree of every vertex.
     * @return the network.
     */
    public static Network ringLattice(int size, int k) {
        requireLatticeDegree(size, k);
        AdjacencyNetwork.Builder builder = indexedBuilder(size);
        for (int i = 0; i < size; i++) {
            for (int j = 1; j <= k / 2; j++) {
                builder.addEdgeByIndex(i, (i + j) % size);
            }
        }
        return builder.build();
    }

    /**
     * Builds a G(n, p) random graph: every unordered pair is connected independently with
     * probability {@code p}.
     *
     * @param size the number of vertices.
     * @param p the edge probability.
     * @param random the random stream.
     * @return the network.
     */
    public static Network erdosRenyi(int size, double p, IRandomProvider random) {
        requireNonNegativeSize(size);
        requireProbability("p", p);
        AdjacencyNetwork.Builder builder = indexedBuilder(size);
        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                if (random.nextDouble() < p) {
                    builder.addEdgeByIndex(i, j);
                }
            }
        }
        return builder.build();
    }

    /**
     * Builds a Watts-Strogatz small-world graph: a ring lattice of degree {@code k} whose
     * clockwise edges are each rewired to a uniformly chosen new endpoint with probability
     * {@code beta}. Rewiring never creates self-loops or duplicate edges; an edge whose vertex
     * is already connected to every other vertex stays in place.
     *
     * @param size the number of vertices.
     * @param k the (even) lattice degree.
     * @param beta the rewiring probability.
     * @param random the random stream.
     * @return the network.
     */
    public static Network wattsStrogatz(int size, int k, double beta, IRandomProvider random) {
        requireLatticeDegree(size, k);
        requireProbability("beta", beta);
        IntOpenHashSet[] adjacency = new IntOpenHashSet[size];
        for (int i = 0; i < size; i++) {
            adjacency[i] = new IntOpenHashSet();
        }
        for (int i = 0; i < size; i++) {
            for (int j = 1; j <= k / 2; j++) {
                link(adjacency, i, (i + j) % size);
            }
        }
        for (int j = 1; j <= k / 2; j++) {
            for (int i = 0; i < size; i++) {
                int target = (i + j) % size;
                if (random.nextDouble() >= beta || adjacency[i].size() >= size - 1) {
                    continue;
                }
                int replacement;
                do {
                    replacement = random.nextInt(size);
                } while (replacement == i || adjacency[i].contains(replacement));
                adjacency[i].remove(target);
                adjacency[target].remove(i);
                link(adjacency, i, replacement);
            }
        }
        AdjacencyNetwork.Builder builder = indexedBuilder(size);
        for (int i = 0; i < size; i++) {
            for (int neighbor : adjacency[i]) {
                if (neighbor > i) {
                    builder.addEdgeByIndex(i, neighbor);
                }
            }
        }
        return builder.build();
    }

    /**
     * Builds a Barabasi-Albert preferential-attachment graph. The first {@code m + 1} vertices
     * form a complete seed; every later vertex attaches to {@code m} distinct existing vertices
     * chosen with probability proportional to their degree.
     *
     * @param size the number of vertices.
     * @param m the number of edges added with each new vertex.
     * @param random the random stream.
     * @return the network.
     */
    public static Network barabasiAlbert(int size, int m, IRandomProvider random) {
        requireNonNegativeSize(size);
        if (m < 1) {
            throw new MalformedNetworkException("Barabasi-Albert m must be >= 1, got " + m);
        }
        AdjacencyNetwork.Builder builder = indexedBuilder(size);
        // Every edge endpoint appears once, so a uniform draw is degree-proportional
        IntArrayList endpoints = new IntArrayList();
        int seedSize = Math.min(size, m + 1);
        for (int i = 0; i < seedSize; i++) {
            for (int j = i + 1; j < seedSize; j++) {
                builder.addEdgeByIndex(i, j);
                endpoints.add(i);
                endpoints.add(j);
            }
        }
        IntOpenHashSet chosen = new IntOpenHashSet(m);
        IntArrayList chosenInOrder = new IntArrayList(m);
        for (int vertex = seedSize; vertex < size; vertex++) {
            chosen.clear();
            chosenInOrder.clear();
            while (chosenInOrder.size() < m) {
                int candidate = endpoints.getInt(random.nextInt(endpoints.size()));
                if (chosen.add(candidate)) {
                    chosenInOrder.add(candidate);
                }
            }
            for (int i = 0; i < chosenInOrder.size(); i++) {
                int target = chosenInOrder.getInt(i);
                builder.addEdgeByIndex(vertex, target);
                endpoints.add(vertex);
                endpoints.add(target);
            }
        }
        return builder.build();
    }

    private static AdjacencyNetwork.Builder indexedBuilder(int size) {
        AdjacencyNetwork.Builder builder = AdjacencyNetwork.undirected();
        for (int i = 0; i < size; i++) {
            builder.addVertex(i);
        }
        return builder;
    }

    private static void link(IntOpenHashSet[] adjacency, int a, int b) {
        adjacency[a].add(b);
        adjacency[b].add(a);
    }

    private static void requireNonNegativeSize(int size) {
        if (size < 0) {
            throw new MalformedNetworkException("Network size must be >= 0, got " + size);
        }
    }

    private static void requireLatticeDegree(int size, int k) {
        requireNonNegativeSize(size);
        if (k < 0 || k % 2 != 0 || k >= size) {
            throw new MalformedNetworkException(
                    "Lattice degree k must be even, non-negative and smaller than size (" + size + "), got " + k);
        }
    }

    private static void requireProbability(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new MalformedNetworkException("Network parameter " + name + " must be within [0, 1], got " + value);
        }
    }
}
