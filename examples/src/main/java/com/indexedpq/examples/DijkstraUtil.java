package com.indexedpq.examples;

import com.indexedpq.core.IndexedPriorityQueue;

import org.jgrapht.alg.util.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dijkstra's shortest path algorithm on top of an indexed priority queue.
 * <p>
 * Every vertex is queued up front with an infinite distance, and each edge
 * relaxation lowers the neighbour's entry in place (decrease-key). The queue
 * therefore never holds stale entries, and the main loop runs in
 * O((m + n) log n).
 */
public class DijkstraUtil {

    /** Marks a vertex with no known path. */
    public static final int UNREACHABLE = Integer.MAX_VALUE;

    /**
     * A weighted, directed edge of an adjacency list.
     */
    public static class Edge {
        public final int to;
        public final int weight;

        public Edge(int to, int weight) {
            this.to = to;
            this.weight = weight;
        }
    }

    /**
     * Distances and predecessor links computed from a single source.
     */
    public static class DijkstraResult {
        public final int[] distances;
        public final int[] predecessors;

        public DijkstraResult(int[] distances, int[] predecessors) {
            this.distances = distances;
            this.predecessors = predecessors;
        }

        /**
         * Walks the predecessor links back from target to source.
         * @param source the vertex the search started from
         * @param target the vertex to reach
         * @return vertices from source to target, or an empty list if unreachable
         */
        public List<Integer> reconstructPath(int source, int target) {
            List<Integer> path = new ArrayList<>();
            if (distances[target] == UNREACHABLE) {
                return path;
            }

            int current = target;
            while (current != source && current != -1) {
                path.add(current);
                current = predecessors[current];
            }
            if (current != source) {
                path.clear();
                return path;
            }
            path.add(source);
            Collections.reverse(path);
            return path;
        }
    }

    /**
     * Computes the distance from {@code source} to every vertex.
     *
     * @param source the source vertex
     * @param adjacencyList outgoing edges, indexed by vertex
     * @param numNodes total number of vertices
     */
    public static DijkstraResult dijkstra(int source, List<? extends List<Edge>> adjacencyList, int numNodes) {
        return dijkstra(source, -1, adjacencyList, numNodes);
    }

    /**
     * Computes shortest distances from {@code source}, stopping as soon as
     * {@code target} is settled. Distances of vertices not settled by then
     * stay {@link #UNREACHABLE}. A negative target searches the whole graph.
     */
    public static DijkstraResult dijkstra(int source, int target, List<? extends List<Edge>> adjacencyList,
            int numNodes) {
        int[] dist = new int[numNodes];
        int[] from = new int[numNodes];

        Map<Integer, Integer> initial = new LinkedHashMap<>();
        for (int i = 0; i < numNodes; i++) {
            dist[i] = UNREACHABLE;
            from[i] = -1;
            initial.put(i, i == source ? 0 : UNREACHABLE);
        }
        IndexedPriorityQueue<Integer, Integer, Integer> pq = IndexedPriorityQueue.minQueue(initial);

        while (!pq.isEmpty()) {
            Pair<Integer, Integer> top = pq.popTopItem();
            int node = top.getFirst();
            int nodeDist = top.getSecond();
            if (nodeDist == UNREACHABLE) {
                break; // everything left is unreachable
            }
            dist[node] = nodeDist;
            if (node == target) {
                break;
            }

            for (Edge edge : adjacencyList.get(node)) {
                if (!pq.contains(edge.to)) {
                    continue; // already settled
                }
                long newDist = (long) nodeDist + edge.weight;
                if (newDist < pq.get(edge.to)) {
                    pq.setPriority(edge.to, (int) newDist);
                    from[edge.to] = node;
                }
            }
        }

        return new DijkstraResult(dist, from);
    }

    /**
     * Shortest distances over a graph given as nested maps,
     * {@code graph.get(u).get(v)} being the weight of edge u to v.
     * Vertices only appearing as edge targets are included.
     *
     * @return the distances of settled vertices and the predecessor of each
     *         vertex on its shortest path
     */
    public static <N> Pair<Map<N, Double>, Map<N, N>> dijkstra(Map<N, ? extends Map<N, Double>> graph,
            N source, N target) {
        Map<N, Double> dist = new LinkedHashMap<>();
        Map<N, N> pred = new HashMap<>();

        IndexedPriorityQueue<N, Double, Double> pq = IndexedPriorityQueue.minQueue();
        for (Map.Entry<N, ? extends Map<N, Double>> entry : graph.entrySet()) {
            pq.setDefault(entry.getKey(), Double.POSITIVE_INFINITY);
            for (N neighbor : entry.getValue().keySet()) {
                pq.setDefault(neighbor, Double.POSITIVE_INFINITY);
            }
        }
        pq.setPriority(source, 0.0);

        while (!pq.isEmpty()) {
            Pair<N, Double> top = pq.popTopItem();
            N node = top.getFirst();
            dist.put(node, top.getSecond());
            if (node.equals(target)) {
                break;
            }

            Map<N, Double> edges = graph.get(node);
            if (edges == null) {
                continue;
            }
            for (Map.Entry<N, Double> edge : edges.entrySet()) {
                N neighbor = edge.getKey();
                if (pq.contains(neighbor)) {
                    double newScore = top.getSecond() + edge.getValue();
                    if (newScore < pq.get(neighbor)) {
                        pq.setPriority(neighbor, newScore);
                        pred.put(neighbor, node);
                    }
                }
            }
        }
        return new Pair<>(dist, pred);
    }

    /**
     * The vertices of a shortest path from source to target, or an empty
     * list if there is none.
     */
    public static <N> List<N> shortestPath(Map<N, ? extends Map<N, Double>> graph, N source, N target) {
        Pair<Map<N, Double>, Map<N, N>> result = dijkstra(graph, source, target);
        Double distance = result.getFirst().get(target);
        if (distance == null || distance.isInfinite()) {
            return new ArrayList<>();
        }

        List<N> path = new ArrayList<>();
        N end = target;
        path.add(end);
        while (!end.equals(source)) {
            end = result.getSecond().get(end);
            path.add(end);
        }
        Collections.reverse(path);
        return path;
    }
}
