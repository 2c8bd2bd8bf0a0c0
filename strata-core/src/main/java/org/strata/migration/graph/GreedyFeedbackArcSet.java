package org.strata.migration.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Approximate minimum feedback arc set after Eades, Lin and Smyth (1993).
 * <p>
 * Vertices are peeled off one at a time: sinks go to the right end of the sequence, sources
 * to the left end, and when neither exists the vertex with the largest
 * {@code outDegree - inDegree} goes left. Every edge that points backwards in the final
 * sequence belongs to the arc set, so removing those edges always leaves a DAG.
 * Ties are broken by the lowest vertex index; the result only depends on the graph and its
 * edge insertion order.
 */
public class GreedyFeedbackArcSet {

    public List<DirectedGraph.Edge> find(DirectedGraph graph) {
        int[] position = vertexSequencePositions(graph);

        List<DirectedGraph.Edge> arcs = new ArrayList<>();
        for (DirectedGraph.Edge edge : graph.edges()) {
            // 자기 루프도 역방향 간선으로 취급
            if (position[edge.from()] >= position[edge.to()]) {
                arcs.add(edge);
            }
        }
        return arcs;
    }

    private int[] vertexSequencePositions(DirectedGraph graph) {
        int n = graph.vertexCount();
        boolean[] removed = new boolean[n];
        int[] outDegree = new int[n];
        int[] inDegree = new int[n];
        for (DirectedGraph.Edge edge : graph.edges()) {
            if (edge.from() != edge.to()) {
                outDegree[edge.from()]++;
                inDegree[edge.to()]++;
            }
        }

        List<Integer> left = new ArrayList<>(n);
        Deque<Integer> right = new ArrayDeque<>();
        int remaining = n;

        while (remaining > 0) {
            int vertex = firstMatching(removed, outDegree);
            if (vertex >= 0) {
                right.addFirst(vertex);
            } else if ((vertex = firstMatching(removed, inDegree)) >= 0) {
                left.add(vertex);
            } else {
                vertex = maxDelta(removed, outDegree, inDegree);
                left.add(vertex);
            }
            remove(graph, vertex, removed, outDegree, inDegree);
            remaining--;
        }

        int[] position = new int[n];
        int index = 0;
        for (int vertex : left) {
            position[vertex] = index++;
        }
        for (int vertex : right) {
            position[vertex] = index++;
        }
        return position;
    }

    // 차수가 0인 첫 번째 정점 (싱크: outDegree, 소스: inDegree)
    private static int firstMatching(boolean[] removed, int[] degree) {
        for (int v = 0; v < degree.length; v++) {
            if (!removed[v] && degree[v] == 0) {
                return v;
            }
        }
        return -1;
    }

    private static int maxDelta(boolean[] removed, int[] outDegree, int[] inDegree) {
        int best = -1;
        int bestDelta = Integer.MIN_VALUE;
        for (int v = 0; v < outDegree.length; v++) {
            if (removed[v]) {
                continue;
            }
            int delta = outDegree[v] - inDegree[v];
            if (delta > bestDelta) {
                best = v;
                bestDelta = delta;
            }
        }
        return best;
    }

    private static void remove(DirectedGraph graph, int vertex, boolean[] removed, int[] outDegree, int[] inDegree) {
        removed[vertex] = true;
        for (int next : graph.successors(vertex)) {
            if (next != vertex && !removed[next]) {
                inDegree[next]--;
            }
        }
        for (int prev : graph.predecessors(vertex)) {
            if (prev != vertex && !removed[prev]) {
                outDegree[prev]--;
            }
        }
    }
}
