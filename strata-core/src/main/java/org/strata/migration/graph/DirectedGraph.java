package org.strata.migration.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Directed graph over the vertices {@code 0..n-1}. Parallel edges are collapsed; iteration
 * always follows edge insertion order so that every algorithm on top of it is deterministic.
 */
public final class DirectedGraph {

    public record Edge(int from, int to) {
        @Override
        public String toString() {
            return from + "->" + to;
        }
    }

    private final List<Set<Integer>> successors;
    private final List<Set<Integer>> predecessors;
    private final List<Edge> edges = new ArrayList<>();

    public DirectedGraph(int vertexCount) {
        if (vertexCount < 0) {
            throw new IllegalArgumentException("vertexCount must not be negative: " + vertexCount);
        }
        this.successors = new ArrayList<>(vertexCount);
        this.predecessors = new ArrayList<>(vertexCount);
        for (int i = 0; i < vertexCount; i++) {
            successors.add(new LinkedHashSet<>());
            predecessors.add(new LinkedHashSet<>());
        }
    }

    public int vertexCount() {
        return successors.size();
    }

    /**
     * @return {@code false} if the edge already existed
     */
    public boolean addEdge(int from, int to) {
        checkVertex(from);
        checkVertex(to);
        if (!successors.get(from).add(to)) {
            return false;
        }
        predecessors.get(to).add(from);
        edges.add(new Edge(from, to));
        return true;
    }

    public boolean hasEdge(int from, int to) {
        checkVertex(from);
        return successors.get(from).contains(to);
    }

    public Set<Integer> successors(int vertex) {
        checkVertex(vertex);
        return Collections.unmodifiableSet(successors.get(vertex));
    }

    public Set<Integer> predecessors(int vertex) {
        checkVertex(vertex);
        return Collections.unmodifiableSet(predecessors.get(vertex));
    }

    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * Depth-first topological sort. Roots are visited from the highest index down and the
     * finishing order is reversed, so a graph without edges keeps {@code 0..n-1} as is and
     * unrelated vertices keep their relative order.
     *
     * @throws CycleDetectedException if the graph is not a DAG
     */
    public List<Integer> toposort() throws CycleDetectedException {
        VisitState[] states = new VisitState[vertexCount()];
        Arrays.fill(states, VisitState.NOT_VISITED);
        List<Integer> finished = new ArrayList<>(vertexCount());

        for (int vertex = vertexCount() - 1; vertex >= 0; vertex--) {
            visit(vertex, states, finished);
        }

        Collections.reverse(finished);
        return finished;
    }

    public boolean isAcyclic() {
        try {
            toposort();
            return true;
        } catch (CycleDetectedException e) {
            return false;
        }
    }

    /**
     * 명시적 스택으로 DFS (긴 의존 체인에서도 스택 오버플로 없음)
     */
    private void visit(int root, VisitState[] states, List<Integer> finished) throws CycleDetectedException {
        if (states[root] == VisitState.VISITED) {
            return;
        }
        Deque<Frame> stack = new ArrayDeque<>();
        states[root] = VisitState.VISITING;
        stack.push(new Frame(root, successors.get(root).iterator()));

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (!top.successors().hasNext()) {
                stack.pop();
                states[top.vertex()] = VisitState.VISITED;
                finished.add(top.vertex());
                continue;
            }
            int next = top.successors().next();
            switch (states[next]) {
                case VISITED -> { }
                case VISITING -> throw new CycleDetectedException(next);
                case NOT_VISITED -> {
                    states[next] = VisitState.VISITING;
                    stack.push(new Frame(next, successors.get(next).iterator()));
                }
            }
        }
    }

    private void checkVertex(int vertex) {
        if (vertex < 0 || vertex >= successors.size()) {
            throw new IndexOutOfBoundsException("Vertex " + vertex + " out of range [0, " + successors.size() + ")");
        }
    }

    private enum VisitState { NOT_VISITED, VISITING, VISITED }

    private record Frame(int vertex, Iterator<Integer> successors) {
    }
}
