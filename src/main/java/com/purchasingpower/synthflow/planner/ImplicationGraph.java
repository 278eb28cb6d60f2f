package com.purchasingpower.synthflow.planner;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assignment trail and implication graph in one arena.
 *
 * <p>Nodes are appended in assignment order and referenced by index. Each node keeps the indices
 * of the nodes that forced it, so edges never point forward and truncating the tail at a level
 * boundary removes a node together with all of its incoming edges.
 */
final class ImplicationGraph {

    private record Node(Literal literal, int level, int antecedent, int[] predecessors) {
    }

    private static final int NO_ANTECEDENT = -1;

    private final List<Node> nodes = new ArrayList<>();

    /** levelStarts.get(k - 1) is the index of the first node at decision level k. */
    private final List<Integer> levelStarts = new ArrayList<>();

    private final Map<Literal.Variable, Integer> nodeByVariable = new HashMap<>();

    int size() {
        return nodes.size();
    }

    int decisionLevel() {
        return levelStarts.size();
    }

    void openLevel() {
        levelStarts.add(nodes.size());
    }

    int addDecision(Literal literal) {
        return add(literal, NO_ANTECEDENT, new int[0]);
    }

    int addImplied(Literal literal, int antecedent, int[] predecessors) {
        return add(literal, antecedent, predecessors);
    }

    private int add(Literal literal, int antecedent, int[] predecessors) {
        int index = nodes.size();
        nodes.add(new Node(literal, decisionLevel(), antecedent, predecessors));
        nodeByVariable.put(literal.variable(), index);
        return index;
    }

    /**
     * @return TRUE or FALSE under the current assignment, null when the variable is unassigned
     */
    Boolean valueOf(Literal literal) {
        Integer index = nodeByVariable.get(literal.variable());
        if (index == null) {
            return null;
        }
        return nodes.get(index).literal().isPositive() == literal.isPositive();
    }

    int nodeOf(Literal literal) {
        Integer index = nodeByVariable.get(literal.variable());
        if (index == null) {
            throw new IllegalStateException("Unassigned variable " + literal.variable());
        }
        return index;
    }

    Literal literalAt(int index) {
        return nodes.get(index).literal();
    }

    int levelAt(int index) {
        return nodes.get(index).level();
    }

    int[] predecessorsOf(int index) {
        return nodes.get(index).predecessors();
    }

    boolean isDecision(int index) {
        return nodes.get(index).antecedent() == NO_ANTECEDENT;
    }

    Integer antecedentOf(int index) {
        int antecedent = nodes.get(index).antecedent();
        return antecedent == NO_ANTECEDENT ? null : antecedent;
    }

    int levelOf(Literal literal) {
        return levelAt(nodeOf(literal));
    }

    /**
     * Drops every node above {@code level}.
     *
     * @return number of nodes removed
     */
    int truncateTo(int level) {
        if (level >= decisionLevel()) {
            return 0;
        }
        int from = levelStarts.get(level);
        int removed = nodes.size() - from;
        for (int i = nodes.size() - 1; i >= from; i--) {
            nodeByVariable.remove(nodes.remove(i).literal().variable());
        }
        levelStarts.subList(level, levelStarts.size()).clear();
        return removed;
    }

    /**
     * Positive literals currently true, in trail order.
     */
    List<Integer> positiveNodes() {
        List<Integer> positive = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).literal().isPositive()) {
                positive.add(i);
            }
        }
        return positive;
    }
}
