package com.viffx.Parsers.Runtime;

import com.viffx.Parsers.Grammar.Symbols;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * A parse tree node labelled with a grammar symbol. Children are owned by their parent and kept
 * in left-to-right order; an empty derivation is a single {@code ε} leaf.
 */
public final class ParseTreeNode {
    private final String label;
    private final List<ParseTreeNode> children;

    public ParseTreeNode(@NotNull String label, @NotNull List<ParseTreeNode> children) {
        this.label = Objects.requireNonNull(label, "label cannot be null");
        this.children = List.copyOf(children);
    }

    public static ParseTreeNode leaf(@NotNull String label) {
        return new ParseTreeNode(label, List.of());
    }

    public static ParseTreeNode epsilon() {
        return leaf(Symbols.EPSILON);
    }

    public String label() {
        return label;
    }

    public List<ParseTreeNode> children() {
        return children;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * @return the labels of the leaves from left to right, skipping {@code ε} leaves
     */
    public List<String> leaves() {
        List<String> leaves = new ArrayList<>();
        Deque<ParseTreeNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            ParseTreeNode node = stack.pop();
            if (node.isLeaf()) {
                if (!Symbols.EPSILON.equals(node.label)) leaves.add(node.label);
                continue;
            }
            for (int i = node.children.size() - 1; i >= 0; i--) stack.push(node.children.get(i));
        }
        return leaves;
    }

    public int height() {
        int height = 0;
        for (ParseTreeNode child : children) height = Math.max(height, child.height());
        return height + 1;
    }

    /**
     * Renders the tree one node per line, each line indented by a tab per level of depth.
     */
    public String render() {
        StringBuilder text = new StringBuilder();
        Stack<Integer> depthStack = new Stack<>();
        Stack<ParseTreeNode> nodeStack = new Stack<>();
        depthStack.push(0);
        nodeStack.push(this);
        while (!nodeStack.isEmpty()) {
            int depth = depthStack.pop();
            ParseTreeNode node = nodeStack.pop();
            text.append("\t".repeat(depth)).append(node.label).append('\n');
            for (int i = node.children.size() - 1; i >= 0; i--) {
                depthStack.push(depth + 1);
                nodeStack.push(node.children.get(i));
            }
        }
        return text.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParseTreeNode that = (ParseTreeNode) o;
        return label.equals(that.label) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, children);
    }

    @Override
    public String toString() {
        if (children.isEmpty()) return label;
        StringJoiner joiner = new StringJoiner(" ", label + "(", ")");
        for (ParseTreeNode child : children) joiner.add(child.toString());
        return joiner.toString();
    }
}
