package com.challenges.trimbuild.make;

import org.eclipse.collections.api.list.MutableList;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Top-level sequence of a parsed makefile.
 */
public final class Makefile {
    private final MakeNode.BlockList root;

    public Makefile(MutableList<MakeNode> nodes) {
        this.root = new MakeNode.BlockList(Objects.requireNonNull(nodes, "nodes"));
    }

    public MutableList<MakeNode> nodes() {
        return root.nodes();
    }

    public int size() {
        return root.size();
    }

    public MakeNode get(int index) {
        return root.get(index);
    }

    public String serialize() {
        return root.serialize();
    }

    /**
     * Removes, in place and at any depth, every node rejected by {@code predicate}.
     */
    public Makefile filter(Predicate<? super MakeNode> predicate) {
        root.filter(predicate);
        return this;
    }

    /**
     * Pre-order traversal of every node in the tree, visiting at most {@code maxDepth}
     * levels: 1 yields only the top-level nodes, 0 yields nothing, and a negative value
     * means no limit.
     */
    public Stream<MakeNode> recurse(int maxDepth) {
        return recurse(root.children(), maxDepth, 0);
    }

    public Stream<MakeNode> recurse() {
        return recurse(-1);
    }

    private static Stream<MakeNode> recurse(Stream<MakeNode> nodes, int maxDepth, int depth) {
        if (depth == maxDepth) {
            return Stream.empty();
        }
        return nodes.flatMap(node -> Stream.concat(Stream.of(node), recurse(node.children(), maxDepth, depth + 1)));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Makefile other && root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "Makefile(" + serialize() + ")";
    }
}
