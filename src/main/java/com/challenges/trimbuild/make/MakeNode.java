package com.challenges.trimbuild.make;

import com.challenges.trimbuild.filter.Classification;
import com.challenges.trimbuild.filter.DevClassifier;
import com.challenges.trimbuild.filter.TreeFilters;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Node of a parsed makefile. Every node keeps the exact text it was parsed from, so
 * serializing an untouched tree gives back the original input.
 */
public sealed interface MakeNode {
    String LINE_SEPARATOR = "\n";

    void serialize(StringBuilder out);

    default String serialize() {
        StringBuilder sb = new StringBuilder();
        serialize(sb);
        return sb.toString();
    }

    /**
     * Applies {@code predicate} to this node and its descendants, removing rejected
     * descendants in place.
     *
     * @return {@code false} if this node should be removed from its parent
     */
    boolean filter(Predicate<? super MakeNode> predicate);

    default Stream<MakeNode> children() {
        return Stream.empty();
    }

    default boolean isEmpty() {
        return false;
    }

    default Classification classification() {
        return Classification.NONE;
    }

    default boolean isTest() {
        return false;
    }

    default boolean isBenchmark() {
        return false;
    }

    default boolean isDev() {
        return classification().isDev();
    }

    static MakeNode wrap(MutableList<MakeNode> nodes) {
        return nodes.size() == 1 ? nodes.get(0) : new BlockList(nodes);
    }

    record Block(String text) implements MakeNode {
        public Block {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public void serialize(StringBuilder out) {
            out.append(text);
        }

        @Override
        public boolean filter(Predicate<? super MakeNode> predicate) {
            return predicate.test(this);
        }
    }

    final class BlockList implements MakeNode {
        private final MutableList<MakeNode> nodes;

        public BlockList() {
            this(Lists.mutable.empty());
        }

        public BlockList(MutableList<MakeNode> nodes) {
            this.nodes = Objects.requireNonNull(nodes, "nodes");
        }

        public static BlockList of(MakeNode... nodes) {
            return new BlockList(Lists.mutable.of(nodes));
        }

        public MutableList<MakeNode> nodes() {
            return nodes;
        }

        public int size() {
            return nodes.size();
        }

        public MakeNode get(int index) {
            return nodes.get(index);
        }

        @Override
        public boolean isEmpty() {
            return nodes.isEmpty();
        }

        @Override
        public void serialize(StringBuilder out) {
            boolean first = true;
            for (MakeNode node : nodes) {
                if (!first) {
                    out.append(LINE_SEPARATOR);
                }
                first = false;
                node.serialize(out);
            }
        }

        /**
         * A list that loses all of its elements is dropped; a list that was empty to
         * begin with (a header or directive without a body) is kept.
         */
        @Override
        public boolean filter(Predicate<? super MakeNode> predicate) {
            if (nodes.isEmpty()) {
                return true;
            }
            TreeFilters.retain(nodes, node -> node.filter(predicate));
            return !nodes.isEmpty();
        }

        @Override
        public Stream<MakeNode> children() {
            return nodes.stream();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BlockList other && nodes.equals(other.nodes);
        }

        @Override
        public int hashCode() {
            return nodes.hashCode();
        }

        @Override
        public String toString() {
            return "BlockList(" + serialize() + ")";
        }
    }

    /**
     * A decorated comment header together with everything it documents, up to the next
     * header in the same scope.
     */
    final class CommentBlock implements MakeNode {
        private final String comment;
        private final String title;
        private MakeNode child;

        public CommentBlock(String comment, String title, MakeNode child) {
            this.comment = Objects.requireNonNull(comment, "comment");
            this.title = title;
            this.child = Objects.requireNonNull(child, "child");
        }

        public String comment() {
            return comment;
        }

        public String title() {
            return title;
        }

        public MakeNode child() {
            return child;
        }

        void append(MakeNode node) {
            if (child instanceof BlockList list) {
                list.nodes().add(node);
            } else {
                child = BlockList.of(child, node);
            }
        }

        void flattenSingle() {
            if (child instanceof BlockList list && list.size() == 1) {
                child = list.get(0);
            }
        }

        @Override
        public Classification classification() {
            return DevClassifier.classify(title);
        }

        @Override
        public boolean isTest() {
            return DevClassifier.isTest(title);
        }

        @Override
        public boolean isBenchmark() {
            return DevClassifier.isBenchmark(title);
        }

        @Override
        public void serialize(StringBuilder out) {
            out.append(comment);
            if (!child.isEmpty()) {
                out.append(LINE_SEPARATOR);
                child.serialize(out);
            }
        }

        @Override
        public boolean filter(Predicate<? super MakeNode> predicate) {
            if (!predicate.test(this) || !child.filter(predicate)) {
                return false;
            }
            flattenSingle();
            return true;
        }

        @Override
        public Stream<MakeNode> children() {
            return child instanceof BlockList ? child.children() : Stream.of(child);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof CommentBlock other
                    && comment.equals(other.comment)
                    && Objects.equals(title, other.title)
                    && child.equals(other.child);
        }

        @Override
        public int hashCode() {
            return Objects.hash(comment, title, child);
        }

        @Override
        public String toString() {
            return "CommentBlock(" + serialize() + ")";
        }
    }

    /**
     * An {@code ifeq}/{@code ifneq}/{@code ifdef}/{@code ifndef} ... {@code endif} region.
     * The condition is never evaluated and {@code else} stays inside the body as text.
     * {@link #end()} is {@code null} when the input ended before the matching
     * {@code endif}.
     */
    final class DirectiveBlock implements MakeNode {
        private final String start;
        private final String end;
        private MakeNode child;

        public DirectiveBlock(String start, String end, MakeNode child) {
            this.start = Objects.requireNonNull(start, "start");
            this.end = end;
            this.child = Objects.requireNonNull(child, "child");
            flattenSingle();
        }

        public String start() {
            return start;
        }

        public String end() {
            return end;
        }

        public boolean isBalanced() {
            return end != null;
        }

        public MakeNode child() {
            return child;
        }

        void setChild(MakeNode child) {
            this.child = Objects.requireNonNull(child, "child");
            flattenSingle();
        }

        void flattenSingle() {
            if (child instanceof BlockList list && list.size() == 1) {
                child = list.get(0);
            }
        }

        @Override
        public void serialize(StringBuilder out) {
            out.append(start);
            if (!child.isEmpty()) {
                out.append(LINE_SEPARATOR);
                child.serialize(out);
            }
            if (end != null) {
                out.append(LINE_SEPARATOR).append(end);
            }
        }

        @Override
        public boolean filter(Predicate<? super MakeNode> predicate) {
            if (!predicate.test(this) || !child.filter(predicate)) {
                return false;
            }
            flattenSingle();
            return true;
        }

        @Override
        public Stream<MakeNode> children() {
            return child instanceof BlockList ? child.children() : Stream.of(child);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof DirectiveBlock other
                    && start.equals(other.start)
                    && Objects.equals(end, other.end)
                    && child.equals(other.child);
        }

        @Override
        public int hashCode() {
            return Objects.hash(start, end, child);
        }

        @Override
        public String toString() {
            return "DirectiveBlock(" + serialize() + ")";
        }
    }
}
