package com.challenges.trimbuild.blueprint;

import com.challenges.trimbuild.filter.Classification;
import com.challenges.trimbuild.filter.DevClassifier;
import com.challenges.trimbuild.filter.TreeFilters;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Syntax tree of an {@code Android.bp} blueprint file.
 *
 * <p>Nothing is evaluated: variables stay {@link Ident}s and {@code a + b} stays a
 * {@link BinaryOperator}, since the tree is only inspected and pruned.
 */
public sealed interface BlueprintNode {

    sealed interface Rule extends BlueprintNode {
        Ident name();
    }

    record Assignment(Ident name, Expression expr) implements Rule {}

    record CompoundAssignment(Ident name, String operator, Expression expr) implements Rule {}

    record Scope(Ident name, MapLiteral map) implements Rule {
        public boolean isTest() {
            return DevClassifier.isTest(name.name()) || map.isTest();
        }

        public boolean isBenchmark() {
            return DevClassifier.isBenchmark(name.name()) || map.isBenchmark();
        }

        public boolean isArtCheck() {
            return DevClassifier.isArtCheck(name.name()) || map.isArtCheck();
        }

        public boolean isDev() {
            return isArtCheck() || isTest() || isBenchmark();
        }

        public Classification classification() {
            if (isTest()) {
                return Classification.TEST;
            }
            return isBenchmark() ? Classification.BENCHMARK : Classification.NONE;
        }
    }

    sealed interface Expression extends BlueprintNode {}

    record Ident(String name) implements Expression {
        public Ident {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A string as written in the source, quotes and escapes included. Two strings are
     * equal when their text between the quotes is equal.
     */
    record StringLiteral(String literal) implements Expression {
        public StringLiteral {
            if (literal.length() < 2 || literal.charAt(0) != '"' || literal.charAt(literal.length() - 1) != '"') {
                throw new IllegalArgumentException("String literal must be quoted: " + literal);
            }
        }

        public static StringLiteral of(String value) {
            return new StringLiteral("\"" + value + "\"");
        }

        public String value() {
            return literal.substring(1, literal.length() - 1);
        }

        public boolean matches(Predicate<? super String> predicate) {
            return predicate.test(value());
        }

        @Override
        public String toString() {
            return value();
        }
    }

    record IntegerLiteral(BigInteger value) implements Expression {
        public static IntegerLiteral of(long value) {
            return new IntegerLiteral(BigInteger.valueOf(value));
        }
    }

    record BoolLiteral(boolean value) implements Expression {}

    record BinaryOperator(Expression lhs, String operator, Expression rhs) implements Expression {
        public boolean anyString(Predicate<? super String> predicate) {
            return (lhs instanceof StringLiteral left && left.matches(predicate))
                    || (rhs instanceof StringLiteral right && right.matches(predicate));
        }
    }

    record ListLiteral(MutableList<Expression> items) implements Expression {
        public static ListLiteral empty() {
            return new ListLiteral(Lists.mutable.empty());
        }

        public static ListLiteral of(Expression... items) {
            return new ListLiteral(Lists.mutable.of(items));
        }

        public int size() {
            return items.size();
        }

        public Expression get(int index) {
            return items.get(index);
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        public void clear() {
            items.clear();
        }

        public ListLiteral filter(Predicate<? super Expression> predicate) {
            TreeFilters.retain(items, predicate);
            return this;
        }
    }

    /**
     * A map value together with the delimiter it was written with, {@code :} or
     * {@code =}. The delimiter only matters when printing.
     */
    record MapValue(String delimiter, Expression value) implements BlueprintNode {
        public static final String COLON = ":";
        public static final String EQUALS = "=";

        public MapValue {
            if (!COLON.equals(delimiter) && !EQUALS.equals(delimiter)) {
                throw new IllegalArgumentException("Invalid map delimiter: " + delimiter);
            }
            Objects.requireNonNull(value, "value");
        }

        public static MapValue of(Expression value) {
            return new MapValue(COLON, value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof MapValue other && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }
    }

    record MapEntry(Ident key, MapValue value) {}

    record MapLiteral(MutableList<MapEntry> entries) implements Expression {
        private static final String NAME = "name";
        // python C modules with test names are linked into the shipped interpreter
        private static final String PY2_C_MODULE = "py2-c-module";

        public static MapLiteral empty() {
            return new MapLiteral(Lists.mutable.empty());
        }

        public MapLiteral with(String key, Expression value) {
            put(new Ident(key), MapValue.of(value));
            return this;
        }

        public int size() {
            return entries.size();
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }

        public MapValue get(String key) {
            MapEntry entry = entries.detect(e -> e.key().name().equals(key));
            return entry == null ? null : entry.value();
        }

        public boolean containsKey(String key) {
            return get(key) != null;
        }

        public void put(Ident key, MapValue value) {
            int index = entries.detectIndex(e -> e.key().equals(key));
            if (index >= 0) {
                entries.set(index, new MapEntry(key, value));
            } else {
                entries.add(new MapEntry(key, value));
            }
        }

        public boolean remove(String key) {
            return filter((k, v) -> !k.name().equals(key));
        }

        public boolean filter(BiPredicate<? super Ident, ? super MapValue> predicate) {
            return TreeFilters.retain(entries, entry -> predicate.test(entry.key(), entry.value()));
        }

        /**
         * Visits every entry of this map and of the maps nested in it (lists are not
         * entered). Entries of this map are at depth 1; at most {@code maxDepth} levels
         * are visited, all of them if {@code maxDepth} is negative.
         */
        public Stream<MapEntryVisit> recurse(int maxDepth) {
            return recurse(maxDepth, 0);
        }

        public Stream<MapEntryVisit> recurse() {
            return recurse(-1);
        }

        private Stream<MapEntryVisit> recurse(int maxDepth, int depth) {
            if (depth == maxDepth) {
                return Stream.empty();
            }
            return entries.stream().flatMap(entry -> {
                Stream<MapEntryVisit> visit = Stream.of(new MapEntryVisit(entry.key(), entry.value(), depth + 1, this));
                if (entry.value().value() instanceof MapLiteral nested) {
                    return Stream.concat(visit, nested.recurse(maxDepth, depth + 1));
                }
                return visit;
            });
        }

        public String name() {
            MapValue name = get(NAME);
            if (name == null) {
                return null;
            }
            if (name.value() instanceof StringLiteral string) {
                return string.value();
            }
            if (name.value() instanceof Ident ident) {
                return ident.name();
            }
            return null;
        }

        public boolean isTest() {
            String name = name();
            return name != null
                    && DevClassifier.isTest(name)
                    && !name.toLowerCase(Locale.ROOT).contains(PY2_C_MODULE);
        }

        public boolean isBenchmark() {
            return DevClassifier.isBenchmark(name());
        }

        public boolean isArtCheck() {
            return DevClassifier.isArtCheck(name());
        }

        public boolean isDev() {
            return isTest() || isBenchmark();
        }
    }
}
