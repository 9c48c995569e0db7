package com.challenges.trimbuild.blueprint;

import com.challenges.trimbuild.filter.TreeFilters;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A parsed blueprint document: its rules in source order.
 */
public final class Blueprint {
    private final MutableList<BlueprintNode.Rule> rules;

    public Blueprint() {
        this(Lists.mutable.empty());
    }

    public Blueprint(MutableList<BlueprintNode.Rule> rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public MutableList<BlueprintNode.Rule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public BlueprintNode.Rule get(int index) {
        return rules.get(index);
    }

    public MutableList<BlueprintNode.Scope> scopes() {
        return rules.selectInstancesOf(BlueprintNode.Scope.class);
    }

    /**
     * Keeps only the rules accepted by {@code predicate}, in place.
     */
    public Blueprint filter(Predicate<? super BlueprintNode.Rule> predicate) {
        TreeFilters.retain(rules, predicate);
        return this;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Blueprint other && rules.equals(other.rules);
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }

    @Override
    public String toString() {
        return "Blueprint" + rules;
    }
}
