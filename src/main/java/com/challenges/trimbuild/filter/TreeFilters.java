package com.challenges.trimbuild.filter;

import org.eclipse.collections.api.list.MutableList;

import java.util.function.Predicate;

public final class TreeFilters {
    private TreeFilters() {
    }

    /**
     * Keeps only the elements accepted by {@code predicate}, mutating {@code list} in place.
     *
     * @return {@code true} if anything was removed
     */
    public static <T> boolean retain(MutableList<T> list, Predicate<? super T> predicate) {
        Predicate<T> rejected = element -> !predicate.test(element);
        return list.removeIf(rejected);
    }
}
