package com.challenges.trimbuild.filter;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Name heuristics shared by both build dialects for spotting test and benchmark
 * artifacts.
 *
 * <p>{@code test} must start a token or follow a {@code g} (so {@code libgtest} matches
 * but {@code latest} does not). {@code benchmark} must start a token, so
 * {@code gbenchmarks} is left alone.
 */
public final class DevClassifier {
    private static final Pattern TEST = Pattern.compile("(?:^|[^A-Za-z0-9]|g)test", Pattern.CASE_INSENSITIVE);
    private static final Pattern BENCHMARK = Pattern.compile("(?:^|[^A-Za-z0-9])benchmark", Pattern.CASE_INSENSITIVE);

    // fmtlib ships a `lib-non-test-defaults` that regular targets link against
    private static final String NON_TEST = "non-test";
    private static final String ART_CHECK = "art-check";

    private DevClassifier() {
    }

    public static boolean isTest(String name) {
        if (name == null || lower(name).contains(NON_TEST)) {
            return false;
        }
        return TEST.matcher(name).find();
    }

    public static boolean isBenchmark(String name) {
        return name != null && BENCHMARK.matcher(name).find();
    }

    public static boolean isDev(String name) {
        return isTest(name) || isBenchmark(name);
    }

    public static boolean isArtCheck(String name) {
        return name != null && lower(name).contains(ART_CHECK);
    }

    public static Classification classify(String name) {
        if (isTest(name)) {
            return Classification.TEST;
        }
        if (isBenchmark(name)) {
            return Classification.BENCHMARK;
        }
        return Classification.NONE;
    }

    private static String lower(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
