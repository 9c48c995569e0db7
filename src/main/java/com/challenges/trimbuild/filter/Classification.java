package com.challenges.trimbuild.filter;

public enum Classification {
    TEST,
    BENCHMARK,
    NONE;

    public boolean isDev() {
        return this != NONE;
    }
}
