package com.challenges.trimbuild.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.File;

/**
 * Output and removal settings, read from the {@code trimbuild} section of the HOCON
 * configuration.
 *
 * <p>Precedence, highest first: an explicit file passed to {@link #load(File)}, Java
 * system properties, {@code application.conf} on the classpath, and the defaults in
 * {@code reference.conf}.
 *
 * @param pretty             pretty-print blueprint output
 * @param indent             spaces per indent level in blueprint output
 * @param subdirKeywords     substrings that remove an entry from a {@code subdirs} list
 * @param dependencyKeywords substrings that remove an entry from a dependency list
 * @param clearedKeys        list-valued properties that are emptied
 */
public record TrimSettings(
        boolean pretty,
        int indent,
        ImmutableList<String> subdirKeywords,
        ImmutableList<String> dependencyKeywords,
        ImmutableList<String> clearedKeys) {

    private static final String ROOT = "trimbuild";

    public TrimSettings {
        if (indent < 0) {
            throw new IllegalArgumentException("trimbuild.blueprint.indent must not be negative: " + indent);
        }
    }

    public static TrimSettings defaults() {
        return from(ConfigFactory.load());
    }

    /**
     * Loads the settings, layering {@code explicitFile} (if not {@code null}) over the
     * standard configuration.
     *
     * @throws IllegalArgumentException                if {@code explicitFile} does not exist
     * @throws com.typesafe.config.ConfigException     if the configuration is malformed
     */
    public static TrimSettings load(File explicitFile) {
        Config config = ConfigFactory.load();
        if (explicitFile != null) {
            if (!explicitFile.exists()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            config = ConfigFactory.parseFile(explicitFile).withFallback(config).resolve();
        }
        return from(config);
    }

    public static TrimSettings from(Config config) {
        Config root = config.getConfig(ROOT);
        return new TrimSettings(
                root.getBoolean("blueprint.pretty"),
                root.getInt("blueprint.indent"),
                Lists.immutable.ofAll(root.getStringList("removal.subdir-keywords")),
                Lists.immutable.ofAll(root.getStringList("removal.dependency-keywords")),
                Lists.immutable.ofAll(root.getStringList("removal.cleared-keys")));
    }

    public TrimSettings withPretty(boolean pretty) {
        return new TrimSettings(pretty, indent, subdirKeywords, dependencyKeywords, clearedKeys);
    }

    public TrimSettings withIndent(int indent) {
        return new TrimSettings(pretty, indent, subdirKeywords, dependencyKeywords, clearedKeys);
    }
}
