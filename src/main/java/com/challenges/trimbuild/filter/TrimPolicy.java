package com.challenges.trimbuild.filter;

import com.challenges.trimbuild.blueprint.Blueprint;
import com.challenges.trimbuild.blueprint.BlueprintNode;
import com.challenges.trimbuild.blueprint.BlueprintNode.Expression;
import com.challenges.trimbuild.blueprint.MapEntryVisit;
import com.challenges.trimbuild.config.TrimSettings;
import com.challenges.trimbuild.make.Makefile;
import org.eclipse.collections.api.list.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Strips test and benchmark code from build files so the rest of the tree can be built
 * without them.
 *
 * <ul>
 *   <li>Makefiles lose every comment section whose title names tests or benchmarks,
 *       together with everything the section owns.</li>
 *   <li>Blueprints lose every test, benchmark or art-check module, the matching
 *       {@code subdirs} entries, and test-only dependencies of the remaining
 *       modules.</li>
 * </ul>
 */
public class TrimPolicy {
    private static final Logger log = LoggerFactory.getLogger(TrimPolicy.class);

    private static final String SUBDIRS = "subdirs";

    private final ImmutableList<String> subdirKeywords;
    private final ImmutableList<String> dependencyKeywords;
    private final ImmutableList<String> clearedKeys;

    public TrimPolicy(TrimSettings settings) {
        this.subdirKeywords = lower(settings.subdirKeywords());
        this.dependencyKeywords = lower(settings.dependencyKeywords());
        this.clearedKeys = settings.clearedKeys();
    }

    public Makefile apply(Makefile makefile) {
        long before = makefile.recurse().count();
        makefile.filter(node -> !node.isDev());
        log.debug("Removed {} of {} makefile nodes", before - makefile.recurse().count(), before);
        return makefile;
    }

    public Blueprint apply(Blueprint blueprint) {
        int before = blueprint.size();
        blueprint.filter(rule -> !(rule instanceof BlueprintNode.Scope scope && scope.isDev()));
        log.debug("Removed {} test and benchmark modules", before - blueprint.size());

        for (BlueprintNode.Rule rule : blueprint.rules()) {
            Expression value = valueOf(rule);
            if (SUBDIRS.equals(rule.name().name()) && value instanceof BlueprintNode.ListLiteral subdirs) {
                pruneList(subdirs, subdirKeywords);
            }
            if (value instanceof BlueprintNode.MapLiteral map) {
                pruneDependencies(map);
            }
        }
        return blueprint;
    }

    private void pruneDependencies(BlueprintNode.MapLiteral map) {
        for (MapEntryVisit visit : map.recurse().toList()) {
            if (visit.value().value() instanceof BlueprintNode.ListLiteral list) {
                if (clearedKeys.contains(visit.key().name())) {
                    list.clear();
                } else {
                    pruneList(list, dependencyKeywords);
                }
            }
        }
    }

    private static void pruneList(BlueprintNode.ListLiteral list, ImmutableList<String> keywords) {
        list.filter(item -> retain(item, keywords));
    }

    /**
     * Strings are dropped when they mention a keyword; containers are pruned recursively
     * and always kept; anything else is kept as is.
     */
    private static boolean retain(Expression item, ImmutableList<String> keywords) {
        if (item instanceof BlueprintNode.StringLiteral string) {
            return !string.matches(text -> mentions(text, keywords));
        }
        if (item instanceof BlueprintNode.BinaryOperator operator) {
            return !operator.anyString(text -> mentions(text, keywords));
        }
        if (item instanceof BlueprintNode.ListLiteral list) {
            pruneList(list, keywords);
        } else if (item instanceof BlueprintNode.MapLiteral map) {
            map.filter((key, value) -> retain(value.value(), keywords));
        }
        return true;
    }

    private static boolean mentions(String text, ImmutableList<String> keywords) {
        String lower = text.toLowerCase(Locale.ROOT);
        return keywords.anySatisfy(lower::contains);
    }

    private static Expression valueOf(BlueprintNode.Rule rule) {
        if (rule instanceof BlueprintNode.Assignment assignment) {
            return assignment.expr();
        }
        if (rule instanceof BlueprintNode.CompoundAssignment assignment) {
            return assignment.expr();
        }
        return ((BlueprintNode.Scope) rule).map();
    }

    private static ImmutableList<String> lower(ImmutableList<String> keywords) {
        return keywords.collect(keyword -> keyword.toLowerCase(Locale.ROOT));
    }
}
