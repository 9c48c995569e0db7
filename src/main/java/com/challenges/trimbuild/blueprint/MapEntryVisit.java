package com.challenges.trimbuild.blueprint;

/**
 * One entry reached by {@link BlueprintNode.MapLiteral#recurse(int)}, with the map that
 * holds it so callers can prune in place.
 */
public record MapEntryVisit(BlueprintNode.Ident key, BlueprintNode.MapValue value, int depth, BlueprintNode.MapLiteral parent) {
}
