package com.challenges.trimbuild.output;

import com.challenges.trimbuild.blueprint.Blueprint;
import com.challenges.trimbuild.blueprint.BlueprintNode;
import com.challenges.trimbuild.blueprint.BlueprintNode.Expression;
import com.challenges.trimbuild.make.MakeNode;
import com.challenges.trimbuild.make.Makefile;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Renders parsed trees as JSON, to show how a file was split up and which parts would be
 * classified as test or benchmark code.
 */
public class TreeJsonWriter {
    private final JsonFactory factory = new JsonFactory();
    private final boolean prettyPrint;

    public TreeJsonWriter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String write(Makefile makefile) {
        return render(generator -> {
            generator.writeStartObject();
            generator.writeStringField("type", "Makefile");
            generator.writeArrayFieldStart("nodes");
            for (MakeNode node : makefile.nodes()) {
                writeNode(node, generator);
            }
            generator.writeEndArray();
            generator.writeEndObject();
        });
    }

    public String write(Blueprint blueprint) {
        return render(generator -> {
            generator.writeStartObject();
            generator.writeStringField("type", "Blueprint");
            generator.writeArrayFieldStart("rules");
            for (BlueprintNode.Rule rule : blueprint.rules()) {
                writeRule(rule, generator);
            }
            generator.writeEndArray();
            generator.writeEndObject();
        });
    }

    @FunctionalInterface
    private interface JsonBody {
        void write(JsonGenerator generator) throws IOException;
    }

    private String render(JsonBody body) {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(out)) {
            if (prettyPrint) {
                generator.useDefaultPrettyPrinter();
            }
            body.write(generator);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render tree as JSON", e);
        }
        return out.toString();
    }

    private void writeNode(MakeNode node, JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        if (node instanceof MakeNode.Block block) {
            generator.writeStringField("type", "Block");
            generator.writeStringField("text", block.text());
        } else if (node instanceof MakeNode.BlockList list) {
            generator.writeStringField("type", "BlockList");
            writeChildren(list, generator);
        } else if (node instanceof MakeNode.CommentBlock comment) {
            generator.writeStringField("type", "CommentBlock");
            generator.writeStringField("title", comment.title());
            generator.writeStringField("comment", comment.comment());
            generator.writeStringField("classification", comment.classification().name());
            writeChildren(comment.child(), generator);
        } else if (node instanceof MakeNode.DirectiveBlock directive) {
            generator.writeStringField("type", "DirectiveBlock");
            generator.writeStringField("start", directive.start());
            if (directive.end() != null) {
                generator.writeStringField("end", directive.end());
            } else {
                generator.writeNullField("end");
            }
            writeChildren(directive.child(), generator);
        }
        generator.writeEndObject();
    }

    private void writeChildren(MakeNode parent, JsonGenerator generator) throws IOException {
        generator.writeArrayFieldStart("children");
        if (parent instanceof MakeNode.BlockList list) {
            for (MakeNode child : list.nodes()) {
                writeNode(child, generator);
            }
        } else {
            writeNode(parent, generator);
        }
        generator.writeEndArray();
    }

    private void writeRule(BlueprintNode.Rule rule, JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        generator.writeStringField("name", rule.name().name());
        if (rule instanceof BlueprintNode.Assignment assignment) {
            generator.writeStringField("type", "Assignment");
            generator.writeFieldName("expr");
            writeExpression(assignment.expr(), generator);
        } else if (rule instanceof BlueprintNode.CompoundAssignment assignment) {
            generator.writeStringField("type", "CompoundAssignment");
            generator.writeStringField("operator", assignment.operator());
            generator.writeFieldName("expr");
            writeExpression(assignment.expr(), generator);
        } else if (rule instanceof BlueprintNode.Scope scope) {
            generator.writeStringField("type", "Scope");
            generator.writeStringField("classification", scope.classification().name());
            generator.writeBooleanField("artCheck", scope.isArtCheck());
            generator.writeFieldName("map");
            writeExpression(scope.map(), generator);
        }
        generator.writeEndObject();
    }

    private void writeExpression(Expression expression, JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        if (expression instanceof BlueprintNode.Ident ident) {
            generator.writeStringField("type", "Ident");
            generator.writeStringField("name", ident.name());
        } else if (expression instanceof BlueprintNode.StringLiteral string) {
            generator.writeStringField("type", "String");
            generator.writeStringField("value", string.value());
        } else if (expression instanceof BlueprintNode.IntegerLiteral integer) {
            generator.writeStringField("type", "Integer");
            generator.writeFieldName("value");
            generator.writeNumber(integer.value());
        } else if (expression instanceof BlueprintNode.BoolLiteral bool) {
            generator.writeStringField("type", "Bool");
            generator.writeBooleanField("value", bool.value());
        } else if (expression instanceof BlueprintNode.BinaryOperator operator) {
            generator.writeStringField("type", "BinaryOperator");
            generator.writeStringField("operator", operator.operator());
            generator.writeFieldName("lhs");
            writeExpression(operator.lhs(), generator);
            generator.writeFieldName("rhs");
            writeExpression(operator.rhs(), generator);
        } else if (expression instanceof BlueprintNode.ListLiteral list) {
            generator.writeStringField("type", "List");
            generator.writeArrayFieldStart("items");
            for (Expression item : list.items()) {
                writeExpression(item, generator);
            }
            generator.writeEndArray();
        } else if (expression instanceof BlueprintNode.MapLiteral map) {
            generator.writeStringField("type", "Map");
            generator.writeArrayFieldStart("entries");
            for (BlueprintNode.MapEntry entry : map.entries()) {
                generator.writeStartObject();
                generator.writeStringField("key", entry.key().name());
                generator.writeStringField("delimiter", entry.value().delimiter());
                generator.writeFieldName("value");
                writeExpression(entry.value().value(), generator);
                generator.writeEndObject();
            }
            generator.writeEndArray();
        }
        generator.writeEndObject();
    }
}
