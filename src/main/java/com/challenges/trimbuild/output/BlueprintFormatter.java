package com.challenges.trimbuild.output;

import com.challenges.trimbuild.blueprint.Blueprint;
import com.challenges.trimbuild.blueprint.BlueprintNode;
import com.challenges.trimbuild.blueprint.BlueprintNode.Expression;

public class BlueprintFormatter {
    public static final int DEFAULT_INDENT = 4;

    private final boolean prettyPrint;
    private final int indent;

    public BlueprintFormatter(boolean prettyPrint) {
        this(prettyPrint, DEFAULT_INDENT);
    }

    public BlueprintFormatter(boolean prettyPrint, int indent) {
        if (indent < 0) {
            throw new IllegalArgumentException("Indent must not be negative: " + indent);
        }
        this.prettyPrint = prettyPrint;
        this.indent = indent;
    }

    public static BlueprintFormatter compact() {
        return new BlueprintFormatter(false);
    }

    public String format(Blueprint blueprint) {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (BlueprintNode.Rule rule : blueprint.rules()) {
            if (!first) {
                sb.append("\n");
            }
            first = false;
            formatRule(rule, 0, sb);
        }
        return sb.toString();
    }

    public String format(BlueprintNode.Rule rule) {
        return format(rule, 0);
    }

    public String format(BlueprintNode.Rule rule, int depth) {
        StringBuilder sb = new StringBuilder();
        formatRule(rule, depth, sb);
        return sb.toString();
    }

    public String format(Expression expression) {
        return format(expression, 0);
    }

    public String format(Expression expression, int depth) {
        StringBuilder sb = new StringBuilder();
        formatExpression(expression, depth, sb);
        return sb.toString();
    }

    private void formatRule(BlueprintNode.Rule rule, int depth, StringBuilder sb) {
        sb.append(rule.name().name());
        if (rule instanceof BlueprintNode.Assignment assignment) {
            sb.append(" = ");
            formatExpression(assignment.expr(), depth, sb);
        } else if (rule instanceof BlueprintNode.CompoundAssignment assignment) {
            sb.append(' ').append(assignment.operator()).append(' ');
            formatExpression(assignment.expr(), depth, sb);
        } else if (rule instanceof BlueprintNode.Scope scope) {
            sb.append(' ');
            formatMap(scope.map(), depth, sb);
        }
    }

    private void formatExpression(Expression expression, int depth, StringBuilder sb) {
        if (expression instanceof BlueprintNode.MapLiteral map) {
            formatMap(map, depth, sb);
        } else if (expression instanceof BlueprintNode.ListLiteral list) {
            formatList(list, depth, sb);
        } else if (expression instanceof BlueprintNode.BinaryOperator operator) {
            formatExpression(operator.lhs(), depth, sb);
            sb.append(' ').append(operator.operator()).append(' ');
            formatExpression(operator.rhs(), depth, sb);
        } else if (expression instanceof BlueprintNode.StringLiteral string) {
            sb.append(string.literal());
        } else if (expression instanceof BlueprintNode.IntegerLiteral integer) {
            sb.append(integer.value());
        } else if (expression instanceof BlueprintNode.BoolLiteral bool) {
            sb.append(bool.value());
        } else if (expression instanceof BlueprintNode.Ident ident) {
            sb.append(ident.name());
        }
    }

    private void formatMap(BlueprintNode.MapLiteral map, int depth, StringBuilder sb) {
        if (map.isEmpty()) {
            sb.append("{}");
            return;
        }

        sb.append('{');
        if (prettyPrint) {
            sb.append('\n');
            for (BlueprintNode.MapEntry entry : map.entries()) {
                indent(depth + 1, sb);
                formatEntry(entry, depth + 1, sb);
                sb.append(",\n");
            }
            indent(depth, sb);
        } else {
            boolean first = true;
            for (BlueprintNode.MapEntry entry : map.entries()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                formatEntry(entry, depth + 1, sb);
            }
        }
        sb.append('}');
    }

    private void formatEntry(BlueprintNode.MapEntry entry, int depth, StringBuilder sb) {
        sb.append(entry.key().name());
        if (BlueprintNode.MapValue.EQUALS.equals(entry.value().delimiter())) {
            sb.append(" = ");
        } else {
            sb.append(": ");
        }
        formatExpression(entry.value().value(), depth, sb);
    }

    private void formatList(BlueprintNode.ListLiteral list, int depth, StringBuilder sb) {
        sb.append('[');
        if (!prettyPrint || list.size() <= 1) {
            boolean first = true;
            for (Expression item : list.items()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                formatListItem(item, depth, sb);
            }
        } else {
            sb.append('\n');
            for (Expression item : list.items()) {
                indent(depth + 1, sb);
                formatListItem(item, depth, sb);
                sb.append(",\n");
            }
            indent(depth, sb);
        }
        sb.append(']');
    }

    private void formatListItem(Expression item, int depth, StringBuilder sb) {
        // maps inside a list stay at the list's depth
        int itemDepth = item instanceof BlueprintNode.MapLiteral ? depth : depth + 1;
        formatExpression(item, itemDepth, sb);
    }

    private void indent(int depth, StringBuilder sb) {
        sb.append(" ".repeat(indent * depth));
    }
}
