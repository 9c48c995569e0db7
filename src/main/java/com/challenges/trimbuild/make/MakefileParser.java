package com.challenges.trimbuild.make;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

/**
 * Structural parser for {@code Android.mk} files. It does not understand the macro
 * language: it only finds conditional directives and decorated comment headers so that
 * whole sections can be cut out without unbalancing an {@code ifeq}/{@code endif} pair.
 *
 * <p>Parsing runs in three passes:
 * <ol>
 *   <li>split the lines into plain blocks and (nested) directive blocks;</li>
 *   <li>split every plain block on comment headers;</li>
 *   <li>let every comment header adopt the siblings that follow it, up to the next
 *       header, so removing a header removes the directives it documents.</li>
 * </ol>
 * For example
 * <pre>
 * # ---------------
 * # Section 1.
 * # ---------------
 * ifneq ($(USE_A),)
 *     SOURCES=b.cc
 * else
 *     SOURCES=c.cc
 * endif
 * </pre>
 * parses to a single comment block "Section 1." owning the directive block.
 */
public class MakefileParser {
    private static final Logger log = LoggerFactory.getLogger(MakefileParser.class);

    // `else` is deliberately absent: a branch cannot be dropped without evaluating the condition
    private static final String[] START_DIRECTIVES = {"ifeq", "ifneq", "ifdef", "ifndef"};
    private static final String END_DIRECTIVE = "endif";

    public Makefile parse(String text) {
        Iterator<String> lines = Lists.mutable.of(text.split(MakeNode.LINE_SEPARATOR, -1)).iterator();
        Section section = splitDirectives(lines, false);
        MutableList<MakeNode> nodes = groupComments(splitComments(section.nodes()));
        log.debug("Parsed makefile into {} top-level nodes", nodes.size());
        return new Makefile(nodes);
    }

    private record Section(MutableList<MakeNode> nodes, String end) {
    }

    private Section splitDirectives(Iterator<String> lines, boolean inScope) {
        MutableList<MakeNode> nodes = Lists.mutable.empty();
        MutableList<String> current = Lists.mutable.empty();
        while (lines.hasNext()) {
            String line = lines.next();
            String trimmed = line.stripLeading();
            if (isStartDirective(trimmed)) {
                addBlock(nodes, current);
                Section body = splitDirectives(lines, true);
                if (body.end() == null) {
                    log.debug("Directive '{}' is not closed before the end of input", line.strip());
                }
                nodes.add(new MakeNode.DirectiveBlock(line, body.end(), MakeNode.wrap(body.nodes())));
            } else if (inScope && trimmed.startsWith(END_DIRECTIVE)) {
                addBlock(nodes, current);
                return new Section(nodes, line);
            } else {
                current.add(line);
            }
        }
        addBlock(nodes, current);
        return new Section(nodes, null);
    }

    private static boolean isStartDirective(String trimmed) {
        for (String directive : START_DIRECTIVES) {
            if (trimmed.startsWith(directive)) {
                return true;
            }
        }
        return false;
    }

    private static void addBlock(MutableList<MakeNode> nodes, MutableList<String> lines) {
        if (lines.notEmpty()) {
            nodes.add(new MakeNode.Block(lines.makeString(MakeNode.LINE_SEPARATOR)));
            lines.clear();
        }
    }

    private MutableList<MakeNode> splitComments(MutableList<MakeNode> nodes) {
        return nodes.flatCollect(this::splitNode);
    }

    private MutableList<MakeNode> splitNode(MakeNode node) {
        if (node instanceof MakeNode.Block block) {
            return CommentHeaderSplitter.split(block.text());
        }
        if (node instanceof MakeNode.BlockList list) {
            return splitComments(list.nodes());
        }
        if (node instanceof MakeNode.DirectiveBlock directive) {
            directive.setChild(MakeNode.wrap(groupComments(splitNode(directive.child()))));
            return Lists.mutable.of(node);
        }
        throw new IllegalStateException("comment headers are already split: " + node);
    }

    /**
     * Moves every sibling following a comment block into that block, up to the next
     * comment block.
     */
    private MutableList<MakeNode> groupComments(MutableList<MakeNode> nodes) {
        MutableList<MakeNode> result = Lists.mutable.empty();
        MakeNode.CommentBlock current = null;
        for (MakeNode node : nodes) {
            if (node instanceof MakeNode.CommentBlock comment) {
                if (current != null) {
                    current.flattenSingle();
                    result.add(current);
                }
                current = comment;
            } else if (current != null) {
                current.append(node);
            } else {
                result.add(node);
            }
        }
        if (current != null) {
            current.flattenSingle();
            result.add(current);
        }
        return result;
    }
}
