package com.challenges.trimbuild.make;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a run of makefile text on decorated comment headers such as
 *
 * <pre>
 * # -----------------------------------------------------------------------------
 * # Benchmarks.
 * # -----------------------------------------------------------------------------
 * </pre>
 *
 * A header is a separator line ({@code # =====}, {@code # -----} or {@code ######})
 * around one or more {@code #} title lines, either on both sides, before, or after the
 * title. Separators need at least five or six characters; shorter runs show up in
 * ordinary comments too often.
 */
final class CommentHeaderSplitter {
    private static final String SP = "[ \\t]";
    private static final String NL = "\\r?\\n";
    // any header text, including none: `#####\n#` is a valid header
    private static final String TEXT = "[^\\x00-\\x08\\x0A-\\x1F]*";
    private static final String TITLE_LINE = SP + "*#" + SP + "*" + TEXT;
    private static final String TITLE = "(?:(?:" + TITLE_LINE + NL + ")*" + TITLE_LINE + ")";

    private static final String[] SEPARATORS = {
        "#" + SP + "+={5,}",
        "#" + SP + "+-{5,}",
        "#{6,}",
    };

    private static final Pattern HEADER = createPattern();
    private static final Pattern TITLE_MARKER = Pattern.compile(SP + "*#" + SP + "*");

    private CommentHeaderSplitter() {
    }

    /**
     * Splits {@code text} into a leading {@link MakeNode.Block} (if there is text before
     * the first header) followed by one {@link MakeNode.CommentBlock} per header, each
     * holding the text up to the next header.
     */
    static MutableList<MakeNode> split(String text) {
        MutableList<MakeNode> nodes = Lists.mutable.empty();
        Matcher matcher = HEADER.matcher(text);
        if (!matcher.find()) {
            nodes.add(new MakeNode.Block(text));
            return nodes;
        }

        if (matcher.start() > 0) {
            // the header starts a line, so the character before it is the line break
            nodes.add(new MakeNode.Block(text.substring(0, matcher.start() - 1)));
        }

        String comment = matcher.group(1);
        String title = title(matcher);
        int bodyStart = matcher.end() + 1;
        while (matcher.find()) {
            nodes.add(new MakeNode.CommentBlock(comment, title, body(text, bodyStart, matcher.start() - 1)));
            comment = matcher.group(1);
            title = title(matcher);
            bodyStart = matcher.end() + 1;
        }
        nodes.add(new MakeNode.CommentBlock(comment, title, body(text, bodyStart, text.length())));
        return nodes;
    }

    // an empty list means no body at all, unlike a Block holding one empty line
    private static MakeNode body(String text, int start, int end) {
        if (start > end) {
            return new MakeNode.BlockList();
        }
        return new MakeNode.Block(text.substring(start, end));
    }

    private static String title(Matcher matcher) {
        for (int group = 2; group <= matcher.groupCount(); group++) {
            String lines = matcher.group(group);
            if (lines != null) {
                return Lists.mutable.of(lines.split("\n", -1))
                        .collect(CommentHeaderSplitter::stripMarkers)
                        .makeString("\n");
            }
        }
        return "";
    }

    private static String stripMarkers(String line) {
        String stripped = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
        return TITLE_MARKER.matcher(stripped).replaceAll("");
    }

    // sandwich, prefix and suffix are tried in that order for each separator: the
    // greedy title would otherwise swallow the closing separator of a sandwich
    private static Pattern createPattern() {
        MutableList<String> alternatives = Lists.mutable.empty();
        for (String sep : SEPARATORS) {
            alternatives.add(SP + "*" + sep + NL + "(" + TITLE + ")" + NL + SP + "*" + sep);
            alternatives.add(SP + "*" + sep + NL + "(" + TITLE + ")");
            alternatives.add("(" + TITLE + ")" + NL + SP + "*" + sep);
        }
        String header = "(?:" + alternatives.makeString("|") + ")";
        return Pattern.compile("^(" + header + SP + "*\\r?)$", Pattern.MULTILINE | Pattern.UNIX_LINES);
    }
}
