package com.challenges.trimbuild.make;

import com.challenges.trimbuild.Fixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MakefileParserTest {

    private final MakefileParser parser = new MakefileParser();

    @ParameterizedTest
    @ValueSource(strings = {"Android.mk", "Nested.mk", "Single.mk", "Grouped.mk", "Multiline.mk", "FakeTitle.mk", "Unbalanced.mk"})
    public void testRoundTripFixtures(String name) {
        String contents = Fixtures.read("make/" + name);
        assertEquals(contents, parser.parse(contents).serialize());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "\n",
        "LOCAL_PATH := $(call my-dir)",
        "a\r\n# ------\r\n# Unit tests\r\n# ------\r\nb\r\n",
        "x\n# ------\n# Unit tests\n# ------",
        "ifeq (a,b)\nendif",
        "ifeq (a,b)\n\nendif\n",
        "    ifdef FOO\n  else\n    endif   \n",
        "######\n# one\n#two\n",
    })
    public void testRoundTripEdgeCases(String contents) {
        assertEquals(contents, parser.parse(contents).serialize());
    }

    @Test
    public void testAndroidMk() {
        String contents = Fixtures.read("make/Android.mk");
        Makefile makefile = parser.parse(contents);

        assertEquals(9, makefile.size());
        assertTrue(makefile.get(0) instanceof MakeNode.Block);
        assertFalse(makefile.get(0).isDev());
        assertTrue(makefile.get(1).isBenchmark());
        assertTrue(makefile.get(2).isTest());

        List<String> titles = makefile.nodes()
                .selectInstancesOf(MakeNode.CommentBlock.class)
                .collect(MakeNode.CommentBlock::title);
        assertEquals(List.of(
                "Benchmarks.", "Unit tests.", "test executable", "Unit tests.", "test executable",
                "Other section.", "Unit tests.", "test executable"), titles);
        assertFalse(makefile.get(6).isDev());

        assertEquals(makefile, parser.parse(contents));
    }

    @Test
    public void testFilterAndroidMk() {
        Makefile makefile = parser.parse(Fixtures.read("make/Android.mk"));
        makefile.filter(node -> !node.isDev());

        assertEquals(2, makefile.size());
        assertTrue(makefile.get(0) instanceof MakeNode.Block);
        MakeNode.CommentBlock other = (MakeNode.CommentBlock) makefile.get(1);
        assertEquals("Other section.", other.title());

        String output = makefile.serialize();
        assertTrue(output.startsWith("LOCAL_PATH := $(call my-dir)\n"));
        assertTrue(output.endsWith("# Other section.\n"
                + "# =========================================================\n"
                + "include $(call all-makefiles-under,$(LOCAL_PATH))\n"));
        assertFalse(output.contains("benchmark"));
        assertFalse(output.contains("config-tests"));
    }

    @Test
    public void testNestedDirectives() {
        String contents = Fixtures.read("make/Nested.mk");
        Makefile makefile = parser.parse(contents);
        assertEquals(6, makefile.size());

        assertTrue(makefile.get(0) instanceof MakeNode.Block);
        assertTrue(((MakeNode.Block) makefile.get(0)).text().startsWith("# this is a special makefile"));

        MakeNode.DirectiveBlock outer = (MakeNode.DirectiveBlock) makefile.get(1);
        assertEquals("ifneq ($(ENV1),)", outer.start());
        assertEquals("endif", outer.end());
        MakeNode.BlockList outerBody = (MakeNode.BlockList) outer.child();
        assertEquals(2, outerBody.size());
        assertEquals(new MakeNode.Block(""), outerBody.get(0));

        MakeNode.CommentBlock benchmarks = (MakeNode.CommentBlock) outerBody.get(1);
        assertEquals("Benchmarks.", benchmarks.title());
        MakeNode.BlockList owned = (MakeNode.BlockList) benchmarks.child();
        assertEquals(3, owned.size());
        assertTrue(owned.get(0) instanceof MakeNode.Block);
        assertTrue(owned.get(2) instanceof MakeNode.Block);

        MakeNode.DirectiveBlock inner = (MakeNode.DirectiveBlock) owned.get(1);
        assertEquals("ifneq ($(ENV2),)", inner.start());
        assertTrue(inner.child() instanceof MakeNode.Block);
        assertTrue(((MakeNode.Block) inner.child()).text().startsWith("\tbenchmark_src_files += bench1.cc\nelse"));

        assertEquals(new MakeNode.Block(""), makefile.get(2));
        assertEquals("Other section.", ((MakeNode.CommentBlock) makefile.get(3)).title());
        assertEquals("Unit tests.", ((MakeNode.CommentBlock) makefile.get(4)).title());
        assertEquals("test executable", ((MakeNode.CommentBlock) makefile.get(5)).title());
    }

    @Test
    public void testFilterNested() {
        Makefile makefile = parser.parse(Fixtures.read("make/Nested.mk"));
        makefile.filter(node -> !node.isDev());

        assertEquals(4, makefile.size());
        assertTrue(makefile.get(0) instanceof MakeNode.Block);
        assertTrue(makefile.get(2) instanceof MakeNode.Block);

        MakeNode.DirectiveBlock directive = (MakeNode.DirectiveBlock) makefile.get(1);
        assertEquals(new MakeNode.Block(""), directive.child());
        assertEquals("Other section.", ((MakeNode.CommentBlock) makefile.get(3)).title());

        assertTrue(makefile.serialize().endsWith("ifneq ($(ENV1),)\n\nendif\n\n"
                + "# Other section.\n"
                + "# =========================================================\n"
                + "include $(call all-makefiles-under,$(LOCAL_PATH))\n"));
    }

    @Test
    public void testFilterIsIdempotent() {
        Makefile makefile = parser.parse(Fixtures.read("make/Nested.mk"));
        makefile.filter(node -> !node.isDev());
        String once = makefile.serialize();
        makefile.filter(node -> !node.isDev());
        assertEquals(once, makefile.serialize());
    }

    @Test
    public void testRecurse() {
        Makefile makefile = parser.parse(Fixtures.read("make/Nested.mk"));
        List<MakeNode> nodes = makefile.recurse().collect(Collectors.toList());
        assertEquals(15, nodes.size());

        MakeNode.DirectiveBlock outer = (MakeNode.DirectiveBlock) makefile.get(1);
        MakeNode.BlockList outerBody = (MakeNode.BlockList) outer.child();
        MakeNode.CommentBlock benchmarks = (MakeNode.CommentBlock) outerBody.get(1);
        MakeNode.BlockList owned = (MakeNode.BlockList) benchmarks.child();

        assertSame(makefile.get(0), nodes.get(0));
        assertSame(outer, nodes.get(1));
        assertSame(outerBody.get(0), nodes.get(2));
        assertSame(benchmarks, nodes.get(3));
        assertSame(owned.get(0), nodes.get(4));
        assertSame(owned.get(1), nodes.get(5));
        assertSame(((MakeNode.DirectiveBlock) owned.get(1)).child(), nodes.get(6));
        assertSame(owned.get(2), nodes.get(7));
        assertSame(makefile.get(2), nodes.get(8));
        assertSame(makefile.get(3), nodes.get(9));
        assertSame(makefile.get(5), nodes.get(13));
    }

    @Test
    public void testRecurseMaxDepth() {
        Makefile makefile = parser.parse(Fixtures.read("make/Nested.mk"));
        assertEquals(0, makefile.recurse(0).count());
        assertEquals(6, makefile.recurse(1).count());
        assertEquals(11, makefile.recurse(2).count());
        assertEquals(15, makefile.recurse(-1).count());
    }

    @Test
    public void testSectionOwnsFollowingDirectives() {
        Makefile makefile = parser.parse(Fixtures.read("make/Grouped.mk"));
        assertEquals(3, makefile.size());
        assertTrue(((MakeNode.Block) makefile.get(0)).text().startsWith("LOCAL_PATH := $(call my-dir)"));

        MakeNode.CommentBlock library = (MakeNode.CommentBlock) makefile.get(1);
        assertEquals("Shared library.", library.title());
        MakeNode.BlockList owned = (MakeNode.BlockList) library.child();
        assertEquals(3, owned.size());
        assertTrue(((MakeNode.Block) owned.get(0)).text().startsWith("\nLOCAL_SRC_FILES := src.c"));
        assertEquals(new MakeNode.Block("include $(BUILD_SHARED_LIBRARY)\n"), owned.get(2));

        MakeNode.DirectiveBlock directive = (MakeNode.DirectiveBlock) owned.get(1);
        MakeNode.CommentBlock benchmarks = (MakeNode.CommentBlock) directive.child();
        assertEquals("Benchmarks.", benchmarks.title());
        MakeNode.BlockList benchmarkBody = (MakeNode.BlockList) benchmarks.child();
        assertEquals(2, benchmarkBody.size());
        assertEquals("ifeq ($(HOST_OS),linux)", ((MakeNode.DirectiveBlock) benchmarkBody.get(0)).start());
        assertTrue(((MakeNode.Block) benchmarkBody.get(1)).text().startsWith("else"));

        assertTrue(makefile.get(2).isTest());
    }

    @Test
    public void testFilterGrouped() {
        Makefile makefile = parser.parse(Fixtures.read("make/Grouped.mk"));
        makefile.filter(node -> !node.isDev());

        assertEquals("LOCAL_PATH := $(call my-dir)\n"
                + "\n"
                + "# -----------------------------------------------------------------------------\n"
                + "# Shared library.\n"
                + "# -----------------------------------------------------------------------------\n"
                + "\n"
                + "LOCAL_SRC_FILES := src.c\n"
                + "LOCAL_MODULE := libsample\n"
                + "include $(BUILD_SHARED_LIBRARY)\n", makefile.serialize());
    }

    @Test
    public void testMultilineTitle() {
        Makefile makefile = parser.parse(Fixtures.read("make/Multiline.mk"));
        assertEquals(3, makefile.size());
        assertTrue(((MakeNode.Block) makefile.get(0)).text().startsWith("# this is a special makefile"));

        MakeNode.DirectiveBlock directive = (MakeNode.DirectiveBlock) makefile.get(1);
        MakeNode.BlockList body = (MakeNode.BlockList) directive.child();
        assertEquals(new MakeNode.Block("LOCAL_PATH := $(call my-dir)"), body.get(0));

        MakeNode.CommentBlock comment = (MakeNode.CommentBlock) body.get(1);
        assertEquals("new rules\n$(1): rule 1\n$(2): rule 2", comment.title());
        assertTrue(comment.child().serialize().startsWith("\ninclude"));
        assertEquals(new MakeNode.Block(""), makefile.get(2));
    }

    @Test
    public void testEmptyTitle() {
        Makefile makefile = parser.parse(Fixtures.read("make/FakeTitle.mk"));
        assertEquals(1, makefile.size());

        MakeNode.CommentBlock comment = (MakeNode.CommentBlock) makefile.get(0);
        assertEquals("", comment.title());
        assertFalse(comment.isDev());
        assertTrue(comment.child().serialize().startsWith("LOCAL_PATH := $(call my-dir)"));
    }

    @Test
    public void testUnbalancedDirective() {
        String contents = Fixtures.read("make/Unbalanced.mk");
        Makefile makefile = parser.parse(contents);
        assertEquals(2, makefile.size());

        MakeNode.DirectiveBlock directive = (MakeNode.DirectiveBlock) makefile.get(1);
        assertEquals("ifdef SAMPLE_TESTS", directive.start());
        assertNull(directive.end());
        assertFalse(directive.isBalanced());
        assertTrue(directive.child().isTest());

        makefile.filter(node -> !node.isDev());
        assertEquals("LOCAL_PATH := $(call my-dir)\n", makefile.serialize());
    }

    @Test
    public void testNoHeaders() {
        String contents = Fixtures.read("make/Single.mk");
        Makefile makefile = parser.parse(contents);
        assertEquals(1, makefile.size());
        assertEquals(new MakeNode.Block(contents), makefile.get(0));

        makefile.filter(node -> !node.isDev());
        assertEquals(contents, makefile.serialize());
    }

    @Test
    public void testEmptyInput() {
        Makefile makefile = parser.parse("");
        assertEquals(1, makefile.size());
        assertEquals(new MakeNode.Block(""), makefile.get(0));
        assertEquals("", makefile.serialize());
    }

    @Test
    public void testCrlfHeader() {
        Makefile makefile = parser.parse("a\r\n# ------\r\n# Unit tests\r\n# ------\r\nb\r\n");
        assertEquals(2, makefile.size());
        assertEquals(new MakeNode.Block("a\r"), makefile.get(0));

        MakeNode.CommentBlock comment = (MakeNode.CommentBlock) makefile.get(1);
        assertEquals("Unit tests", comment.title());
        assertEquals(new MakeNode.Block("b\r\n"), comment.child());
    }

    @Test
    public void testHeaderAtEndOfInput() {
        Makefile makefile = parser.parse("x\n# ------\n# Unit tests\n# ------");
        MakeNode.CommentBlock comment = (MakeNode.CommentBlock) makefile.get(1);
        assertTrue(comment.child().isEmpty());

        makefile.filter(node -> !node.isDev());
        assertEquals("x", makefile.serialize());
    }
}
