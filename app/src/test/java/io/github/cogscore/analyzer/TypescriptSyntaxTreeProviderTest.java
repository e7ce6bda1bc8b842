package io.github.cogscore.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import io.github.cogscore.syntax.NodeKind;
import io.github.cogscore.syntax.SyntaxNode;
import io.github.cogscore.syntax.SyntaxTreeException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public class TypescriptSyntaxTreeProviderTest {

    private final TypescriptSyntaxTreeProvider provider = new TypescriptSyntaxTreeProvider();

    private static SyntaxNode findFirst(SyntaxNode node, NodeKind kind) {
        if (node.kind() == kind) {
            return node;
        }
        for (var child : node.children()) {
            var found = findFirst(child, kind);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static List<SyntaxNode> findAll(SyntaxNode node, NodeKind kind) {
        var found = new ArrayList<SyntaxNode>();
        collect(node, kind, found);
        return found;
    }

    private static void collect(SyntaxNode node, NodeKind kind, List<SyntaxNode> found) {
        if (node.kind() == kind) {
            found.add(node);
        }
        for (var child : node.children()) {
            collect(child, kind, found);
        }
    }

    private static String childKinds(SyntaxNode node) {
        return node.children().stream()
                .map(c -> c.kind() == NodeKind.TOKEN ? c.text() : c.kind().name())
                .collect(Collectors.joining(" "));
    }

    @Test
    void testRootIsSourceFile() throws Exception {
        var root = provider.parse("let x = 1;", "a.ts");
        assertEquals(NodeKind.SOURCE_FILE, root.kind());
        assertTrue(root.isRoot());
        assertEquals("let x = 1;", root.text());
    }

    @Test
    void testIfConditionAndElseAreInlined() throws Exception {
        var ifNode = findFirst(provider.parse("if (a) { b(); } else { c(); }", "a.ts"), NodeKind.IF);
        assertNotNull(ifNode);
        assertEquals("if ( IDENTIFIER ) BLOCK else BLOCK", childKinds(ifNode));
    }

    @Test
    void testElseIfNestsTheSecondIf() throws Exception {
        var root = provider.parse("if (a) {} else if (b) {}", "a.ts");
        var ifs = findAll(root, NodeKind.IF);
        assertEquals(2, ifs.size());
        assertEquals("if ( IDENTIFIER ) BLOCK else IF", childKinds(ifs.get(0)));
        assertSame(ifs.get(0), ifs.get(1).parent());
    }

    @Test
    void testLoopAndSwitchConditionsAreInlined() throws Exception {
        var root = provider.parse("""
                while (a) {}
                do {} while (b);
                switch (c) { case 1: break; }
                """, "a.ts");
        assertEquals("while ( IDENTIFIER ) BLOCK", childKinds(findFirst(root, NodeKind.WHILE)));
        assertEquals("do BLOCK while ( IDENTIFIER ) ;", childKinds(findFirst(root, NodeKind.DO)));
        var switchNode = findFirst(root, NodeKind.SWITCH);
        assertNotNull(switchNode);
        assertEquals("switch", switchNode.children().get(0).text());
        assertEquals("(", switchNode.children().get(1).text());
        assertEquals("c", switchNode.children().get(2).text());
        assertEquals(")", switchNode.children().get(3).text());
        assertEquals(5, switchNode.children().size());
    }

    @Test
    void testCommentsAreDropped() throws Exception {
        var ifNode = findFirst(provider.parse("if (a) /* why */ { b(); } // done", "a.ts"), NodeKind.IF);
        assertNotNull(ifNode);
        assertEquals("if ( IDENTIFIER ) BLOCK", childKinds(ifNode));
    }

    @Test
    void testForInAndForOfAreDistinguished() throws Exception {
        var root = provider.parse("""
                for (const k in o) {}
                for (const v of xs) {}
                for (let i = 0; i < 3; i++) {}
                """, "a.ts");
        assertEquals(1, findAll(root, NodeKind.FOR_IN).size());
        assertEquals(1, findAll(root, NodeKind.FOR_OF).size());
        assertEquals(1, findAll(root, NodeKind.FOR).size());
    }

    @Test
    void testLabeledJumpCarriesItsLabel() throws Exception {
        var root = provider.parse("outer: for (;;) { break outer; }", "a.ts");
        var jump = findFirst(root, NodeKind.BREAK);
        assertNotNull(jump);
        assertTrue(jump.children().stream().anyMatch(c -> c.kind() == NodeKind.IDENTIFIER && c.text().equals("outer")));

        var plain = findFirst(provider.parse("for (;;) { continue; }", "a.ts"), NodeKind.CONTINUE);
        assertNotNull(plain);
        assertTrue(plain.children().stream().noneMatch(c -> c.kind() == NodeKind.IDENTIFIER));
    }

    @Test
    void testFunctionKinds() throws Exception {
        var root = provider.parse("""
                function f() {}
                function* g() {}
                const h = function () {};
                const k = () => 1;
                class C { m() {} }
                """, "a.ts");
        assertEquals(2, findAll(root, NodeKind.FUNCTION_DECLARATION).size());
        assertEquals(1, findAll(root, NodeKind.FUNCTION_EXPRESSION).size());
        assertEquals(1, findAll(root, NodeKind.ARROW_FUNCTION).size());
        assertEquals(1, findAll(root, NodeKind.METHOD_DECLARATION).size());
    }

    @Test
    void testTernaryAndCatchKinds() throws Exception {
        var root = provider.parse("try { x = a ? b : c; } catch (e) {}", "a.ts");
        var ternary = findFirst(root, NodeKind.CONDITIONAL_EXPRESSION);
        assertNotNull(ternary);
        assertEquals("IDENTIFIER ? IDENTIFIER : IDENTIFIER", childKinds(ternary));
        assertNotNull(findFirst(root, NodeKind.CATCH_CLAUSE));
    }

    @Test
    void testPositionsAreZeroBasedCharacterColumns() throws Exception {
        var root = provider.parse("x();\nconst t = \"é\"; if (s) {}\n", "a.ts");
        var ifNode = findFirst(root, NodeKind.IF);
        assertNotNull(ifNode);
        assertEquals(1, ifNode.position().line());
        assertEquals(15, ifNode.position().column());
        assertEquals("if (s) {}", ifNode.text());
    }

    @Test
    void testByteOrderMarkIsIgnored() throws Exception {
        var root = provider.parse("\uFEFFif (a) {}", "a.ts");
        var ifNode = findFirst(root, NodeKind.IF);
        assertNotNull(ifNode);
        assertEquals(0, ifNode.position().column());
        assertEquals("if (a) {}", ifNode.text());
    }

    @Test
    void testParentLinks() throws Exception {
        var root = provider.parse("while (a) { if (b) {} }", "a.ts");
        var ifNode = findFirst(root, NodeKind.IF);
        assertNotNull(ifNode);
        var block = ifNode.parent();
        assertNotNull(block);
        assertEquals(NodeKind.BLOCK, block.kind());
        assertSame(findFirst(root, NodeKind.WHILE), block.parent());
    }

    @Test
    void testTreeDeeperThanLimitIsRejected() {
        var shallowProvider = new TypescriptSyntaxTreeProvider(10);
        var source = "x = " + "(".repeat(20) + "1" + ")".repeat(20) + ";";
        var e = assertThrows(SyntaxTreeException.class, () -> shallowProvider.parse(source, "deep.ts"));
        assertEquals("deep.ts", e.getSourceName());
        assertTrue(e.getMessage().contains("deeper than 10"), e.getMessage());
    }

    @Test
    void testInvalidMaxTreeDepth() {
        assertThrows(IllegalArgumentException.class, () -> new TypescriptSyntaxTreeProvider(0));
    }

    @Test
    void testSyntaxErrorsStillProduceATree() throws Exception {
        var root = provider.parse("if (a { ", "broken.ts");
        assertEquals(NodeKind.SOURCE_FILE, root.kind());
    }

    @Test
    void testSupportedExtensions() {
        assertTrue(provider.supportedExtensions().containsAll(List.of("ts", "js", "mjs", "cjs", "mts", "cts")));
        assertFalse(provider.supportedExtensions().contains("tsx"));
    }
}
