package io.github.cogscore.complexity;

import static org.junit.jupiter.api.Assertions.*;

import io.github.cogscore.analyzer.TypescriptSyntaxTreeProvider;
import io.github.cogscore.syntax.SyntaxNode;
import io.github.cogscore.syntax.SyntaxTreeException;
import org.junit.jupiter.api.Test;

public class CognitiveComplexityTest {

    private final TypescriptSyntaxTreeProvider provider = new TypescriptSyntaxTreeProvider();

    private SyntaxNode parse(String source) throws SyntaxTreeException {
        return provider.parse(source, "test.ts");
    }

    private int score(String source) throws SyntaxTreeException, UnexpectedNodeException {
        return CognitiveComplexity.calcFileCost(parse(source)).score();
    }

    @Test
    void testEmptyFileScoresZero() throws Exception {
        var result = CognitiveComplexity.calcFileCost(parse(""));
        assertEquals(0, result.score());
    }

    @Test
    void testStraightLineCodeScoresZero() throws Exception {
        assertEquals(0, score("""
                const a = 1;
                let b = a + 2;
                console.log(a, b);
                """));
    }

    @Test
    void testTopLevelIfElse() throws Exception {
        var result = CognitiveComplexity.calcFileCost(parse("if (a) { b; } else { c; }"));
        assertEquals(1, result.score());
        assertEquals(1, result.inner().size());
        assertEquals("if (a) { b; } else { c; }", result.inner().get(0).name());
        assertEquals(1, result.inner().get(0).score());
    }

    @Test
    void testIfInsideWhileGetsNestingIncrement() throws Exception {
        assertEquals(3, score("""
                while (c) {
                    if (a) {
                        b();
                    }
                }
                """));
    }

    @Test
    void testTernaryInElseBranchDoesNotNest() throws Exception {
        assertEquals(2, score("x = a ? b : (c ? d : e);"));
    }

    @Test
    void testTernaryInThenBranchNests() throws Exception {
        assertEquals(3, score("x = a ? (b ? c : d) : e;"));
    }

    @Test
    void testTernaryConditionIsScored() throws Exception {
        // condition stays at depth 0
        assertEquals(2, score("x = (a ? b : c) ? d : e;"));
    }

    @Test
    void testTopLevelArrowBodyKeepsDepth() throws Exception {
        assertEquals(1, score("() => { if (x) { y(); } };"));
        assertEquals(1, score("const f = () => { if (x) { y(); } };"));
    }

    @Test
    void testCallbackArrowInsideFunctionIsNested() throws Exception {
        assertEquals(2, score("""
                function outer() {
                    run(() => {
                        if (x) {
                            y();
                        }
                    });
                }
                """));
    }

    @Test
    void testArrowVariants() throws Exception {
        assertEquals(1, score("const f = x => x ? 1 : 2;"));
        assertEquals(2, score("function g(xs) { return xs.map(x => x ? 1 : 2); }"));
        assertEquals(1, score("""
                const f = async (a: number): Promise<number> => {
                    if (a) {
                        return 1;
                    }
                    return 0;
                };
                """));
    }

    @Test
    void testUnlabeledJumpsAreFree() throws Exception {
        assertEquals(1, score("for (;;) { break; }"));
        assertEquals(1, score("while (x) { continue; }"));
    }

    @Test
    void testLabeledJumpsCostOneAtAnyDepth() throws Exception {
        assertEquals(7, score("""
                outer: for (const a of xs) {
                    for (const b of ys) {
                        if (b) {
                            continue outer;
                        }
                        break;
                    }
                }
                """));
    }

    @Test
    void testForHeadIsScoredAtCurrentDepth() throws Exception {
        // the ternary in the condition is at depth 0, the if in the body at depth 1
        assertEquals(4, score("""
                for (let i = 0; i !== (big ? 10 : 5); i++) {
                    if (i) {
                        log(i);
                    }
                }
                """));
    }

    @Test
    void testForInAndForOf() throws Exception {
        assertEquals(3, score("for (const k in obj) { if (k) { use(k); } }"));
        assertEquals(3, score("for (const v of list) { if (v) { use(v); } }"));
    }

    @Test
    void testForAwait() throws Exception {
        assertEquals(3, score("""
                async function f(xs) {
                    for await (const x of xs) {
                        if (x) {
                            return;
                        }
                    }
                }
                """));
    }

    @Test
    void testDoWhile() throws Exception {
        assertEquals(2, score("do { if (a) { b(); } } while (c);"));
        assertEquals(1, score("do { x(); } while (a ? b : c);"));
    }

    @Test
    void testSwitchNestsItsCaseBlock() throws Exception {
        assertEquals(3, score("""
                switch (x) {
                    case 1:
                        if (a) {
                            b();
                        }
                        break;
                    default:
                        c();
                }
                """));
    }

    @Test
    void testCatchClauseHasNoNestingIncrement() throws Exception {
        assertEquals(3, score("try { a(); } catch (e) { if (e) { b(); } }"));
        assertEquals(2, score("while (x) { try { a(); } catch (e) { b(); } }"));
        assertEquals(0, score("try { a(); } finally { b(); }"));
    }

    @Test
    void testElseIfChainNests() throws Exception {
        assertEquals(3, score("""
                if (a) {
                    x();
                } else if (b) {
                    y();
                } else {
                    z();
                }
                """));
    }

    @Test
    void testTopLevelFunctionDeclaration() throws Exception {
        assertEquals(1, score("function f() { if (a) { b(); } }"));
    }

    @Test
    void testNestedFunctionDeclaration() throws Exception {
        assertEquals(2, score("""
                function outer() {
                    function inner() {
                        if (a) {
                            b();
                        }
                    }
                }
                """));
    }

    @Test
    void testFunctionInsideTopLevelIfIsTopLevel() throws Exception {
        // outer if: 1, inner if at depth 1 (the function body keeps the branch depth): 2
        assertEquals(3, score("""
                if (ok) {
                    function g() {
                        if (a) {
                            b();
                        }
                    }
                }
                """));
    }

    @Test
    void testFunctionExpressionBodyAlwaysNests() throws Exception {
        assertEquals(2, score("const f = function () { if (a) { b(); } };"));
    }

    @Test
    void testMethods() throws Exception {
        assertEquals(1, score("class A { m() { if (a) { b(); } } }"));
        assertEquals(2, score("""
                function make() {
                    return class {
                        m() {
                            if (a) {
                                b();
                            }
                        }
                    };
                }
                """));
    }

    @Test
    void testScoringIsIdempotent() throws Exception {
        var tree = parse("""
                function f(xs) {
                    for (const x of xs) {
                        if (x > 0 ? big : small) {
                            try { g(x); } catch (e) { break; }
                        }
                    }
                }
                """);
        var first = CognitiveComplexity.calcFileCost(tree);
        var second = CognitiveComplexity.calcFileCost(tree);
        assertEquals(first, second);
    }

    @Test
    void testScoresRollUpFromChildren() throws Exception {
        var result = CognitiveComplexity.calcFileCost(parse("""
                class Parser {
                    parse(tokens) {
                        while (tokens.length) {
                            const t = tokens.shift();
                            switch (t.kind) {
                                case "a":
                                    if (t.value ? t.value.ok : false) {
                                        continue;
                                    }
                                    break;
                            }
                        }
                    }
                }
                """));
        assertEquals(result.inner().stream().mapToInt(CostResult::score).sum(), result.score());
        for (var child : result.inner()) {
            assertRollsUp(child);
        }
        // while 1, switch 1+1, if 1+2, ternary 1+2
        assertEquals(9, result.score());
    }

    private static void assertRollsUp(CostResult result) {
        int childScores = result.inner().stream().mapToInt(CostResult::score).sum();
        assertTrue(
                result.score() >= childScores,
                "Score of `" + result.name() + "` should include its children's scores");
        for (var child : result.inner()) {
            assertRollsUp(child);
        }
    }

    @Test
    void testResultPositions() throws Exception {
        var result = CognitiveComplexity.calcFileCost(parse("a();\n  if (b) { c(); }\n"));
        var ifResult = result.inner().get(1);
        assertEquals(1, ifResult.line());
        assertEquals(2, ifResult.column());
    }

    @Test
    void testNonFileRootRejected() throws Exception {
        var ifNode = parse("if (a) {}").children().get(0);
        assertThrows(IllegalArgumentException.class, () -> CognitiveComplexity.calcFileCost(ifNode));
    }

    @Test
    void testCalcNodeCostAtDepth() throws Exception {
        var ifNode = parse("if (a) {}").children().get(0);
        assertEquals(1, CognitiveComplexity.calcNodeCost(ifNode, 0).score());
        assertEquals(4, CognitiveComplexity.calcNodeCost(ifNode, 3).score());
    }
}
