package net.normalform.cnf;

import static net.normalform.util.grammar.TestGrammars.bodies;
import static net.normalform.util.grammar.TestGrammars.body;
import static net.normalform.util.grammar.TestGrammars.example;
import static net.normalform.util.grammar.TestGrammars.grammar;
import static net.normalform.util.grammar.TestGrammars.set;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.Set;
import net.normalform.api.grammar.Grammar;
import net.normalform.util.grammar.GrammarImpl;
import net.normalform.util.grammar.Grammars;
import org.junit.jupiter.api.Test;

public class UnitEliminatorTest {

    private final UnitEliminator eliminator = new UnitEliminator();

    private static Grammar.NonterminalSymbol nt(GrammarImpl g, String name) {
        return g.createNonterminal(name);
    }

    @Test
    public void testUnitPairsFollowChainsOnly() {
        GrammarImpl g = grammar("S A B C", "s b c", "S",
            "S -> A | s",
            "A -> B",
            "B -> b | A",
            "C -> c | s C");
        Map<Grammar.NonterminalSymbol, Set<Grammar.NonterminalSymbol>> pairs =
            eliminator.findUnitPairs(g);
        assertEquals(set(nt(g, "S"), nt(g, "A"), nt(g, "B")),
                     pairs.get(nt(g, "S")));
        assertEquals(set(nt(g, "A"), nt(g, "B")), pairs.get(nt(g, "A")));
        assertEquals(set(nt(g, "A"), nt(g, "B")), pairs.get(nt(g, "B")));
        assertEquals(set(nt(g, "C")), pairs.get(nt(g, "C")));
    }

    @Test
    public void testClosureIsReflexiveAndTransitive() {
        GrammarImpl g = grammar("S A B C D", "d", "S",
            "S -> A | B",
            "A -> C",
            "B -> D | S",
            "C -> d",
            "D -> d D");
        Map<Grammar.NonterminalSymbol, Set<Grammar.NonterminalSymbol>> pairs =
            eliminator.findUnitPairs(g);
        assertEquals(g.getNonterminals(), pairs.keySet());
        for (Grammar.NonterminalSymbol a : pairs.keySet()) {
            assertTrue(pairs.get(a).contains(a));
            for (Grammar.NonterminalSymbol b : pairs.get(a)) {
                assertTrue(pairs.get(a).containsAll(pairs.get(b)),
                           a + " should reach everything " + b + " reaches");
            }
        }
        assertFalse(pairs.get(nt(g, "D")).contains(nt(g, "S")));
        assertTrue(pairs.get(nt(g, "B")).contains(nt(g, "C")));
    }

    @Test
    public void testRewrite() {
        GrammarImpl g = grammar("S A B C", "s b c", "S",
            "S -> A | s",
            "A -> B",
            "B -> b | A",
            "C -> c");
        Grammar out = eliminator.apply(g);
        assertEquals(set(body("s"), body("b")), bodies(out, "S"));
        assertEquals(set(body("b")), bodies(out, "A"));
        assertEquals(set(body("b")), bodies(out, "B"));
        assertEquals(set(body("c")), bodies(out, "C"));
        for (String name : out.getProductionNames())
            for (Grammar.Production p : out.getProductions(name))
                assertFalse(Grammars.isUnitProduction(p));
    }

    @Test
    public void testEveryNonterminalGetsAnEntry() {
        GrammarImpl g = grammar("S T", "s", "S", "S -> T | s");
        Grammar out = eliminator.apply(g);
        assertTrue(out.getProductionNames().contains("T"));
        assertTrue(out.getProductions("T").isEmpty());
        assertEquals(set(body("s")), bodies(out, "S"));
    }

    @Test
    public void testExampleAfterEpsilonElimination() {
        Grammar eps = new EpsilonEliminator().apply(example());
        Grammar out = eliminator.apply(eps);
        assertEquals(set(body("b", "S"), body("a", "A", "a"), body("a"),
                            body("a", "S"), body("b", "A", "a", "A", "b")),
                     bodies(out, "B"));
        assertEquals(set(body("b", "A"), body("B", "C"), body("b", "S"),
                            body("a", "A", "a"), body("a"), body("a", "S"),
                            body("b", "A", "a", "A", "b")),
                     bodies(out, "S"));
    }

}
