package net.normalform.cnf;

import static net.normalform.util.grammar.TestGrammars.bodies;
import static net.normalform.util.grammar.TestGrammars.body;
import static net.normalform.util.grammar.TestGrammars.example;
import static net.normalform.util.grammar.TestGrammars.grammar;
import static net.normalform.util.grammar.TestGrammars.set;
import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.normalform.api.grammar.Grammar;
import net.normalform.util.grammar.GrammarImpl;
import net.normalform.util.grammar.TestGrammars;
import org.junit.jupiter.api.Test;

public class EpsilonEliminatorTest {

    private final EpsilonEliminator eliminator = new EpsilonEliminator();

    private static Set<String> names(Set<Grammar.NonterminalSymbol> syms) {
        Set<String> ret = new HashSet<String>();
        for (Grammar.NonterminalSymbol s : syms) ret.add(s.getName());
        return ret;
    }

    @Test
    public void testExample() {
        GrammarImpl g = example();
        assertEquals(set("C"), names(eliminator.findNullable(g)));

        Grammar out = eliminator.apply(g);
        assertEquals(set(body("b", "A"), body("B", "C"), body("B")),
                     bodies(out, "S"));
        assertEquals(set(body("A", "B")), bodies(out, "C"));
        assertEquals(bodies(g, "A"), bodies(out, "A"));
        assertEquals(bodies(g, "B"), bodies(out, "B"));
        // The input is left alone.
        assertTrue(bodies(g, "C").contains(body()));
        assertEquals(g, example());
    }

    @Test
    public void testTransitiveNullability() {
        GrammarImpl g = grammar("S A B", "b", "S",
            "S -> A B",
            "A -> B B",
            "B -> ε | b");
        assertEquals(set("S", "A", "B"), names(eliminator.findNullable(g)));
        Grammar out = eliminator.apply(g);
        assertEquals(set(body("A", "B"), body("A"), body("B")),
                     bodies(out, "S"));
        assertEquals(set(body("B", "B"), body("B")), bodies(out, "A"));
        assertEquals(set(body("b")), bodies(out, "B"));
    }

    @Test
    public void testTerminalsAreNeverNullable() {
        GrammarImpl g = grammar("S A", "a", "S", "S -> A a", "A -> ε");
        assertEquals(set("A"), names(eliminator.findNullable(g)));
    }

    @Test
    public void testOccurrencesAreIndependent() {
        GrammarImpl g = grammar("S A", "x y", "S",
            "S -> A x A",
            "A -> ε | y");
        Grammar out = eliminator.apply(g);
        assertEquals(set(body("A", "x", "A"), body("x", "A"),
                            body("A", "x"), body("x")),
                     bodies(out, "S"));
    }

    @Test
    public void testSubsetExpansion() {
        GrammarImpl g = grammar("S N1 N2 N3 N4 N5 N6", "n", "S",
            "S -> N1 N2 N3 N4 N5 N6",
            "N1 -> ε | n", "N2 -> ε | n", "N3 -> ε | n",
            "N4 -> ε | n", "N5 -> ε | n", "N6 -> ε | n");
        Grammar out = eliminator.apply(g);
        // 2^6 subsets, minus the one deleting everything.
        assertEquals(63, out.getProductions("S").size());
        for (List<String> b : bodies(out, "S")) assertFalse(b.isEmpty());
    }

    @Test
    public void testNoEmptyBodiesRemain() {
        Grammar out = eliminator.apply(TestGrammars.grammar("S A", "a", "S",
            "S -> A | ε", "A -> ε"));
        for (String name : out.getProductionNames())
            for (Grammar.Production p : out.getProductions(name))
                assertFalse(p.getSymbols().isEmpty());
        assertEquals(set(body("A")), bodies(out, "S"));
        assertTrue(out.getProductions("A").isEmpty());
    }

}
