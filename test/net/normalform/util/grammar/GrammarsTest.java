package net.normalform.util.grammar;

import static net.normalform.util.grammar.TestGrammars.example;
import static net.normalform.util.grammar.TestGrammars.grammar;
import static org.junit.jupiter.api.Assertions.*;

import net.normalform.api.grammar.Grammar;
import org.junit.jupiter.api.Test;

public class GrammarsTest {

    @Test
    public void testNormalFormAccepted() {
        GrammarImpl g = grammar("S A B", "a b", "S",
            "S -> A B | a",
            "A -> a",
            "B -> b | A A");
        assertTrue(Grammars.isNormalForm(g));
        Grammars.checkNormalForm(g);
    }

    @Test
    public void testNormalFormRejectsMixedBody() {
        GrammarImpl g = grammar("S A", "a", "S", "S -> a A", "A -> a");
        assertFalse(Grammars.isNormalForm(g));
        IllegalStateException exc = assertThrows(IllegalStateException.class,
            () -> Grammars.checkNormalForm(g));
        assertTrue(exc.getMessage().contains("S -> a A"));
    }

    @Test
    public void testNormalFormRejectsUnitAndLongBodies() {
        assertFalse(Grammars.isNormalForm(grammar("S A", "a", "S",
            "S -> A", "A -> a")));
        assertFalse(Grammars.isNormalForm(grammar("S A", "a", "S",
            "S -> A A A", "A -> a")));
    }

    @Test
    public void testEmptyBodyOnlyForUnreferencedStart() {
        GrammarImpl ok = grammar("S A", "a", "S", "S -> A A | ε", "A -> a");
        assertTrue(Grammars.isNormalForm(ok));
        GrammarImpl referenced = grammar("S A", "a", "S",
            "S -> A S | ε", "A -> a");
        assertFalse(Grammars.isNormalForm(referenced));
        GrammarImpl other = grammar("S A", "a", "S",
            "S -> A A", "A -> a | ε");
        assertFalse(Grammars.isNormalForm(other));
    }

    @Test
    public void testOccursOnRightSideScansWholeGrammar() {
        GrammarImpl g = grammar("S A B", "a", "S",
            "S -> A",
            "A -> a",
            "B -> a S");
        assertTrue(Grammars.occursOnRightSide(g, g.createNonterminal("S")));
        assertFalse(Grammars.occursOnRightSide(g, g.createNonterminal("B")));
    }

    @Test
    public void testUnitProduction() {
        GrammarImpl g = example();
        Grammar.Production unit = g.createProduction("B",
            g.createNonterminal("A"));
        Grammar.Production terminal = g.createProduction("A",
            g.createTerminal("a"));
        assertTrue(Grammars.isUnitProduction(unit));
        assertFalse(Grammars.isUnitProduction(terminal));
    }

    @Test
    public void testFormat() {
        GrammarImpl g = grammar("S C", "a", "S", "S -> a C", "C -> ε | a");
        assertEquals("G = ({S, C}, {a}, P, S)\n" +
                     "S -> a C\n" +
                     "C -> ε | a\n", Grammars.format(g));
    }

    @Test
    public void testProductionCount() {
        assertEquals(11, Grammars.countProductions(example()));
    }

}
