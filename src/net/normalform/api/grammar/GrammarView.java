package net.normalform.api.grammar;

import java.util.Set;

/**
 * A read-only view of a Grammar.
 * The Set-s returned by the methods in this interface are unmodifiable and
 * iterate in insertion order.
 */
public interface GrammarView {

    /**
     * The start symbol of the GrammarView.
     */
    Grammar.NonterminalSymbol getStartSymbol();

    /**
     * All non-terminal symbols declared by this GrammarView.
     */
    Set<Grammar.NonterminalSymbol> getNonterminals();

    /**
     * All terminal symbols declared by this GrammarView.
     */
    Set<Grammar.TerminalSymbol> getTerminals();

    /**
     * The names of all left-hand sides that have a (possibly empty) set of
     * productions in this GrammarView.
     */
    Set<String> getProductionNames();

    /**
     * The productions of this GrammarView with the given name, or an empty
     * set if none.
     */
    Set<Grammar.Production> getProductions(String name);

}
