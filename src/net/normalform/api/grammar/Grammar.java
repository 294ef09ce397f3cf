package net.normalform.api.grammar;

import java.util.List;
import net.normalform.api.NamedValue;

/**
 * A context-free Grammar, defining a formal language.
 * The grammar consists of a set of non-terminal symbols, a (disjoint) set
 * of terminal symbols, a start symbol that is one of the non-terminals, and
 * productions, which rewrite a non-terminal into a sequence of symbols. The
 * grammar generates those strings of terminals that can be derived from the
 * start symbol.
 * This provides a mutable interface, along with factory methods for creating
 * the parts of a Grammar.
 */
public interface Grammar extends GrammarView {

    /**
     * An (immutable) element of a Production.
     * A Symbol is either a TerminalSymbol, which cannot be rewritten any
     * further, or a NonterminalSymbol, which is rewritten by the productions
     * bearing its name.
     * Classes implementing Symbol should implement equals() (and hashCode())
     * such that two symbols are equal if-and-only-if they are of the same
     * kind and have equal names. Names may be of any (nonzero) length; a
     * sequence of symbols is never encoded as a single string.
     */
    public interface Symbol extends NamedValue {}

    /**
     * A Symbol that is rewritten by the productions with its name.
     */
    public interface NonterminalSymbol extends Symbol {}

    /**
     * An atomic Symbol of the generated language.
     */
    public interface TerminalSymbol extends Symbol {}

    /**
     * An (immutable) rewrite rule of a Grammar.
     * A Production has a name, which is the name of the non-terminal it
     * rewrites, and a list of Symbol-s (the "body") that non-terminal is
     * replaced with. An empty body denotes the empty string.
     * Classes implementing Production should implement equals() (and
     * hashCode()) such that two productions are equal if-and-only-if their
     * names and their symbol lists are equal.
     */
    public interface Production extends NamedValue {

        /**
         * The symbols of this Production.
         */
        List<Symbol> getSymbols();

    }

    /**
     * Create a NonterminalSymbol with the given name.
     */
    NonterminalSymbol createNonterminal(String name);

    /**
     * Create a TerminalSymbol with the given name.
     */
    TerminalSymbol createTerminal(String name);

    /**
     * Create a Production with the given name and symbols.
     */
    Production createProduction(String name, List<Symbol> symbols);

    /**
     * Declare the given non-terminal.
     */
    void addNonterminal(NonterminalSymbol sym);

    /**
     * Remove the given non-terminal along with all productions named after
     * it.
     * Productions of other non-terminals that refer to it are not touched.
     */
    void removeNonterminal(NonterminalSymbol sym);

    /**
     * Declare the given terminal.
     */
    void addTerminal(TerminalSymbol sym);

    /**
     * Replace the start symbol of the Grammar.
     * The symbol is declared as a non-terminal if it is not already.
     */
    void setStartSymbol(NonterminalSymbol sym);

    /**
     * Add the given production to the Grammar.
     */
    void addProduction(Production prod);

    /**
     * Remove the given production from the Grammar.
     */
    void removeProduction(Production prod);

    /**
     * Ensure that the given name has a (possibly empty) set of productions.
     */
    void ensureProductions(String name);

    /**
     * Return an independent deep copy of this Grammar.
     * Modifying either grammar afterwards does not affect the other.
     */
    Grammar copy();

    /**
     * Check that this Grammar is well-formed.
     * A grammar is well-formed if it has a start symbol that is a declared
     * non-terminal, no name is declared both as a terminal and as a
     * non-terminal, every production is named after a declared
     * non-terminal, and every symbol in every production body is declared.
     */
    void validate() throws InvalidGrammarException;

}
