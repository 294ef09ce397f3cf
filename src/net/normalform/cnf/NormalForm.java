package net.normalform.cnf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.normalform.api.grammar.Grammar;

/**
 * The outcome of a normalization run.
 */
public class NormalForm {

    private final Grammar grammar;
    private final boolean acceptsEmptyString;
    private final List<Grammar.NonterminalSymbol> freshSymbols;

    public NormalForm(Grammar grammar, boolean acceptsEmptyString,
                      List<Grammar.NonterminalSymbol> freshSymbols) {
        if (grammar == null)
            throw new NullPointerException("Grammar may not be null");
        this.grammar = grammar;
        this.acceptsEmptyString = acceptsEmptyString;
        this.freshSymbols = Collections.unmodifiableList(
            new ArrayList<Grammar.NonterminalSymbol>(freshSymbols));
    }

    public String toString() {
        return String.format("%s@%h[acceptsEmptyString=%s,grammar=%s]",
            getClass().getName(), this, acceptsEmptyString, grammar);
    }

    /**
     * The grammar in Chomsky normal form.
     */
    public Grammar getGrammar() {
        return grammar;
    }

    /**
     * Whether the language of the input grammar contains the empty string.
     * Unless the run was configured to emit an empty production for the
     * start symbol, the normalized grammar does not generate it; consumers
     * have to special-case it then.
     */
    public boolean acceptsEmptyString() {
        return acceptsEmptyString;
    }

    /**
     * The non-terminals introduced by the run, in order of allocation.
     */
    public List<Grammar.NonterminalSymbol> getFreshSymbols() {
        return freshSymbols;
    }

}
