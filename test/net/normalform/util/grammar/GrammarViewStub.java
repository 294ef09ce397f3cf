package net.normalform.util.grammar;

import java.util.Set;
import net.normalform.api.grammar.Grammar;
import net.normalform.api.grammar.GrammarView;

/**
 * Delegates to another view but reports a different start symbol, which
 * GrammarImpl itself never allows to happen.
 */
class GrammarViewStub implements GrammarView {

    private final GrammarView base;
    private final Grammar.NonterminalSymbol start;

    GrammarViewStub(GrammarView base, Grammar.NonterminalSymbol start) {
        this.base = base;
        this.start = start;
    }

    public Grammar.NonterminalSymbol getStartSymbol() {
        return start;
    }

    public Set<Grammar.NonterminalSymbol> getNonterminals() {
        return base.getNonterminals();
    }

    public Set<Grammar.TerminalSymbol> getTerminals() {
        return base.getTerminals();
    }

    public Set<String> getProductionNames() {
        return base.getProductionNames();
    }

    public Set<Grammar.Production> getProductions(String name) {
        return base.getProductions(name);
    }

}
