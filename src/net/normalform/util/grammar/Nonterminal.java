package net.normalform.util.grammar;

import net.normalform.api.grammar.Grammar;

public class Nonterminal extends AbstractSymbol
        implements Grammar.NonterminalSymbol {

    public Nonterminal(String name) {
        super(name);
    }

    protected boolean matches(AbstractSymbol other) {
        return ((other instanceof Nonterminal) &&
                getName().equals(other.getName()));
    }

    protected int hashCodeBase() {
        return getName().hashCode();
    }

}
