package net.normalform.util.grammar;

import net.normalform.api.grammar.Grammar;

public abstract class AbstractSymbol implements Grammar.Symbol {

    private final String name;

    public AbstractSymbol(String name) {
        if (name == null)
            throw new NullPointerException("Symbol name may not be null");
        if (name.isEmpty())
            throw new IllegalArgumentException("Symbol name may not be empty");
        this.name = name;
    }

    public String toString() {
        return getName();
    }

    public boolean equals(Object other) {
        if (! (other instanceof AbstractSymbol)) return false;
        AbstractSymbol co = (AbstractSymbol) other;
        return (matches(co) && co.matches(this));
    }

    public int hashCode() {
        return hashCodeBase();
    }

    protected abstract boolean matches(AbstractSymbol other);

    protected abstract int hashCodeBase();

    public String getName() {
        return name;
    }

}
