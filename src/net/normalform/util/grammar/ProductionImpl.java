package net.normalform.util.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.normalform.api.grammar.Grammar;

public class ProductionImpl implements Grammar.Production {

    private final String name;
    private final List<Grammar.Symbol> symbols;

    public ProductionImpl(String name, List<Grammar.Symbol> symbols) {
        if (name == null)
            throw new NullPointerException(
                "Production name may not be null");
        if (symbols == null)
            throw new NullPointerException(
                "Production symbols may not be null");
        List<Grammar.Symbol> copy = new ArrayList<Grammar.Symbol>(symbols);
        if (copy.contains(null))
            throw new NullPointerException(
                "Production symbols may not contain null");
        this.name = name;
        this.symbols = Collections.unmodifiableList(copy);
    }
    public ProductionImpl(String name, Grammar.Symbol... symbols) {
        this(name, Arrays.asList(symbols));
    }

    public String toString() {
        return String.format("%s@%h[name=%s,symbols=%s]",
            getClass().getName(), this, getName(), getSymbols());
    }

    public boolean equals(Object other) {
        if (! (other instanceof Grammar.Production)) return false;
        Grammar.Production po = (Grammar.Production) other;
        return (getName().equals(po.getName()) &&
                getSymbols().equals(po.getSymbols()));
    }

    public int hashCode() {
        return getName().hashCode() ^ getSymbols().hashCode();
    }

    public String getName() {
        return name;
    }

    public List<Grammar.Symbol> getSymbols() {
        return symbols;
    }

}
