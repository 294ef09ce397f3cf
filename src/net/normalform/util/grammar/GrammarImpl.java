package net.normalform.util.grammar;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.normalform.api.grammar.Grammar;
import net.normalform.api.grammar.GrammarView;
import net.normalform.api.grammar.InvalidGrammarException;
import net.normalform.util.NamedMap;
import net.normalform.util.NamedSet;

public class GrammarImpl implements Grammar {

    private final Set<NonterminalSymbol> nonterminals;
    private final Set<TerminalSymbol> terminals;
    private final NamedMap<NamedSet<Production>> productions;
    private NonterminalSymbol startSymbol;

    public GrammarImpl() {
        nonterminals = new LinkedHashSet<NonterminalSymbol>();
        terminals = new LinkedHashSet<TerminalSymbol>();
        productions = new NamedMap<NamedSet<Production>>();
    }
    public GrammarImpl(GrammarView other) {
        this();
        nonterminals.addAll(other.getNonterminals());
        terminals.addAll(other.getTerminals());
        startSymbol = other.getStartSymbol();
        for (String name : other.getProductionNames()) {
            ensureProductions(name);
            for (Production prod : other.getProductions(name)) {
                addProduction(prod);
            }
        }
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getName());
        sb.append('@');
        sb.append(Integer.toHexString(System.identityHashCode(this)));
        sb.append("[start=");
        sb.append(startSymbol);
        sb.append(",nonterminals=");
        sb.append(nonterminals);
        sb.append(",terminals=");
        sb.append(terminals);
        for (Set<Production> ps : productions.values()) {
            for (Production p : ps) {
                sb.append(',');
                sb.append(Grammars.formatProduction(p));
            }
        }
        sb.append(']');
        return sb.toString();
    }

    public boolean equals(Object other) {
        if (! (other instanceof GrammarImpl)) return false;
        GrammarImpl go = (GrammarImpl) other;
        return (equalOrNull(getStartSymbol(), go.getStartSymbol()) &&
                getNonterminals().equals(go.getNonterminals()) &&
                getTerminals().equals(go.getTerminals()) &&
                Grammars.productionMap(this).equals(
                    Grammars.productionMap(go)));
    }

    public int hashCode() {
        return ((startSymbol == null) ? 0 : startSymbol.hashCode()) ^
            nonterminals.hashCode() ^ terminals.hashCode() * 31 ^
            Grammars.productionMap(this).hashCode();
    }

    public Nonterminal createNonterminal(String name) {
        return new Nonterminal(name);
    }
    public Terminal createTerminal(String name) {
        return new Terminal(name);
    }

    public Production createProduction(String name, List<Symbol> symbols) {
        return new ProductionImpl(name, symbols);
    }
    public Production createProduction(String name, Symbol... symbols) {
        return new ProductionImpl(name, Arrays.asList(symbols));
    }

    // Immutable GrammarView interface.
    public NonterminalSymbol getStartSymbol() {
        return startSymbol;
    }

    public Set<NonterminalSymbol> getNonterminals() {
        return Collections.unmodifiableSet(nonterminals);
    }

    public Set<TerminalSymbol> getTerminals() {
        return Collections.unmodifiableSet(terminals);
    }

    public Set<String> getProductionNames() {
        return Collections.unmodifiableSet(productions.keySet());
    }

    public Set<Production> getProductions(String name) {
        Set<Production> ret = productions.get(name);
        if (ret == null) return Collections.emptySet();
        return Collections.unmodifiableSet(ret);
    }

    // Mutable direct interface.
    public void addNonterminal(NonterminalSymbol sym) {
        if (sym == null)
            throw new NullPointerException("Symbol may not be null");
        nonterminals.add(sym);
    }
    public void removeNonterminal(NonterminalSymbol sym) {
        nonterminals.remove(sym);
        productions.remove(sym.getName());
    }
    public void retainNonterminals(Set<? extends NonterminalSymbol> keep) {
        for (NonterminalSymbol nt : new LinkedHashSet<NonterminalSymbol>(
                nonterminals)) {
            if (! keep.contains(nt)) removeNonterminal(nt);
        }
    }

    public void addTerminal(TerminalSymbol sym) {
        if (sym == null)
            throw new NullPointerException("Symbol may not be null");
        terminals.add(sym);
    }

    public void setStartSymbol(NonterminalSymbol sym) {
        addNonterminal(sym);
        startSymbol = sym;
    }

    public void addProduction(Production prod) {
        getRawProductions(prod.getName(), true).add(prod);
    }
    public void removeProduction(Production prod) {
        Set<Production> subset = getRawProductions(prod.getName(), false);
        if (subset == null) return;
        subset.remove(prod);
    }

    public void ensureProductions(String name) {
        getRawProductions(name, true);
    }

    protected NamedSet<Production> getRawProductions(String name,
                                                     boolean create) {
        NamedSet<Production> ret = productions.get(name);
        if (ret == null && create) {
            ret = new NamedSet<Production>(name);
            productions.add(ret);
        }
        return ret;
    }

    /**
     * Return the declared symbol with the given name, or null if there is
     * none.
     */
    public Symbol resolve(String name) {
        Nonterminal nt = createNonterminal(name);
        if (nonterminals.contains(nt)) return nt;
        Terminal t = createTerminal(name);
        if (terminals.contains(t)) return t;
        return null;
    }

    public GrammarImpl copy() {
        return new GrammarImpl(this);
    }

    public void validate() throws InvalidGrammarException {
        if (startSymbol == null)
            throw new InvalidGrammarException("Missing start symbol");
        if (! nonterminals.contains(startSymbol))
            throw new InvalidGrammarException("Start symbol " + startSymbol +
                " is not a declared non-terminal");
        Set<String> ntNames = new LinkedHashSet<String>();
        for (NonterminalSymbol nt : nonterminals) ntNames.add(nt.getName());
        for (TerminalSymbol t : terminals) {
            if (ntNames.contains(t.getName()))
                throw new InvalidGrammarException("Symbol " + t +
                    " declared both as terminal and as non-terminal");
        }
        for (NamedSet<Production> ps : productions.values()) {
            if (! ntNames.contains(ps.getName()))
                throw new InvalidGrammarException("Productions for " +
                    "undeclared non-terminal " + ps.getName());
            for (Production p : ps) {
                for (Symbol s : p.getSymbols()) {
                    if (! isDeclared(s))
                        throw new InvalidGrammarException("Symbol " + s +
                            " in production " + Grammars.formatProduction(p) +
                            " is not declared");
                }
            }
        }
    }

    protected boolean isDeclared(Symbol s) {
        if (s instanceof NonterminalSymbol) return nonterminals.contains(s);
        if (s instanceof TerminalSymbol) return terminals.contains(s);
        return false;
    }

    private static boolean equalOrNull(Object a, Object b) {
        return (a == null) ? (b == null) : a.equals(b);
    }

}
