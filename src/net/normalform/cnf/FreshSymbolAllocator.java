package net.normalform.cnf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.normalform.api.grammar.Grammar;
import net.normalform.api.grammar.GrammarView;

/**
 * Hands out non-terminal names that collide with nothing.
 * Names are formed from a prefix and a counter ("X1", "X2", ...); a name is
 * skipped if any symbol of the grammar it is allocated for, any symbol of
 * the seed grammar, or any earlier allocation already uses it. Instances
 * belong to a single normalization run.
 */
public class FreshSymbolAllocator {

    public static final String DEFAULT_PREFIX = "X";

    private final String prefix;
    private final Set<String> taken;
    private final List<Grammar.NonterminalSymbol> allocated;
    private int counter;

    public FreshSymbolAllocator(String prefix) {
        if (prefix == null)
            throw new NullPointerException("Prefix may not be null");
        if (prefix.isEmpty())
            throw new IllegalArgumentException("Prefix may not be empty");
        this.prefix = prefix;
        this.taken = new HashSet<String>();
        this.allocated = new ArrayList<Grammar.NonterminalSymbol>();
    }
    public FreshSymbolAllocator(String prefix, GrammarView seed) {
        this(prefix);
        reserve(seed);
    }
    public FreshSymbolAllocator() {
        this(DEFAULT_PREFIX);
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * All symbols allocated so far, in allocation order.
     */
    public List<Grammar.NonterminalSymbol> getAllocated() {
        return Collections.unmodifiableList(allocated);
    }

    /**
     * Exclude all symbol names of g from future allocations.
     */
    public void reserve(GrammarView g) {
        for (Grammar.Symbol s : g.getNonterminals()) taken.add(s.getName());
        for (Grammar.Symbol s : g.getTerminals()) taken.add(s.getName());
    }

    /**
     * Create a fresh non-terminal and declare it in g.
     */
    public Grammar.NonterminalSymbol allocate(Grammar g) {
        String name;
        do {
            name = prefix + (++counter);
        } while (taken.contains(name) || isDeclared(g, name));
        taken.add(name);
        Grammar.NonterminalSymbol ret = g.createNonterminal(name);
        g.addNonterminal(ret);
        allocated.add(ret);
        return ret;
    }

    private static boolean isDeclared(Grammar g, String name) {
        return (g.getNonterminals().contains(g.createNonterminal(name)) ||
                g.getTerminals().contains(g.createTerminal(name)));
    }

}
