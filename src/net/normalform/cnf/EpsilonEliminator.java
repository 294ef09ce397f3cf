package net.normalform.cnf;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.normalform.api.grammar.Grammar;
import net.normalform.api.grammar.GrammarView;
import net.normalform.util.grammar.GrammarImpl;

/**
 * Removes productions with empty bodies.
 * Every body mentioning nullable non-terminals is complemented by all the
 * variants with some of those occurrences deleted. A body with k nullable
 * occurrences yields up to 2^k - 1 additional productions; no limit is
 * imposed on k.
 * The empty string itself is not preserved; callers interested in whether
 * the language contains it should consult findNullable() beforehand.
 */
public class EpsilonEliminator implements GrammarTransform {

    /* Expansions yielding at least this many variants are logged. */
    public static final int LARGE_EXPANSION = 64;

    private static final Logger LOGGER = Logger.getLogger("EpsilonEliminator");

    /**
     * Return the set of non-terminals that can derive the empty string.
     */
    public Set<Grammar.NonterminalSymbol> findNullable(GrammarView g) {
        Set<Grammar.NonterminalSymbol> ret = Closures.countDown(g, true);
        LOGGER.finer("Nullable non-terminals: " + ret);
        return ret;
    }

    public Grammar apply(GrammarView g) {
        return apply(g, findNullable(g));
    }

    /**
     * Rewrite g given its (precomputed) set of nullable non-terminals.
     */
    public Grammar apply(GrammarView g,
                         Set<? extends Grammar.NonterminalSymbol> nullable) {
        GrammarImpl ret = new GrammarImpl(g);
        for (String name : g.getProductionNames()) {
            for (Grammar.Production p : g.getProductions(name)) {
                List<Grammar.Symbol> body = p.getSymbols();
                if (body.isEmpty()) {
                    ret.removeProduction(p);
                    continue;
                }
                List<Integer> positions = new ArrayList<Integer>();
                for (int i = 0; i < body.size(); i++) {
                    if (nullable.contains(body.get(i))) positions.add(i);
                }
                if (positions.isEmpty()) continue;
                int added = expand(ret, p, positions, 0,
                                   new boolean[body.size()], false);
                if (added >= LARGE_EXPANSION && LOGGER.isLoggable(Level.FINE))
                    LOGGER.fine("Production " + name + " with " +
                        positions.size() + " nullable occurrences expanded " +
                        "into " + added + " variants");
            }
        }
        return ret;
    }

    /* Enumerate all keep/drop choices for the nullable positions from index
     * onwards and add the resulting non-empty variants to g. Returns the
     * number of variants generated. */
    private int expand(Grammar g, Grammar.Production base,
                       List<Integer> positions, int index, boolean[] drop,
                       boolean anyDropped) {
        if (index == positions.size()) {
            if (! anyDropped) return 0;
            List<Grammar.Symbol> body = new ArrayList<Grammar.Symbol>();
            List<Grammar.Symbol> orig = base.getSymbols();
            for (int i = 0; i < orig.size(); i++) {
                if (! drop[i]) body.add(orig.get(i));
            }
            if (body.isEmpty()) return 0;
            g.addProduction(g.createProduction(base.getName(), body));
            return 1;
        }
        int pos = positions.get(index);
        int ret = expand(g, base, positions, index + 1, drop, anyDropped);
        drop[pos] = true;
        ret += expand(g, base, positions, index + 1, drop, true);
        drop[pos] = false;
        return ret;
    }

}
