package net.normalform.cnf;

import java.util.LinkedHashSet;
import java.util.Set;
import net.normalform.api.grammar.Grammar;
import net.normalform.api.grammar.GrammarView;
import net.normalform.util.grammar.GrammarImpl;

/**
 * Removes non-terminals that cannot derive any string of terminals, along
 * with every production mentioning them.
 * The start symbol stays declared even if it is not productive (the
 * language is then empty and the start symbol has no productions).
 */
public class ProductivityPruner implements GrammarTransform {

    public Set<Grammar.NonterminalSymbol> findProductive(GrammarView g) {
        return Closures.countDown(g, false);
    }

    public Grammar apply(GrammarView g) {
        Set<Grammar.NonterminalSymbol> productive = findProductive(g);
        GrammarImpl ret = new GrammarImpl(g);
        for (String name : g.getProductionNames()) {
            for (Grammar.Production p : g.getProductions(name)) {
                if (! allProductive(p, productive)) ret.removeProduction(p);
            }
        }
        Set<Grammar.NonterminalSymbol> keep =
            new LinkedHashSet<Grammar.NonterminalSymbol>(productive);
        keep.add(g.getStartSymbol());
        ret.retainNonterminals(keep);
        return ret;
    }

    private static boolean allProductive(Grammar.Production p,
            Set<Grammar.NonterminalSymbol> productive) {
        for (Grammar.Symbol s : p.getSymbols()) {
            if (s instanceof Grammar.NonterminalSymbol &&
                    ! productive.contains(s))
                return false;
        }
        return true;
    }

}
