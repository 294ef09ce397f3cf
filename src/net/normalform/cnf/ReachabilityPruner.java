package net.normalform.cnf;

import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Set;
import net.normalform.api.grammar.Grammar;
import net.normalform.api.grammar.GrammarView;
import net.normalform.util.grammar.GrammarImpl;

/**
 * Removes non-terminals (and their productions) that cannot be reached from
 * the start symbol. The terminal set is left alone.
 */
public class ReachabilityPruner implements GrammarTransform {

    public Set<Grammar.NonterminalSymbol> findReachable(GrammarView g) {
        Set<Grammar.NonterminalSymbol> ret =
            new LinkedHashSet<Grammar.NonterminalSymbol>();
        Deque<Grammar.NonterminalSymbol> queue =
            new LinkedList<Grammar.NonterminalSymbol>();
        ret.add(g.getStartSymbol());
        queue.add(g.getStartSymbol());
        for (;;) {
            Grammar.NonterminalSymbol nt = queue.poll();
            if (nt == null) break;
            for (Grammar.Production p : g.getProductions(nt.getName())) {
                for (Grammar.Symbol s : p.getSymbols()) {
                    if (! (s instanceof Grammar.NonterminalSymbol)) continue;
                    Grammar.NonterminalSymbol n =
                        (Grammar.NonterminalSymbol) s;
                    if (ret.add(n)) queue.add(n);
                }
            }
        }
        return ret;
    }

    public Grammar apply(GrammarView g) {
        GrammarImpl ret = new GrammarImpl(g);
        ret.retainNonterminals(findReachable(g));
        return ret;
    }

}
