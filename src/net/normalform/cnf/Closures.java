package net.normalform.cnf;

import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.normalform.api.grammar.Grammar;
import net.normalform.api.grammar.GrammarView;

final class Closures {

    /* A production together with the number of body occurrences that are
     * not yet known to be settled. */
    private static class Counter {

        final Grammar.NonterminalSymbol left;
        int pending;

        Counter(Grammar.NonterminalSymbol left, int pending) {
            this.left = left;
            this.pending = pending;
        }

    }

    // Prevent construction.
    private Closures() {}

    static Map<String, Grammar.NonterminalSymbol> nonterminalsByName(
            GrammarView g) {
        Map<String, Grammar.NonterminalSymbol> ret =
            new LinkedHashMap<String, Grammar.NonterminalSymbol>();
        for (Grammar.NonterminalSymbol nt : g.getNonterminals())
            ret.put(nt.getName(), nt);
        return ret;
    }

    /**
     * Compute the least set of non-terminals S such that a non-terminal is
     * in S whenever one of its bodies consists only of members of S and
     * (unless terminalsBlock is true) terminals.
     * With terminalsBlock, this yields the nullable non-terminals; without,
     * the productive ones.
     * Every production carries a counter of unsettled body occurrences;
     * each member added to S decrements the counters of the productions
     * mentioning it, and a counter reaching zero adds that production's
     * left-hand side. Every occurrence is thus visited at most once.
     */
    static Set<Grammar.NonterminalSymbol> countDown(GrammarView g,
                                                    boolean terminalsBlock) {
        Map<String, Grammar.NonterminalSymbol> byName = nonterminalsByName(g);
        Map<Grammar.NonterminalSymbol, List<Counter>> uses =
            new HashMap<Grammar.NonterminalSymbol, List<Counter>>();
        Set<Grammar.NonterminalSymbol> ret =
            new LinkedHashSet<Grammar.NonterminalSymbol>();
        Deque<Grammar.NonterminalSymbol> queue =
            new LinkedList<Grammar.NonterminalSymbol>();
        for (String name : g.getProductionNames()) {
            Grammar.NonterminalSymbol left = byName.get(name);
            if (left == null) continue;
            for (Grammar.Production p : g.getProductions(name)) {
                if (terminalsBlock && containsTerminal(p)) continue;
                Counter c = new Counter(left, 0);
                for (Grammar.Symbol s : p.getSymbols()) {
                    if (! (s instanceof Grammar.NonterminalSymbol)) continue;
                    c.pending++;
                    getUses(uses, (Grammar.NonterminalSymbol) s).add(c);
                }
                if (c.pending == 0 && ret.add(left)) queue.add(left);
            }
        }
        for (;;) {
            Grammar.NonterminalSymbol nt = queue.poll();
            if (nt == null) break;
            List<Counter> cs = uses.get(nt);
            if (cs == null) continue;
            for (Counter c : cs) {
                if (--c.pending == 0 && ret.add(c.left)) queue.add(c.left);
            }
        }
        return ret;
    }

    private static boolean containsTerminal(Grammar.Production p) {
        for (Grammar.Symbol s : p.getSymbols()) {
            if (s instanceof Grammar.TerminalSymbol) return true;
        }
        return false;
    }

    private static List<Counter> getUses(
            Map<Grammar.NonterminalSymbol, List<Counter>> uses,
            Grammar.NonterminalSymbol key) {
        List<Counter> ret = uses.get(key);
        if (ret == null) {
            ret = new ArrayList<Counter>();
            uses.put(key, ret);
        }
        return ret;
    }

}
