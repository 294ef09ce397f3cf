package net.normalform.cnf;

import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Map;
import java.util.Set;
import net.normalform.api.grammar.Grammar;
import net.normalform.api.grammar.GrammarView;
import net.normalform.util.grammar.GrammarImpl;
import net.normalform.util.grammar.Grammars;

/**
 * Removes unit productions (those whose body is a single non-terminal).
 * Each non-terminal A receives the non-unit bodies of every B it can turn
 * into through a chain of unit productions (including A itself).
 */
public class UnitEliminator implements GrammarTransform {

    /**
     * Compute the reflexive-transitive closure of the unit relation.
     * The returned map has an entry for every non-terminal of g; the pair
     * (A, B) is in the closure iff B is in the set mapped to by A.
     */
    public Map<Grammar.NonterminalSymbol, Set<Grammar.NonterminalSymbol>>
            findUnitPairs(GrammarView g) {
        Map<Grammar.NonterminalSymbol, Set<Grammar.NonterminalSymbol>> direct =
            new LinkedHashMap<Grammar.NonterminalSymbol,
                              Set<Grammar.NonterminalSymbol>>();
        for (Grammar.NonterminalSymbol nt : g.getNonterminals()) {
            Set<Grammar.NonterminalSymbol> targets =
                new LinkedHashSet<Grammar.NonterminalSymbol>();
            for (Grammar.Production p : g.getProductions(nt.getName())) {
                if (Grammars.isUnitProduction(p))
                    targets.add((Grammar.NonterminalSymbol)
                                p.getSymbols().get(0));
            }
            direct.put(nt, targets);
        }
        Map<Grammar.NonterminalSymbol, Set<Grammar.NonterminalSymbol>> ret =
            new LinkedHashMap<Grammar.NonterminalSymbol,
                              Set<Grammar.NonterminalSymbol>>();
        for (Grammar.NonterminalSymbol nt : g.getNonterminals()) {
            Set<Grammar.NonterminalSymbol> reached =
                new LinkedHashSet<Grammar.NonterminalSymbol>();
            Deque<Grammar.NonterminalSymbol> queue =
                new LinkedList<Grammar.NonterminalSymbol>();
            reached.add(nt);
            queue.add(nt);
            for (;;) {
                Grammar.NonterminalSymbol cur = queue.poll();
                if (cur == null) break;
                Set<Grammar.NonterminalSymbol> next = direct.get(cur);
                if (next == null) continue;
                for (Grammar.NonterminalSymbol n : next) {
                    if (reached.add(n)) queue.add(n);
                }
            }
            ret.put(nt, reached);
        }
        return ret;
    }

    public Grammar apply(GrammarView g) {
        Map<Grammar.NonterminalSymbol, Set<Grammar.NonterminalSymbol>> pairs =
            findUnitPairs(g);
        GrammarImpl ret = new GrammarImpl();
        for (Grammar.NonterminalSymbol nt : g.getNonterminals())
            ret.addNonterminal(nt);
        for (Grammar.TerminalSymbol t : g.getTerminals())
            ret.addTerminal(t);
        ret.setStartSymbol(g.getStartSymbol());
        for (Map.Entry<Grammar.NonterminalSymbol,
                       Set<Grammar.NonterminalSymbol>> ent :
                 pairs.entrySet()) {
            String name = ent.getKey().getName();
            ret.ensureProductions(name);
            for (Grammar.NonterminalSymbol target : ent.getValue()) {
                for (Grammar.Production p :
                         g.getProductions(target.getName())) {
                    if (Grammars.isUnitProduction(p)) continue;
                    ret.addProduction(ret.createProduction(name,
                                                           p.getSymbols()));
                }
            }
        }
        return ret;
    }

}
