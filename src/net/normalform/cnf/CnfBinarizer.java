package net.normalform.cnf;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import net.normalform.api.grammar.Grammar;
import net.normalform.api.grammar.GrammarView;
import net.normalform.util.grammar.GrammarImpl;
import net.normalform.util.grammar.Grammars;

/**
 * Brings an epsilon-free, unit-free, pruned grammar into Chomsky normal
 * form.
 * The three steps may also be invoked individually; they modify the grammar
 * passed to them in place, whereas apply() works on a copy.
 */
public class CnfBinarizer implements GrammarTransform {

    private static final Logger LOGGER = Logger.getLogger("CnfBinarizer");

    private final FreshSymbolAllocator allocator;

    public CnfBinarizer(FreshSymbolAllocator allocator) {
        if (allocator == null)
            throw new NullPointerException("Allocator may not be null");
        this.allocator = allocator;
    }

    public FreshSymbolAllocator getAllocator() {
        return allocator;
    }

    public Grammar apply(GrammarView g) {
        GrammarImpl ret = new GrammarImpl(g);
        isolateStart(ret);
        isolateTerminals(ret);
        binarize(ret);
        return ret;
    }

    /**
     * Replace the start symbol by a fresh one if it occurs on any
     * right-hand side.
     * The whole grammar is scanned. The new start symbol receives copies of
     * the old one's bodies, which is what the unit production from the new
     * to the old start symbol would expand to.
     * Returns whether a new start symbol was introduced.
     */
    public boolean isolateStart(Grammar g) {
        Grammar.NonterminalSymbol start = g.getStartSymbol();
        if (! Grammars.occursOnRightSide(g, start)) return false;
        Grammar.NonterminalSymbol fresh = allocator.allocate(g);
        g.ensureProductions(fresh.getName());
        for (Grammar.Production p : g.getProductions(start.getName())) {
            g.addProduction(g.createProduction(fresh.getName(),
                                               p.getSymbols()));
        }
        g.setStartSymbol(fresh);
        LOGGER.fine("Start symbol " + start + " occurs on a right-hand " +
            "side; replaced by " + fresh);
        return true;
    }

    /**
     * Replace every terminal in a body of length two or more by a
     * non-terminal that derives just that terminal.
     * One such non-terminal is allocated per distinct terminal.
     * Returns the replacements made.
     */
    public Map<Grammar.TerminalSymbol, Grammar.NonterminalSymbol>
            isolateTerminals(Grammar g) {
        Map<Grammar.TerminalSymbol, Grammar.NonterminalSymbol> replacements =
            new LinkedHashMap<Grammar.TerminalSymbol,
                              Grammar.NonterminalSymbol>();
        for (Grammar.Production p : snapshot(g)) {
            List<Grammar.Symbol> body = p.getSymbols();
            if (body.size() < 2) continue;
            List<Grammar.Symbol> newBody = new ArrayList<Grammar.Symbol>();
            boolean changed = false;
            for (Grammar.Symbol s : body) {
                if (s instanceof Grammar.TerminalSymbol) {
                    newBody.add(replacementFor(g, replacements,
                                               (Grammar.TerminalSymbol) s));
                    changed = true;
                } else {
                    newBody.add(s);
                }
            }
            if (! changed) continue;
            g.removeProduction(p);
            g.addProduction(g.createProduction(p.getName(), newBody));
        }
        return replacements;
    }

    /**
     * Split every body longer than two symbols by repeatedly replacing its
     * last two symbols with a fresh non-terminal deriving them.
     * Returns the number of non-terminals introduced.
     */
    public int binarize(Grammar g) {
        int ret = 0;
        for (Grammar.Production p : snapshot(g)) {
            if (p.getSymbols().size() <= 2) continue;
            List<Grammar.Symbol> body =
                new ArrayList<Grammar.Symbol>(p.getSymbols());
            while (body.size() > 2) {
                int n = body.size();
                Grammar.NonterminalSymbol fresh = allocator.allocate(g);
                g.addProduction(g.createProduction(fresh.getName(),
                    new ArrayList<Grammar.Symbol>(body.subList(n - 2, n))));
                body.subList(n - 2, n).clear();
                body.add(fresh);
                ret++;
            }
            g.removeProduction(p);
            g.addProduction(g.createProduction(p.getName(), body));
        }
        return ret;
    }

    private Grammar.NonterminalSymbol replacementFor(Grammar g,
            Map<Grammar.TerminalSymbol, Grammar.NonterminalSymbol> repl,
            Grammar.TerminalSymbol t) {
        Grammar.NonterminalSymbol ret = repl.get(t);
        if (ret == null) {
            ret = allocator.allocate(g);
            List<Grammar.Symbol> body = new ArrayList<Grammar.Symbol>();
            body.add(t);
            g.addProduction(g.createProduction(ret.getName(), body));
            repl.put(t, ret);
            LOGGER.finer("Terminal " + t + " isolated as " + ret);
        }
        return ret;
    }

    /* Productions are replaced while iterating, so work on a copy. */
    private static List<Grammar.Production> snapshot(GrammarView g) {
        List<Grammar.Production> ret = new ArrayList<Grammar.Production>();
        for (String name : g.getProductionNames())
            ret.addAll(g.getProductions(name));
        return ret;
    }

}
