package net.normalform.util.grammar;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.normalform.api.grammar.Grammar;
import net.normalform.api.grammar.GrammarView;

public final class Grammars {

    public static final String EPSILON = "ε";

    // Prevent construction.
    private Grammars() {}

    /**
     * Map every left-hand side with at least one production to its
     * productions.
     * Left-hand sides with an empty production set are omitted, so that
     * grammars differing only in such entries compare equal.
     */
    public static Map<String, Set<Grammar.Production>> productionMap(
            GrammarView g) {
        Map<String, Set<Grammar.Production>> ret =
            new LinkedHashMap<String, Set<Grammar.Production>>();
        for (String name : g.getProductionNames()) {
            Set<Grammar.Production> ps = g.getProductions(name);
            if (! ps.isEmpty()) ret.put(name, ps);
        }
        return ret;
    }

    public static int countProductions(GrammarView g) {
        int ret = 0;
        for (String name : g.getProductionNames()) {
            ret += g.getProductions(name).size();
        }
        return ret;
    }

    /**
     * Test whether sym occurs anywhere in any production body of g.
     */
    public static boolean occursOnRightSide(GrammarView g,
                                            Grammar.Symbol sym) {
        for (String name : g.getProductionNames()) {
            for (Grammar.Production p : g.getProductions(name)) {
                if (p.getSymbols().contains(sym)) return true;
            }
        }
        return false;
    }

    /**
     * Test whether prod's body consists of exactly one non-terminal.
     */
    public static boolean isUnitProduction(Grammar.Production prod) {
        List<Grammar.Symbol> syms = prod.getSymbols();
        return (syms.size() == 1 &&
                syms.get(0) instanceof Grammar.NonterminalSymbol);
    }

    /**
     * Test whether every production of g is of the form A -> a or A -> B C.
     * The start symbol may additionally have an empty body, provided it
     * does not occur on any right-hand side.
     */
    public static boolean isNormalForm(GrammarView g) {
        return (findNormalFormViolation(g) == null);
    }

    /**
     * Throw an IllegalStateException naming the first production of g that
     * violates the normal form.
     */
    public static void checkNormalForm(GrammarView g) {
        Grammar.Production bad = findNormalFormViolation(g);
        if (bad != null)
            throw new IllegalStateException("Production " +
                formatProduction(bad) + " is not in Chomsky normal form");
    }

    private static Grammar.Production findNormalFormViolation(GrammarView g) {
        Grammar.NonterminalSymbol start = g.getStartSymbol();
        for (String name : g.getProductionNames()) {
            for (Grammar.Production p : g.getProductions(name)) {
                List<Grammar.Symbol> syms = p.getSymbols();
                switch (syms.size()) {
                    case 0:
                        if (start == null ||
                                ! name.equals(start.getName()) ||
                                occursOnRightSide(g, start))
                            return p;
                        break;
                    case 1:
                        if (! (syms.get(0) instanceof Grammar.TerminalSymbol))
                            return p;
                        break;
                    case 2:
                        if (! (syms.get(0) instanceof
                                   Grammar.NonterminalSymbol) ||
                                ! (syms.get(1) instanceof
                                   Grammar.NonterminalSymbol))
                            return p;
                        break;
                    default:
                        return p;
                }
            }
        }
        return null;
    }

    public static String formatBody(List<Grammar.Symbol> symbols) {
        if (symbols.isEmpty()) return EPSILON;
        StringBuilder sb = new StringBuilder();
        for (Grammar.Symbol s : symbols) {
            if (sb.length() != 0) sb.append(' ');
            sb.append(s.getName());
        }
        return sb.toString();
    }

    public static String formatProduction(Grammar.Production prod) {
        return prod.getName() + " -> " + formatBody(prod.getSymbols());
    }

    /**
     * Render g as a header line in the customary (N, T, P, S) notation
     * followed by one "A -> x y | z" line per left-hand side.
     */
    public static String format(GrammarView g) {
        StringBuilder sb = new StringBuilder();
        sb.append("G = (");
        appendNames(sb, g.getNonterminals());
        sb.append(", ");
        appendNames(sb, g.getTerminals());
        sb.append(", P, ");
        sb.append(g.getStartSymbol());
        sb.append(")\n");
        for (String name : g.getProductionNames()) {
            Set<Grammar.Production> ps = g.getProductions(name);
            if (ps.isEmpty()) continue;
            sb.append(name).append(" ->");
            Iterator<Grammar.Production> it = ps.iterator();
            while (it.hasNext()) {
                sb.append(' ').append(formatBody(it.next().getSymbols()));
                if (it.hasNext()) sb.append(" |");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void appendNames(StringBuilder sb,
            Set<? extends Grammar.Symbol> syms) {
        sb.append('{');
        boolean first = true;
        for (Grammar.Symbol s : syms) {
            if (first) {
                first = false;
            } else {
                sb.append(", ");
            }
            sb.append(s.getName());
        }
        sb.append('}');
    }

}
