package net.normalform.cnf;

import java.util.Collections;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.normalform.api.grammar.Grammar;
import net.normalform.api.grammar.GrammarView;
import net.normalform.api.grammar.InvalidGrammarException;
import net.normalform.util.config.Configuration;
import net.normalform.util.grammar.GrammarImpl;
import net.normalform.util.grammar.Grammars;

/**
 * Converts grammars into Chomsky normal form.
 * The input is validated and then run through epsilon elimination, unit
 * elimination, reachability pruning, productivity pruning, and
 * binarization, in this order. Instances only hold configuration and may be
 * shared; every call to normalize() works on its own copies and its own
 * FreshSymbolAllocator.
 */
public class Normalizer {

    /**
     * What to do if the language of the input contains the empty string.
     */
    public enum EmptyStringPolicy {

        /* Only report it via NormalForm.acceptsEmptyString(). */
        FLAG,
        /* Additionally give the final start symbol an empty body. */
        EMIT;

        public static EmptyStringPolicy parse(String value) {
            for (EmptyStringPolicy p : values()) {
                if (p.name().equalsIgnoreCase(value.trim())) return p;
            }
            throw new IllegalArgumentException("Unknown empty string " +
                "policy " + value);
        }

    }

    public static final String KEY_FRESH_PREFIX = "normalform.fresh.prefix";
    public static final String KEY_EMPTY_STRING = "normalform.emptyString";
    public static final String KEY_REPEAT_PRUNING = "normalform.prune.repeat";

    private static final Logger LOGGER = Logger.getLogger("Normalizer");

    private final String freshPrefix;
    private final EmptyStringPolicy emptyStringPolicy;
    private final boolean repeatPruning;

    public Normalizer(String freshPrefix, EmptyStringPolicy emptyStringPolicy,
                      boolean repeatPruning) {
        if (freshPrefix == null || freshPrefix.isEmpty())
            throw new IllegalArgumentException("Fresh symbol prefix may " +
                "not be empty");
        if (emptyStringPolicy == null)
            throw new NullPointerException("Policy may not be null");
        this.freshPrefix = freshPrefix;
        this.emptyStringPolicy = emptyStringPolicy;
        this.repeatPruning = repeatPruning;
    }
    public Normalizer(Configuration config) {
        this(getOr(config, KEY_FRESH_PREFIX,
                   FreshSymbolAllocator.DEFAULT_PREFIX),
             EmptyStringPolicy.parse(getOr(config, KEY_EMPTY_STRING,
                                           "flag")),
             parseBoolean(KEY_REPEAT_PRUNING,
                          getOr(config, KEY_REPEAT_PRUNING, "false")));
    }
    public Normalizer() {
        this(Configuration.DEFAULT);
    }

    public String getFreshPrefix() {
        return freshPrefix;
    }

    public EmptyStringPolicy getEmptyStringPolicy() {
        return emptyStringPolicy;
    }

    public boolean isRepeatPruning() {
        return repeatPruning;
    }

    public NormalForm normalize(GrammarView input)
            throws InvalidGrammarException {
        GrammarImpl g = new GrammarImpl(input);
        g.validate();
        FreshSymbolAllocator allocator =
            new FreshSymbolAllocator(freshPrefix, g);

        EpsilonEliminator epsilons = new EpsilonEliminator();
        Set<Grammar.NonterminalSymbol> nullable = epsilons.findNullable(g);
        boolean acceptsEmpty = nullable.contains(g.getStartSymbol());
        if (acceptsEmpty)
            LOGGER.fine("Language of " + g.getStartSymbol() + " contains " +
                "the empty string");

        Grammar cur = stage("epsilon elimination", g,
                            epsilons.apply(g, nullable));
        cur = stage("unit elimination", cur,
                    new UnitEliminator().apply(cur));
        ReachabilityPruner reachability = new ReachabilityPruner();
        cur = stage("reachability pruning", cur, reachability.apply(cur));
        cur = stage("productivity pruning", cur,
                    new ProductivityPruner().apply(cur));
        if (repeatPruning)
            cur = stage("reachability pruning", cur,
                        reachability.apply(cur));
        cur = stage("binarization", cur,
                    new CnfBinarizer(allocator).apply(cur));

        if (acceptsEmpty && emptyStringPolicy == EmptyStringPolicy.EMIT)
            cur.addProduction(cur.createProduction(
                cur.getStartSymbol().getName(),
                Collections.<Grammar.Symbol>emptyList()));
        Grammars.checkNormalForm(cur);
        return new NormalForm(cur, acceptsEmpty, allocator.getAllocated());
    }

    private static Grammar stage(String name, GrammarView before,
                                 Grammar after) {
        if (LOGGER.isLoggable(Level.FINE))
            LOGGER.fine(String.format("After %s: %d -> %d non-terminals, " +
                "%d -> %d productions", name,
                before.getNonterminals().size(),
                after.getNonterminals().size(),
                Grammars.countProductions(before),
                Grammars.countProductions(after)));
        return after;
    }

    private static String getOr(Configuration config, String key,
                                String dflt) {
        String ret = config.get(key);
        return (ret == null) ? dflt : ret;
    }

    private static boolean parseBoolean(String key, String value) {
        String v = value.trim();
        if (v.equalsIgnoreCase("true")) return true;
        if (v.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException("Invalid boolean value " + value +
            " for " + key);
    }

}
