package net.normalform.cnf;

import net.normalform.api.grammar.Grammar;
import net.normalform.api.grammar.GrammarView;

/**
 * A structural rewrite of a grammar.
 * Implementations never modify their input; the returned grammar shares no
 * mutable state with it, so that callers may compare the two.
 */
public interface GrammarTransform {

    /**
     * Return a transformed copy of input.
     */
    Grammar apply(GrammarView input);

}
