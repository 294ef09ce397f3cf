package net.normalform.util.grammar;

import net.normalform.api.grammar.Grammar;

public class Terminal extends AbstractSymbol
        implements Grammar.TerminalSymbol {

    /* Keeps a terminal and a same-named non-terminal apart in hash
     * tables. */
    private static final int KIND_SALT = 0x5F3759DF;

    public Terminal(String name) {
        super(name);
    }

    protected boolean matches(AbstractSymbol other) {
        return ((other instanceof Terminal) &&
                getName().equals(other.getName()));
    }

    protected int hashCodeBase() {
        return getName().hashCode() ^ KIND_SALT;
    }

}
