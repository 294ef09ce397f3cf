package net.normalform.util.grammar;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import net.normalform.api.grammar.Grammar;
import net.normalform.api.grammar.GrammarView;
import net.normalform.api.grammar.InvalidGrammarException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Conversion between grammars and JSON documents.
 * A document looks like
 * <pre>
 * {"start": "S", "nonterminals": ["S", "A"], "terminals": ["a"],
 *  "productions": {"S": [["a", "A"], []], "A": [["a"]]}}
 * </pre>
 * where every production body is an array of symbol names and the empty
 * array stands for the empty string. Names are classified as terminals or
 * non-terminals according to the declared sets.
 */
public final class GrammarJson {

    public static final String KEY_START = "start";
    public static final String KEY_NONTERMINALS = "nonterminals";
    public static final String KEY_TERMINALS = "terminals";
    public static final String KEY_PRODUCTIONS = "productions";

    // Prevent construction.
    private GrammarJson() {}

    public static JSONObject toJSON(GrammarView g) {
        JSONObject ret = new JSONObject();
        if (g.getStartSymbol() != null)
            ret.put(KEY_START, g.getStartSymbol().getName());
        ret.put(KEY_NONTERMINALS, names(g.getNonterminals()));
        ret.put(KEY_TERMINALS, names(g.getTerminals()));
        JSONObject prods = new JSONObject();
        for (String name : g.getProductionNames()) {
            JSONArray bodies = new JSONArray();
            for (Grammar.Production p : g.getProductions(name)) {
                bodies.put(names(p.getSymbols()));
            }
            prods.put(name, bodies);
        }
        ret.put(KEY_PRODUCTIONS, prods);
        return ret;
    }

    /**
     * Construct a grammar from the given document and validate it.
     */
    public static GrammarImpl fromJSON(JSONObject doc)
            throws InvalidGrammarException {
        GrammarImpl ret = new GrammarImpl();
        try {
            JSONArray nts = doc.getJSONArray(KEY_NONTERMINALS);
            for (int i = 0; i < nts.length(); i++) {
                ret.addNonterminal(ret.createNonterminal(nts.getString(i)));
            }
            JSONArray ts = doc.getJSONArray(KEY_TERMINALS);
            for (int i = 0; i < ts.length(); i++) {
                ret.addTerminal(ret.createTerminal(ts.getString(i)));
            }
            String start = doc.getString(KEY_START);
            if (! (ret.resolve(start) instanceof Grammar.NonterminalSymbol))
                throw new InvalidGrammarException("Start symbol " + start +
                    " is not a declared non-terminal");
            ret.setStartSymbol(ret.createNonterminal(start));
            JSONObject prods = (doc.has(KEY_PRODUCTIONS)) ?
                doc.getJSONObject(KEY_PRODUCTIONS) : new JSONObject();
            Iterator<String> keys = prods.keys();
            while (keys.hasNext()) {
                String k = keys.next();
                if (! (ret.resolve(k) instanceof Grammar.NonterminalSymbol))
                    throw new InvalidGrammarException("Productions for " +
                        "undeclared non-terminal " + k);
            }
            // Follow declaration order rather than the (unordered) keys.
            for (Grammar.NonterminalSymbol nt : ret.getNonterminals()) {
                if (! prods.has(nt.getName())) continue;
                JSONArray bodies = prods.getJSONArray(nt.getName());
                ret.ensureProductions(nt.getName());
                for (int i = 0; i < bodies.length(); i++) {
                    ret.addProduction(ret.createProduction(nt.getName(),
                        readBody(ret, bodies.getJSONArray(i))));
                }
            }
        } catch (JSONException exc) {
            throw new InvalidGrammarException("Malformed grammar document: " +
                exc.getMessage(), exc);
        } catch (IllegalArgumentException exc) {
            throw new InvalidGrammarException("Malformed grammar document: " +
                exc.getMessage(), exc);
        }
        ret.validate();
        return ret;
    }

    /**
     * Parse text holding exactly one JSON object and convert it as
     * fromJSON() does.
     */
    public static GrammarImpl parse(String text)
            throws InvalidGrammarException {
        Object value;
        try {
            JSONTokener tok = new JSONTokener(text);
            value = tok.nextValue();
            if (tok.nextClean() != 0)
                throw tok.syntaxError("Unexpected garbage after JSON value");
        } catch (JSONException exc) {
            throw new InvalidGrammarException("Malformed grammar document: " +
                exc.getMessage(), exc);
        }
        if (! (value instanceof JSONObject))
            throw new InvalidGrammarException("Grammar document must be a " +
                "JSON object");
        return fromJSON((JSONObject) value);
    }

    private static List<Grammar.Symbol> readBody(GrammarImpl g,
            JSONArray body) throws InvalidGrammarException {
        List<Grammar.Symbol> ret = new ArrayList<Grammar.Symbol>();
        for (int i = 0; i < body.length(); i++) {
            String name = body.getString(i);
            Grammar.Symbol sym = g.resolve(name);
            if (sym == null)
                throw new InvalidGrammarException("Undeclared symbol " +
                    name + " in production body");
            ret.add(sym);
        }
        return ret;
    }

    private static JSONArray names(Iterable<? extends Grammar.Symbol> syms) {
        JSONArray ret = new JSONArray();
        for (Grammar.Symbol s : syms) ret.put(s.getName());
        return ret;
    }

}
