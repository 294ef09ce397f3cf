package net.normalform.api.grammar;

/**
 * Generic superclass for checked grammar module exceptions.
 */
public class GrammarException extends Exception {

    public GrammarException() {
        super();
    }
    public GrammarException(String message) {
        super(message);
    }
    public GrammarException(Throwable cause) {
        super(cause);
    }
    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }

}
