package net.normalform.api;

/**
 * An object that can be filed under a textual name.
 * Productions are NamedValue-s whose name is their left-hand side, so that
 * all alternatives of a non-terminal can be grouped together.
 */
public interface NamedValue {

    /**
     * The name of this object.
     */
    String getName();

}
