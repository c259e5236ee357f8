package net.atndebug.api.symbols;

/**
 * A use of a token (by name or by literal) within an alternative.
 */
public interface TerminalReferenceSymbol extends Symbol {

    int getTokenType();

}
