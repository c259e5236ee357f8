package net.atndebug.api.symbols;

/**
 * One alternative of a rule or block; its children are the elements of
 * the alternative, in sequence.
 * Scoped symbols that are not alternatives are choices between their
 * children.
 */
public interface AlternativeSymbol extends ScopedSymbol {}
