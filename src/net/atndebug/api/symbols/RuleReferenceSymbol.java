package net.atndebug.api.symbols;

/**
 * A use of a parser rule within an alternative.
 * getName() returns the name of the referenced rule.
 */
public interface RuleReferenceSymbol extends Symbol {}
