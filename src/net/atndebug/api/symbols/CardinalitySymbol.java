package net.atndebug.api.symbols;

/**
 * An EBNF suffix applied to the preceding element.
 */
public interface CardinalitySymbol extends Symbol {

    enum Cardinality {
        OPTIONAL,
        ZERO_OR_MORE,
        ONE_OR_MORE;

        public boolean isSkippable() {
            return (this != ONE_OR_MORE);
        }
    }

    Cardinality getCardinality();

}
