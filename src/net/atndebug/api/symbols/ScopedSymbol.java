package net.atndebug.api.symbols;

import java.util.List;

/**
 * A symbol grouping other symbols, such as a block of alternatives or a
 * single alternative.
 */
public interface ScopedSymbol extends Symbol {

    List<Symbol> getChildren();

}
