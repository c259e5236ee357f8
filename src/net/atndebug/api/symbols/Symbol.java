package net.atndebug.api.symbols;

import net.atndebug.api.NamedValue;

/**
 * An entry of an external grammar symbol table.
 * Symbols form a tree mirroring the grammar source: rules contain
 * alternatives, alternatives contain sequences of references and nested
 * blocks (which in turn contain alternatives), and cardinality suffixes
 * (?, *, +) appear as symbols of their own placed right after the element
 * they apply to.
 * The debugger only ever reads symbols.
 */
public interface Symbol extends NamedValue {

    /**
     * The symbol that follows this one in reading order.
     * Nested symbols are not descended into: the successor of a block is
     * whatever follows the whole block. For the last element of an
     * alternative, this is the first symbol after the enclosing block;
     * null if nothing follows within the rule.
     */
    Symbol getNext();

    Symbol getNextSibling();

    LexicalRange getRange();

}
