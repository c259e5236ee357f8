package net.atndebug.api.symbols;

/**
 * The lookup service the debugger consults for rule declarations.
 */
public interface SymbolTable {

    /**
     * Find the rule declared under the given name, searching imported
     * grammars as well; null if there is none.
     */
    RuleSymbol resolve(String name);

    String getSourceName();

}
