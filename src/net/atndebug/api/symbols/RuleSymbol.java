package net.atndebug.api.symbols;

/**
 * The declaration of a parser or lexer rule.
 * The children of a rule symbol are its alternatives
 * (AlternativeSymbol instances).
 */
public interface RuleSymbol extends ScopedSymbol {

    /**
     * The symbol table the rule was declared in. This need not be the
     * table the debugger was created with, as grammars may import others.
     */
    SymbolTable getSymbolTable();

}
