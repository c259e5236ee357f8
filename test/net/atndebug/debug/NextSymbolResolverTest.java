package net.atndebug.debug;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.atndebug.api.symbols.CardinalitySymbol.Cardinality;
import net.atndebug.api.symbols.Symbol;
import net.atndebug.atn.ATNException;
import net.atndebug.atn.TestGrammars;
import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.runtime.atn.Transition;
import org.junit.Before;
import org.junit.Test;

import static net.atndebug.debug.TestSymbols.*;
import static org.junit.Assert.*;

public class NextSymbolResolverTest {

    private TestSymbols symbols;
    private Rule r;
    private Term a, b, c, d, e;
    private NextSymbolResolver resolver;
    private ATN atn;

    @Before
    public void setUp() throws ATNException {
        // r : A (B | C)? D E+ ;
        symbols = new TestSymbols("Test.g4");
        a = term("A", 4, 1, 4);
        b = term("B", TestGrammars.B, 1, 7);
        c = term("C", TestGrammars.C, 1, 11);
        d = term("D", 5, 1, 15);
        e = term("E", 6, 1, 17);
        r = symbols.rule("r", 1, 1, alt(a, block(alt(b), alt(c)),
            card(Cardinality.OPTIONAL, 1, 13), d, e,
            card(Cardinality.ONE_OR_MORE, 1, 18)));
        symbols.rule("s", 2, 2, alt(ref("a", 2, 4), ref("b", 2, 6)));
        atn = TestGrammars.load(TestGrammars.callingParser());
        resolver = new NextSymbolResolver(atn,
                                          TestGrammars.callingRuleNames());
    }

    private static List<Symbol> list(Symbol... items) {
        return Arrays.asList(items);
    }

    @Test
    public void testRuleEntry() {
        assertEquals(list(a), resolver.nextCandidates(r));
    }

    @Test
    public void testOptionalBlock() {
        assertEquals(list(b, c, d), resolver.nextCandidates(a));
        // Leaving an alternative of the block continues after the suffix.
        assertEquals(list(d), resolver.nextCandidates(b));
        assertEquals(list(d), resolver.nextCandidates(c));
    }

    @Test
    public void testRepetition() {
        assertEquals(list(e), resolver.nextCandidates(d));
        // The end of the rule; only the repetition remains.
        assertEquals(list(e), resolver.nextCandidates(e));
    }

    @Test
    public void testNothingFromNull() {
        assertTrue(resolver.nextCandidates(null).isEmpty());
    }

    @Test
    public void testComputeNextForTokens() {
        Transition matchB = atn.states.get(7).transition(0);
        assertEquals(list(b), resolver.computeNext(list(a), matchB));
        Transition matchC = atn.states.get(11).transition(0);
        assertEquals(list(c), resolver.computeNext(list(a), matchC));
        assertTrue(resolver.computeNext(list(d), matchB).isEmpty());
        assertTrue(resolver.computeNext(Collections.<Symbol>emptyList(),
                                        matchB).isEmpty());
    }

    @Test
    public void testComputeNextForRuleCalls() {
        Symbol s = symbols.resolve("s");
        List<Symbol> refs = ((Scope) ((Scope) s).getChildren().get(0))
            .getChildren();
        Transition callA = atn.states.get(2).transition(0);
        assertEquals(Transition.RULE, callA.getSerializationType());
        assertEquals(list(refs.get(0)), resolver.computeNext(list(s), callA));
        Transition callB = atn.states.get(3).transition(0);
        assertEquals(list(refs.get(1)),
                     resolver.computeNext(list(refs.get(0)), callB));
        // Token references never match a rule call.
        assertTrue(resolver.computeNext(list(r), callA).isEmpty());
    }

}
