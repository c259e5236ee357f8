package net.atndebug.atn;

import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.runtime.atn.ATNState;
import org.antlr.v4.runtime.atn.ATNType;
import org.antlr.v4.runtime.atn.RuleTransition;
import org.antlr.v4.runtime.atn.Transition;
import org.junit.Test;

import static net.atndebug.atn.SerializedATNBuilder.*;
import static org.junit.Assert.*;

public class ATNOptimizerTest {

    private static final DeserializationOptions RAW =
        new DeserializationOptions(true, false, false);

    private static SerializedATNBuilder alternatives(ATNType type) {
        // X : ('a' | 'b' | 'c') ; in either kind of grammar.
        SerializedATNBuilder b = new SerializedATNBuilder(type, 1);
        int ts = (type == ATNType.LEXER) ? b.state(TOKEN_START, -1) : -1;
        int start = b.state(RULE_START, 0);
        int stop = b.state(RULE_STOP, 0);
        int block = b.state(BLOCK_START, 0, start + 3);
        int end = b.state(BLOCK_END, 0);
        b.epsilon(start, block);
        for (char c = 'a'; c <= 'c'; c++) {
            int alt = b.state(BASIC, 0);
            b.epsilon(block, alt).atom(alt, end, c);
        }
        b.epsilon(end, stop);
        if (ts != -1) {
            b.epsilon(ts, start).lexerRule(start, 1).mode(ts).decision(ts);
        } else {
            b.rule(start);
        }
        b.decision(block);
        return b;
    }

    @Test
    public void testInlineSetRules() throws ATNException {
        ATN atn = TestGrammars.load(TestGrammars.callingParser(), RAW);
        ATNOptimizer opt = new ATNOptimizer(atn);
        assertSame(atn, opt.getATN());
        assertEquals(2, opt.inlineSetRules());
        assertEquals(15, atn.states.size());

        ATNState caller = atn.states.get(2);
        assertTrue(caller.isOptimized());
        assertEquals(1, caller.getNumberOfOptimizedTransitions());
        Transition eps = caller.getOptimizedTransition(0);
        assertEquals(Transition.EPSILON, eps.getSerializationType());
        ATNState inlined = eps.target;
        assertEquals(ATNState.BASIC, inlined.getStateType());
        assertEquals(0, inlined.ruleIndex);
        assertEquals(Transition.ATOM,
                     inlined.transition(0).getSerializationType());
        assertTrue(inlined.transition(0).label().contains(
            TestGrammars.B));
        assertEquals(3, inlined.transition(0).target.stateNumber);

        // The original edges stay in place.
        assertEquals(Transition.RULE,
                     caller.transition(0).getSerializationType());
        assertEquals(1, caller.getNumberOfTransitions());
    }

    @Test
    public void testInlineSkipsMultiTokenRules() throws ATNException {
        // x : y ; y : B C ;
        SerializedATNBuilder b = tailCallGrammar(false);
        ATN atn = TestGrammars.load(b, RAW);
        assertEquals(0, new ATNOptimizer(atn).inlineSetRules());
        assertFalse(atn.states.get(2).isOptimized());
    }

    @Test
    public void testCombineChainedEpsilons() throws ATNException {
        ATN atn = TestGrammars.load(TestGrammars.callingParser(), RAW);
        ATNOptimizer opt = new ATNOptimizer(atn);
        opt.inlineSetRules();
        assertEquals(1, opt.combineChainedEpsilons());
        // The rule start now skips the caller state.
        ATNState start = atn.ruleToStartState[0];
        assertEquals(1, start.getNumberOfOptimizedTransitions());
        assertEquals(13,
                     start.getOptimizedTransition(0).target.stateNumber);
        assertEquals(2, start.transition(0).target.stateNumber);
        assertEquals(0, opt.combineChainedEpsilons());
    }

    @Test
    public void testCombineStopsAtSelfLoop() throws ATNException {
        SerializedATNBuilder b = new SerializedATNBuilder(ATNType.PARSER, 1);
        int start = b.state(RULE_START, 0);
        int stop = b.state(RULE_STOP, 0);
        int loop = b.state(BASIC, 0);
        b.epsilon(start, loop).epsilon(loop, loop).rule(start);
        ATN atn = TestGrammars.load(b, RAW);
        assertEquals(1, stop);
        ATNOptimizer opt = new ATNOptimizer(atn);
        assertEquals(0, opt.combineChainedEpsilons());
        assertEquals(0, opt.optimize());
    }

    @Test
    public void testOptimizeSets() throws ATNException {
        ATN atn = TestGrammars.load(TestGrammars.choiceParser(), RAW);
        assertEquals(1, new ATNOptimizer(atn).optimizeSets(false));
        ATNState decision = atn.states.get(2);
        assertEquals(3, decision.getNumberOfTransitions());
        assertEquals(2, decision.getNumberOfOptimizedTransitions());
        // The alternative that was not a single match comes first.
        assertEquals(6,
            decision.getOptimizedTransition(0).target.stateNumber);
        ATNState collapsed = decision.getOptimizedTransition(1).target;
        Transition t = collapsed.transition(0);
        assertEquals(Transition.RANGE, t.getSerializationType());
        assertEquals(3, t.target.stateNumber);
        assertTrue(t.label().contains(TestGrammars.B));
        assertTrue(t.label().contains(TestGrammars.C));
    }

    @Test
    public void testOptimizeSetsMergesIntoSet() throws ATNException {
        SerializedATNBuilder b = new SerializedATNBuilder(ATNType.PARSER, 5);
        int start = b.state(RULE_START, 0);
        int stop = b.state(RULE_STOP, 0);
        int block = b.state(BLOCK_START, 0, 3);
        int end = b.state(BLOCK_END, 0);
        int alt1 = b.state(BASIC, 0);
        int alt2 = b.state(BASIC, 0);
        b.epsilon(start, block).epsilon(block, alt1).epsilon(block, alt2)
         .atom(alt1, end, 1).range(alt2, end, 4, 5).epsilon(end, stop)
         .rule(start).decision(block);
        ATN atn = TestGrammars.load(b, RAW);
        assertEquals(1, new ATNOptimizer(atn).optimizeSets(false));
        ATNState decision = atn.states.get(block);
        assertEquals(1, decision.getNumberOfOptimizedTransitions());
        Transition t = decision.getOptimizedTransition(0).target
                               .transition(0);
        assertEquals(Transition.SET, t.getSerializationType());
        assertEquals(3, t.label().size());
        assertFalse(t.label().contains(2));
    }

    @Test
    public void testLexerKeepsAlternativeOrder() throws ATNException {
        ATN lexer = TestGrammars.load(alternatives(ATNType.LEXER), RAW);
        int nstates = lexer.states.size();
        assertEquals(0, new ATNOptimizer(lexer).optimize());
        assertEquals(nstates, lexer.states.size());
        ATNState block = lexer.getDecisionState(1);
        assertFalse(block.isOptimized());
        assertEquals(3, block.getNumberOfOptimizedTransitions());

        ATN parser = TestGrammars.load(alternatives(ATNType.PARSER), RAW);
        assertEquals(2, new ATNOptimizer(parser).optimize());
        assertEquals(1, parser.getDecisionState(0)
                              .getNumberOfOptimizedTransitions());
    }

    @Test
    public void testOptimizeReachesFixpoint() throws ATNException {
        ATN atn = TestGrammars.load(TestGrammars.callingParser(), RAW);
        assertEquals(3, new ATNOptimizer(atn).optimize());
        assertEquals(0, new ATNOptimizer(atn).optimize());

        SerializedATNBuilder[] grammars = {
            TestGrammars.choiceParser(), TestGrammars.precedenceParser(),
            TestGrammars.bcLexer(), tailCallGrammar(true)
        };
        for (SerializedATNBuilder b : grammars) {
            ATN loaded = TestGrammars.load(b);
            assertEquals(0, new ATNOptimizer(loaded).optimize());
        }
    }

    @Test
    public void testPrecedenceRuleUntouched() throws ATNException {
        ATN atn = TestGrammars.load(TestGrammars.precedenceParser(), RAW);
        assertEquals(0, new ATNOptimizer(atn).optimize());
        assertEquals(12, atn.states.size());
    }

    @Test
    public void testTailCalls() throws ATNException {
        ATN tail = TestGrammars.load(tailCallGrammar(false));
        RuleTransition rt =
            (RuleTransition) tail.states.get(2).transition(0);
        assertTrue(rt.tailCall);
        assertTrue(rt.optimizedTailCall);

        ATN notTail = TestGrammars.load(tailCallGrammar(true));
        rt = (RuleTransition) notTail.states.get(2).transition(0);
        assertFalse(rt.tailCall);
        assertFalse(rt.optimizedTailCall);
    }

    /**
     * x : y ; or x : y B ; with y : B C ;
     */
    private static SerializedATNBuilder tailCallGrammar(boolean trailing) {
        SerializedATNBuilder b = new SerializedATNBuilder(ATNType.PARSER, 2);
        int xStart = b.state(RULE_START, 0);
        int xStop = b.state(RULE_STOP, 0);
        int x1 = b.state(BASIC, 0);
        int x2 = b.state(BASIC, 0);
        int yStart = b.state(RULE_START, 1);
        int yStop = b.state(RULE_STOP, 1);
        int y1 = b.state(BASIC, 1);
        int y2 = b.state(BASIC, 1);
        int y3 = b.state(BASIC, 1);
        b.epsilon(xStart, x1).call(x1, yStart, 1, 0, x2);
        if (trailing) {
            int x3 = b.state(BASIC, 0);
            b.atom(x2, x3, TestGrammars.B).epsilon(x3, xStop);
        } else {
            b.epsilon(x2, xStop);
        }
        b.epsilon(yStart, y1).atom(y1, y2, TestGrammars.B)
         .atom(y2, y3, TestGrammars.C).epsilon(y3, yStop);
        b.rule(xStart).rule(yStart);
        return b;
    }

}
