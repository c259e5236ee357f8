package net.atndebug.debug;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.atndebug.api.symbols.LexicalRange;
import net.atndebug.atn.ATNException;
import net.atndebug.atn.TestGrammars;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;

import static net.atndebug.debug.TestSymbols.*;
import static org.junit.Assert.*;

public class DebuggerTest {

    private EventQueue events;
    private TestSymbols symbols;

    @Before
    public void setUp() {
        events = new EventQueue();
        symbols = new TestSymbols("Test.g4");
    }

    /* a : B C ; */
    private Debugger sequenceDebugger() throws ATNException {
        symbols.rule("a", 1, 1, alt(term("B", TestGrammars.B, 1, 4),
                                    term("C", TestGrammars.C, 1, 6)));
        return new Debugger(symbols, symbols, "Test.g4",
            TestGrammars.bcLexerData(),
            TestGrammars.parserData(TestGrammars.sequenceParser(),
                                    Arrays.asList("a")),
            events);
    }

    /* s : a b ; a : B ; b :\n\n C ; */
    private Debugger callingDebugger() throws ATNException {
        symbols.rule("s", 1, 1, alt(ref("a", 1, 4), ref("b", 1, 6)));
        symbols.rule("a", 2, 2, alt(term("B", TestGrammars.B, 2, 4)));
        symbols.rule("b", 3, 5, alt(term("C", TestGrammars.C, 5, 1)));
        return new Debugger(symbols, symbols, "Test.g4",
            TestGrammars.bcLexerData(),
            TestGrammars.parserData(TestGrammars.callingParser(),
                                    TestGrammars.callingRuleNames()),
            events);
    }

    private List<DebuggerEvent.Type> drainTypes() {
        List<DebuggerEvent.Type> ret = new ArrayList<DebuggerEvent.Type>();
        for (DebuggerEvent e : events.drainEvents()) ret.add(e.getType());
        return ret;
    }

    private List<DebuggerEvent> drainOutput() {
        List<DebuggerEvent> ret = new ArrayList<DebuggerEvent>();
        for (DebuggerEvent e : events.drainEvents()) {
            if (e.getType() == DebuggerEvent.Type.OUTPUT) ret.add(e);
        }
        return ret;
    }

    private static List<DebuggerEvent.Type> types(
            DebuggerEvent.Type... items) {
        return Arrays.asList(items);
    }

    private List<String> stackNames(Debugger dbg) {
        List<String> ret = new ArrayList<String>();
        for (StackFrame f : dbg.getCurrentStackTrace()) ret.add(f.getName());
        return ret;
    }

    @Test
    public void testStepThroughSequence() throws ATNException {
        Debugger dbg = sequenceDebugger();
        assertTrue(dbg.isValid());
        dbg.start(0, "BC", true);
        assertEquals(types(DebuggerEvent.Type.STOP_ON_STEP), drainTypes());
        assertTrue(dbg.getCurrentStackTrace().isEmpty());

        dbg.stepIn();
        assertEquals(types(DebuggerEvent.Type.STOP_ON_STEP), drainTypes());
        List<StackFrame> stack = dbg.getCurrentStackTrace();
        assertEquals(1, stack.size());
        assertEquals("a", stack.get(0).getName());
        assertEquals("Test.g4", stack.get(0).getSource());
        assertEquals(Arrays.asList(symbols.resolve("a").getRange()),
                     stack.get(0).getNext());

        dbg.stepIn();
        assertEquals(types(DebuggerEvent.Type.STOP_ON_STEP), drainTypes());
        assertEquals(Arrays.asList(new LexicalRange(1, 4, 1, 5)),
                     dbg.getCurrentStackTrace().get(0).getNext());
        assertEquals(1, dbg.getCurrentTokenIndex());

        dbg.stepIn();
        assertEquals(types(DebuggerEvent.Type.STOP_ON_STEP), drainTypes());
        assertEquals(Arrays.asList(new LexicalRange(1, 6, 1, 7)),
                     dbg.getCurrentStackTrace().get(0).getNext());

        dbg.resume();
        assertEquals(types(DebuggerEvent.Type.END), drainTypes());
        ParseTreeNode tree = dbg.getCurrentParseTree();
        assertEquals(ParseTreeNode.Type.RULE, tree.getType());
        assertEquals("a", tree.getName());
        assertEquals(0, tree.getRuleIndex());
        assertEquals(2, tree.getChildren().size());
        assertEquals("B", tree.getChildren().get(0).getName());
        assertEquals("C", tree.getStop().getText());

        // Stepping a finished parse does nothing.
        dbg.stepIn();
        assertTrue(events.isEmpty());
    }

    @Test
    public void testRunToEnd() throws ATNException {
        Debugger dbg = sequenceDebugger();
        dbg.start(0, "BC");
        assertEquals(types(DebuggerEvent.Type.END), drainTypes());
        JSONObject json = dbg.getCurrentParseTree().toJSON();
        assertEquals("rule", json.getString("type"));
        assertEquals(2, json.getJSONArray("children").length());
        assertEquals("terminal", json.getJSONArray("children")
                     .getJSONObject(1).getString("type"));
    }

    @Test
    public void testStepOverRuleCall() throws ATNException {
        Debugger dbg = callingDebugger();
        dbg.start(0, "BC", true);
        dbg.stepIn();
        // Now at the entry of a, called from s.
        assertEquals(Arrays.asList("s"), stackNames(dbg));
        assertEquals(0, dbg.getCurrentTokenIndex());
        events.drainEvents();

        dbg.stepOver();
        assertEquals(types(DebuggerEvent.Type.STOP_ON_STEP), drainTypes());
        assertEquals(Arrays.asList("s"), stackNames(dbg));
        assertEquals(1, dbg.getCurrentTokenIndex());
    }

    @Test
    public void testStepInStopsAtCalledRuleStart() throws ATNException {
        Debugger dbg = callingDebugger();
        dbg.start(0, "BC", true);
        dbg.stepIn();
        dbg.stepIn();
        assertEquals(Arrays.asList("a", "s"), stackNames(dbg));
        events.drainEvents();

        // Leaving a does not stop at its end; the next stop is b's entry.
        dbg.stepIn();
        assertEquals(types(DebuggerEvent.Type.STOP_ON_STEP), drainTypes());
        assertEquals(Arrays.asList("s"), stackNames(dbg));
        assertEquals(1, dbg.getCurrentTokenIndex());
        assertEquals(Arrays.asList(new LexicalRange(1, 6, 1, 7)),
                     dbg.getCurrentStackTrace().get(0).getNext());

        dbg.stepIn();
        assertEquals(Arrays.asList("b", "s"), stackNames(dbg));
        // The end of the start rule is the one rule end that stops.
        dbg.stepIn();
        assertEquals(types(DebuggerEvent.Type.STOP_ON_STEP,
                           DebuggerEvent.Type.STOP_ON_STEP), drainTypes());
        assertEquals(Arrays.asList("s"), stackNames(dbg));
        assertEquals(2, dbg.getCurrentTokenIndex());

        dbg.stepIn();
        assertEquals(types(DebuggerEvent.Type.END), drainTypes());
        assertEquals(2, dbg.getCurrentParseTree().getChildren().size());
    }

    @Test
    public void testStepOut() throws ATNException {
        Debugger dbg = callingDebugger();
        dbg.start(0, "BC", true);
        dbg.stepIn();
        dbg.stepIn();
        assertEquals(Arrays.asList("a", "s"), stackNames(dbg));
        events.drainEvents();

        dbg.stepOut();
        assertEquals(types(DebuggerEvent.Type.STOP_ON_STEP), drainTypes());
        assertEquals(Arrays.asList("s"), stackNames(dbg));
        assertEquals(1, dbg.getCurrentTokenIndex());

        dbg.resume();
        assertEquals(types(DebuggerEvent.Type.END), drainTypes());
    }

    @Test
    public void testBreakPoints() throws ATNException {
        Debugger dbg = callingDebugger();
        BreakPoint atA = dbg.addBreakPoint("Test.g4", 2);
        BreakPoint inB = dbg.addBreakPoint("Test.g4", 3);
        BreakPoint inside = dbg.addBreakPoint("Test.g4", 4);
        assertTrue(atA.isValidated());
        assertEquals(5, atA.getBoundState());
        assertEquals(9, inB.getBoundState());
        assertFalse(inside.isValidated());
        assertEquals(-1, inside.getBoundState());
        assertEquals(3, dbg.getBreakPoints().size());
        List<DebuggerEvent> validated = events.drainEvents();
        assertEquals(2, validated.size());
        assertSame(atA, validated.get(0).getBreakPoint());
        assertSame(inB, validated.get(1).getBreakPoint());

        dbg.start(0, "BC");
        assertEquals(types(DebuggerEvent.Type.BREAKPOINT_VALIDATED,
                           DebuggerEvent.Type.BREAKPOINT_VALIDATED,
                           DebuggerEvent.Type.STOP_ON_BREAKPOINT),
                     drainTypes());
        assertEquals(Arrays.asList("a", "s"), stackNames(dbg));

        dbg.resume();
        assertEquals(types(DebuggerEvent.Type.STOP_ON_BREAKPOINT),
                     drainTypes());
        assertEquals(Arrays.asList("b", "s"), stackNames(dbg));

        dbg.resume();
        assertEquals(types(DebuggerEvent.Type.END), drainTypes());

        dbg.clearBreakPoints();
        assertTrue(dbg.getBreakPoints().isEmpty());
        assertFalse(atA.isValidated());
        dbg.start(0, "BC");
        assertEquals(types(DebuggerEvent.Type.END), drainTypes());
    }

    @Test
    public void testParserError() throws ATNException {
        Debugger dbg = callingDebugger();
        dbg.start(0, "CC");
        List<DebuggerEvent> all = events.drainEvents();
        assertEquals(2, all.size());
        DebuggerEvent out = all.get(0);
        assertEquals(DebuggerEvent.Type.OUTPUT, out.getType());
        // The missing B is conjured up and parsing goes on with b.
        assertEquals("Parser error (1, 1): missing 'B' at 'C'",
                     out.getMessage());
        assertEquals("Test.g4", out.getSource());
        assertEquals(1, out.getLine());
        assertEquals(0, out.getColumn());
        assertTrue(out.isError());
        assertEquals(DebuggerEvent.Type.END, all.get(1).getType());
    }

    @Test
    public void testLexerError() throws ATNException {
        Debugger dbg = sequenceDebugger();
        dbg.start(0, "BXC");
        List<DebuggerEvent> output = drainOutput();
        assertEquals(1, output.size());
        assertEquals("Lexer error (1, 2): token recognition error at: 'X'",
                     output.get(0).getMessage());
        assertEquals(1, output.get(0).getColumn());
    }

    @Test
    public void testLexerOnly() throws ATNException {
        Debugger dbg = new Debugger(null, null, "Test.g4",
            TestGrammars.bcLexerData(), null, events);
        assertFalse(dbg.isValid());
        dbg.start(0, "B C");
        assertEquals(types(DebuggerEvent.Type.END), drainTypes());

        List<LexerToken> tokens = dbg.getTokenList();
        assertEquals(3, tokens.size());
        assertEquals("B", tokens.get(0).getName());
        assertEquals("C", tokens.get(1).getName());
        assertEquals(2, tokens.get(1).getOffset());
        assertEquals(1, tokens.get(1).getTokenIndex());
        assertEquals("EOF", tokens.get(2).getName());

        List<String[]> lexerSymbols = dbg.getLexerSymbols();
        assertEquals(4, lexerSymbols.size());
        assertArrayEquals(new String[] { "'C'", "C" }, lexerSymbols.get(2));
        assertTrue(dbg.getParserSymbols().isEmpty());
        assertEquals(Arrays.asList("DEFAULT_MODE"), dbg.getModes());
        assertEquals(2, dbg.getChannels().size());
        assertNull(dbg.getCurrentParseTree());
        assertTrue(dbg.getCurrentStackTrace().isEmpty());
        assertNull(dbg.ruleNameFromIndex(0));
        assertEquals(-1, dbg.ruleIndexFromName("a"));

        // Breakpoints cannot be validated without a parser.
        assertFalse(dbg.addBreakPoint("Test.g4", 1).isValidated());
        assertTrue(events.isEmpty());
    }

    @Test
    public void testRuleNames() throws ATNException {
        Debugger dbg = callingDebugger();
        assertEquals("Test.g4", dbg.getMainGrammarName());
        assertEquals(TestGrammars.callingRuleNames(), dbg.getParserSymbols());
        assertEquals("a", dbg.ruleNameFromIndex(1));
        assertNull(dbg.ruleNameFromIndex(3));
        assertEquals(2, dbg.ruleIndexFromName("b"));
        assertEquals(-1, dbg.ruleIndexFromName("x"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidStartRule() throws ATNException {
        callingDebugger().start(3, "BC");
    }

    @Test
    public void testPauseAndStopAreNoOps() throws ATNException {
        Debugger dbg = sequenceDebugger();
        dbg.start(0, "BC", true);
        events.drainEvents();
        dbg.pause();
        dbg.stop();
        assertTrue(events.isEmpty());
        dbg.resume();
        assertEquals(types(DebuggerEvent.Type.END), drainTypes());
    }

    @Test(expected = IllegalStateException.class)
    public void testResumeBeforeStart() throws ATNException {
        callingDebugger().stepIn();
    }

    @Test
    public void testWithoutSymbols() throws ATNException {
        Debugger dbg = new Debugger(null, null, "Test.g4",
            TestGrammars.bcLexerData(),
            TestGrammars.parserData(TestGrammars.callingParser(),
                                    TestGrammars.callingRuleNames()),
            events);
        dbg.start(0, "BC", true);
        dbg.stepIn();
        dbg.stepIn();
        List<StackFrame> stack = dbg.getCurrentStackTrace();
        assertEquals(Arrays.asList("a", "s"), stackNames(dbg));
        assertNull(stack.get(0).getSource());
        assertTrue(stack.get(0).getNext().isEmpty());
        assertEquals("a", stack.get(0).toJSON().getString("name"));
        events.drainEvents();
        dbg.resume();
        assertEquals(types(DebuggerEvent.Type.END), drainTypes());
    }

}
