package net.atndebug.debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import net.atndebug.api.symbols.LexicalRange;
import net.atndebug.api.symbols.RuleLocator;
import net.atndebug.api.symbols.Symbol;
import net.atndebug.api.symbols.SymbolTable;
import net.atndebug.data.InterpreterData;
import org.antlr.v4.runtime.ANTLRErrorListener;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.LexerInterpreter;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.atn.ATN;

/**
 * A debugging session for one grammar.
 * The session tokenizes the input with the lexer grammar and steps
 * through it with the parser grammar, reporting its progress as events
 * posted to an EventQueue. All step calls run synchronously; the host
 * delivers the events afterwards.
 * Breakpoints are set on source lines and become effective once they are
 * found to coincide with the first line of a rule.
 */
public class Debugger {

    private static final Logger LOGGER = Logger.getLogger("Debugger");

    private final RuleLocator locator;
    private final String mainGrammarName;
    private final InterpreterData lexerData;
    private final InterpreterData parserData;
    private final EventQueue events;
    private final LexerInterpreter lexer;
    private final CommonTokenStream tokenStream;
    private final SteppingInterpreter parser;
    private final Map<Integer, BreakPoint> breakPoints;
    private int nextBreakPointId;

    public Debugger(SymbolTable symbolTable, RuleLocator locator,
                    String mainGrammarName, InterpreterData lexerData,
                    InterpreterData parserData, EventQueue events) {
        if (lexerData == null)
            throw new NullPointerException("Lexer data may not be null");
        if (events == null)
            throw new NullPointerException("Event queue may not be null");
        this.locator = locator;
        this.mainGrammarName = mainGrammarName;
        this.lexerData = lexerData;
        this.parserData = parserData;
        this.events = events;
        this.breakPoints = new LinkedHashMap<Integer, BreakPoint>();
        this.lexer = new LexerInterpreter(mainGrammarName,
            lexerData.getVocabulary(), lexerData.getRuleNames(),
            lexerData.getChannels(), lexerData.getModes(),
            lexerData.getATN(), CharStreams.fromString("", mainGrammarName));
        this.tokenStream = new CommonTokenStream(lexer);
        this.lexer.removeErrorListeners();
        this.lexer.addErrorListener(new ANTLRErrorListener<Integer>() {
            public <T extends Integer> void syntaxError(
                    Recognizer<T, ?> recognizer, T offendingSymbol,
                    int line, int charPositionInLine, String message,
                    RecognitionException e) {
                reportError("Lexer", line, charPositionInLine, message);
            }
        });
        if (parserData == null) {
            this.parser = null;
        } else {
            this.parser = new SteppingInterpreter(mainGrammarName,
                lexerData.getVocabulary(), parserData.getRuleNames(),
                parserData.getATN(), tokenStream, symbolTable, events);
            this.parser.removeErrorListeners();
            this.parser.addErrorListener(new BaseErrorListener() {
                public <T extends Token> void syntaxError(
                        Recognizer<T, ?> recognizer, T offendingSymbol,
                        int line, int charPositionInLine, String message,
                        RecognitionException e) {
                    reportError("Parser", line, charPositionInLine, message);
                }
            });
        }
    }

    public String toString() {
        return String.format("%s@%h[grammar=%s,breakpoints=%s]",
            getClass().getName(), this, mainGrammarName, breakPoints.size());
    }

    public String getMainGrammarName() {
        return mainGrammarName;
    }

    public EventQueue getEventQueue() {
        return events;
    }

    public boolean isValid() {
        return (parser != null);
    }

    public void start(int startRuleIndex, String input) {
        start(startRuleIndex, input, false);
    }

    /**
     * Start a new run of the given rule over input.
     * If stopOnEntry is true, the run stops at the start rule's entry
     * instead of continuing.
     */
    public void start(int startRuleIndex, String input, boolean stopOnEntry) {
        lexer.setInputStream(CharStreams.fromString(input, mainGrammarName));
        tokenStream.setTokenSource(lexer);
        if (parser == null) {
            events.post(DebuggerEvent.end());
            return;
        }
        if (startRuleIndex < 0 ||
                startRuleIndex >= parserData.getRuleNames().size())
            throw new IllegalArgumentException("Invalid start rule index " +
                                               startRuleIndex);
        parser.start(startRuleIndex);
        parser.clearBreakPointStates();
        for (BreakPoint bp : breakPoints.values()) {
            bp.unbind();
            validateBreakPoint(bp);
        }
        LOGGER.config("Starting rule " + ruleNameFromIndex(startRuleIndex) +
                      " of " + mainGrammarName);
        if (stopOnEntry) {
            events.post(DebuggerEvent.stopOnStep());
        } else {
            resume(RunMode.NORMAL);
        }
    }

    public void resume() {
        resume(RunMode.NORMAL);
    }

    public void resume(RunMode mode) {
        if (parser == null) return;
        if (! parser.isStarted())
            throw new IllegalStateException("Debugger not started");
        parser.resume(mode);
    }

    public void stepIn() {
        resume(RunMode.STEP_IN);
    }

    public void stepOver() {
        resume(RunMode.STEP_OVER);
    }

    public void stepOut() {
        resume(RunMode.STEP_OUT);
    }

    // Steps run to completion synchronously; there is nothing to
    // interrupt.
    public void pause() {}

    public void stop() {}

    public BreakPoint addBreakPoint(String source, int line) {
        BreakPoint bp = new BreakPoint(nextBreakPointId++, source, line);
        breakPoints.put(bp.getId(), bp);
        validateBreakPoint(bp);
        return bp;
    }

    public void clearBreakPoints() {
        for (BreakPoint bp : breakPoints.values()) bp.unbind();
        breakPoints.clear();
        if (parser != null) parser.clearBreakPointStates();
    }

    public List<BreakPoint> getBreakPoints() {
        return Collections.unmodifiableList(new ArrayList<BreakPoint>(
            breakPoints.values()));
    }

    /* Rules are assumed to start at column 0. */
    private void validateBreakPoint(BreakPoint bp) {
        if (parser == null || locator == null) return;
        RuleLocator.RuleLocation loc = locator.ruleAt(0, bp.getLine());
        if (loc == null || loc.getRange() == null ||
                loc.getRange().getStartRow() != bp.getLine())
            return;
        ATN atn = parserData.getATN();
        if (loc.getIndex() < 0 ||
                loc.getIndex() >= atn.ruleToStartState.length) {
            LOGGER.warning("Rule " + loc.getName() + " at line " +
                           bp.getLine() + " has no ATN counterpart");
            return;
        }
        int state = atn.ruleToStartState[loc.getIndex()].stateNumber;
        bp.bind(state, loc.getRange().getStartRow());
        parser.addBreakPointState(state);
        events.post(DebuggerEvent.breakpointValidated(bp));
    }

    private void reportError(String kind, int line, int charPositionInLine,
                             String message) {
        String text = String.format("%s error (%d, %d): %s", kind, line,
                                    charPositionInLine + 1, message);
        events.post(DebuggerEvent.output(text, mainGrammarName, line,
                                         charPositionInLine, true));
    }

    /**
     * All tokens of the current input, including those on other channels.
     */
    public List<LexerToken> getTokenList() {
        tokenStream.fill();
        Vocabulary vocabulary = lexerData.getVocabulary();
        List<LexerToken> ret = new ArrayList<LexerToken>();
        for (Token t : tokenStream.getTokens())
            ret.add(LexerToken.fromToken(t, vocabulary));
        return ret;
    }

    public List<String[]> getLexerSymbols() {
        Vocabulary vocabulary = lexerData.getVocabulary();
        List<String[]> ret = new ArrayList<String[]>();
        for (int i = 0; i <= vocabulary.getMaxTokenType(); i++) {
            ret.add(new String[] { vocabulary.getLiteralName(i),
                                   vocabulary.getSymbolicName(i) });
        }
        return ret;
    }

    public List<String> getParserSymbols() {
        if (parserData == null) return Collections.emptyList();
        return parserData.getRuleNames();
    }

    public List<String> getChannels() {
        return lexerData.getChannels();
    }

    public List<String> getModes() {
        return lexerData.getModes();
    }

    public String ruleNameFromIndex(int ruleIndex) {
        if (parserData == null) return null;
        List<String> names = parserData.getRuleNames();
        if (ruleIndex < 0 || ruleIndex >= names.size()) return null;
        return names.get(ruleIndex);
    }

    public int ruleIndexFromName(String ruleName) {
        if (parserData == null) return -1;
        return parserData.getRuleNames().indexOf(ruleName);
    }

    /**
     * The parse tree built so far, or null if nothing was started.
     */
    public ParseTreeNode getCurrentParseTree() {
        if (parser == null) return null;
        ParserRuleContext tree = parser.getParseTree();
        if (tree == null) return null;
        return ParseTreeNode.fromTree(tree, parserData.getRuleNames(),
                                      lexerData.getVocabulary());
    }

    /**
     * The active call frames, innermost first.
     */
    public List<StackFrame> getCurrentStackTrace() {
        List<StackFrame> ret = new ArrayList<StackFrame>();
        if (parser == null) return ret;
        for (CallFrame frame : parser.getCallStack()) {
            List<LexicalRange> next = new ArrayList<LexicalRange>();
            for (Symbol s : frame.getNext()) {
                if (s.getRange() != null) next.add(s.getRange());
            }
            ret.add(new StackFrame(frame.getName(), frame.getSource(),
                                   next));
        }
        Collections.reverse(ret);
        return ret;
    }

    public int getCurrentTokenIndex() {
        return tokenStream.index();
    }

}
