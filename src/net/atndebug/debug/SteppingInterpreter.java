package net.atndebug.debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import net.atndebug.api.symbols.RuleSymbol;
import net.atndebug.api.symbols.Symbol;
import net.atndebug.api.symbols.SymbolTable;
import org.antlr.v4.runtime.ParserInterpreter;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.runtime.atn.ATNState;
import org.antlr.v4.runtime.atn.RuleStartState;
import org.antlr.v4.runtime.atn.Transition;
import org.antlr.v4.runtime.misc.Tuple2;

/**
 * A parser interpreter that can be suspended between ATN states.
 * Each call to resume() runs the parse until a stop condition of the
 * requested mode is met, a breakpoint is hit, or the start rule
 * completes; the outcome is posted to the event queue. Alongside the
 * rule invocations, a stack of call frames tracks which grammar symbols
 * the parse is at.
 */
public class SteppingInterpreter extends ParserInterpreter {

    private static final Logger LOGGER =
        Logger.getLogger("SteppingInterpreter");

    private final SymbolTable symbolTable;
    private final NextSymbolResolver resolver;
    private final EventQueue events;
    private final List<CallFrame> callStack;
    private final Set<Integer> breakPoints;
    private RuleStartState startState;
    private ParserRuleContext parseTree;
    private boolean finished;

    public SteppingInterpreter(String grammarFileName, Vocabulary vocabulary,
                               List<String> ruleNames, ATN atn,
                               TokenStream input, SymbolTable symbolTable,
                               EventQueue events) {
        super(grammarFileName, vocabulary, ruleNames, atn, input);
        this.symbolTable = symbolTable;
        this.resolver = new NextSymbolResolver(atn, ruleNames);
        this.events = events;
        this.callStack = new ArrayList<CallFrame>();
        this.breakPoints = new HashSet<Integer>();
    }

    /**
     * Position the interpreter at the start of the given rule, without
     * executing anything.
     */
    public void start(int startRuleIndex) {
        reset();
        callStack.clear();
        parseTree = null;
        finished = false;
        startState = atn.ruleToStartState[startRuleIndex];
        rootContext = createInterpreterRuleContext(null,
            ATNState.INVALID_STATE_NUMBER, startRuleIndex);
        if (startState.isPrecedenceRule) {
            enterRecursionRule(rootContext, startState.stateNumber,
                               startRuleIndex, 0);
        } else {
            enterRule(rootContext, startState.stateNumber, startRuleIndex);
        }
    }

    public boolean isStarted() {
        return (startState != null);
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * The outermost rule context; after the parse completes, the root of
     * the parse tree.
     */
    public ParserRuleContext getParseTree() {
        return (parseTree != null) ? parseTree : getRootContext();
    }

    public List<CallFrame> getCallStack() {
        return Collections.unmodifiableList(callStack);
    }

    public void addBreakPointState(int state) {
        breakPoints.add(state);
    }

    public void clearBreakPointStates() {
        breakPoints.clear();
    }

    /**
     * Run until the given mode says to stop.
     * Resuming a completed parse does nothing.
     */
    public DebuggerEvent.Type resume(RunMode mode) {
        if (startState == null)
            throw new IllegalStateException("Interpreter not started");
        if (finished) return null;
        int currentRule = getATNState().ruleIndex;
        int entryDepth = callStack.size();
        // Step over is only different from step in at rule invocations.
        if (mode == RunMode.STEP_OVER &&
                ! (getATNState() instanceof RuleStartState))
            mode = RunMode.STEP_IN;

        for (;;) {
            ATNState p = getATNState();
            if (p.getNumberOfTransitions() == 1 && ! callStack.isEmpty()) {
                Transition t = p.transition(0);
                if (isSymbolTransition(t)) {
                    CallFrame frame = callStack.get(callStack.size() - 1);
                    frame.advance(resolver.computeNext(frame.getNext(), t));
                }
            }

            switch (p.getStateType()) {
                case ATNState.RULE_STOP:
                    if (getContext().isEmpty()) {
                        parseTree = finishParse();
                        finished = true;
                        return post(DebuggerEvent.end());
                    }
                    if (! callStack.isEmpty())
                        callStack.remove(callStack.size() - 1);
                    boolean endOfCurrentRule = (currentRule == p.ruleIndex);
                    visitRuleStopState(p);
                    if (mode == RunMode.STEP_OUT && endOfCurrentRule &&
                            callStack.size() < entryDepth)
                        return post(DebuggerEvent.stopOnStep());
                    if (mode == RunMode.STEP_OVER &&
                            callStack.size() <= entryDepth)
                        return post(DebuggerEvent.stopOnStep());
                    break;
                case ATNState.RULE_START:
                    callStack.add(createFrame(p.ruleIndex));
                    visit(p);
                    break;
                default:
                    visit(p);
                    break;
            }

            if (breakPoints.contains(p.stateNumber))
                return post(DebuggerEvent.stopOnBreakpoint());
            if (mode == RunMode.STEP_IN && isWorkState(getATNState()))
                return post(DebuggerEvent.stopOnStep());
        }
    }

    private void visit(ATNState p) {
        try {
            visitState(p);
        } catch (RecognitionException exc) {
            setState(atn.ruleToStopState[p.ruleIndex].stateNumber);
            getContext().exception = exc;
            getErrorHandler().reportError(this, exc);
            recover(exc);
        }
    }

    private ParserRuleContext finishParse() {
        if (startState.isPrecedenceRule) {
            ParserRuleContext result = getContext();
            Tuple2<ParserRuleContext, Integer> parent =
                _parentContextStack.pop();
            unrollRecursionContexts(parent.getItem1());
            return result;
        }
        exitRule();
        return rootContext;
    }

    /*
     * Whether s represents work to do. Rule ends only count for the
     * start rule, so that the last match stays visible before completion.
     */
    private boolean isWorkState(ATNState s) {
        switch (s.getStateType()) {
            case ATNState.RULE_START:
                return true;
            case ATNState.BASIC:
                return ! s.onlyHasEpsilonTransitions();
            case ATNState.RULE_STOP:
                return getContext().isEmpty();
            default:
                return false;
        }
    }

    private static boolean isSymbolTransition(Transition t) {
        switch (t.getSerializationType()) {
            case Transition.RULE:
            case Transition.ATOM:
            case Transition.NOT_SET:
            case Transition.RANGE:
            case Transition.SET:
            case Transition.WILDCARD:
                return true;
            default:
                return false;
        }
    }

    private CallFrame createFrame(int ruleIndex) {
        String[] ruleNames = getRuleNames();
        String name = (ruleIndex >= 0 && ruleIndex < ruleNames.length) ?
            ruleNames[ruleIndex] : null;
        RuleSymbol rule = (name == null || symbolTable == null) ? null :
            symbolTable.resolve(name);
        if (rule == null) {
            LOGGER.fine("No symbol for rule " + name);
            return new CallFrame(name, null, Collections.<Symbol>emptyList());
        }
        // The rule may come from an imported grammar.
        SymbolTable owner = rule.getSymbolTable();
        String source = (owner == null) ? null : owner.getSourceName();
        return new CallFrame(name, source,
                             Collections.<Symbol>singletonList(rule));
    }

    private DebuggerEvent.Type post(DebuggerEvent event) {
        events.post(event);
        return event.getType();
    }

}
