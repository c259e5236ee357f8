package net.atndebug.atn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Logger;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.runtime.atn.ATNState;
import org.antlr.v4.runtime.atn.ATNType;
import org.antlr.v4.runtime.atn.ActionTransition;
import org.antlr.v4.runtime.atn.AtomTransition;
import org.antlr.v4.runtime.atn.BasicBlockStartState;
import org.antlr.v4.runtime.atn.BasicState;
import org.antlr.v4.runtime.atn.BlockEndState;
import org.antlr.v4.runtime.atn.BlockStartState;
import org.antlr.v4.runtime.atn.DecisionState;
import org.antlr.v4.runtime.atn.EpsilonTransition;
import org.antlr.v4.runtime.atn.LexerAction;
import org.antlr.v4.runtime.atn.LexerActionType;
import org.antlr.v4.runtime.atn.LexerChannelAction;
import org.antlr.v4.runtime.atn.LexerCustomAction;
import org.antlr.v4.runtime.atn.LexerModeAction;
import org.antlr.v4.runtime.atn.LexerMoreAction;
import org.antlr.v4.runtime.atn.LexerPopModeAction;
import org.antlr.v4.runtime.atn.LexerPushModeAction;
import org.antlr.v4.runtime.atn.LexerSkipAction;
import org.antlr.v4.runtime.atn.LexerTypeAction;
import org.antlr.v4.runtime.atn.LoopEndState;
import org.antlr.v4.runtime.atn.NotSetTransition;
import org.antlr.v4.runtime.atn.PlusBlockStartState;
import org.antlr.v4.runtime.atn.PlusLoopbackState;
import org.antlr.v4.runtime.atn.PrecedencePredicateTransition;
import org.antlr.v4.runtime.atn.PredicateTransition;
import org.antlr.v4.runtime.atn.RangeTransition;
import org.antlr.v4.runtime.atn.RuleStartState;
import org.antlr.v4.runtime.atn.RuleStopState;
import org.antlr.v4.runtime.atn.RuleTransition;
import org.antlr.v4.runtime.atn.SetTransition;
import org.antlr.v4.runtime.atn.StarBlockStartState;
import org.antlr.v4.runtime.atn.StarLoopEntryState;
import org.antlr.v4.runtime.atn.StarLoopbackState;
import org.antlr.v4.runtime.atn.TokensStartState;
import org.antlr.v4.runtime.atn.Transition;
import org.antlr.v4.runtime.atn.WildcardTransition;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.IntervalSet;

/**
 * Decodes ATNs serialized by the standard ANTLR tool into the graph
 * model of the optimizing runtime.
 * The input is a sequence of 16-bit words; all of them but the first are
 * stored shifted by 2 and are shifted back before decoding. Decoding
 * either yields a complete, consistent graph or fails with an
 * ATNException; partial graphs are never returned.
 */
public class ATNDeserializer {

    public static final int SERIALIZED_VERSION = 3;

    public static final UUID BASE_SERIALIZED_UUID =
        UUID.fromString("E4178468-DF95-44D0-AD87-F22A5D5FB6D3");
    public static final UUID ADDED_LEXER_ACTIONS =
        UUID.fromString("AB35191A-1603-487E-B75A-479B831EAF6D");
    public static final UUID ADDED_UNICODE_SMP =
        UUID.fromString("59627784-3BE5-417A-B9EB-8131A7286089");

    public static final List<UUID> SUPPORTED_UUIDS =
        Collections.unmodifiableList(Arrays.asList(BASE_SERIALIZED_UUID,
            ADDED_LEXER_ACTIONS, ADDED_UNICODE_SMP));

    public static final UUID SERIALIZED_UUID = ADDED_UNICODE_SMP;

    private static final int SENTINEL = 0xFFFF;

    private static final Logger LOGGER = Logger.getLogger("ATNDeserializer");

    private static final class WordReader {

        private final char[] data;
        private int pos;

        public WordReader(char[] data) {
            this.data = data;
        }

        public int next() throws ATNFormatException {
            if (pos >= data.length)
                throw new ATNFormatException("Serialized ATN ends " +
                    "prematurely at word " + pos);
            return data[pos++];
        }

        public int nextInt32() throws ATNFormatException {
            return next() | (next() << 16);
        }

        public long nextInt64() throws ATNFormatException {
            long lowOrder = nextInt32() & 0x00000000FFFFFFFFL;
            return lowOrder | ((long) nextInt32() << 32);
        }

        public UUID nextUUID() throws ATNFormatException {
            long leastSigBits = nextInt64();
            long mostSigBits = nextInt64();
            return new UUID(mostSigBits, leastSigBits);
        }

        public int remaining() {
            return data.length - pos;
        }

    }

    private static final class ReturnEdge {

        private final int ruleIndex;
        private final ATNState returnState;
        private final int outermostPrecedenceReturn;

        public ReturnEdge(int ruleIndex, ATNState returnState,
                          int outermostPrecedenceReturn) {
            this.ruleIndex = ruleIndex;
            this.returnState = returnState;
            this.outermostPrecedenceReturn = outermostPrecedenceReturn;
        }

        public boolean equals(Object other) {
            if (! (other instanceof ReturnEdge)) return false;
            ReturnEdge ro = (ReturnEdge) other;
            return (ruleIndex == ro.ruleIndex &&
                    returnState == ro.returnState &&
                    outermostPrecedenceReturn ==
                        ro.outermostPrecedenceReturn);
        }

        public int hashCode() {
            return (ruleIndex * 31 + returnState.stateNumber) * 31 +
                outermostPrecedenceReturn;
        }

    }

    private final DeserializationOptions options;

    public ATNDeserializer(DeserializationOptions options) {
        if (options == null) options = new DeserializationOptions();
        this.options = options;
    }

    public ATNDeserializer() {
        this(null);
    }

    public DeserializationOptions getOptions() {
        return options;
    }

    public ATN deserialize(String data) throws ATNException {
        return deserialize(data.toCharArray());
    }

    public ATN deserialize(int[] words) throws ATNException {
        char[] data = new char[words.length];
        for (int i = 0; i < words.length; i++) {
            if (words[i] < 0 || words[i] > 0xFFFF)
                throw new ATNFormatException("Word " + i + " (" + words[i] +
                    ") out of 16-bit range");
            data[i] = (char) words[i];
        }
        return deserialize(data);
    }

    public ATN deserialize(char[] data) throws ATNException {
        data = data.clone();
        for (int i = 1; i < data.length; i++) {
            data[i] = (char) (data[i] - 2);
        }
        WordReader rd = new WordReader(data);

        int version = rd.next();
        if (version != SERIALIZED_VERSION)
            throw new ATNFormatException(String.format("Could not " +
                "deserialize ATN with version %d (expected %d)", version,
                SERIALIZED_VERSION));
        UUID uuid = rd.nextUUID();
        if (! SUPPORTED_UUIDS.contains(uuid))
            throw new ATNFormatException(String.format("Could not " +
                "deserialize ATN with UUID %s (expected %s or a legacy " +
                "UUID)", uuid, SERIALIZED_UUID));
        boolean supportsLexerActions = isFeatureSupported(
            ADDED_LEXER_ACTIONS, uuid);
        boolean supportsSMPSets = isFeatureSupported(ADDED_UNICODE_SMP,
                                                     uuid);

        int grammarCode = rd.next();
        if (grammarCode >= ATNType.values().length)
            throw new ATNFormatException("Unknown grammar type " +
                                         grammarCode);
        ATNType grammarType = ATNType.values()[grammarCode];
        int maxTokenType = rd.next();
        ATN atn = new ATN(grammarType, maxTokenType);

        readStates(rd, atn);
        readRules(rd, atn, supportsLexerActions);
        readModes(rd, atn);
        List<IntervalSet> sets = new ArrayList<IntervalSet>();
        readSets(rd, sets, false);
        if (supportsSMPSets) {
            int narrow = sets.size();
            readSets(rd, sets, true);
            if (sets.size() > narrow) atn.setHasUnicodeSMPTransitions(true);
        }
        readEdges(rd, atn, sets);
        synthesizeReturnEdges(atn);
        linkBlocksAndLoops(atn);
        readDecisions(rd, atn);
        if (grammarType == ATNType.LEXER) {
            if (supportsLexerActions) {
                readLexerActions(rd, atn);
            } else {
                convertLegacyLexerActions(atn);
            }
        } else {
            atn.lexerActions = new LexerAction[0];
        }
        if (rd.remaining() != 0)
            LOGGER.warning("Ignoring " + rd.remaining() + " trailing " +
                           "words after serialized ATN");

        markPrecedenceDecisions(atn);
        allocateDFAs(atn);
        if (options.isVerifyATN()) verifyATN(atn);

        if (options.isGenerateRuleBypassTransitions() &&
                grammarType == ATNType.PARSER) {
            generateRuleBypassTransitions(atn);
            if (options.isVerifyATN()) verifyATN(atn);
        }

        if (options.isOptimize()) {
            new ATNOptimizer(atn).optimize();
            if (options.isVerifyATN()) verifyATN(atn);
        }
        ATNOptimizer.identifyTailCalls(atn);
        return atn;
    }

    private void readStates(WordReader rd, ATN atn) throws ATNException {
        List<int[]> loopBackStateNumbers = new ArrayList<int[]>();
        List<int[]> endStateNumbers = new ArrayList<int[]>();
        int nstates = rd.next();
        for (int i = 0; i < nstates; i++) {
            int type = rd.next();
            if (type == ATNState.INVALID_TYPE) {
                atn.addState(null);
                continue;
            }
            ATNState s = createState(type, i);
            int ruleIndex = rd.next();
            s.ruleIndex = (ruleIndex == SENTINEL) ? -1 : ruleIndex;
            atn.addState(s);
            if (s instanceof LoopEndState) {
                loopBackStateNumbers.add(new int[] { i, rd.next() });
            } else if (s instanceof BlockStartState) {
                endStateNumbers.add(new int[] { i, rd.next() });
            }
        }
        // Back-links may point forward, so they are resolved only now.
        for (int[] pair : loopBackStateNumbers) {
            ((LoopEndState) atn.states.get(pair[0])).loopBackState =
                getState(atn, pair[1]);
        }
        for (int[] pair : endStateNumbers) {
            ATNState end = getState(atn, pair[1]);
            if (! (end instanceof BlockEndState))
                throw new ATNIntegrityException("End state " + pair[1] +
                    " of block start " + pair[0] + " is not a block end");
            ((BlockStartState) atn.states.get(pair[0])).endState =
                (BlockEndState) end;
        }

        int numNonGreedyStates = rd.next();
        for (int i = 0; i < numNonGreedyStates; i++) {
            ATNState s = getState(atn, rd.next());
            if (! (s instanceof DecisionState))
                throw new ATNIntegrityException("Non-greedy state " + s +
                                                " is not a decision state");
            ((DecisionState) s).nonGreedy = true;
        }
        int numPrecedenceStates = rd.next();
        for (int i = 0; i < numPrecedenceStates; i++) {
            ATNState s = getState(atn, rd.next());
            if (! (s instanceof RuleStartState))
                throw new ATNIntegrityException("Precedence state " + s +
                                                " is not a rule start");
            ((RuleStartState) s).isPrecedenceRule = true;
        }
    }

    private static ATNState createState(int type, int stateNumber)
            throws ATNFormatException {
        switch (type) {
            case ATNState.BASIC: return new BasicState();
            case ATNState.RULE_START: return new RuleStartState();
            case ATNState.BLOCK_START: return new BasicBlockStartState();
            case ATNState.PLUS_BLOCK_START: return new PlusBlockStartState();
            case ATNState.STAR_BLOCK_START: return new StarBlockStartState();
            case ATNState.TOKEN_START: return new TokensStartState();
            case ATNState.RULE_STOP: return new RuleStopState();
            case ATNState.BLOCK_END: return new BlockEndState();
            case ATNState.STAR_LOOP_BACK: return new StarLoopbackState();
            case ATNState.STAR_LOOP_ENTRY: return new StarLoopEntryState();
            case ATNState.PLUS_LOOP_BACK: return new PlusLoopbackState();
            case ATNState.LOOP_END: return new LoopEndState();
            default:
                throw new ATNFormatException("Unknown state type " + type +
                                             " for state " + stateNumber);
        }
    }

    private void readRules(WordReader rd, ATN atn,
                           boolean supportsLexerActions) throws ATNException {
        int nrules = rd.next();
        boolean lexer = (atn.grammarType == ATNType.LEXER);
        atn.ruleToStartState = new RuleStartState[nrules];
        if (lexer) atn.ruleToTokenType = new int[nrules];
        for (int i = 0; i < nrules; i++) {
            ATNState s = getState(atn, rd.next());
            if (! (s instanceof RuleStartState))
                throw new ATNIntegrityException("Start state " + s +
                    " of rule " + i + " is not a rule start");
            atn.ruleToStartState[i] = (RuleStartState) s;
            if (lexer) {
                int tokenType = rd.next();
                if (tokenType == SENTINEL) tokenType = Token.EOF;
                atn.ruleToTokenType[i] = tokenType;
                // Unused legacy action index.
                if (! supportsLexerActions) rd.next();
            }
        }
        atn.ruleToStopState = new RuleStopState[nrules];
        for (ATNState s : atn.states) {
            if (! (s instanceof RuleStopState)) continue;
            int ri = s.ruleIndex;
            if (ri < 0 || ri >= nrules)
                throw new ATNIntegrityException("Rule stop state " + s +
                    " belongs to unknown rule " + ri);
            if (atn.ruleToStopState[ri] != null)
                throw new ATNIntegrityException("Rule " + ri + " has " +
                    "more than one stop state");
            atn.ruleToStopState[ri] = (RuleStopState) s;
            atn.ruleToStartState[ri].stopState = (RuleStopState) s;
        }
        for (int i = 0; i < nrules; i++) {
            if (atn.ruleToStopState[i] == null)
                throw new ATNIntegrityException("Rule " + i + " has no " +
                                                "stop state");
        }
    }

    private void readModes(WordReader rd, ATN atn) throws ATNException {
        int nmodes = rd.next();
        for (int i = 0; i < nmodes; i++) {
            ATNState s = getState(atn, rd.next());
            if (! (s instanceof TokensStartState))
                throw new ATNIntegrityException("Start state " + s +
                    " of mode " + i + " is not a tokens start");
            atn.modeToStartState.add((TokensStartState) s);
        }
    }

    private void readSets(WordReader rd, List<IntervalSet> sets,
                          boolean wide) throws ATNException {
        int nsets = rd.next();
        for (int i = 0; i < nsets; i++) {
            int nintervals = rd.next();
            IntervalSet set = new IntervalSet();
            sets.add(set);
            boolean containsEof = (rd.next() != 0);
            if (containsEof) set.add(Token.EOF);
            for (int j = 0; j < nintervals; j++) {
                int a = (wide) ? rd.nextInt32() : rd.next();
                int b = (wide) ? rd.nextInt32() : rd.next();
                set.add(a, b);
            }
            set.setReadonly(true);
        }
    }

    private void readEdges(WordReader rd, ATN atn, List<IntervalSet> sets)
            throws ATNException {
        int nedges = rd.next();
        for (int i = 0; i < nedges; i++) {
            ATNState src = getState(atn, rd.next());
            ATNState trg = getState(atn, rd.next());
            int ttype = rd.next();
            int arg1 = rd.next();
            int arg2 = rd.next();
            int arg3 = rd.next();
            src.addTransition(edgeFactory(atn, ttype, trg, arg1, arg2, arg3,
                                          sets));
        }
    }

    protected Transition edgeFactory(ATN atn, int type, ATNState target,
                                     int arg1, int arg2, int arg3,
                                     List<IntervalSet> sets)
            throws ATNException {
        switch (type) {
            case Transition.EPSILON:
                return new EpsilonTransition(target);
            case Transition.RANGE:
                return new RangeTransition(target,
                    (arg3 != 0) ? Token.EOF : arg1, arg2);
            case Transition.RULE:
                ATNState callee = getState(atn, arg1);
                if (! (callee instanceof RuleStartState))
                    throw new ATNIntegrityException("Rule transition " +
                        "target " + arg1 + " is not a rule start");
                return new RuleTransition((RuleStartState) callee, arg2,
                                          arg3, target);
            case Transition.PREDICATE:
                return new PredicateTransition(target, arg1, arg2,
                                               arg3 != 0);
            case Transition.PRECEDENCE:
                return new PrecedencePredicateTransition(target, arg1);
            case Transition.ATOM:
                return new AtomTransition(target, (arg3 != 0) ? Token.EOF :
                                                                arg1);
            case Transition.ACTION:
                return new ActionTransition(target, arg1,
                    (arg2 == SENTINEL) ? -1 : arg2, arg3 != 0);
            case Transition.SET:
                return new SetTransition(target, getSet(sets, arg1));
            case Transition.NOT_SET:
                return new NotSetTransition(target, getSet(sets, arg1));
            case Transition.WILDCARD:
                return new WildcardTransition(target);
            default:
                throw new ATNFormatException("Unknown transition type " +
                                             type);
        }
    }

    private void synthesizeReturnEdges(ATN atn) {
        Set<ReturnEdge> returnEdges = new LinkedHashSet<ReturnEdge>();
        for (ATNState state : atn.states) {
            if (state == null) continue;
            boolean returningToLeftFactored = (state.ruleIndex >= 0 &&
                atn.ruleToStartState[state.ruleIndex].leftFactored);
            for (int i = 0; i < state.getNumberOfTransitions(); i++) {
                Transition t = state.transition(i);
                if (! (t instanceof RuleTransition)) continue;
                RuleTransition rt = (RuleTransition) t;
                RuleStartState callee = (RuleStartState) rt.target;
                if (returningToLeftFactored && ! callee.leftFactored)
                    continue;
                int outermostPrecedenceReturn = -1;
                if (callee.isPrecedenceRule && rt.precedence == 0)
                    outermostPrecedenceReturn = callee.ruleIndex;
                returnEdges.add(new ReturnEdge(callee.ruleIndex,
                    rt.followState, outermostPrecedenceReturn));
            }
        }
        for (ReturnEdge re : returnEdges) {
            atn.ruleToStopState[re.ruleIndex].addTransition(
                new EpsilonTransition(re.returnState,
                                      re.outermostPrecedenceReturn));
        }
    }

    private void linkBlocksAndLoops(ATN atn) throws ATNException {
        for (ATNState state : atn.states) {
            if (state instanceof BlockStartState) {
                BlockStartState start = (BlockStartState) state;
                if (start.endState == null)
                    throw new ATNIntegrityException("Block start " + state +
                                                    " has no end state");
                if (start.endState.startState != null)
                    throw new ATNIntegrityException("Block end " +
                        start.endState + " is already claimed by " +
                        start.endState.startState);
                start.endState.startState = start;
            }
            if (state instanceof PlusLoopbackState) {
                for (int i = 0; i < state.getNumberOfTransitions(); i++) {
                    ATNState target = state.transition(i).target;
                    if (target instanceof PlusBlockStartState)
                        ((PlusBlockStartState) target).loopBackState =
                            (PlusLoopbackState) state;
                }
            } else if (state instanceof StarLoopbackState) {
                for (int i = 0; i < state.getNumberOfTransitions(); i++) {
                    ATNState target = state.transition(i).target;
                    if (target instanceof StarLoopEntryState)
                        ((StarLoopEntryState) target).loopBackState =
                            (StarLoopbackState) state;
                }
            }
        }
    }

    private void readDecisions(WordReader rd, ATN atn) throws ATNException {
        int ndecisions = rd.next();
        for (int i = 0; i < ndecisions; i++) {
            ATNState s = getState(atn, rd.next());
            if (! (s instanceof DecisionState))
                throw new ATNIntegrityException("Decision state " + s +
                    " is not of a decision kind");
            DecisionState ds = (DecisionState) s;
            if (ds.decision != -1)
                throw new ATNIntegrityException("State " + s + " is " +
                    "listed as decision more than once");
            defineDecision(atn, ds);
        }
    }

    private static void defineDecision(ATN atn, DecisionState ds) {
        atn.decisionToState.add(ds);
        ds.decision = atn.decisionToState.size() - 1;
    }

    private void readLexerActions(WordReader rd, ATN atn)
            throws ATNException {
        LexerAction[] actions = new LexerAction[rd.next()];
        for (int i = 0; i < actions.length; i++) {
            int code = rd.next();
            int data1 = rd.next();
            if (data1 == SENTINEL) data1 = -1;
            int data2 = rd.next();
            if (data2 == SENTINEL) data2 = -1;
            actions[i] = lexerActionFactory(code, data1, data2);
        }
        atn.lexerActions = actions;
    }

    protected LexerAction lexerActionFactory(int code, int data1, int data2)
            throws ATNFormatException {
        if (code >= LexerActionType.values().length)
            throw new ATNFormatException("Unknown lexer action type " +
                                         code);
        switch (LexerActionType.values()[code]) {
            case CHANNEL:
                return new LexerChannelAction(data1);
            case CUSTOM:
                return new LexerCustomAction(data1, data2);
            case MODE:
                return new LexerModeAction(data1);
            case MORE:
                return LexerMoreAction.INSTANCE;
            case POP_MODE:
                return LexerPopModeAction.INSTANCE;
            case PUSH_MODE:
                return new LexerPushModeAction(data1);
            case SKIP:
                return LexerSkipAction.INSTANCE;
            case TYPE:
                return new LexerTypeAction(data1);
            default:
                throw new ATNFormatException("Unknown lexer action type " +
                                             code);
        }
    }

    /**
     * Older formats encoded lexer actions as (rule, action) pairs on the
     * action transitions; turn each of them into a custom action and make
     * the transition refer to it.
     */
    private void convertLegacyLexerActions(ATN atn) {
        List<LexerAction> legacy = new ArrayList<LexerAction>();
        for (ATNState state : atn.states) {
            if (state == null) continue;
            for (int i = 0; i < state.getNumberOfTransitions(); i++) {
                Transition t = state.transition(i);
                if (! (t instanceof ActionTransition)) continue;
                ActionTransition at = (ActionTransition) t;
                LexerAction action = new LexerCustomAction(at.ruleIndex,
                                                           at.actionIndex);
                state.setTransition(i, new ActionTransition(at.target,
                    at.ruleIndex, legacy.size(), false));
                legacy.add(action);
            }
        }
        atn.lexerActions = legacy.toArray(new LexerAction[legacy.size()]);
    }

    private void markPrecedenceDecisions(ATN atn) {
        List<StarLoopEntryState> decisions =
            new ArrayList<StarLoopEntryState>();
        for (ATNState state : atn.states) {
            if (! (state instanceof StarLoopEntryState)) continue;
            if (state.ruleIndex < 0 ||
                    ! atn.ruleToStartState[state.ruleIndex].isPrecedenceRule)
                continue;
            if (! isPrecedencePrefixEnd(state)) continue;
            StarLoopEntryState entry = (StarLoopEntryState) state;
            entry.precedenceRuleDecision = true;
            entry.precedenceLoopbackStates = new BitSet(atn.states.size());
            decisions.add(entry);
        }
        // Record where the rule returns to itself for left recursion.
        for (StarLoopEntryState entry : decisions) {
            RuleStopState stop = atn.ruleToStopState[entry.ruleIndex];
            for (int i = 0; i < stop.getNumberOfTransitions(); i++) {
                Transition t = stop.transition(i);
                if (! (t instanceof EpsilonTransition)) continue;
                if (((EpsilonTransition) t).outermostPrecedenceReturn() !=
                        -1)
                    continue;
                entry.precedenceLoopbackStates.set(t.target.stateNumber);
            }
        }
    }

    private static boolean isPrecedencePrefixEnd(ATNState state) {
        if (state.getNumberOfTransitions() == 0) return false;
        ATNState maybeLoopEnd = state.transition(
            state.getNumberOfTransitions() - 1).target;
        if (! (maybeLoopEnd instanceof LoopEndState)) return false;
        if (! maybeLoopEnd.onlyHasEpsilonTransitions() ||
                maybeLoopEnd.getNumberOfTransitions() == 0)
            return false;
        return (maybeLoopEnd.transition(0).target instanceof RuleStopState);
    }

    private static void allocateDFAs(ATN atn) {
        atn.decisionToDFA = new DFA[atn.decisionToState.size()];
        for (int i = 0; i < atn.decisionToDFA.length; i++) {
            atn.decisionToDFA[i] = new DFA(atn.decisionToState.get(i), i);
        }
        atn.modeToDFA = new DFA[atn.modeToStartState.size()];
        for (int i = 0; i < atn.modeToDFA.length; i++) {
            atn.modeToDFA[i] = new DFA(atn.modeToStartState.get(i));
        }
    }

    private void generateRuleBypassTransitions(ATN atn)
            throws ATNException {
        int nrules = atn.ruleToStartState.length;
        atn.ruleToTokenType = new int[nrules];
        for (int i = 0; i < nrules; i++) {
            atn.ruleToTokenType[i] = atn.maxTokenType + i + 1;
        }
        for (int i = 0; i < nrules; i++) {
            RuleStartState ruleStart = atn.ruleToStartState[i];
            BasicBlockStartState bypassStart = new BasicBlockStartState();
            bypassStart.ruleIndex = i;
            atn.addState(bypassStart);
            BlockEndState bypassStop = new BlockEndState();
            bypassStop.ruleIndex = i;
            atn.addState(bypassStop);
            bypassStart.endState = bypassStop;
            defineDecision(atn, bypassStart);
            bypassStop.startState = bypassStart;

            ATNState endState;
            Transition excludeTransition = null;
            if (ruleStart.isPrecedenceRule) {
                // The bypass covers the non-recursive prefix only.
                endState = null;
                for (ATNState state : atn.states) {
                    if (state == null || state.ruleIndex != i) continue;
                    if (! (state instanceof StarLoopEntryState)) continue;
                    if (isPrecedencePrefixEnd(state)) {
                        endState = state;
                        break;
                    }
                }
                if (endState == null)
                    throw new ATNIntegrityException("Couldn't identify " +
                        "final state of the precedence rule prefix " +
                        "section of rule " + i);
                StarLoopbackState loopBack =
                    ((StarLoopEntryState) endState).loopBackState;
                if (loopBack == null)
                    throw new ATNIntegrityException("Precedence prefix " +
                        "end " + endState + " has no loopback state");
                excludeTransition = loopBack.transition(0);
            } else {
                endState = atn.ruleToStopState[i];
            }

            for (ATNState state : atn.states) {
                if (state == null) continue;
                for (int j = 0; j < state.getNumberOfTransitions(); j++) {
                    Transition t = state.transition(j);
                    if (t == excludeTransition) continue;
                    if (t.target == endState) t.target = bypassStop;
                }
            }

            while (ruleStart.getNumberOfTransitions() > 0) {
                Transition t = ruleStart.removeTransition(
                    ruleStart.getNumberOfTransitions() - 1);
                bypassStart.addTransition(0, t);
            }

            ruleStart.addTransition(new EpsilonTransition(bypassStart));
            bypassStop.addTransition(new EpsilonTransition(endState));
            BasicState matchState = new BasicState();
            matchState.ruleIndex = i;
            atn.addState(matchState);
            matchState.addTransition(new AtomTransition(bypassStop,
                atn.ruleToTokenType[i]));
            bypassStart.addTransition(new EpsilonTransition(matchState));
        }
        allocateDFAs(atn);
    }

    public static void verifyATN(ATN atn) throws ATNIntegrityException {
        for (ATNState state : atn.states) {
            if (state == null) continue;
            checkCondition(state.onlyHasEpsilonTransitions() ||
                           state.getNumberOfTransitions() <= 1, state,
                           "non-epsilon state with several transitions");
            if (state instanceof PlusBlockStartState)
                checkCondition(((PlusBlockStartState) state).loopBackState !=
                               null, state, "missing loopback state");
            if (state instanceof StarLoopEntryState) {
                StarLoopEntryState entry = (StarLoopEntryState) state;
                checkCondition(entry.loopBackState != null, state,
                               "missing loopback state");
                checkCondition(entry.getNumberOfTransitions() == 2, state,
                               "expected two transitions");
                ATNState first = entry.transition(0).target;
                ATNState second = entry.transition(1).target;
                if (first instanceof StarBlockStartState) {
                    checkCondition(second instanceof LoopEndState, state,
                                   "loop exit expected");
                    checkCondition(! entry.nonGreedy, state,
                                   "greedy loop marked non-greedy");
                } else if (first instanceof LoopEndState) {
                    checkCondition(second instanceof StarBlockStartState,
                                   state, "loop body expected");
                    checkCondition(entry.nonGreedy, state,
                                   "non-greedy loop marked greedy");
                } else {
                    checkCondition(false, state, "malformed loop entry");
                }
            }
            if (state instanceof StarLoopbackState) {
                checkCondition(state.getNumberOfTransitions() == 1, state,
                               "expected one transition");
                checkCondition(state.transition(0).target instanceof
                               StarLoopEntryState, state,
                               "loopback must lead to loop entry");
            }
            if (state instanceof LoopEndState)
                checkCondition(((LoopEndState) state).loopBackState != null,
                               state, "missing loopback state");
            if (state instanceof RuleStartState)
                checkCondition(((RuleStartState) state).stopState != null,
                               state, "missing stop state");
            if (state instanceof BlockStartState)
                checkCondition(((BlockStartState) state).endState != null,
                               state, "missing end state");
            if (state instanceof BlockEndState)
                checkCondition(((BlockEndState) state).startState != null,
                               state, "missing start state");
            if (state instanceof DecisionState) {
                checkCondition(state.getNumberOfTransitions() <= 1 ||
                               ((DecisionState) state).decision >= 0, state,
                               "decision state without decision number");
            } else {
                checkCondition(state.getNumberOfTransitions() <= 1 ||
                               state instanceof RuleStopState, state,
                               "unexpected branching");
            }
        }
    }

    /**
     * Whether the given feature is available in the format identified by
     * actual. Features are available from the identifier that introduced
     * them onward.
     */
    public static boolean isFeatureSupported(UUID feature, UUID actual) {
        int featureIndex = SUPPORTED_UUIDS.indexOf(feature);
        if (featureIndex < 0) return false;
        return (SUPPORTED_UUIDS.indexOf(actual) >= featureIndex);
    }

    private static void checkCondition(boolean condition, ATNState state,
            String message) throws ATNIntegrityException {
        if (! condition)
            throw new ATNIntegrityException("ATN verification failed at " +
                                            "state " + state + ": " + message);
    }

    private static ATNState getState(ATN atn, int n)
            throws ATNException {
        if (n < 0 || n >= atn.states.size())
            throw new ATNFormatException("State reference " + n +
                " out of range (" + atn.states.size() + " states)");
        ATNState s = atn.states.get(n);
        if (s == null)
            throw new ATNIntegrityException("State reference " + n +
                                            " points to an invalid state");
        return s;
    }

    private static IntervalSet getSet(List<IntervalSet> sets, int index)
            throws ATNFormatException {
        if (index < 0 || index >= sets.size())
            throw new ATNFormatException("Set reference " + index +
                " out of range (" + sets.size() + " sets)");
        return sets.get(index);
    }

}
