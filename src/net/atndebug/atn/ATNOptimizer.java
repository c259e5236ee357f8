package net.atndebug.atn;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;
import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.runtime.atn.ATNState;
import org.antlr.v4.runtime.atn.ATNType;
import org.antlr.v4.runtime.atn.AtomTransition;
import org.antlr.v4.runtime.atn.BasicState;
import org.antlr.v4.runtime.atn.BlockEndState;
import org.antlr.v4.runtime.atn.DecisionState;
import org.antlr.v4.runtime.atn.EpsilonTransition;
import org.antlr.v4.runtime.atn.RangeTransition;
import org.antlr.v4.runtime.atn.RuleStopState;
import org.antlr.v4.runtime.atn.RuleTransition;
import org.antlr.v4.runtime.atn.SetTransition;
import org.antlr.v4.runtime.atn.Transition;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.IntervalSet;

/**
 * Rewrites the optimized edge lists of a freshly loaded ATN.
 * The original edges are left untouched; simulations that follow the
 * optimized edges see the same language with fewer steps. New helper
 * states are appended to the ATN as needed.
 */
public class ATNOptimizer {

    private static final Logger LOGGER = Logger.getLogger("ATNOptimizer");

    private final ATN atn;

    public ATNOptimizer(ATN atn) {
        this.atn = atn;
    }

    public ATN getATN() {
        return atn;
    }

    /**
     * Run all passes repeatedly until a round changes nothing.
     * Returns the total number of rewrites performed.
     */
    public int optimize() {
        boolean preserveOrder = (atn.grammarType == ATNType.LEXER);
        int total = 0;
        for (int round = 1; ; round++) {
            int inlined = inlineSetRules();
            int combined = combineChainedEpsilons();
            int collapsed = optimizeSets(preserveOrder);
            LOGGER.fine("Optimization round " + round + ": inlined " +
                inlined + " rule calls, removed " + combined +
                " chained epsilon edges, collapsed " + collapsed +
                " set alternatives");
            int count = inlined + combined + collapsed;
            if (count == 0) break;
            total += count;
        }
        return total;
    }

    /**
     * Replace invocations of rules that match exactly one atom, range or
     * set by an inline copy of that match.
     */
    public int inlineSetRules() {
        int inlinedCalls = 0;
        Transition[] ruleToInlineTransition =
            new Transition[atn.ruleToStartState.length];
        for (int i = 0; i < ruleToInlineTransition.length; i++) {
            ATNState middleState = atn.ruleToStartState[i];
            while (middleState.onlyHasEpsilonTransitions() &&
                    middleState.getNumberOfOptimizedTransitions() == 1 &&
                    middleState.getOptimizedTransition(0)
                        .getSerializationType() == Transition.EPSILON) {
                ATNState next = middleState.getOptimizedTransition(0).target;
                if (next == middleState) break;
                middleState = next;
            }
            if (middleState.getNumberOfOptimizedTransitions() != 1)
                continue;
            Transition matchTransition =
                middleState.getOptimizedTransition(0);
            ATNState matchTarget = matchTransition.target;
            if (matchTransition.isEpsilon() ||
                    ! matchTarget.onlyHasEpsilonTransitions() ||
                    matchTarget.getNumberOfOptimizedTransitions() != 1 ||
                    ! (matchTarget.getOptimizedTransition(0).target
                        instanceof RuleStopState))
                continue;
            switch (matchTransition.getSerializationType()) {
                case Transition.ATOM:
                case Transition.RANGE:
                case Transition.SET:
                    ruleToInlineTransition[i] = matchTransition;
                    break;
                default:
                    break;
            }
        }

        int nstates = atn.states.size();
        for (int sn = 0; sn < nstates; sn++) {
            ATNState state = atn.states.get(sn);
            if (state == null || state.ruleIndex < 0) continue;
            List<Transition> optimized = null;
            for (int i = 0; i < state.getNumberOfOptimizedTransitions();
                    i++) {
                Transition t = state.getOptimizedTransition(i);
                Transition effective = null;
                if (t instanceof RuleTransition)
                    effective = ruleToInlineTransition[
                        ((RuleTransition) t).target.ruleIndex];
                if (effective == null) {
                    if (optimized != null) optimized.add(t);
                    continue;
                }
                if (optimized == null) {
                    optimized = new ArrayList<Transition>();
                    for (int j = 0; j < i; j++)
                        optimized.add(state.getOptimizedTransition(j));
                }
                inlinedCalls++;
                ATNState follow = ((RuleTransition) t).followState;
                BasicState intermediate = new BasicState();
                intermediate.setRuleIndex(follow.ruleIndex);
                atn.addState(intermediate);
                intermediate.addTransition(retarget(effective, follow));
                optimized.add(new EpsilonTransition(intermediate));
            }
            if (optimized != null) setOptimizedTransitions(state, optimized);
        }
        return inlinedCalls;
    }

    public int combineChainedEpsilons() {
        int removedEdges = 0;
        for (ATNState state : atn.states) {
            if (state == null || ! state.onlyHasEpsilonTransitions() ||
                    state instanceof RuleStopState)
                continue;
            List<Transition> optimized = null;
            for (int i = 0; i < state.getNumberOfOptimizedTransitions();
                    i++) {
                Transition t = state.getOptimizedTransition(i);
                ATNState intermediate = t.target;
                if (! isPlainEpsilon(t) || intermediate == state ||
                        intermediate.getStateType() != ATNState.BASIC ||
                        ! intermediate.onlyHasEpsilonTransitions() ||
                        ! isSpliceable(intermediate)) {
                    if (optimized != null) optimized.add(t);
                    continue;
                }
                removedEdges++;
                if (optimized == null) {
                    optimized = new ArrayList<Transition>();
                    for (int j = 0; j < i; j++)
                        optimized.add(state.getOptimizedTransition(j));
                }
                for (int j = 0;
                        j < intermediate.getNumberOfOptimizedTransitions();
                        j++) {
                    optimized.add(new EpsilonTransition(
                        intermediate.getOptimizedTransition(j).target));
                }
            }
            if (optimized != null) setOptimizedTransitions(state, optimized);
        }
        return removedEdges;
    }

    /**
     * Collapse the alternatives of a decision that each consist of a
     * single atom, range or set leading to the block end into one set
     * alternative. Lexer ATNs are left alone since the rewrite does not
     * preserve alternative order.
     */
    public int optimizeSets(boolean preserveOrder) {
        if (preserveOrder) return 0;
        int removedPaths = 0;
        for (DecisionState decision : atn.decisionToState) {
            IntervalSet setTransitions = new IntervalSet();
            for (int i = 0; i < decision.getNumberOfOptimizedTransitions();
                    i++) {
                Transition eps = decision.getOptimizedTransition(i);
                if (! (eps instanceof EpsilonTransition)) continue;
                ATNState alt = eps.target;
                if (alt.getNumberOfOptimizedTransitions() != 1) continue;
                Transition t = alt.getOptimizedTransition(0);
                if (! (t.target instanceof BlockEndState)) continue;
                switch (t.getSerializationType()) {
                    case Transition.ATOM:
                    case Transition.RANGE:
                    case Transition.SET:
                        setTransitions.add(i);
                        break;
                    default:
                        break;
                }
            }
            if (setTransitions.size() <= 1) continue;

            List<Transition> optimized = new ArrayList<Transition>();
            for (int i = 0; i < decision.getNumberOfOptimizedTransitions();
                    i++) {
                if (! setTransitions.contains(i))
                    optimized.add(decision.getOptimizedTransition(i));
            }
            ATNState blockEndState = matchTransitionOf(decision,
                setTransitions.getMinElement()).target;
            IntervalSet matchSet = new IntervalSet();
            for (Interval iv : setTransitions.getIntervals()) {
                for (int j = iv.a; j <= iv.b; j++) {
                    matchSet.addAll(matchTransitionOf(decision, j).label());
                }
            }
            Transition newTransition;
            if (matchSet.getIntervals().size() == 1) {
                Interval iv = matchSet.getIntervals().get(0);
                if (iv.length() == 1) {
                    newTransition = new AtomTransition(blockEndState, iv.a);
                } else {
                    newTransition = new RangeTransition(blockEndState, iv.a,
                                                        iv.b);
                }
            } else {
                matchSet.setReadonly(true);
                newTransition = new SetTransition(blockEndState, matchSet);
            }
            BasicState setOptimizedState = new BasicState();
            setOptimizedState.setRuleIndex(decision.ruleIndex);
            atn.addState(setOptimizedState);
            setOptimizedState.addTransition(newTransition);
            optimized.add(new EpsilonTransition(setOptimizedState));
            removedPaths += decision.getNumberOfOptimizedTransitions() -
                optimized.size();
            setOptimizedTransitions(decision, optimized);
        }
        return removedPaths;
    }

    private static Transition matchTransitionOf(ATNState decision,
                                                int alt) {
        return decision.getOptimizedTransition(alt).target
            .getOptimizedTransition(0);
    }

    private static Transition retarget(Transition t, ATNState target) {
        switch (t.getSerializationType()) {
            case Transition.ATOM:
                return new AtomTransition(target, ((AtomTransition) t).label);
            case Transition.RANGE:
                RangeTransition rt = (RangeTransition) t;
                return new RangeTransition(target, rt.from, rt.to);
            case Transition.SET:
                return new SetTransition(target, ((SetTransition) t).set);
            default:
                throw new IllegalArgumentException("Cannot inline " + t);
        }
    }

    // The original edge list is shared until the first rewrite and must
    // not be cleared.
    private static void setOptimizedTransitions(ATNState state,
                                                List<Transition> ts) {
        if (state.isOptimized()) {
            while (state.getNumberOfOptimizedTransitions() > 0) {
                state.removeOptimizedTransition(
                    state.getNumberOfOptimizedTransitions() - 1);
            }
        }
        for (Transition t : ts) {
            state.addOptimizedTransition(t);
        }
    }

    private static boolean isPlainEpsilon(Transition t) {
        return (t instanceof EpsilonTransition &&
                ((EpsilonTransition) t).outermostPrecedenceReturn() == -1);
    }

    private static boolean isSpliceable(ATNState intermediate) {
        for (int i = 0; i < intermediate.getNumberOfOptimizedTransitions();
                i++) {
            Transition t = intermediate.getOptimizedTransition(i);
            // A self-loop would be reproduced by every splice.
            if (! isPlainEpsilon(t) || t.target == intermediate)
                return false;
        }
        return true;
    }

    /**
     * Mark every rule invocation whose follow state can reach the end of
     * the calling rule through plain epsilon edges alone. Both the
     * original and the optimized edge lists are examined.
     */
    public static void identifyTailCalls(ATN atn) {
        for (ATNState state : atn.states) {
            if (state == null) continue;
            for (int i = 0; i < state.getNumberOfTransitions(); i++) {
                markTailCall(atn, state.transition(i));
            }
            if (! state.isOptimized()) continue;
            for (int i = 0; i < state.getNumberOfOptimizedTransitions();
                    i++) {
                markTailCall(atn, state.getOptimizedTransition(i));
            }
        }
    }

    private static void markTailCall(ATN atn, Transition t) {
        if (! (t instanceof RuleTransition)) return;
        RuleTransition rt = (RuleTransition) t;
        rt.tailCall = testTailCall(atn, rt, false);
        rt.optimizedTailCall = testTailCall(atn, rt, true);
    }

    private static boolean testTailCall(ATN atn, RuleTransition rt,
                                        boolean optimizedPath) {
        if (! optimizedPath && rt.tailCall) return true;
        if (optimizedPath && rt.optimizedTailCall) return true;
        BitSet reachable = new BitSet(atn.states.size());
        Deque<ATNState> worklist = new ArrayDeque<ATNState>();
        worklist.push(rt.followState);
        while (! worklist.isEmpty()) {
            ATNState state = worklist.pop();
            if (reachable.get(state.stateNumber)) continue;
            reachable.set(state.stateNumber);
            if (state instanceof RuleStopState) continue;
            if (! state.onlyHasEpsilonTransitions()) return false;
            int n = (optimizedPath) ? state.getNumberOfOptimizedTransitions() :
                                      state.getNumberOfTransitions();
            for (int i = 0; i < n; i++) {
                Transition t = (optimizedPath) ?
                    state.getOptimizedTransition(i) : state.transition(i);
                if (t.getSerializationType() != Transition.EPSILON)
                    return false;
                worklist.push(t.target);
            }
        }
        return true;
    }

}
