package net.atndebug.debug;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.atndebug.api.symbols.AlternativeSymbol;
import net.atndebug.api.symbols.CardinalitySymbol;
import net.atndebug.api.symbols.RuleReferenceSymbol;
import net.atndebug.api.symbols.RuleSymbol;
import net.atndebug.api.symbols.ScopedSymbol;
import net.atndebug.api.symbols.Symbol;
import net.atndebug.api.symbols.TerminalReferenceSymbol;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.runtime.atn.RuleTransition;
import org.antlr.v4.runtime.atn.Transition;

/**
 * Determines which grammar symbols an ATN transition corresponds to.
 * Starting from the symbols a call frame is positioned at, the resolver
 * collects the leaf symbols (rule and token references) that can be
 * reached next, and keeps those consistent with the transition about to
 * be taken.
 */
public class NextSymbolResolver {

    private final ATN atn;
    private final List<String> ruleNames;

    public NextSymbolResolver(ATN atn, List<String> ruleNames) {
        this.atn = atn;
        this.ruleNames = ruleNames;
    }

    /**
     * The leaf symbols reachable from any of sources that match t.
     */
    public List<Symbol> computeNext(List<Symbol> sources, Transition t) {
        String targetRule = null;
        if (t instanceof RuleTransition) {
            int idx = ((RuleTransition) t).target.ruleIndex;
            if (idx >= 0 && idx < ruleNames.size())
                targetRule = ruleNames.get(idx);
        }
        Set<Symbol> ret = new LinkedHashSet<Symbol>();
        for (Symbol source : sources) {
            for (Symbol c : nextCandidates(source)) {
                if (c instanceof RuleReferenceSymbol) {
                    if (targetRule != null && targetRule.equals(c.getName()))
                        ret.add(c);
                } else if (c instanceof TerminalReferenceSymbol) {
                    if (targetRule != null) continue;
                    int type = ((TerminalReferenceSymbol) c).getTokenType();
                    if (t.matches(type, Token.MIN_USER_TOKEN_TYPE,
                                  atn.maxTokenType))
                        ret.add(c);
                }
            }
        }
        return new ArrayList<Symbol>(ret);
    }

    /**
     * All leaf symbols that can be reached right after start.
     * If start is a rule, these are the leaves its alternatives begin
     * with. Nested blocks are entered, elements followed by an optional or
     * zero-or-more suffix may be skipped, and a one-or-more suffix makes
     * start itself reachable again.
     */
    public List<Symbol> nextCandidates(Symbol start) {
        if (start == null) return Collections.emptyList();
        Set<Symbol> result = new LinkedHashSet<Symbol>();
        Set<Symbol> entered = Collections.newSetFromMap(
            new IdentityHashMap<Symbol, Boolean>());
        Set<Symbol> left = Collections.newSetFromMap(
            new IdentityHashMap<Symbol, Boolean>());
        // Entries are (symbol, enter?) pairs; order follows the source.
        Deque<Object[]> work = new ArrayDeque<Object[]>();
        work.push(new Object[] { start, start instanceof RuleSymbol });
        while (! work.isEmpty()) {
            Object[] item = work.pop();
            Symbol s = (Symbol) item[0];
            if ((Boolean) item[1]) {
                if (! entered.add(s)) continue;
                enter(s, result, work);
            } else {
                if (! left.add(s)) continue;
                leave(s, work);
            }
        }
        return new ArrayList<Symbol>(result);
    }

    /* Collect the leaves s can begin with. */
    private static void enter(Symbol s, Set<Symbol> result,
                              Deque<Object[]> work) {
        Symbol sibling = s.getNextSibling();
        if (sibling instanceof CardinalitySymbol &&
                ((CardinalitySymbol) sibling).getCardinality().isSkippable())
            work.push(new Object[] { sibling, false });
        if (! (s instanceof ScopedSymbol)) {
            if (! (s instanceof CardinalitySymbol)) result.add(s);
            return;
        }
        List<Symbol> children = ((ScopedSymbol) s).getChildren();
        if (s instanceof AlternativeSymbol) {
            if (! children.isEmpty())
                work.push(new Object[] { children.get(0), true });
            return;
        }
        for (int i = children.size() - 1; i >= 0; i--)
            work.push(new Object[] { children.get(i), true });
    }

    /* Schedule whatever follows s. */
    private static void leave(Symbol s, Deque<Object[]> work) {
        Symbol next = s.getNext();
        if (next instanceof CardinalitySymbol) {
            CardinalitySymbol card = (CardinalitySymbol) next;
            next = next.getNext();
            if (next != null) work.push(new Object[] { next, true });
            if (card.getCardinality() ==
                    CardinalitySymbol.Cardinality.ONE_OR_MORE)
                work.push(new Object[] { s, true });
            return;
        }
        if (next != null) work.push(new Object[] { next, true });
    }

}
