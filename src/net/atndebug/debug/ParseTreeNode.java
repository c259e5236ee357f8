package net.atndebug.debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.atndebug.util.Util;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * A detached copy of a parse tree node as presented to debugger hosts.
 * Rule nodes carry the rule and the tokens they span; terminal and error
 * nodes carry their token. EOF terminals are left out.
 */
public class ParseTreeNode {

    public enum Type { RULE, TERMINAL, ERROR }

    private final Type type;
    private final String name;
    private final int ruleIndex;
    private final LexerToken start;
    private final LexerToken stop;
    private final LexerToken symbol;
    private final List<ParseTreeNode> children;

    protected ParseTreeNode(Type type, String name, int ruleIndex,
                            LexerToken start, LexerToken stop,
                            LexerToken symbol,
                            List<ParseTreeNode> children) {
        this.type = type;
        this.name = name;
        this.ruleIndex = ruleIndex;
        this.start = start;
        this.stop = stop;
        this.symbol = symbol;
        this.children = Collections.unmodifiableList(children);
    }

    public static ParseTreeNode fromTree(ParseTree tree,
                                         List<String> ruleNames,
                                         Vocabulary vocabulary) {
        if (tree instanceof ParserRuleContext) {
            ParserRuleContext ctx = (ParserRuleContext) tree;
            List<ParseTreeNode> children = new ArrayList<ParseTreeNode>();
            for (int i = 0; i < ctx.getChildCount(); i++) {
                ParseTree child = ctx.getChild(i);
                if (child instanceof TerminalNode &&
                        ! (child instanceof ErrorNode) &&
                        ((TerminalNode) child).getSymbol().getType() ==
                            Token.EOF)
                    continue;
                children.add(fromTree(child, ruleNames, vocabulary));
            }
            int idx = ctx.getRuleIndex();
            String name = (idx >= 0 && idx < ruleNames.size()) ?
                ruleNames.get(idx) : "<no name>";
            return new ParseTreeNode(Type.RULE, name, idx,
                convert(ctx.getStart(), vocabulary),
                convert(ctx.getStop(), vocabulary), null, children);
        }
        TerminalNode node = (TerminalNode) tree;
        LexerToken sym = convert(node.getSymbol(), vocabulary);
        Type type = (node instanceof ErrorNode) ? Type.ERROR : Type.TERMINAL;
        return new ParseTreeNode(type, sym.getName(), -1, null, null, sym,
                                 new ArrayList<ParseTreeNode>());
    }

    private static LexerToken convert(Token t, Vocabulary vocabulary) {
        return (t == null) ? null : LexerToken.fromToken(t, vocabulary);
    }

    public String toString() {
        return String.format("%s@%h[type=%s,name=%s,children=%s]",
            getClass().getName(), this, type, name, children.size());
    }

    public Type getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    /**
     * The rule index of a RULE node; -1 for others.
     */
    public int getRuleIndex() {
        return ruleIndex;
    }

    public LexerToken getStart() {
        return start;
    }

    public LexerToken getStop() {
        return stop;
    }

    /**
     * The token of a TERMINAL or ERROR node; null for RULE nodes.
     */
    public LexerToken getSymbol() {
        return symbol;
    }

    public List<ParseTreeNode> getChildren() {
        return children;
    }

    public JSONObject toJSON() {
        JSONObject ret = Util.createJSONObject("type",
            type.name().toLowerCase(), "name", name);
        if (type == Type.RULE) {
            ret.put("ruleIndex", ruleIndex);
            ret.put("start", (start == null) ? JSONObject.NULL :
                                               start.toJSON());
            ret.put("stop", (stop == null) ? JSONObject.NULL : stop.toJSON());
        } else {
            ret.put("symbol", symbol.toJSON());
        }
        JSONArray ch = new JSONArray();
        for (ParseTreeNode c : children) ch.put(c.toJSON());
        ret.put("children", ch);
        return ret;
    }

}
