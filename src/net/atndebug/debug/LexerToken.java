package net.atndebug.debug;

import net.atndebug.util.Util;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.json.JSONObject;

/**
 * A token as presented to debugger hosts.
 */
public class LexerToken {

    private final String text;
    private final int type;
    private final String name;
    private final int line;
    private final int offset;
    private final int channel;
    private final int tokenIndex;
    private final int startIndex;
    private final int stopIndex;

    public LexerToken(String text, int type, String name, int line,
                      int offset, int channel, int tokenIndex,
                      int startIndex, int stopIndex) {
        this.text = text;
        this.type = type;
        this.name = name;
        this.line = line;
        this.offset = offset;
        this.channel = channel;
        this.tokenIndex = tokenIndex;
        this.startIndex = startIndex;
        this.stopIndex = stopIndex;
    }

    /**
     * Convert a runtime token; the name is taken from the vocabulary's
     * symbolic names, falling back to the numeric type.
     */
    public static LexerToken fromToken(Token t, Vocabulary vocabulary) {
        String name = vocabulary.getSymbolicName(t.getType());
        if (name == null) name = Integer.toString(t.getType());
        return new LexerToken(t.getText(), t.getType(), name, t.getLine(),
            t.getCharPositionInLine(), t.getChannel(), t.getTokenIndex(),
            t.getStartIndex(), t.getStopIndex());
    }

    public String toString() {
        return String.format("%s@%h[name=%s,text=%s,line=%s,offset=%s]",
            getClass().getName(), this, name, text, line, offset);
    }

    public String getText() {
        return text;
    }

    public int getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public int getLine() {
        return line;
    }

    public int getOffset() {
        return offset;
    }

    public int getChannel() {
        return channel;
    }

    public int getTokenIndex() {
        return tokenIndex;
    }

    public int getStartIndex() {
        return startIndex;
    }

    public int getStopIndex() {
        return stopIndex;
    }

    public JSONObject toJSON() {
        return Util.createJSONObject("text", text, "type", type, "name",
            name, "line", line, "offset", offset, "channel", channel,
            "tokenIndex", tokenIndex, "startIndex", startIndex,
            "stopIndex", stopIndex);
    }

}
