package net.atndebug.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.atn.ATN;

/**
 * Everything needed to interpret a grammar without generated code: the
 * token vocabulary, rule, channel and mode names, and the loaded ATN.
 * Channel and mode names are only present for lexer grammars.
 */
public class InterpreterData {

    private final Vocabulary vocabulary;
    private final List<String> ruleNames;
    private final List<String> channels;
    private final List<String> modes;
    private final ATN atn;

    public InterpreterData(Vocabulary vocabulary, List<String> ruleNames,
                           List<String> channels, List<String> modes,
                           ATN atn) {
        if (atn == null)
            throw new NullPointerException("ATN may not be null");
        this.vocabulary = vocabulary;
        this.ruleNames = freeze(ruleNames);
        this.channels = freeze(channels);
        this.modes = freeze(modes);
        this.atn = atn;
    }

    private static List<String> freeze(List<String> l) {
        if (l == null) return Collections.emptyList();
        return Collections.unmodifiableList(new ArrayList<String>(l));
    }

    public String toString() {
        return String.format("%s@%h[type=%s,rules=%s]",
            getClass().getName(), this, atn.grammarType,
            ruleNames.size());
    }

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    public List<String> getRuleNames() {
        return ruleNames;
    }

    public List<String> getChannels() {
        return channels;
    }

    public List<String> getModes() {
        return modes;
    }

    public ATN getATN() {
        return atn;
    }

}
