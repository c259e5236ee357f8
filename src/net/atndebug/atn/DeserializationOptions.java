package net.atndebug.atn;

import net.atndebug.util.config.Configuration;
import org.antlr.v4.runtime.atn.ATNDeserializationOptions;

public class DeserializationOptions extends ATNDeserializationOptions {

    public static final String VERIFY_KEY = "atndebug.atn.verify";
    public static final String BYPASS_KEY = "atndebug.atn.bypass";
    public static final String OPTIMIZE_KEY = "atndebug.atn.optimize";

    public DeserializationOptions(boolean verifyATN,
                                  boolean generateRuleBypassTransitions,
                                  boolean optimize) {
        setVerifyATN(verifyATN);
        setGenerateRuleBypassTransitions(generateRuleBypassTransitions);
        setOptimize(optimize);
    }

    public DeserializationOptions() {
        super();
    }

    public DeserializationOptions(ATNDeserializationOptions other) {
        super(other);
    }

    public String toString() {
        return String.format("%s@%h[verify=%s,bypass=%s,optimize=%s]",
            getClass().getName(), this, isVerifyATN(),
            isGenerateRuleBypassTransitions(), isOptimize());
    }

    public static DeserializationOptions fromConfiguration(
            Configuration config) {
        DeserializationOptions def = new DeserializationOptions();
        return new DeserializationOptions(
            Configuration.Values.getBoolean(config, VERIFY_KEY,
                                            def.isVerifyATN()),
            Configuration.Values.getBoolean(config, BYPASS_KEY,
                def.isGenerateRuleBypassTransitions()),
            Configuration.Values.getBoolean(config, OPTIMIZE_KEY,
                                            def.isOptimize()));
    }

}
