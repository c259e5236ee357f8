package net.atndebug.util;

import java.io.OutputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;
import net.atndebug.util.config.Configuration;

public final class Logging {

    public static final String LEVEL_KEY = "atndebug.log.level";

    private static final Logger LOGGER = Logger.getLogger("Logging");

    private Logging() {}

    public static void initFormat() {
        System.setProperty("java.util.logging.SimpleFormatter.format",
                           "[%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS.%1$tL " +
                           "%4$s %3$s] %5$s%6$s%n");
    }

    public static void redirectToStream(OutputStream os) {
        Logger rootLogger = Logger.getLogger("");
        Handler newhnd = new StreamHandler(os, new SimpleFormatter()) {
            public synchronized void publish(LogRecord record) {
                // HACK: Force quick flushing.
                super.publish(record);
                flush();
            }
        };
        newhnd.setLevel(Level.ALL);
        for (Handler hnd : rootLogger.getHandlers()) {
            rootLogger.removeHandler(hnd);
        }
        rootLogger.addHandler(newhnd);
    }

    public static Level parseLevel(String name) {
        if (name == null) return null;
        try {
            return Level.parse(name.trim().toUpperCase());
        } catch (IllegalArgumentException exc) {
            LOGGER.warning("Ignoring unknown log level " +
                           Formats.formatString(name));
            return null;
        }
    }

    public static void applyLevel(Configuration config) {
        Level level = parseLevel(config.get(LEVEL_KEY));
        if (level == null) return;
        Logger.getLogger("").setLevel(level);
    }

}
