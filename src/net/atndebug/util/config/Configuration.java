package net.atndebug.util.config;

public interface Configuration {

    final class Values {

        private Values() {}

        public static String getString(Configuration config, String key,
                                       String def) {
            String ret = config.get(key);
            return (ret == null) ? def : ret;
        }

        public static boolean getBoolean(Configuration config, String key,
                                         boolean def) {
            String value = config.get(key);
            if (value == null) return def;
            value = value.trim().toLowerCase();
            if (value.equals("true") || value.equals("yes") ||
                    value.equals("on") || value.equals("1")) {
                return true;
            } else if (value.equals("false") || value.equals("no") ||
                    value.equals("off") || value.equals("0")) {
                return false;
            } else {
                throw new IllegalArgumentException("Invalid boolean " +
                    "value " + value + " for configuration key " + key);
            }
        }

    }

    Configuration NULL = new DynamicConfiguration();

    Configuration DEFAULT = DynamicConfiguration.makeDefault();

    String get(String key);

}
