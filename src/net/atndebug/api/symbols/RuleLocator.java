package net.atndebug.api.symbols;

/**
 * Maps source positions to the rules declared there.
 * This is used to bind breakpoints, which are set on source lines.
 */
public interface RuleLocator {

    final class RuleLocation {

        private final String name;
        private final int index;
        private final LexicalRange range;

        public RuleLocation(String name, int index, LexicalRange range) {
            this.name = name;
            this.index = index;
            this.range = range;
        }

        public String toString() {
            return String.format("%s@%h[name=%s,index=%s,range=%s]",
                getClass().getName(), this, name, index, range);
        }

        public String getName() {
            return name;
        }

        public int getIndex() {
            return index;
        }

        public LexicalRange getRange() {
            return range;
        }

    }

    /**
     * Find the rule whose declaration covers the given position.
     * Rows are 1-based, columns 0-based. Returns null if the position is
     * not inside any rule.
     */
    RuleLocation ruleAt(int column, int row);

}
