package net.atndebug.api.symbols;

/**
 * A stretch of source text delimited by two positions.
 * Rows are 1-based and columns are 0-based, the way grammar sources are
 * addressed by the symbol table; the end position is inclusive of the
 * last character's row and exclusive of its column.
 */
public final class LexicalRange {

    private final int startRow;
    private final int startColumn;
    private final int endRow;
    private final int endColumn;

    public LexicalRange(int startRow, int startColumn, int endRow,
                        int endColumn) {
        this.startRow = startRow;
        this.startColumn = startColumn;
        this.endRow = endRow;
        this.endColumn = endColumn;
    }

    public String toString() {
        return String.format("%d:%d-%d:%d", startRow, startColumn, endRow,
                             endColumn);
    }

    public boolean equals(Object other) {
        if (! (other instanceof LexicalRange)) return false;
        LexicalRange lo = (LexicalRange) other;
        return (startRow == lo.startRow && startColumn == lo.startColumn &&
                endRow == lo.endRow && endColumn == lo.endColumn);
    }

    public int hashCode() {
        return ((startRow * 31 + startColumn) * 31 + endRow) * 31 +
            endColumn;
    }

    public int getStartRow() {
        return startRow;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndRow() {
        return endRow;
    }

    public int getEndColumn() {
        return endColumn;
    }

}
