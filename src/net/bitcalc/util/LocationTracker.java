package net.bitcalc.util;

import net.bitcalc.api.TextLocation;

public class LocationTracker implements TextLocation {

    public static class FixedLocation implements TextLocation {

        private final long line;
        private final long column;
        private final long characterIndex;

        public FixedLocation(long line, long column, long characterIndex) {
            this.line = line;
            this.column = column;
            this.characterIndex = characterIndex;
        }
        public FixedLocation(TextLocation other) {
            this(other.getLine(), other.getColumn(),
                 other.getCharacterIndex());
        }

        public String toString() {
            return String.format("column %d (char %d)", getColumn(),
                                 getCharacterIndex());
        }

        public boolean equals(Object other) {
            if (! (other instanceof FixedLocation)) return false;
            FixedLocation co = (FixedLocation) other;
            return (line == co.getLine() &&
                    column == co.getColumn() &&
                    characterIndex == co.getCharacterIndex());
        }

        public int hashCode() {
            return (int) (line ^ line >>> 31 ^ column ^ column >>> 31 ^
                characterIndex ^ characterIndex >>> 31);
        }

        public long getLine() {
            return line;
        }

        public long getColumn() {
            return column;
        }

        public long getCharacterIndex() {
            return characterIndex;
        }

    }

    public static final int DEFAULT_TAB_SIZE = 8;

    private long column;
    private long characterIndex;
    private int tabSize;

    public LocationTracker(long column, long characterIndex, int tabSize) {
        this.column = column;
        this.characterIndex = characterIndex;
        this.tabSize = tabSize;
    }
    public LocationTracker() {
        this(1, 0, DEFAULT_TAB_SIZE);
    }

    public String toString() {
        return String.format("%s@%h[column=%s,char=%s,tabSize=%s]",
            getClass().getName(), this, getColumn(), getCharacterIndex(),
            getTabSize());
    }

    public long getLine() {
        return 1;
    }

    public long getColumn() {
        return column;
    }

    public long getCharacterIndex() {
        return characterIndex;
    }

    public int getTabSize() {
        return tabSize;
    }
    public void setTabSize(int ts) {
        tabSize = ts;
    }

    public TextLocation snapshot() {
        return new FixedLocation(this);
    }

    public void advance(char ch) {
        characterIndex++;
        if (ch == '\t') {
            column = ((column - 1) / tabSize + 1) * tabSize + 1;
        } else {
            column++;
        }
    }
    public void advance(CharSequence data, int offset, int size) {
        for (int i = offset, ei = offset + size; i < ei; i++) {
            advance(data.charAt(i));
        }
    }

}
