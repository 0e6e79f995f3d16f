package com.cpp2c.transformer.ast;

import java.util.Objects;

/** Spelling or definition location as reported by the front end. */
public final class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

    public final String file;
    public final int line;
    public final int column;

    public SourceLocation(String file, int line, int column) {
        this.file = file == null ? "<unknown>" : file;
        this.line = line;
        this.column = column;
    }

    public static SourceLocation of(String file, int line, int column) {
        return new SourceLocation(file, line, column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    /** Same shape as clang's SourceLocation::printToString: {@code file:line:column}. */
    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
