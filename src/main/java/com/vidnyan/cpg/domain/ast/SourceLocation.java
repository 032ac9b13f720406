package com.vidnyan.cpg.domain.ast;

/**
 * Source code location of an AST node.
 */
public record SourceLocation(
    String filePath,
    int line,
    int column,
    int endLine,
    int endColumn
) {

    public static final SourceLocation UNKNOWN = new SourceLocation("", 0, 0, 0, 0);

    public static SourceLocation at(String filePath, int line) {
        return new SourceLocation(filePath, line, 0, line, 0);
    }

    public static SourceLocation at(String filePath, int line, int column) {
        return new SourceLocation(filePath, line, column, line, column);
    }

    public boolean isKnown() {
        return line > 0;
    }

    public boolean containsLine(int candidate) {
        return candidate >= line && candidate <= Math.max(line, endLine);
    }

    /**
     * Format as "path:line:column".
     */
    public String format() {
        return filePath + ":" + line + (column > 0 ? ":" + column : "");
    }
}
