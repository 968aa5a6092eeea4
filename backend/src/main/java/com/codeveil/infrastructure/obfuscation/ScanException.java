package com.codeveil.infrastructure.obfuscation;

/**
 * The source cannot be tokenized. Fatal for the run: no partial output is produced.
 */
public class ScanException extends ObfuscationException {

    private final int line;
    private final int column;

    public ScanException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
