/* (C)2026 */
package com.ammann.logquery.exception;

/**
 * Raised when a column name outside the column registry is asked to be placed into SQL text.
 */
public class UnknownColumnException extends ValidationException {

    private final String column;

    public UnknownColumnException(String column) {
        super("Unknown column: " + column);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
