package io.tradeload.error;

public class CoercionException extends PipelineException {
    private final String column;
    private final int rowIndex;

    public CoercionException(String column, int rowIndex, String message, Throwable cause) {
        super("cannot coerce column '" + column + "' at row " + rowIndex + ": " + message, cause);
        this.column = column;
        this.rowIndex = rowIndex;
    }

    public String column() { return column; }
    public int rowIndex() { return rowIndex; }
}
