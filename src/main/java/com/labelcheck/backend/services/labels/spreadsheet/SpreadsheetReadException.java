package com.labelcheck.backend.services.labels.spreadsheet;

public class SpreadsheetReadException extends RuntimeException {

    public SpreadsheetReadException(String message) {
        super(message);
    }

    public SpreadsheetReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
