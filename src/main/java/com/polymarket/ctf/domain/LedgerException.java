package com.polymarket.ctf.domain;

public class LedgerException extends RuntimeException {

    private final LedgerError error;

    public LedgerException(LedgerError error, String detail) {
        super(error.getDescription() + ": " + detail);
        this.error = error;
    }

    public LedgerException(LedgerError error, String detail, Throwable cause) {
        super(error.getDescription() + ": " + detail, cause);
        this.error = error;
    }

    public LedgerError getError() {
        return error;
    }
}
