package com.marketplace.dispatch.exception;

public class DispatchException extends RuntimeException {

    private final DispatchError error;

    public DispatchException(DispatchError error) {
        super(error.getMessage());
        this.error = error;
    }

    public DispatchException(DispatchError error, String message) {
        super(message);
        this.error = error;
    }

    public DispatchError getError() {
        return error;
    }

    public String getCode() {
        return error.name();
    }
}
