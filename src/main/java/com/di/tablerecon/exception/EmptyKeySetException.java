package com.di.tablerecon.exception;

public class EmptyKeySetException extends ReconciliationException {

    public EmptyKeySetException(String context) {
        super(String.format("Empty key column list supplied for %s", context), context, null, null, null);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.EMPTY_KEY_SET;
    }
}
