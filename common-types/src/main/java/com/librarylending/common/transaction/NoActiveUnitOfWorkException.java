package com.librarylending.common.transaction;

public class NoActiveUnitOfWorkException extends UnitOfWorkException {
    public NoActiveUnitOfWorkException(String message) {
        super(message);
    }
}
