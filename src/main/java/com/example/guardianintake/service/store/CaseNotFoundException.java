package com.example.guardianintake.service.store;

public class CaseNotFoundException extends RuntimeException {

    public CaseNotFoundException(String causeNumber) {
        super("No case with cause number " + causeNumber);
    }
}
