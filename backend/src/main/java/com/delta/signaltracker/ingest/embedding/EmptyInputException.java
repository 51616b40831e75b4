package com.delta.signaltracker.ingest.embedding;

public class EmptyInputException extends IllegalArgumentException {

    public EmptyInputException() {
        super("Cannot embed empty text");
    }
}
