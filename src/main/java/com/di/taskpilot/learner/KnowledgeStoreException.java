package com.di.taskpilot.learner;

public class KnowledgeStoreException extends RuntimeException {

    public KnowledgeStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
