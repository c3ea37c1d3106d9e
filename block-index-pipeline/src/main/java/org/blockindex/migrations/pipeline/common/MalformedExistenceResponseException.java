package org.blockindex.migrations.pipeline.common;

public class MalformedExistenceResponseException extends RuntimeException {
    public MalformedExistenceResponseException(String message) {
        super(message);
    }
}
