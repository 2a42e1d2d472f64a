package org.brown.greenbench.sink;

public class ResultPersistenceException extends RuntimeException {

    public ResultPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
