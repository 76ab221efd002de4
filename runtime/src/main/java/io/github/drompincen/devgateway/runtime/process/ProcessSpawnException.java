package io.github.drompincen.devgateway.runtime.process;

public class ProcessSpawnException extends Exception {

    public ProcessSpawnException(String message) {
        super(message);
    }

    public ProcessSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
