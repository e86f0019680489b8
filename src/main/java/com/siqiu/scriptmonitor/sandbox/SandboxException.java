package com.siqiu.scriptmonitor.sandbox;

/**
 * Interpreter construction or internal fault not attributable to script content.
 */
public class SandboxException extends RuntimeException {

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
