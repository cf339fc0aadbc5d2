package com.protorpc.generator.codegen;

/**
 * Fatal error raised while generating bindings.
 *
 * A generation run never recovers from one of these: a half-generated binding set is
 * not something callers can compile against.
 */
public class GenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
