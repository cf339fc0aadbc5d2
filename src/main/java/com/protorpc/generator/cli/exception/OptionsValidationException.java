package com.protorpc.generator.cli.exception;

import java.util.List;

/**
 * Thrown when "generate" options are rejected. Carries every problem found, not just
 * the first, so a user can fix the whole command line in one go.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(errors.size() + " invalid option(s): " + String.join("; ", errors));
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("errors must not be empty");
        }
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
