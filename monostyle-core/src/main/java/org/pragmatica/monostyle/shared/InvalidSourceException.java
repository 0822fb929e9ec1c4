package org.pragmatica.monostyle.shared;

/// Input validation failure. Thrown only at the boundary, never from inside the pipeline.
public class InvalidSourceException extends Exception {
    private final InputError error;

    public InvalidSourceException(InputError error) {
        super(error.message());
        this.error = error;
    }

    public InputError error() {
        return error;
    }
}
