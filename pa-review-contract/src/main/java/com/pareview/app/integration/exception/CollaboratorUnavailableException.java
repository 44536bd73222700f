package com.pareview.app.integration.exception;

import lombok.Getter;

/**
 * Raised by an external collaborator client when its backing service cannot answer.
 */
@Getter
public class CollaboratorUnavailableException extends RuntimeException {

    private final String collaborator;

    public CollaboratorUnavailableException(String collaborator, String message) {
        super(String.format("Collaborator [%s] unavailable: %s", collaborator, message));
        this.collaborator = collaborator;
    }

    public CollaboratorUnavailableException(String collaborator, String message, Throwable cause) {
        super(String.format("Collaborator [%s] unavailable: %s", collaborator, message), cause);
        this.collaborator = collaborator;
    }
}
