package com.entitygen;

/**
 * Base type of every failure raised while turning a catalog into entity classes.
 */
public class EntitygenException extends RuntimeException {
    public EntitygenException(String message) {
        super(message);
    }

    public EntitygenException(String message, Throwable cause) {
        super(message, cause);
    }
}
