package com.entitygen.config;

import com.entitygen.EntitygenException;

public class ConfigurationException extends EntitygenException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
