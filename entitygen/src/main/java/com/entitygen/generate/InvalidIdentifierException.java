package com.entitygen.generate;

import com.entitygen.EntitygenException;

/**
 * A catalog name normalizes to something that is not a legal Java identifier,
 * e.g. a keyword or a name starting with a digit.
 */
public class InvalidIdentifierException extends EntitygenException {
    public InvalidIdentifierException(String catalogName, String javaName) {
        super("'" + catalogName + "' normalizes to '" + javaName + "', which is not a valid Java identifier");
    }
}
