package com.hcltech.textres.resources;

/** Root of the failures raised while binding a resource group. Lookups never throw these. */
public class TextResourceException extends RuntimeException {

    public TextResourceException(String message) {
        super(message);
    }

    public TextResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
