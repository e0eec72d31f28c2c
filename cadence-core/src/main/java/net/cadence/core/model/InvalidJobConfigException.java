package net.cadence.core.model;

public class InvalidJobConfigException extends IllegalArgumentException {
    public InvalidJobConfigException(String message) {
        super(message);
    }
}
