package org.celshape;

/**
 * Thrown when the generator parameter string names an unknown option or gives it a value it does not accept.
 */
public class InvalidOptionException extends CelShapeException {

    private final String key;
    private final String value;

    public InvalidOptionException(String key, String value, String reason) {
        super("Invalid option '" + key + "=" + value + "': " + reason);
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }
}
