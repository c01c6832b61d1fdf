package org.celshape.config;

import java.util.regex.Pattern;

import org.celshape.InvalidOptionException;
import org.celshape.constraint.ConstraintExtractor;

/**
 * Generator options, read from the plugin parameter string ({@code cel_validation=true,cel_subject=this}).
 * Options not given there fall back to the system properties {@value #CEL_VALIDATION_PROPERTY} (default
 * {@code true}) and {@value #SUBJECT_PROPERTY} (default {@code this}).
 */
public final class ShapeOptions {

    public static final String CEL_VALIDATION = "cel_validation";
    public static final String CEL_SUBJECT = "cel_subject";

    public static final String CEL_VALIDATION_PROPERTY = "celshape.celValidation";
    public static final String SUBJECT_PROPERTY = "celshape.subject";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final boolean celValidation;
    private final String subject;

    private ShapeOptions(boolean celValidation, String subject) {
        this.celValidation = celValidation;
        this.subject = subject;
    }

    public static ShapeOptions defaults() {
        boolean celValidation = parseBoolean(CEL_VALIDATION_PROPERTY,
                System.getProperty(CEL_VALIDATION_PROPERTY, "true"));
        String subject = parseIdentifier(SUBJECT_PROPERTY,
                System.getProperty(SUBJECT_PROPERTY, ConstraintExtractor.DEFAULT_SUBJECT));
        return new ShapeOptions(celValidation, subject);
    }

    /**
     * Parses a comma separated {@code key=value} list on top of {@link #defaults()}.
     *
     * @throws InvalidOptionException for unknown keys or malformed values
     */
    public static ShapeOptions parse(String parameter) {
        ShapeOptions options = defaults();
        if (parameter == null || parameter.isBlank()) {
            return options;
        }
        for (String pair : parameter.split(",")) {
            String trimmed = pair.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            String key = eq < 0 ? trimmed : trimmed.substring(0, eq).trim();
            String value = eq < 0 ? "" : trimmed.substring(eq + 1).trim();
            switch (key) {
                case CEL_VALIDATION -> options = options.withCelValidation(parseBoolean(key, value));
                case CEL_SUBJECT -> options = options.withSubject(parseIdentifier(key, value));
                default -> throw new InvalidOptionException(key, value, "unknown option");
            }
        }
        return options;
    }

    public ShapeOptions withCelValidation(boolean celValidation) {
        return new ShapeOptions(celValidation, subject);
    }

    public ShapeOptions withSubject(String subject) {
        return new ShapeOptions(celValidation, parseIdentifier(CEL_SUBJECT, subject));
    }

    public boolean isCelValidation() {
        return celValidation;
    }

    public String getSubject() {
        return subject;
    }

    private static boolean parseBoolean(String key, String value) {
        switch (value) {
            case "true":
            case "1":
                return true;
            case "false":
            case "0":
                return false;
            default:
                throw new InvalidOptionException(key, value, "please provide true or false");
        }
    }

    private static String parseIdentifier(String key, String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new InvalidOptionException(key, String.valueOf(value), "not an identifier");
        }
        return value;
    }

    @Override
    public String toString() {
        return "ShapeOptions{" +
               "celValidation=" + celValidation +
               ", subject='" + subject + '\'' +
               '}';
    }
}
