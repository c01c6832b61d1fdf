package org.celshape.util;

public final class NameUtils {

    private NameUtils() {
    }

    /**
     * Converts a protobuf field name to the camel case used by generated members, {@code parent_field}
     * becoming {@code parentField}. Every underscore is removed and the character after it upper-cased.
     */
    public static String snakeToCamel(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        boolean upperNext = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_') {
                upperNext = true;
            } else if (upperNext) {
                sb.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
