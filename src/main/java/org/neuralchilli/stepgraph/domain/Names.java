package org.neuralchilli.stepgraph.domain;

import java.util.regex.Pattern;

/**
 * Naming rules shared by ops, graphs, node invocations, inputs and outputs.
 */
public final class Names {

    public static final Pattern VALID_NAME = Pattern.compile("^[A-Za-z0-9_]+$");

    private Names() {
    }

    public static String requireValid(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(what + " name cannot be null or empty");
        }
        if (!VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    what + " name must match pattern " + VALID_NAME.pattern() + ", got: " + name
            );
        }
        return name;
    }

    /**
     * Join a parent handle and a local node name with the nesting separator.
     */
    public static String join(String prefix, String name) {
        return prefix == null || prefix.isEmpty() ? name : prefix + "." + name;
    }
}
