package org.neuralchilli.stepgraph.selection;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One term of a selection query.
 * <p>
 * A leading {@code *} selects every ancestor, a trailing {@code *} every descendant.
 * Each {@code +} selects one more level in that direction instead, so {@code +name++} is the
 * name, its direct parents, and its children and grandchildren.
 *
 * @param name            step key or node handle
 * @param ancestorDepth   levels of ancestors to include, {@link #UNLIMITED} for all
 * @param descendantDepth levels of descendants to include, {@link #UNLIMITED} for all
 */
public record SelectionToken(String name, int ancestorDepth, int descendantDepth) {

    public static final int UNLIMITED = -1;

    private static final Pattern TOKEN = Pattern.compile("^(\\*|\\+*)([A-Za-z0-9_.\\[\\]?]+)(\\*|\\+*)$");

    public SelectionToken {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Selection name cannot be null or empty");
        }
        if (ancestorDepth < UNLIMITED || descendantDepth < UNLIMITED) {
            throw new IllegalArgumentException("Invalid selection depth");
        }
    }

    public static SelectionToken parse(String token) {
        Matcher matcher = TOKEN.matcher(token);
        if (!matcher.matches()) {
            throw new InvalidSelectionException("Invalid selection token: '" + token + "'");
        }
        return new SelectionToken(matcher.group(2), depthOf(matcher.group(1)), depthOf(matcher.group(3)));
    }

    private static int depthOf(String operator) {
        if ("*".equals(operator)) {
            return UNLIMITED;
        }
        return operator.length();
    }

    public boolean includesAncestors() {
        return ancestorDepth != 0;
    }

    public boolean includesDescendants() {
        return descendantDepth != 0;
    }
}
