package org.learningjava.snippetfmt.domain.model.fragment;

/**
 * Leading whitespace removed from a fragment before layout and put back
 * afterwards. {@link #amount()} is the column count it occupies.
 */
public record Indentation(String prefix) {

    public static final Indentation NONE = new Indentation("");

    public int amount() {
        return prefix.length();
    }

    public boolean isNone() {
        return prefix.isEmpty();
    }
}
