package org.learningjava.snippetfmt.domain.model.fragment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record FormatResult(
        List<String> lines,
        Outcome outcome,
        String failure      // exception that forced the fallback, null when formatted
) {

    public enum Outcome {
        FORMATTED,
        UNCHANGED
    }

    public FormatResult {
        // the fallback echoes whatever it was given, null lines included
        lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public static FormatResult formatted(List<String> lines) {
        return new FormatResult(lines, Outcome.FORMATTED, null);
    }

    public static FormatResult unchanged(List<String> original, Exception cause) {
        String failure = cause == null ? null : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new FormatResult(original, Outcome.UNCHANGED, failure);
    }

    public boolean isFormatted() {
        return outcome == Outcome.FORMATTED;
    }
}
