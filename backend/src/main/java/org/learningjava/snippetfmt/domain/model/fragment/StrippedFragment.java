package org.learningjava.snippetfmt.domain.model.fragment;

import java.util.List;

public record StrippedFragment(List<String> lines, Indentation indentation) {

    public StrippedFragment {
        lines = List.copyOf(lines);
    }
}
