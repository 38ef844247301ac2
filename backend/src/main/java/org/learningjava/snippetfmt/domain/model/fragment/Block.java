package org.learningjava.snippetfmt.domain.model.fragment;

import java.util.List;

public record Block(
        BlockKind kind,
        List<String> lines
) {

    public Block {
        lines = List.copyOf(lines);
    }

    public boolean isComment() {
        return kind == BlockKind.COMMENT;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
