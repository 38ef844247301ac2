package org.learningjava.snippetfmt.domain.model.fragment;

public enum BlockKind {
    COMMENT,
    CODE
}
