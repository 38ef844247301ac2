package org.learningjava.snippetfmt.domain.model.syntax;

public record ImportAlias(String name, String asName) {

    public ImportAlias(String name) {
        this(name, null);
    }

    public boolean hasAlias() {
        return asName != null;
    }
}
