package org.learningjava.snippetfmt.domain.model.syntax;

import java.util.List;

// one name, or the names of an unpacking target
public record AssignmentTarget(List<String> names) {

    public AssignmentTarget {
        names = List.copyOf(names);
    }

    public static AssignmentTarget of(String name) {
        return new AssignmentTarget(List.of(name));
    }
}
