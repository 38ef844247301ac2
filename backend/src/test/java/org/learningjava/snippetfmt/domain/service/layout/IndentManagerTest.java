package org.learningjava.snippetfmt.domain.service.layout;

import org.junit.jupiter.api.Test;
import org.learningjava.snippetfmt.domain.exception.EmptyFragmentException;
import org.learningjava.snippetfmt.domain.exception.MalformedFragmentException;
import org.learningjava.snippetfmt.domain.model.fragment.Indentation;
import org.learningjava.snippetfmt.domain.model.fragment.StrippedFragment;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IndentManagerTest {

    private final IndentManager indentManager = new IndentManager();

    @Test
    void strips_indentation_of_first_line_from_every_line() {
        StrippedFragment out = indentManager.strip(List.of("    x = f(", "        1,", "    )"));

        assertEquals(4, out.indentation().amount());
        assertEquals(List.of("x = f(", "    1,", ")"), out.lines());
    }

    @Test
    void unindented_fragment_is_returned_as_is() {
        List<String> lines = List.of("x = 1", "    y");

        StrippedFragment out = indentManager.strip(lines);

        assertTrue(out.indentation().isNone());
        assertEquals(lines, out.lines());
    }

    @Test
    void blank_first_line_means_no_indent() {
        List<String> lines = List.of("", "  x = 1", "  y = 2");

        StrippedFragment out = indentManager.strip(lines);

        assertTrue(out.indentation().isNone());
        assertEquals(lines, out.lines());
    }

    @Test
    void whitespace_only_first_line_means_no_indent() {
        StrippedFragment out = indentManager.strip(List.of("  ", "    x = 1"));

        assertTrue(out.indentation().isNone());
        assertEquals(List.of("  ", "    x = 1"), out.lines());
    }

    @Test
    void blank_lines_shorter_than_the_indent_become_empty() {
        StrippedFragment out = indentManager.strip(List.of("    a", "", "  ", "    b"));

        assertEquals(List.of("a", "", "", "b"), out.lines());
    }

    @Test
    void all_blank_fragment_has_no_indent() {
        StrippedFragment out = indentManager.strip(List.of("   ", ""));

        assertTrue(out.indentation().isNone());
    }

    @Test
    void line_indented_less_than_the_first_is_malformed() {
        MalformedFragmentException e = assertThrows(MalformedFragmentException.class,
                () -> indentManager.strip(List.of("    x = 1", "  y = 2")));

        assertEquals(1, e.getLineIndex());
    }

    @Test
    void empty_fragment_fails() {
        assertThrows(EmptyFragmentException.class, () -> indentManager.strip(List.of()));
    }

    @Test
    void keeps_tab_indentation_verbatim() {
        StrippedFragment out = indentManager.strip(List.of("\tx = 1"));

        assertEquals(1, out.indentation().amount());
        assertEquals(List.of("\tx = 1"), indentManager.reapply(out.lines(), out.indentation()));
    }

    @Test
    void reapply_prefixes_every_line() {
        List<String> out = indentManager.reapply(List.of("f(", "    1,", ")"), new Indentation("  "));

        assertEquals(List.of("  f(", "      1,", "  )"), out);
    }

    @Test
    void reapply_with_zero_indent_is_a_no_op() {
        List<String> lines = List.of("a", "b");

        assertSame(lines, indentManager.reapply(lines, Indentation.NONE));
    }
}
