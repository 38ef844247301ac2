package org.learningjava.snippetfmt.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.snippetfmt.application.port.SyntaxParserPort;
import org.learningjava.snippetfmt.config.FormatterProperties;
import org.learningjava.snippetfmt.domain.exception.SyntaxRejectedException;
import org.learningjava.snippetfmt.domain.model.fragment.FormatResult;
import org.learningjava.snippetfmt.domain.model.syntax.Call;
import org.learningjava.snippetfmt.domain.model.syntax.NumberLiteral;
import org.learningjava.snippetfmt.domain.model.syntax.SyntaxNode;
import org.learningjava.snippetfmt.domain.service.layout.BlockSegmenter;
import org.learningjava.snippetfmt.domain.service.layout.CommentReflower;
import org.learningjava.snippetfmt.domain.service.layout.IndentManager;
import org.learningjava.snippetfmt.domain.service.layout.NodeRenderer;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class FormatSnippetUseCaseFallbackTest {

    private SyntaxParserPort parser;
    private NodeRenderer renderer;
    private FormatSnippetUseCase useCase;

    @BeforeEach
    void setUp() {
        FormatterProperties cfg = new FormatterProperties();
        parser = mock(SyntaxParserPort.class);
        renderer = mock(NodeRenderer.class);

        useCase = new FormatSnippetUseCase(
                parser, new IndentManager(), new BlockSegmenter(cfg), new CommentReflower(), renderer, cfg
        );
    }

    @Test
    void code_block_is_handed_to_the_parser_as_one_text() throws Exception {
        SyntaxNode call = new Call("f", List.of(new NumberLiteral("1")));
        when(parser.parse(anyString())).thenReturn(List.of(call));
        when(renderer.render(call, 76)).thenReturn(List.of("f(1)"));

        FormatResult result = useCase.format(List.of("   f(", "   1)"), 79);

        assertEquals(List.of("   f(1)"), result.lines());
        verify(parser).parse("f(\n1)");
        verify(renderer).render(call, 76);
    }

    @Test
    void comment_blocks_never_reach_the_parser() throws Exception {
        useCase.format(List.of("# only a comment"), 79);

        verify(parser, never()).parse(anyString());
        verifyNoInteractions(renderer);
    }

    @Test
    void rejected_block_is_reflowed_as_prose() throws Exception {
        when(parser.parse(anyString())).thenThrow(new SyntaxRejectedException(1, 5, "no viable alternative"));

        FormatResult result = useCase.format(List.of("a  b", "c"), 79);

        assertTrue(result.isFormatted());
        assertEquals(List.of("a b c"), result.lines());
        verifyNoInteractions(renderer);
    }

    @Test
    void unexpected_parser_failure_returns_input_unchanged() throws Exception {
        when(parser.parse(anyString())).thenThrow(new IllegalStateException("boom"));
        List<String> input = List.of("x=1");

        FormatResult result = useCase.format(input, 79);

        assertEquals(FormatResult.Outcome.UNCHANGED, result.outcome());
        assertEquals(input, result.lines());
        assertEquals("IllegalStateException: boom", result.failure());
    }

    @Test
    void renderer_failure_discards_partial_output() throws Exception {
        SyntaxNode first = new NumberLiteral("1");
        SyntaxNode second = new NumberLiteral("2");
        when(parser.parse(anyString())).thenReturn(List.of(first, second));
        when(renderer.render(first, 79)).thenReturn(List.of("1"));
        when(renderer.render(second, 79)).thenThrow(new IllegalArgumentException("bad width"));
        List<String> input = List.of("1", "2");

        FormatResult result = useCase.format(input, 79);

        assertFalse(result.isFormatted());
        assertEquals(input, result.lines());
    }
}
