package org.learningjava.snippetfmt.application.usecase;

import org.learningjava.snippetfmt.application.port.SyntaxParserPort;
import org.learningjava.snippetfmt.config.FormatterProperties;
import org.learningjava.snippetfmt.domain.exception.SyntaxRejectedException;
import org.learningjava.snippetfmt.domain.model.fragment.Block;
import org.learningjava.snippetfmt.domain.model.fragment.FormatResult;
import org.learningjava.snippetfmt.domain.model.fragment.StrippedFragment;
import org.learningjava.snippetfmt.domain.model.syntax.SyntaxNode;
import org.learningjava.snippetfmt.domain.service.layout.BlockSegmenter;
import org.learningjava.snippetfmt.domain.service.layout.CommentReflower;
import org.learningjava.snippetfmt.domain.service.layout.IndentManager;
import org.learningjava.snippetfmt.domain.service.layout.NodeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats a source fragment: strip the indentation, split it into comment and
 * code blocks, reflow comments, lay out code (or reflow it as prose when it
 * does not parse), and indent the result again.
 * <p>
 * Any failure along the way returns the input untouched.
 */
@Service
public class FormatSnippetUseCase {

    private static final Logger log = LoggerFactory.getLogger(FormatSnippetUseCase.class);

    private final SyntaxParserPort parser;
    private final IndentManager indentManager;
    private final BlockSegmenter segmenter;
    private final CommentReflower reflower;
    private final NodeRenderer renderer;
    private final FormatterProperties cfg;

    public FormatSnippetUseCase(
            SyntaxParserPort parser,
            IndentManager indentManager,
            BlockSegmenter segmenter,
            CommentReflower reflower,
            NodeRenderer renderer,
            FormatterProperties cfg
    ) {
        this.parser = parser;
        this.indentManager = indentManager;
        this.segmenter = segmenter;
        this.reflower = reflower;
        this.renderer = renderer;
        this.cfg = cfg;
    }

    public FormatResult format(List<String> lines) {
        return format(lines, cfg.getWidth());
    }

    public FormatResult format(List<String> lines, int width) {
        if (lines == null || lines.isEmpty()) {
            return FormatResult.formatted(List.of());
        }

        try {
            return FormatResult.formatted(layout(lines, width));
        } catch (Exception e) {
            log.debug("Returning fragment of {} lines unchanged: {}", lines.size(), e.toString(), e);
            return FormatResult.unchanged(lines, e);
        }
    }

    private List<String> layout(List<String> lines, int width) {
        StrippedFragment fragment = indentManager.strip(lines);

        // the visible width stays the same once the indentation is put back
        int effectiveWidth = width - fragment.indentation().amount();
        if (effectiveWidth <= 0) {
            throw new IllegalArgumentException(
                    "width " + width + " leaves no room after " + fragment.indentation().amount() + " columns of indentation");
        }

        List<String> out = new ArrayList<>();
        for (Block block : segmenter.segment(fragment.lines())) {
            if (block.isEmpty()) {
                continue;
            }
            if (block.isComment()) {
                out.addAll(reflower.reflow(cfg.getCommentToken(), block.lines(), effectiveWidth));
            } else {
                out.addAll(layoutCode(block, effectiveWidth));
            }
        }

        return indentManager.reapply(out, fragment.indentation());
    }

    private List<String> layoutCode(Block block, int width) {
        List<SyntaxNode> nodes;
        try {
            nodes = parser.parse(String.join("\n", block.lines()));
        } catch (SyntaxRejectedException e) {
            // not code: most likely a paragraph inside a docstring
            log.debug("Block of {} lines is not code ({}), reflowing as text", block.lines().size(), e.getMessage());
            return reflower.reflow("", block.lines(), width);
        }

        List<String> out = new ArrayList<>();
        for (SyntaxNode node : nodes) {
            out.addAll(renderer.render(node, width));
        }
        log.debug("Laid out {} statements into {} lines", nodes.size(), out.size());
        return out;
    }
}
