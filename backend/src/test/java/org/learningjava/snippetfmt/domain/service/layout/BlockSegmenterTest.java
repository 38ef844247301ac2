package org.learningjava.snippetfmt.domain.service.layout;

import org.junit.jupiter.api.Test;
import org.learningjava.snippetfmt.config.FormatterProperties;
import org.learningjava.snippetfmt.domain.model.fragment.Block;
import org.learningjava.snippetfmt.domain.model.fragment.BlockKind;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockSegmenterTest {

    private final BlockSegmenter segmenter = new BlockSegmenter(new FormatterProperties());

    @Test
    void splits_on_every_comment_code_switch() {
        List<Block> blocks = segmenter.segment(List.of(
                "# first", "# second",
                "x = 1", "y = 2",
                "# trailing"
        ));

        assertEquals(3, blocks.size());
        assertEquals(BlockKind.COMMENT, blocks.get(0).kind());
        assertEquals(List.of("# first", "# second"), blocks.get(0).lines());
        assertEquals(BlockKind.CODE, blocks.get(1).kind());
        assertEquals(List.of("x = 1", "y = 2"), blocks.get(1).lines());
        assertEquals(BlockKind.COMMENT, blocks.get(2).kind());
    }

    @Test
    void concatenated_blocks_reproduce_the_input() {
        List<String> lines = List.of("x = 1", "#a", "", "# b", "#c", "f()", "", "g()");

        List<String> rejoined = segmenter.segment(lines).stream()
                .flatMap(b -> b.lines().stream())
                .toList();

        assertEquals(lines, rejoined);
    }

    @Test
    void first_line_starts_the_first_block_whatever_its_kind() {
        List<Block> blocks = segmenter.segment(List.of("x = 1"));

        assertEquals(1, blocks.size());
        assertEquals(BlockKind.CODE, blocks.get(0).kind());
    }

    @Test
    void empty_input_gives_one_empty_block() {
        List<Block> blocks = segmenter.segment(List.of());

        assertEquals(1, blocks.size());
        assertTrue(blocks.get(0).isEmpty());
    }

    @Test
    void only_a_leading_marker_makes_a_comment_line() {
        assertEquals(BlockKind.COMMENT, segmenter.classify("#"));
        assertEquals(BlockKind.CODE, segmenter.classify("  # indented"));
        assertEquals(BlockKind.CODE, segmenter.classify("x = 1  # trailing"));
        assertEquals(BlockKind.CODE, segmenter.classify(""));
    }

    @Test
    void honours_a_configured_marker() {
        FormatterProperties cfg = new FormatterProperties();
        cfg.setCommentMarker("//");
        BlockSegmenter slashes = new BlockSegmenter(cfg);

        List<Block> blocks = slashes.segment(List.of("// note", "# not a comment here"));

        assertEquals(2, blocks.size());
        assertTrue(blocks.get(0).isComment());
        assertFalse(blocks.get(1).isComment());
    }
}
