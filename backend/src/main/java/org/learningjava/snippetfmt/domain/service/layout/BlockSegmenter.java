package org.learningjava.snippetfmt.domain.service.layout;

import org.learningjava.snippetfmt.config.FormatterProperties;
import org.learningjava.snippetfmt.domain.model.fragment.Block;
import org.learningjava.snippetfmt.domain.model.fragment.BlockKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits stripped lines into maximal runs of comment lines and code lines.
 * A line is a comment line when it starts with the comment marker; blank lines
 * therefore belong to code runs.
 */
@Component
public class BlockSegmenter {
    private static final Logger log = LoggerFactory.getLogger(BlockSegmenter.class);

    private final String commentMarker;

    public BlockSegmenter(FormatterProperties cfg) {
        this.commentMarker = cfg.getCommentMarker();
    }

    public List<Block> segment(List<String> lines) {
        List<Block> blocks = new ArrayList<>();
        if (lines.isEmpty()) {
            blocks.add(new Block(BlockKind.CODE, List.of()));
            return blocks;
        }

        BlockKind currentKind = classify(lines.get(0));
        List<String> current = new ArrayList<>();

        for (String line : lines) {
            BlockKind kind = classify(line);
            if (!current.isEmpty() && kind != currentKind) {
                blocks.add(new Block(currentKind, current));
                current = new ArrayList<>();
                currentKind = kind;
            }
            current.add(line);
        }
        blocks.add(new Block(currentKind, current));

        log.debug("Segmented {} lines into {} blocks", lines.size(), blocks.size());
        return blocks;
    }

    public BlockKind classify(String line) {
        return line.startsWith(commentMarker) ? BlockKind.COMMENT : BlockKind.CODE;
    }
}
