package org.learningjava.snippetfmt.domain.service.layout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy word-wrap for comment blocks and prose.
 * <p>
 * The token (a comment marker such as {@code "# "}, or nothing for prose) is
 * removed from each input line, the words of all lines are refilled into lines
 * of at most {@code width} columns, and every output line starts with the
 * token again. Only the first occurrence of the token in a line is removed,
 * wherever it sits. Words are never split: one longer than the available width
 * gets a line of its own.
 */
@Component
public class CommentReflower {
    private static final Logger log = LoggerFactory.getLogger(CommentReflower.class);

    public List<String> reflow(String token, List<String> lines, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be > 0, was " + width);
        }

        List<String> words = new ArrayList<>();
        for (String line : lines) {
            String text = token.isEmpty() ? line : removeFirst(line, token);
            for (String word : text.trim().split("\\s+")) {
                if (!word.isEmpty()) {
                    words.add(word);
                }
            }
        }

        if (words.isEmpty()) {
            return List.of(token);
        }

        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder(token);
        for (String word : words) {
            boolean hasWords = current.length() > token.length();
            if (hasWords && current.length() + 1 + word.length() > width) {
                out.add(current.toString());
                current = new StringBuilder(token);
                hasWords = false;
            }
            if (hasWords) {
                current.append(' ');
            }
            current.append(word);
        }
        out.add(current.toString());

        log.trace("Reflowed {} lines into {} at width {}", lines.size(), out.size(), width);
        return out;
    }

    private static String removeFirst(String line, String token) {
        int at = line.indexOf(token);
        if (at < 0) {
            return line;
        }
        return line.substring(0, at) + line.substring(at + token.length());
    }
}
