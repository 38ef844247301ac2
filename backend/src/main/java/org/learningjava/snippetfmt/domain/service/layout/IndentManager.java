package org.learningjava.snippetfmt.domain.service.layout;

import org.learningjava.snippetfmt.domain.exception.EmptyFragmentException;
import org.learningjava.snippetfmt.domain.exception.MalformedFragmentException;
import org.learningjava.snippetfmt.domain.model.fragment.Indentation;
import org.learningjava.snippetfmt.domain.model.fragment.StrippedFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes the indentation of a fragment so the parser sees column-0 code, and
 * puts it back on the rendered output.
 * <p>
 * The indentation is the leading whitespace of the first line; a blank first
 * line means no indentation. Every line must start with at least that much
 * whitespace; blank lines may be shorter.
 */
@Component
public class IndentManager {
    private static final Logger log = LoggerFactory.getLogger(IndentManager.class);

    public StrippedFragment strip(List<String> fragment) {
        if (fragment == null || fragment.isEmpty()) {
            throw new EmptyFragmentException();
        }

        Indentation indentation = measure(fragment);
        if (indentation.isNone()) {
            return new StrippedFragment(fragment, indentation);
        }

        int amount = indentation.amount();
        List<String> stripped = new ArrayList<>(fragment.size());
        for (int i = 0; i < fragment.size(); i++) {
            String line = fragment.get(i);
            if (line.isBlank()) {
                stripped.add(line.length() > amount ? line.substring(amount) : "");
                continue;
            }
            if (line.length() < amount || !line.substring(0, amount).isBlank()) {
                throw new MalformedFragmentException(i, "indented less than the first line (" + amount + " columns)");
            }
            stripped.add(line.substring(amount));
        }

        log.trace("Stripped {} columns of indentation from {} lines", amount, fragment.size());
        return new StrippedFragment(stripped, indentation);
    }

    public List<String> reapply(List<String> lines, Indentation indentation) {
        if (indentation.isNone()) {
            return lines;
        }
        return lines.stream()
                .map(line -> indentation.prefix() + line)
                .toList();
    }

    private Indentation measure(List<String> fragment) {
        String first = fragment.get(0);
        if (first.isBlank()) {
            return Indentation.NONE;
        }
        int end = 0;
        while (Character.isWhitespace(first.charAt(end))) {
            end++;
        }
        return end == 0 ? Indentation.NONE : new Indentation(first.substring(0, end));
    }
}
