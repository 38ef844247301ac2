package org.learningjava.snippetfmt.infrastructure.adapter.in.cli;

import org.learningjava.snippetfmt.application.usecase.FormatSnippetUseCase;
import org.learningjava.snippetfmt.domain.model.fragment.FormatResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Filter mode for editors: reads the selection from stdin and writes the
 * formatted lines to stdout.
 * <pre>
 * java -jar snippetfmt.jar --snippetfmt.stdin.enabled=true \
 *      --spring.main.web-application-type=none --logging.level.root=OFF \
 *      --snippetfmt.format.width=72
 * </pre>
 * Console logging shares stdout, so it should be switched off in this mode.
 */
@Component
@ConditionalOnProperty(prefix = "snippetfmt.stdin", name = "enabled", havingValue = "true")
public class StdinFormatRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StdinFormatRunner.class);

    private final FormatSnippetUseCase useCase;

    public StdinFormatRunner(FormatSnippetUseCase useCase) {
        this.useCase = useCase;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        Reader in = new InputStreamReader(System.in, StandardCharsets.UTF_8);
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        filter(in, out);
    }

    void filter(Reader in, Writer out) throws IOException {
        List<String> lines;
        try (BufferedReader reader = new BufferedReader(in)) {
            lines = reader.lines().toList();
        }

        FormatResult result = useCase.format(lines);
        log.debug("stdin fragment of {} lines: {}", lines.size(), result.outcome());

        for (String line : result.lines()) {
            out.write(line);
            out.write('\n');
        }
        out.flush();
    }
}
