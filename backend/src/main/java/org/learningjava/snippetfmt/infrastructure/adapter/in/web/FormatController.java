package org.learningjava.snippetfmt.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.learningjava.snippetfmt.application.usecase.FormatSnippetUseCase;
import org.learningjava.snippetfmt.domain.model.fragment.FormatResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/format")
public class FormatController {
    private static final Logger log = LoggerFactory.getLogger(FormatController.class);

    private final FormatSnippetUseCase useCase;

    public FormatController(FormatSnippetUseCase useCase) {
        this.useCase = useCase;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public FormatResponse format(@Valid @RequestBody FormatRequest req) {
        if (req.lines().contains(null)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "lines must not contain null");
        }
        FormatResult result = req.width() == null
                ? useCase.format(req.lines())
                : useCase.format(req.lines(), req.width());
        log.info("Formatted {} lines into {} ({})", req.lines().size(), result.lines().size(), result.outcome());
        return FormatResponse.from(result);
    }

    /**
     * Plain-text variant for editor integrations: the body is the selection,
     * the response is the replacement.
     */
    @PostMapping(path = "/text", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
    public String formatText(@RequestBody(required = false) String body,
                             @RequestParam(name = "width", required = false) @Min(1) Integer width) {
        if (body == null || body.isEmpty()) {
            return "";
        }
        boolean trailingNewline = body.endsWith("\n");
        List<String> lines = body.lines().toList();

        FormatResult result = width == null ? useCase.format(lines) : useCase.format(lines, width);
        log.info("Formatted text selection of {} lines ({})", lines.size(), result.outcome());

        String text = String.join("\n", result.lines());
        return trailingNewline ? text + "\n" : text;
    }

    public record FormatRequest(@NotNull List<String> lines, @Min(1) Integer width) {
    }

    public record FormatResponse(
            List<String> lines,
            String outcome,
            String failure
    ) {
        static FormatResponse from(FormatResult r) {
            return new FormatResponse(r.lines(), r.outcome().name(), r.failure());
        }
    }
}
