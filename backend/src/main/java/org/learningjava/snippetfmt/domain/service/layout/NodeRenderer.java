package org.learningjava.snippetfmt.domain.service.layout;

import org.learningjava.snippetfmt.config.FormatterProperties;
import org.learningjava.snippetfmt.domain.exception.UnhandledNodeException;
import org.learningjava.snippetfmt.domain.model.syntax.Assignment;
import org.learningjava.snippetfmt.domain.model.syntax.Call;
import org.learningjava.snippetfmt.domain.model.syntax.ConstantLiteral;
import org.learningjava.snippetfmt.domain.model.syntax.DictEntry;
import org.learningjava.snippetfmt.domain.model.syntax.DictLiteral;
import org.learningjava.snippetfmt.domain.model.syntax.ExpressionStatement;
import org.learningjava.snippetfmt.domain.model.syntax.Import;
import org.learningjava.snippetfmt.domain.model.syntax.ImportAlias;
import org.learningjava.snippetfmt.domain.model.syntax.ImportFrom;
import org.learningjava.snippetfmt.domain.model.syntax.Keyword;
import org.learningjava.snippetfmt.domain.model.syntax.ListLiteral;
import org.learningjava.snippetfmt.domain.model.syntax.NameRef;
import org.learningjava.snippetfmt.domain.model.syntax.NumberLiteral;
import org.learningjava.snippetfmt.domain.model.syntax.SetLiteral;
import org.learningjava.snippetfmt.domain.model.syntax.StringLiteral;
import org.learningjava.snippetfmt.domain.model.syntax.SyntaxNode;
import org.learningjava.snippetfmt.domain.model.syntax.TupleLiteral;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns one syntax node into output lines within a width budget.
 * <p>
 * Calls and collection literals either fit on one line, which must be strictly
 * shorter than the width, or are expanded: the opening token alone, one child
 * per indented line with a trailing comma, the closing token alone. Imports
 * always put each name on its own line.
 */
@Component
public class NodeRenderer {
    private static final Logger log = LoggerFactory.getLogger(NodeRenderer.class);

    private final String indent;

    public NodeRenderer(FormatterProperties cfg) {
        this.indent = cfg.getIndent();
    }

    public List<String> render(SyntaxNode node, int width) {
        if (node == null) {
            throw new UnhandledNodeException(null);
        }
        log.trace("Rendering {} at width {}", node.kind(), width);

        if (node instanceof ExpressionStatement statement) {
            return render(statement.value(), width);
        }
        if (node instanceof Assignment assignment) {
            return renderAssignment(assignment, width);
        }
        if (node instanceof Call call) {
            return renderCall(call, width);
        }
        if (node instanceof Keyword keyword) {
            return prefixed(keyword.name() + "=", render(keyword.value(), width));
        }
        if (node instanceof ListLiteral list) {
            return renderCollection("[", "]", list.elements(), width);
        }
        if (node instanceof TupleLiteral tuple) {
            return renderTuple(tuple, width);
        }
        if (node instanceof SetLiteral set) {
            return renderCollection("{", "}", set.elements(), width);
        }
        if (node instanceof DictLiteral dict) {
            return renderDict(dict, width);
        }
        if (node instanceof NameRef name) {
            return List.of(name.id());
        }
        if (node instanceof NumberLiteral number) {
            return List.of(number.text());
        }
        if (node instanceof ConstantLiteral constant) {
            return List.of(constant.text());
        }
        if (node instanceof StringLiteral string) {
            return List.of(renderString(string));
        }
        if (node instanceof Import imp) {
            return renderImports(null, imp.names());
        }
        if (node instanceof ImportFrom from) {
            return renderImports(from.module(), from.names());
        }
        throw new UnhandledNodeException(node);
    }

    // ----- statements ---------------------------------------------------------

    private List<String> renderAssignment(Assignment assignment, int width) {
        String targets = assignment.targets().stream()
                .map(t -> String.join(", ", t.names()))
                .collect(Collectors.joining(" = "));
        return prefixed(targets + " = ", render(assignment.value(), width));
    }

    private List<String> renderImports(String module, List<ImportAlias> names) {
        String from = module == null ? "" : "from " + module + " ";
        return names.stream()
                .map(a -> from + "import " + a.name() + (a.hasAlias() ? " as " + a.asName() : ""))
                .toList();
    }

    // ----- expressions --------------------------------------------------------

    private List<String> renderCall(Call call, int width) {
        int childWidth = width - indent.length();
        List<List<String>> args = new ArrayList<>();
        for (SyntaxNode arg : call.args()) {
            args.add(render(arg, childWidth));
        }
        for (Keyword keyword : call.keywords()) {
            args.add(render(keyword, childWidth));
        }
        if (call.starArgs() != null) {
            args.add(prefixed("*", render(call.starArgs(), childWidth)));
        }
        if (call.kwArgs() != null) {
            args.add(prefixed("**", render(call.kwArgs(), childWidth)));
        }
        return fitOrExpand(call.function() + "(", ")", args, "", width);
    }

    private List<String> renderCollection(String open, String close, List<SyntaxNode> elements, int width) {
        if (elements.isEmpty()) {
            return List.of(open + close);
        }
        return fitOrExpand(open, close, renderAll(elements, width), "", width);
    }

    private List<String> renderTuple(TupleLiteral tuple, int width) {
        if (tuple.elements().isEmpty()) {
            return List.of("()");
        }
        // (x) is not a tuple
        String tail = tuple.elements().size() == 1 ? "," : "";
        return fitOrExpand("(", ")", renderAll(tuple.elements(), width), tail, width);
    }

    private List<String> renderDict(DictLiteral dict, int width) {
        if (dict.entries().isEmpty()) {
            return List.of("{}");
        }
        int childWidth = width - indent.length();
        List<List<String>> items = new ArrayList<>();
        for (DictEntry entry : dict.entries()) {
            items.add(joined(render(entry.key(), childWidth), ": ", render(entry.value(), childWidth)));
        }
        return fitOrExpand("{", "}", items, "", width);
    }

    private String renderString(StringLiteral string) {
        String body = string.body();
        if (body.indexOf('\n') >= 0 || body.indexOf('\r') >= 0) {
            throw new UnhandledNodeException(string, "String literal spans several lines");
        }
        String quote = string.isTripleQuoted() || body.indexOf('"') >= 0 ? string.quote() : "\"";
        return string.prefix() + quote + body + quote;
    }

    // ----- layout -------------------------------------------------------------

    private List<List<String>> renderAll(List<SyntaxNode> nodes, int width) {
        int childWidth = width - indent.length();
        List<List<String>> rendered = new ArrayList<>(nodes.size());
        for (SyntaxNode node : nodes) {
            rendered.add(render(node, childWidth));
        }
        return rendered;
    }

    /**
     * One line when every child is single-line and the result is shorter than
     * {@code width}; otherwise one child per line. A multi-line child keeps its
     * own lines, each shifted by one indent, and only its last line gets the
     * separating comma.
     */
    private List<String> fitOrExpand(String open, String close, List<List<String>> children,
                                     String singleLineTail, int width) {
        if (children.stream().allMatch(c -> c.size() == 1)) {
            String line = open
                    + children.stream().map(c -> c.get(0)).collect(Collectors.joining(", "))
                    + singleLineTail
                    + close;
            if (line.length() < width) {
                return List.of(line);
            }
        }

        List<String> out = new ArrayList<>();
        out.add(open);
        for (List<String> child : children) {
            int last = child.size() - 1;
            for (int i = 0; i <= last; i++) {
                out.add(indent + child.get(i) + (i == last ? "," : ""));
            }
        }
        out.add(close);
        return out;
    }

    private static List<String> prefixed(String prefix, List<String> lines) {
        return joined(List.of(prefix), "", lines);
    }

    // last line of left + separator + first line of right, the rest unchanged
    private static List<String> joined(List<String> left, String separator, List<String> right) {
        List<String> out = new ArrayList<>(left.size() + right.size() - 1);
        out.addAll(left.subList(0, left.size() - 1));
        out.add(left.get(left.size() - 1) + separator + right.get(0));
        out.addAll(right.subList(1, right.size()));
        return out;
    }
}
