package org.learningjava.snippetfmt.infrastructure.adapter.out.pythonParser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.RuleNode;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.learningjava.snippetfmt.domain.exception.SyntaxRejectedException;
import org.learningjava.snippetfmt.domain.model.syntax.Assignment;
import org.learningjava.snippetfmt.domain.model.syntax.AssignmentTarget;
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
import org.learningjava.snippetfmt.domain.model.syntax.UnsupportedNode;
import pysnippet.PySnippetBaseVisitor;
import pysnippet.PySnippetParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds syntax nodes from a {@code PySnippet} parse tree.
 * <p>
 * Constructs with a layout rule become their record; every other valid
 * construct becomes an {@link UnsupportedNode} named after its parse rule.
 * Code the grammar accepts but Python rejects (assigning to a literal, a
 * positional argument after a keyword argument, an unexpected indent) cancels
 * the parse with a {@link SyntaxRejectedException} cause.
 */
class SyntaxTreeBuilder extends PySnippetBaseVisitor<SyntaxNode> {

    // valid assignment targets the renderer cannot lay out
    private static final Set<String> UNSUPPORTED_TARGETS = Set.of("Attribute", "Subscript", "Starred");

    List<SyntaxNode> build(PySnippetParser.SnippetContext snippet) {
        List<PySnippetParser.StatementContext> statements = snippet.statement();
        boolean hasCompound = statements.stream().anyMatch(s -> s.compoundHeader() != null);

        List<SyntaxNode> nodes = new ArrayList<>();
        for (PySnippetParser.StatementContext statement : statements) {
            if (statement.compoundHeader() != null) {
                Token keyword = statement.getStart();
                nodes.add(new UnsupportedNode("Compound:" + keyword.getText(), sourceText(statement)));
                continue;
            }
            // indentation is only valid inside a compound statement
            if (!hasCompound && statement.getStart().getCharPositionInLine() > 0) {
                throw reject(statement.getStart(), "unexpected indent");
            }
            for (PySnippetParser.SmallStatementContext small : statement.simpleStatements().smallStatement()) {
                nodes.add(visit(small));
            }
        }
        return nodes;
    }

    // ----- statements ---------------------------------------------------------

    @Override
    public SyntaxNode visitExpressionStatement(PySnippetParser.ExpressionStatementContext ctx) {
        return new ExpressionStatement(visit(ctx.testList()));
    }

    @Override
    public SyntaxNode visitAssignStatement(PySnippetParser.AssignStatementContext ctx) {
        List<PySnippetParser.TestListContext> lists = ctx.testList();
        int targetCount = ctx.yieldExpr() != null ? lists.size() : lists.size() - 1;

        List<AssignmentTarget> targets = new ArrayList<>();
        boolean supported = true;
        for (int i = 0; i < targetCount; i++) {
            AssignmentTarget target = target(lists.get(i), visit(lists.get(i)));
            if (target == null) {
                supported = false;
            } else {
                targets.add(target);
            }
        }

        if (!supported || ctx.yieldExpr() != null) {
            return unsupported(ctx);
        }
        return new Assignment(targets, visit(lists.get(targetCount)));
    }

    @Override
    public SyntaxNode visitImportStatement(PySnippetParser.ImportStatementContext ctx) {
        List<ImportAlias> names = new ArrayList<>();
        for (PySnippetParser.DottedAsNameContext dotted : ctx.dottedAsName()) {
            TerminalNode alias = dotted.NAME();
            names.add(new ImportAlias(dotted.dottedName().getText(), alias == null ? null : alias.getText()));
        }
        return new Import(names);
    }

    @Override
    public SyntaxNode visitImportFromStatement(PySnippetParser.ImportFromStatementContext ctx) {
        String module = ctx.relativeModule().getText();
        PySnippetParser.ImportAsNamesContext imported = ctx.importTargets().importAsNames();
        if (imported == null) {
            return new ImportFrom(module, List.of(new ImportAlias("*")));
        }

        List<ImportAlias> names = new ArrayList<>();
        for (PySnippetParser.ImportAsNameContext name : imported.importAsName()) {
            List<TerminalNode> parts = name.NAME();
            names.add(new ImportAlias(parts.get(0).getText(), parts.size() > 1 ? parts.get(1).getText() : null));
        }
        return new ImportFrom(module, names);
    }

    // ----- expressions --------------------------------------------------------

    @Override
    public SyntaxNode visitTestList(PySnippetParser.TestListContext ctx) {
        List<PySnippetParser.TestItemContext> items = ctx.testItem();
        // a single item without a comma is not a tuple
        if (items.size() == 1 && ctx.getChildCount() == 1) {
            return visit(items.get(0));
        }
        return new TupleLiteral(visitAll(items));
    }

    @Override
    public SyntaxNode visitTestItem(PySnippetParser.TestItemContext ctx) {
        if (ctx.test() == null) {
            return new UnsupportedNode("Starred", sourceText(ctx));
        }
        return visit(ctx.test());
    }

    @Override
    public SyntaxNode visitListItem(PySnippetParser.ListItemContext ctx) {
        if (ctx.namedTest() == null) {
            return new UnsupportedNode("Starred", sourceText(ctx));
        }
        return visit(ctx.namedTest());
    }

    @Override
    public SyntaxNode visitPlainTest(PySnippetParser.PlainTestContext ctx) {
        return visit(ctx.expr());
    }

    @Override
    public SyntaxNode visitNamedTest(PySnippetParser.NamedTestContext ctx) {
        if (ctx.NAME() != null) {
            return new UnsupportedNode("NamedExpr", sourceText(ctx));
        }
        return visit(ctx.test());
    }

    @Override
    public SyntaxNode visitAtomExpression(PySnippetParser.AtomExpressionContext ctx) {
        List<PySnippetParser.TrailerContext> trailers = ctx.trailer();
        if (trailers.isEmpty()) {
            return visit(ctx.atom());
        }

        PySnippetParser.TrailerContext last = trailers.get(trailers.size() - 1);
        boolean plainCall = trailers.size() == 1
                && ctx.atom() instanceof PySnippetParser.NameAtomContext
                && last instanceof PySnippetParser.CallTrailerContext;
        if (!plainCall) {
            return new UnsupportedNode(kindOf(last).replace("Trailer", ""), sourceText(ctx));
        }

        return call(ctx.atom().getText(), (PySnippetParser.CallTrailerContext) last, ctx);
    }

    @Override
    public SyntaxNode visitParenthesizedAtom(PySnippetParser.ParenthesizedAtomContext ctx) {
        return visit(ctx.namedTest());
    }

    @Override
    public SyntaxNode visitEmptyTupleAtom(PySnippetParser.EmptyTupleAtomContext ctx) {
        return new TupleLiteral(List.of());
    }

    @Override
    public SyntaxNode visitTupleAtom(PySnippetParser.TupleAtomContext ctx) {
        return new TupleLiteral(visitAll(ctx.listItem()));
    }

    @Override
    public SyntaxNode visitEmptyListAtom(PySnippetParser.EmptyListAtomContext ctx) {
        return new ListLiteral(List.of());
    }

    @Override
    public SyntaxNode visitListAtom(PySnippetParser.ListAtomContext ctx) {
        return new ListLiteral(visitAll(ctx.listItem()));
    }

    @Override
    public SyntaxNode visitSetAtom(PySnippetParser.SetAtomContext ctx) {
        return new SetLiteral(visitAll(ctx.listItem()));
    }

    @Override
    public SyntaxNode visitEmptyDictAtom(PySnippetParser.EmptyDictAtomContext ctx) {
        return new DictLiteral(List.of());
    }

    @Override
    public SyntaxNode visitDictAtom(PySnippetParser.DictAtomContext ctx) {
        List<DictEntry> entries = new ArrayList<>();
        for (PySnippetParser.DictEntryContext entry : ctx.dictEntry()) {
            if (entry.expr() != null) {
                return new UnsupportedNode("DictUnpacking", sourceText(ctx));
            }
            entries.add(new DictEntry(visit(entry.test(0)), visit(entry.test(1))));
        }
        return new DictLiteral(entries);
    }

    @Override
    public SyntaxNode visitNameAtom(PySnippetParser.NameAtomContext ctx) {
        return new NameRef(ctx.NAME().getText());
    }

    @Override
    public SyntaxNode visitNumberAtom(PySnippetParser.NumberAtomContext ctx) {
        return new NumberLiteral(ctx.NUMBER().getText());
    }

    @Override
    public SyntaxNode visitConstantAtom(PySnippetParser.ConstantAtomContext ctx) {
        return new ConstantLiteral(ctx.getText());
    }

    @Override
    public SyntaxNode visitStringAtom(PySnippetParser.StringAtomContext ctx) {
        if (ctx.STRING().size() > 1) {
            return new UnsupportedNode("ImplicitConcatenation", sourceText(ctx));
        }
        String raw = ctx.STRING(0).getText();

        int quoteAt = 0;
        while (raw.charAt(quoteAt) != '\'' && raw.charAt(quoteAt) != '"') {
            quoteAt++;
        }
        String prefix = raw.substring(0, quoteAt);
        String lower = prefix.toLowerCase(Locale.ROOT);
        if (lower.contains("b")) {
            return new UnsupportedNode("Bytes", raw);
        }
        if (lower.contains("f")) {
            return new UnsupportedNode("FormattedString", raw);
        }

        String rest = raw.substring(quoteAt);
        String quote = rest.startsWith("'''") || rest.startsWith("\"\"\"")
                ? rest.substring(0, 3)
                : rest.substring(0, 1);
        String body = rest.substring(quote.length(), rest.length() - quote.length());
        return new StringLiteral(prefix, quote, body);
    }

    /**
     * Anything without a dedicated visit method is valid but has no layout
     * rule.
     */
    @Override
    public SyntaxNode visitChildren(RuleNode node) {
        ParserRuleContext ctx = (ParserRuleContext) node.getRuleContext();
        return unsupported(ctx);
    }

    // ----- helpers ------------------------------------------------------------

    private SyntaxNode call(String function, PySnippetParser.CallTrailerContext trailer, ParserRuleContext whole) {
        List<SyntaxNode> args = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        SyntaxNode starArgs = null;
        SyntaxNode kwArgs = null;

        List<PySnippetParser.ArgumentContext> arguments = trailer.argList() == null
                ? List.of()
                : trailer.argList().argument();

        for (PySnippetParser.ArgumentContext argument : arguments) {
            if (argument instanceof PySnippetParser.PositionalArgumentContext positional) {
                if (kwArgs != null) {
                    throw reject(argument.getStart(), "positional argument follows keyword argument unpacking");
                }
                if (!keywords.isEmpty()) {
                    throw reject(argument.getStart(), "positional argument follows keyword argument");
                }
                if (starArgs != null) {
                    // would be moved in front of the spread
                    return new UnsupportedNode("PositionalAfterStar", sourceText(whole));
                }
                args.add(visit(positional.test()));
            } else if (argument instanceof PySnippetParser.KeywordArgumentContext keyword) {
                keywords.add(new Keyword(keyword.NAME().getText(), visit(keyword.test())));
            } else if (argument instanceof PySnippetParser.StarArgumentContext star) {
                if (kwArgs != null) {
                    throw reject(argument.getStart(), "iterable argument unpacking follows keyword argument unpacking");
                }
                if (starArgs != null) {
                    return new UnsupportedNode("MultipleStarArgs", sourceText(whole));
                }
                starArgs = visit(star.test());
            } else if (argument instanceof PySnippetParser.KwargsArgumentContext kwargs) {
                if (kwArgs != null) {
                    return new UnsupportedNode("MultipleKwArgs", sourceText(whole));
                }
                kwArgs = visit(kwargs.test());
            } else {
                return new UnsupportedNode(kindOf(argument), sourceText(whole));
            }
        }
        return new Call(function, args, keywords, starArgs, kwArgs);
    }

    /**
     * The target of an assignment, or null when it is valid but unsupported.
     */
    private AssignmentTarget target(PySnippetParser.TestListContext ctx, SyntaxNode node) {
        if (node instanceof NameRef name) {
            return AssignmentTarget.of(name.id());
        }
        if (node instanceof TupleLiteral tuple) {
            List<String> names = new ArrayList<>();
            for (SyntaxNode element : tuple.elements()) {
                if (element instanceof NameRef name) {
                    names.add(name.id());
                } else if (!isValidTarget(element)) {
                    throw reject(ctx.getStart(), "cannot assign to " + element.kind());
                } else {
                    return null;
                }
            }
            return names.isEmpty() ? null : new AssignmentTarget(names);
        }
        if (isValidTarget(node)) {
            return null;
        }
        throw reject(ctx.getStart(), "cannot assign to " + node.kind());
    }

    private static boolean isValidTarget(SyntaxNode node) {
        if (node instanceof NameRef) {
            return true;
        }
        if (node instanceof TupleLiteral tuple) {
            return tuple.elements().stream().allMatch(SyntaxTreeBuilder::isValidTarget);
        }
        if (node instanceof ListLiteral list) {
            return list.elements().stream().allMatch(SyntaxTreeBuilder::isValidTarget);
        }
        return node instanceof UnsupportedNode unsupported && UNSUPPORTED_TARGETS.contains(unsupported.kind());
    }

    private List<SyntaxNode> visitAll(List<? extends ParserRuleContext> contexts) {
        List<SyntaxNode> nodes = new ArrayList<>(contexts.size());
        for (ParserRuleContext ctx : contexts) {
            nodes.add(visit(ctx));
        }
        return nodes;
    }

    private static UnsupportedNode unsupported(ParserRuleContext ctx) {
        return new UnsupportedNode(kindOf(ctx), sourceText(ctx));
    }

    private static String kindOf(ParserRuleContext ctx) {
        return ctx.getClass().getSimpleName().replace("Context", "");
    }

    private static String sourceText(ParserRuleContext ctx) {
        if (ctx.stop == null || ctx.stop.getStopIndex() < ctx.start.getStartIndex()) {
            return ctx.getText();
        }
        Interval interval = new Interval(ctx.start.getStartIndex(), ctx.stop.getStopIndex());
        return ctx.start.getInputStream().getText(interval);
    }

    private static ParseCancellationException reject(Token at, String message) {
        return new ParseCancellationException(
                new SyntaxRejectedException(at.getLine(), at.getCharPositionInLine(), message));
    }
}
