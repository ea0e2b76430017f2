package co.fanki.sourcescan.extraction.domain.python;

import co.fanki.sourcescan.extraction.domain.python.StringLiterals.Field;
import co.fanki.sourcescan.extraction.domain.python.StringLiterals.Literal;
import co.fanki.sourcescan.extraction.domain.python.StringLiterals.Segment;
import co.fanki.sourcescan.extraction.domain.python.Token.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for Python 3 producing a {@link SyntaxTree}.
 *
 * <p>Covers the statement, expression and pattern grammar of Python 3.11.
 * The tree mirrors CPython's {@code ast} module: same node classes, same
 * field order, same positions for the nodes that carry one. Syntax errors
 * carry CPython's message and position for the common mistakes.</p>
 *
 * <p>A parser instance is single use and not thread-safe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class PythonParser {

    private static final String INVALID_SYNTAX = "invalid syntax";

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async",
            "await", "break", "class", "continue", "def", "del", "elif",
            "else", "except", "finally", "for", "from", "global", "if",
            "import", "in", "is", "lambda", "nonlocal", "not", "or",
            "pass", "raise", "return", "try", "while", "with", "yield");

    /** Keywords that may start an expression. */
    private static final Set<String> EXPRESSION_KEYWORDS = Set.of(
            "False", "None", "True", "not", "lambda", "await");

    private static final Set<String> AUGMENTED_ASSIGNMENTS = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "@=", "&=", "|=", "^=",
            ">>=", "<<=", "**=");

    /** Python 2 statements that get a dedicated error when used as such. */
    private static final Set<String> LEGACY_STATEMENTS = Set.of(
            "print", "exec");

    /** Tokens after which a name is a declaration, never a call. */
    private static final Set<String> DECLARING_KEYWORDS = Set.of(
            "def", "class", "import", "from", "as", "global", "nonlocal");

    private static final Set<String> COMPARISONS = Set.of(
            "==", "!=", "<", "<=", ">", ">=");

    /** Binary operator levels, loosest first. */
    private static final List<Set<String>> BINARY_LEVELS = List.of(
            Set.of("|"),
            Set.of("^"),
            Set.of("&"),
            Set.of("<<", ">>"),
            Set.of("+", "-"),
            Set.of("*", "/", "//", "%", "@"));

    private final PythonTokenizer tokenizer;
    private final SourceLines lines;
    private final List<Token> tokens = new ArrayList<>();
    private int index;
    private PythonSyntaxException lexicalError;

    /**
     * Creates a parser over a token source.
     *
     * @param theTokenizer the tokenizer to pull tokens from
     * @param theLines the document line index, for error reporting
     */
    PythonParser(final PythonTokenizer theTokenizer,
            final SourceLines theLines) {
        this.tokenizer = theTokenizer;
        this.lines = theLines;
    }

    /**
     * Parses a whole module.
     *
     * @return the syntax tree
     * @throws PythonSyntaxException on the first unparsable construct
     */
    SyntaxTree parseModule() {
        final List<SyntaxNode> body = new ArrayList<>();
        try {
            while (!peek().is(Type.ENDMARKER)) {
                body.addAll(parseStatement());
            }
        } catch (final PythonSyntaxException e) {
            throw preferLexicalError(e);
        }
        return new SyntaxTree(SyntaxNode.builder(NodeKind.MODULE, 0, 0)
                .children(Fields.BODY, body)
                .build());
    }

    /**
     * Replaces a generic "invalid syntax" error by a lexical error further
     * down the document, such as a bracket that is never closed, which
     * usually explains it better.
     */
    private PythonSyntaxException preferLexicalError(
            final PythonSyntaxException error) {
        if (lexicalError != null || !INVALID_SYNTAX.equals(error.getMessage())) {
            return error;
        }
        try {
            Token token = tokenizer.next();
            while (!token.is(Type.ENDMARKER)) {
                token = tokenizer.next();
            }
        } catch (final PythonSyntaxException lexical) {
            return lexical;
        }
        return error;
    }

    /**
     * Parses the expression of an f-string replacement field.
     *
     * @return the expression node
     */
    SyntaxNode parseEmbeddedExpression() {
        final SyntaxNode expression = peek().isKeyword("yield")
                ? parseYield() : parseStarExpressions();
        if (!peek().is(Type.ENDMARKER)) {
            throw errorAt(peek(), "f-string: expecting '}'");
        }
        return expression;
    }

    // -- Statements --

    private List<SyntaxNode> parseStatement() {
        final Token token = peek();

        if (token.is(Type.INDENT)) {
            throw new PythonSyntaxException("unexpected indent", token.line(),
                    indentWidth(token.line()), lines.line(token.line()));
        }
        if (token.isOp("@")) {
            return List.of(parseDecorated());
        }
        if (token.is(Type.NAME)) {
            switch (token.text()) {
                case "def":
                    return List.of(parseFunctionDef(List.of(), null));
                case "class":
                    return List.of(parseClassDef(List.of()));
                case "if":
                    return List.of(parseIf());
                case "while":
                    return List.of(parseWhile());
                case "for":
                    return List.of(parseFor(null));
                case "try":
                    return List.of(parseTry());
                case "with":
                    return List.of(parseWith(null));
                case "async":
                    return List.of(parseAsync(List.of()));
                case "match": {
                    final SyntaxNode match = parseMatchIfPresent();
                    if (match != null) {
                        return List.of(match);
                    }
                    break;
                }
                default:
                    break;
            }
        }
        return parseSimpleStatements();
    }

    private List<SyntaxNode> parseSimpleStatements() {
        final List<SyntaxNode> statements = new ArrayList<>();
        while (true) {
            statements.add(parseSmallStatement());
            if (!checkOp(";")) {
                break;
            }
            advance();
            if (peek().is(Type.NEWLINE)) {
                break;
            }
        }
        if (!peek().is(Type.NEWLINE)) {
            throw errorAt(peek(), INVALID_SYNTAX);
        }
        advance();
        return statements;
    }

    private SyntaxNode parseSmallStatement() {
        final Token token = peek();
        if (token.is(Type.NAME)) {
            switch (token.text()) {
                case "pass":
                    advance();
                    return node(NodeKind.PASS, token).build();
                case "break":
                    advance();
                    return node(NodeKind.BREAK, token).build();
                case "continue":
                    advance();
                    return node(NodeKind.CONTINUE, token).build();
                case "return":
                    return parseReturn();
                case "raise":
                    return parseRaise();
                case "global":
                    return parseNameList(NodeKind.GLOBAL);
                case "nonlocal":
                    return parseNameList(NodeKind.NONLOCAL);
                case "del":
                    return parseDelete();
                case "assert":
                    return parseAssert();
                case "import":
                    return parseImport();
                case "from":
                    return parseImportFrom();
                default:
                    break;
            }
        }
        return parseExpressionStatement();
    }

    private SyntaxNode parseExpressionStatement() {
        final Token start = peek();
        final SyntaxNode first = peek().isKeyword("yield")
                ? parseYield() : parseStarExpressions();

        if (checkOp("=")) {
            final List<SyntaxNode> targets = new ArrayList<>();
            SyntaxNode value = first;
            while (checkOp("=")) {
                checkAssignable(value, "assign to");
                targets.add(value);
                advance();
                value = peek().isKeyword("yield")
                        ? parseYield() : parseStarExpressions();
            }
            return node(NodeKind.ASSIGN, start)
                    .children(Fields.TARGETS, targets)
                    .child(Fields.VALUE, value)
                    .build();
        }

        if (peek().is(Type.OP) && AUGMENTED_ASSIGNMENTS.contains(peek().text())) {
            if (!isSingleTarget(first)) {
                throw errorAt(first, "'" + describe(first)
                        + "' is an illegal expression for augmented"
                        + " assignment");
            }
            final String op = advance().text();
            final SyntaxNode value = peek().isKeyword("yield")
                    ? parseYield() : parseStarExpressions();
            return node(NodeKind.AUG_ASSIGN, start)
                    .payload(op.substring(0, op.length() - 1))
                    .child(Fields.TARGET, first)
                    .child(Fields.VALUE, value)
                    .build();
        }

        if (checkOp(":")) {
            if (!isSingleTarget(first)) {
                throw errorAt(first, first.is(NodeKind.TUPLE)
                        ? "only single target (not tuple) can be annotated"
                        : "illegal target for annotation");
            }
            advance();
            final SyntaxNode annotation = parseExpression();
            SyntaxNode value = null;
            if (checkOp("=")) {
                advance();
                value = peek().isKeyword("yield")
                        ? parseYield() : parseStarExpressions();
            }
            return node(NodeKind.ANN_ASSIGN, start)
                    .child(Fields.TARGET, first)
                    .child(Fields.ANNOTATION, annotation)
                    .child(Fields.VALUE, value)
                    .build();
        }

        return node(NodeKind.EXPR, first)
                .child(Fields.VALUE, first)
                .build();
    }

    private SyntaxNode parseReturn() {
        final Token keyword = advance();
        SyntaxNode value = null;
        if (startsExpression(peek())) {
            value = parseStarExpressions();
        }
        return node(NodeKind.RETURN, keyword)
                .child(Fields.VALUE, value)
                .build();
    }

    private SyntaxNode parseRaise() {
        final Token keyword = advance();
        SyntaxNode exc = null;
        SyntaxNode cause = null;
        if (startsExpression(peek())) {
            exc = parseExpression();
            if (peek().isKeyword("from")) {
                advance();
                cause = parseExpression();
            }
        }
        return node(NodeKind.RAISE, keyword)
                .child(Fields.EXC, exc)
                .child(Fields.CAUSE, cause)
                .build();
    }

    private SyntaxNode parseNameList(final NodeKind kind) {
        final Token keyword = advance();
        final List<String> names = new ArrayList<>();
        names.add(expectName().text());
        while (checkOp(",")) {
            advance();
            names.add(expectName().text());
        }
        return node(kind, keyword).payload(List.copyOf(names)).build();
    }

    private SyntaxNode parseDelete() {
        final Token keyword = advance();
        final List<SyntaxNode> targets = new ArrayList<>();
        targets.add(parseBitwiseOrChecked("delete"));
        while (checkOp(",")) {
            advance();
            if (!startsExpression(peek())) {
                break;
            }
            targets.add(parseBitwiseOrChecked("delete"));
        }
        return node(NodeKind.DELETE, keyword)
                .children(Fields.TARGETS, targets)
                .build();
    }

    private SyntaxNode parseBitwiseOrChecked(final String verb) {
        final SyntaxNode target = parseBitwiseOr();
        checkAssignable(target, verb);
        return target;
    }

    private SyntaxNode parseAssert() {
        final Token keyword = advance();
        final SyntaxNode test = parseExpression();
        SyntaxNode msg = null;
        if (checkOp(",")) {
            advance();
            msg = parseExpression();
        }
        return node(NodeKind.ASSERT, keyword)
                .child(Fields.TEST, test)
                .child(Fields.MSG, msg)
                .build();
    }

    private SyntaxNode parseImport() {
        final Token keyword = advance();
        final List<SyntaxNode> names = new ArrayList<>();
        do {
            if (!names.isEmpty()) {
                advance();
            }
            final Token first = peek();
            final String name = parseDottedName();
            String asName = null;
            if (peek().isKeyword("as")) {
                advance();
                asName = expectName().text();
            }
            names.add(node(NodeKind.ALIAS, first)
                    .payload(new ImportAlias(name, asName))
                    .build());
        } while (checkOp(","));

        return node(NodeKind.IMPORT, keyword)
                .children(Fields.NAMES, names)
                .build();
    }

    private SyntaxNode parseImportFrom() {
        final Token keyword = advance();

        int level = 0;
        while (checkOp(".") || checkOp("...")) {
            level += advance().text().length();
        }

        String module = null;
        if (!peek().isKeyword("import")) {
            module = parseDottedName();
        } else if (level == 0) {
            throw errorAt(peek(), INVALID_SYNTAX);
        }

        if (!peek().isKeyword("import")) {
            throw errorAt(peek(), INVALID_SYNTAX);
        }
        advance();

        final List<SyntaxNode> names = new ArrayList<>();
        if (checkOp("*")) {
            final Token star = advance();
            names.add(node(NodeKind.ALIAS, star)
                    .payload(new ImportAlias("*", null))
                    .build());
        } else {
            final boolean parenthesized = checkOp("(");
            if (parenthesized) {
                advance();
            }
            while (true) {
                final Token nameToken = expectName();
                String asName = null;
                if (peek().isKeyword("as")) {
                    advance();
                    asName = expectName().text();
                }
                names.add(node(NodeKind.ALIAS, nameToken)
                        .payload(new ImportAlias(nameToken.text(), asName))
                        .build());
                if (!checkOp(",")) {
                    break;
                }
                advance();
                if (parenthesized && checkOp(")")) {
                    break;
                }
                if (!parenthesized && !peek().is(Type.NAME)) {
                    throw errorAt(peek(), "trailing comma not allowed"
                            + " without surrounding parentheses");
                }
            }
            if (parenthesized) {
                expectOp(")");
            }
        }

        return node(NodeKind.IMPORT_FROM, keyword)
                .payload(module)
                .children(Fields.NAMES, names)
                .build();
    }

    private String parseDottedName() {
        final StringBuilder name = new StringBuilder(expectName().text());
        while (checkOp(".")) {
            advance();
            name.append('.').append(expectName().text());
        }
        return name.toString();
    }

    // -- Compound statements --

    private SyntaxNode parseDecorated() {
        final List<SyntaxNode> decorators = new ArrayList<>();
        while (checkOp("@")) {
            advance();
            decorators.add(parseNamedExpression());
            if (!peek().is(Type.NEWLINE)) {
                throw errorAt(peek(), INVALID_SYNTAX);
            }
            advance();
        }

        final Token token = peek();
        if (token.isKeyword("def")) {
            return parseFunctionDef(decorators, null);
        }
        if (token.isKeyword("class")) {
            return parseClassDef(decorators);
        }
        if (token.isKeyword("async") && peek(1).isKeyword("def")) {
            return parseAsync(decorators);
        }
        throw errorAt(token, INVALID_SYNTAX);
    }

    private SyntaxNode parseAsync(final List<SyntaxNode> decorators) {
        final Token async = peek();
        final Token next = peek(1);
        if (next.isKeyword("def")) {
            advance();
            return parseFunctionDef(decorators, async);
        }
        if (decorators.isEmpty() && next.isKeyword("for")) {
            advance();
            return parseFor(async);
        }
        if (decorators.isEmpty() && next.isKeyword("with")) {
            advance();
            return parseWith(async);
        }
        throw errorAt(next, INVALID_SYNTAX);
    }

    private SyntaxNode parseFunctionDef(final List<SyntaxNode> decorators,
            final Token async) {
        final Token keyword = advance();
        final Token name = expectName();
        expectOp("(", "expected '('");
        final SyntaxNode arguments = parseParameters(")", true);
        expectOp(")");

        SyntaxNode returns = null;
        if (checkOp("->")) {
            advance();
            returns = parseExpression();
        }

        final List<SyntaxNode> body = parseBlock("function definition",
                keyword);

        final Token start = async != null ? async : keyword;
        return node(async != null ? NodeKind.ASYNC_FUNCTION_DEF
                : NodeKind.FUNCTION_DEF, start)
                .payload(name.text())
                .child(Fields.ARGS, arguments)
                .children(Fields.BODY, body)
                .children(Fields.DECORATOR_LIST, decorators)
                .child(Fields.RETURNS, returns)
                .build();
    }

    private SyntaxNode parseClassDef(final List<SyntaxNode> decorators) {
        final Token keyword = advance();
        final Token name = expectName();

        final List<SyntaxNode> bases = new ArrayList<>();
        final List<SyntaxNode> keywords = new ArrayList<>();
        if (checkOp("(")) {
            parseArguments(bases, keywords);
        }

        final List<SyntaxNode> body = parseBlock("class definition", keyword);

        return node(NodeKind.CLASS_DEF, keyword)
                .payload(name.text())
                .children(Fields.BASES, bases)
                .children(Fields.KEYWORDS, keywords)
                .children(Fields.BODY, body)
                .children(Fields.DECORATOR_LIST, decorators)
                .build();
    }

    private SyntaxNode parseIf() {
        final Token keyword = advance();
        final SyntaxNode test = parseNamedExpression();
        final List<SyntaxNode> body = parseBlock(
                "'" + keyword.text() + "' statement", keyword);

        List<SyntaxNode> orelse = List.of();
        if (peek().isKeyword("elif")) {
            orelse = List.of(parseIf());
        } else if (peek().isKeyword("else")) {
            final Token elseToken = advance();
            orelse = parseBlock("'else' statement", elseToken);
        }

        return node(NodeKind.IF, keyword)
                .child(Fields.TEST, test)
                .children(Fields.BODY, body)
                .children(Fields.ORELSE, orelse)
                .build();
    }

    private SyntaxNode parseWhile() {
        final Token keyword = advance();
        final SyntaxNode test = parseNamedExpression();
        final List<SyntaxNode> body = parseBlock("'while' statement", keyword);
        final List<SyntaxNode> orelse = parseElse();

        return node(NodeKind.WHILE, keyword)
                .child(Fields.TEST, test)
                .children(Fields.BODY, body)
                .children(Fields.ORELSE, orelse)
                .build();
    }

    private SyntaxNode parseFor(final Token async) {
        final Token keyword = advance();
        final SyntaxNode target = parseTargetList();
        if (!peek().isKeyword("in")) {
            throw errorAt(peek(), INVALID_SYNTAX);
        }
        advance();
        final SyntaxNode iter = parseStarExpressions();
        final List<SyntaxNode> body = parseBlock("'for' statement", keyword);
        final List<SyntaxNode> orelse = parseElse();

        final Token start = async != null ? async : keyword;
        return node(async != null ? NodeKind.ASYNC_FOR : NodeKind.FOR, start)
                .child(Fields.TARGET, target)
                .child(Fields.ITER, iter)
                .children(Fields.BODY, body)
                .children(Fields.ORELSE, orelse)
                .build();
    }

    private List<SyntaxNode> parseElse() {
        if (!peek().isKeyword("else")) {
            return List.of();
        }
        final Token elseToken = advance();
        return parseBlock("'else' statement", elseToken);
    }

    private SyntaxNode parseTry() {
        final Token keyword = advance();
        final List<SyntaxNode> body = parseBlock("'try' statement", keyword);

        final List<SyntaxNode> handlers = new ArrayList<>();
        boolean star = false;
        while (peek().isKeyword("except")) {
            final Token except = advance();
            if (checkOp("*")) {
                advance();
                star = true;
            }
            SyntaxNode type = null;
            String name = null;
            if (!checkOp(":")) {
                type = parseExpression();
                if (checkOp(",")) {
                    throw errorAt(type, "multiple exception types must be"
                            + " parenthesized");
                }
                if (peek().isKeyword("as")) {
                    advance();
                    name = expectName().text();
                }
            }
            final List<SyntaxNode> handlerBody = parseBlock(
                    "'except' statement", except);
            handlers.add(node(NodeKind.EXCEPT_HANDLER, except)
                    .payload(name)
                    .child(Fields.TYPE, type)
                    .children(Fields.BODY, handlerBody)
                    .build());
        }

        List<SyntaxNode> orelse = List.of();
        if (!handlers.isEmpty() && peek().isKeyword("else")) {
            final Token elseToken = advance();
            orelse = parseBlock("'else' statement", elseToken);
        }

        List<SyntaxNode> finalbody = List.of();
        if (peek().isKeyword("finally")) {
            final Token finallyToken = advance();
            finalbody = parseBlock("'finally' statement", finallyToken);
        }

        if (handlers.isEmpty() && finalbody.isEmpty()) {
            throw errorAt(peek(), "expected 'except' or 'finally' block");
        }

        return node(star ? NodeKind.TRY_STAR : NodeKind.TRY, keyword)
                .children(Fields.BODY, body)
                .children(Fields.HANDLERS, handlers)
                .children(Fields.ORELSE, orelse)
                .children(Fields.FINALBODY, finalbody)
                .build();
    }

    private SyntaxNode parseWith(final Token async) {
        final Token keyword = advance();

        List<SyntaxNode> items = null;
        if (checkOp("(")) {
            final int mark = index;
            try {
                items = parseParenthesizedWithItems();
            } catch (final PythonSyntaxException e) {
                if (lexicalError != null) {
                    throw lexicalError;
                }
                index = mark;
                items = null;
            }
        }
        if (items == null) {
            items = new ArrayList<>();
            items.add(parseWithItem());
            while (checkOp(",")) {
                advance();
                items.add(parseWithItem());
            }
        }

        final List<SyntaxNode> body = parseBlock("'with' statement", keyword);

        final Token start = async != null ? async : keyword;
        return node(async != null ? NodeKind.ASYNC_WITH : NodeKind.WITH, start)
                .children(Fields.ITEMS, items)
                .children(Fields.BODY, body)
                .build();
    }

    private List<SyntaxNode> parseParenthesizedWithItems() {
        advance();
        final List<SyntaxNode> items = new ArrayList<>();
        items.add(parseWithItem());
        while (checkOp(",")) {
            advance();
            if (checkOp(")")) {
                break;
            }
            items.add(parseWithItem());
        }
        expectOp(")");
        if (!checkOp(":")) {
            throw errorAt(peek(), "expected ':'");
        }
        return items;
    }

    private SyntaxNode parseWithItem() {
        final SyntaxNode context = parseExpression();
        SyntaxNode vars = null;
        if (peek().isKeyword("as")) {
            advance();
            vars = parseStarTarget();
            checkAssignable(vars, "assign to");
        }
        return SyntaxNode.builder(NodeKind.WITH_ITEM, 0, 0)
                .child(Fields.CONTEXT_EXPR, context)
                .child(Fields.OPTIONAL_VARS, vars)
                .build();
    }

    /**
     * Parses the colon and the suite of a compound statement.
     *
     * @param construct how the construct is named in error messages
     * @param header the keyword token that opened the construct
     */
    private List<SyntaxNode> parseBlock(final String construct,
            final Token header) {
        expectOp(":", "expected ':'");

        if (!peek().is(Type.NEWLINE)) {
            return parseSimpleStatements();
        }
        advance();

        if (!peek().is(Type.INDENT)) {
            throw errorAt(peek(), "expected an indented block after "
                    + construct + " on line " + header.line());
        }
        advance();

        final List<SyntaxNode> body = new ArrayList<>();
        while (!peek().is(Type.DEDENT) && !peek().is(Type.ENDMARKER)) {
            body.addAll(parseStatement());
        }
        if (peek().is(Type.DEDENT)) {
            advance();
        }
        return body;
    }

    // -- Pattern matching --

    /**
     * Parses a {@code match} statement, or returns null when {@code match}
     * is an ordinary name, as in {@code match = re.match(p, s)}.
     */
    private SyntaxNode parseMatchIfPresent() {
        final int mark = index;
        final Token keyword = advance();

        final SyntaxNode subject;
        try {
            subject = parseMatchSubject();
        } catch (final PythonSyntaxException e) {
            if (lexicalError != null) {
                throw lexicalError;
            }
            index = mark;
            return null;
        }
        if (!checkOp(":") || !peek(1).is(Type.NEWLINE)) {
            index = mark;
            return null;
        }
        advance();
        advance();

        if (!peek().is(Type.INDENT)) {
            throw errorAt(peek(), "expected an indented block after 'match'"
                    + " statement on line " + keyword.line());
        }
        advance();

        final List<SyntaxNode> cases = new ArrayList<>();
        do {
            cases.add(parseCase());
        } while (!peek().is(Type.DEDENT) && !peek().is(Type.ENDMARKER));
        if (peek().is(Type.DEDENT)) {
            advance();
        }

        return node(NodeKind.MATCH, keyword)
                .child(Fields.SUBJECT, subject)
                .children(Fields.CASES, cases)
                .build();
    }

    private SyntaxNode parseMatchSubject() {
        final Token start = peek();
        final SyntaxNode first = parseStarNamedExpression();
        if (!checkOp(",")) {
            if (first.is(NodeKind.STARRED)) {
                throw errorAt(first, INVALID_SYNTAX);
            }
            return first;
        }
        final List<SyntaxNode> elts = new ArrayList<>();
        elts.add(first);
        while (checkOp(",")) {
            advance();
            if (!startsExpression(peek())) {
                break;
            }
            elts.add(parseStarNamedExpression());
        }
        return node(NodeKind.TUPLE, start).children(Fields.ELTS, elts).build();
    }

    private SyntaxNode parseCase() {
        final Token keyword = peek();
        if (!keyword.isKeyword("case")) {
            throw errorAt(keyword, INVALID_SYNTAX);
        }
        advance();

        final SyntaxNode pattern = parsePatterns();
        SyntaxNode guard = null;
        if (peek().isKeyword("if")) {
            advance();
            guard = parseNamedExpression();
        }
        final List<SyntaxNode> body = parseBlock("'case' statement", keyword);

        return SyntaxNode.builder(NodeKind.MATCH_CASE, 0, 0)
                .child(Fields.PATTERN, pattern)
                .child(Fields.GUARD, guard)
                .children(Fields.BODY, body)
                .build();
    }

    /** Parses the pattern of a case, an open sequence being allowed. */
    private SyntaxNode parsePatterns() {
        final Token start = peek();
        final SyntaxNode first = parseMaybeStarPattern();
        if (!checkOp(",")) {
            if (first.is(NodeKind.MATCH_STAR)) {
                throw errorAt(peek(), INVALID_SYNTAX);
            }
            return first;
        }
        final List<SyntaxNode> patterns = new ArrayList<>();
        patterns.add(first);
        while (checkOp(",")) {
            advance();
            if (!startsPattern(peek())) {
                break;
            }
            patterns.add(parseMaybeStarPattern());
        }
        return node(NodeKind.MATCH_SEQUENCE, start)
                .children(Fields.PATTERNS, patterns)
                .build();
    }

    private SyntaxNode parseMaybeStarPattern() {
        if (!checkOp("*")) {
            return parsePattern();
        }
        final Token star = advance();
        final Token name = expectName();
        return node(NodeKind.MATCH_STAR, star)
                .payload(captureName(name))
                .build();
    }

    private SyntaxNode parsePattern() {
        final Token start = peek();
        final SyntaxNode pattern = parseOrPattern();
        if (!peek().isKeyword("as")) {
            return pattern;
        }
        advance();
        final Token name = peek();
        if (name.isKeyword("_")) {
            throw errorAt(name, "cannot use '_' as a target");
        }
        expectName();
        return node(NodeKind.MATCH_AS, start)
                .payload(name.text())
                .child(Fields.PATTERN, pattern)
                .build();
    }

    private SyntaxNode parseOrPattern() {
        final Token start = peek();
        final SyntaxNode first = parseClosedPattern();
        if (!checkOp("|")) {
            return first;
        }
        final List<SyntaxNode> patterns = new ArrayList<>();
        patterns.add(first);
        while (checkOp("|")) {
            advance();
            patterns.add(parseClosedPattern());
        }
        return node(NodeKind.MATCH_OR, start)
                .children(Fields.PATTERNS, patterns)
                .build();
    }

    private SyntaxNode parseClosedPattern() {
        final Token token = peek();

        if (token.is(Type.NUMBER) || token.is(Type.STRING)
                || token.isOp("-")) {
            final SyntaxNode value = parseLiteralExpression();
            return node(NodeKind.MATCH_VALUE, value)
                    .child(Fields.VALUE, value)
                    .build();
        }
        if (token.isKeyword("None")) {
            advance();
            return node(NodeKind.MATCH_SINGLETON, token)
                    .payload(LiteralValue.none())
                    .build();
        }
        if (token.isKeyword("True") || token.isKeyword("False")) {
            advance();
            return node(NodeKind.MATCH_SINGLETON, token)
                    .payload(LiteralValue.ofBoolean(token.isKeyword("True")))
                    .build();
        }
        if (token.is(Type.NAME)) {
            return parseNamePattern();
        }
        if (token.isOp("(")) {
            return parseGroupPattern();
        }
        if (token.isOp("[")) {
            return parseSequencePattern();
        }
        if (token.isOp("{")) {
            return parseMappingPattern();
        }
        throw errorAt(token, INVALID_SYNTAX);
    }

    /** Capture, wildcard, value or class pattern. */
    private SyntaxNode parseNamePattern() {
        final Token first = expectName();
        if (!checkOp(".") && !checkOp("(")) {
            return node(NodeKind.MATCH_AS, first)
                    .payload(captureName(first))
                    .build();
        }

        final SyntaxNode target = parseAttributeChain(first);
        if (checkOp("(")) {
            return parseClassPattern(target);
        }
        return node(NodeKind.MATCH_VALUE, target)
                .child(Fields.VALUE, target)
                .build();
    }

    private SyntaxNode parseAttributeChain(final Token first) {
        SyntaxNode target = node(NodeKind.NAME, first)
                .payload(first.text())
                .build();
        while (checkOp(".")) {
            advance();
            final Token name = expectName();
            target = node(NodeKind.ATTRIBUTE, first)
                    .payload(name.text())
                    .child(Fields.VALUE, target)
                    .build();
        }
        return target;
    }

    private SyntaxNode parseClassPattern(final SyntaxNode cls) {
        advance();
        final List<SyntaxNode> patterns = new ArrayList<>();
        final List<String> attributes = new ArrayList<>();
        final List<SyntaxNode> keywordPatterns = new ArrayList<>();

        while (!checkOp(")")) {
            final Token token = peek();
            if (token.is(Type.NAME) && peek(1).isOp("=")) {
                advance();
                advance();
                attributes.add(token.text());
                keywordPatterns.add(parsePattern());
            } else {
                final SyntaxNode pattern = parsePattern();
                if (!attributes.isEmpty()) {
                    throw errorAt(pattern, "positional patterns follow"
                            + " keyword patterns");
                }
                patterns.add(pattern);
            }
            if (!checkOp(",")) {
                break;
            }
            advance();
        }
        expectOp(")");

        return node(NodeKind.MATCH_CLASS, cls)
                .payload(List.copyOf(attributes))
                .child(Fields.CLS, cls)
                .children(Fields.PATTERNS, patterns)
                .children(Fields.KWD_PATTERNS, keywordPatterns)
                .build();
    }

    /** A parenthesized pattern or a parenthesized sequence pattern. */
    private SyntaxNode parseGroupPattern() {
        final Token open = advance();
        if (checkOp(")")) {
            advance();
            return node(NodeKind.MATCH_SEQUENCE, open)
                    .children(Fields.PATTERNS, List.of())
                    .build();
        }

        final SyntaxNode first = parseMaybeStarPattern();
        if (!checkOp(",")) {
            if (first.is(NodeKind.MATCH_STAR)) {
                throw errorAt(peek(), INVALID_SYNTAX);
            }
            expectOp(")");
            return first;
        }

        final List<SyntaxNode> patterns = new ArrayList<>();
        patterns.add(first);
        while (checkOp(",")) {
            advance();
            if (checkOp(")")) {
                break;
            }
            patterns.add(parseMaybeStarPattern());
        }
        expectOp(")");
        return node(NodeKind.MATCH_SEQUENCE, open)
                .children(Fields.PATTERNS, patterns)
                .build();
    }

    private SyntaxNode parseSequencePattern() {
        final Token open = advance();
        final List<SyntaxNode> patterns = new ArrayList<>();
        while (!checkOp("]")) {
            patterns.add(parseMaybeStarPattern());
            if (!checkOp(",")) {
                break;
            }
            advance();
        }
        expectOp("]");
        return node(NodeKind.MATCH_SEQUENCE, open)
                .children(Fields.PATTERNS, patterns)
                .build();
    }

    private SyntaxNode parseMappingPattern() {
        final Token open = advance();
        final List<SyntaxNode> keys = new ArrayList<>();
        final List<SyntaxNode> patterns = new ArrayList<>();
        String rest = null;

        while (!checkOp("}")) {
            if (checkOp("**")) {
                advance();
                final Token name = peek();
                if (name.isKeyword("_")) {
                    throw errorAt(name, INVALID_SYNTAX);
                }
                rest = expectName().text();
                if (checkOp(",")) {
                    advance();
                }
                break;
            }
            keys.add(parseMappingKey());
            expectOp(":");
            patterns.add(parsePattern());
            if (!checkOp(",")) {
                break;
            }
            advance();
        }
        expectOp("}");

        return node(NodeKind.MATCH_MAPPING, open)
                .payload(rest)
                .children(Fields.KEYS, keys)
                .children(Fields.PATTERNS, patterns)
                .build();
    }

    private SyntaxNode parseMappingKey() {
        final Token token = peek();
        if (token.isKeyword("None") || token.isKeyword("True")
                || token.isKeyword("False")) {
            return parseNameAtom(token);
        }
        if (token.is(Type.NAME)) {
            final Token first = expectName();
            if (!checkOp(".")) {
                throw errorAt(peek(), INVALID_SYNTAX);
            }
            return parseAttributeChain(first);
        }
        return parseLiteralExpression();
    }

    /** A string, a signed number or a complex literal such as 1 - 2j. */
    private SyntaxNode parseLiteralExpression() {
        final Token start = peek();
        if (start.is(Type.STRING)) {
            return parseStrings();
        }

        final SyntaxNode real = parseSignedNumber();
        if (!checkOp("+") && !checkOp("-")) {
            return real;
        }
        final String operator = advance().text();
        final Token imaginaryToken = peek();
        if (!imaginaryToken.is(Type.NUMBER)) {
            throw errorAt(imaginaryToken, INVALID_SYNTAX);
        }
        final SyntaxNode imaginary = parseSignedNumber();
        if (isImaginary(real)) {
            throw errorAt(real, "real number required in complex literal");
        }
        if (!isImaginary(imaginary)) {
            throw errorAt(imaginary, "imaginary number required in complex"
                    + " literal");
        }
        return node(NodeKind.BIN_OP, start)
                .payload(operator)
                .child(Fields.LEFT, real)
                .child(Fields.RIGHT, imaginary)
                .build();
    }

    private SyntaxNode parseSignedNumber() {
        final Token sign = peek();
        if (sign.isOp("-")) {
            advance();
        }
        final Token number = peek();
        if (!number.is(Type.NUMBER)) {
            throw errorAt(number, INVALID_SYNTAX);
        }
        advance();
        final SyntaxNode constant = node(NodeKind.CONSTANT, number)
                .payload(LiteralValue.ofNumber(number.text()))
                .build();
        if (!sign.isOp("-")) {
            return constant;
        }
        return node(NodeKind.UNARY_OP, sign)
                .payload("-")
                .child(Fields.OPERAND, constant)
                .build();
    }

    private static boolean isImaginary(final SyntaxNode number) {
        final SyntaxNode constant = number.is(NodeKind.UNARY_OP)
                ? number.requireChild(Fields.OPERAND) : number;
        return constant.payload(LiteralValue.class).kind()
                == LiteralValue.LiteralKind.IMAGINARY;
    }

    /** @return the bound name, null for the wildcard {@code _} */
    private static String captureName(final Token name) {
        return "_".equals(name.text()) ? null : name.text();
    }

    /** Tells whether a token can begin a pattern. */
    private static boolean startsPattern(final Token token) {
        switch (token.type()) {
            case NAME:
                return !KEYWORDS.contains(token.text())
                        || token.isKeyword("None") || token.isKeyword("True")
                        || token.isKeyword("False");
            case NUMBER:
            case STRING:
                return true;
            case OP:
                return token.isOp("(") || token.isOp("[") || token.isOp("{")
                        || token.isOp("-") || token.isOp("*");
            default:
                return false;
        }
    }

    // -- Parameters and arguments --

    private SyntaxNode parseParameters(final String closer,
            final boolean annotations) {
        final List<SyntaxNode> posonly = new ArrayList<>();
        final List<SyntaxNode> args = new ArrayList<>();
        final List<SyntaxNode> defaults = new ArrayList<>();
        final List<SyntaxNode> kwonly = new ArrayList<>();
        final List<SyntaxNode> kwDefaults = new ArrayList<>();
        SyntaxNode vararg = null;
        SyntaxNode kwarg = null;
        boolean seenStar = false;
        boolean seenSlash = false;

        while (!checkOp(closer)) {
            final Token token = peek();
            if (kwarg != null) {
                throw errorAt(token, "arguments cannot follow var-keyword"
                        + " argument");
            }
            if (token.isOp("/")) {
                if (seenSlash || seenStar || args.isEmpty()) {
                    throw errorAt(token, seenSlash ? "/ may appear only once"
                            : "at least one argument must precede /");
                }
                advance();
                posonly.addAll(args);
                args.clear();
                seenSlash = true;
            } else if (token.isOp("**")) {
                advance();
                kwarg = parseParameter(annotations);
            } else if (token.isOp("*")) {
                if (seenStar) {
                    throw errorAt(token, "* argument may appear only once");
                }
                advance();
                seenStar = true;
                if (peek().is(Type.NAME)) {
                    vararg = parseParameter(annotations);
                } else if (checkOp(closer) || (checkOp(",")
                        && peek(1).isOp(closer))) {
                    throw errorAt(token, "named arguments must follow bare *");
                }
            } else {
                final SyntaxNode parameter = parseParameter(annotations);
                SyntaxNode value = null;
                if (checkOp("=")) {
                    advance();
                    value = parseExpression();
                }
                if (seenStar) {
                    kwonly.add(parameter);
                    kwDefaults.add(value);
                } else {
                    args.add(parameter);
                    if (value != null) {
                        defaults.add(value);
                    } else if (!defaults.isEmpty()) {
                        throw errorAt(parameter, "non-default argument"
                                + " follows default argument");
                    }
                }
            }
            if (!checkOp(",")) {
                break;
            }
            advance();
        }

        return SyntaxNode.builder(NodeKind.ARGUMENTS, 0, 0)
                .children(Fields.POSONLYARGS, posonly)
                .children(Fields.ARGS, args)
                .child(Fields.VARARG, vararg)
                .children(Fields.KWONLYARGS, kwonly)
                .children(Fields.KW_DEFAULTS, kwDefaults)
                .child(Fields.KWARG, kwarg)
                .children(Fields.DEFAULTS, defaults)
                .build();
    }

    private SyntaxNode parseParameter(final boolean annotations) {
        final Token name = expectName();
        SyntaxNode annotation = null;
        if (annotations && checkOp(":")) {
            advance();
            annotation = checkOp("*") ? parseStarExpression()
                    : parseExpression();
        }
        return node(NodeKind.ARG, name)
                .payload(name.text())
                .child(Fields.ANNOTATION, annotation)
                .build();
    }

    /**
     * Parses a parenthesized argument list into positional arguments and
     * keywords, as used by calls and class definitions.
     */
    private void parseArguments(final List<SyntaxNode> args,
            final List<SyntaxNode> keywords) {
        final Token open = advance();
        boolean seenKeyword = false;
        Token firstUnpacking = null;
        String misplacedPositional = null;

        while (!checkOp(")")) {
            final Token token = peek();

            if (token.isOp("*")) {
                advance();
                if (firstUnpacking != null) {
                    throw errorAt(firstUnpacking, "iterable argument"
                            + " unpacking follows keyword argument unpacking");
                }
                args.add(node(NodeKind.STARRED, token)
                        .child(Fields.VALUE, parseExpression())
                        .build());
            } else if (token.isOp("**")) {
                advance();
                keywords.add(node(NodeKind.KEYWORD, token)
                        .child(Fields.VALUE, parseExpression())
                        .build());
                if (firstUnpacking == null) {
                    firstUnpacking = token;
                }
            } else if (token.is(Type.NAME) && peek(1).isOp("=")) {
                if (KEYWORDS.contains(token.text())) {
                    throw errorAt(token, "True".equals(token.text())
                            || "False".equals(token.text())
                            || "None".equals(token.text())
                            ? "cannot assign to " + token.text()
                            : INVALID_SYNTAX);
                }
                advance();
                advance();
                keywords.add(node(NodeKind.KEYWORD, token)
                        .payload(token.text())
                        .child(Fields.VALUE, parseExpression())
                        .build());
                seenKeyword = true;
            } else {
                SyntaxNode value = parseNamedExpression();
                if (startsComprehension()) {
                    value = node(NodeKind.GENERATOR_EXP, open)
                            .child(Fields.ELT, value)
                            .children(Fields.GENERATORS,
                                    parseComprehensions())
                            .build();
                    if (!args.isEmpty() || !keywords.isEmpty()
                            || (checkOp(",") && !peek(1).isOp(")"))) {
                        throw errorAt(token, "Generator expression must be"
                                + " parenthesized");
                    }
                }
                if (misplacedPositional == null && firstUnpacking != null) {
                    misplacedPositional = "positional argument follows"
                            + " keyword argument unpacking";
                } else if (misplacedPositional == null && seenKeyword) {
                    misplacedPositional = "positional argument follows"
                            + " keyword argument";
                }
                args.add(value);
            }

            if (!checkOp(",")) {
                break;
            }
            advance();
        }
        // Reported at the closing parenthesis, once the list is complete.
        if (misplacedPositional != null && checkOp(")")) {
            throw errorAt(peek(), misplacedPositional);
        }
        expectOp(")");
    }

    // -- Expressions --

    private SyntaxNode parseStarExpressions() {
        final Token start = peek();
        final SyntaxNode first = parseStarExpression();
        if (!checkOp(",")) {
            return first;
        }
        final List<SyntaxNode> elts = new ArrayList<>();
        elts.add(first);
        while (checkOp(",")) {
            advance();
            if (!startsExpression(peek())) {
                break;
            }
            elts.add(parseStarExpression());
        }
        return node(NodeKind.TUPLE, start).children(Fields.ELTS, elts).build();
    }

    private SyntaxNode parseStarExpression() {
        if (checkOp("*")) {
            final Token star = advance();
            return node(NodeKind.STARRED, star)
                    .child(Fields.VALUE, parseBitwiseOr())
                    .build();
        }
        return parseExpression();
    }

    private SyntaxNode parseStarNamedExpression() {
        if (checkOp("*")) {
            final Token star = advance();
            return node(NodeKind.STARRED, star)
                    .child(Fields.VALUE, parseBitwiseOr())
                    .build();
        }
        return parseNamedExpression();
    }

    private SyntaxNode parseNamedExpression() {
        final Token token = peek();
        if (token.is(Type.NAME) && !KEYWORDS.contains(token.text())
                && peek(1).isOp(":=")) {
            advance();
            advance();
            final SyntaxNode target = node(NodeKind.NAME, token)
                    .payload(token.text())
                    .build();
            return node(NodeKind.NAMED_EXPR, token)
                    .child(Fields.TARGET, target)
                    .child(Fields.VALUE, parseExpression())
                    .build();
        }
        return parseExpression();
    }

    private SyntaxNode parseExpression() {
        if (peek().isKeyword("lambda")) {
            return parseLambda();
        }
        final Token start = peek();
        final SyntaxNode body = parseDisjunction();
        if (!peek().isKeyword("if")) {
            return body;
        }
        advance();
        final SyntaxNode test = parseDisjunction();
        if (!peek().isKeyword("else")) {
            throw errorAt(peek(), "expected 'else' after 'if' expression");
        }
        advance();
        final SyntaxNode orelse = parseExpression();
        return node(NodeKind.IF_EXP, start)
                .child(Fields.TEST, test)
                .child(Fields.BODY, body)
                .child(Fields.ORELSE, orelse)
                .build();
    }

    private SyntaxNode parseLambda() {
        final Token keyword = advance();
        final SyntaxNode arguments = parseParameters(":", false);
        expectOp(":");
        final SyntaxNode body = parseExpression();
        return node(NodeKind.LAMBDA, keyword)
                .child(Fields.ARGS, arguments)
                .child(Fields.BODY, body)
                .build();
    }

    private SyntaxNode parseDisjunction() {
        return parseBooleanOperation("or");
    }

    private SyntaxNode parseBooleanOperation(final String operator) {
        final Token start = peek();
        final SyntaxNode first = "or".equals(operator)
                ? parseBooleanOperation("and") : parseInversion();
        if (!peek().isKeyword(operator)) {
            return first;
        }
        final List<SyntaxNode> values = new ArrayList<>();
        values.add(first);
        while (peek().isKeyword(operator)) {
            advance();
            values.add("or".equals(operator)
                    ? parseBooleanOperation("and") : parseInversion());
        }
        return node(NodeKind.BOOL_OP, start)
                .payload(operator)
                .children(Fields.VALUES, values)
                .build();
    }

    private SyntaxNode parseInversion() {
        if (peek().isKeyword("not")) {
            final Token not = advance();
            return node(NodeKind.UNARY_OP, not)
                    .payload("not")
                    .child(Fields.OPERAND, parseInversion())
                    .build();
        }
        return parseComparison();
    }

    private SyntaxNode parseComparison() {
        final Token start = peek();
        final SyntaxNode left = parseBitwiseOr();

        final List<String> operators = new ArrayList<>();
        final List<SyntaxNode> comparators = new ArrayList<>();
        while (true) {
            final String operator = readComparisonOperator();
            if (operator == null) {
                break;
            }
            operators.add(operator);
            comparators.add(parseBitwiseOr());
        }

        if (operators.isEmpty()) {
            return left;
        }
        return node(NodeKind.COMPARE, start)
                .payload(List.copyOf(operators))
                .child(Fields.LEFT, left)
                .children(Fields.COMPARATORS, comparators)
                .build();
    }

    private String readComparisonOperator() {
        final Token token = peek();
        if (token.is(Type.OP) && COMPARISONS.contains(token.text())) {
            advance();
            return token.text();
        }
        if (token.isKeyword("in")) {
            advance();
            return "in";
        }
        if (token.isKeyword("not") && peek(1).isKeyword("in")) {
            advance();
            advance();
            return "not in";
        }
        if (token.isKeyword("is")) {
            advance();
            if (peek().isKeyword("not")) {
                advance();
                return "is not";
            }
            return "is";
        }
        return null;
    }

    private SyntaxNode parseBitwiseOr() {
        return parseBinary(0);
    }

    private SyntaxNode parseBinary(final int level) {
        if (level == BINARY_LEVELS.size()) {
            return parseFactor();
        }
        final Set<String> operators = BINARY_LEVELS.get(level);
        final Token start = peek();
        SyntaxNode left = parseBinary(level + 1);
        while (peek().is(Type.OP) && operators.contains(peek().text())) {
            final String operator = advance().text();
            final SyntaxNode right = parseBinary(level + 1);
            left = node(NodeKind.BIN_OP, start)
                    .payload(operator)
                    .child(Fields.LEFT, left)
                    .child(Fields.RIGHT, right)
                    .build();
        }
        return left;
    }

    private SyntaxNode parseFactor() {
        final Token token = peek();
        if (token.isOp("+") || token.isOp("-") || token.isOp("~")) {
            advance();
            return node(NodeKind.UNARY_OP, token)
                    .payload(token.text())
                    .child(Fields.OPERAND, parseFactor())
                    .build();
        }
        return parsePower();
    }

    private SyntaxNode parsePower() {
        final Token start = peek();
        final SyntaxNode base = parseAwaitPrimary();
        if (!checkOp("**")) {
            return base;
        }
        advance();
        return node(NodeKind.BIN_OP, start)
                .payload("**")
                .child(Fields.LEFT, base)
                .child(Fields.RIGHT, parseFactor())
                .build();
    }

    private SyntaxNode parseAwaitPrimary() {
        if (peek().isKeyword("await")) {
            final Token await = advance();
            return node(NodeKind.AWAIT, await)
                    .child(Fields.VALUE, parsePrimary())
                    .build();
        }
        return parsePrimary();
    }

    private SyntaxNode parsePrimary() {
        final Token start = peek();
        SyntaxNode node = parseAtom();

        while (true) {
            if (checkOp(".")) {
                advance();
                final Token name = expectName();
                node = node(NodeKind.ATTRIBUTE, start)
                        .payload(name.text())
                        .child(Fields.VALUE, node)
                        .build();
            } else if (checkOp("(")) {
                final List<SyntaxNode> args = new ArrayList<>();
                final List<SyntaxNode> keywords = new ArrayList<>();
                parseArguments(args, keywords);
                node = node(NodeKind.CALL, start)
                        .child(Fields.FUNC, node)
                        .children(Fields.ARGS, args)
                        .children(Fields.KEYWORDS, keywords)
                        .build();
            } else if (checkOp("[")) {
                final SyntaxNode slice = parseSlices();
                node = node(NodeKind.SUBSCRIPT, start)
                        .child(Fields.VALUE, node)
                        .child(Fields.SLICE, slice)
                        .build();
            } else {
                return node;
            }
        }
    }

    private SyntaxNode parseSlices() {
        advance();
        final Token start = peek();
        final SyntaxNode first = parseSlice();
        if (!checkOp(",")) {
            expectOp("]");
            return first;
        }
        final List<SyntaxNode> elts = new ArrayList<>();
        elts.add(first);
        while (checkOp(",")) {
            advance();
            if (checkOp("]")) {
                break;
            }
            elts.add(parseSlice());
        }
        expectOp("]");
        return node(NodeKind.TUPLE, start).children(Fields.ELTS, elts).build();
    }

    private SyntaxNode parseSlice() {
        final Token start = peek();
        SyntaxNode lower = null;
        if (!checkOp(":")) {
            if (checkOp("*")) {
                return parseStarExpression();
            }
            lower = parseNamedExpression();
            if (!checkOp(":")) {
                return lower;
            }
        }
        advance();
        SyntaxNode upper = null;
        if (startsExpression(peek())) {
            upper = parseExpression();
        }
        SyntaxNode step = null;
        if (checkOp(":")) {
            advance();
            if (startsExpression(peek())) {
                step = parseExpression();
            }
        }
        return node(NodeKind.SLICE, start)
                .child(Fields.LOWER, lower)
                .child(Fields.UPPER, upper)
                .child(Fields.STEP, step)
                .build();
    }

    private SyntaxNode parseAtom() {
        final Token token = peek();

        switch (token.type()) {
            case NAME:
                return parseNameAtom(token);
            case NUMBER:
                advance();
                return node(NodeKind.CONSTANT, token)
                        .payload(LiteralValue.ofNumber(token.text()))
                        .build();
            case STRING:
                return parseStrings();
            case OP:
                if (token.isOp("(")) {
                    return parseGroup();
                }
                if (token.isOp("[")) {
                    return parseListDisplay();
                }
                if (token.isOp("{")) {
                    return parseDictOrSet();
                }
                if (token.isOp("...")) {
                    advance();
                    return node(NodeKind.CONSTANT, token)
                            .payload(LiteralValue.ellipsis())
                            .build();
                }
                throw errorAt(token, INVALID_SYNTAX);
            default:
                throw errorAt(token, INVALID_SYNTAX);
        }
    }

    private SyntaxNode parseNameAtom(final Token token) {
        switch (token.text()) {
            case "None":
                advance();
                return node(NodeKind.CONSTANT, token)
                        .payload(LiteralValue.none())
                        .build();
            case "True":
            case "False":
                advance();
                return node(NodeKind.CONSTANT, token)
                        .payload(LiteralValue.ofBoolean(
                                "True".equals(token.text())))
                        .build();
            default:
                if (KEYWORDS.contains(token.text())) {
                    throw errorAt(token, INVALID_SYNTAX);
                }
                advance();
                return node(NodeKind.NAME, token)
                        .payload(token.text())
                        .build();
        }
    }

    private SyntaxNode parseGroup() {
        final Token open = advance();

        if (checkOp(")")) {
            advance();
            return node(NodeKind.TUPLE, open)
                    .children(Fields.ELTS, List.of())
                    .build();
        }
        if (peek().isKeyword("yield")) {
            final SyntaxNode yield = parseYield();
            expectOp(")");
            return yield;
        }

        final SyntaxNode first = parseStarNamedExpression();

        if (startsComprehension()) {
            final List<SyntaxNode> generators = parseComprehensions();
            expectOp(")");
            return node(NodeKind.GENERATOR_EXP, open)
                    .child(Fields.ELT, first)
                    .children(Fields.GENERATORS, generators)
                    .build();
        }

        if (checkOp(",")) {
            final List<SyntaxNode> elts = new ArrayList<>();
            elts.add(first);
            while (checkOp(",")) {
                advance();
                if (checkOp(")")) {
                    break;
                }
                elts.add(parseStarNamedExpression());
            }
            expectOp(")");
            return node(NodeKind.TUPLE, open)
                    .children(Fields.ELTS, elts)
                    .build();
        }

        expectOp(")");
        if (first.is(NodeKind.STARRED)) {
            throw errorAt(first, "cannot use starred expression here");
        }
        return first;
    }

    private SyntaxNode parseListDisplay() {
        final Token open = advance();
        final List<SyntaxNode> elts = new ArrayList<>();

        if (!checkOp("]")) {
            final SyntaxNode first = parseStarNamedExpression();
            if (startsComprehension()) {
                final List<SyntaxNode> generators = parseComprehensions();
                expectOp("]");
                return node(NodeKind.LIST_COMP, open)
                        .child(Fields.ELT, first)
                        .children(Fields.GENERATORS, generators)
                        .build();
            }
            elts.add(first);
            while (checkOp(",")) {
                advance();
                if (checkOp("]")) {
                    break;
                }
                elts.add(parseStarNamedExpression());
            }
        }
        expectOp("]");
        return node(NodeKind.LIST, open).children(Fields.ELTS, elts).build();
    }

    private SyntaxNode parseDictOrSet() {
        final Token open = advance();

        if (checkOp("}")) {
            advance();
            return node(NodeKind.DICT, open)
                    .children(Fields.KEYS, List.of())
                    .children(Fields.VALUES, List.of())
                    .build();
        }

        final List<SyntaxNode> keys = new ArrayList<>();
        final List<SyntaxNode> values = new ArrayList<>();

        if (checkOp("**")) {
            advance();
            keys.add(null);
            values.add(parseBitwiseOr());
            return parseDictRest(open, keys, values);
        }

        final SyntaxNode first = parseStarNamedExpression();

        if (checkOp(":") && !first.is(NodeKind.STARRED)) {
            advance();
            final SyntaxNode value = parseExpression();
            if (startsComprehension()) {
                final List<SyntaxNode> generators = parseComprehensions();
                expectOp("}");
                return node(NodeKind.DICT_COMP, open)
                        .child(Fields.KEY, first)
                        .child(Fields.VALUE, value)
                        .children(Fields.GENERATORS, generators)
                        .build();
            }
            keys.add(first);
            values.add(value);
            return parseDictRest(open, keys, values);
        }

        if (startsComprehension()) {
            final List<SyntaxNode> generators = parseComprehensions();
            expectOp("}");
            return node(NodeKind.SET_COMP, open)
                    .child(Fields.ELT, first)
                    .children(Fields.GENERATORS, generators)
                    .build();
        }

        final List<SyntaxNode> elts = new ArrayList<>();
        elts.add(first);
        while (checkOp(",")) {
            advance();
            if (checkOp("}")) {
                break;
            }
            elts.add(parseStarNamedExpression());
        }
        expectOp("}");
        return node(NodeKind.SET, open).children(Fields.ELTS, elts).build();
    }

    private SyntaxNode parseDictRest(final Token open,
            final List<SyntaxNode> keys, final List<SyntaxNode> values) {
        while (checkOp(",")) {
            advance();
            if (checkOp("}")) {
                break;
            }
            if (checkOp("**")) {
                advance();
                keys.add(null);
                values.add(parseBitwiseOr());
            } else {
                keys.add(parseExpression());
                expectOp(":", "':' expected after dictionary key");
                values.add(parseExpression());
            }
        }
        expectOp("}");
        return node(NodeKind.DICT, open)
                .children(Fields.KEYS, keys)
                .children(Fields.VALUES, values)
                .build();
    }

    private boolean startsComprehension() {
        return peek().isKeyword("for")
                || (peek().isKeyword("async") && peek(1).isKeyword("for"));
    }

    private List<SyntaxNode> parseComprehensions() {
        final List<SyntaxNode> generators = new ArrayList<>();
        while (startsComprehension()) {
            final boolean async = peek().isKeyword("async");
            if (async) {
                advance();
            }
            advance();
            final SyntaxNode target = parseTargetList();
            if (!peek().isKeyword("in")) {
                throw errorAt(peek(), INVALID_SYNTAX);
            }
            advance();
            final SyntaxNode iter = parseDisjunction();
            final List<SyntaxNode> ifs = new ArrayList<>();
            while (peek().isKeyword("if")) {
                advance();
                ifs.add(parseDisjunction());
            }
            generators.add(SyntaxNode.builder(NodeKind.COMPREHENSION, 0, 0)
                    .payload(async)
                    .child(Fields.TARGET, target)
                    .child(Fields.ITER, iter)
                    .children(Fields.IFS, ifs)
                    .build());
        }
        return generators;
    }

    private SyntaxNode parseTargetList() {
        final Token start = peek();
        final SyntaxNode first = parseStarTarget();
        SyntaxNode target = first;
        if (checkOp(",")) {
            final List<SyntaxNode> elts = new ArrayList<>();
            elts.add(first);
            while (checkOp(",")) {
                advance();
                if (!startsExpression(peek())) {
                    break;
                }
                elts.add(parseStarTarget());
            }
            target = node(NodeKind.TUPLE, start)
                    .children(Fields.ELTS, elts)
                    .build();
        }
        checkAssignable(target, "assign to");
        return target;
    }

    private SyntaxNode parseStarTarget() {
        if (checkOp("*")) {
            final Token star = advance();
            return node(NodeKind.STARRED, star)
                    .child(Fields.VALUE, parseBitwiseOr())
                    .build();
        }
        return parseBitwiseOr();
    }

    private SyntaxNode parseYield() {
        final Token keyword = advance();
        if (peek().isKeyword("from")) {
            advance();
            return node(NodeKind.YIELD_FROM, keyword)
                    .child(Fields.VALUE, parseExpression())
                    .build();
        }
        SyntaxNode value = null;
        if (startsExpression(peek())) {
            value = parseStarExpressions();
        }
        return node(NodeKind.YIELD, keyword)
                .child(Fields.VALUE, value)
                .build();
    }

    // -- Strings --

    /**
     * Parses one or more adjacent string tokens into a single constant or,
     * when any of them is an f-string, a joined string.
     *
     * <p>An error inside the strings is reported at the token that follows
     * them, where CPython reports it.</p>
     */
    private SyntaxNode parseStrings() {
        final Token first = peek();
        final List<Token> run = new ArrayList<>();
        while (peek().is(Type.STRING)) {
            run.add(advance());
        }
        try {
            return decodeStrings(first, run);
        } catch (final PythonSyntaxException e) {
            final Token next = peek();
            throw new PythonSyntaxException(e.getMessage(), next.line(),
                    next.column() + 1, lines.line(next.line()));
        }
    }

    private SyntaxNode decodeStrings(final Token first,
            final List<Token> run) {
        final List<Literal> literals = new ArrayList<>();
        for (final Token token : run) {
            literals.add(StringLiterals.read(token, lines));
        }

        boolean anyBytes = false;
        boolean anyText = false;
        boolean anyFormatted = false;
        for (final Literal literal : literals) {
            anyBytes |= literal.bytes();
            anyText |= !literal.bytes();
            anyFormatted |= literal.formatted();
        }
        if (anyBytes && anyText) {
            throw errorAt(first, "cannot mix bytes and nonbytes literals");
        }

        if (anyBytes) {
            final StringBuilder body = new StringBuilder();
            for (final Literal literal : literals) {
                body.append(literal.value());
            }
            return node(NodeKind.CONSTANT, first)
                    .payload(LiteralValue.ofBytes(body.toString()))
                    .build();
        }

        if (!anyFormatted) {
            final StringBuilder text = new StringBuilder();
            for (final Literal literal : literals) {
                text.append(literal.value());
            }
            return node(NodeKind.CONSTANT, first)
                    .payload(LiteralValue.ofString(text.toString()))
                    .build();
        }

        final List<Segment> segments = new ArrayList<>();
        for (final Literal literal : literals) {
            if (literal.formatted()) {
                segments.addAll(literal.segments());
            } else if (!literal.value().isEmpty()) {
                segments.add(new Segment(literal.value(), null));
            }
        }
        return joinedString(segments, first);
    }

    private SyntaxNode joinedString(final List<Segment> segments,
            final Token at) {
        final List<SyntaxNode> values = new ArrayList<>();
        final StringBuilder pending = new StringBuilder();

        for (final Segment segment : segments) {
            if (segment.field() == null) {
                pending.append(segment.text());
                continue;
            }
            if (pending.length() > 0) {
                values.add(node(NodeKind.CONSTANT, at)
                        .payload(LiteralValue.ofString(pending.toString()))
                        .build());
                pending.setLength(0);
            }
            values.add(formattedValue(segment.field(), at));
        }
        if (pending.length() > 0) {
            values.add(node(NodeKind.CONSTANT, at)
                    .payload(LiteralValue.ofString(pending.toString()))
                    .build());
        }

        return node(NodeKind.JOINED_STR, at)
                .children(Fields.VALUES, values)
                .build();
    }

    private SyntaxNode formattedValue(final Field field, final Token at) {
        final PythonTokenizer fieldTokenizer = new PythonTokenizer(
                field.expression(), lines, true, field.line(), field.column());
        final SyntaxNode value = new PythonParser(fieldTokenizer, lines)
                .parseEmbeddedExpression();

        final SyntaxNode spec = field.formatSpec() == null
                ? null : joinedString(field.formatSpec(), at);

        return node(NodeKind.FORMATTED_VALUE, at)
                .payload(field.conversion())
                .child(Fields.VALUE, value)
                .child(Fields.FORMAT_SPEC, spec)
                .build();
    }

    // -- Target validation --

    private static boolean isSingleTarget(final SyntaxNode node) {
        return node.is(NodeKind.NAME) || node.is(NodeKind.ATTRIBUTE)
                || node.is(NodeKind.SUBSCRIPT);
    }

    private void checkAssignable(final SyntaxNode node, final String verb) {
        switch (node.kind()) {
            case NAME, ATTRIBUTE, SUBSCRIPT:
                return;
            case TUPLE, LIST:
                for (final SyntaxNode element : node.children(Fields.ELTS)) {
                    checkAssignable(element, verb);
                }
                return;
            case STARRED:
                if ("delete".equals(verb)) {
                    throw errorAt(node, "cannot delete starred");
                }
                checkAssignable(node.requireChild(Fields.VALUE), verb);
                return;
            default:
                throw errorAt(node, "cannot " + verb + " " + describe(node));
        }
    }

    private static String describe(final SyntaxNode node) {
        switch (node.kind()) {
            case CALL:
                return "function call";
            case CONSTANT:
                final LiteralValue literal = node.payload(LiteralValue.class);
                return switch (literal.kind()) {
                    case NONE -> "None";
                    case BOOLEAN -> Boolean.TRUE.equals(literal.value())
                            ? "True" : "False";
                    case ELLIPSIS -> "ellipsis";
                    default -> "literal";
                };
            case TUPLE:
                return "tuple";
            case LIST:
                return "list";
            case JOINED_STR:
                return "f-string expression";
            case COMPARE:
                return "comparison";
            case LAMBDA:
                return "lambda";
            case NAMED_EXPR:
                return "named expression";
            case AWAIT:
                return "await expression";
            case YIELD, YIELD_FROM:
                return "yield expression";
            case DICT:
                return "dict literal";
            case SET:
                return "set display";
            case GENERATOR_EXP:
                return "generator expression";
            case LIST_COMP:
                return "list comprehension";
            case DICT_COMP:
                return "dict comprehension";
            case SET_COMP:
                return "set comprehension";
            case IF_EXP:
                return "conditional expression";
            default:
                return "expression";
        }
    }

    // -- Token access --

    private Token peek() {
        return peek(0);
    }

    private Token peek(final int ahead) {
        while (tokens.size() <= index + ahead) {
            fetch();
        }
        return tokens.get(index + ahead);
    }

    private void fetch() {
        if (lexicalError != null) {
            throw lexicalError;
        }
        try {
            tokens.add(tokenizer.next());
        } catch (final PythonSyntaxException e) {
            lexicalError = e;
            throw e;
        }
    }

    private Token advance() {
        final Token token = peek();
        index++;
        return token;
    }

    private boolean checkOp(final String op) {
        return peek().isOp(op);
    }

    private void expectOp(final String op) {
        expectOp(op, INVALID_SYNTAX);
    }

    private void expectOp(final String op, final String message) {
        if (!checkOp(op)) {
            throw errorAt(peek(), message);
        }
        advance();
    }

    private Token expectName() {
        final Token token = peek();
        if (!token.is(Type.NAME) || KEYWORDS.contains(token.text())) {
            throw errorAt(token, INVALID_SYNTAX);
        }
        return advance();
    }

    /** Tells whether a token can begin an expression. */
    private static boolean startsExpression(final Token token) {
        switch (token.type()) {
            case NAME:
                return !KEYWORDS.contains(token.text())
                        || EXPRESSION_KEYWORDS.contains(token.text());
            case NUMBER:
            case STRING:
                return true;
            case OP:
                return token.isOp("(") || token.isOp("[") || token.isOp("{")
                        || token.isOp("-") || token.isOp("+")
                        || token.isOp("~") || token.isOp("*")
                        || token.isOp("...");
            default:
                return false;
        }
    }

    /** @return the width of the indentation of a line, in characters */
    private int indentWidth(final int line) {
        final String text = lines.line(line);
        int width = 0;
        while (text != null && width < text.length()
                && (text.charAt(width) == ' ' || text.charAt(width) == '\t'
                        || text.charAt(width) == '\f')) {
            width++;
        }
        return width;
    }

    private static SyntaxNode.Builder node(final NodeKind kind,
            final Token at) {
        return SyntaxNode.builder(kind, at.line(), at.column());
    }

    private static SyntaxNode.Builder node(final NodeKind kind,
            final SyntaxNode at) {
        return SyntaxNode.builder(kind, at.line(), at.column());
    }

    private PythonSyntaxException errorAt(final Token token,
            final String message) {
        final PythonSyntaxException legacy = legacyStatementError(token);
        if (legacy != null) {
            return legacy;
        }
        return new PythonSyntaxException(message, token.line(),
                token.column() + 1, lines.line(token.line()));
    }

    /**
     * Detects a Python 2 {@code print x} or {@code exec x} statement when
     * parsing stops right after the bare name.
     *
     * @param at the token parsing stopped at
     * @return the error to report instead, or null
     */
    private PythonSyntaxException legacyStatementError(final Token at) {
        if (index < 1 || index >= tokens.size() || tokens.get(index) != at
                || !startsExpression(at) || at.isOp("(")) {
            return null;
        }
        final Token name = tokens.get(index - 1);
        if (!name.is(Type.NAME) || !LEGACY_STATEMENTS.contains(name.text())) {
            return null;
        }
        if (index >= 2) {
            final Token before = tokens.get(index - 2);
            if (before.isOp(".") || (before.is(Type.NAME)
                    && DECLARING_KEYWORDS.contains(before.text()))) {
                return null;
            }
        }
        return new PythonSyntaxException("Missing parentheses in call to '"
                + name.text() + "'. Did you mean " + name.text() + "(...)?",
                name.line(), name.column() + 1, lines.line(name.line()));
    }

    private PythonSyntaxException errorAt(final SyntaxNode node,
            final String message) {
        return new PythonSyntaxException(message, node.line(),
                node.column() + 1, lines.line(node.line()));
    }
}
