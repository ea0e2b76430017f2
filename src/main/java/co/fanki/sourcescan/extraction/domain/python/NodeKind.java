package co.fanki.sourcescan.extraction.domain.python;

import java.util.HashMap;
import java.util.Map;

/**
 * The closed set of node kinds a {@link SyntaxTree} can contain.
 *
 * <p>Each kind mirrors one class of CPython's {@code ast} module and keeps
 * its child fields in the same order, so a breadth-first walk over a tree
 * built by any front-end visits nodes in the order {@code ast.walk} does.
 * The field names each kind carries are listed next to the constant.</p>
 *
 * <p>{@link #OTHER} is only produced by front-ends that see a construct
 * with no dedicated kind (for example a statement added by a newer
 * interpreter). Its children are kept so nothing below it is lost.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum NodeKind {

    /** body. */
    MODULE("Module"),

    /** args, body, decorator_list, returns. Payload: the name. */
    FUNCTION_DEF("FunctionDef"),

    /** args, body, decorator_list, returns. Payload: the name. */
    ASYNC_FUNCTION_DEF("AsyncFunctionDef"),

    /** bases, keywords, body, decorator_list. Payload: the name. */
    CLASS_DEF("ClassDef"),

    /** value. */
    RETURN("Return"),

    /** targets. */
    DELETE("Delete"),

    /** targets, value. */
    ASSIGN("Assign"),

    /** target, value. Payload: the operator, e.g. {@code "+"}. */
    AUG_ASSIGN("AugAssign"),

    /** target, annotation, value. */
    ANN_ASSIGN("AnnAssign"),

    /** target, iter, body, orelse. */
    FOR("For"),

    /** target, iter, body, orelse. */
    ASYNC_FOR("AsyncFor"),

    /** test, body, orelse. */
    WHILE("While"),

    /** test, body, orelse. */
    IF("If"),

    /** items, body. */
    WITH("With"),

    /** items, body. */
    ASYNC_WITH("AsyncWith"),

    /** subject, cases. */
    MATCH("Match"),

    /** exc, cause. */
    RAISE("Raise"),

    /** body, handlers, orelse, finalbody. */
    TRY("Try"),

    /** body, handlers, orelse, finalbody. */
    TRY_STAR("TryStar"),

    /** test, msg. */
    ASSERT("Assert"),

    /** names. */
    IMPORT("Import"),

    /** names. Payload: the module, or null for {@code from . import x}. */
    IMPORT_FROM("ImportFrom"),

    /** No children. Payload: the list of names. */
    GLOBAL("Global"),

    /** No children. Payload: the list of names. */
    NONLOCAL("Nonlocal"),

    /** value. */
    EXPR("Expr"),

    PASS("Pass"),

    BREAK("Break"),

    CONTINUE("Continue"),

    /** values. Payload: {@code "and"} or {@code "or"}. */
    BOOL_OP("BoolOp"),

    /** target, value. */
    NAMED_EXPR("NamedExpr"),

    /** left, right. Payload: the operator. */
    BIN_OP("BinOp"),

    /** operand. Payload: the operator. */
    UNARY_OP("UnaryOp"),

    /** args, body. */
    LAMBDA("Lambda"),

    /** test, body, orelse. */
    IF_EXP("IfExp"),

    /** keys, values. A null key stands for a {@code **mapping} entry. */
    DICT("Dict"),

    /** elts. */
    SET("Set"),

    /** elt, generators. */
    LIST_COMP("ListComp"),

    /** elt, generators. */
    SET_COMP("SetComp"),

    /** key, value, generators. */
    DICT_COMP("DictComp"),

    /** elt, generators. */
    GENERATOR_EXP("GeneratorExp"),

    /** value. */
    AWAIT("Await"),

    /** value. */
    YIELD("Yield"),

    /** value. */
    YIELD_FROM("YieldFrom"),

    /** left, comparators. Payload: the list of operators. */
    COMPARE("Compare"),

    /** func, args, keywords. */
    CALL("Call"),

    /** value, format_spec. Payload: the conversion character or -1. */
    FORMATTED_VALUE("FormattedValue"),

    /** values. */
    JOINED_STR("JoinedStr"),

    /** No children. Payload: a {@link LiteralValue}. */
    CONSTANT("Constant"),

    /** value. Payload: the attribute name. */
    ATTRIBUTE("Attribute"),

    /** value, slice. */
    SUBSCRIPT("Subscript"),

    /** value. */
    STARRED("Starred"),

    /** No children. Payload: the identifier. */
    NAME("Name"),

    /** elts. */
    LIST("List"),

    /** elts. */
    TUPLE("Tuple"),

    /** lower, upper, step. */
    SLICE("Slice"),

    /** target, iter, ifs. Payload: true when it is an async for. */
    COMPREHENSION("comprehension"),

    /** type, body. Payload: the bound name, or null. */
    EXCEPT_HANDLER("ExceptHandler"),

    /** posonlyargs, args, vararg, kwonlyargs, kw_defaults, kwarg, defaults. */
    ARGUMENTS("arguments"),

    /** annotation. Payload: the parameter name. */
    ARG("arg"),

    /** value. Payload: the keyword, or null for {@code **mapping}. */
    KEYWORD("keyword"),

    /** No children. Payload: an {@link ImportAlias}. */
    ALIAS("alias"),

    /** context_expr, optional_vars. */
    WITH_ITEM("withitem"),

    /** pattern, guard, body. */
    MATCH_CASE("match_case"),

    /** value. */
    MATCH_VALUE("MatchValue"),

    /** No children. Payload: the None or boolean {@link LiteralValue}. */
    MATCH_SINGLETON("MatchSingleton"),

    /** patterns. */
    MATCH_SEQUENCE("MatchSequence"),

    /** keys, patterns. Payload: the {@code **rest} name, or null. */
    MATCH_MAPPING("MatchMapping"),

    /** cls, patterns, kwd_patterns. Payload: the keyword attribute names. */
    MATCH_CLASS("MatchClass"),

    /** No children. Payload: the bound name, null for {@code *_}. */
    MATCH_STAR("MatchStar"),

    /** pattern. Payload: the bound name, null for {@code _}. */
    MATCH_AS("MatchAs"),

    /** patterns. */
    MATCH_OR("MatchOr"),

    /** Any construct without a dedicated kind. */
    OTHER(null);

    private static final Map<String, NodeKind> BY_AST_NAME = new HashMap<>();

    static {
        for (final NodeKind kind : values()) {
            if (kind.astName != null) {
                BY_AST_NAME.put(kind.astName, kind);
            }
        }
    }

    private final String astName;

    NodeKind(final String theAstName) {
        this.astName = theAstName;
    }

    /**
     * Returns the CPython {@code ast} class name this kind mirrors.
     *
     * @return the class name, null for {@link #OTHER}
     */
    public String astName() {
        return astName;
    }

    /**
     * Resolves a kind from a CPython {@code ast} class name.
     *
     * @param astName the class name, e.g. "Call"
     * @return the matching kind, or {@link #OTHER} if there is none
     */
    public static NodeKind fromAstName(final String astName) {
        if (astName == null) {
            return OTHER;
        }
        return BY_AST_NAME.getOrDefault(astName, OTHER);
    }
}
