package co.fanki.sourcescan.extraction.domain.python;

/**
 * Child field names used by {@link SyntaxNode}, spelled as in CPython's
 * {@code ast} module.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Fields {

    public static final String BODY = "body";
    public static final String ARGS = "args";
    public static final String DECORATOR_LIST = "decorator_list";
    public static final String RETURNS = "returns";
    public static final String BASES = "bases";
    public static final String KEYWORDS = "keywords";
    public static final String VALUE = "value";
    public static final String VALUES = "values";
    public static final String TARGETS = "targets";
    public static final String TARGET = "target";
    public static final String ANNOTATION = "annotation";
    public static final String ITER = "iter";
    public static final String ORELSE = "orelse";
    public static final String TEST = "test";
    public static final String ITEMS = "items";
    public static final String EXC = "exc";
    public static final String CAUSE = "cause";
    public static final String HANDLERS = "handlers";
    public static final String FINALBODY = "finalbody";
    public static final String MSG = "msg";
    public static final String NAMES = "names";
    public static final String LEFT = "left";
    public static final String RIGHT = "right";
    public static final String OPERAND = "operand";
    public static final String KEYS = "keys";
    public static final String ELTS = "elts";
    public static final String ELT = "elt";
    public static final String KEY = "key";
    public static final String GENERATORS = "generators";
    public static final String COMPARATORS = "comparators";
    public static final String FUNC = "func";
    public static final String FORMAT_SPEC = "format_spec";
    public static final String SLICE = "slice";
    public static final String LOWER = "lower";
    public static final String UPPER = "upper";
    public static final String STEP = "step";
    public static final String IFS = "ifs";
    public static final String TYPE = "type";
    public static final String POSONLYARGS = "posonlyargs";
    public static final String VARARG = "vararg";
    public static final String KWONLYARGS = "kwonlyargs";
    public static final String KW_DEFAULTS = "kw_defaults";
    public static final String KWARG = "kwarg";
    public static final String DEFAULTS = "defaults";
    public static final String CONTEXT_EXPR = "context_expr";
    public static final String OPTIONAL_VARS = "optional_vars";
    public static final String SUBJECT = "subject";
    public static final String CASES = "cases";
    public static final String PATTERN = "pattern";
    public static final String PATTERNS = "patterns";
    public static final String GUARD = "guard";
    public static final String CLS = "cls";
    public static final String KWD_PATTERNS = "kwd_patterns";

    private Fields() {
        // Constants holder, not instantiable
    }
}
