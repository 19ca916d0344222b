package info.isaksson.erland.svtofsm.syntax;

/**
 * Kinds of syntax nodes the parser materializes.
 *
 * <p>Only constructs relevant to state-machine recovery get their own kind. Everything else is
 * either flattened into its parent or surfaces as {@link #OTHER_STATEMENT}.</p>
 */
public enum NodeKind {
    SOURCE,
    MODULE,
    PACKAGE,
    /** Declared name of a module, package or type. */
    NAME,

    TYPE_DECLARATION,
    DATA_TYPE,
    TYPE_REFERENCE,
    ENUM_TYPE,
    ENUM_MEMBER,
    PACKED_DIMENSION,
    DATA_DECLARATION,
    VARIABLE_DECLARATOR,
    PARAMETER_DECLARATION,
    PARAMETER_ASSIGNMENT,

    ALWAYS_CONSTRUCT,
    ALWAYS_KEYWORD,
    INITIAL_CONSTRUCT,
    EVENT_CONTROL,
    EVENT_TERM,
    EDGE,
    EVENT_WILDCARD,
    DELAY,

    SEQ_BLOCK,
    IF_STATEMENT,
    CONDITION,
    THEN_BRANCH,
    ELSE_BRANCH,
    CASE_STATEMENT,
    CASE_KEYWORD,
    CASE_SUBJECT,
    CASE_ITEM,
    DEFAULT_CASE_ITEM,
    CASE_LABEL,
    BLOCKING_ASSIGNMENT,
    NONBLOCKING_ASSIGNMENT,
    LVALUE,
    LOOP_STATEMENT,
    CALL_STATEMENT,
    OTHER_STATEMENT,

    UNARY_EXPRESSION(true),
    BINARY_EXPRESSION(true),
    CONDITIONAL_EXPRESSION(true),
    PAREN_EXPRESSION(true),
    CONCATENATION(true),
    CALL_EXPRESSION(true),
    CAST_EXPRESSION(true),
    /** Possibly scoped or hierarchical identifier, with optional bit selects. */
    REFERENCE(true),
    NUMBER(true),
    STRING(true),
    OPERATOR,
    SELECT,
    IDENTIFIER;

    private final boolean expression;

    NodeKind() {
        this(false);
    }

    NodeKind(boolean expression) {
        this.expression = expression;
    }

    public boolean isExpression() {
        return expression;
    }

    public boolean isAssignment() {
        return this == BLOCKING_ASSIGNMENT || this == NONBLOCKING_ASSIGNMENT;
    }
}
