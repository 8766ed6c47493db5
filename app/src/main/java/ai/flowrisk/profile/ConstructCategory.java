package ai.flowrisk.profile;

/**
 * Generic construct vocabulary that language profiles map tree-sitter node types onto. Structural categories decide
 * which handler the flow graph builder dispatches a statement to, so a node type may belong to at most one of them.
 * The remaining categories are looked up in a fixed syntactic position (an else clause under an if, a catch under a
 * try) and may overlap.
 */
public enum ConstructCategory {
    /** Declarations discovered as functions of their own. */
    FUNCTION(false),
    /** Function-like nodes inside a body; treated as one opaque statement. */
    NESTED_FUNCTION(true),
    BLOCK(true),
    COMMENT(true),
    IF(true),
    ELSE_CLAUSE(false),
    /** A flattened else-if alternative carried by the if node itself (Python {@code elif}). */
    ELSE_IF(false),
    LOOP(true),
    /** Body run when a loop ends without break (Python {@code for ... else}). */
    LOOP_ELSE(false),
    SWITCH(true),
    CASE(false),
    DEFAULT_CASE(false),
    /** Header nodes of a case arm ({@code case X:} labels, match patterns). */
    CASE_LABEL(false),
    TRY(true),
    CATCH(false),
    FINALLY(false),
    TRY_ELSE(false),
    LOGICAL_OP(false),
    TERNARY(false),
    CALL(false),
    RETURN(true),
    THROW(true),
    /** Expressions that may leave the function while control also continues (Rust {@code ?}). */
    CONDITIONAL_EXIT(false),
    BREAK(true),
    CONTINUE(true),
    LABELED_STATEMENT(true),
    /** Label identifiers, both where a label is declared and where break/continue reference it. */
    LABEL_NAME(false),
    /** A label written on the loop itself rather than on a wrapping statement (Rust {@code 'outer: loop}). */
    INLINE_LABEL(false),
    /** Parents that name an anonymous function, such as a variable declarator. */
    NAMING_PARENT(false),
    /** Nodes wrapping a declaration that should anchor its suppression comment (decorators, exports). */
    DECLARATION_WRAPPER(false),
    /** Constructs the builder deliberately does not model; reported as diagnostics. */
    UNMODELED(false);

    private final boolean structural;

    ConstructCategory(boolean structural) {
        this.structural = structural;
    }

    public boolean isStructural() {
        return structural;
    }
}
