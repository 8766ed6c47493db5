package ai.flowrisk.profile;

import static ai.flowrisk.profile.ConstructCategory.*;

import ai.flowrisk.analyzer.Language;
import java.util.EnumMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The built-in profile table for every supported language. Profiles are validated once when this class initializes;
 * an invalid table fails class initialization with {@link ProfileConfigurationException}.
 */
public final class LanguageProfiles {
    private static final Logger logger = LogManager.getLogger(LanguageProfiles.class);

    private static final Map<Language, LanguageProfile> PROFILES = createProfiles();

    private LanguageProfiles() {}

    public static LanguageProfile forLanguage(Language language) {
        var profile = PROFILES.get(language);
        if (profile == null) {
            throw new ProfileConfigurationException("No profile registered for " + language);
        }
        return profile;
    }

    private static Map<Language, LanguageProfile> createProfiles() {
        var profiles = new EnumMap<Language, LanguageProfile>(Language.class);
        profiles.put(Language.JAVA, java());
        profiles.put(Language.JAVASCRIPT, ecmascript(Language.JAVASCRIPT));
        profiles.put(Language.TYPESCRIPT, ecmascript(Language.TYPESCRIPT));
        profiles.put(Language.PYTHON, python());
        profiles.put(Language.GO, go());
        profiles.put(Language.RUST, rust());
        for (var language : Language.values()) {
            if (!profiles.containsKey(language)) {
                throw new ProfileConfigurationException("No profile defined for " + language);
            }
        }
        logger.debug("Initialized {} language profiles", profiles.size());
        return Map.copyOf(profiles);
    }

    static LanguageProfile java() {
        return LanguageProfile.builder(Language.JAVA)
                .kinds(
                        FUNCTION,
                        "method_declaration",
                        "constructor_declaration",
                        "compact_constructor_declaration",
                        "lambda_expression")
                .kinds(
                        NESTED_FUNCTION,
                        "lambda_expression",
                        "class_declaration",
                        "class_body",
                        "record_declaration",
                        "enum_declaration",
                        "interface_declaration")
                .kinds(BLOCK, "block", "constructor_body")
                .kinds(COMMENT, "line_comment", "block_comment")
                .kinds(IF, "if_statement")
                .notApplicable(ELSE_CLAUSE, ELSE_IF, LOOP_ELSE, TRY_ELSE, DEFAULT_CASE, CONDITIONAL_EXIT)
                .loop(LoopKind.FOR, "for_statement")
                .loop(LoopKind.FOREACH, "enhanced_for_statement")
                .loop(LoopKind.WHILE, "while_statement")
                .loop(LoopKind.DO_WHILE, "do_statement")
                .kinds(SWITCH, "switch_expression")
                .kinds(CASE, "switch_block_statement_group", "switch_rule")
                .kinds(CASE_LABEL, "switch_label")
                .kinds(TRY, "try_statement", "try_with_resources_statement")
                .kinds(CATCH, "catch_clause")
                .kinds(FINALLY, "finally_clause")
                .kinds(LOGICAL_OP, "binary_expression")
                .kinds(TERNARY, "ternary_expression")
                .kinds(CALL, "method_invocation", "object_creation_expression", "explicit_constructor_invocation")
                .kinds(RETURN, "return_statement")
                .kinds(THROW, "throw_statement")
                .kinds(BREAK, "break_statement")
                .kinds(CONTINUE, "continue_statement")
                .kinds(LABELED_STATEMENT, "labeled_statement")
                .kinds(LABEL_NAME, "identifier")
                .notApplicable(INLINE_LABEL, NAMING_PARENT, DECLARATION_WRAPPER, UNMODELED)
                .logicalOperators("&&", "||")
                .calleeFields("name", "type", "constructor")
                .receiverField("object")
                .defaultLabelTexts("default")
                .breakableSwitch(true)
                .lineCommentPrefix("//")
                .build();
    }

    /** JavaScript and TypeScript share one grammar family; TypeScript adds a few declaration kinds. */
    static LanguageProfile ecmascript(Language language) {
        var b = LanguageProfile.builder(language)
                .kinds(
                        FUNCTION,
                        "function_declaration",
                        "generator_function_declaration",
                        "method_definition",
                        "function_expression",
                        "arrow_function");
        if (language == Language.TYPESCRIPT) {
            b.kinds(
                    NESTED_FUNCTION,
                    "function_declaration",
                    "generator_function_declaration",
                    "function_expression",
                    "arrow_function",
                    "class_declaration",
                    "class",
                    "abstract_class_declaration",
                    "interface_declaration");
        } else {
            b.kinds(
                    NESTED_FUNCTION,
                    "function_declaration",
                    "generator_function_declaration",
                    "function_expression",
                    "arrow_function",
                    "class_declaration",
                    "class");
        }
        return b.kinds(BLOCK, "statement_block")
                .kinds(COMMENT, "comment")
                .kinds(IF, "if_statement")
                .kinds(ELSE_CLAUSE, "else_clause")
                .notApplicable(ELSE_IF, LOOP_ELSE, TRY_ELSE, CASE_LABEL)
                .loop(LoopKind.FOR, "for_statement")
                .loop(LoopKind.FOREACH, "for_in_statement")
                .loop(LoopKind.WHILE, "while_statement")
                .loop(LoopKind.DO_WHILE, "do_statement")
                .kinds(SWITCH, "switch_statement")
                .kinds(CASE, "switch_case", "switch_default")
                .kinds(DEFAULT_CASE, "switch_default")
                .kinds(TRY, "try_statement")
                .kinds(CATCH, "catch_clause")
                .kinds(FINALLY, "finally_clause")
                .kinds(LOGICAL_OP, "binary_expression")
                .kinds(CALL, "call_expression", "new_expression")
                .kinds(RETURN, "return_statement")
                .kinds(THROW, "throw_statement")
                .kinds(BREAK, "break_statement")
                .kinds(CONTINUE, "continue_statement")
                .kinds(LABELED_STATEMENT, "labeled_statement")
                .kinds(LABEL_NAME, "statement_identifier")
                .kinds(NAMING_PARENT, "variable_declarator")
                .kinds(DECLARATION_WRAPPER, "export_statement")
                .kinds(TERNARY, "ternary_expression")
                .notApplicable(CONDITIONAL_EXIT, INLINE_LABEL, UNMODELED)
                .logicalOperators("&&", "||", "??")
                .calleeFields("function", "constructor")
                .caseHeaderFields("value")
                .breakableSwitch(true)
                .lineCommentPrefix("//")
                .build();
    }

    static LanguageProfile python() {
        return LanguageProfile.builder(Language.PYTHON)
                .kinds(FUNCTION, "function_definition", "lambda")
                .kinds(NESTED_FUNCTION, "function_definition", "lambda", "class_definition", "decorated_definition")
                .kinds(BLOCK, "block")
                .kinds(COMMENT, "comment")
                .kinds(IF, "if_statement")
                .kinds(ELSE_CLAUSE, "else_clause")
                .kinds(ELSE_IF, "elif_clause")
                .loop(LoopKind.FOREACH, "for_statement")
                .loop(LoopKind.WHILE, "while_statement")
                .kinds(LOOP_ELSE, "else_clause")
                .kinds(SWITCH, "match_statement")
                .kinds(CASE, "case_clause")
                .kinds(CASE_LABEL, "case_pattern")
                .kinds(TRY, "try_statement")
                .kinds(CATCH, "except_clause", "except_group_clause")
                .kinds(FINALLY, "finally_clause")
                .kinds(TRY_ELSE, "else_clause")
                .kinds(LOGICAL_OP, "boolean_operator")
                .kinds(TERNARY, "conditional_expression")
                .kinds(CALL, "call")
                .kinds(RETURN, "return_statement")
                .kinds(THROW, "raise_statement")
                .kinds(BREAK, "break_statement")
                .kinds(CONTINUE, "continue_statement")
                .kinds(DECLARATION_WRAPPER, "decorated_definition")
                .kinds(UNMODELED, "if_clause")
                .notApplicable(
                        DEFAULT_CASE, CONDITIONAL_EXIT, LABELED_STATEMENT, LABEL_NAME, INLINE_LABEL, NAMING_PARENT)
                .logicalOperators("and", "or")
                .calleeFields("function")
                .guardFields("guard")
                .defaultLabelTexts("_")
                .breakableSwitch(false)
                .lineCommentPrefix("#")
                .build();
    }

    static LanguageProfile go() {
        return LanguageProfile.builder(Language.GO)
                .kinds(FUNCTION, "function_declaration", "method_declaration", "func_literal")
                .kinds(NESTED_FUNCTION, "func_literal")
                .kinds(BLOCK, "block", "statement_list")
                .kinds(COMMENT, "comment")
                .kinds(IF, "if_statement")
                .loop(LoopKind.FOR, "for_statement")
                .kinds(SWITCH, "expression_switch_statement", "type_switch_statement", "select_statement")
                .kinds(CASE, "expression_case", "type_case", "communication_case", "default_case")
                .kinds(DEFAULT_CASE, "default_case")
                .kinds(LOGICAL_OP, "binary_expression")
                .kinds(CALL, "call_expression")
                .kinds(RETURN, "return_statement")
                .kinds(BREAK, "break_statement")
                .kinds(CONTINUE, "continue_statement")
                .kinds(LABELED_STATEMENT, "labeled_statement")
                .kinds(LABEL_NAME, "label_name")
                .kinds(UNMODELED, "goto_statement", "fallthrough_statement")
                .notApplicable(ELSE_CLAUSE, ELSE_IF, LOOP_ELSE, CASE_LABEL, TRY, CATCH, FINALLY, TRY_ELSE)
                .notApplicable(TERNARY, THROW, CONDITIONAL_EXIT, INLINE_LABEL, NAMING_PARENT, DECLARATION_WRAPPER)
                .logicalOperators("&&", "||")
                .calleeFields("function")
                .panicCallees("panic")
                .caseHeaderFields("value", "type", "communication")
                .breakableSwitch(true)
                .lineCommentPrefix("//")
                .build();
    }

    static LanguageProfile rust() {
        return LanguageProfile.builder(Language.RUST)
                .kinds(FUNCTION, "function_item", "closure_expression")
                .kinds(NESTED_FUNCTION, "closure_expression", "function_item", "impl_item", "trait_item")
                .kinds(BLOCK, "block")
                .kinds(COMMENT, "line_comment", "block_comment")
                .kinds(IF, "if_expression")
                .kinds(ELSE_CLAUSE, "else_clause")
                .loop(LoopKind.INFINITE, "loop_expression")
                .loop(LoopKind.WHILE, "while_expression")
                .loop(LoopKind.FOREACH, "for_expression")
                .kinds(SWITCH, "match_expression")
                .kinds(CASE, "match_arm")
                .kinds(LOGICAL_OP, "binary_expression")
                .kinds(CALL, "call_expression", "macro_invocation")
                .kinds(RETURN, "return_expression")
                .kinds(CONDITIONAL_EXIT, "try_expression")
                .kinds(BREAK, "break_expression")
                .kinds(CONTINUE, "continue_expression")
                .kinds(LABEL_NAME, "label")
                .kinds(INLINE_LABEL, "label")
                .notApplicable(ELSE_IF, LOOP_ELSE, DEFAULT_CASE, CASE_LABEL, TRY, CATCH, FINALLY, TRY_ELSE)
                .notApplicable(TERNARY, THROW, LABELED_STATEMENT, NAMING_PARENT, DECLARATION_WRAPPER, UNMODELED)
                .logicalOperators("&&", "||")
                .calleeFields("function", "macro")
                .panicCallees("panic", "unreachable", "todo", "unimplemented")
                .caseHeaderFields("pattern")
                .guardFields("condition")
                .defaultLabelTexts("_")
                .breakableSwitch(false)
                .lineCommentPrefix("//")
                .build();
    }
}
