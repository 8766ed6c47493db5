package ai.flowrisk.profile;

import static org.junit.jupiter.api.Assertions.*;

import ai.flowrisk.analyzer.Language;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class LanguageProfilesTest {

    @ParameterizedTest
    @EnumSource(Language.class)
    void everyLanguage_hasCompleteProfile(Language language) {
        var profile = LanguageProfiles.forLanguage(language);

        assertEquals(language, profile.language());
        assertFalse(profile.kindsOf(ConstructCategory.FUNCTION).isEmpty());
        assertFalse(profile.kindsOf(ConstructCategory.LOOP).isEmpty());
        assertFalse(profile.kindsOf(ConstructCategory.CALL).isEmpty());
        assertFalse(profile.calleeFields().isEmpty());
        assertFalse(profile.lineCommentPrefix().isBlank());
        for (var loopType : profile.kindsOf(ConstructCategory.LOOP)) {
            assertTrue(profile.loopKind(loopType).isPresent(), loopType);
        }
    }

    @Test
    void structuralLookup_resolvesDispatchCategory() {
        var java = LanguageProfiles.forLanguage(Language.JAVA);
        assertEquals(ConstructCategory.IF, java.structuralCategory("if_statement").orElseThrow());
        assertEquals(ConstructCategory.LOOP, java.structuralCategory("do_statement").orElseThrow());
        assertEquals(LoopKind.DO_WHILE, java.loopKind("do_statement").orElseThrow());
        assertTrue(java.structuralCategory("method_invocation").isEmpty());

        var rust = LanguageProfiles.forLanguage(Language.RUST);
        assertEquals(LoopKind.INFINITE, rust.loopKind("loop_expression").orElseThrow());
        assertTrue(rust.isPanicCallee("unreachable"));
        assertFalse(rust.breakableSwitch());
    }

    @Test
    void logicalOperators_arePerLanguage() {
        assertTrue(LanguageProfiles.forLanguage(Language.JAVASCRIPT).isLogicalOperator("??"));
        assertFalse(LanguageProfiles.forLanguage(Language.JAVA).isLogicalOperator("??"));
        assertTrue(LanguageProfiles.forLanguage(Language.PYTHON).isLogicalOperator("and"));
        assertFalse(LanguageProfiles.forLanguage(Language.GO).isLogicalOperator("&"));
    }

    @Test
    void pythonElseClause_overlapsAcrossPositionalCategories() {
        var python = LanguageProfiles.forLanguage(Language.PYTHON);
        assertTrue(python.is(ConstructCategory.ELSE_CLAUSE, "else_clause"));
        assertTrue(python.is(ConstructCategory.LOOP_ELSE, "else_clause"));
        assertTrue(python.is(ConstructCategory.TRY_ELSE, "else_clause"));
        assertTrue(python.structuralCategory("else_clause").isEmpty());
    }

    @Test
    void missingCategory_failsBuild() {
        var builder = LanguageProfile.builder(Language.GO)
                .kinds(ConstructCategory.FUNCTION, "function_declaration")
                .lineCommentPrefix("//");

        var e = assertThrows(ProfileConfigurationException.class, builder::build);
        assertTrue(e.getMessage().contains("BLOCK is not declared"), e.getMessage());
    }

    @Test
    void structuralConflict_failsBuild() {
        var builder = completeGoBuilder().kinds(ConstructCategory.THROW, "if_statement");

        var e = assertThrows(ProfileConfigurationException.class, builder::build);
        assertTrue(e.getMessage().contains("node type if_statement is in both"), e.getMessage());
    }

    @Test
    void categoryDeclaredBothWays_failsBuild() {
        var builder = completeGoBuilder().notApplicable(ConstructCategory.IF);

        var e = assertThrows(ProfileConfigurationException.class, builder::build);
        assertTrue(e.getMessage().contains("IF is declared with kinds and as not applicable"), e.getMessage());
    }

    @Test
    void completeTable_builds() {
        var profile = completeGoBuilder().notApplicable(ConstructCategory.THROW).build();
        assertTrue(profile.is(ConstructCategory.IF, "if_statement"));
    }

    /** A minimal table that declares every category; THROW is left open for the tests to decide. */
    private static LanguageProfile.Builder completeGoBuilder() {
        return LanguageProfile.builder(Language.GO)
                .kinds(ConstructCategory.FUNCTION, "function_declaration")
                .kinds(ConstructCategory.BLOCK, "block")
                .kinds(ConstructCategory.COMMENT, "comment")
                .kinds(ConstructCategory.IF, "if_statement")
                .loop(LoopKind.FOR, "for_statement")
                .kinds(ConstructCategory.CALL, "call_expression")
                .kinds(ConstructCategory.RETURN, "return_statement")
                .notApplicable(
                        ConstructCategory.NESTED_FUNCTION,
                        ConstructCategory.ELSE_CLAUSE,
                        ConstructCategory.ELSE_IF,
                        ConstructCategory.LOOP_ELSE,
                        ConstructCategory.SWITCH,
                        ConstructCategory.CASE,
                        ConstructCategory.DEFAULT_CASE,
                        ConstructCategory.CASE_LABEL,
                        ConstructCategory.TRY,
                        ConstructCategory.CATCH,
                        ConstructCategory.FINALLY,
                        ConstructCategory.TRY_ELSE,
                        ConstructCategory.LOGICAL_OP,
                        ConstructCategory.TERNARY,
                        ConstructCategory.CONDITIONAL_EXIT,
                        ConstructCategory.BREAK,
                        ConstructCategory.CONTINUE,
                        ConstructCategory.LABELED_STATEMENT,
                        ConstructCategory.LABEL_NAME,
                        ConstructCategory.INLINE_LABEL,
                        ConstructCategory.NAMING_PARENT,
                        ConstructCategory.DECLARATION_WRAPPER,
                        ConstructCategory.UNMODELED)
                .calleeFields("function")
                .lineCommentPrefix("//");
    }
}
