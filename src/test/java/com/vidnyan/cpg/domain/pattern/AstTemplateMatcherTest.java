package com.vidnyan.cpg.domain.pattern;

import com.vidnyan.cpg.domain.ast.AstNode;
import org.junit.jupiter.api.Test;

import static com.vidnyan.cpg.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class AstTemplateMatcherTest {

    @Test
    void match_DifferentRootKind_ShouldScoreZero() {
        AstTemplateMatcher.TemplateMatch match =
                AstTemplateMatcher.match(call("map", 1), var("x", 1), false);

        assertEquals(0.0, match.confidence());
    }

    @Test
    void match_PartialShape_ShouldScoreFractionOfTemplate() {
        // Arrange: 3 template nodes, the right operand differs
        AstNode template = op("+", 1, var("_", 1), lit(1, 1));
        AstNode node = op("+", 7, var("x", 7), lit(2, 7));

        // Act
        AstTemplateMatcher.TemplateMatch match = AstTemplateMatcher.match(template, node, false);

        // Assert
        assertEquals(2.0 / 3.0, match.confidence(), 1e-9);
        assertFalse(match.isExact());
    }

    @Test
    void match_BindingVariables_ShouldRequireConsistentBindings() {
        // Arrange
        AstNode template = op("+", 1, var("$v", 1), var("$v", 1));
        AstNode same = op("+", 2, var("x", 2), var("x", 2));
        AstNode different = op("+", 3, var("x", 3), var("y", 3));

        // Act & Assert
        AstTemplateMatcher.TemplateMatch exact = AstTemplateMatcher.match(template, same, true);
        assertTrue(exact.isExact());
        assertEquals("x", exact.bindings().get("$v"));
        assertFalse(AstTemplateMatcher.match(template, different, true).isExact());
        assertTrue(AstTemplateMatcher.match(template, different, false).isExact());
    }

    @Test
    void match_SurplusChildren_ShouldCountAsOneMiss() {
        AstNode template = call("reduce", 1, var("_", 1));
        AstNode node = call("reduce", 4, var("list", 4), lit(0, 4));

        assertEquals(2.0 / 3.0, AstTemplateMatcher.match(template, node, false).confidence(), 1e-9);
    }
}
