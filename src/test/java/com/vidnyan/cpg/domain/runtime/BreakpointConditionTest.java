package com.vidnyan.cpg.domain.runtime;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BreakpointConditionTest {

    @Test
    void parse_BlankOrAny_ShouldAlwaysFire() {
        assertTrue(BreakpointCondition.parse(null).orElseThrow().isAny());
        assertTrue(BreakpointCondition.parse(":any").orElseThrow().isAny());
        assertTrue(BreakpointCondition.parse("any").orElseThrow().test(Map.of()));
    }

    @Test
    void parse_Garbage_ShouldBeRejected() {
        assertTrue(BreakpointCondition.parse("x is large").isEmpty());
        assertTrue(BreakpointCondition.parse("> 3").isEmpty());
    }

    @Test
    void test_NumericComparison_ShouldCompareAcrossNumberTypes() {
        // Arrange
        BreakpointCondition condition = BreakpointCondition.parse("count > 10").orElseThrow();

        // Act & Assert
        assertTrue(condition.test(Map.of("count", 11)));
        assertFalse(condition.test(Map.of("count", 10.0)));
        assertFalse(condition.test(Map.of("count", "eleven")));
        assertFalse(condition.test(Map.of("other", 50)));
    }

    @Test
    void test_EqualityOnLiterals_ShouldHandleStringsAtomsAndNil() {
        assertTrue(BreakpointCondition.parse("state == \"ready\"").orElseThrow().test(Map.of("state", "ready")));
        assertTrue(BreakpointCondition.parse("state == :ready").orElseThrow().test(Map.of("state", "ready")));
        assertTrue(BreakpointCondition.parse("flag != false").orElseThrow().test(Map.of("flag", true)));

        Map<String, Object> withNil = new HashMap<>();
        withNil.put("reply", null);
        assertTrue(BreakpointCondition.parse("reply == nil").orElseThrow().test(withNil));
    }
}
