package com.vidnyan.cpg.domain.query;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValuesTest {

    @Test
    void compare_BigIntegerBeyondLongRange_ShouldKeepMagnitude() {
        // Arrange
        BigInteger huge = BigInteger.valueOf(Long.MAX_VALUE).multiply(BigInteger.TEN);

        // Act & Assert
        assertTrue(Values.compare(huge, Long.MAX_VALUE) > 0);
        assertTrue(Values.compare(huge.negate(), 0) < 0);
        assertFalse(Values.equal(huge, huge.longValue()));
        assertTrue(Values.equal(new BigInteger("12"), new BigDecimal("12.00")));
        assertEquals("92233720368547758070", Values.canonical(huge));
    }

    @Test
    void compare_NonFiniteDoubles_ShouldNotThrow() {
        // Act & Assert
        assertTrue(Values.compare(Double.POSITIVE_INFINITY, Long.MAX_VALUE) > 0);
        assertTrue(Values.compare(Double.NEGATIVE_INFINITY, -1) < 0);
        assertTrue(Values.equal(Double.NaN, Double.NaN));
        assertFalse(Values.equal(Double.NaN, 0));
        assertEquals("NaN", Values.canonical(Float.NaN));
        assertEquals("Infinity", Values.canonical(Double.POSITIVE_INFINITY));
    }

    @Test
    void nullsLast_MixedNumbers_ShouldSortWithoutError() {
        List<Object> values = new ArrayList<>(Arrays.asList(Double.NaN, 3, null, Double.NEGATIVE_INFINITY, 2.5));

        values.sort(Values.NULLS_LAST);

        assertEquals(Arrays.asList(Double.NEGATIVE_INFINITY, 2.5, 3, Double.NaN, null), values);
    }
}
