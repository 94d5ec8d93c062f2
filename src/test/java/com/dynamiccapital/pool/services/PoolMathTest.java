package com.dynamiccapital.pool.services;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PoolMathTest {

    @Test
    public void test_roundMoney_halfAwayFromZero() {
        assertEquals(1.01, PoolMath.roundMoney(1.005), 0.0);
        assertEquals(-1.01, PoolMath.roundMoney(-1.005), 0.0);
        assertEquals(2.34, PoolMath.roundMoney(2.344), 0.0);
    }

    @Test
    public void test_roundPercentage_keepsSixDecimals() {
        assertEquals(33.333333, PoolMath.roundPercentage(100.0 / 3), 0.0);
        assertEquals(66.666667, PoolMath.roundPercentage(200.0 / 3), 0.0);
    }

    @Test
    public void test_round_rejectsNegativeDigitsAndNaN() {
        assertThrows(IllegalArgumentException.class, () -> PoolMath.round(1.0, -1));
        assertThrows(IllegalArgumentException.class, () -> PoolMath.round(Double.NaN, 2));
        assertThrows(IllegalArgumentException.class, () -> PoolMath.round(Double.POSITIVE_INFINITY, 2));
    }

    @Test
    public void test_clamp_boundsIntoClosedInterval() {
        assertEquals(0.0, PoolMath.clamp(-5.0, 0.0, 10.0), 0.0);
        assertEquals(10.0, PoolMath.clamp(15.0, 0.0, 10.0), 0.0);
        assertEquals(7.5, PoolMath.clamp(7.5, 0.0, 10.0), 0.0);
        assertThrows(IllegalArgumentException.class, () -> PoolMath.clamp(1.0, 5.0, 0.0));
    }

    @Test
    public void test_moneyEquals_comparesAtCents() {
        assertTrue(PoolMath.moneyEquals(0.1 + 0.2, 0.3));
        assertTrue(PoolMath.moneyEquals(100.004, 100.0));
        assertFalse(PoolMath.moneyEquals(100.01, 100.0));
    }
}
