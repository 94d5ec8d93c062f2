package com.dynamiccapital.pool.pojos;

import java.util.Objects;

/**
 * Calendar month (1-12) and year identifying a fund cycle.
 */
public final class CycleMonthYear {

    public final int cycleMonth;
    public final int cycleYear;

    public CycleMonthYear(int cycleMonth, int cycleYear) {
        if (cycleMonth < 1 || cycleMonth > 12) {
            throw new IllegalArgumentException("cycle month must be between 1 and 12, got " + cycleMonth);
        }
        this.cycleMonth = cycleMonth;
        this.cycleYear = cycleYear;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CycleMonthYear)) return false;
        CycleMonthYear that = (CycleMonthYear) o;
        return cycleMonth == that.cycleMonth && cycleYear == that.cycleYear;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cycleMonth, cycleYear);
    }

    @Override
    public String toString() {
        return String.format("%04d-%02d", cycleYear, cycleMonth);
    }
}
