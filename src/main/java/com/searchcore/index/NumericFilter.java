package com.searchcore.index;

/**
 * 数值范围过滤器。
 *
 * @param min 下界
 * @param max 上界
 * @param inclusiveMin 是否包含下界
 * @param inclusiveMax 是否包含上界
 */
public record NumericFilter(double min, double max, boolean inclusiveMin, boolean inclusiveMax) {
    public NumericFilter {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new IllegalArgumentException("数值范围边界不能为NaN");
        }
        if (min > max) {
            throw new IllegalArgumentException("数值范围下界大于上界: " + min + " > " + max);
        }
    }

    /**
     * 闭区间 [min, max]。
     */
    public static NumericFilter between(double min, double max) {
        return new NumericFilter(min, max, true, true);
    }

    public boolean matches(double value) {
        boolean aboveMin = inclusiveMin ? value >= min : value > min;
        boolean belowMax = inclusiveMax ? value <= max : value < max;
        return aboveMin && belowMax;
    }
}
