package com.calai.dietworkout.prediction.model;

import java.util.Arrays;

/**
 * 固定 13 維、依 {@link ProfileField} 順序排列的模型輸入。
 */
public final class FeatureVector {

    public static final int SIZE = ProfileField.values().length;

    private final double[] values;

    public FeatureVector(double[] values) {
        if (values == null || values.length != SIZE) {
            throw new IllegalArgumentException("feature vector must have " + SIZE + " values");
        }
        this.values = values.clone();
    }

    public double get(ProfileField field) {
        return values[field.ordinal()];
    }

    public double get(int index) {
        return values[index];
    }

    public int size() {
        return SIZE;
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector that)) return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
