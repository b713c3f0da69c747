package com.docchat.chatbot.service.embedding;

import java.util.ArrayList;
import java.util.List;

public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Returns a unit-length copy of the vector, or throws {@link IllegalArgumentException} for a zero vector.
     */
    public static List<Double> normalize(List<Double> vector) {
        double norm = Math.sqrt(dot(vector, vector));
        if (norm == 0d || Double.isNaN(norm)) {
            throw new IllegalArgumentException("Cannot normalize a zero or undefined vector");
        }
        List<Double> normalized = new ArrayList<>(vector.size());
        for (Double value : vector) {
            normalized.add(value / norm);
        }
        return List.copyOf(normalized);
    }

    public static double dot(List<Double> left, List<Double> right) {
        if (left.size() != right.size()) {
            throw new IllegalArgumentException("Vector dimensions differ: " + left.size() + " vs " + right.size());
        }
        double sum = 0d;
        for (int i = 0; i < left.size(); i++) {
            sum += left.get(i) * right.get(i);
        }
        return sum;
    }

    public static double cosine(List<Double> left, List<Double> right) {
        double denominator = Math.sqrt(dot(left, left)) * Math.sqrt(dot(right, right));
        return denominator == 0d ? 0d : dot(left, right) / denominator;
    }
}
