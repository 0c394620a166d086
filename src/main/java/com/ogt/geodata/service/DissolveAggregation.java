package com.ogt.geodata.service;

import com.ogt.geodata.exception.GeodataException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reducciones de atributos para dissolve. Los valores nulos se ignoran.
 */
public enum DissolveAggregation {
    FIRST,
    LAST,
    SUM,
    MEAN,
    MIN,
    MAX,
    COUNT;

    public static DissolveAggregation parse(String name) {
        if (name == null || name.isBlank()) {
            return FIRST;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            String allowed = Arrays.stream(values()).map(v -> v.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", "));
            throw GeodataException.invalidParameter(
                    "Agregación « " + name + " » no soportada. Valores aceptados: " + allowed + ".");
        }
    }

    public Object apply(String attribute, List<Object> values) {
        List<Object> present = values.stream().filter(Objects::nonNull).collect(Collectors.toList());
        switch (this) {
            case FIRST:
                return present.isEmpty() ? null : present.get(0);
            case LAST:
                return present.isEmpty() ? null : present.get(present.size() - 1);
            case COUNT:
                return (long) present.size();
            case SUM: {
                List<Number> numbers = numeric(attribute, present);
                if (numbers.stream().allMatch(DissolveAggregation::isIntegral)) {
                    return numbers.stream().mapToLong(Number::longValue).sum();
                }
                return numbers.stream().mapToDouble(Number::doubleValue).sum();
            }
            case MEAN: {
                List<Number> numbers = numeric(attribute, present);
                return numbers.isEmpty() ? null : numbers.stream().mapToDouble(Number::doubleValue).average().getAsDouble();
            }
            case MIN:
            case MAX:
                return extreme(attribute, present, this == MAX);
            default:
                throw new IllegalStateException("Agregación no implementada: " + this);
        }
    }

    private Object extreme(String attribute, List<Object> present, boolean max) {
        if (present.isEmpty()) {
            return null;
        }
        if (present.stream().allMatch(String.class::isInstance)) {
            return present.stream().map(String.class::cast)
                    .reduce((a, b) -> (a.compareTo(b) >= 0) == max ? a : b).orElse(null);
        }
        List<Number> numbers = numeric(attribute, present);
        Number best = numbers.get(0);
        for (Number n : numbers) {
            int cmp = Double.compare(n.doubleValue(), best.doubleValue());
            if (max ? cmp > 0 : cmp < 0) {
                best = n;
            }
        }
        return best;
    }

    private List<Number> numeric(String attribute, List<Object> present) {
        List<Number> numbers = new ArrayList<>(present.size());
        for (Object v : present) {
            if (!(v instanceof Number)) {
                throw GeodataException.invalidParameter("La agregación " + name().toLowerCase(Locale.ROOT)
                        + " requiere valores numéricos en « " + attribute + " » (encontrado: " + v + ").");
            }
            numbers.add((Number) v);
        }
        return numbers;
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }
}
