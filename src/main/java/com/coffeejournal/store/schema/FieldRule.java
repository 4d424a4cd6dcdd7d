package com.coffeejournal.store.schema;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Constraint on a single field: accepted types, nullability, numeric range, string shape,
 * enumerations, and element rules for arrays.
 * Rules are assembled fluently while the schema set is defined and never change afterwards.
 */
public final class FieldRule {

    private static final double MULTIPLE_EPSILON = 1e-9;

    private final Set<FieldType> types;
    private boolean nullable;
    private Double minimum;
    private Double maximum;
    private Double multipleOf;
    private Integer minLength;
    private Pattern pattern;
    private boolean dateTime;
    private Set<Object> allowedValues;
    private FieldType itemType;
    private Set<Object> allowedItems;
    private boolean uniqueItems;

    private FieldRule(Set<FieldType> types) {
        this.types = types;
    }

    public static FieldRule of(FieldType first, FieldType... more) {
        return new FieldRule(EnumSet.of(first, more));
    }

    public FieldRule nullable() {
        this.nullable = true;
        return this;
    }

    public FieldRule min(double min) {
        this.minimum = min;
        return this;
    }

    public FieldRule max(double max) {
        this.maximum = max;
        return this;
    }

    public FieldRule range(double min, double max) {
        return min(min).max(max);
    }

    public FieldRule multipleOf(double step) {
        this.multipleOf = step;
        return this;
    }

    public FieldRule minLength(int length) {
        this.minLength = length;
        return this;
    }

    public FieldRule pattern(String regex) {
        this.pattern = Pattern.compile(regex);
        return this;
    }

    public FieldRule dateTime() {
        this.dateTime = true;
        return this;
    }

    public FieldRule oneOf(Object... values) {
        this.allowedValues = new LinkedHashSet<>(List.of(values));
        return this;
    }

    public FieldRule items(FieldType type) {
        this.itemType = type;
        return this;
    }

    public FieldRule itemsOneOf(Object... values) {
        this.allowedItems = new LinkedHashSet<>(List.of(values));
        return this;
    }

    public FieldRule uniqueItems() {
        this.uniqueItems = true;
        return this;
    }

    public Set<FieldType> getTypes() {
        return types;
    }

    public boolean isNullable() {
        return nullable;
    }

    /**
     * Check a present value against this rule.
     * @return human-readable problems; empty when the value is acceptable
     */
    public List<String> check(Object value) {
        List<String> problems = new ArrayList<>();
        if (value == null) {
            if (!nullable) {
                problems.add("must not be null");
            }
            return problems;
        }
        if (types.stream().noneMatch(t -> t.accepts(value))) {
            problems.add("expected " + describeTypes() + " but was " + value.getClass().getSimpleName());
            return problems;
        }
        if (value instanceof Number n && !(value instanceof Boolean)) {
            checkNumber(n.doubleValue(), problems);
        }
        if (value instanceof String s) {
            checkString(s, problems);
        }
        if (allowedValues != null && !allowedValues.contains(value)) {
            problems.add("must be one of " + allowedValues);
        }
        if (value instanceof List<?> list) {
            checkItems(list, problems);
        }
        return problems;
    }

    private void checkNumber(double d, List<String> problems) {
        if (minimum != null && d < minimum) {
            problems.add("must be >= " + format(minimum));
        }
        if (maximum != null && d > maximum) {
            problems.add("must be <= " + format(maximum));
        }
        if (multipleOf != null) {
            double quotient = d / multipleOf;
            if (Math.abs(quotient - Math.rint(quotient)) > MULTIPLE_EPSILON) {
                problems.add("must be a multiple of " + format(multipleOf));
            }
        }
    }

    private void checkString(String s, List<String> problems) {
        if (minLength != null && s.length() < minLength) {
            problems.add("must be at least " + minLength + " characters");
        }
        if (pattern != null && !pattern.matcher(s).matches()) {
            problems.add("must match " + pattern.pattern());
        }
        if (dateTime) {
            if (!isDateTime(s)) {
                problems.add("must be an ISO-8601 date-time");
            }
        }
    }

    /** Offset-less values are accepted; older data was written without one. */
    private static boolean isDateTime(String s) {
        try {
            OffsetDateTime.parse(s);
            return true;
        } catch (DateTimeParseException e) {
            try {
                LocalDateTime.parse(s);
                return true;
            } catch (DateTimeParseException notLocal) {
                return false;
            }
        }
    }

    private void checkItems(List<?> list, List<String> problems) {
        Set<Object> seen = new HashSet<>();
        for (Object item : list) {
            if (itemType != null && !itemType.accepts(item)) {
                problems.add("items must be " + itemType.name().toLowerCase());
                return;
            }
            if (allowedItems != null && !allowedItems.contains(item)) {
                problems.add("item '" + item + "' must be one of " + allowedItems);
                return;
            }
            if (uniqueItems && !seen.add(item)) {
                problems.add("items must be unique");
                return;
            }
        }
    }

    private String describeTypes() {
        String joined = types.stream().map(t -> t.name().toLowerCase()).collect(Collectors.joining("|"));
        return nullable ? joined + "|null" : joined;
    }

    private static String format(double d) {
        return d == Math.rint(d) ? String.valueOf((long) d) : String.valueOf(d);
    }
}
