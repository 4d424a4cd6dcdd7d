package com.coffeejournal.store.migration;

import java.util.ArrayList;
import java.util.List;

/** Dotted numeric version such as {@code 1.6}; missing components compare as zero. */
public final class SemanticVersion implements Comparable<SemanticVersion> {

    private final String text;
    private final List<Integer> parts;

    private SemanticVersion(String text, List<Integer> parts) {
        this.text = text;
        this.parts = parts;
    }

    public static SemanticVersion parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Version must not be blank");
        }
        List<Integer> parts = new ArrayList<>();
        for (String part : text.trim().split("\\.")) {
            try {
                parts.add(Integer.parseInt(part));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid version: " + text, e);
            }
        }
        return new SemanticVersion(text.trim(), List.copyOf(parts));
    }

    public boolean isBefore(SemanticVersion other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int length = Math.max(parts.size(), other.parts.size());
        for (int i = 0; i < length; i++) {
            int a = i < parts.size() ? parts.get(i) : 0;
            int b = i < other.parts.size() ? other.parts.get(i) : 0;
            if (a != b) {
                return Integer.compare(a, b);
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SemanticVersion other && compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        int last = parts.size();
        while (last > 0 && parts.get(last - 1) == 0) {
            last--;
        }
        for (int i = 0; i < last; i++) {
            hash = 31 * hash + parts.get(i);
        }
        return hash;
    }

    @Override
    public String toString() {
        return text;
    }
}
