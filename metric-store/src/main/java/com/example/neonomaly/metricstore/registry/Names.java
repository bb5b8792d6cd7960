package com.example.neonomaly.metricstore.registry;

final class Names {

    static final int MAX_LENGTH = 100;

    private Names() {
    }

    /**
     * Accepts a name with at least one non-whitespace character and at most
     * {@link #MAX_LENGTH} characters as given, surrounding whitespace included.
     */
    static void requireValid(String name, String kind) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(kind + " name must not be blank");
        }
        if (name.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(kind + " name must be at most " + MAX_LENGTH + " characters");
        }
    }
}
