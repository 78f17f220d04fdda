package com.pgworkload.log.parser;

public final class BindParameter {

    private final String key;
    private final int index;
    private final String value;

    public BindParameter(int index, String value) {
        this("$" + index, index, value);
    }

    /**
     * @param key placeholder text as logged, {@code $} followed by digits;
     *            leading zeros are kept
     */
    public BindParameter(String key, String value) {
        this(key, parseIndex(key), value);
    }

    private BindParameter(String key, int index, String value) {
        if (index < 1) {
            throw new IllegalArgumentException("Parameter index must be at least 1: " + key);
        }
        this.key = key;
        this.index = index;
        this.value = value == null ? "" : value;
    }

    private static int parseIndex(String key) {
        if (key == null || key.length() < 2 || key.charAt(0) != '$') {
            throw new IllegalArgumentException("Parameter key is not of the form $n: " + key);
        }
        for (int i = 1; i < key.length(); i++) {
            if (key.charAt(i) < '0' || key.charAt(i) > '9') {
                throw new IllegalArgumentException("Parameter key is not of the form $n: " + key);
            }
        }
        try {
            return Integer.parseInt(key.substring(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter index out of range: " + key, e);
        }
    }

    public int getIndex() {
        return index;
    }

    /**
     * Placeholder text as it appears in the query, e.g. {@code $3}.
     */
    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + value.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        BindParameter other = (BindParameter) obj;
        return index == other.index && key.equals(other.key) && value.equals(other.value);
    }

    @Override
    public String toString() {
        return getKey() + " = " + value;
    }
}
