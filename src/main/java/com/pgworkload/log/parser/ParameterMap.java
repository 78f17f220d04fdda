package com.pgworkload.log.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Bind parameter values of one statement, sorted by placeholder index.
 * Indexes are unique; construction fails otherwise.
 */
public final class ParameterMap implements Iterable<BindParameter> {

    private static final ParameterMap EMPTY = new ParameterMap(Collections.emptyList());

    private final List<BindParameter> parameters;

    private ParameterMap(List<BindParameter> sorted) {
        this.parameters = sorted;
    }

    public static ParameterMap empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException if two parameters share an index
     */
    public static ParameterMap of(List<BindParameter> parameters) {
        if (parameters.isEmpty()) {
            return EMPTY;
        }
        List<BindParameter> sorted = new ArrayList<>(parameters);
        sorted.sort(Comparator.comparingInt(BindParameter::getIndex));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).getIndex() == sorted.get(i - 1).getIndex()) {
                throw new IllegalArgumentException("Duplicate parameter " + sorted.get(i).getKey());
            }
        }
        return new ParameterMap(Collections.unmodifiableList(sorted));
    }

    public Optional<String> get(int index) {
        for (BindParameter p : parameters) {
            if (p.getIndex() == index) {
                return Optional.of(p.getValue());
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return parameters.isEmpty();
    }

    public int size() {
        return parameters.size();
    }

    public List<BindParameter> asList() {
        return parameters;
    }

    /**
     * Parameters from the highest index down, the order in which keys are
     * tried during substitution.
     */
    public List<BindParameter> descending() {
        List<BindParameter> reversed = new ArrayList<>(parameters);
        Collections.reverse(reversed);
        return reversed;
    }

    @Override
    public Iterator<BindParameter> iterator() {
        return parameters.iterator();
    }

    @Override
    public int hashCode() {
        return parameters.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        return parameters.equals(((ParameterMap) obj).parameters);
    }

    @Override
    public String toString() {
        return parameters.toString();
    }
}
