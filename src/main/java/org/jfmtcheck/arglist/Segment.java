package org.jfmtcheck.arglist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered run of constraint elements together with the number of arguments it represents.
 *
 * <p>The cached {@link #length()} is the sum of all repeat counts; every mutation goes through this class so
 * the two never diverge.
 */
public final class Segment {
    private final List<ConstraintElement> elements;
    private int length;

    Segment() {
        this.elements = new ArrayList<>();
        this.length = 0;
    }

    public int count() {
        return elements.size();
    }

    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public ConstraintElement get(final int index) {
        return elements.get(index);
    }

    public ConstraintElement last() {
        return elements.get(elements.size() - 1);
    }

    public List<ConstraintElement> elements() {
        return Collections.unmodifiableList(elements);
    }

    void add(final ConstraintElement element) {
        elements.add(Objects.requireNonNull(element, "element"));
        length += element.repeatCount();
    }

    void add(final int index, final ConstraintElement element) {
        elements.add(index, Objects.requireNonNull(element, "element"));
        length += element.repeatCount();
    }

    void addAll(final Segment other) {
        for (final ConstraintElement element : other.elements) {
            add(element);
        }
    }

    ConstraintElement removeLast() {
        final ConstraintElement removed = elements.remove(elements.size() - 1);
        length -= removed.repeatCount();
        return removed;
    }

    void truncate(final int newCount) {
        while (elements.size() > newCount) {
            removeLast();
        }
    }

    void clear() {
        elements.clear();
        length = 0;
    }

    void setRepeatCount(final int index, final int repeatCount) {
        final ConstraintElement element = elements.get(index);
        length += repeatCount - element.repeatCount();
        element.repeatCount(repeatCount);
    }

    /**
     * Replaces the content wholesale; repeat counts of the given elements may have been edited beforehand.
     */
    void replaceWith(final List<ConstraintElement> newElements) {
        final List<ConstraintElement> snapshot = new ArrayList<>(newElements);
        elements.clear();
        length = 0;
        for (final ConstraintElement element : snapshot) {
            add(element);
        }
    }

    Segment copy() {
        final Segment copy = new Segment();
        for (final ConstraintElement element : elements) {
            copy.add(element.copy());
        }
        return copy;
    }

    void verify() {
        int total = 0;
        for (final ConstraintElement element : elements) {
            if (element.repeatCount() <= 0) {
                throw new IllegalStateException("element with non-positive repeat count: " + element.repeatCount());
            }
            if (element.isElementwise() != (element.elementwise() != null)) {
                throw new IllegalStateException("elementwise flag and nested list disagree");
            }
            if (element.isElementwise()) {
                element.elementwise().verify();
            }
            total += element.repeatCount();
        }
        if (total != length) {
            throw new IllegalStateException("segment length " + length + " differs from repeat count sum " + total);
        }
    }
}
