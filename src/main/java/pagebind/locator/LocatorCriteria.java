package pagebind.locator;

import org.openqa.selenium.By;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered, de-duplicated set of {@link By} criteria declared for one member.
 *
 * <p>The criteria are evaluated as a logical OR with leftmost priority when a
 * single element is located, and as a union in declaration order when a list
 * of elements is located. Duplicates are dropped keeping the first occurrence.
 */
public final class LocatorCriteria implements Iterable<By> {

    private final List<By> bys;

    private LocatorCriteria(List<By> bys) {
        this.bys = bys;
    }

    public static LocatorCriteria of(By... bys) {
        Objects.requireNonNull(bys, "bys must not be null");
        return of(Arrays.asList(bys));
    }

    /**
     * @throws IllegalArgumentException if {@code bys} is empty
     * @throws NullPointerException     if {@code bys} or any of its entries is null
     */
    public static LocatorCriteria of(Collection<? extends By> bys) {
        Objects.requireNonNull(bys, "bys must not be null");
        LinkedHashSet<By> unique = new LinkedHashSet<>();
        for (By by : bys) {
            unique.add(Objects.requireNonNull(by, "criteria must not contain null"));
        }
        if (unique.isEmpty()) {
            throw new IllegalArgumentException("At least one locator criterion is required");
        }
        return new LocatorCriteria(Collections.unmodifiableList(new ArrayList<>(unique)));
    }

    public List<By> asList() { return bys; }
    public int      size()   { return bys.size(); }

    @Override
    public Iterator<By> iterator() {
        return bys.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LocatorCriteria)) return false;
        return bys.equals(((LocatorCriteria) o).bys);
    }

    @Override
    public int hashCode() {
        return bys.hashCode();
    }

    @Override
    public String toString() {
        return bys.stream().map(String::valueOf).collect(Collectors.joining(", or: ", "[", "]"));
    }
}
