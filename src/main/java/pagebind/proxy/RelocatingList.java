package pagebind.proxy;

import java.util.AbstractList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Spliterator;
import java.util.function.Consumer;

/**
 * Read-only list whose contents are recomputed on every access.
 *
 * <p>Each operation takes exactly one {@link #snapshot()} and answers from
 * it, so an iteration, a stream or a {@code size()} call each cost one
 * lookup and see a consistent view. Nothing is kept between operations.
 *
 * @param <T> element type
 */
public abstract class RelocatingList<T> extends AbstractList<T> {

    /** A freshly located, unmodifiable view of the current contents. */
    protected abstract List<T> snapshot();

    @Override public T               get(int index)                 { return snapshot().get(index); }
    @Override public int             size()                         { return snapshot().size(); }
    @Override public boolean         isEmpty()                      { return snapshot().isEmpty(); }
    @Override public boolean         contains(Object o)             { return snapshot().contains(o); }
    @Override public boolean         containsAll(Collection<?> c)   { return snapshot().containsAll(c); }
    @Override public int             indexOf(Object o)              { return snapshot().indexOf(o); }
    @Override public int             lastIndexOf(Object o)          { return snapshot().lastIndexOf(o); }
    @Override public Iterator<T>     iterator()                     { return snapshot().iterator(); }
    @Override public ListIterator<T> listIterator()                 { return snapshot().listIterator(); }
    @Override public ListIterator<T> listIterator(int index)        { return snapshot().listIterator(index); }
    @Override public List<T>         subList(int from, int to)      { return snapshot().subList(from, to); }
    @Override public Spliterator<T>  spliterator()                  { return snapshot().spliterator(); }
    @Override public Object[]        toArray()                      { return snapshot().toArray(); }
    @Override public <A> A[]         toArray(A[] a)                 { return snapshot().toArray(a); }
    @Override public void            forEach(Consumer<? super T> action) { snapshot().forEach(action); }

    @Override
    public boolean equals(Object o) {
        return o == this || snapshot().equals(o);
    }

    @Override
    public int hashCode() {
        return snapshot().hashCode();
    }
}
