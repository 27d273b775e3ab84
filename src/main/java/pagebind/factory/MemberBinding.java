package pagebind.factory;

import pagebind.decorator.MemberType;
import pagebind.locator.LocatorCriteria;

import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * One declared member of a page object: its name, declared type, criteria
 * and the setter that writes the decorated value into it.
 *
 * @param <P> page-object type
 * @param <T> member type
 */
public final class MemberBinding<P, T> {

    private final String name;
    private final MemberType<T> memberType;
    private final LocatorCriteria criteria;
    private final BiConsumer<? super P, ? super T> setter;

    MemberBinding(String name, MemberType<T> memberType, LocatorCriteria criteria,
                  BiConsumer<? super P, ? super T> setter) {
        this.name       = Objects.requireNonNull(name, "name must not be null");
        this.memberType = Objects.requireNonNull(memberType, "memberType must not be null");
        this.criteria   = Objects.requireNonNull(criteria, "criteria must not be null");
        this.setter     = Objects.requireNonNull(setter, "setter must not be null");
    }

    public String          getName()       { return name; }
    public MemberType<T>   getMemberType() { return memberType; }
    public LocatorCriteria getCriteria()   { return criteria; }

    void assign(P page, T value) {
        setter.accept(page, value);
    }

    @Override
    public String toString() {
        return name + ": " + memberType.getTypeName() + " by " + criteria;
    }
}
