package pagebind.decorator;

import pagebind.locator.ElementLocator;
import pagebind.locator.LocatorCriteria;

/**
 * Builds the value assigned to one page-object member.
 */
public interface MemberDecorator {

    /**
     * @param memberType declared type of the member
     * @param criteria   criteria declared for the member
     * @param locator    locator the member's elements are found with
     * @return a value assignable to a member of {@code memberType}
     * @throws UnsupportedMemberTypeException if the type has no supported shape
     */
    <T> T decorate(MemberType<T> memberType, LocatorCriteria criteria, ElementLocator locator);
}
