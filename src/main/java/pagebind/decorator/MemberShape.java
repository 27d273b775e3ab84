package pagebind.decorator;

/** The member shapes a {@link ProxyMemberDecorator} knows how to build. */
public enum MemberShape {
    /** {@code WebElement} */
    ELEMENT,
    /** a type implementing {@code WrapsElement} */
    WRAPPER,
    /** {@code List<WebElement>} */
    ELEMENT_LIST,
    /** {@code List<W extends WrapsElement>} */
    WRAPPER_LIST
}
