package pagebind.decorator;

/**
 * Thrown when a declared member type matches none of the shapes a
 * {@link MemberDecorator} can build a value for.
 */
public class UnsupportedMemberTypeException extends DecorationException {

    private final MemberType<?> memberType;

    public UnsupportedMemberTypeException(MemberType<?> memberType) {
        super("Unable to decorate " + memberType.getTypeName() + ", it is unsupported");
        this.memberType = memberType;
    }

    public MemberType<?> getMemberType() {
        return memberType;
    }
}
