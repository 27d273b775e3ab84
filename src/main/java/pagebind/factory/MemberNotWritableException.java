package pagebind.factory;

import pagebind.decorator.DecorationException;

/**
 * Thrown when a decorated value cannot be written into its member.
 */
public class MemberNotWritableException extends DecorationException {

    public MemberNotWritableException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
