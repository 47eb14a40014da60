package edu.isi.mgparse;
/** a satisfying assignment broke an invariant the constraints should guarantee.
    Always an assembler or schema defect, never a user error */

public class InconsistentModelException extends RuntimeException {
    /**      Constructs a new exception with the specified detail message. */
    public InconsistentModelException(String message) { super(message); }
}
