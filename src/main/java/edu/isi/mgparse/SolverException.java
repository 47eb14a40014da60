package edu.isi.mgparse;
/** fatal failure inside the constraint backend. Unchecked, since it can
    surface from the enumeration iterator */

public class SolverException extends RuntimeException {
    /**      Constructs a new exception with the specified detail message. */
    public SolverException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public SolverException(String message, Throwable cause) { super(message, cause); }
}
