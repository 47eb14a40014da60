package edu.isi.mgparse;
/** the interface condition cannot be hosted by a schema of the requested size.
    Recoverable: the caller may raise the bounds and retry */

public class BoundExceededException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public BoundExceededException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public BoundExceededException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public BoundExceededException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()). */
    public BoundExceededException(Throwable cause) { super(cause); }
}
