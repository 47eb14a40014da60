package edu.isi.mgparse;
/** for errors in lexicon input: malformed json, bad feature sequences,
    duplicate identifiers, words the lexicon cannot host */

public class LexiconException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public LexiconException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public LexiconException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public LexiconException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()). */
    public LexiconException(Throwable cause) { super(cause); }
}
