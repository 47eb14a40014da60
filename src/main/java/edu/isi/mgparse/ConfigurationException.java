package edu.isi.mgparse;
/** for errors in the parse configuration, like both constraint families
    switched off, negative bounds, a family switched on without its target */

public class ConfigurationException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public ConfigurationException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public ConfigurationException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public ConfigurationException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()). */
    public ConfigurationException(Throwable cause) { super(cause); }
}
