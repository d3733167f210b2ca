package edu.isi.bonito;
/** thrown for internal states that should not occur, such as unbalanced capture markers in a decoded path */
public class UnusualConditionException extends Exception {
	public UnusualConditionException() { super(); }
	public UnusualConditionException(String message) { super(message); }
	public UnusualConditionException(String message, Throwable cause) { super(message, cause); }
	public UnusualConditionException(Throwable cause) { super(cause); }
}
