package edu.isi.bonito;
/** thrown for bad settings, such as an unknown unknown-word policy or a bad option combination */
public class ConfigureException extends Exception {
	public ConfigureException() { super(); }
	public ConfigureException(String message) { super(message); }
	public ConfigureException(String message, Throwable cause) { super(message, cause); }
	public ConfigureException(Throwable cause) { super(cause); }
}
