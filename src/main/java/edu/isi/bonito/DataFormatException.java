package edu.isi.bonito;
/** thrown for malformed input data: bad lines, missing reserved symbols, unknown labels in read-only tables */
public class DataFormatException extends Exception {
	public DataFormatException() { super(); }
	public DataFormatException(String message) { super(message); }
	public DataFormatException(String message, Throwable cause) { super(message, cause); }
	public DataFormatException(Throwable cause) { super(cause); }
}
