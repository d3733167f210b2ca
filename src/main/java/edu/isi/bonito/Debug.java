package edu.isi.bonito;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;

// stderr reporting for the command line tools and tracing for the library.
// tracing is switched per method with a local debug flag
public class Debug {

	private static String encoding = "utf-8";
	private static OutputStreamWriter w = null;
	private static int dblevel = 0;

	public static void setEncoding(String s) {
		encoding = s;
		w = null;
	}
	public static String getEncoding() {
		return encoding;
	}

	public static void setDbLevel(int i) {
		dblevel = i;
	}

	private static OutputStreamWriter stream() {
		if (w == null) {
			try {
				w = new OutputStreamWriter(System.err, encoding);
			}
			catch (UnsupportedEncodingException e) {
				System.err.println("Warning: encoding "+encoding+" not supported; using default");
				w = new OutputStreamWriter(System.err);
			}
		}
		return w;
	}

	private static void emit(String s) {
		try {
			OutputStreamWriter out = stream();
			out.write(s);
			out.write("\n");
			out.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}

	// messages meant for the user
	public static void prettyDebug(String s) {
		emit(s);
	}

	// tracing, labelled with the calling class and method
	public static void debug(boolean d, String s) {
		if (!d)
			return;
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		emit(caller.getClassName()+":"+caller.getMethodName()+" : "+s);
	}

	public static void debug(boolean d, int indent, String s) {
		if (!d)
			return;
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		StringBuffer sb = new StringBuffer();
		for (int i = 0; i < indent; i++)
			sb.append(' ');
		sb.append(caller.getClassName()+":"+caller.getMethodName()+" : "+s);
		emit(sb.toString());
	}

	// report elapsed time since start if the global level is at least needlevel
	public static void dbtime(int needlevel, Date start, String msg) {
		if (dblevel < needlevel)
			return;
		long x = new Date().getTime() - start.getTime();
		emit(msg+": "+x+" ms");
	}
}
