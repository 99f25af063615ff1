package edu.isi.fstweight;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;
// diagnostic channel. everything goes to stderr in the configured encoding
public class Debug {

    static String encoding = "utf-8";
    public static void setEncoding(String s) {
	encoding = s;
	initializeStream();
    }
    public static String getEncoding() {
	return encoding;
    }

    private static OutputStreamWriter w=null;
    private static synchronized void initializeStream() {
	try {
	    w = new OutputStreamWriter(System.err, encoding);
	}
	catch (UnsupportedEncodingException e) {
	    System.err.println("Warning: encoding "+encoding+" not supported; using default");
	    w = new OutputStreamWriter(System.err);
	}
    }

    // stuff we always print: reported errors, tool progress
    public static synchronized void prettyDebug(String s) {
	if (w == null)
	    initializeStream();
	try {
	    w.write(s+"\n");
	    w.flush();
	}
	catch (IOException e) {
	    System.err.println("IOException while trying to print "+s);
	}
    }
    // trace output, only when the caller's flag is on
    public static void debug(boolean d, String s)  {
	if (!d)
	    return;
	StackTraceElement caller = new Throwable().getStackTrace()[1];
	write(caller.getClassName()+":"+caller.getMethodName(), s);
    }
    private static synchronized void write(String caller, String s) {
	if (w == null)
	    initializeStream();
	try {
	    w.write(caller+" : "+s+"\n");
	    w.flush();
	}
	catch (IOException e) {
	    System.err.println("IOException while trying to print "+s);
	}
    }

    // elapsed time between two stamps, if timing was asked for
    public static void dbtime(boolean timing, Date pta, Date ptb, String msg) {
	if (!timing)
	    return;
	long x = ptb.getTime() - pta.getTime();
	prettyDebug(msg+": "+x+" ms");
    }
}
