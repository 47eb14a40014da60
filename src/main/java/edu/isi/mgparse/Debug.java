package edu.isi.mgparse;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.io.Writer;
import java.util.Date;
// debugging and progress output for the parser. everything goes to stderr unless redirected
public class Debug {

    static String encoding = "utf-8";
    public static void setEncoding(String s) {
	encoding = s;
	initializeStream();
    }

    private static Writer w=null;
    private static void initializeStream() {
	try {
	    w = new OutputStreamWriter(System.err, encoding);
	}
	catch (UnsupportedEncodingException e) {
	    System.err.println("Warning: encoding "+encoding+" not supported; using default");
	    w = new OutputStreamWriter(System.err);
	}
    }

    // send everything somewhere else (a file, a StringWriter in tests). null restores stderr
    public static synchronized void setWriter(Writer writer) {
	if (writer == null)
	    initializeStream();
	else
	    w = writer;
    }

    // stuff we always print
    public static synchronized void prettyDebug(String s) {
	write(s+"\n");
    }

    // true debugging stuff. caller is looked up from the stack
    public static void debug(boolean d, String s)  {
	if (!d)
	    return;
	StackTraceElement caller = new Throwable().getStackTrace()[1];
	debug(0, caller.getClassName()+":"+caller.getMethodName(), s);
    }
    public static void debug(boolean d, int i, String s) {
	if (!d)
	    return;
	StackTraceElement caller = new Throwable().getStackTrace()[1];
	debug(i, caller.getClassName()+":"+caller.getMethodName(), s);
    }
    private static synchronized void debug(int i, String caller, String s) {
	StringBuffer sb = new StringBuffer();
	for (int x = 0; x < i; x++)
	    sb.append(" ");
	sb.append(caller+" : "+s+"\n");
	write(sb.toString());
    }

    // -1: no timing output
    private static int dblevel=-1;
    public static void setDbLevel(int i) {
	dblevel = i;
    }
    public static int getDbLevel() {
	return dblevel;
    }

    // print time debug info if the global level is at least needlevel
    public static synchronized void dbtime(int needlevel, Date pta, String msg) {
	if (dblevel < needlevel)
	    return;
	long x = new Date().getTime() - pta.getTime();
	write(msg+": "+x+" ms\n");
    }

    private static void write(String s) {
	if (w == null)
	    initializeStream();
	try {
	    w.write(s);
	    w.flush();
	}
	catch (IOException e) {
	    System.err.println("IOException while trying to print "+s);
	}
    }
}
