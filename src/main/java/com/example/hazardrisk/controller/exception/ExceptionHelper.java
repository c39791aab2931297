package com.example.hazardrisk.controller.exception;

public class ExceptionHelper {

    private static final String APP_PACKAGE = "com.example.hazardrisk";

    /**
     * First stack frame inside this application, falling back to the top frame.
     */
    public static String getTrace(Throwable ex) {
        StackTraceElement[] st = ex.getStackTrace();
        if (st == null || st.length == 0) {
            return null;
        }
        for (StackTraceElement e : st) {
            if (e.getClassName().startsWith(APP_PACKAGE)) {
                return format(e);
            }
        }
        return format(st[0]);
    }

    private static String format(StackTraceElement e) {
        return e.getClassName() + ":" + e.getLineNumber();
    }
}
