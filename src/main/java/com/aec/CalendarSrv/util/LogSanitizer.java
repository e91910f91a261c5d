package com.aec.CalendarSrv.util;

/** Enmascara datos personales antes de escribirlos al log. */
public final class LogSanitizer {

    private LogSanitizer() {
    }

    /** {@code juan.perez@gmail.com} -> {@code j***@gmail.com}. */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return "<sin email>";
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
