package com.appforge.sandbox;

import java.util.List;
import java.util.Locale;

/**
 * Sorts upstream errors into permanent and transient by message content.
 * Unknown errors are treated as transient.
 */
public final class SandboxErrorClassifier {

    private static final List<String> PERMANENT_MARKERS = List.of(
            "unauthorized", "forbidden", "401", "403", "404", "not found",
            "invalid api key", "authentication", "quota exceeded", "no such image");

    private static final List<String> TRANSIENT_MARKERS = List.of(
            "timeout", "timed out", "econnreset", "etimedout", "connection reset",
            "connection refused", "502", "503", "504", "temporarily unavailable");

    private SandboxErrorClassifier() {}

    public static boolean isPermanent(Throwable error) {
        if (error instanceof SandboxException se) {
            return se.isPermanent();
        }
        String message = describe(error);
        for (String marker : TRANSIENT_MARKERS) {
            if (message.contains(marker)) {
                return false;
            }
        }
        for (String marker : PERMANENT_MARKERS) {
            if (message.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable error) {
        var sb = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause()) {
            sb.append(t.getClass().getSimpleName()).append(' ');
            if (t.getMessage() != null) {
                sb.append(t.getMessage()).append(' ');
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
