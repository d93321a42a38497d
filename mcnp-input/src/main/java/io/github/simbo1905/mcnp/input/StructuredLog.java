package io.github.simbo1905.mcnp.input;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Package-private helper for `event=NAME key=value` JUL lines with simple sampling.
/// Record text is logged through here, so values are cut and newlines collapsed.
final class StructuredLog {
    private static final Map<String, AtomicLong> COUNTERS = new ConcurrentHashMap<>();
    private static final int MAX_VALUE = 160;

    private StructuredLog() {}

    static void fine(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.FINE)) log.fine(() -> ev(event, kv));
    }

    static void finer(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.FINER)) log.finer(() -> ev(event, kv));
    }

    static void finest(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.FINEST)) log.finest(() -> ev(event, kv));
    }

    /// FINEST, but only every Nth time an event name is seen. Used for per-value formatting.
    static void finestSampled(Logger log, String event, int everyN, Object... kv) {
        if (!log.isLoggable(Level.FINEST)) return;
        if (everyN <= 1) {
            log.finest(() -> ev(event, kv));
            return;
        }
        long n = COUNTERS.computeIfAbsent(event, k -> new AtomicLong()).incrementAndGet();
        if (n % everyN == 0L) {
            Object[] withSample = new Object[kv.length + 2];
            withSample[0] = "sample";
            withSample[1] = n;
            System.arraycopy(kv, 0, withSample, 2, kv.length);
            log.finest(() -> ev(event, withSample));
        }
    }

    static String ev(String event, Object... kv) {
        StringBuilder sb = new StringBuilder(64);
        sb.append("event=").append(sanitize(event));
        for (int i = 0; i + 1 < kv.length; i += 2) {
            Object key = kv[i];
            if (key == null) continue;
            Object val = kv[i + 1];
            String v = val == null ? "null" : sanitize(val.toString());
            sb.append(' ').append(key).append('=');
            if (needsQuotes(v)) {
                sb.append('"').append(v.replace("\"", "\\\"")).append('"');
            } else {
                sb.append(v);
            }
        }
        return sb.toString();
    }

    private static boolean needsQuotes(String s) {
        if (s.isEmpty()) return true;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || c == '"' || c == '=') return true;
        }
        return false;
    }

    private static String sanitize(String s) {
        if (s == null) return "null";
        String trimmed = s.length() > MAX_VALUE ? s.substring(0, MAX_VALUE) + "..." : s;
        return trimmed.replace("\r", "\\r").replace("\n", "\\n").replace('\t', ' ');
    }
}
