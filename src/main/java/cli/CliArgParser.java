package cli;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CLI argument parsing helpers.
 *
 * <p>All value parsers are lenient: a blank or malformed value yields the
 * supplied default instead of an exception.</p>
 */
public final class CliArgParser {

    private static final String PREFIX = "--";

    private CliArgParser() {
    }

    /**
     * {@code --key=value} and {@code --key value}. A token not starting with
     * {@code --} right after a bare key is its value; other stray tokens are
     * ignored. Later keys win.
     */
    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> argv = new HashMap<>();
        if (args == null) return argv;

        int i = 0;
        while (i < args.length) {
            String token = (args[i] == null) ? "" : args[i].trim();
            i++;
            if (!token.startsWith(PREFIX)) continue;

            String body = token.substring(PREFIX.length());
            int eq = body.indexOf('=');
            String key;
            String value;
            if (eq > 0) {
                key = body.substring(0, eq).trim();
                value = body.substring(eq + 1).trim();
            } else {
                key = body.trim();
                value = "";
                if (i < args.length && isValue(args[i])) {
                    value = args[i].trim();
                    i++;
                }
            }

            if (!key.isEmpty()) argv.put(key, value);
        }
        return argv;
    }

    private static boolean isValue(String token) {
        return token != null && !token.trim().startsWith(PREFIX);
    }

    public static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public static long parseLong(String s, long def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /**
     * NaN and infinities fall back to {@code def}.
     */
    public static double parseDouble(String s, double def) {
        if (s == null || s.isBlank()) return def;
        try {
            double v = Double.parseDouble(s.trim());
            return Double.isFinite(v) ? v : def;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /**
     * Like {@link #parseDouble} but a value outside {@code [min, max]} is an
     * argument error rather than silently replaced.
     */
    public static double parseDoubleInRange(String name, String s, double def, double min, double max) {
        double v = parseDouble(s, def);
        if (v < min || v > max) {
            throw new IllegalArgumentException("--" + name + " must be in [" + min + ", " + max + "]: " + s);
        }
        return v;
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim().toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--noResult       => true</li>
     *   <li>--noResult=true  => true</li>
     *   <li>--noResult=false => false</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || key == null || !argv.containsKey(key)) return false;
        return parseBoolean(argv.get(key), true);
    }

    /** Either flag set counts. */
    public static boolean anyFlag(Map<String, String> argv, String key, String alias) {
        return flag(argv, key) || flag(argv, alias);
    }
}
