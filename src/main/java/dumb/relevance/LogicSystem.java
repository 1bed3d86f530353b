package dumb.relevance;

import java.util.List;
import java.util.Locale;

/** The relevance logics this engine reasons in, declared weakest first. */
public enum LogicSystem {
    B, T, E, R;

    public static final String PREFIX = "relevance_";

    public static List<LogicSystem> hierarchy() {
        return List.of(values());
    }

    public static boolean isStronger(LogicSystem a, LogicSystem b) {
        return a.ordinal() > b.ordinal();
    }

    /** Accepts {@code R}, {@code r} and {@code relevance_R}. */
    public static LogicSystem parse(String name) {
        var n = name.strip();
        if (n.toLowerCase(Locale.ROOT).startsWith(PREFIX)) n = n.substring(PREFIX.length());
        try {
            return valueOf(n.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown relevance logic system: " + name, e);
        }
    }

    public String id() {
        return PREFIX + name();
    }
}
