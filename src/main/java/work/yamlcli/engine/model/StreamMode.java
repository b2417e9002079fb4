package work.yamlcli.engine.model;

import work.yamlcli.engine.error.ConfigException;

/**
 * Where a child's stdout or stderr goes: inherited, captured line by line, or written to a file.
 */
public record StreamMode(Kind kind, String pathTemplate) {
    private static final String FILE_PREFIX = "file:";

    public enum Kind {
        INHERIT,
        CAPTURE,
        FILE
    }

    public static StreamMode capture() {
        return new StreamMode(Kind.CAPTURE, null);
    }

    public static StreamMode inherit() {
        return new StreamMode(Kind.INHERIT, null);
    }

    public static StreamMode parse(Object raw) {
        var text = String.valueOf(raw).trim();
        if ("capture".equals(text)) {
            return capture();
        }
        if ("inherit".equals(text)) {
            return inherit();
        }
        if (text.startsWith(FILE_PREFIX) && text.length() > FILE_PREFIX.length()) {
            return new StreamMode(Kind.FILE, text.substring(FILE_PREFIX.length()));
        }
        throw new ConfigException("Unsupported stream mode: " + raw);
    }
}
