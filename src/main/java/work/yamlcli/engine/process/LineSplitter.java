package work.yamlcli.engine.process;

import java.io.IOException;
import java.io.Reader;
import java.util.function.Consumer;

/**
 * Coalesces a character stream into logical lines. Both {@code \n} and a bare {@code \r} end a line,
 * so progress-bar output that rewrites itself with carriage returns yields one line per update.
 * Empty lines are dropped; an unterminated tail is flushed when the stream closes.
 */
public final class LineSplitter {
    private LineSplitter() {}

    public static void split(Reader reader, Consumer<String> onLine) throws IOException {
        var buffer = new StringBuilder();
        var chunk = new char[4096];
        int read;
        while ((read = reader.read(chunk)) != -1) {
            for (int i = 0; i < read; i++) {
                char ch = chunk[i];
                if (ch == '\n' || ch == '\r') {
                    flush(buffer, onLine);
                } else {
                    buffer.append(ch);
                }
            }
        }
        flush(buffer, onLine);
    }

    private static void flush(StringBuilder buffer, Consumer<String> onLine) {
        if (buffer.length() > 0) {
            onLine.accept(buffer.toString());
            buffer.setLength(0);
        }
    }
}
