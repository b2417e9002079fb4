package work.yamlcli.engine.process;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LineSplitterTest {
    @Test
    void splitsOnNewlinesAndCarriageReturns() throws Exception {
        assertEquals(List.of("a", "b", "c"), split("a\nb\r\nc"));
    }

    @Test
    void progressOutputYieldsOneLinePerUpdate() throws Exception {
        assertEquals(List.of("10%", "20%", "30%", "done"), split("10%\r20%\r30%\ndone\n"));
    }

    @Test
    void flushesUnterminatedTail() throws Exception {
        assertEquals(List.of("tail"), split("tail"));
    }

    @Test
    void dropsEmptyLines() throws Exception {
        assertEquals(List.of(), split(""));
        assertEquals(List.of(), split("\n\r\n\n"));
        assertEquals(List.of("x"), split("\n\nx\n\n"));
    }

    @Test
    void handlesLinesLongerThanTheReadChunk() throws Exception {
        var longLine = "y".repeat(10_000);
        assertEquals(List.of(longLine, "z"), split(longLine + "\nz"));
    }

    private static List<String> split(String text) throws Exception {
        var lines = new ArrayList<String>();
        LineSplitter.split(new StringReader(text), lines::add);
        return lines;
    }
}
