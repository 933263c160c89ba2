package dict;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;
import org.apache.log4j.WriterAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.*;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsTest {

    private final Logger logger = Logger.getLogger(OrderedMap.class);
    private StringWriter captured;
    private WriterAppender appender;
    private Level savedLevel;

    @BeforeEach
    void captureLog() {
        captured = new StringWriter();
        appender = new WriterAppender(new PatternLayout("%m%n"), captured);
        savedLevel = logger.getLevel();
        logger.addAppender(appender);
    }

    @AfterEach
    void releaseLog() {
        logger.removeAppender(appender);
        logger.setLevel(savedLevel);
    }

    private List<String> capturedLines() {
        List<String> lines = new ArrayList<>();
        for (String line : captured.toString().split("\\R")) {
            if (!line.isEmpty()) lines.add(line);
        }
        return lines;
    }

    @Test
    void dump_is_preorder_with_depth_and_path() {
        OrderedMap<Integer,Integer> t = OrderedMapBasicTests.scenario();

        String expected =
                ": 5=50\n" +
                "    0: 3=30\n" +
                "        00: 1=10\n" +
                "        01: 4=40\n" +
                "    1: 8=80\n" +
                "        10: 7=70\n" +
                "        11: 9=90\n";
        assertEquals(expected, ValueSemanticsTest.dumpOf(t).replace(System.lineSeparator(), "\n"));
    }

    @Test
    void dump_after_removal_and_access() {
        OrderedMap<Integer,Integer> t = OrderedMapBasicTests.scenario();
        t.remove(5);
        t.access(6);

        String expected =
                ": 4=40\n" +
                "    0: 3=30\n" +
                "        00: 1=10\n" +
                "    1: 8=80\n" +
                "        10: 7=70\n" +
                "            100: 6=0\n" +
                "        11: 9=90\n";
        assertEquals(expected, ValueSemanticsTest.dumpOf(t).replace(System.lineSeparator(), "\n"));
    }

    @Test
    void dump_of_empty_map_is_empty() {
        assertEquals("", ValueSemanticsTest.dumpOf(new OrderedMap<String,String>()));
        assertEquals("{}", new OrderedMap<String,String>().toString());
    }

    @Test
    void dump_to_log_honours_level() {
        OrderedMap<Integer,Integer> t = new OrderedMap<>();
        t.insert(2, 20);
        t.insert(1, 10);

        logger.setLevel(Level.INFO);
        t.dump(Level.DEBUG);
        assertTrue(capturedLines().isEmpty());

        t.dump(Level.INFO);
        assertEquals(Arrays.asList(": 2=20", "    0: 1=10"), capturedLines());
    }

    @Test
    void two_child_removal_is_logged_at_debug() {
        OrderedMap<Integer,Integer> t = OrderedMapBasicTests.scenario();
        logger.setLevel(Level.DEBUG);

        t.remove(5);
        t.clear();

        List<String> lines = capturedLines();
        assertTrue(lines.contains("remove 5: promoting 4"), lines.toString());
        assertTrue(lines.contains("released 6 nodes"), lines.toString());
    }
}
