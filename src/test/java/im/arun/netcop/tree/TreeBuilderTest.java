package im.arun.netcop.tree;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeBuilderTest {

    @Test
    void testNestingFollowsIndentation() {
        ConfNode root = TreeBuilder.parse(String.join("\n",
            "a",
            "  b",
            "    c",
            "  d",
            "e"));

        List<ConfNode> top = root.getChildren();
        assertEquals(2, top.size());
        assertEquals("a", top.get(0).getContent());
        assertEquals("e", top.get(1).getContent());

        List<ConfNode> underA = top.get(0).getChildren();
        assertEquals(2, underA.size());
        assertEquals("  b", underA.get(0).getContent());
        assertEquals("    c", underA.get(0).getChildren().get(0).getContent());
        assertEquals("  d", underA.get(1).getContent());
    }

    @Test
    void testBlankLinesSkippedButCounted() {
        ConfNode root = TreeBuilder.parse(List.of("", "hostname r1", "   ", "  ", "ntp server 1.2.3.4   "));
        assertEquals(2, root.getChildren().size());
        assertEquals(1, root.getChildren().get(0).getLineNumber());
        assertEquals(4, root.getChildren().get(1).getLineNumber());
        assertEquals("ntp server 1.2.3.4", root.getChildren().get(1).getOriginalText());
    }

    @Test
    void testEmptyInputHasNoMatches() {
        ConfNode root = TreeBuilder.parse("");
        assertFalse(root.isPresent());
        assertEquals(0, root.size());
        assertFalse(TreeBuilder.parse("\n   \n").isPresent());
    }

    @Test
    void testRootIsPresentContainer() {
        ConfNode root = TreeBuilder.parse("hostname r1");
        assertTrue(root.isPresent());
        assertEquals("", root.getContent());
        assertTrue(root.getTrace().isEmpty());
    }

    @Test
    void testIndentComparedByLengthOnly() {
        ConfNode root = TreeBuilder.parse(String.join("\n",
            "a",
            "\tb",
            " c"));
        ConfNode a = root.getChildren().get(0);
        assertEquals(2, a.getChildren().size());
        assertTrue(a.getChildren().get(1).getChildren().isEmpty());
    }

    @Test
    void testDedentBelowPreviousSiblingLevel() {
        ConfNode root = TreeBuilder.parse(String.join("\n",
            "a",
            "    b",
            "  c",
            "d"));
        ConfNode a = root.getChildren().get(0);
        assertEquals(List.of("    b", "  c"), List.of(a.getChildren().get(0).getContent(),
            a.getChildren().get(1).getContent()));
        assertEquals(2, root.getChildren().size());
    }

    @Test
    void testParseFromReaderAndCrLf() throws IOException {
        ConfNode fromReader = TreeBuilder.parse(new StringReader("a\r\n  b\r\nc\r\n"));
        ConfNode fromText = TreeBuilder.parse("a\r\n  b\r\nc\r\n");
        assertEquals(fromText.lines(), fromReader.lines());
        assertEquals(List.of("a", "  b", "c"), fromText.lines());
    }
}
