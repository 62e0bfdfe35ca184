package com.cyclerprotocol.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cyclerprotocol.loader.ast.XmlElementNode;
import org.junit.jupiter.api.Test;

class MaccorAstBuilderTest {
    private final MaccorAstBuilder builder = new MaccorAstBuilder();

    @Test
    void buildsNestedElements() throws Exception {
        String xml =
                String.join(
                        "\n",
                        "<?xml version=\"1.0\"?>",
                        "<!-- procedure -->",
                        "<Root kind=\"test\" note='a &amp; b'>",
                        "  <Leaf>  value  </Leaf>",
                        "  <Empty/>",
                        "  <Leaf>second</Leaf>",
                        "  <Group><Inner>x</Inner></Group>",
                        "</Root>",
                        "");

        XmlElementNode root = builder.parse("inline", xml);

        assertEquals("Root", root.getName());
        assertEquals("test", root.getAttributes().get("kind"));
        assertEquals("a & b", root.getAttributes().get("note"));
        assertEquals(4, root.getChildren().size());
        assertEquals("value", root.childText("Leaf"));
        assertEquals(2, root.children("Leaf").size());
        assertEquals("", root.childText("Empty"));
        assertEquals("x", root.path("Group", "Inner").getText());
        assertNull(root.child("Missing"));
        assertNull(root.path("Group", "Missing"));
        assertEquals(3, root.getLine());
    }

    @Test
    void decodesEntitiesCharacterReferencesAndCdata() throws Exception {
        XmlElementNode root =
                builder.parse(
                        "inline",
                        "<R><A>&gt;=</A><B>&#60;&#x3D;</B><C><![CDATA[<raw> & text]]></C><D>1<!-- c -->2</D></R>");

        assertEquals(">=", root.childText("A"));
        assertEquals("<=", root.childText("B"));
        assertEquals("<raw> & text", root.childText("C"));
        assertEquals("12", root.childText("D"));
    }

    @Test
    void keepsPunctuationInText() throws Exception {
        XmlElementNode root = builder.parse("inline", "<R><T>00:00:10</T><U>a/b = c</U><V>::.5</V></R>");

        assertEquals("00:00:10", root.childText("T"));
        assertEquals("a/b = c", root.childText("U"));
        assertEquals("::.5", root.childText("V"));
    }

    @Test
    void rejectsMismatchedClosingTag() {
        ProcedureParseException ex =
                assertThrows(ProcedureParseException.class, () -> builder.parse("bad.000", "<A>\n<B>1</C>\n</A>"));
        assertTrue(ex.getMessage().contains("bad.000"));
        assertTrue(ex.getMessage().contains("line 2"));
    }

    @Test
    void rejectsUnterminatedDocument() {
        assertThrows(ProcedureParseException.class, () -> builder.parse("bad.000", "<A><B>1</B>"));
    }

    @Test
    void rejectsUnknownEntity() {
        assertThrows(ProcedureParseException.class, () -> builder.parse("bad.000", "<A>&nbsp;</A>"));
    }

    @Test
    void tokenDumpDoesNotDisturbParsing() throws Exception {
        String previous = System.getProperty("cyclerprotocol.debugTokens");
        System.setProperty("cyclerprotocol.debugTokens", "true");
        try {
            assertTrue(DebugFlags.isTokenDebugEnabled());
            assertEquals("1", builder.parse("debug", "<A><B>1</B></A>").childText("B"));
        } finally {
            if (previous == null) {
                System.clearProperty("cyclerprotocol.debugTokens");
            } else {
                System.setProperty("cyclerprotocol.debugTokens", previous);
            }
        }
    }
}
