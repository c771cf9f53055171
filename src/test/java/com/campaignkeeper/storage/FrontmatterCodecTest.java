package com.campaignkeeper.storage;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FrontmatterCodecTest {

    private final FrontmatterCodec codec = new FrontmatterCodec();

    @Test
    void parsesHeaderAndBody() throws Exception {
        String raw = "---\nid: vex-abc123\nname: Captain Vex\ntags:\n  - pirate\n  - captain\nhidden: true\n---\n\nRuns the *Gilded Eel*.\n";

        FrontmatterCodec.ParsedDocument doc = codec.parse(raw);

        assertEquals("vex-abc123", doc.getFrontmatter().get("id"));
        assertEquals("Captain Vex", doc.getFrontmatter().get("name"));
        assertEquals(List.of("pirate", "captain"), doc.getFrontmatter().get("tags"));
        assertEquals(Boolean.TRUE, doc.getFrontmatter().get("hidden"));
        assertEquals("Runs the *Gilded Eel*.", doc.getContent());
    }

    @Test
    void keepsKeyOrder() throws Exception {
        FrontmatterCodec.ParsedDocument doc = codec.parse("---\nzeta: 1\nalpha: 2\nmid: 3\n---\n");

        assertEquals(List.of("zeta", "alpha", "mid"), List.copyOf(doc.getFrontmatter().keySet()));
    }

    @Test
    void handlesWindowsLineEndingsAndBom() throws Exception {
        FrontmatterCodec.ParsedDocument doc = codec.parse("\uFEFF---\r\nid: a\r\nname: A\r\n---\r\nBody\r\n");

        assertEquals("a", doc.getFrontmatter().get("id"));
        assertEquals("Body", doc.getContent());
    }

    @Test
    void documentWithoutHeaderIsAllBody() throws Exception {
        FrontmatterCodec.ParsedDocument doc = codec.parse("Just some notes\n");

        assertTrue(doc.getFrontmatter().isEmpty());
        assertEquals("Just some notes", doc.getContent());
    }

    @Test
    void rejectsUnterminatedHeader() {
        assertThrows(FrontmatterParseException.class, () -> codec.parse("---\nid: a\nname: A\n"));
    }

    @Test
    void rejectsNonMapHeader() {
        FrontmatterParseException e = assertThrows(FrontmatterParseException.class,
            () -> codec.parse("---\n- one\n- two\n---\nbody"));
        assertEquals("Frontmatter must be a key-value map", e.getMessage());
    }

    @Test
    void rejectsBrokenYaml() {
        assertThrows(FrontmatterParseException.class, () -> codec.parse("---\nname: [unclosed\n---\n"));
    }

    @Test
    void serializedDocumentReadsBackTheSame() throws Exception {
        Map<String, Object> fm = new LinkedHashMap<>();
        fm.put("id", "station-9-xyz123");
        fm.put("name", "Station: Nine");
        fm.put("code", "0042");
        fm.put("population", 1200);
        fm.put("hidden", false);
        fm.put("tags", List.of("orbital", "trade"));

        String text = codec.serialize(fm, "A ring station.\n\nSecond paragraph.");
        FrontmatterCodec.ParsedDocument doc = codec.parse(text);

        assertTrue(text.startsWith("---\n"));
        assertEquals(fm, doc.getFrontmatter());
        assertEquals("A ring station.\n\nSecond paragraph.", doc.getContent());
    }

    @Test
    void numberLikeAndKeywordStringsStayStrings() throws Exception {
        List<String> tricky = List.of(".inf", "-.inf", ".NaN", "0x1F", "1e5", "1_000", "0b101", "1.0e+3",
            "0o17", "+12", "007", "3.", "true", "No", "null", "~", "", "12:30", "a: b");
        Map<String, Object> fm = new LinkedHashMap<>();
        for (int i = 0; i < tricky.size(); i++) {
            fm.put("v" + i, tricky.get(i));
        }

        Map<String, Object> read = codec.parse(codec.serialize(fm, "")).getFrontmatter();

        for (int i = 0; i < tricky.size(); i++) {
            assertEquals(tricky.get(i), read.get("v" + i), "value " + tricky.get(i));
        }
    }

    @Test
    void realNumbersAndBooleansKeepTheirType() throws Exception {
        Map<String, Object> fm = new LinkedHashMap<>();
        fm.put("crew", 12);
        fm.put("mass", 4.5);
        fm.put("isCrewShip", true);

        Map<String, Object> read = codec.parse(codec.serialize(fm, "")).getFrontmatter();

        assertEquals(12, read.get("crew"));
        assertEquals(4.5, read.get("mass"));
        assertEquals(Boolean.TRUE, read.get("isCrewShip"));
    }
}
