package io.intellixity.pagesync.source;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PageRecordParserTest {
  private static final String T1 = "aaaaaaaa000040008000000000000001";
  private static final String T2 = "aaaaaaaa000040008000000000000002";
  private static final String P_A = "111111110000400080000000000000aa";
  private static final String P_B = "111111110000400080000000000000bb";

  @Test
  void parsesColumnsRowsAndRelations() {
    ParsedRecords parsed = PageRecordParser.parse(PageJson.pages(PageJsonTest.fixture("tasks-query.json")));

    assertEquals(List.of("primary_key_id", "Name", "Status", "Estimate", "Done", "Tags", "Due"), parsed.columns());
    assertEquals(2, parsed.rows().size());

    ParsedRow first = parsed.rows().get(0);
    assertEquals(T1, first.id());
    assertEquals(Ids.toUuid(T1), first.values().get("primary_key_id"));
    assertEquals("Write report", first.values().get("Name"));
    assertEquals("In progress", first.values().get("Status"));
    assertEquals(3.5, first.values().get("Estimate"));
    assertEquals(false, first.values().get("Done"));
    assertEquals(List.of("ops", "q3"), first.values().get("Tags"));
    assertEquals(LocalDate.of(2024, 7, 1), first.values().get("Due"));
    assertFalse(first.values().containsKey("Total"));

    ParsedRow second = parsed.rows().get(1);
    assertNull(second.values().get("Status"));
    assertEquals(List.of(), second.values().get("Tags"));
    assertInstanceOf(OffsetDateTime.class, second.values().get("Due"));

    assertEquals(List.of(
        new RelationEdge(T1, P_A),
        new RelationEdge(T2, P_A),
        new RelationEdge(T2, P_B)
    ), parsed.relations().get("Project"));
    assertEquals(List.of(RelationEdge.purge(T1), new RelationEdge(T2, T1)), parsed.relations().get("Blocked By"));
  }

  @Test
  void truncatesShortTextTypes() {
    String longTitle = "x".repeat(300);
    PageRecord page = new PageRecord(T1, null, Map.of(
        "Name", new PropertyValue("title", List.of(Map.of("plain_text", longTitle))),
        "Notes", new PropertyValue("rich_text", List.of(Map.of("plain_text", longTitle)))
    ));
    ParsedRow row = PageRecordParser.parse(List.of(page)).rows().get(0);
    assertEquals(255, ((String) row.values().get("Name")).length());
    assertEquals(300, ((String) row.values().get("Notes")).length());
  }

  @Test
  void missingRelationPayloadIsPurge() {
    PageRecord page = new PageRecord(T1, null, Map.of("Project", new PropertyValue("relation", null)));
    ParsedRecords parsed = PageRecordParser.parse(List.of(page));
    assertEquals(List.of(RelationEdge.purge(T1)), parsed.relations().get("Project"));
  }

  @Test
  void extractsTypedValues() {
    assertEquals("PRJ_42", PageValues.extract("unique_id", Map.of("prefix", "PRJ", "number", 42)));
    assertEquals("42", PageValues.extract("unique_id", Map.of("number", 42)));
    assertEquals("yes", PageValues.extract("formula", Map.of("type", "string", "string", "yes")));
    assertEquals(List.of("https://files.example/a.png"),
        PageValues.extract("files", List.of(Map.of("type", "external", "external", Map.of("url", "https://files.example/a.png")))));
    assertEquals(List.of("Ada"), PageValues.extract("people", List.of(Map.of("name", "Ada", "id", "u1"))));
    assertEquals("u2", PageValues.extract("created_by", Map.of("id", "u2")));
    assertNull(PageValues.extract("date", null));
  }

  @Test
  void idsNormalize() {
    assertEquals(T1, Ids.normalize("AAAAAAAA-0000-4000-8000-000000000001"));
    assertEquals(T1, Ids.of(Ids.toUuid(T1)));
    assertThrows(IllegalArgumentException.class, () -> Ids.normalize("not-an-id"));
    assertFalse(Ids.isId("abc"));
  }
}
