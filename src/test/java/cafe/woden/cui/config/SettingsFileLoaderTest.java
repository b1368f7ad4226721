package cafe.woden.cui.config;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cafe.woden.cui.config.api.SettingsStoreException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SettingsFileLoaderTest {

  @TempDir
  Path tempDir;

  private MachineIdGenerator machineIds;
  private SettingsFileLoader loader;
  private Path cfg;

  @BeforeEach
  void setUp() {
    machineIds = mock(MachineIdGenerator.class);
    when(machineIds.generate()).thenReturn("testhost-0123abcd");
    Clock clock = Clock.fixed(Instant.parse("2026-03-04T05:06:07Z"), ZoneOffset.UTC);
    loader = new SettingsFileLoader(machineIds, true, clock);
    cfg = tempDir.resolve("config.json");
  }

  private static ObjectNode defaultsWithId(String id) {
    ObjectNode doc = SettingsDefaults.newDocument();
    doc.put("machineId", id);
    return doc;
  }

  @Test
  void missingFileYieldsDefaultsAndAsksForWrite() {
    LoadResult result = loader.load(cfg);

    assertEquals(LoadResult.Origin.MISSING, result.origin());
    assertTrue(result.migrated());
    assertEquals(defaultsWithId("testhost-0123abcd"), result.document());
  }

  @Test
  void emptyObjectLoadsToFullDefaults() throws Exception {
    Files.writeString(cfg, "{}");

    LoadResult result = loader.load(cfg);

    assertEquals(LoadResult.Origin.PARSED, result.origin());
    assertTrue(result.migrated());
    assertEquals(defaultsWithId("testhost-0123abcd"), result.document());
  }

  @Test
  void blankFileIsReadAsEmptyDocument() throws Exception {
    Files.writeString(cfg, "  \n");

    LoadResult result = loader.load(cfg);

    assertEquals(LoadResult.Origin.EMPTY, result.origin());
    assertTrue(result.migrated());
    assertEquals(defaultsWithId("testhost-0123abcd"), result.document());
  }

  @Test
  void systemOnlyFileGetsDefaultInterfaceAndKeepsItsValues() throws Exception {
    Files.writeString(cfg, "{\n"
        + "  \"claudeExecutablePath\": \"/opt/claude\",\n"
        + "  \"logLevel\": \"debug\",\n"
        + "  \"serverPort\": 3000,\n"
        + "  \"maxConversations\": 4,\n"
        + "  \"conversationTimeout\": 60000,\n"
        + "  \"healthCheckInterval\": 5000,\n"
        + "  \"machineId\": \"box-11112222\"\n"
        + "}\n");

    LoadResult result = loader.load(cfg);
    ObjectNode doc = result.document();

    assertTrue(result.migrated());
    assertEquals(SettingsDefaults.newInterfaceSection(), doc.get("interface"));
    assertEquals("/opt/claude", doc.get("claudeExecutablePath").asText());
    assertEquals("debug", doc.get("logLevel").asText());
    assertEquals(3000, doc.get("serverPort").asInt());
    assertEquals(4, doc.get("maxConversations").asInt());
    assertEquals(60000, doc.get("conversationTimeout").asInt());
    assertEquals(5000, doc.get("healthCheckInterval").asInt());
    assertEquals("box-11112222", doc.get("machineId").asText());
    verify(machineIds, never()).generate();
  }

  @Test
  void completeFileIsNotMigrated() throws Exception {
    Files.writeString(cfg, SettingsJson.PRETTY.writeValueAsString(defaultsWithId("box-1")));

    LoadResult result = loader.load(cfg);

    assertEquals(LoadResult.Origin.PARSED, result.origin());
    assertFalse(result.migrated());
  }

  @Test
  void unknownKeysAndNestedLegacyFieldsSurvive() throws Exception {
    Files.writeString(cfg,
        "{\"futureFlag\":{\"on\":true},\"interface\":{\"notifications\":{\"enabled\":false,"
            + "\"ntfyUrl\":\"https://ntfy.example\"}},\"machineId\":\"m-1\"}");

    ObjectNode doc = loader.load(cfg).document();

    assertTrue(doc.get("futureFlag").get("on").asBoolean());
    assertEquals("https://ntfy.example", doc.get("interface").get("notifications").get("ntfyUrl").asText());
    assertFalse(doc.get("interface").get("notifications").get("enabled").asBoolean());
    assertTrue(doc.get("interface").get("notifications").get("showOnError").asBoolean());
    assertEquals("auto", doc.get("interface").get("colorScheme").asText());
  }

  @Test
  void wrongTypedKnownValueIsPassedThrough() throws Exception {
    Files.writeString(cfg, "{\"serverPort\":\"not-a-port\",\"machineId\":\"m-1\"}");

    ObjectNode doc = loader.load(cfg).document();

    assertEquals("not-a-port", doc.get("serverPort").asText());
  }

  @Test
  void invalidJsonFallsBackToDefaultsAndKeepsACopy() throws Exception {
    Files.writeString(cfg, "{ this is not json");

    LoadResult result = loader.load(cfg);

    assertEquals(LoadResult.Origin.MALFORMED, result.origin());
    assertTrue(result.migrated());
    assertEquals(defaultsWithId("testhost-0123abcd"), result.document());
    Path backup = tempDir.resolve("config.json.corrupt-20260304-050607");
    assertTrue(Files.exists(backup));
    assertEquals("{ this is not json", Files.readString(backup));
  }

  @Test
  void invalidUtf8IsMalformedNotAReadFailure() throws Exception {
    byte[] bytes = {'{', '"', (byte) 0xC3, '(', '"', ':', '1', '}'};
    Files.write(cfg, bytes);

    LoadResult result = loader.load(cfg);

    assertEquals(LoadResult.Origin.MALFORMED, result.origin());
    assertEquals(defaultsWithId("testhost-0123abcd"), result.document());
    Path backup = tempDir.resolve("config.json.corrupt-20260304-050607");
    assertArrayEquals(bytes, Files.readAllBytes(backup));
  }

  @Test
  void trailingTextAfterObjectIsMalformed() throws Exception {
    Files.writeString(cfg, "{\"serverPort\":1234} garbage");

    LoadResult result = loader.load(cfg);

    assertEquals(LoadResult.Origin.MALFORMED, result.origin());
    assertEquals(3001, result.document().get("serverPort").asInt());
    assertTrue(Files.exists(tempDir.resolve("config.json.corrupt-20260304-050607")));
  }

  @Test
  void nonObjectJsonIsTreatedAsMalformed() throws Exception {
    Files.writeString(cfg, "[1, 2, 3]");

    LoadResult result = loader.load(cfg);

    assertEquals(LoadResult.Origin.MALFORMED, result.origin());
    assertEquals(defaultsWithId("testhost-0123abcd"), result.document());
  }

  @Test
  void malformedFileIsNotCopiedWhenBackupDisabled() throws Exception {
    Files.writeString(cfg, "42");
    SettingsFileLoader noBackup = new SettingsFileLoader(machineIds, false);

    LoadResult result = noBackup.load(cfg);

    assertEquals(LoadResult.Origin.MALFORMED, result.origin());
    try (var files = Files.list(tempDir)) {
      assertEquals(1, files.count());
    }
  }

  @Test
  void unreadableFileIsAReadFailure() throws Exception {
    Files.createDirectories(cfg);

    SettingsStoreException e = assertThrows(SettingsStoreException.class, () -> loader.load(cfg));

    assertEquals(SettingsStoreException.ErrorKind.READ_FAILED, e.kind());
  }
}
