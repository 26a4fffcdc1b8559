package docbuild.registry.git;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parsed content of one package file in a sparse index: one JSON object per
 * line, one line per published version.
 *
 * <pre>{@code
 * {"name":"serde","vers":"1.0.0","deps":[],"features":{},"yanked":false}
 * }</pre>
 */
final class IndexFile {
  private static final Logger logger = Logger.getLogger(IndexFile.class.getName());

  record Line(String name, String version, boolean yanked, String dependencies) {}

  private final Map<String, Line> versions;

  private IndexFile(Map<String, Line> versions) {
    this.versions = versions;
  }

  static IndexFile empty() {
    return new IndexFile(Map.of());
  }

  static IndexFile parse(ObjectMapper mapper, String path, byte[] content) {
    Map<String, Line> versions = new LinkedHashMap<>();
    String text = new String(content, StandardCharsets.UTF_8);
    int lineNo = 0;
    for (String raw : text.split("\n")) {
      lineNo++;
      if (raw.isBlank()) {
        continue;
      }
      try {
        JsonNode node = mapper.readTree(raw);
        String name = node.path("name").asText(null);
        String version = node.path("vers").asText(null);
        if (name == null || version == null) {
          logger.log(Level.WARNING, "Index line without name or vers in {0}:{1}",
              new Object[]{path, lineNo});
          continue;
        }
        JsonNode deps = node.get("deps");
        versions.put(version, new Line(name, version, node.path("yanked").asBoolean(false),
            deps == null ? null : deps.toString()));
      } catch (JsonProcessingException e) {
        logger.log(Level.WARNING, "Malformed index line in " + path + ":" + lineNo, e);
      }
    }
    return new IndexFile(versions);
  }

  Map<String, Line> versions() {
    return versions;
  }

  Line get(String version) {
    return versions.get(version);
  }

  boolean isEmpty() {
    return versions.isEmpty();
  }
}
