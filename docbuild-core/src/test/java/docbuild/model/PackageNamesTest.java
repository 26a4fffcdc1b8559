package docbuild.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PackageNamesTest {

  @Test
  void normalizesCaseAndSeparators() {
    assertEquals("serde-json", PackageNames.normalize("Serde_JSON"));
    assertTrue(PackageNames.sameName("foo_bar", "FOO-bar"));
    assertFalse(PackageNames.sameName("foobar", "foo-bar"));
  }

  @Test
  void rejectsBlankNames() {
    assertThrows(IllegalArgumentException.class, () -> PackageNames.normalize("  "));
    assertThrows(NullPointerException.class, () -> PackageNames.normalize(null));
  }

  @Test
  void buildStatusCodesRoundTrip() {
    for (BuildStatus status : BuildStatus.values()) {
      assertSame(status, BuildStatus.fromCode(status.code()));
    }
    assertThrows(IllegalArgumentException.class, () -> BuildStatus.fromCode("queued"));
  }
}
