package docbuild.priority;

import docbuild.model.PriorityRule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PriorityResolverTest {

  @Test
  void newReleaseAlwaysGetsTopPriority() {
    PriorityResolver resolver = new PriorityResolver(List.of(new PriorityRule(1, "%", 20)));

    assertEquals(Priorities.NEW_RELEASE, resolver.resolve("anything", true));
  }

  @Test
  void firstMatchingRuleWins() {
    PriorityResolver resolver = new PriorityResolver(List.of(
        new PriorityRule(1, "aws-sdk-%", 15),
        new PriorityRule(2, "aws-%", 8)));

    assertEquals(15, resolver.resolve("aws-sdk-s3", false));
    assertEquals(8, resolver.resolve("aws-config", false));
  }

  @Test
  void unmatchedNameFallsBackToBaseline() {
    PriorityResolver resolver = new PriorityResolver(List.of(new PriorityRule(1, "aws-%", 15)));

    assertEquals(Priorities.DEFAULT, resolver.resolve("serde", false));
    assertEquals(7, new PriorityResolver(List.of(), 7).resolve("serde", false));
  }

  @Test
  void ruleForIgnoresNovelty() {
    PriorityResolver resolver = new PriorityResolver(List.of(new PriorityRule(1, "tokio%", 3)));

    assertEquals(3, resolver.ruleFor("tokio-util"));
  }

  @Test
  void resolverIsSnapshotOfRules() {
    List<PriorityRule> rules = new java.util.ArrayList<>();
    rules.add(new PriorityRule(1, "a%", 9));
    PriorityResolver resolver = new PriorityResolver(rules);

    rules.clear();

    assertEquals(9, resolver.resolve("abc", false));
  }

  @Test
  void emptyPatternIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new PriorityRule(1, "", 5));
  }
}
