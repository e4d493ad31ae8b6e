package relay.topology;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TopicMatcherTest {

  @Test
  void exactWords() {
    assertTrue(TopicMatcher.matches("report.raw", "report.raw"));
    assertFalse(TopicMatcher.matches("report.raw", "report.tagged"));
  }

  @Test
  void starMatchesExactlyOneWord() {
    assertTrue(TopicMatcher.matches("report.*", "report.raw"));
    assertFalse(TopicMatcher.matches("report.*", "report"));
    assertFalse(TopicMatcher.matches("report.*", "report.raw.v2"));
  }

  @Test
  void hashMatchesZeroOrMoreWords() {
    assertTrue(TopicMatcher.matches("#", "report.raw"));
    assertTrue(TopicMatcher.matches("#", ""));
    assertTrue(TopicMatcher.matches("report.#", "report"));
    assertTrue(TopicMatcher.matches("report.#", "report.raw.v2"));
    assertTrue(TopicMatcher.matches("#.raw", "report.raw"));
    assertFalse(TopicMatcher.matches("report.#", "image.raw"));
  }

  @Test
  void detectsPatterns() {
    assertTrue(TopicMatcher.isPattern("report.*"));
    assertTrue(TopicMatcher.isPattern("#"));
    assertFalse(TopicMatcher.isPattern("report.raw"));
    assertFalse(TopicMatcher.isPattern("report*"));
  }
}
