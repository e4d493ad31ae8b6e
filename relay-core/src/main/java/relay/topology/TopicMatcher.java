package relay.topology;

/**
 * Topic-exchange pattern matching: words are separated by {@code .}, {@code *} matches
 * exactly one word and {@code #} matches zero or more words.
 */
public final class TopicMatcher {

  private TopicMatcher() {}

  public static boolean matches(String pattern, String routingKey) {
    return match(pattern.split("\\.", -1), 0, routingKey.split("\\.", -1), 0);
  }

  public static boolean isPattern(String key) {
    for (String word : key.split("\\.", -1)) {
      if (word.equals("*") || word.equals("#")) {
        return true;
      }
    }
    return false;
  }

  private static boolean match(String[] pattern, int p, String[] words, int w) {
    if (p == pattern.length) {
      return w == words.length;
    }
    String token = pattern[p];
    if (token.equals("#")) {
      for (int skip = w; skip <= words.length; skip++) {
        if (match(pattern, p + 1, words, skip)) {
          return true;
        }
      }
      return false;
    }
    if (w == words.length) {
      return false;
    }
    if (token.equals("*") || token.equals(words[w])) {
      return match(pattern, p + 1, words, w + 1);
    }
    return false;
  }
}
