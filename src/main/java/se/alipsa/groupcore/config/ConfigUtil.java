package se.alipsa.groupcore.config;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/** Configuration parsing helpers. */
public final class ConfigUtil {

  private ConfigUtil() {
  }

  /**
   * Split window parameters or other settings written as {@code key=value} pairs joined by {@code &}. Keys and
   * values are URL-decoded and trimmed; a pair without {@code =} maps to an empty value and empty keys are skipped.
   *
   * @param query
   *          the pairs, optionally prefixed by {@code ?}
   * @return the decoded pairs, empty when {@code query} is null or blank
   */
  public static Properties parseQuery(String query) {
    Properties props = new Properties();
    if (query == null || query.isBlank()) {
      return props;
    }
    String pairs = query.trim();
    if (pairs.startsWith("?")) {
      pairs = pairs.substring(1);
    }
    for (String pair : pairs.split("&")) {
      int eq = pair.indexOf('=');
      String key = decode(eq < 0 ? pair : pair.substring(0, eq));
      if (key.isEmpty()) {
        continue;
      }
      props.setProperty(key, eq < 0 ? "" : decode(pair.substring(eq + 1)));
    }
    return props;
  }

  private static String decode(String text) {
    return URLDecoder.decode(text, StandardCharsets.UTF_8).trim();
  }

  /**
   * Look up a property that must not be blank when present.
   *
   * @param props
   *          the properties
   * @param key
   *          the property key
   * @return the trimmed value or {@code null} when the key is absent
   * @throws IllegalArgumentException
   *           if the key is present but blank
   */
  public static String optional(Properties props, String key) {
    String value = props.getProperty(key);
    if (value == null) {
      return null;
    }
    if (value.isBlank()) {
      throw new IllegalArgumentException("Configuration value for " + key + " is blank");
    }
    return value.trim();
  }
}
