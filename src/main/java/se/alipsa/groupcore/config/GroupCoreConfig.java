package se.alipsa.groupcore.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.groupcore.lookup.KeyLookup;
import se.alipsa.groupcore.lookup.LookupType;
import se.alipsa.groupcore.window.WindowSpec;

/**
 * Settings for grouping and windowing.
 *
 * <p>
 * {@link #load()} reads {@value #DEFAULT_RESOURCE} from the classpath when present and then applies system
 * properties starting with {@value #PREFIX}, so {@code -Dgroupcore.lookup=random} overrides the file. Recognized
 * keys:
 * </p>
 * <ul>
 * <li>{@value #LOOKUP_KEY}: {@code ordered} (default) or {@code random}</li>
 * <li>{@value #WINDOW_KEY}: a window spec such as {@code every=1h&period=1h&offset=0s}</li>
 * </ul>
 */
public final class GroupCoreConfig {

  private static final Logger log = LoggerFactory.getLogger(GroupCoreConfig.class);

  public static final String DEFAULT_RESOURCE = "groupcore.properties";
  public static final String PREFIX = "groupcore.";
  public static final String LOOKUP_KEY = PREFIX + "lookup";
  public static final String WINDOW_KEY = PREFIX + "window";

  private final LookupType lookupType;
  private final WindowSpec window;

  private GroupCoreConfig(LookupType lookupType, WindowSpec window) {
    this.lookupType = lookupType;
    this.window = window;
  }

  /**
   * Load the configuration from {@value #DEFAULT_RESOURCE} and system properties.
   *
   * @return the configuration
   */
  public static GroupCoreConfig load() {
    return load(DEFAULT_RESOURCE, System.getProperties());
  }

  /**
   * Load the configuration from a classpath resource, overridden by the {@value #PREFIX} entries of
   * {@code overrides}.
   *
   * @param resource
   *          the classpath resource, skipped when it does not exist
   * @param overrides
   *          properties taking precedence over the resource, typically the system properties
   * @return the configuration
   * @throws UncheckedIOException
   *           if the resource exists but cannot be read
   */
  public static GroupCoreConfig load(String resource, Properties overrides) {
    Properties props = new Properties();
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = GroupCoreConfig.class.getClassLoader();
    }
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in != null) {
        props.load(in);
        log.debug("Loaded {} entries from {}", props.size(), resource);
      } else {
        log.debug("No {} on the classpath, using defaults", resource);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
    for (String key : overrides.stringPropertyNames()) {
      if (key.startsWith(PREFIX)) {
        props.setProperty(key, overrides.getProperty(key));
      }
    }
    return fromProperties(props);
  }

  /**
   * Build the configuration from explicit properties.
   *
   * @param props
   *          the properties
   * @return the configuration
   * @throws IllegalArgumentException
   *           if a value is invalid, the message names the offending key
   */
  public static GroupCoreConfig fromProperties(Properties props) {
    LookupType lookupType = LookupType.ORDERED;
    String lookup = ConfigUtil.optional(props, LOOKUP_KEY);
    if (lookup != null) {
      try {
        lookupType = LookupType.fromName(lookup);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Invalid " + LOOKUP_KEY + ": " + e.getMessage(), e);
      }
    }
    WindowSpec window = null;
    String spec = ConfigUtil.optional(props, WINDOW_KEY);
    if (spec != null) {
      try {
        window = WindowSpec.parse(spec);
        window.toWindow();
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Invalid " + WINDOW_KEY + ": " + e.getMessage(), e);
      }
    }
    GroupCoreConfig config = new GroupCoreConfig(lookupType, window);
    log.debug("Using {}", config);
    return config;
  }

  public LookupType lookupType() {
    return lookupType;
  }

  /**
   * @return the configured window spec, empty if none is configured
   */
  public Optional<WindowSpec> window() {
    return Optional.ofNullable(window);
  }

  /**
   * @param <V>
   *          the value type
   * @return a new lookup of the configured type
   */
  public <V> KeyLookup<V> newLookup() {
    return lookupType.newLookup();
  }

  @Override
  public String toString() {
    return "GroupCoreConfig[lookup=" + lookupType + ", window=" + (window == null ? "none" : window) + "]";
  }
}
