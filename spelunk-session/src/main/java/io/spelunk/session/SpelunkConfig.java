package io.spelunk.session;

import io.spelunk.path.AddressStyle;
import io.spelunk.path.ParseOptions;
import io.spelunk.path.StablePathBuilder;
import io.spelunk.syntax.api.NodeKinds;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Engine configuration. Loads from {@code ~/.spelunk/spelunk.properties} by default; {@code
 * spelunk.*} system properties override file values.
 *
 * @param markerCapacity maximum number of active markers per session
 * @param statementCapacity maximum number of registered statements per session
 * @param strictAttributes reject unknown attribute names when parsing paths
 * @param addressStyle rendering of declaration segments in stable paths
 */
public record SpelunkConfig(
    int markerCapacity,
    int statementCapacity,
    boolean strictAttributes,
    AddressStyle addressStyle) {

  public static final String MARKER_CAPACITY = "spelunk.markers.capacity";
  public static final String STATEMENT_CAPACITY = "spelunk.statements.capacity";
  public static final String STRICT = "spelunk.path.strict";
  public static final String ADDRESS_STYLE = "spelunk.path.addressStyle";

  public SpelunkConfig {
    if (markerCapacity <= 0) {
      throw new IllegalArgumentException(MARKER_CAPACITY + " must be positive: " + markerCapacity);
    }
    if (statementCapacity <= 0) {
      throw new IllegalArgumentException(
          STATEMENT_CAPACITY + " must be positive: " + statementCapacity);
    }
    if (addressStyle == null) {
      addressStyle = AddressStyle.COMPACT;
    }
  }

  /**
   * Creates the default configuration.
   *
   * @return default configuration
   */
  public static SpelunkConfig defaults() {
    return new SpelunkConfig(
        MarkerStore.DEFAULT_CAPACITY,
        StatementRegistry.DEFAULT_CAPACITY,
        false, // fail-open attribute handling
        AddressStyle.COMPACT);
  }

  /**
   * Loads configuration from {@code ~/.spelunk/spelunk.properties} and system properties.
   *
   * @return loaded configuration, or defaults if neither source sets anything
   * @throws IOException if the file exists but cannot be read
   */
  public static SpelunkConfig load() throws IOException {
    return load(getConfigPath(), System.getProperties());
  }

  static SpelunkConfig load(Path configPath, Properties overrides) throws IOException {
    Properties props = new Properties();
    if (Files.exists(configPath)) {
      try (var reader = Files.newBufferedReader(configPath)) {
        props.load(reader);
      }
    }
    for (String key : overrides.stringPropertyNames()) {
      if (key.startsWith("spelunk.")) {
        props.setProperty(key, overrides.getProperty(key));
      }
    }
    return fromProperties(props);
  }

  private static Path getConfigPath() {
    String home = System.getProperty("user.home");
    return Path.of(home, ".spelunk", "spelunk.properties");
  }

  /**
   * Converts properties to a configuration; missing keys take their defaults.
   *
   * @throws IllegalArgumentException naming the offending key if a value is invalid
   */
  public static SpelunkConfig fromProperties(Properties props) {
    int markerCapacity = intValue(props, MARKER_CAPACITY, MarkerStore.DEFAULT_CAPACITY);
    int statementCapacity = intValue(props, STATEMENT_CAPACITY, StatementRegistry.DEFAULT_CAPACITY);
    boolean strict = booleanValue(props, STRICT);
    AddressStyle style;
    String styleName = props.getProperty(ADDRESS_STYLE, AddressStyle.COMPACT.name()).trim();
    try {
      style = AddressStyle.valueOf(styleName.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid " + ADDRESS_STYLE + ": " + styleName, e);
    }
    return new SpelunkConfig(markerCapacity, statementCapacity, strict, style);
  }

  /** Parser options implied by this configuration. */
  public ParseOptions parseOptions() {
    return strictAttributes ? ParseOptions.strict() : ParseOptions.lenient();
  }

  /** Stable path builder implied by this configuration. */
  public StablePathBuilder pathBuilder() {
    return new StablePathBuilder(NodeKinds.standard(), addressStyle);
  }

  private static int intValue(Properties props, String key, int defaultValue) {
    String value = props.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + key + ": " + value, e);
    }
  }

  private static boolean booleanValue(Properties props, String key) {
    String value = props.getProperty(key);
    if (value == null) {
      return false;
    }
    String v = value.trim().toLowerCase(Locale.ROOT);
    if (!v.equals("true") && !v.equals("false")) {
      throw new IllegalArgumentException("Invalid " + key + ": " + value);
    }
    return Boolean.parseBoolean(v);
  }
}
