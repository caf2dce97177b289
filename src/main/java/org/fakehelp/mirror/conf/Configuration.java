/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.conf;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Initialize configuration with defaults from fakehelp.properties,
 * unless a configuration properties file is available.
 */
public class Configuration {

  public static final String FIELDSEP = ",";

  public static final String CONF_FILE = "fakehelp.properties";

  private final Properties props = new Properties();

  /**
   * Load the defaults shipped with the jar and then the configuration from
   * the given path, which overrides any default.
   */
  public void loadAndCheckConfiguration(Path confPath) throws
      ConfigurationException {
    try (InputStream defaults = Configuration.class.getClassLoader()
             .getResourceAsStream(CONF_FILE)) {
      if (null != defaults) {
        this.props.load(defaults);
      }
    } catch (IOException e) {
      throw new ConfigurationException("Cannot load default configuration. "
          + "Reason: " + e.getMessage(), e);
    }
    try (FileInputStream fis
             = new FileInputStream(confPath.toFile())) {
      this.props.load(fis);
      requiredSettingsPresent();
    } catch (IOException e) {
      throw new ConfigurationException("Cannot load configuration file. "
          + "Reason: " + e.getMessage(), e);
    }
  }

  private void requiredSettingsPresent() throws ConfigurationException {
    this.getPath(Key.DataPath);
    this.getUrl(Key.UpstreamUrl);
    if (this.getInt(Key.UpdateIntervalMinutes) < 1) {
      throw new ConfigurationException("UpdateIntervalMinutes must be at "
          + "least 1.\nPlease edit " + CONF_FILE + ". Exiting.");
    }
    if (this.getInt(Key.ConcurrentPlayers) < 1
        || this.getInt(Key.ConcurrentGuilds) < 1) {
      throw new ConfigurationException("Concurrency limits must be at "
          + "least 1.\nPlease edit " + CONF_FILE + ". Exiting.");
    }
  }

  /**
   * Loads properties from the given stream.
   */
  public void load(InputStream fis) throws IOException {
    props.load(fis);
  }

  /** Retrieves the value for key. */
  public String getProperty(String key) {
    return props.getProperty(key);
  }

  /** Sets the value for key. */
  public void setProperty(String key, String value) {
    props.setProperty(key, value);
  }

  /** clears all properties. */
  public void clear() {
    props.clear();
  }

  /**
   * Returns a trimmed {@code String} property, or the empty string if the
   * property is not set.
   */
  public String getString(Key key) throws ConfigurationException {
    try {
      checkClass(key, String.class);
      return props.getProperty(key.name(), "").trim();
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Returns {@code String[]} from a property. Commas seperate array elements,
   * e.g.,
   * {@code propertyname = a1, a2, a3}
   */
  public String[] getStringArray(Key key) throws ConfigurationException {
    try {
      checkClass(key, String[].class);
      String[] res = props.getProperty(key.name()).split(FIELDSEP);
      for (int i = 0; i < res.length; i++) {
        res[i] = res[i].trim();
      }
      return res;
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  private void checkClass(Key key, Class clazz) {
    if (!key.keyClass().getSimpleName().equals(clazz.getSimpleName())) {
      throw new RuntimeException("Wrong type wanted! My class is "
          + key.keyClass().getSimpleName());
    }
  }

  /**
   * Returns a {@code boolean} property (case insensitiv), e.g.
   * {@code propertyOne = True}.
   */
  public boolean getBool(Key key) throws ConfigurationException {
    try {
      checkClass(key, Boolean.class);
      return Boolean.parseBoolean(props.getProperty(key.name()));
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Parse an integer property and translate the String
   * {@code "inf"} into Integer.MAX_VALUE.
   * Verifies that this enum is a Key for an integer value.
   */
  public int getInt(Key key) throws ConfigurationException {
    try {
      checkClass(key, Integer.class);
      String prop = props.getProperty(key.name());
      if ("inf".equals(prop)) {
        return Integer.MAX_VALUE;
      } else {
        return Integer.parseInt(prop.trim());
      }
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Parse a long property.
   * Verifies that this enum is a Key for a Long value.
   */
  public long getLong(Key key) throws ConfigurationException {
    try {
      checkClass(key, Long.class);
      String prop = props.getProperty(key.name());
      return Long.parseLong(prop.trim());
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Returns a {@code Path} property, e.g.
   * {@code pathProperty = /my/path/file}.
   */
  public Path getPath(Key key) throws ConfigurationException {
    try {
      checkClass(key, Path.class);
      return Paths.get(props.getProperty(key.name()).trim());
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Returns a {@code URL} property, e.g.
   * {@code urlProperty = https://my.url.here}.
   */
  public URL getUrl(Key key) throws ConfigurationException {
    try {
      checkClass(key, URL.class);
      return new URL(props.getProperty(key.name()).trim());
    } catch (MalformedURLException | RuntimeException mue) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + mue.getMessage(), mue);
    }
  }

}
