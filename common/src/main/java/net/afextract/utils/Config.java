// This file is part of AFExtract.
// Copyright (C) 2026  The AFExtract Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.afextract.utils;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * AFExtract Configuration Class
 *
 * This handles all of the user configurable variables for the engine. On
 * initialization default values are configured for all variables. Then
 * callers may use the {@link #Config(boolean)} ctor to search for a default
 * configuration file or {@link #Config(String)} to load one provided by the
 * user.
 *
 * To add a configuration, simply set a default value in {@link #setDefaults()}.
 * Wherever you need to access the config value, use the proper helper to fetch
 * the value, accounting for exceptions that may be thrown if necessary.
 *
 * The get<type> number helpers will return NumberFormatExceptions if the
 * requested property is null or unparseable. The {@link #getString(String)}
 * helper will return null if the property isn't found.
 *
 * @since 1.0
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  /** The display time zone for every timestamp handed to callers. */
  public static final String TIMEZONE_KEY = "afx.display.timezone";

  /** Default depth when loading descendants of root nodes. */
  public static final String HIERARCHY_DEPTH_KEY = "afx.hierarchy.depth";

  /** Max nodes returned by a single descendant fetch. */
  public static final String HIERARCHY_MAX_NODES_KEY = "afx.hierarchy.max_nodes";

  /** Either "level" or "template". */
  public static final String CONDENSE_SUFFIX_KEY = "afx.condense.suffix";

  /** Rows spanning longer than this duration trigger a warning. */
  public static final String WARN_DURATION_KEY = "afx.extract.warn.duration";

  /** Scopes with more rows than this trigger a warning. */
  public static final String WARN_ROWS_KEY = "afx.extract.warn.rows";

  /** Default paging hint type. */
  public static final String PAGING_TYPE_KEY = "afx.paging.type";

  /** Default paging hint size. */
  public static final String PAGING_SIZE_KEY = "afx.paging.size";

  /** Default rows or tags per chunk. */
  public static final String CHUNK_SIZE_KEY = "afx.runner.chunk_size";

  /** Number of worker threads. */
  public static final String MAX_WORKERS_KEY = "afx.runner.max_workers";

  /** Bound on the worker queue. */
  public static final String QUEUE_MAX_SIZE_KEY = "afx.runner.queue.max_size";

  /** Milliseconds to wait for a chunked run, 0 to wait forever. */
  public static final String TIMEOUT_KEY = "afx.runner.timeout";

  /** The list of properties configured to their defaults or modified by users */
  protected final HashMap<String, String> properties =
      new HashMap<String, String>();

  /** Holds default values for the config */
  protected static final HashMap<String, String> default_map =
      new HashMap<String, String>();

  /** Tracks the location of the file that was actually loaded */
  protected String config_location;

  /**
   * Constructor that initializes default configuration values. May attempt to
   * search for a config file if configured.
   * @param auto_load_config When set to true, attempts to search for a config
   *          file in the default locations
   * @throws IOException Thrown if unable to read or parse one of the default
   *           config files
   */
  public Config(final boolean auto_load_config) throws IOException {
    if (auto_load_config) {
      loadConfig();
    }
    setDefaults();
  }

  /**
   * Constructor that initializes default values and attempts to load the given
   * properties file
   * @param file Path to the file to load
   * @throws IOException Thrown if unable to read or parse the file
   */
  public Config(final String file) throws IOException {
    loadConfig(file);
    setDefaults();
  }

  /**
   * Constructor for plugins or overloaders who want a copy of the parent
   * properties but without the ability to modify them
   * @param parent Parent configuration object to load from
   */
  public Config(final Config parent) {
    // fill in defaults
    setDefaults();

    // copy parent properties
    properties.putAll(parent.properties);
    config_location = parent.config_location;
  }

  /**
   * Constructor with only the default values.
   */
  public Config() {
    setDefaults();
  }

  /** @return the location of the loaded config file or null if none. */
  public String configLocation() {
    return config_location;
  }

  /**
   * Allows for modifying properties after creation or loading.
   *
   * WARNING: This should only be used on initialization and is meant for
   * command line overrides and tests.
   *
   * @param property The name of the property to override
   * @param value The value to store
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * Returns the given property as a String
   * @param property The property to load
   * @return The property value as a string, null if not set
   */
  public final String getString(final String property) {
    return properties.get(property);
  }

  /**
   * Returns the given property as an integer
   * @param property The property to load
   * @return A parsed integer or an exception if the value could not be parsed
   * @throws NumberFormatException if the property could not be parsed
   */
  public final int getInt(final String property) {
    return Integer.parseInt(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as a long
   * @param property The property to load
   * @return A parsed long or an exception if the value could not be parsed
   * @throws NumberFormatException if the property could not be parsed
   */
  public final long getLong(final String property) {
    return Long.parseLong(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as a double
   * @param property The property to load
   * @return A parsed double or an exception if the value could not be parsed
   * @throws NumberFormatException if the property could not be parsed
   */
  public final double getDouble(final String property) {
    return Double.parseDouble(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as a boolean
   *
   * Property values are case insensitive and the following values will result
   * in a True return value: - 1 - True - Yes
   *
   * Any other values, including an empty string, will result in a False
   *
   * @param property The property to load
   * @return A parsed boolean
   */
  public final boolean getBoolean(final String property) {
    final String val = Strings.nullToEmpty(properties.get(property))
        .trim().toUpperCase();
    if (val.equals("1"))
      return true;
    if (val.equals("TRUE"))
      return true;
    if (val.equals("YES"))
      return true;
    return false;
  }

  /**
   * Returns the configured display time zone.
   * @return A valid zone.
   * @throws IllegalArgumentException if the configured zone is unknown.
   */
  public final ZoneId getTimeZone() {
    return DateTime.zone(properties.get(TIMEZONE_KEY));
  }

  /**
   * Determines if the given propery is in the map
   * @param property The property to search for
   * @return True if the property exists and has a value, not an empty string
   */
  public final boolean hasProperty(final String property) {
    final String val = properties.get(property);
    if (val == null)
      return false;
    if (val.isEmpty())
      return false;
    return true;
  }

  /**
   * Returns a simple string with the configured properties for debugging
   * @return A string with information about the config
   */
  public final String dumpConfiguration() {
    if (properties.isEmpty())
      return "No configuration settings stored";

    StringBuilder response = new StringBuilder("AFExtract Configuration:\n");
    response.append("File [" + config_location + "]\n");
    int line = 0;
    for (Map.Entry<String, String> entry : properties.entrySet()) {
      if (line > 0) {
        response.append("\n");
      }
      response.append("Key [" + entry.getKey() + "]  Value [");
      if (entry.getKey().toUpperCase().contains("PASS")) {
         response.append("********");
      } else {
        response.append(entry.getValue());
      }
      response.append("]");
      line++;
    }
    return response.toString();
  }

  /**
   * Returns an immutable copy of the configuration map
   * @return A copy of the properties.
   */
  public final Map<String, String> getMap() {
    return ImmutableMap.copyOf(properties);
  }

  /**
   * Loads default entries that were not provided by a file or command line
   *
   * This should be called in the constructor
   */
  protected void setDefaults() {
    default_map.put(TIMEZONE_KEY, ZoneId.systemDefault().getId());
    default_map.put(HIERARCHY_DEPTH_KEY, "10");
    default_map.put(HIERARCHY_MAX_NODES_KEY, "1000000");
    default_map.put(CONDENSE_SUFFIX_KEY, "level");
    default_map.put(WARN_DURATION_KEY, "60d");
    default_map.put(WARN_ROWS_KEY, "50");
    default_map.put(PAGING_TYPE_KEY, "EVENT_COUNT");
    default_map.put(PAGING_SIZE_KEY, "1000");
    default_map.put(CHUNK_SIZE_KEY, "1000");
    default_map.put(MAX_WORKERS_KEY, "8");
    default_map.put(QUEUE_MAX_SIZE_KEY, "100000");
    default_map.put(TIMEOUT_KEY, "0");

    for (Map.Entry<String, String> entry : default_map.entrySet()) {
      if (!properties.containsKey(entry.getKey()))
        properties.put(entry.getKey(), entry.getValue());
    }
  }

  /**
   * Searches a list of locations for an afextract.conf file
   *
   * The config file must be a standard JAVA properties formatted file. If none
   * of the locations have a config file, then the defaults or command line
   * arguments will be used for the configuration
   *
   * Defaults for Linux based systems are: ./afextract.conf
   * /etc/afextract.conf /etc/afextract/afextract.conf
   * /opt/afextract/afextract.conf
   *
   * @throws IOException Thrown if there was an issue reading a file
   */
  protected void loadConfig() throws IOException {
    if (config_location != null && !config_location.isEmpty()) {
      loadConfig(config_location);
      return;
    }

    for (final String file : searchLocations()) {
      try {
        loadConfig(file);
      } catch (FileNotFoundException e) {
        // don't do anything, the file may be missing and that's fine
        LOG.debug("No configuration found at: " + file);
        continue;
      }
      return;
    }

    LOG.info("No configuration found, will use defaults");
  }

  /** @return The files to try in order when searching for a config. */
  protected List<String> searchLocations() {
    final List<String> file_locations = new ArrayList<String>();
    // search locally first
    file_locations.add("afextract.conf");
    file_locations.add("/etc/afextract.conf");
    file_locations.add("/etc/afextract/afextract.conf");
    file_locations.add("/opt/afextract/afextract.conf");
    return file_locations;
  }

  /**
   * Attempts to load the configuration from the given location
   * @param file Path to the file to load
   * @throws IOException Thrown if there was an issue reading the file
   * @throws FileNotFoundException Thrown if the config file was not found
   */
  protected void loadConfig(final String file) throws FileNotFoundException,
      IOException {
    final FileInputStream file_stream = new FileInputStream(file);
    try {
      final Properties props = new Properties();
      props.load(file_stream);

      // load the hash map
      loadHashMap(props);

      // no exceptions thrown, so save the valid path and exit
      LOG.info("Successfully loaded configuration file: " + file);
      config_location = file;
    } finally {
      file_stream.close();
    }
  }

  /**
   * Called from {@link #loadConfig} to copy the properties into the hash map.
   * @param props The loaded Properties object to copy
   */
  private void loadHashMap(final Properties props) {
    properties.clear();

    @SuppressWarnings("rawtypes")
    Enumeration e = props.propertyNames();
    while (e.hasMoreElements()) {
      String key = (String) e.nextElement();
      properties.put(key, props.getProperty(key));
    }
  }

  /**
   * Strips whitespace from a numeric property before parsing.
   * @param string The value to clean up.
   * @return The trimmed value.
   * @throws NumberFormatException if the value is null.
   */
  private final String sanitize(final String string) {
    if (string == null) {
      throw new NumberFormatException("Property value was null");
    }
    return string.trim();
  }
}
