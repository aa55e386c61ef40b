/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tessera.common.config;

import java.net.URL;
import java.util.Map.Entry;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import org.tessera.common.exceptions.UserException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;
import com.typesafe.config.ConfigValueFactory;

/**
 * Engine configuration backed by a Typesafe {@link Config}.
 */
public class TesseraConfig {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TesseraConfig.class);

  private final Config config;

  @VisibleForTesting
  public TesseraConfig(Config config) {
    this.config = config;
    logger.debug("Setting up TesseraConfig object.");
    logger.trace("Given Config object is:\n{}", config.root().render(ConfigRenderOptions.concise()));
  }

  /**
   * Creates a TesseraConfig object using the default config file name.
   * @return The new TesseraConfig object.
   */
  public static TesseraConfig create() {
    return create(null, null);
  }

  /**
   * <b><u>Do not use this method outside of test code.</u></b>
   */
  @VisibleForTesting
  public static TesseraConfig create(Properties testConfigurations) {
    return create(null, testConfigurations);
  }

  /**
   * Creates a configuration from the provided config object, resolving substitutions.
   */
  public static TesseraConfig create(Config config) {
    return new TesseraConfig(config.resolve());
  }

  /**
   * Loads the configuration. The order of precedence, highest first, is:
   * <ul>
   * <li>the overriding properties, if any</li>
   * <li>JVM system properties (e.g., {@code -Dname=value})</li>
   * <li>a single copy of "{@code tessera-override.conf}", or the resource named by
   *     {@code overrideFileResourcePathname}</li>
   * <li>a single copy of "{@code tessera-default.conf}"</li>
   * </ul>
   *
   * @param overrideFileResourcePathname the classpath resource to use for overrides; {@code null} selects
   *          {@link CommonConstants#CONFIG_OVERRIDE}
   * @param overriderProps optional property map applied on top of everything else
   */
  public static TesseraConfig create(String overrideFileResourcePathname, Properties overriderProps) {
    final StringBuilder logString = new StringBuilder();
    final Stopwatch watch = Stopwatch.createStarted();
    overrideFileResourcePathname =
        overrideFileResourcePathname == null
            ? CommonConstants.CONFIG_OVERRIDE
            : overrideFileResourcePathname;

    final ClassLoader classLoader = Thread.currentThread().getContextClassLoader();

    // 1. Load defaults configuration file.
    final URL defaultUrl = classLoader.getResource(CommonConstants.CONFIG_DEFAULT);
    if (defaultUrl != null) {
      logString.append("Base Configuration:\n\t- ").append(defaultUrl).append("\n");
    }
    Config fallback = ConfigFactory.parseResources(classLoader, CommonConstants.CONFIG_DEFAULT);

    // 2. Load the overrides file along with any JVM system properties.
    final URL overrideFileUrl = classLoader.getResource(overrideFileResourcePathname);
    if (overrideFileUrl != null) {
      logString.append("Override File: ").append(overrideFileUrl).append("\n");
    }
    Config effectiveConfig = ConfigFactory.systemProperties()
        .withFallback(ConfigFactory.parseResources(classLoader, overrideFileResourcePathname))
        .withFallback(fallback);

    // 3. Apply any overriding properties.
    if (overriderProps != null) {
      logString.append("Overridden Properties:\n");
      for (Entry<Object, Object> entry : overriderProps.entrySet()) {
        logString.append("\t-").append(entry.getKey()).append(" = ").append(entry.getValue()).append("\n");
      }
      effectiveConfig = ConfigFactory.parseProperties(overriderProps).withFallback(effectiveConfig);
    }

    logger.debug("Configuration file(s) identified in {}ms.\n{}",
        watch.elapsed(TimeUnit.MILLISECONDS),
        logString);
    return new TesseraConfig(effectiveConfig.resolve());
  }

  public boolean hasPath(String path) {
    return config.hasPath(path);
  }

  public String getString(String path) {
    try {
      return config.getString(path);
    } catch (ConfigException e) {
      throw UserException.systemError(e)
          .message("Failure while reading configuration value at path %s.", path)
          .build(logger);
    }
  }

  /**
   * @return the value at {@code path}, or {@code defaultValue} when the path is absent or empty
   */
  public String getString(String path, String defaultValue) {
    if (!config.hasPath(path)) {
      return defaultValue;
    }
    String value = getString(path);
    return value.isEmpty() ? defaultValue : value;
  }

  public boolean getBoolean(String path) {
    try {
      return config.getBoolean(path);
    } catch (ConfigException e) {
      throw UserException.systemError(e)
          .message("Failure while reading configuration value at path %s.", path)
          .build(logger);
    }
  }

  /**
   * Returns a copy of this configuration with {@code path} set to {@code value}.
   */
  public TesseraConfig withValue(String path, Object value) {
    return new TesseraConfig(config.withValue(path, ConfigValueFactory.fromAnyRef(value)));
  }

  public Config getConfig() {
    return config;
  }

  @Override
  public String toString() {
    return config.root().render();
  }
}
