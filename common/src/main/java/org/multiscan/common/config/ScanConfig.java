/*
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
package org.multiscan.common.config;

import java.io.IOException;
import java.net.URL;
import java.util.Enumeration;
import java.util.Map.Entry;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import org.multiscan.common.exceptions.ScanRuntimeException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;
import com.typesafe.config.ConfigValueFactory;

/**
 * Scan configuration, a thin wrapper over a resolved Typesafe {@link Config}.
 */
public class ScanConfig {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ScanConfig.class);

  private final Config config;

  @VisibleForTesting
  public ScanConfig(Config config) {
    this.config = config;
    logger.trace("Given Config object is:\n{}", config.root().render(ConfigRenderOptions.concise()));
  }

  /**
   * Creates a configuration using the default file names.
   *
   * @return the new ScanConfig object
   */
  public static ScanConfig create() {
    return create(null, null);
  }

  /**
   * <b><u>Do not use this method outside of test code.</u></b>
   */
  @VisibleForTesting
  public static ScanConfig create(Properties testConfigurations) {
    return create(null, testConfigurations);
  }

  /**
   * Creates a configuration from an already assembled config.
   */
  public static ScanConfig create(Config config) {
    return new ScanConfig(config.resolve());
  }

  /**
   * Loads the configuration. Values are retrieved in the following order of
   * precedence:
   * <ul>
   * <li>the given properties, if any</li>
   * <li>a single copy of "{@code multiscan-override.conf}", or of the given
   *     override file, along with JVM system properties</li>
   * <li>all copies of "{@code multiscan-module.conf}". Loading order is
   *     indeterminate.</li>
   * <li>a single copy of "{@code multiscan-default.conf}"</li>
   * </ul>
   *
   * @param overrideFileResourcePathname classpath resource of the override
   *        file, {@code null} for {@link CommonConstants#CONFIG_OVERRIDE_RESOURCE_PATHNAME}
   * @param overriderProps optional properties applied last
   * @return a merged configuration
   */
  public static ScanConfig create(String overrideFileResourcePathname, Properties overriderProps) {
    final StringBuilder logString = new StringBuilder();
    final Stopwatch watch = Stopwatch.createStarted();
    overrideFileResourcePathname =
        overrideFileResourcePathname == null
            ? CommonConstants.CONFIG_OVERRIDE_RESOURCE_PATHNAME
            : overrideFileResourcePathname;

    final ClassLoader classLoader = Thread.currentThread().getContextClassLoader();

    // 1. Load defaults configuration file.
    final URL defaultUrl = classLoader.getResource(CommonConstants.CONFIG_DEFAULT_RESOURCE_PATHNAME);
    if (defaultUrl == null) {
      throw new ScanRuntimeException(String.format("Configuration file %s was not found on the classpath",
          CommonConstants.CONFIG_DEFAULT_RESOURCE_PATHNAME));
    }
    logString.append("Base Configuration:\n\t- ").append(defaultUrl).append("\n");
    Config fallback = ConfigFactory.parseURL(defaultUrl);

    // 2. Load per-module configuration files.
    logString.append("\nIntermediate Configuration files, in order of precedence:\n");
    try {
      final Enumeration<URL> urls = classLoader.getResources(CommonConstants.CONFIG_MODULE_RESOURCE_PATHNAME);
      while (urls.hasMoreElements()) {
        final URL url = urls.nextElement();
        logString.append("\t- ").append(url).append("\n");
        fallback = ConfigFactory.parseURL(url).withFallback(fallback);
      }
    } catch (IOException e) {
      throw new ScanRuntimeException("Failure while scanning the classpath for "
          + CommonConstants.CONFIG_MODULE_RESOURCE_PATHNAME, e);
    }
    logString.append("\n");

    // 3. Load the overrides file along with JVM system properties.
    final URL overrideFileUrl = classLoader.getResource(overrideFileResourcePathname);
    if (overrideFileUrl != null) {
      logString.append("Override File: ").append(overrideFileUrl).append("\n");
    }
    Config effectiveConfig = ConfigFactory.load(overrideFileResourcePathname).withFallback(fallback);

    // 4. Apply any overriding properties.
    if (overriderProps != null) {
      logString.append("Overridden Properties:\n");
      for (Entry<Object, Object> entry : overriderProps.entrySet()) {
        logString.append("\t-").append(entry.getKey()).append(" = ").append(entry.getValue()).append("\n");
      }
      logString.append("\n");
      effectiveConfig = ConfigFactory.parseProperties(overriderProps).withFallback(effectiveConfig);
    }

    logger.debug("Configuration file(s) identified in {}ms.\n{}",
        watch.elapsed(TimeUnit.MILLISECONDS), logString);
    return new ScanConfig(effectiveConfig.resolve());
  }

  public boolean hasPath(String path) {
    return config.hasPath(path);
  }

  public boolean getBoolean(String path) {
    return config.getBoolean(path);
  }

  public int getInt(String path) {
    return config.getInt(path);
  }

  public long getLong(String path) {
    return config.getLong(path);
  }

  public String getString(String path) {
    return config.getString(path);
  }

  /**
   * Returns a copy of this configuration with a single value replaced.
   */
  public ScanConfig withValue(String path, Object value) {
    return new ScanConfig(config.withValue(path, ConfigValueFactory.fromAnyRef(value)));
  }

  @Override
  public String toString() {
    return config.root().render();
  }
}
