/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.tensorform.config;

import com.google.common.base.MoreObjects;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.IntPredicate;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * A system property that is used to configure various aspects of the
 * expression engine.
 *
 * <p>Properties must always be in the "tensorform" root namespace. Values are
 * read once, when this class is initialized, from the system properties merged
 * over the optional class path resource {@code tensorform.properties}; system
 * properties win.</p>
 *
 * @param <T> the type of the property value
 */
public final class TensorSystemProperty<T> {
  /**
   * Holds all system properties related to the engine.
   */
  private static final Properties PROPERTIES = loadProperties();

  /**
   * Whether to run in debug mode.
   *
   * <p>In debug mode every legality violation is logged at ERROR level as
   * soon as its exception is created.</p>
   */
  public static final TensorSystemProperty<Boolean> DEBUG =
      booleanProperty("tensorform.debug", false);

  /**
   * Number of spatial directions, which is the dimension of a free index
   * introduced by a spatial derivative. Must be between 1 and 3; used by
   * {@link org.apache.tensorform.expr.ExprBuilder} instances that are not
   * given a dimension explicitly.
   */
  public static final TensorSystemProperty<Integer> SPATIAL_DIMENSION =
      intProperty("tensorform.spatial.dimension", 3, v -> v >= 1 && v <= 3);

  /**
   * Whether multiplying or indexing a zero tensor short-circuits to a zero of
   * the right shape, rather than building the full expression.
   */
  public static final TensorSystemProperty<Boolean> ENABLE_ZERO_SHORTCUT =
      booleanProperty("tensorform.enable.zero.shortcut", true);

  private static TensorSystemProperty<Boolean> booleanProperty(String key,
      boolean defaultValue) {
    // Note that "" -> true (convenient for command-lines flags like '-Dflag')
    return new TensorSystemProperty<>(key,
        v -> v == null ? defaultValue
            : "".equals(v) || Boolean.parseBoolean(v));
  }

  /**
   * Returns the value of the system property with the specified name as
   * {@code int}. If any of the conditions below hold, returns the
   * <code>defaultValue</code>:
   *
   * <ol>
   * <li>the property is not defined;
   * <li>the property value cannot be transformed to an int;
   * <li>the property value does not satisfy the checker.
   * </ol>
   */
  private static TensorSystemProperty<Integer> intProperty(String key,
      int defaultValue, IntPredicate valueChecker) {
    return new TensorSystemProperty<>(key, v -> {
      if (v == null) {
        return defaultValue;
      }
      try {
        int intVal = Integer.parseInt(v.trim());
        return valueChecker.test(intVal) ? intVal : defaultValue;
      } catch (NumberFormatException nfe) {
        return defaultValue;
      }
    });
  }

  private static Properties loadProperties() {
    Properties fileProperties = new Properties();
    ClassLoader classLoader = MoreObjects.firstNonNull(
        Thread.currentThread().getContextClassLoader(),
        TensorSystemProperty.class.getClassLoader());
    // Read properties from the file "tensorform.properties", if it exists in
    // the class path
    try (InputStream stream = requireNonNull(classLoader, "classLoader")
        .getResourceAsStream("tensorform.properties")) {
      if (stream != null) {
        fileProperties.load(stream);
      }
    } catch (IOException e) {
      throw new RuntimeException("while reading from tensorform.properties file", e);
    }

    final Properties allProperties = new Properties();
    Stream.concat(
        fileProperties.entrySet().stream(),
        System.getProperties().entrySet().stream())
        .forEach(prop -> {
          String key = (String) prop.getKey();
          if (key.startsWith("tensorform.")) {
            allProperties.setProperty(key, (String) prop.getValue());
          }
        });
    return allProperties;
  }

  private final String key;
  private final T value;

  private TensorSystemProperty(String key,
      Function<? super @Nullable String, ? extends T> valueParser) {
    this.key = key;
    this.value = valueParser.apply(PROPERTIES.getProperty(key));
  }

  /** Returns the name of this property. */
  public String key() {
    return key;
  }

  /**
   * Returns the value of this property.
   *
   * @return the value of this property, or its default value if the property
   * is not set or its value is invalid
   */
  public T value() {
    return value;
  }
}
