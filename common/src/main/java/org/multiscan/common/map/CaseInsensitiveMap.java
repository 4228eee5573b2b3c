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
package org.multiscan.common.map;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Maps;

/**
 * A special type of {@link Map} with {@link String}s as keys, and the case of a key is ignored for operations
 * involving keys like {@link #put}, {@link #get}, etc. The keys are stored and retrieved in lower case. Use the
 * static factory methods to create instances of this class (e.g. {@link #newHashMap}).
 *
 * @param <VALUE> the type of values to be stored in the map
 */
public class CaseInsensitiveMap<VALUE> implements Map<String, VALUE> {

  /**
   * Returns a new instance of {@link java.util.LinkedHashMap} with key case-insensitivity. Keys are
   * iterated in insertion order.
   *
   * @param <VALUE> type of values to be stored in the map
   * @return key case-insensitive map
   */
  public static <VALUE> CaseInsensitiveMap<VALUE> newHashMap() {
    return new CaseInsensitiveMap<>(new LinkedHashMap<String, VALUE>());
  }

  /**
   * Returns a new instance of {@link java.util.LinkedHashMap} with key case-insensitivity, sized for
   * the expected number of entries.
   */
  public static <VALUE> CaseInsensitiveMap<VALUE> newHashMapWithExpectedSize(final int expectedSize) {
    return new CaseInsensitiveMap<>(Maps.<String, VALUE>newLinkedHashMapWithExpectedSize(expectedSize));
  }

  /**
   * Builds a name to position lookup over the given names. When a name occurs
   * more than once, ignoring case, the first position wins.
   */
  public static CaseInsensitiveMap<Integer> indexOf(final Iterable<String> names) {
    final CaseInsensitiveMap<Integer> map = newHashMap();
    int position = 0;
    for (final String name : names) {
      if (!map.containsKey(name)) {
        map.put(name, position);
      }
      position++;
    }
    return map;
  }

  private final Map<String, VALUE> underlyingMap;

  /**
   * Use the static factory methods to create instances of this class.
   *
   * @param underlyingMap the underlying map
   */
  private CaseInsensitiveMap(final Map<String, VALUE> underlyingMap) {
    this.underlyingMap = underlyingMap;
  }

  @Override
  public int size() {
    return underlyingMap.size();
  }

  @Override
  public boolean isEmpty() {
    return underlyingMap.isEmpty();
  }

  @Override
  public boolean containsKey(final Object key) {
    return key instanceof String && underlyingMap.containsKey(((String) key).toLowerCase());
  }

  @Override
  public boolean containsValue(final Object value) {
    return underlyingMap.containsValue(value);
  }

  @Override
  public VALUE get(final Object key) {
    return key instanceof String ? underlyingMap.get(((String) key).toLowerCase()) : null;
  }

  @Override
  public VALUE put(final String key, final VALUE value) {
    return underlyingMap.put(key.toLowerCase(), value);
  }

  @Override
  public VALUE remove(final Object key) {
    return key instanceof String ? underlyingMap.remove(((String) key).toLowerCase()) : null;
  }

  @Override
  public void putAll(final Map<? extends String, ? extends VALUE> map) {
    for (final Entry<? extends String, ? extends VALUE> entry : map.entrySet()) {
      underlyingMap.put(entry.getKey().toLowerCase(), entry.getValue());
    }
  }

  @Override
  public void clear() {
    underlyingMap.clear();
  }

  @Override
  public Set<String> keySet() {
    return underlyingMap.keySet();
  }

  @Override
  public Collection<VALUE> values() {
    return underlyingMap.values();
  }

  @Override
  public Set<Entry<String, VALUE>> entrySet() {
    return underlyingMap.entrySet();
  }

  @Override
  public boolean equals(Object o) {
    return underlyingMap.equals(o);
  }

  @Override
  public int hashCode() {
    return underlyingMap.hashCode();
  }

  @Override
  public String toString() {
    return underlyingMap.toString();
  }
}
