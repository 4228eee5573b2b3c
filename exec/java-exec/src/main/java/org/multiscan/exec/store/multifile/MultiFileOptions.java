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
package org.multiscan.exec.store.multifile;

import java.util.Map;
import java.util.Objects;

import org.multiscan.common.config.ScanConfig;
import org.multiscan.common.exceptions.UserException;
import org.multiscan.common.types.MinorType;
import org.multiscan.common.types.ScalarValue;
import org.multiscan.exec.ExecConstants;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

/**
 * The named parameters shared by every multi-file reader.
 * <ul>
 * <li>{@code filename}: add a VARCHAR column holding the path of each file.</li>
 * <li>{@code hive_partitioning}: add a VARCHAR column per {@code key=value}
 *     directory of the file paths.</li>
 * <li>{@code union_by_name}: unify the columns of all files by name instead
 *     of taking the schema of the first file.</li>
 * </ul>
 */
@JsonPropertyOrder({"version", "filename", "hivePartitioning", "unionByName"})
@JsonAutoDetect(getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE)
public class MultiFileOptions {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(MultiFileOptions.class);

  public static final int CURRENT_VERSION = 1;

  public static final String FILENAME = "filename";
  public static final String HIVE_PARTITIONING = "hive_partitioning";
  public static final String UNION_BY_NAME = "union_by_name";

  /**
   * Named parameters to register on every multi-file table function.
   */
  public static final Map<String, MinorType> NAMED_PARAMETERS = ImmutableMap.of(
      FILENAME, MinorType.BIT,
      HIVE_PARTITIONING, MinorType.BIT,
      UNION_BY_NAME, MinorType.BIT);

  private static final MultiFileOptions DEFAULTS = new MultiFileOptions(false, false, false);

  private final boolean filename;
  private final boolean hivePartitioning;
  private final boolean unionByName;

  public MultiFileOptions(boolean filename, boolean hivePartitioning, boolean unionByName) {
    this.filename = filename;
    this.hivePartitioning = hivePartitioning;
    this.unionByName = unionByName;
  }

  @JsonCreator
  static MultiFileOptions fromJson(@JsonProperty(value = "version", required = true) int version,
                                   @JsonProperty(value = "filename", required = true) boolean filename,
                                   @JsonProperty(value = "hivePartitioning", required = true) boolean hivePartitioning,
                                   @JsonProperty(value = "unionByName", required = true) boolean unionByName) {
    MultiFilePersistence.checkVersion(version, MultiFileOptions.class);
    return new MultiFileOptions(filename, hivePartitioning, unionByName);
  }

  /**
   * @return options with every flag off
   */
  public static MultiFileOptions defaults() {
    return DEFAULTS;
  }

  /**
   * @return options with the flags configured under
   *         {@code multiscan.exec.multifile}
   */
  public static MultiFileOptions fromConfig(ScanConfig config) {
    return new MultiFileOptions(
        config.getBoolean(ExecConstants.MULTIFILE_FILENAME),
        config.getBoolean(ExecConstants.MULTIFILE_HIVE_PARTITIONING),
        config.getBoolean(ExecConstants.MULTIFILE_UNION_BY_NAME));
  }

  public static Builder builder() {
    return new Builder(DEFAULTS);
  }

  public static Builder builder(ScanConfig config) {
    return new Builder(fromConfig(config));
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @JsonProperty("version")
  public int getVersion() {
    return CURRENT_VERSION;
  }

  @JsonProperty("filename")
  public boolean isFilename() {
    return filename;
  }

  @JsonProperty("hivePartitioning")
  public boolean isHivePartitioning() {
    return hivePartitioning;
  }

  @JsonProperty("unionByName")
  public boolean isUnionByName() {
    return unionByName;
  }

  /**
   * Exports the options as boolean values, for display in plans.
   */
  public void addBindInfo(Map<String, ScalarValue> bindInfo) {
    bindInfo.put(FILENAME, ScalarValue.ofBoolean(filename));
    bindInfo.put(HIVE_PARTITIONING, ScalarValue.ofBoolean(hivePartitioning));
    bindInfo.put(UNION_BY_NAME, ScalarValue.ofBoolean(unionByName));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MultiFileOptions that = (MultiFileOptions) o;
    return filename == that.filename
        && hivePartitioning == that.hivePartitioning
        && unionByName == that.unionByName;
  }

  @Override
  public int hashCode() {
    return Objects.hash(filename, hivePartitioning, unionByName);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add(FILENAME, filename)
        .add(HIVE_PARTITIONING, hivePartitioning)
        .add(UNION_BY_NAME, unionByName)
        .toString();
  }

  /**
   * Collects option values, typically the named parameters of a table
   * function call, on top of a set of defaults.
   */
  public static class Builder {
    private boolean filename;
    private boolean hivePartitioning;
    private boolean unionByName;

    private Builder(MultiFileOptions defaults) {
      this.filename = defaults.filename;
      this.hivePartitioning = defaults.hivePartitioning;
      this.unionByName = defaults.unionByName;
    }

    public Builder filename(boolean filename) {
      this.filename = filename;
      return this;
    }

    public Builder hivePartitioning(boolean hivePartitioning) {
      this.hivePartitioning = hivePartitioning;
      return this;
    }

    public Builder unionByName(boolean unionByName) {
      this.unionByName = unionByName;
      return this;
    }

    /**
     * Sets the option named by the key, ignoring its case.
     *
     * @param key option name
     * @param value option value, a non-NULL BIT
     * @return false if the key does not name a multi-file option, in which
     *         case nothing is changed
     * @throws UserException parse error if the key is recognized but the
     *         value is not a boolean
     */
    public boolean parseOption(String key, ScalarValue value) {
      final String option = key.toLowerCase();
      switch (option) {
        case FILENAME:
          filename = booleanValue(option, value);
          return true;
        case HIVE_PARTITIONING:
          hivePartitioning = booleanValue(option, value);
          return true;
        case UNION_BY_NAME:
          unionByName = booleanValue(option, value);
          return true;
        default:
          return false;
      }
    }

    private static boolean booleanValue(String option, ScalarValue value) {
      if (value == null || value.isNull()) {
        throw UserException.parseError()
            .message("Option %s cannot be NULL", option)
            .build(logger);
      }
      if (value.getType() != MinorType.BIT) {
        throw UserException.parseError()
            .message("Option %s expects a BOOLEAN value, got %s", option, value.getType())
            .build(logger);
      }
      return value.getBoolean();
    }

    public MultiFileOptions build() {
      return new MultiFileOptions(filename, hivePartitioning, unionByName);
    }
  }
}
