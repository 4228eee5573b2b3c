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
package org.multiscan.common.types;

/**
 * Logical column types understood by a multi-file scan.
 */
public enum MinorType {
  /** Untyped NULL, bottom of the type lattice. */
  NULL,
  /** Single bit value, SQL BOOLEAN. */
  BIT,
  /** 1 byte signed integer. */
  TINYINT,
  /** 2 byte signed integer. */
  SMALLINT,
  /** 4 byte signed integer. */
  INT,
  /** 8 byte signed integer. */
  BIGINT,
  /** Arbitrary precision decimal. */
  VARDECIMAL,
  /** 4 byte IEEE 754 floating point. */
  FLOAT4,
  /** 8 byte IEEE 754 floating point. */
  FLOAT8,
  /** Days since the epoch. */
  DATE,
  /** Time of day without a zone. */
  TIME,
  /** Date and time without a zone. */
  TIMESTAMP,
  /** UTF-8 string, top of the type lattice. */
  VARCHAR,
  /** Variable length binary. */
  VARBINARY,
  /** List of values. */
  LIST
}
