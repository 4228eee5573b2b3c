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
package org.multiscan.common.exceptions;

/**
 * Classifies a {@link UserException}. The type is the first word of the
 * message shown to the user.
 */
public enum ErrorType {

  /**
   * File access is disabled by configuration.
   */
  PERMISSION,

  /**
   * Invalid or NULL input handed to a scan: paths, option values,
   * persisted plan state.
   */
  PARSE,

  /**
   * A file could not be read as part of the scan, or yields a schema that
   * cannot be mapped onto the scan schema.
   */
  DATA_READ,

  /**
   * Inconsistency between file schemas or options detected at bind time.
   */
  VALIDATION,

  /**
   * Resources (threads, time) were exhausted.
   */
  RESOURCE,

  /**
   * Invariant violation: a bug, not bad input.
   */
  INTERNAL_ERROR,

  /**
   * Any exception that was not explicitly classified.
   */
  SYSTEM
}
