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

import org.multiscan.test.BaseTest;
import org.junit.Assert;
import org.junit.Test;

/**
 * Test various use cases around creating user exceptions
 */
public class TestUserException extends BaseTest {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TestUserException.class);

  private Exception wrap(UserException uex, int numWraps) {
    Exception ex = uex;
    for (int i = 0; i < numWraps; i++) {
      ex = new Exception("wrap #" + (i+1), ex);
    }

    return ex;
  }

  // make sure system exceptions are created properly
  @Test
  public void testBuildSystemException() {
    UserException uex = UserException.systemError(new RuntimeException("this is an exception")).build(logger);

    Assert.assertEquals(ErrorType.SYSTEM, uex.getErrorType());
    Assert.assertEquals("RuntimeException: this is an exception", uex.getOriginalMessage());
  }

  @Test
  public void testBuildUserExceptionWithMessage() {
    String message = "Test message";

    UserException uex = UserException.dataReadError().message(message).build(logger);

    Assert.assertEquals(ErrorType.DATA_READ, uex.getErrorType());
    Assert.assertEquals(message, uex.getOriginalMessage());
    Assert.assertTrue(uex.getMessage().startsWith("DATA_READ ERROR: " + message));
  }

  @Test
  public void testBuildUserExceptionWithCause() {
    String message = "Test message";

    UserException uex = UserException.dataReadError(new RuntimeException(message)).build(logger);

    // cause message should be used
    Assert.assertEquals(ErrorType.DATA_READ, uex.getErrorType());
    Assert.assertEquals(message, uex.getOriginalMessage());
  }

  @Test
  public void testBuildUserExceptionWithCauseAndMessage() {
    String messageA = "Test message A";
    String messageB = "Test message B";

    UserException uex = UserException.dataReadError(new RuntimeException(messageA))
        .message(messageB)
        .build(logger);

    // passed message should override the cause message
    Assert.assertEquals(ErrorType.DATA_READ, uex.getErrorType());
    Assert.assertFalse(uex.getMessage().contains(messageA));
    Assert.assertEquals(messageB, uex.getOriginalMessage());
  }

  @Test
  public void testBuildUserExceptionWithUserExceptionCauseAndMessage() {
    String messageA = "Test message A";
    String messageB = "Test message B";

    UserException original = UserException.validationError().message(messageA).build(logger);
    UserException uex = UserException.dataReadError(wrap(original, 5))
        .message(messageB)
        .addContext("File", "/data/a.csv")
        .build(logger);

    //builder should return the unwrapped original user exception and not build a new one
    Assert.assertSame(original, uex);
    Assert.assertEquals(ErrorType.VALIDATION, uex.getErrorType());
    Assert.assertEquals(messageA, uex.getOriginalMessage());
    Assert.assertTrue(uex.getMessage().contains("File: /data/a.csv"));
  }

  @Test
  public void testBuildUserExceptionWithFormattedMessage() {
    String format = "This is test #%d";

    UserException uex = UserException.parseError().message(format, 5).build(logger);

    Assert.assertEquals(ErrorType.PARSE, uex.getErrorType());
    Assert.assertEquals(String.format(format, 5), uex.getOriginalMessage());
  }

  @Test
  public void testMessageWithoutArgumentsIsNotFormatted() {
    UserException uex = UserException.internalError().message("100% broken").build(logger);

    Assert.assertEquals("100% broken", uex.getOriginalMessage());
  }

  @Test
  public void testContextOrder() {
    UserException uex = UserException.permissionError()
        .message("Scanning %s files is disabled through configuration", "CSV")
        .addContext("second")
        .pushContext("first")
        .addContext("Count", 3)
        .build(logger);

    Assert.assertEquals(3, uex.getContext().size());
    Assert.assertEquals("first", uex.getContext().get(0));
    Assert.assertEquals("Count: 3", uex.getContext().get(2));
    Assert.assertTrue(uex.getMessage().endsWith("[Error Id: " + uex.getErrorId() + "]"));
    Assert.assertFalse(uex.getMessage(false).contains(uex.getErrorId()));
  }

  @Test
  public void testVerboseMessageContainsCause() {
    UserException uex = UserException.resourceError(new IllegalStateException("pool exhausted"))
        .message("Timed out")
        .build(logger);

    Assert.assertTrue(uex.getVerboseMessage().contains("(java.lang.IllegalStateException) pool exhausted"));
  }

  @Test
  public void testEdgeCases() {
    UserException.systemError(null).build(logger);
    UserException.dataReadError(null).build(logger).getMessage();
    UserException.dataReadError(new RuntimeException()).message(null).build(logger).getVerboseMessage();
  }
}
