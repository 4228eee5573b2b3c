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
package org.multiscan.exec.store;

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.List;

import org.junit.Test;
import org.multiscan.common.exceptions.ErrorType;
import org.multiscan.common.exceptions.UserException;
import org.multiscan.exec.ExecTest;

import com.google.common.collect.Lists;

/**
 * Unit testing for {@link TimedRunnable}.
 */
public class TestTimedRunnable extends ExecTest {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TestTimedRunnable.class);

  private static class TestTask extends TimedRunnable<Integer> {
    final int value;
    final long sleepTime; // sleep time in ms
    final boolean fail;

    public TestTask(int value, long sleepTime, boolean fail) {
      this.value = value;
      this.sleepTime = sleepTime;
      this.fail = fail;
    }

    @Override
    protected Integer runInner() throws Exception {
      Thread.sleep(sleepTime);
      if (fail) {
        throw new IOException("Task " + value + " failed");
      }
      return value;
    }

    @Override
    protected UserException convertToUserException(Exception e) {
      return UserException.dataReadError(e)
          .message("Failure while running task %d", value)
          .build(logger);
    }
  }

  @Test
  public void testResultsInTaskOrder() {
    List<TestTask> tasks = Lists.newArrayList();
    for (int i = 0; i < 20; i++) {
      tasks.add(new TestTask(i, (20 - i) % 5, false));
    }

    List<Integer> values = TimedRunnable.run("Execution in order", logger, tasks, 4, 5000);
    assertEquals(20, values.size());
    for (int i = 0; i < 20; i++) {
      assertEquals(i, (int) values.get(i));
    }
  }

  @Test
  public void testSingleTaskRunsInThread() {
    List<TestTask> tasks = Lists.newArrayList(new TestTask(7, 0, false));
    assertEquals(Lists.newArrayList(7), TimedRunnable.run("Single task", logger, tasks, 4, 1000));
  }

  @Test
  public void testNoTasks() {
    List<TestTask> tasks = Lists.newArrayList();
    assertTrue(TimedRunnable.run("No tasks", logger, tasks, 4, 1000).isEmpty());
  }

  @Test
  public void testFirstFailureIsThrown() {
    List<TestTask> tasks = Lists.newArrayList();
    for (int i = 0; i < 6; i++) {
      tasks.add(new TestTask(i, 0, i == 2 || i == 4));
    }

    UserException ex = null;
    try {
      TimedRunnable.run("Execution with failures", logger, tasks, 3, 5000);
    } catch (UserException e) {
      ex = e;
    }

    assertNotNull("Expected a UserException", ex);
    assertEquals(ErrorType.DATA_READ, ex.getErrorType());
    assertEquals("Failure while running task 2", ex.getOriginalMessage());
    assertEquals(1, ex.getSuppressed().length);
  }

  @Test
  public void testTasksExceedingTimeout() {
    UserException ex = null;

    try {
      List<TestTask> tasks = Lists.newArrayList();
      for (int i = 0; i < 4; i++) {
        tasks.add(new TestTask(i, i == 0 ? 20000 : 0, false));
      }
      TimedRunnable.run("Execution with a task triggering timeout", logger, tasks, 2, 100);
    } catch (UserException e) {
      ex = e;
    }

    assertNotNull("Expected a UserException", ex);
    assertEquals(ErrorType.RESOURCE, ex.getErrorType());
    assertThat(ex.getMessage(),
        containsString("Waited for 200ms, but tasks for 'Execution with a task triggering timeout' are not " +
            "complete. Total runnable size 4, parallelism 2."));
  }
}
