/*
 * Copyright (C) 2013 Brett Wooldridge
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.zaxxer.nuhandle.internal;

import java.util.concurrent.TimeUnit;

/**
 * A running child process as seen by its parent: the process-spawn
 * abstraction an {@link com.zaxxer.nuhandle.IsolatedProcess} is composed
 * with.
 */
public interface SpawnedChild
{
   int getPid();

   /**
    * @return {@code true} until the process has terminated
    */
   boolean isAlive();

   /**
    * Queue a frame for the child's stdin; never blocks.
    *
    * @param frame the frame to send
    */
   void write(Frame frame);

   /**
    * Forcibly kill the process. Asynchronous: the process may still be alive
    * when this method returns.
    */
   void terminate();

   /**
    * Wait until the process terminates and all of its output was delivered.
    *
    * @throws InterruptedException if interrupted while waiting
    */
   void waitFor() throws InterruptedException;

   /**
    * Wait until the process terminates, at most {@code timeout}. A timeout of
    * zero or less only checks.
    *
    * @param timeout the maximum time to wait
    * @param unit the unit of {@code timeout}
    * @return {@code true} if the process terminated and its output was delivered
    * @throws InterruptedException if interrupted while waiting
    */
   boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException;

   /**
    * @return the exit status, or {@code null} while the process is running
    */
   Integer getExitCode();

   /**
    * Close the child's stdin once pending writes are flushed.
    */
   void closeInput();
}
