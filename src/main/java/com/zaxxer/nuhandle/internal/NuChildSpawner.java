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

import java.util.List;
import java.util.concurrent.TimeUnit;

import com.zaxxer.nuprocess.NuProcess;
import com.zaxxer.nuprocess.NuProcessBuilder;

/**
 * {@link ChildSpawner} on top of NuProcess: the child's stdin is written
 * with {@link NuProcess#writeStdin(java.nio.ByteBuffer)}, its stdout and
 * stderr are pumped by the NuProcess processing threads.
 */
public final class NuChildSpawner implements ChildSpawner
{
   public static final NuChildSpawner INSTANCE = new NuChildSpawner();

   private NuChildSpawner()
   {
   }

   @Override
   public SpawnedChild spawn(List<String> command, FrameListener listener)
   {
      FrameProcessHandler handler = new FrameProcessHandler(listener);
      NuProcessBuilder builder = new NuProcessBuilder(command);
      builder.setProcessListener(handler);

      NuProcess process = builder.start();
      if (process == null || (handler.hasExited() && handler.getExitCode() == Integer.MIN_VALUE)) {
         throw new IllegalStateException("Failed to launch child process " + command);
      }

      NuSpawnedChild child = new NuSpawnedChild(process, handler);
      handler.attach(child);
      return child;
   }

   private static final class NuSpawnedChild implements SpawnedChild
   {
      private final NuProcess process;
      private final FrameProcessHandler handler;

      NuSpawnedChild(NuProcess process, FrameProcessHandler handler)
      {
         this.process = process;
         this.handler = handler;
      }

      @Override
      public int getPid()
      {
         return process.getPID();
      }

      @Override
      public boolean isAlive()
      {
         return process.isRunning();
      }

      @Override
      public void write(Frame frame)
      {
         process.writeStdin(frame.encode());
      }

      @Override
      public void terminate()
      {
         process.destroy(true);
      }

      @Override
      public void waitFor() throws InterruptedException
      {
         process.waitFor(0, TimeUnit.MILLISECONDS);
      }

      @Override
      public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException
      {
         if (timeout > 0 && !handler.hasExited()) {
            process.waitFor(timeout, unit);
         }

         return handler.hasExited();
      }

      @Override
      public Integer getExitCode()
      {
         return handler.getExitCode();
      }

      @Override
      public void closeInput()
      {
         process.closeStdin(false);
      }

      @Override
      public String toString()
      {
         return "child " + process.getPID();
      }
   }
}
