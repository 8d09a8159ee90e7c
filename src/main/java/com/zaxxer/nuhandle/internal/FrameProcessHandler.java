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

import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.zaxxer.nuprocess.NuAbstractProcessHandler;
import com.zaxxer.nuprocess.NuProcess;

/**
 * NuProcess callbacks for one child: stdout is decoded into frames, stderr is
 * copied to the parent's {@link System#err}, exit is recorded.
 * <p>
 * NuProcess invokes {@link #onExit(int)} only after the final
 * {@link #onStdout(ByteBuffer, boolean)}, so once {@link #hasExited()} is
 * true every frame the child wrote has reached the listener.
 */
class FrameProcessHandler extends NuAbstractProcessHandler
{
   private static final Logger LOGGER = Logger.getLogger(FrameProcessHandler.class.getCanonicalName());

   private final FrameDecoder decoder;
   private final CountDownLatch exited;
   private volatile Integer exitCode;
   private volatile NuProcess process;
   private volatile SpawnedChild owner;
   private boolean corrupt;

   FrameProcessHandler(FrameListener listener)
   {
      this.decoder = new FrameDecoder(listener);
      this.exited = new CountDownLatch(1);
   }

   /**
    * Bind the child this handler reports for, so that it is dropped from
    * {@link ChildReaper} as soon as it exits.
    */
   void attach(SpawnedChild child)
   {
      this.owner = child;
   }

   @Override
   public void onStart(NuProcess nuProcess)
   {
      this.process = nuProcess;
   }

   @Override
   public void onStdout(ByteBuffer buffer, boolean closed)
   {
      if (corrupt) {
         buffer.position(buffer.limit());
         return;
      }

      try {
         decoder.feed(buffer);
      }
      catch (RuntimeException e) {
         corrupt = true;
         buffer.position(buffer.limit());
         LOGGER.log(Level.WARNING, "Discarding output of child " + pid() + " after undecodable data", e);
      }

      if (closed && decoder.pendingBytes() > 0) {
         LOGGER.log(Level.WARNING, "Child " + pid() + " closed stdout in the middle of a frame, " + decoder.pendingBytes() + " bytes dropped");
      }
   }

   @Override
   public void onStderr(ByteBuffer buffer, boolean closed)
   {
      if (buffer.hasRemaining()) {
         byte[] bytes = new byte[buffer.remaining()];
         buffer.get(bytes);
         PrintStream err = System.err;
         err.write(bytes, 0, bytes.length);
         err.flush();
      }
   }

   @Override
   public void onExit(int statusCode)
   {
      exitCode = statusCode;
      exited.countDown();

      SpawnedChild child = owner;
      if (child != null) {
         ChildReaper.forget(child);
      }
      LOGGER.log(Level.FINE, "Child " + pid() + " exited with status " + statusCode);
   }

   boolean hasExited()
   {
      return exited.getCount() == 0;
   }

   Integer getExitCode()
   {
      return exitCode;
   }

   private String pid()
   {
      NuProcess p = process;
      return p == null ? "?" : String.valueOf(p.getPID());
   }
}
