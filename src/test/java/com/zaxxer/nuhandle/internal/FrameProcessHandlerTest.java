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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.Assert;
import org.junit.Test;

public class FrameProcessHandlerTest
{
   @Test
   public void framesAreDecodedAndExitIsRecorded()
   {
      List<Frame> frames = new ArrayList<Frame>();
      FrameProcessHandler handler = new FrameProcessHandler(frames::add);

      ByteBuffer stdout = Frame.of(Frame.Kind.RESULT, "value").encode();
      handler.onStdout(stdout, false);
      Assert.assertFalse(stdout.hasRemaining());
      Assert.assertFalse(handler.hasExited());
      Assert.assertNull(handler.getExitCode());

      handler.onStdout(ByteBuffer.allocate(0), true);
      handler.onExit(0);

      Assert.assertEquals(1, frames.size());
      Assert.assertTrue(handler.hasExited());
      assertThat(handler.getExitCode(), is(0));
   }

   @Test
   public void undecodableOutputIsDiscarded()
   {
      List<Frame> frames = new ArrayList<Frame>();
      FrameProcessHandler handler = new FrameProcessHandler(frames::add);

      ByteBuffer garbage = ByteBuffer.wrap("Hello from a stray println".getBytes());
      handler.onStdout(garbage, false);
      Assert.assertFalse(garbage.hasRemaining());

      ByteBuffer valid = Frame.of(Frame.Kind.RESULT, 1).encode();
      handler.onStdout(valid, true);
      Assert.assertFalse("Output after corruption is still consumed", valid.hasRemaining());
      Assert.assertTrue(frames.isEmpty());
   }

   @Test
   public void exitedChildIsDroppedFromTheReaper()
   {
      FrameProcessHandler handler = new FrameProcessHandler(frame -> { });
      StubChild child = new StubChild(handler);
      handler.attach(child);

      ChildReaper.register(child, false);
      Assert.assertTrue(ChildReaper.isRegistered(child));

      handler.onExit(0);
      Assert.assertFalse("Never joined, but exited", ChildReaper.isRegistered(child));
   }

   @Test
   public void childThatExitedBeforeRegistrationIsNotKept()
   {
      FrameProcessHandler handler = new FrameProcessHandler(frame -> { });
      StubChild child = new StubChild(handler);
      handler.onExit(1);

      ChildReaper.register(child, true);
      Assert.assertFalse(ChildReaper.isRegistered(child));
   }

   private static final class StubChild implements SpawnedChild
   {
      private final FrameProcessHandler handler;

      StubChild(FrameProcessHandler handler)
      {
         this.handler = handler;
      }

      @Override
      public int getPid()
      {
         return 1;
      }

      @Override
      public boolean isAlive()
      {
         return !handler.hasExited();
      }

      @Override
      public void write(Frame frame)
      {
      }

      @Override
      public void terminate()
      {
         handler.onExit(137);
      }

      @Override
      public void waitFor()
      {
      }

      @Override
      public boolean waitFor(long timeout, TimeUnit unit)
      {
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
      }
   }
}
