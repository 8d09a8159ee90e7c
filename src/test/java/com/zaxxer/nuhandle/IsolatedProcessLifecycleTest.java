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
package com.zaxxer.nuhandle;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.zaxxer.nuhandle.internal.ChildReaper;
import com.zaxxer.nuhandle.internal.ChildSpawner;
import com.zaxxer.nuhandle.internal.Frame;
import com.zaxxer.nuhandle.internal.FrameListener;
import com.zaxxer.nuhandle.internal.Invocation;
import com.zaxxer.nuhandle.internal.Payloads;
import com.zaxxer.nuhandle.internal.SpawnedChild;

/**
 * Drives {@link IsolatedProcess} against a scripted child instead of a real
 * JVM, to pin down the start / join / scope-exit sequence.
 */
public class IsolatedProcessLifecycleTest
{
   private FakeSpawner spawner;

   @Before
   public void setup()
   {
      spawner = new FakeSpawner();
   }

   @After
   public void teardown()
   {
      FakeChild child = spawner.child;
      if (child != null) {
         child.exit(0);
         ChildReaper.forget(child);
      }
   }

   private IsolatedProcessBuilder builder(ChildTarget target)
   {
      return new IsolatedProcessBuilder(target).name("scripted").timeout(50, TimeUnit.MILLISECONDS).spawner(spawner);
   }

   @Test
   public void startSendsTheInvocationFirst() throws Exception
   {
      ChildFunction serve = args -> null;

      IsolatedProcess process = builder(serve).args(7).kwarg("mode", "fast").daemon(false).build();
      process.start();

      Assert.assertEquals(1, spawner.child.written.size());
      Frame frame = spawner.child.written.get(0);
      assertThat(frame.kind(), is(Frame.Kind.INVOKE));

      Invocation invocation = (Invocation) Payloads.deserialize(frame.payload(), getClass().getClassLoader());
      assertThat(invocation.getName(), equalTo("scripted"));
      assertThat(invocation.getArguments().get(0), equalTo((Object) 7));
      assertThat(invocation.getArguments().get("mode"), equalTo((Object) "fast"));
      Assert.assertFalse(invocation.isDaemon());
      Assert.assertTrue(spawner.command.get(spawner.command.size() - 1).endsWith("ChildMain"));
   }

   @Test
   public void sendsAreWrittenAsFramesInOrder() throws Exception
   {
      IsolatedProcess process = builder(Generators.of(1, 2)).build();
      process.start();
      process.send("first");
      process.go();

      List<Frame> written = spawner.child.written;
      Assert.assertEquals(3, written.size());
      assertThat(written.get(1).kind(), is(Frame.Kind.SEND));
      assertThat(Payloads.deserialize(written.get(1).payload(), null), equalTo((Object) "first"));
      assertThat(Payloads.deserialize(written.get(2).payload(), null), is(nullValue()));
   }

   @Test(expected = IllegalStateException.class)
   public void sendBeforeStartFails()
   {
      builder(Generators.of(1)).build().go();
   }

   @Test
   public void yieldedValuesAreReadInOrder() throws Exception
   {
      IsolatedProcess process = builder(Generators.of(1, 2)).build();
      process.start();
      spawner.deliver(Frame.Kind.YIELD, "a");
      spawner.deliver(Frame.Kind.YIELD, null);
      spawner.deliver(Frame.Kind.YIELD, "c");

      Assert.assertEquals("a", process.get());
      Assert.assertNull(process.get());
      Assert.assertEquals("c", process.get());
   }

   @Test
   public void joinCollectsOnlyOnceTheChildHasExited() throws Exception
   {
      ChildFunction serve = args -> null;

      IsolatedProcess process = builder(serve).build();
      process.start();
      spawner.deliver(Frame.Kind.RESULT, 3);

      Assert.assertFalse("Child is still running", process.join(10, TimeUnit.MILLISECONDS));
      assertThat(process.getResult(), is(nullValue()));

      spawner.child.exit(0);
      Assert.assertTrue(process.join(10, TimeUnit.MILLISECONDS));
      assertThat(process.getResult(), equalTo((Object) 3));
      assertThat(process.getException(), is(nullValue()));
      Assert.assertTrue("stdin is closed after the join", spawner.child.inputClosed);
   }

   @Test
   public void joinRebuildsTheChildException() throws Exception
   {
      ChildFunction serve = args -> null;

      IsolatedProcess process = builder(serve).build();
      process.start();
      spawner.deliver(Frame.Kind.ERROR, ChildFailure.of(new UnsupportedOperationException("nope")));
      spawner.child.exit(1);

      Assert.assertTrue(process.join());
      assertThat(process.getException(), instanceOf(UnsupportedOperationException.class));
      assertThat(process.getException().getMessage(), equalTo("nope"));
      assertThat(process.getResult(), is(nullValue()));
   }

   @Test
   public void closeTerminatesWhenConfigured() throws Exception
   {
      ChildFunction serve = args -> null;

      IsolatedProcess process = builder(serve).terminate(true).build();
      process.start();
      process.close();

      Assert.assertTrue(spawner.child.terminated);
      Assert.assertFalse(process.isAlive());
      assertThat(process.getExitCode(), equalTo(137));
   }

   @Test
   public void closeWithoutTerminateOnlyWaits() throws Exception
   {
      ChildFunction serve = args -> null;

      IsolatedProcess process = builder(serve).build();
      process.start();
      process.close();

      Assert.assertFalse(spawner.child.terminated);
      Assert.assertTrue("The child keeps running after the timeout", process.isAlive());
   }

   @Test
   public void reraisedChildExceptionWinsOverTheScopeException() throws Exception
   {
      ChildFunction serve = args -> null;

      IsolatedProcess process = builder(serve).reraise(true).build();
      spawner.onTerminate = new Runnable() {
         @Override
         public void run()
         {
            spawner.deliver(Frame.Kind.ERROR, ChildFailure.of(new IllegalArgumentException("child")));
         }
      };

      try {
         process.within(p -> {
            throw new IllegalStateException("scope");
         });
         Assert.fail("The child exception should propagate");
      }
      catch (IllegalArgumentException e) {
         assertThat(e.getMessage(), equalTo("child"));
         Throwable[] suppressed = e.getSuppressed();
         assertThat(suppressed[0], instanceOf(ChildProcessException.class));
         Assert.assertEquals(2, suppressed.length);
         assertThat(suppressed[1], instanceOf(IllegalStateException.class));
         assertThat(suppressed[1].getMessage(), equalTo("scope"));
      }

      Assert.assertTrue(spawner.child.terminated);
   }

   @Test
   public void scopeExceptionPropagatesWithoutReraise() throws Exception
   {
      ChildFunction serve = args -> null;

      IsolatedProcess process = builder(serve).build();
      spawner.onTerminate = new Runnable() {
         @Override
         public void run()
         {
            spawner.deliver(Frame.Kind.ERROR, ChildFailure.of(new IllegalArgumentException("child")));
         }
      };

      try {
         process.within(p -> {
            throw new IllegalStateException("scope");
         });
         Assert.fail("The scope exception should propagate");
      }
      catch (IllegalStateException e) {
         assertThat(e.getMessage(), equalTo("scope"));
         Assert.assertEquals(0, e.getSuppressed().length);
      }

      assertThat(process.getException(), instanceOf(IllegalArgumentException.class));
   }

   @Test
   public void interruptedScopeExitRestoresTheInterruptFlag() throws Exception
   {
      ChildFunction serve = args -> null;

      IsolatedProcess process = builder(serve).reraise(true).build();
      spawner.interruptWait = true;

      try {
         process.within(p -> {
            throw new IllegalStateException("scope");
         });
         Assert.fail("The scope exception should propagate");
      }
      catch (IllegalStateException e) {
         Assert.assertEquals(1, e.getSuppressed().length);
         assertThat(e.getSuppressed()[0], instanceOf(InterruptedException.class));
         Assert.assertTrue("Interrupt flag should be restored", Thread.interrupted());
      }
   }

   @Test
   public void concurrentJoinsBothComplete() throws Exception
   {
      ChildFunction serve = args -> null;

      final IsolatedProcess process = builder(serve).build();
      process.start();
      spawner.deliver(Frame.Kind.ERROR, ChildFailure.of(new IllegalArgumentException("child")));
      spawner.deliver(Frame.Kind.RESULT, "ignored");
      spawner.child.exit(1);

      ExecutorService joiners = Executors.newFixedThreadPool(2);
      try {
         Callable<Boolean> join = new Callable<Boolean>() {
            @Override
            public Boolean call() throws Exception
            {
               return process.join();
            }
         };
         Future<Boolean> first = joiners.submit(join);
         Future<Boolean> second = joiners.submit(join);

         Assert.assertTrue(first.get(5, TimeUnit.SECONDS));
         Assert.assertTrue(second.get(5, TimeUnit.SECONDS));
      }
      finally {
         joiners.shutdownNow();
      }

      assertThat(process.getException(), instanceOf(IllegalArgumentException.class));
   }

   @Test
   public void operationsBeforeStartFail() throws Exception
   {
      ChildFunction serve = args -> null;
      IsolatedProcess process = builder(serve).build();

      try {
         process.join();
         Assert.fail();
      }
      catch (IllegalStateException e) {
         assertThat(e.getMessage(), equalTo("Process scripted was not started"));
      }

      try {
         process.terminate();
         Assert.fail();
      }
      catch (IllegalStateException e) {
         // expected
      }

      assertThat(process.getExitCode(), is(nullValue()));
   }

   private static final class FakeSpawner implements ChildSpawner
   {
      FakeChild child;
      FrameListener listener;
      List<String> command;
      Runnable onTerminate;
      volatile boolean interruptWait;

      @Override
      public SpawnedChild spawn(List<String> command, FrameListener listener)
      {
         this.command = command;
         this.listener = listener;
         this.child = new FakeChild(this);
         return child;
      }

      void deliver(Frame.Kind kind, Object value)
      {
         listener.onFrame(Frame.of(kind, value));
      }
   }

   private static final class FakeChild implements SpawnedChild
   {
      final List<Frame> written = new CopyOnWriteArrayList<Frame>();
      final FakeSpawner spawner;
      volatile Integer exitCode;
      volatile boolean terminated;
      volatile boolean inputClosed;

      FakeChild(FakeSpawner spawner)
      {
         this.spawner = spawner;
      }

      void exit(int status)
      {
         if (exitCode == null) {
            exitCode = status;
         }
      }

      @Override
      public int getPid()
      {
         return 4242;
      }

      @Override
      public boolean isAlive()
      {
         return exitCode == null;
      }

      @Override
      public void write(Frame frame)
      {
         written.add(frame);
      }

      @Override
      public void terminate()
      {
         terminated = true;
         if (spawner.onTerminate != null) {
            spawner.onTerminate.run();
         }
         exit(137);
      }

      @Override
      public void waitFor()
      {
         if (isAlive()) {
            throw new AssertionError("Scripted child would never exit");
         }
      }

      @Override
      public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException
      {
         if (spawner.interruptWait) {
            throw new InterruptedException("join interrupted");
         }
         return !isAlive();
      }

      @Override
      public Integer getExitCode()
      {
         return exitCode;
      }

      @Override
      public void closeInput()
      {
         inputClosed = true;
      }
   }
}
