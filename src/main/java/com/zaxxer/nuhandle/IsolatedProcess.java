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

import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.zaxxer.nuhandle.internal.ChildReaper;
import com.zaxxer.nuhandle.internal.ChildSpawner;
import com.zaxxer.nuhandle.internal.Frame;
import com.zaxxer.nuhandle.internal.FrameWriter;
import com.zaxxer.nuhandle.internal.InboundChannel;
import com.zaxxer.nuhandle.internal.Invocation;
import com.zaxxer.nuhandle.internal.OutboundChannel;
import com.zaxxer.nuhandle.internal.Settings;
import com.zaxxer.nuhandle.internal.SpawnedChild;

/**
 * Runs a {@link ChildTarget} in a child JVM and exposes it as a scoped
 * resource.
 * <p>
 * Once the child has finished and the handle was joined, the value returned
 * by the target is available from {@link #getResult()} and an exception it
 * threw from {@link #getException()}. With {@code reraise} set, that
 * exception is also thrown by {@link #join()} and on scope exit.
 * <pre>
 *    ChildFunction add = args -&gt; (Integer) args.get(0) + (Integer) args.get(1);
 *    IsolatedProcess process = new IsolatedProcess(add, 1, 2);
 *    process.start();
 *    process.join();
 *    process.getResult();   // 3
 * </pre>
 * If the target is a {@link ChildGenerator}, the child stops at each yield:
 * {@link #get()} retrieves the yielded value and {@link #send(Object)} (or
 * {@link #go()}) lets it continue. Values are retrieved in yield order even
 * when sends are issued ahead of the gets. <b>Every yield needs one send,
 * the last one included</b>; otherwise the child never finishes and a join
 * only returns on its timeout.
 * <pre>
 *    new IsolatedProcessBuilder(Generators.of(1, 2, 5)).build().within(p -&gt; {
 *       p.go(); p.go(); p.go();
 *       return Arrays.asList(p.get(), p.get(), p.get());   // [1, 2, 5]
 *    });
 * </pre>
 * A handle is started once and joined once. A child that hangs or crashes
 * never affects the parent on its own; with {@code terminate} set, scope
 * exit kills it, which is a signal, not an instantaneous stop.
 * <p>
 * After {@link #terminate()}, a thread blocked in {@link #get()} stays
 * blocked forever.
 */
public class IsolatedProcess implements AutoCloseable
{
   private static final Logger LOGGER = Logger.getLogger(IsolatedProcess.class.getCanonicalName());

   private final ChildTarget target;
   private final Arguments arguments;
   private final String name;
   private final long timeoutMillis;
   private final boolean terminate;
   private final boolean reraise;
   private final boolean daemon;
   private final ChildSpawner spawner;
   private final ClassLoader loader;

   private final Conversation conversation;
   private final InboundChannel childToParent;
   private final InboundChannel resultChannel;
   private final InboundChannel errorChannel;

   private volatile SpawnedChild child;
   private volatile Object result;
   private volatile Throwable exception;

   /**
    * Construct a handle with default attributes.
    *
    * @param target a {@link ChildFunction} or a {@link ChildGenerator}
    * @param args positional arguments for the target
    */
   public IsolatedProcess(ChildTarget target, Object... args)
   {
      this(new IsolatedProcessBuilder(target).args(args));
   }

   IsolatedProcess(IsolatedProcessBuilder builder)
   {
      this.target = builder.getTarget();
      this.arguments = builder.getArguments();
      this.name = builder.getName();
      this.timeoutMillis = builder.getTimeoutMillis();
      this.terminate = builder.isTerminate();
      this.reraise = builder.isReraise();
      this.daemon = builder.isDaemon();
      this.spawner = builder.getSpawner();

      ClassLoader targetLoader = target.getClass().getClassLoader();
      this.loader = targetLoader != null ? targetLoader : IsolatedProcess.class.getClassLoader();

      this.resultChannel = new InboundChannel("result of " + name, loader);
      this.errorChannel = new InboundChannel("error of " + name, loader);

      if (target instanceof ChildGenerator) {
         this.childToParent = new InboundChannel("child-to-parent of " + name, loader);
         Channel<Object> parentToChild = new OutboundChannel(Frame.Kind.SEND, new ChildWriter());
         this.conversation = new Conversation((ChildGenerator) target, childToParent, parentToChild);
      }
      else {
         this.childToParent = null;
         this.conversation = null;
      }
   }

   /**
    * Spawn the child and send it the target and its arguments.
    *
    * @throws IllegalStateException if already started, or if the child could not be launched
    * @throws IllegalArgumentException if the target or an argument is not serializable
    */
   public synchronized void start()
   {
      if (child != null) {
         throw new IllegalStateException("Process " + name + " was already started");
      }

      Frame invocation = Frame.of(Frame.Kind.INVOKE, new Invocation(name, target, arguments, daemon));

      SpawnedChild spawned = spawner.spawn(Settings.childCommand(), this::onFrame);
      ChildReaper.register(spawned, daemon);
      spawned.write(invocation);
      child = spawned;

      LOGGER.log(Level.FINE, "Started " + name + " as " + spawned);
   }

   /**
    * Wait for the child to terminate, without a time limit, then collect its
    * result or exception.
    *
    * @return {@code true}
    * @throws Exception the child's exception, if {@code reraise} is set
    */
   public boolean join() throws Exception
   {
      SpawnedChild spawned = started();
      spawned.waitFor();
      return collect(spawned, true);
   }

   /**
    * Wait for the child to terminate, at most {@code timeout}. If it did,
    * collect its result or exception; if it did not, nothing is collected and
    * the child keeps running.
    *
    * @param timeout the maximum time to wait, zero to only check
    * @param unit the unit of {@code timeout}
    * @return {@code true} if the child terminated, {@code false} if it is still running
    * @throws Exception the child's exception, if {@code reraise} is set
    */
   public boolean join(long timeout, TimeUnit unit) throws Exception
   {
      SpawnedChild spawned = started();
      return collect(spawned, spawned.waitFor(timeout, unit));
   }

   /**
    * Retrieve the oldest value yielded by a generator target and not yet
    * retrieved, blocking until there is one. This does not let the child
    * continue; see {@link #send(Object)}.
    *
    * @return the yielded value
    * @throws InterruptedException if interrupted while waiting
    * @throws NotAGeneratorTargetException if the target is not a {@link ChildGenerator}
    */
   public Object get() throws InterruptedException
   {
      if (conversation == null) {
         throw new NotAGeneratorTargetException(name + " is not a generator target and so cannot send values back before returning.");
      }

      return conversation.getFromChild();
   }

   /**
    * Answer the oldest unanswered yield of a generator target with
    * {@code value}, letting the child continue. Does not block.
    *
    * @param value a {@link java.io.Serializable} value or {@code null}
    * @throws NotAGeneratorTargetException if the target is not a {@link ChildGenerator}
    * @throws IllegalArgumentException if {@code value} is not serializable
    */
   public void send(Object value)
   {
      if (conversation == null) {
         throw new NotAGeneratorTargetException(name + " is not a generator target and so cannot receive values after starting up.");
      }

      conversation.sendToChild(value);
   }

   /**
    * Let a generator target continue past its pending yield; the same as
    * {@code send(null)}.
    *
    * @throws NotAGeneratorTargetException if the target is not a {@link ChildGenerator}
    */
   public void go()
   {
      if (conversation == null) {
         throw new NotAGeneratorTargetException(name + " is not a generator target. It cannot be stopped - much less go ahead after stopping.");
      }

      conversation.sendToChild(null);
   }

   /**
    * @return {@code true} if the child was started and has not terminated
    */
   public boolean isAlive()
   {
      SpawnedChild spawned = child;
      return spawned != null && spawned.isAlive();
   }

   /**
    * Forcibly kill the child. The kill is asynchronous; use
    * {@link #join(long, TimeUnit)} to wait for it to take effect.
    */
   public void terminate()
   {
      SpawnedChild spawned = started();
      LOGGER.log(Level.FINE, "Terminating " + name);
      spawned.terminate();
   }

   /**
    * Start the child, run {@code block}, then leave the scope: if the block
    * threw or {@code terminate} is set the child is killed first, and the
    * child is joined with the configured timeout in every case.
    * <p>
    * If {@code reraise} is set and the child failed, the child's exception is
    * thrown on the way out, with any exception from the block attached to it
    * as suppressed. Otherwise an exception from the block is rethrown as is.
    *
    * @param block the body of the scope
    * @param <T> the type of the body's result
    * @return what the block returned
    * @throws Exception the block's exception, or the child's if {@code reraise} is set
    */
   public <T> T within(ScopedBlock<T> block) throws Exception
   {
      start();

      T value;
      try {
         value = block.run(this);
      }
      catch (Throwable t) {
         terminate();
         try {
            join(timeoutMillis, TimeUnit.MILLISECONDS);
         }
         catch (Throwable failure) {
            if (isReraisedChildException(failure)) {
               failure.addSuppressed(t);
               throw failure;
            }

            if (failure instanceof InterruptedException) {
               Thread.currentThread().interrupt();
            }
            t.addSuppressed(failure);
         }
         throw t;
      }

      close();
      return value;
   }

   /**
    * Leave the scope normally: kill the child if {@code terminate} is set,
    * then join it with the configured timeout.
    *
    * @throws Exception the child's exception, if {@code reraise} is set
    */
   @Override
   public void close() throws Exception
   {
      if (terminate) {
         terminate();
      }

      join(timeoutMillis, TimeUnit.MILLISECONDS);
   }

   /**
    * @return the target's returned value, once a join observed the child's termination
    */
   public Object getResult()
   {
      return result;
   }

   /**
    * @return the exception the target threw, once a join observed the child's termination
    */
   public Throwable getException()
   {
      return exception;
   }

   /**
    * @return the conversation, or {@code null} if the target is not a {@link ChildGenerator}
    */
   public Conversation getConversation()
   {
      return conversation;
   }

   public String getName()
   {
      return name;
   }

   public long getTimeout(TimeUnit unit)
   {
      return unit.convert(timeoutMillis, TimeUnit.MILLISECONDS);
   }

   public boolean isTerminate()
   {
      return terminate;
   }

   public boolean isReraise()
   {
      return reraise;
   }

   public boolean isDaemon()
   {
      return daemon;
   }

   /**
    * @return the child's process id
    * @throws IllegalStateException if not started
    */
   public int getPid()
   {
      return started().getPid();
   }

   /**
    * @return the child's exit status, or {@code null} if not started or still running
    */
   public Integer getExitCode()
   {
      SpawnedChild spawned = child;
      return spawned == null ? null : spawned.getExitCode();
   }

   @Override
   public String toString()
   {
      return "IsolatedProcess[" + name + (child != null ? ", " + child : "") + "]";
   }

   private SpawnedChild started()
   {
      SpawnedChild spawned = child;
      if (spawned == null) {
         throw new IllegalStateException("Process " + name + " was not started");
      }

      return spawned;
   }

   private boolean isReraisedChildException(Throwable failure)
   {
      return reraise && failure != null && (failure == exception || failure instanceof ChildProcessException);
   }

   private synchronized boolean collect(SpawnedChild spawned, boolean exited) throws Exception
   {
      if (exited) {
         ChildReaper.forget(spawned);
         spawned.closeInput();

         if (!errorChannel.isEmpty()) {
            ChildFailure failure = (ChildFailure) errorChannel.take();
            exception = failure.toThrowable(loader);
         }
         if (!resultChannel.isEmpty()) {
            try {
               result = resultChannel.take();
            }
            catch (IllegalStateException e) {
               exception = e;
            }
         }
      }
      else {
         LOGGER.log(Level.FINE, name + " is still running after join timeout");
      }

      Throwable captured = exception;
      if (reraise && captured != null) {
         if (captured instanceof Exception) {
            throw (Exception) captured;
         }
         else if (captured instanceof Error) {
            throw (Error) captured;
         }
         throw new ChildProcessException(ChildFailure.of(captured));
      }

      return exited;
   }

   private void onFrame(Frame frame)
   {
      switch (frame.kind()) {
      case YIELD:
         if (childToParent != null) {
            childToParent.deliver(frame.payload());
            return;
         }
         break;
      case RESULT:
         resultChannel.deliver(frame.payload());
         return;
      case ERROR:
         errorChannel.deliver(frame.payload());
         return;
      default:
         break;
      }

      LOGGER.log(Level.WARNING, "Ignoring unexpected " + frame + " from " + name);
   }

   /**
    * Writes parent-to-child frames, once the child exists.
    */
   private final class ChildWriter implements FrameWriter
   {
      @Override
      public void write(Frame frame)
      {
         started().write(frame);
      }
   }
}
