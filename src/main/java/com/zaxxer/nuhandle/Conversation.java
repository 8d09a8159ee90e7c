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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bridges a {@link ChildGenerator} running in a child process and its parent
 * with two FIFO {@link Channel channels}: child-to-parent carries yielded
 * values, parent-to-child carries sent values.
 * <p>
 * The same class serves both sides. In the child, {@link #start(Arguments)}
 * drives the generator; in the parent, {@link #getFromChild()} and
 * {@link #sendToChild(Object)} talk to it. Each side is constructed over its
 * own ends of the two channels.
 * <p>
 * <b>For every yield of the generator the parent must get one value and send
 * one value back</b>, including the last one: the generator only ends when
 * the reply to its final yield arrives. A missing final
 * {@link #sendToChild(Object)} leaves the child blocked forever, and with it
 * any join on the process. This is not detected.
 */
public class Conversation
{
   private static final Logger LOGGER = Logger.getLogger(Conversation.class.getCanonicalName());

   /**
    * Child-side progress of the conversation.
    */
   public enum State
   {
      CREATED,
      RUNNING,
      WAITING_FOR_PARENT,
      TERMINATED,
      FAILED
   }

   private final ChildGenerator function;
   private final Channel<Object> childToParent;
   private final Channel<Object> parentToChild;
   private volatile State state = State.CREATED;

   public Conversation(ChildGenerator function, Channel<Object> childToParent, Channel<Object> parentToChild)
   {
      if (function == null) {
         throw new IllegalArgumentException("Conversations require a generator target");
      }

      this.function = function;
      this.childToParent = childToParent;
      this.parentToChild = parentToChild;
   }

   /**
    * Runs in the child. Creates the generator and drives it until it is done,
    * pushing every yielded value to the parent and resuming the generator with
    * each value the parent sends back.
    *
    * @param arguments the arguments bound to the process
    * @return the value of the terminal {@link Step}, usually {@code null}
    * @throws Exception whatever the generator threw, after {@link Generator#abort(Throwable)}
    */
   public Object start(Arguments arguments) throws Exception
   {
      Generator generator = function.create(arguments);
      state = State.RUNNING;

      Step step = advance(generator, null);
      while (!step.isDone()) {
         childToParent.put(step.value());

         state = State.WAITING_FOR_PARENT;
         Object fromParent = parentToChild.take();
         state = State.RUNNING;

         step = advance(generator, fromParent);
      }

      state = State.TERMINATED;
      return step.value();
   }

   /**
    * Runs in the parent. Blocks until the child yields a value not yet
    * retrieved; values come back in yield order.
    *
    * @return the oldest undelivered yielded value
    * @throws InterruptedException if interrupted while waiting
    */
   public Object getFromChild() throws InterruptedException
   {
      return childToParent.take();
   }

   /**
    * Runs in the parent. Enqueues the reply to the oldest unanswered yield;
    * never blocks.
    *
    * @param value the value the pending yield evaluates to in the child
    */
   public void sendToChild(Object value)
   {
      parentToChild.put(value);
   }

   public ChildGenerator getFunction()
   {
      return function;
   }

   public State getState()
   {
      return state;
   }

   private Step advance(Generator generator, Object sent) throws Exception
   {
      try {
         return generator.next(sent);
      }
      catch (Exception | Error e) {
         state = State.FAILED;
         try {
            generator.abort(e);
         }
         catch (RuntimeException cleanup) {
            LOGGER.log(Level.WARNING, "Generator cleanup failed", cleanup);
            e.addSuppressed(cleanup);
         }
         throw e;
      }
   }
}
