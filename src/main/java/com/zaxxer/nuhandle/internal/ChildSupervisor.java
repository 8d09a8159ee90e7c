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

import java.io.UncheckedIOException;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.zaxxer.nuhandle.Channel;
import com.zaxxer.nuhandle.ChildFailure;
import com.zaxxer.nuhandle.ChildFunction;
import com.zaxxer.nuhandle.ChildGenerator;
import com.zaxxer.nuhandle.ChildTarget;
import com.zaxxer.nuhandle.Conversation;

/**
 * The failure boundary around a target inside the child. Exactly one outcome
 * frame is reported: {@link Frame.Kind#RESULT} with the returned value, or
 * {@link Frame.Kind#ERROR} with a {@link ChildFailure}.
 */
final class ChildSupervisor
{
   private static final Logger LOGGER = Logger.getLogger(ChildSupervisor.class.getCanonicalName());

   private final FrameWriter writer;

   ChildSupervisor(FrameWriter writer)
   {
      this.writer = writer;
   }

   /**
    * Run the invocation and report its outcome.
    *
    * @param invocation what to run
    * @param fromParent the parent-to-child channel, used by generator targets
    * @return the exit status for the child JVM
    */
   int run(Invocation invocation, Channel<Object> fromParent)
   {
      Frame outcome;
      int status;
      try {
         ChildFunction target = effectiveTarget(invocation.getTarget(), fromParent);
         Object result = target.call(invocation.getArguments());
         outcome = Frame.of(Frame.Kind.RESULT, result);
         status = ChildMain.EXIT_OK;
      }
      catch (Throwable t) {
         outcome = failure(t);
         status = ChildMain.EXIT_FAILED;
      }

      return deliver(outcome, status);
   }

   /**
    * Report a failure that happened before the target could run.
    *
    * @param t the failure
    * @return the exit status for the child JVM
    */
   int fail(Throwable t)
   {
      return deliver(failure(t), ChildMain.EXIT_FAILED);
   }

   /**
    * A generator target is replaced by the start routine of a
    * {@link Conversation} over it; a function target runs as is.
    */
   ChildFunction effectiveTarget(ChildTarget target, Channel<Object> fromParent)
   {
      if (target instanceof ChildGenerator) {
         Conversation conversation = new Conversation((ChildGenerator) target, new OutboundChannel(Frame.Kind.YIELD, writer), fromParent);
         return conversation::start;
      }
      else if (target instanceof ChildFunction) {
         return (ChildFunction) target;
      }

      throw new IllegalArgumentException("Unsupported target " + (target == null ? "null" : target.getClass().getName()));
   }

   private Frame failure(Throwable t)
   {
      LOGGER.log(Level.FINE, "Target failed", t);
      return Frame.of(Frame.Kind.ERROR, ChildFailure.of(t));
   }

   private int deliver(Frame outcome, int status)
   {
      try {
         writer.write(outcome);
         return status;
      }
      catch (UncheckedIOException e) {
         LOGGER.log(Level.SEVERE, "Cannot report " + outcome.kind() + " to the parent", e);
         return ChildMain.EXIT_PROTOCOL;
      }
   }
}
