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

/**
 * The outcome of one {@link Generator#next(Object)} call: a yielded value or
 * the end of the generator.
 */
public final class Step
{
   private static final Step DONE = new Step(false, null);

   private final boolean yielded;
   private final Object value;

   private Step(boolean yielded, Object value)
   {
      this.yielded = yielded;
      this.value = value;
   }

   public static Step yielded(Object value)
   {
      return new Step(true, value);
   }

   public static Step done()
   {
      return DONE;
   }

   /**
    * End the generator with a value that becomes the process result.
    *
    * @param result the result of the conversation
    * @return a terminal step
    */
   public static Step done(Object result)
   {
      return result == null ? DONE : new Step(false, result);
   }

   public boolean isDone()
   {
      return !yielded;
   }

   /**
    * @return the yielded value, or the result of a terminal step
    */
   public Object value()
   {
      return value;
   }

   @Override
   public String toString()
   {
      return (yielded ? "Yielded(" : "Done(") + value + ")";
   }
}
