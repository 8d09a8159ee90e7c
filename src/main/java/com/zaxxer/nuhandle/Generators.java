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

import java.util.Arrays;

/**
 * Ready-made {@link ChildGenerator} implementations.
 */
public final class Generators
{
   private Generators()
   {
   }

   /**
    * A generator target that yields the given values in order, ignoring
    * whatever the parent sends back, and then ends.
    *
    * @param values the values to yield, each {@link java.io.Serializable}
    * @return a generator target
    */
   public static ChildGenerator of(Object... values)
   {
      return new ValuesGenerator(values.clone());
   }

   private static final class ValuesGenerator implements ChildGenerator
   {
      private static final long serialVersionUID = 1L;

      private final Object[] values;

      ValuesGenerator(Object[] values)
      {
         this.values = values;
      }

      @Override
      public Generator create(Arguments arguments)
      {
         return new Generator() {
            private int index;

            @Override
            public Step next(Object sent)
            {
               return index < values.length ? Step.yielded(values[index++]) : Step.done();
            }
         };
      }

      @Override
      public String toString()
      {
         return "Generators.of" + Arrays.toString(values);
      }
   }
}
