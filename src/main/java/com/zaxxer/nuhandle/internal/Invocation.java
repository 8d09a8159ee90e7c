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

import java.io.Serializable;

import com.zaxxer.nuhandle.Arguments;
import com.zaxxer.nuhandle.ChildTarget;

/**
 * Everything the child needs to run: the payload of the {@link Frame.Kind#INVOKE} frame.
 */
public final class Invocation implements Serializable
{
   private static final long serialVersionUID = 1L;

   private final String name;
   private final ChildTarget target;
   private final Arguments arguments;
   private final boolean daemon;

   public Invocation(String name, ChildTarget target, Arguments arguments, boolean daemon)
   {
      this.name = name;
      this.target = target;
      this.arguments = arguments;
      this.daemon = daemon;
   }

   public String getName()
   {
      return name;
   }

   public ChildTarget getTarget()
   {
      return target;
   }

   public Arguments getArguments()
   {
      return arguments;
   }

   public boolean isDaemon()
   {
      return daemon;
   }
}
