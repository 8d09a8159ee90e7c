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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import com.zaxxer.nuhandle.internal.ChildSpawner;
import com.zaxxer.nuhandle.internal.NuChildSpawner;
import com.zaxxer.nuhandle.internal.Settings;

/**
 * Collects the attributes of an {@link IsolatedProcess}.
 * <p>
 * Defaults: no arguments, a timeout of one second (see
 * {@link Settings#TIMEOUT_PROPERTY}), no forced termination, no re-raising
 * of child exceptions, and a daemon child.
 * <p>
 * The {@link #build()} method can be invoked repeatedly to create
 * independent handles with identical attributes.
 */
public class IsolatedProcessBuilder
{
   private final ChildTarget target;
   private final List<Object> args;
   private final Map<String, Object> kwargs;
   private long timeoutMillis;
   private boolean terminate;
   private boolean reraise;
   private boolean daemon;
   private String name;
   private ChildSpawner spawner;

   /**
    * @param target a {@link ChildFunction} or a {@link ChildGenerator}
    */
   public IsolatedProcessBuilder(ChildTarget target)
   {
      if (target == null) {
         throw new IllegalArgumentException("A target must be specified");
      }

      this.target = target;
      this.args = new ArrayList<Object>();
      this.kwargs = new LinkedHashMap<String, Object>();
      this.timeoutMillis = Settings.getDefaultTimeoutMillis();
      this.daemon = true;
      this.spawner = NuChildSpawner.INSTANCE;
   }

   /**
    * Append positional arguments.
    *
    * @param values {@link java.io.Serializable} values
    * @return this builder
    */
   public IsolatedProcessBuilder args(Object... values)
   {
      args.addAll(Arrays.asList(values));
      return this;
   }

   /**
    * Bind a named argument.
    *
    * @param key the argument name
    * @param value a {@link java.io.Serializable} value
    * @return this builder
    */
   public IsolatedProcessBuilder kwarg(String key, Object value)
   {
      if (key == null) {
         throw new IllegalArgumentException("Argument names may not be null");
      }

      kwargs.put(key, value);
      return this;
   }

   public IsolatedProcessBuilder kwargs(Map<String, ?> values)
   {
      for (Map.Entry<String, ?> entry : values.entrySet()) {
         kwarg(entry.getKey(), entry.getValue());
      }
      return this;
   }

   /**
    * How long scope exit waits for the child to finish. Waiting does not kill.
    *
    * @param timeout the timeout, zero to only check
    * @param unit the unit of {@code timeout}
    * @return this builder
    */
   public IsolatedProcessBuilder timeout(long timeout, TimeUnit unit)
   {
      if (timeout < 0) {
         throw new IllegalArgumentException("Timeout may not be negative");
      }

      this.timeoutMillis = unit.toMillis(timeout);
      return this;
   }

   /**
    * @param terminate kill the child when the scope exits, however it ends
    * @return this builder
    */
   public IsolatedProcessBuilder terminate(boolean terminate)
   {
      this.terminate = terminate;
      return this;
   }

   /**
    * @param reraise throw the child's exception from {@code join} and on scope exit
    * @return this builder
    */
   public IsolatedProcessBuilder reraise(boolean reraise)
   {
      this.reraise = reraise;
      return this;
   }

   /**
    * @param daemon kill the child instead of waiting for it if the parent JVM exits first
    * @return this builder
    */
   public IsolatedProcessBuilder daemon(boolean daemon)
   {
      this.daemon = daemon;
      return this;
   }

   /**
    * @param name the display name used in logs and error messages
    * @return this builder
    */
   public IsolatedProcessBuilder name(String name)
   {
      this.name = name;
      return this;
   }

   IsolatedProcessBuilder spawner(ChildSpawner spawner)
   {
      this.spawner = spawner;
      return this;
   }

   public IsolatedProcess build()
   {
      return new IsolatedProcess(this);
   }

   /**
    * Build the handle and start its child.
    *
    * @return the started handle
    */
   public IsolatedProcess start()
   {
      IsolatedProcess process = build();
      process.start();
      return process;
   }

   ChildTarget getTarget()
   {
      return target;
   }

   Arguments getArguments()
   {
      return new Arguments(args, kwargs);
   }

   long getTimeoutMillis()
   {
      return timeoutMillis;
   }

   boolean isTerminate()
   {
      return terminate;
   }

   boolean isReraise()
   {
      return reraise;
   }

   boolean isDaemon()
   {
      return daemon;
   }

   String getName()
   {
      return name != null ? name : target.getClass().getName();
   }

   ChildSpawner getSpawner()
   {
      return spawner;
   }
}
