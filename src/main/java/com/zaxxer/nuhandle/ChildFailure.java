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

import java.io.PrintWriter;
import java.io.Serializable;
import java.io.StringWriter;
import java.lang.reflect.Constructor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serializable description of an exception raised in a child process: the
 * exception's class name, its message and its printed stack trace. Live
 * exception objects never cross the process boundary; the parent rebuilds
 * one from this descriptor with {@link #toThrowable(ClassLoader)}.
 */
public final class ChildFailure implements Serializable
{
   private static final long serialVersionUID = 1L;

   private static final Logger LOGGER = Logger.getLogger(ChildFailure.class.getCanonicalName());

   private final String kind;
   private final String message;
   private final String trace;

   public ChildFailure(String kind, String message, String trace)
   {
      if (kind == null) {
         throw new IllegalArgumentException("A failure kind must be specified");
      }

      this.kind = kind;
      this.message = message;
      this.trace = trace;
   }

   public static ChildFailure of(Throwable throwable)
   {
      StringWriter trace = new StringWriter();
      throwable.printStackTrace(new PrintWriter(trace, true));
      return new ChildFailure(throwable.getClass().getName(), throwable.getMessage(), trace.toString());
   }

   public String getKind()
   {
      return kind;
   }

   public String getMessage()
   {
      return message;
   }

   public String getTrace()
   {
      return trace;
   }

   /**
    * Rebuild the exception in the calling JVM.
    * <p>
    * If {@link #getKind()} names a {@link Throwable} loadable through
    * {@code loader} with a public no-argument constructor (when there is no
    * message) or a {@code (String)} or {@code (Object)} constructor, an
    * instance of that type is returned, with a {@link ChildProcessException}
    * holding the child's stack trace attached as suppressed. Otherwise the
    * {@link ChildProcessException} itself is returned.
    *
    * @param loader the class loader to resolve {@link #getKind()} with
    * @return the rebuilt exception, never {@code null}
    */
   public Throwable toThrowable(ClassLoader loader)
   {
      ChildProcessException remote = new ChildProcessException(this);

      Throwable rebuilt = rebuild(loader);
      if (rebuilt == null) {
         return remote;
      }

      rebuilt.addSuppressed(remote);
      return rebuilt;
   }

   private Throwable rebuild(ClassLoader loader)
   {
      try {
         Class<?> type = Class.forName(kind, false, loader);
         if (!Throwable.class.isAssignableFrom(type)) {
            return null;
         }

         if (message == null) {
            Constructor<?> constructor = findConstructor(type, null);
            if (constructor != null) {
               return (Throwable) constructor.newInstance();
            }
         }

         for (Class<?> parameter : new Class<?>[] { String.class, Object.class }) {
            Constructor<?> constructor = findConstructor(type, parameter);
            if (constructor != null) {
               return (Throwable) constructor.newInstance(message);
            }
         }
      }
      catch (ReflectiveOperationException | LinkageError | RuntimeException e) {
         LOGGER.log(Level.FINE, "Cannot rebuild child exception " + kind, e);
      }

      return null;
   }

   private static Constructor<?> findConstructor(Class<?> type, Class<?> parameter)
   {
      try {
         return parameter == null ? type.getConstructor() : type.getConstructor(parameter);
      }
      catch (NoSuchMethodException e) {
         return null;
      }
   }

   @Override
   public String toString()
   {
      return message == null ? kind : kind + ": " + message;
   }
}
