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
 * An exception that escaped the target inside a child process, as seen from
 * the parent.
 * <p>
 * When the original exception type can be rebuilt in the parent, an instance
 * of this class is attached to it as a suppressed exception to carry the
 * child's stack trace. Otherwise it stands in for the original exception.
 */
public class ChildProcessException extends Exception
{
   private static final long serialVersionUID = 1L;

   private final String kind;
   private final String remoteMessage;
   private final String remoteStackTrace;

   public ChildProcessException(ChildFailure failure)
   {
      super(describe(failure));
      this.kind = failure.getKind();
      this.remoteMessage = failure.getMessage();
      this.remoteStackTrace = failure.getTrace();
   }

   /**
    * @return the fully qualified class name of the exception thrown in the child
    */
   public String getKind()
   {
      return kind;
   }

   public String getRemoteMessage()
   {
      return remoteMessage;
   }

   /**
    * @return the stack trace printed in the child, including causes
    */
   public String getRemoteStackTrace()
   {
      return remoteStackTrace;
   }

   private static String describe(ChildFailure failure)
   {
      String message = failure.getMessage() == null ? failure.getKind() : failure.getKind() + ": " + failure.getMessage();
      if (failure.getTrace() == null || failure.getTrace().isEmpty()) {
         return message;
      }

      return message + System.lineSeparator() + "Child stack trace:" + System.lineSeparator() + failure.getTrace();
   }
}
