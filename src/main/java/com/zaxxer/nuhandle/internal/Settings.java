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

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.sun.jna.Platform;

/**
 * System property driven configuration.
 */
public final class Settings
{
   private static final Logger LOGGER = Logger.getLogger(Settings.class.getCanonicalName());

   public static final String TIMEOUT_PROPERTY = "com.zaxxer.nuhandle.timeout";
   public static final String JAVA_HOME_PROPERTY = "com.zaxxer.nuhandle.javaHome";
   public static final String JVM_ARGS_PROPERTY = "com.zaxxer.nuhandle.jvmArgs";

   static final long DEFAULT_TIMEOUT_MILLIS = 1000;
   static final long MAX_TIMEOUT_MILLIS = 24L * 60 * 60 * 1000;
   static final String DEFAULT_JVM_ARGS = "-XX:TieredStopAtLevel=1 -XX:+UseSerialGC";

   private static final String LOGGING_CONFIG_PROPERTY = "java.util.logging.config.file";

   private Settings()
   {
   }

   /**
    * @return the join timeout used on scope exit when none is configured, in milliseconds
    */
   public static long getDefaultTimeoutMillis()
   {
      final String timeoutProperty = System.getProperty(TIMEOUT_PROPERTY);
      if (timeoutProperty == null || timeoutProperty.trim().isEmpty()) {
         return DEFAULT_TIMEOUT_MILLIS;
      }
      try {
         final long value = Long.parseLong(timeoutProperty.trim());
         if (value < 0) {
            LOGGER.log(Level.WARNING, "Requested timeout of " + value + "ms is negative, defaulting to 0");
            return 0;
         }
         else if (value > MAX_TIMEOUT_MILLIS) {
            LOGGER.log(Level.WARNING, "Requested timeout of " + value + "ms is more than max, defaulting to max value of " + MAX_TIMEOUT_MILLIS);
            return MAX_TIMEOUT_MILLIS;
         }
         else {
            return value;
         }
      }
      catch (NumberFormatException e) {
         LOGGER.log(Level.WARNING, "Ignoring unparsable " + TIMEOUT_PROPERTY + " value '" + timeoutProperty + "'");
         return DEFAULT_TIMEOUT_MILLIS;
      }
   }

   /**
    * The command line of a child JVM: the parent's {@code java} executable,
    * the configured JVM options, the parent's class path and
    * {@link ChildMain}.
    *
    * @return a new, modifiable list
    */
   public static List<String> childCommand()
   {
      List<String> command = new ArrayList<String>();
      command.add(javaExecutable());
      command.addAll(jvmArguments());

      String loggingConfig = System.getProperty(LOGGING_CONFIG_PROPERTY);
      if (loggingConfig != null) {
         command.add("-D" + LOGGING_CONFIG_PROPERTY + "=" + loggingConfig);
      }

      command.add("-cp");
      command.add(System.getProperty("java.class.path"));
      command.add(ChildMain.class.getName());
      return command;
   }

   static String javaExecutable()
   {
      String javaHome = System.getProperty(JAVA_HOME_PROPERTY, System.getProperty("java.home"));
      return Paths.get(javaHome, "bin", Platform.isWindows() ? "java.exe" : "java").toString();
   }

   static List<String> jvmArguments()
   {
      String arguments = System.getProperty(JVM_ARGS_PROPERTY, DEFAULT_JVM_ARGS).trim();
      if (arguments.isEmpty()) {
         return new ArrayList<String>();
      }

      return new ArrayList<String>(Arrays.asList(arguments.split("\\s+")));
   }
}
