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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies the daemon policy when the parent JVM exits while children are
 * still running: daemon children are killed, the others are waited for.
 */
public final class ChildReaper
{
   private static final Logger LOGGER = Logger.getLogger(ChildReaper.class.getCanonicalName());

   private static final Map<SpawnedChild, Boolean> LIVE_CHILDREN = new ConcurrentHashMap<SpawnedChild, Boolean>();

   static {
      Runtime.getRuntime().addShutdownHook(new Thread(new Runnable() {
         @Override
         public void run()
         {
            reap();
         }
      }, "nuhandle-reaper"));
   }

   private ChildReaper()
   {
   }

   public static void register(SpawnedChild child, boolean daemon)
   {
      LIVE_CHILDREN.put(child, daemon);
      if (!child.isAlive()) {
         // exited before it was registered
         LIVE_CHILDREN.remove(child);
      }
   }

   public static void forget(SpawnedChild child)
   {
      LIVE_CHILDREN.remove(child);
   }

   static boolean isRegistered(SpawnedChild child)
   {
      return LIVE_CHILDREN.containsKey(child);
   }

   static void reap()
   {
      for (Map.Entry<SpawnedChild, Boolean> entry : LIVE_CHILDREN.entrySet()) {
         SpawnedChild child = entry.getKey();
         if (!child.isAlive()) {
            continue;
         }

         if (entry.getValue()) {
            LOGGER.log(Level.FINE, "Killing daemon " + child);
            child.terminate();
         }
         else {
            LOGGER.log(Level.FINE, "Waiting for non-daemon " + child);
            try {
               child.waitFor();
            }
            catch (InterruptedException e) {
               Thread.currentThread().interrupt();
               return;
            }
         }
      }

      LIVE_CHILDREN.clear();
   }
}
