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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.FileDescriptor;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of a child JVM.
 * <p>
 * stdin carries frames from the parent: one {@link Frame.Kind#INVOKE} frame,
 * then any number of {@link Frame.Kind#SEND} frames. stdout is reserved for
 * frames to the parent; {@link System#out} is redirected to
 * {@link System#err} so that output of the target cannot corrupt it.
 * <p>
 * End of file on stdin means the parent is gone. A daemon child then exits
 * at once; a non-daemon child keeps running, but any further read of the
 * conversation fails with {@link com.zaxxer.nuhandle.ChannelClosedException}.
 */
public final class ChildMain
{
   private static final Logger LOGGER = Logger.getLogger(ChildMain.class.getCanonicalName());

   static final int EXIT_OK = 0;
   static final int EXIT_FAILED = 1;
   static final int EXIT_PROTOCOL = 2;
   static final int EXIT_ORPHANED = 3;

   private ChildMain()
   {
   }

   public static void main(String[] args)
   {
      OutputStream toParent = new BufferedOutputStream(new FileOutputStream(FileDescriptor.out));
      System.setOut(System.err);

      InputStream fromParent = new BufferedInputStream(new FileInputStream(FileDescriptor.in));
      System.exit(run(fromParent, toParent));
   }

   static int run(InputStream input, OutputStream output)
   {
      DataInputStream in = new DataInputStream(input);
      ClassLoader loader = ChildMain.class.getClassLoader();
      ChildSupervisor supervisor = new ChildSupervisor(new StreamFrameWriter(output));

      Frame first;
      try {
         first = Frame.read(in);
      }
      catch (IOException e) {
         LOGGER.log(Level.SEVERE, "Cannot read the invocation from the parent", e);
         return EXIT_PROTOCOL;
      }

      if (first == null || first.kind() != Frame.Kind.INVOKE) {
         LOGGER.log(Level.SEVERE, "Expected an INVOKE frame from the parent, got " + first);
         return EXIT_PROTOCOL;
      }

      Invocation invocation;
      try {
         invocation = (Invocation) Payloads.deserialize(first.payload(), loader);
      }
      catch (Exception | LinkageError e) {
         return supervisor.fail(e);
      }

      InboundChannel parentToChild = new InboundChannel("parent-to-child", loader);
      Thread pump = new Thread(new ParentPump(in, parentToChild, invocation.isDaemon()), "nuhandle-parent-pump");
      pump.setDaemon(true);
      pump.start();

      LOGGER.log(Level.FINE, "Running " + invocation.getName());
      return supervisor.run(invocation, parentToChild);
   }

   /**
    * Moves {@link Frame.Kind#SEND} payloads from stdin into the
    * parent-to-child channel.
    */
   private static final class ParentPump implements Runnable
   {
      private final DataInputStream in;
      private final InboundChannel parentToChild;
      private final boolean daemon;

      ParentPump(DataInputStream in, InboundChannel parentToChild, boolean daemon)
      {
         this.in = in;
         this.parentToChild = parentToChild;
         this.daemon = daemon;
      }

      @Override
      public void run()
      {
         try {
            Frame frame;
            while ((frame = Frame.read(in)) != null) {
               if (frame.kind() == Frame.Kind.SEND) {
                  parentToChild.deliver(frame.payload());
               }
               else {
                  LOGGER.log(Level.WARNING, "Ignoring unexpected " + frame + " from the parent");
               }
            }
         }
         catch (IOException e) {
            LOGGER.log(Level.FINE, "Channel from the parent failed", e);
         }
         finally {
            parentToChild.close();
         }

         if (daemon) {
            LOGGER.log(Level.FINE, "Parent is gone, exiting");
            Runtime.getRuntime().halt(EXIT_ORPHANED);
         }
      }
   }
}
