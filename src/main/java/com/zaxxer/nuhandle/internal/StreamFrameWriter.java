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

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;

/**
 * Writes frames to a blocking {@link OutputStream}, flushing after each one.
 * Used by the child for its stdout.
 */
final class StreamFrameWriter implements FrameWriter
{
   private final OutputStream out;

   StreamFrameWriter(OutputStream out)
   {
      this.out = out;
   }

   @Override
   public synchronized void write(Frame frame)
   {
      ByteBuffer encoded = frame.encode();
      try {
         out.write(encoded.array(), encoded.arrayOffset(), encoded.limit());
         out.flush();
      }
      catch (IOException e) {
         throw new UncheckedIOException("Cannot write " + frame.kind() + " frame to parent", e);
      }
   }
}
