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

import java.nio.ByteBuffer;

/**
 * Incremental decoder for frames arriving in arbitrary chunks, as delivered
 * by {@link com.zaxxer.nuprocess.NuProcessHandler#onStdout(ByteBuffer, boolean)}.
 * Every byte fed in is consumed; partial frames are kept until the rest
 * arrives. Not thread-safe: NuProcess delivers stdout of one process on a
 * single thread.
 */
public final class FrameDecoder
{
   static final int INITIAL_CAPACITY = 8 * 1024;

   private final FrameListener listener;
   private ByteBuffer pending;

   public FrameDecoder(FrameListener listener)
   {
      this.listener = listener;
      this.pending = ByteBuffer.allocate(INITIAL_CAPACITY);
   }

   /**
    * Consume all remaining bytes of {@code input}, passing every completed
    * frame to the listener in order.
    *
    * @param input the received bytes
    * @throws IllegalStateException if the stream is corrupt
    */
   public void feed(ByteBuffer input)
   {
      ensureCapacity(input.remaining());
      pending.put(input);
      pending.flip();
      try {
         while (pending.remaining() >= Frame.HEADER_SIZE) {
            pending.mark();
            int code = pending.get();
            int length = pending.getInt();
            Frame.checkLength(length);
            if (pending.remaining() < length) {
               pending.reset();
               break;
            }

            byte[] payload = new byte[length];
            pending.get(payload);
            listener.onFrame(new Frame(Frame.Kind.of(code), payload));
         }
      }
      finally {
         pending.compact();
      }
   }

   /**
    * @return the number of buffered bytes belonging to an incomplete frame
    */
   public int pendingBytes()
   {
      return pending.position();
   }

   private void ensureCapacity(int incoming)
   {
      if (pending.remaining() < incoming) {
         ByteBuffer grown = ByteBuffer.allocate(Math.max(pending.capacity() * 2, pending.position() + incoming));
         pending.flip();
         grown.put(pending);
         pending = grown;
      }
   }
}
