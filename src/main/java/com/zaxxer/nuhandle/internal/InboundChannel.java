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

import com.zaxxer.nuhandle.Channel;
import com.zaxxer.nuhandle.QueueChannel;

/**
 * The reading end of a cross-process channel. Frame payloads are delivered
 * raw by whatever pumps the underlying stream and deserialized on
 * {@link #take()}, in the reader's thread.
 */
public final class InboundChannel implements Channel<Object>
{
   private final QueueChannel<byte[]> payloads;
   private final ClassLoader loader;

   public InboundChannel(String name, ClassLoader loader)
   {
      this.payloads = new QueueChannel<byte[]>(name);
      this.loader = loader;
   }

   /**
    * Called by the single writer role, the stream pump.
    *
    * @param payload a serialized value
    */
   public void deliver(byte[] payload)
   {
      payloads.put(payload);
   }

   @Override
   public void put(Object value)
   {
      throw new UnsupportedOperationException("Inbound channels are read-only");
   }

   @Override
   public Object take() throws InterruptedException
   {
      byte[] payload = payloads.take();
      try {
         return Payloads.deserialize(payload, loader);
      }
      catch (IOException | ClassNotFoundException e) {
         throw new IllegalStateException("Cannot decode value received from the other process", e);
      }
   }

   public boolean isEmpty()
   {
      return payloads.isEmpty();
   }

   /**
    * Mark the end of the stream; see {@link QueueChannel#close()}.
    */
   public void close()
   {
      payloads.close();
   }
}
