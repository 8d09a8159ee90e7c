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

import java.util.concurrent.LinkedBlockingQueue;

/**
 * A {@link Channel} backed by an unbounded {@link LinkedBlockingQueue},
 * usable between threads of one JVM. Accepts {@code null} values.
 *
 * @param <T> the type of values carried
 */
public class QueueChannel<T> implements Channel<T>
{
   private static final Object NULL = new Object();
   private static final Object CLOSED = new Object();

   private final LinkedBlockingQueue<Object> queue;
   private final String name;
   private volatile boolean closed;

   public QueueChannel()
   {
      this("channel");
   }

   public QueueChannel(String name)
   {
      this.name = name;
      this.queue = new LinkedBlockingQueue<Object>();
   }

   @Override
   public void put(T value)
   {
      if (closed) {
         throw new ChannelClosedException(name + " is closed");
      }

      queue.add(value == null ? NULL : value);
   }

   @Override
   @SuppressWarnings("unchecked")
   public T take() throws InterruptedException
   {
      Object value = queue.take();
      if (value == CLOSED) {
         // leave the marker for any later reader
         queue.add(CLOSED);
         throw new ChannelClosedException(name + " was closed by its writer");
      }

      return value == NULL ? null : (T) value;
   }

   /**
    * @return {@code true} if no value is waiting to be taken
    */
   public boolean isEmpty()
   {
      Object head = queue.peek();
      return head == null || head == CLOSED;
   }

   /**
    * Close the channel. Values already enqueued can still be taken; once
    * they are exhausted, {@link #take()} throws {@link ChannelClosedException}
    * instead of blocking.
    */
   public void close()
   {
      if (!closed) {
         closed = true;
         queue.add(CLOSED);
      }
   }

   public boolean isClosed()
   {
      return closed;
   }
}
