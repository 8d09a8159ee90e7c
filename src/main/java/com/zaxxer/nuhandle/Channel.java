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
 * An unbounded, FIFO, one-directional message channel. Each channel has a
 * single writer role and a single reader role; an end that only plays one
 * of them rejects the other operation with
 * {@link UnsupportedOperationException}.
 *
 * @param <T> the type of values carried
 */
public interface Channel<T>
{
   /**
    * Enqueue a value without blocking. {@code null} is a legal value.
    *
    * @param value the value to enqueue
    */
   void put(T value);

   /**
    * Remove the oldest value, blocking until one is available.
    *
    * @return the oldest value not yet taken
    * @throws InterruptedException if interrupted while waiting
    * @throws ChannelClosedException if the channel was closed and is empty
    */
   T take() throws InterruptedException;
}
