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

import com.zaxxer.nuhandle.Channel;

/**
 * The writing end of a cross-process channel: every value put is serialized
 * into a frame of a fixed {@link Frame.Kind} and handed to a
 * {@link FrameWriter}.
 */
public final class OutboundChannel implements Channel<Object>
{
   private final Frame.Kind kind;
   private final FrameWriter writer;

   public OutboundChannel(Frame.Kind kind, FrameWriter writer)
   {
      this.kind = kind;
      this.writer = writer;
   }

   @Override
   public void put(Object value)
   {
      writer.write(Frame.of(kind, value));
   }

   @Override
   public Object take()
   {
      throw new UnsupportedOperationException("Outbound channels are write-only");
   }
}
