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

import java.io.DataInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * One message between parent and child. On the wire a frame is a one byte
 * {@link Kind} code, a four byte big-endian payload length and the payload,
 * which is a Java-serialized object (see {@link Payloads}).
 * <p>
 * The parent writes {@link Kind#INVOKE} and {@link Kind#SEND} frames to the
 * child's stdin; the child writes {@link Kind#YIELD}, {@link Kind#RESULT} and
 * {@link Kind#ERROR} frames to its stdout.
 */
public final class Frame
{
   public static final int HEADER_SIZE = 5;
   public static final int MAX_PAYLOAD_SIZE = 512 * 1024 * 1024;

   public enum Kind
   {
      /** the {@link Invocation}, always the first frame sent to a child */
      INVOKE(1),
      /** a value sent to the child's conversation */
      SEND(2),
      /** a value yielded by the child's conversation */
      YIELD(3),
      /** the target's return value */
      RESULT(4),
      /** a {@link com.zaxxer.nuhandle.ChildFailure} describing what the target threw */
      ERROR(5);

      private final byte code;

      Kind(int code)
      {
         this.code = (byte) code;
      }

      static Kind of(int code)
      {
         for (Kind kind : values()) {
            if (kind.code == code) {
               return kind;
            }
         }

         throw new IllegalArgumentException("Unknown frame kind " + code);
      }
   }

   private final Kind kind;
   private final byte[] payload;

   public Frame(Kind kind, byte[] payload)
   {
      this.kind = kind;
      this.payload = payload;
   }

   /**
    * Serialize {@code value} into a new frame.
    *
    * @param kind the frame kind
    * @param value a {@link java.io.Serializable} value or {@code null}
    * @return the frame
    * @throws IllegalArgumentException if the value cannot be serialized
    */
   public static Frame of(Kind kind, Object value)
   {
      return new Frame(kind, Payloads.serialize(value));
   }

   public Kind kind()
   {
      return kind;
   }

   public byte[] payload()
   {
      return payload;
   }

   /**
    * @return a flipped buffer holding the encoded frame
    */
   public ByteBuffer encode()
   {
      ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE + payload.length);
      buffer.put(kind.code).putInt(payload.length).put(payload);
      buffer.flip();
      return buffer;
   }

   /**
    * Blocking read of the next frame.
    *
    * @param in the stream to read from
    * @return the frame, or {@code null} at end of stream on a frame boundary
    * @throws IOException on a read error or a stream truncated mid-frame
    */
   public static Frame read(DataInputStream in) throws IOException
   {
      int code = in.read();
      if (code < 0) {
         return null;
      }

      int length = in.readInt();
      try {
         checkLength(length);
         Kind kind = Kind.of(code);

         byte[] payload = new byte[length];
         in.readFully(payload);
         return new Frame(kind, payload);
      }
      catch (IllegalArgumentException | IllegalStateException e) {
         throw new IOException(e.getMessage(), e);
      }
   }

   static void checkLength(int length)
   {
      if (length < 0 || length > MAX_PAYLOAD_SIZE) {
         throw new IllegalStateException("Corrupt frame, payload length " + length);
      }
   }

   @Override
   public String toString()
   {
      return kind + "[" + payload.length + " bytes]";
   }
}
