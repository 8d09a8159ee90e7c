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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamClass;

/**
 * Java serialization of frame payloads.
 */
public final class Payloads
{
   private Payloads()
   {
   }

   /**
    * @param value a {@link java.io.Serializable} value or {@code null}
    * @return the serialized form
    * @throws IllegalArgumentException if {@code value} is not serializable
    */
   public static byte[] serialize(Object value)
   {
      ByteArrayOutputStream bytes = new ByteArrayOutputStream();
      try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
         out.writeObject(value);
      }
      catch (IOException e) {
         throw new IllegalArgumentException("Cannot serialize " + describe(value) + ": " + e, e);
      }

      return bytes.toByteArray();
   }

   /**
    * @param payload the serialized form
    * @param loader the class loader that resolves classes named in the payload
    * @return the deserialized value
    * @throws IOException if the payload is corrupt
    * @throws ClassNotFoundException if a class of the payload cannot be resolved
    */
   public static Object deserialize(byte[] payload, ClassLoader loader) throws IOException, ClassNotFoundException
   {
      try (ObjectInputStream in = new LoaderObjectInputStream(new ByteArrayInputStream(payload), loader)) {
         return in.readObject();
      }
   }

   private static String describe(Object value)
   {
      return value == null ? "null" : value.getClass().getName();
   }

   private static final class LoaderObjectInputStream extends ObjectInputStream
   {
      private final ClassLoader loader;

      LoaderObjectInputStream(InputStream in, ClassLoader loader) throws IOException
      {
         super(in);
         this.loader = loader;
      }

      @Override
      protected Class<?> resolveClass(ObjectStreamClass desc) throws IOException, ClassNotFoundException
      {
         if (loader != null) {
            try {
               return Class.forName(desc.getName(), false, loader);
            }
            catch (ClassNotFoundException e) {
               // primitives and bootstrap classes
            }
         }

         return super.resolveClass(desc);
      }
   }
}
