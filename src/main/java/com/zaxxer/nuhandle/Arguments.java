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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Positional and named arguments bound to an {@link IsolatedProcess} at
 * construction and handed to its {@link ChildTarget} in the child.
 */
public final class Arguments implements Serializable
{
   private static final long serialVersionUID = 1L;

   private static final Arguments NONE = new Arguments(Collections.emptyList(), Collections.<String, Object>emptyMap());

   private final ArrayList<Object> positional;
   private final LinkedHashMap<String, Object> keywords;

   public Arguments(List<?> positional, Map<String, ?> keywords)
   {
      this.positional = new ArrayList<Object>(positional);
      this.keywords = new LinkedHashMap<String, Object>(keywords);
   }

   public static Arguments none()
   {
      return NONE;
   }

   public static Arguments of(Object... positional)
   {
      return new Arguments(Arrays.asList(positional), Collections.<String, Object>emptyMap());
   }

   /**
    * @return the number of positional arguments
    */
   public int size()
   {
      return positional.size();
   }

   @SuppressWarnings("unchecked")
   public <T> T get(int index)
   {
      if (index < 0 || index >= positional.size()) {
         throw new IndexOutOfBoundsException("No positional argument " + index + ", " + positional.size() + " given");
      }

      return (T) positional.get(index);
   }

   @SuppressWarnings("unchecked")
   public <T> T get(String name)
   {
      if (!keywords.containsKey(name)) {
         throw new IllegalArgumentException("No named argument '" + name + "'");
      }

      return (T) keywords.get(name);
   }

   @SuppressWarnings("unchecked")
   public <T> T get(String name, T defaultValue)
   {
      return keywords.containsKey(name) ? (T) keywords.get(name) : defaultValue;
   }

   public boolean has(String name)
   {
      return keywords.containsKey(name);
   }

   public List<Object> positional()
   {
      return Collections.unmodifiableList(positional);
   }

   public Map<String, Object> keywords()
   {
      return Collections.unmodifiableMap(keywords);
   }

   @Override
   public String toString()
   {
      return "Arguments" + positional + keywords;
   }
}
