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

import java.util.List;

/**
 * Launches child processes whose stdout carries {@link Frame frames}.
 */
public interface ChildSpawner
{
   /**
    * @param command the program and its arguments
    * @param listener receives every frame the child writes to its stdout
    * @return the running child
    * @throws IllegalStateException if the process could not be launched
    */
   SpawnedChild spawn(List<String> command, FrameListener listener);
}
