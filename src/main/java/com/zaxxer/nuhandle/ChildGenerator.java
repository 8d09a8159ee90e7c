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
 * A {@link ChildTarget} producing a {@link Generator}. An
 * {@link IsolatedProcess} constructed with one of these wraps it in a
 * {@link Conversation}: every value the generator yields is delivered to
 * {@link IsolatedProcess#get()}, and every value passed to
 * {@link IsolatedProcess#send(Object)} resumes it.
 */
public interface ChildGenerator extends ChildTarget
{
   Generator create(Arguments arguments) throws Exception;
}
