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
 * A {@link ChildTarget} that runs to completion in the child and either
 * returns a value or throws. The returned value becomes
 * {@link IsolatedProcess#getResult()}, a thrown exception becomes
 * {@link IsolatedProcess#getException()}.
 */
public interface ChildFunction extends ChildTarget
{
   /**
    * Run the unit of work.
    *
    * @param arguments the positional and named arguments bound to the process
    * @return the result, which must be {@link java.io.Serializable} (or {@code null})
    * @throws Exception any failure, captured as the process's exception
    */
   Object call(Arguments arguments) throws Exception;
}
