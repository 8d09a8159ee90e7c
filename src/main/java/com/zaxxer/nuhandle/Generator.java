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
 * An explicit yield/send state machine.
 * <p>
 * {@link #next(Object)} is first invoked with {@code null}. Each invocation
 * returns either {@link Step#yielded(Object)}, suspending the generator
 * until the parent sends the next value, or {@link Step#done()}, ending it.
 * The value passed to the following {@code next} call is the one the parent
 * sent in response to the previous yield.
 */
public interface Generator
{
   /**
    * Resume the generator.
    *
    * @param sent the value sent by the parent in reply to the last yield,
    *        {@code null} on the first call or after {@link IsolatedProcess#go()}
    * @return the next step
    * @throws Exception any failure, which ends the conversation
    */
   Step next(Object sent) throws Exception;

   /**
    * Invoked once when {@link #next(Object)} throws, before the failure
    * leaves the child. Release resources held across yields here.
    *
    * @param failure the throwable raised by {@code next}
    */
   default void abort(Throwable failure)
   {
   }
}
