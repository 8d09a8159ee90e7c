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

/**
 * The unit of work run inside the child JVM of an {@link IsolatedProcess}.
 * <p>
 * A target is either a {@link ChildFunction}, which runs to completion and
 * produces one result or one exception, or a {@link ChildGenerator}, which
 * produces a {@link Generator} that converses with the parent through
 * {@link IsolatedProcess#get()} and {@link IsolatedProcess#send(Object)}.
 * <p>
 * Targets are serialized and shipped to the child, so implementations (and
 * lambdas assigned to them) must not capture anything that is not
 * {@link Serializable}. The child runs with the same class path as the
 * parent, so the target's class is resolvable there.
 */
public interface ChildTarget extends Serializable
{
}
