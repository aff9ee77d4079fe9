/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.derive.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Value of the logging applicative: a value together with the messages
 * that were written while computing it, in order.
 *
 * <p>Because the log is ordered, the logging applicative is not commutative,
 * and so reveals the order in which effects are sequenced.
 */
public class Logged {
  public final Object value;
  public final ImmutableList<String> log;

  public Logged(Object value, List<String> log) {
    this.value = requireNonNull(value);
    this.log = ImmutableList.copyOf(log);
  }

  /** Creates a value that writes one message. */
  public static Logged of(Object value, String message) {
    return new Logged(value, ImmutableList.of(message));
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, log);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Logged
            && value.equals(((Logged) o).value)
            && log.equals(((Logged) o).log);
  }

  @Override
  public String toString() {
    return "Logged(" + value + ", " + log + ")";
  }
}

// End Logged.java
