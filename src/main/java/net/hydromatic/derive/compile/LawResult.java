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
package net.hydromatic.derive.compile;

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of checking a {@link LawObligation}. */
public class LawResult {
  public final LawObligation obligation;
  /** Number of values for which the law was checked, over all cases. */
  public final int valueCount;
  /** Why the law could not be checked, or null if it was checked. */
  public final @Nullable String reason;

  LawResult(LawObligation obligation, int valueCount,
      @Nullable String reason) {
    this.obligation = requireNonNull(obligation);
    this.valueCount = valueCount;
    this.reason = reason;
  }

  /** Creates a result for a law that holds for every value checked. */
  static LawResult holds(LawObligation obligation, int valueCount) {
    return new LawResult(obligation, valueCount, null);
  }

  /** Creates a result for a law for which no values could be generated. */
  static LawResult notChecked(LawObligation obligation, String reason) {
    return new LawResult(obligation, 0, requireNonNull(reason));
  }

  /** Returns whether the law was checked against values. */
  public boolean checked() {
    return reason == null;
  }

  @Override
  public String toString() {
    if (reason != null) {
      return obligation.law + " not checked for " + obligation.opName
          + ": " + reason;
    }
    return obligation.law + " holds for " + obligation.opName + " ("
        + valueCount + " values)";
  }
}

// End LawResult.java
