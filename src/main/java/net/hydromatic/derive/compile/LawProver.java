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

import com.google.common.collect.ImmutableList;
import net.hydromatic.derive.eval.Capability;
import net.hydromatic.derive.type.DataType;

/**
 * Establishes the laws of a synthesized operation.
 *
 * <p>The proof is by case split over the constructors of the datatype. Each
 * case uses the constructor's unfolding equation, and, for each nested
 * field, the laws of the capabilities of the outer types. If every case
 * goes through, the prover emits one {@link LawObligation} per law of the
 * operation's kind.
 */
public class LawProver {
  private final Context context;

  LawProver(Context context) {
    this.context = requireNonNull(context);
  }

  /**
   * Returns a copy of an operation with its laws.
   *
   * @throws DeriveException if a constructor has no equation
   * @throws MissingCapabilityLawException if the laws of the capability of a
   *   nested field's outer type have not been established
   */
  public SynthesizedOp prove(SynthesizedOp op) {
    final DataType decl = context.decl;
    final ImmutableList.Builder<String> cases = ImmutableList.builder();
    for (DataType.TyCon tyCon : decl.tyCons) {
      if (op.equation(tyCon.name) == null) {
        throw new DeriveException("missing equation for " + op.name
            + " on constructor " + decl.name + "." + tyCon.name,
            decl.pos(tyCon));
      }
      final ImmutableList<Classification> classifications =
          context.classifications(tyCon);
      for (int i = 0; i < classifications.size(); i++) {
        for (String head : classifications.get(i).heads()) {
          final Capability capability = context.env.lookupCapability(head);
          if (capability == null) {
            throw new MissingCapabilityException("type " + head
                + " has no capability", context.pos(tyCon, i));
          }
          if (!capability.lawful()) {
            throw new MissingCapabilityLawException("laws of capability "
                + head + " are not established; cannot prove laws of "
                + op.name, context.pos(tyCon, i));
          }
        }
      }
      cases.add(tyCon.name);
    }
    final ImmutableList.Builder<LawObligation> laws = ImmutableList.builder();
    for (Law law : Law.values()) {
      if (law.kind == op.kind) {
        laws.add(new LawObligation(law, op.name, cases.build()));
      }
    }
    return op.withLaws(laws.build());
  }
}

// End LawProver.java
