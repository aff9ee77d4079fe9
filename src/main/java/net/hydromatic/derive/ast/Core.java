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
package net.hydromatic.derive.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.derive.compile.CapabilityKind;

/**
 * Core expressions.
 *
 * <p>These are the terms that the synthesizers generate: functions, case
 * analysis over type constructors, applications of type constructors and of
 * capability operations, and the three applicative operators {@link Pure},
 * {@link MapEffect} and {@link ApplyEffect}.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short.
 */
public class Core {
  private Core() {}

  /** Abstract base class of Core nodes. */
  abstract static class BaseNode extends AstNode {
    BaseNode(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Base class of Core expressions. */
  public abstract static class Exp extends BaseNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Exp accept(Shuttle shuttle);
  }

  /**
   * Named pattern, the parameter of a {@link Fn} or an argument of a {@link
   * ConPat}.
   */
  public static class IdPat extends BaseNode {
    public final String name;

    IdPat(String name) {
      super(Pos.ZERO, Op.ID_PAT);
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof IdPat && ((IdPat) obj).name.equals(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }

    @Override
    public IdPat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Returns an identifier that references this pattern. */
    public Id toId() {
      return new Id(name);
    }
  }

  /**
   * Type constructor pattern.
   *
   * <p>For example, in "{@code case x of Pair.mk (a0, a1) => ...}", "{@code
   * Pair.mk (a0, a1)}" is a type constructor pattern that binds {@code a0}
   * and {@code a1}.
   */
  public static class ConPat extends BaseNode {
    public final String typeName;
    public final String tyCon;
    public final ImmutableList<IdPat> args;

    ConPat(Pos pos, String typeName, String tyCon, ImmutableList<IdPat> args) {
      super(pos, Op.CON_PAT);
      this.typeName = requireNonNull(typeName);
      this.tyCon = requireNonNull(tyCon);
      this.args = requireNonNull(args);
    }

    /** Returns the qualified name of the constructor, e.g. "Pair.mk". */
    public String qualifiedName() {
      return typeName + "." + tyCon;
    }

    @Override
    public int hashCode() {
      return Objects.hash(typeName, tyCon, args);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof ConPat
              && ((ConPat) obj).typeName.equals(typeName)
              && ((ConPat) obj).tyCon.equals(tyCon)
              && ((ConPat) obj).args.equals(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.id(qualifiedName());
      if (!args.isEmpty()) {
        w.append(" (").appendAll(args, ", ").append(")");
      }
      return w;
    }

    @Override
    public ConPat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code ConPat} with given arguments,
     * or {@code this} if the arguments are the same. */
    public ConPat copy(List<IdPat> args) {
      return this.args.equals(args)
          ? this
          : new ConPat(pos, typeName, tyCon, ImmutableList.copyOf(args));
    }
  }

  /** Reference to a variable. */
  public static class Id extends Exp {
    public final String name;

    Id(String name) {
      super(Pos.ZERO, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Id && this.name.equals(((Id) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Reference to an operation of a capability, e.g. "{@code List.map}" or
   * "{@code Option.traverse}".
   *
   * <p>The operation transforms the last type argument of the type
   * constructor {@link #typeName}.
   */
  public static class CapabilityOp extends Exp {
    public final String typeName;
    public final CapabilityKind kind;

    CapabilityOp(String typeName, CapabilityKind kind) {
      super(Pos.ZERO, Op.CAPABILITY_OP);
      this.typeName = requireNonNull(typeName);
      this.kind = requireNonNull(kind);
    }

    @Override
    public int hashCode() {
      return Objects.hash(typeName, kind);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof CapabilityOp
              && this.typeName.equals(((CapabilityOp) o).typeName)
              && this.kind == ((CapabilityOp) o).kind;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(typeName).append(".").append(kind.opName);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Lambda expression, "{@code fn x => e}". */
  public static class Fn extends Exp {
    public final IdPat idPat;
    public final Exp exp;

    Fn(IdPat idPat, Exp exp) {
      super(Pos.ZERO, Op.FN);
      this.idPat = requireNonNull(idPat);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return Objects.hash(idPat, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Fn
              && idPat.equals(((Fn) o).idPat)
              && exp.equals(((Fn) o).exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("fn ").append(idPat, 0, 0).append(" => ")
          .append(exp, 0, 0);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Fn} with given contents,
     * or {@code this} if the contents are the same. */
    public Fn copy(IdPat idPat, Exp exp) {
      return this.idPat.equals(idPat) && this.exp.equals(exp)
          ? this
          : new Fn(idPat, exp);
    }
  }

  /** Application of a function to an argument, "{@code f x}". */
  public static class Apply extends Exp {
    public final Exp fn;
    public final Exp arg;

    Apply(Exp fn, Exp arg) {
      super(Pos.ZERO, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
              && fn.equals(((Apply) o).fn)
              && arg.equals(((Apply) o).arg);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, fn, op, arg, right);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Apply} with given contents,
     * or {@code this} if the contents are the same. */
    public Apply copy(Exp fn, Exp arg) {
      return this.fn.equals(fn) && this.arg.equals(arg)
          ? this
          : new Apply(fn, arg);
    }
  }

  /** Application of a type constructor to its fields,
   * "{@code Pair.mk (a, b)}". */
  public static class Con extends Exp {
    public final String typeName;
    public final String tyCon;
    public final ImmutableList<Exp> args;

    Con(Pos pos, String typeName, String tyCon, ImmutableList<Exp> args) {
      super(pos, Op.CON);
      this.typeName = requireNonNull(typeName);
      this.tyCon = requireNonNull(tyCon);
      this.args = requireNonNull(args);
    }

    /** Returns the qualified name of the constructor, e.g. "Pair.mk". */
    public String qualifiedName() {
      return typeName + "." + tyCon;
    }

    @Override
    public int hashCode() {
      return Objects.hash(typeName, tyCon, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Con
              && typeName.equals(((Con) o).typeName)
              && tyCon.equals(((Con) o).tyCon)
              && args.equals(((Con) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (args.isEmpty()) {
        return w.id(qualifiedName());
      }
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.id(qualifiedName()).append(" (").appendAll(args, ", ")
          .append(")");
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Con} with given arguments,
     * or {@code this} if the arguments are the same. */
    public Con copy(List<Exp> args) {
      return this.args.equals(args)
          ? this
          : new Con(pos, typeName, tyCon, ImmutableList.copyOf(args));
    }
  }

  /** Arm of a {@link Case}, "{@code pat => exp}". */
  public static class Match extends BaseNode {
    public final ConPat pat;
    public final Exp exp;

    Match(ConPat pat, Exp exp) {
      super(pat.pos, Op.MATCH);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return Objects.hash(pat, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Match
              && pat.equals(((Match) o).pat)
              && exp.equals(((Match) o).exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(pat, 0, 0).append(op.padded).append(exp, 0, right);
    }

    @Override
    public Match accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Match} with given contents,
     * or {@code this} if the contents are the same. */
    public Match copy(ConPat pat, Exp exp) {
      return this.pat.equals(pat) && this.exp.equals(exp)
          ? this
          : new Match(pat, exp);
    }
  }

  /** Case expression, "{@code case x of p1 => e1 | p2 => e2}". */
  public static class Case extends Exp {
    public final Exp exp;
    public final ImmutableList<Match> matchList;

    Case(Pos pos, Exp exp, ImmutableList<Match> matchList) {
      super(pos, Op.CASE);
      this.exp = requireNonNull(exp);
      this.matchList = requireNonNull(matchList);
    }

    @Override
    public int hashCode() {
      return Objects.hash(exp, matchList);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Case
              && exp.equals(((Case) o).exp)
              && matchList.equals(((Case) o).matchList);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append("case ").append(exp, 0, 0).append(" of ");
      return w.appendAll(matchList, Op.BAR.padded);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Case} with given contents,
     * or {@code this} if the contents are the same. */
    public Case copy(Exp exp, List<Match> matchList) {
      return this.exp.equals(exp) && this.matchList.equals(matchList)
          ? this
          : new Case(pos, exp, ImmutableList.copyOf(matchList));
    }
  }

  /** Embeds a pure value in the ambient applicative, "{@code pure e}". */
  public static class Pure extends Exp {
    public final Exp exp;

    Pure(Exp exp) {
      super(Pos.ZERO, Op.PURE);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return exp.hashCode() * 37 + 1;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Pure && exp.equals(((Pure) o).exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, "pure", exp, op, right);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Pure} with a given argument,
     * or {@code this} if the argument is the same. */
    public Pure copy(Exp exp) {
      return this.exp.equals(exp) ? this : new Pure(exp);
    }
  }

  /** Abstract base class of the two binary applicative operators. */
  public abstract static class EffectOp extends Exp {
    public final Exp fn;
    public final Exp arg;

    EffectOp(Op op, Exp fn, Exp arg) {
      super(Pos.ZERO, op);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, fn, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof EffectOp
              && op == ((EffectOp) o).op
              && fn.equals(((EffectOp) o).fn)
              && arg.equals(((EffectOp) o).arg);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, fn, op, arg, right);
    }

    /** Creates a copy of this operator with given contents,
     * or {@code this} if the contents are the same. */
    public abstract EffectOp copy(Exp fn, Exp arg);
  }

  /** Maps a pure function over an effectful value, "{@code f <$> e}". */
  public static class MapEffect extends EffectOp {
    MapEffect(Exp fn, Exp arg) {
      super(Op.MAP_EFFECT, fn, arg);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public MapEffect copy(Exp fn, Exp arg) {
      return this.fn.equals(fn) && this.arg.equals(arg)
          ? this
          : new MapEffect(fn, arg);
    }
  }

  /** Sequences an effectful function with an effectful argument,
   * "{@code ef <*> e}". */
  public static class ApplyEffect extends EffectOp {
    ApplyEffect(Exp fn, Exp arg) {
      super(Op.APPLY_EFFECT, fn, arg);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public ApplyEffect copy(Exp fn, Exp arg) {
      return this.fn.equals(fn) && this.arg.equals(arg)
          ? this
          : new ApplyEffect(fn, arg);
    }
  }
}

// End Core.java
