/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.jitopt.common.lang;

import java.util.ArrayList;
import java.util.List;

import exm.jitopt.common.exceptions.JitRuntimeError;

/**
 * An operand: either a variable or a literal value
 */
public class Arg {
  public static enum ArgKind {
    INTVAL, FLOATVAL, VAR
  }

  public final ArgKind kind;

  /** Storage for arg, dependent on arg type */
  private final long intlit;
  private final double floatlit;
  private final Var var;

  /**
   * Private constructors so that it can only be build using static builder
   * methods (below)
   */
  private Arg(ArgKind kind, Var var, long intlit, double floatlit) {
    super();
    this.kind = kind;
    this.intlit = intlit;
    this.floatlit = floatlit;
    this.var = var;
  }

  public static Arg createIntLit(long v) {
    return new Arg(ArgKind.INTVAL, null, v, -1);
  }

  public static Arg createFloatLit(double v) {
    return new Arg(ArgKind.FLOATVAL, null, -1, v);
  }

  public static Arg createVar(Var var) {
    assert (var != null);
    return new Arg(ArgKind.VAR, var, -1, -1);
  }

  public static List<Arg> fromVarList(List<Var> vars) {
    ArrayList<Arg> res = new ArrayList<Arg>(vars.size());
    for (Var v: vars) {
      res.add(createVar(v));
    }
    return res;
  }

  public long getIntLit() {
    if (kind == ArgKind.INTVAL) {
      return intlit;
    } else {
      throw new JitRuntimeError("getIntLit for non-int type");
    }
  }

  public Var getVar() {
    if (kind == ArgKind.VAR) {
      return var;
    } else {
      throw new JitRuntimeError("getVariable for non-variable type");
    }
  }

  public boolean isVar() {
    return kind == ArgKind.VAR;
  }

  public boolean isIntVal() {
    return kind == ArgKind.INTVAL;
  }

  @Override
  public String toString() {
    switch (kind) {
    case INTVAL:
      return Long.toString(intlit);
    case FLOATVAL:
      return Double.toString(floatlit);
    case VAR:
      return var.name();
    default:
      throw new JitRuntimeError("Unknown oparg type " + this.kind.toString());
    }
  }

  @Override
  public int hashCode() {
    int hash1;
    switch (kind) {
    case INTVAL:
      hash1 = ((Long) intlit).hashCode();
      break;
    case FLOATVAL:
      hash1 = ((Double) floatlit).hashCode();
      break;
    case VAR:
      hash1 = var.hashCode();
      break;
    default:
      throw new JitRuntimeError("Unknown oparg type " + this.kind.toString());
    }
    return kind.hashCode() + 13 * hash1;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Arg)) {
      return false;
    }
    Arg other = (Arg) obj;
    if (this.kind != other.kind) {
      return false;
    }
    switch (this.kind) {
    case INTVAL:
      return this.intlit == other.intlit;
    case FLOATVAL:
      return this.floatlit == other.floatlit;
    case VAR:
      return this.var.equals(other.var);
    default:
      throw new JitRuntimeError("Unknown oparg type " + this.kind.toString());
    }
  }
}
