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
package exm.jitopt.ic.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.jitopt.common.exceptions.JitRuntimeError;
import exm.jitopt.common.lang.Arg;
import exm.jitopt.common.lang.Var;

/**
 * Right hand side of an assignment.  The set of kinds is closed: every
 * kind has exactly one subclass below, and consumers switch on kind.
 *
 * Expressions are compared by identity, so that an expression object can
 * serve as a key in the call type map.
 */
public abstract class Expr {

  public static enum ExprKind {
    /** Function parameter */
    PARAM,
    /** Reference to global value, e.g. an imported module */
    GLOBAL,
    GETATTR,
    BUILD_TUPLE,
    CONST,
    /** Plain variable reference */
    VAR,
    UNARY,
    BINOP,
    INPLACE_BINOP,
    /** Fused tree of elementwise operations */
    ARRAYEXPR,
    CAST,
    CALL,
    STATIC_GETITEM,
  }

  public final ExprKind kind;

  protected Expr(ExprKind kind) {
    this.kind = kind;
  }

  /**
   * @return variables read by the expression, in order of appearance
   */
  public abstract List<Var> getVars();

  @Override
  public abstract String toString();

  public static class Param extends Expr {
    public final int index;
    public final String name;

    public Param(int index, String name) {
      super(ExprKind.PARAM);
      this.index = index;
      this.name = name;
    }

    @Override
    public List<Var> getVars() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      return "arg(" + index + ", name=" + name + ")";
    }
  }

  public static class Global extends Expr {
    public static enum GlobalKind {
      MODULE,
      /** Universal function object: applied elementwise */
      UFUNC,
      FUNCTION,
      VALUE,
    }

    /** Name the global is bound to in the source */
    public final String name;
    public final GlobalKind globalKind;
    /** Name of the referenced object, e.g. module name */
    public final String valueName;

    public Global(String name, GlobalKind globalKind, String valueName) {
      super(ExprKind.GLOBAL);
      this.name = name;
      this.globalKind = globalKind;
      this.valueName = valueName;
    }

    @Override
    public List<Var> getVars() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      return "global(" + name + ": " + globalKind.toString().toLowerCase() +
             " " + valueName + ")";
    }
  }

  public static class GetAttr extends Expr {
    public final Var value;
    public final String attr;

    public GetAttr(Var value, String attr) {
      super(ExprKind.GETATTR);
      this.value = value;
      this.attr = attr;
    }

    @Override
    public List<Var> getVars() {
      return Collections.singletonList(value);
    }

    @Override
    public String toString() {
      return "getattr(value=" + value + ", attr=" + attr + ")";
    }
  }

  public static class BuildTuple extends Expr {
    public final List<Var> items;

    public BuildTuple(List<Var> items) {
      super(ExprKind.BUILD_TUPLE);
      this.items = Collections.unmodifiableList(new ArrayList<Var>(items));
    }

    @Override
    public List<Var> getVars() {
      return items;
    }

    @Override
    public String toString() {
      return "build_tuple(items=[" + StringUtils.join(items, ", ") + "])";
    }
  }

  /**
   * Constant value: a single literal, or a tuple of literals
   */
  public static class Const extends Expr {
    private final List<Arg> values;
    public final boolean isTuple;

    private Const(List<Arg> values, boolean isTuple) {
      super(ExprKind.CONST);
      for (Arg v: values) {
        if (v.isVar()) {
          throw new JitRuntimeError("Constant holds variable " + v);
        }
      }
      this.values = Collections.unmodifiableList(new ArrayList<Arg>(values));
      this.isTuple = isTuple;
    }

    public static Const scalar(Arg value) {
      return new Const(Collections.singletonList(value), false);
    }

    public static Const tuple(List<Arg> values) {
      return new Const(values, true);
    }

    public Arg value() {
      if (isTuple) {
        throw new JitRuntimeError("Tuple constant has no single value");
      }
      return values.get(0);
    }

    public List<Arg> tupleValues() {
      if (!isTuple) {
        throw new JitRuntimeError("Scalar constant is not a tuple");
      }
      return values;
    }

    @Override
    public List<Var> getVars() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      if (isTuple) {
        return "const((" + StringUtils.join(values, ", ") + "))";
      }
      return "const(" + values.get(0) + ")";
    }
  }

  public static class VarRef extends Expr {
    public final Var var;

    public VarRef(Var var) {
      super(ExprKind.VAR);
      this.var = var;
    }

    @Override
    public List<Var> getVars() {
      return Collections.singletonList(var);
    }

    @Override
    public String toString() {
      return var.name();
    }
  }

  public static class Unary extends Expr {
    public final String fn;
    public final Var value;

    public Unary(String fn, Var value) {
      super(ExprKind.UNARY);
      this.fn = fn;
      this.value = value;
    }

    @Override
    public List<Var> getVars() {
      return Collections.singletonList(value);
    }

    @Override
    public String toString() {
      return "unary(fn=" + fn + ", value=" + value + ")";
    }
  }

  public static class BinOp extends Expr {
    public final String fn;
    public final Var lhs;
    public final Var rhs;

    public BinOp(String fn, Var lhs, Var rhs) {
      super(ExprKind.BINOP);
      this.fn = fn;
      this.lhs = lhs;
      this.rhs = rhs;
    }

    @Override
    public List<Var> getVars() {
      return Arrays.asList(lhs, rhs);
    }

    @Override
    public String toString() {
      return lhs + " " + fn + " " + rhs;
    }
  }

  /**
   * In-place update, e.g. a += b.  immutableFn is the operator
   * computing the new value (+ for +=).
   */
  public static class InplaceBinOp extends Expr {
    public final String fn;
    public final String immutableFn;
    public final Var lhs;
    public final Var rhs;

    public InplaceBinOp(String fn, String immutableFn, Var lhs, Var rhs) {
      super(ExprKind.INPLACE_BINOP);
      this.fn = fn;
      this.immutableFn = immutableFn;
      this.lhs = lhs;
      this.rhs = rhs;
    }

    @Override
    public List<Var> getVars() {
      return Arrays.asList(lhs, rhs);
    }

    @Override
    public String toString() {
      return lhs + " " + fn + " " + rhs;
    }
  }

  /**
   * Tree of elementwise operations fused into one expression
   */
  public static class ArrayExpr extends Expr {
    public final ArrayExprNode root;

    public ArrayExpr(ArrayExprNode root) {
      super(ExprKind.ARRAYEXPR);
      this.root = root;
    }

    @Override
    public List<Var> getVars() {
      List<Var> result = new ArrayList<Var>();
      root.collectVars(result);
      return result;
    }

    @Override
    public String toString() {
      return "arrayexpr(" + root + ")";
    }
  }

  /**
   * Node in a fused elementwise tree: a leaf operand or an operator
   * applied to child nodes
   */
  public static class ArrayExprNode {
    private final Arg leaf;
    private final String op;
    private final List<ArrayExprNode> operands;

    private ArrayExprNode(Arg leaf, String op, List<ArrayExprNode> operands) {
      this.leaf = leaf;
      this.op = op;
      this.operands = operands;
    }

    public static ArrayExprNode leaf(Arg arg) {
      return new ArrayExprNode(arg, null, Collections.<ArrayExprNode>emptyList());
    }

    public static ArrayExprNode leaf(Var var) {
      return leaf(Arg.createVar(var));
    }

    public static ArrayExprNode op(String op, ArrayExprNode ...operands) {
      return new ArrayExprNode(null, op, Collections.unmodifiableList(
                            new ArrayList<ArrayExprNode>(Arrays.asList(operands))));
    }

    public boolean isLeaf() {
      return leaf != null;
    }

    private void collectVars(List<Var> result) {
      if (isLeaf()) {
        if (leaf.isVar()) {
          result.add(leaf.getVar());
        }
      } else {
        for (ArrayExprNode operand: operands) {
          operand.collectVars(result);
        }
      }
    }

    @Override
    public String toString() {
      if (isLeaf()) {
        return leaf.toString();
      }
      return op + "(" + StringUtils.join(operands, ", ") + ")";
    }
  }

  public static class Cast extends Expr {
    public final Var value;

    public Cast(Var value) {
      super(ExprKind.CAST);
      this.value = value;
    }

    @Override
    public List<Var> getVars() {
      return Collections.singletonList(value);
    }

    @Override
    public String toString() {
      return "cast(value=" + value + ")";
    }
  }

  public static class Call extends Expr {
    public final Var func;
    public final List<Var> args;

    public Call(Var func, List<Var> args) {
      super(ExprKind.CALL);
      this.func = func;
      this.args = Collections.unmodifiableList(new ArrayList<Var>(args));
    }

    @Override
    public List<Var> getVars() {
      List<Var> result = new ArrayList<Var>(args.size() + 1);
      result.add(func);
      result.addAll(args);
      return result;
    }

    @Override
    public String toString() {
      return "call " + func + "(" + StringUtils.join(args, ", ") + ")";
    }
  }

  /**
   * Lookup with an index known at compile time, e.g. t[0]
   */
  public static class StaticGetItem extends Expr {
    public final Var value;
    public final int index;
    /** Variable holding the index, if any */
    public final Var indexVar;

    public StaticGetItem(Var value, int index, Var indexVar) {
      super(ExprKind.STATIC_GETITEM);
      this.value = value;
      this.index = index;
      this.indexVar = indexVar;
    }

    @Override
    public List<Var> getVars() {
      if (indexVar == null) {
        return Collections.singletonList(value);
      }
      return Arrays.asList(value, indexVar);
    }

    @Override
    public String toString() {
      return "static_getitem(value=" + value + ", index=" + index +
             ", index_var=" + indexVar + ")";
    }
  }
}
