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
package exm.jitopt.ic.opt.arrayshape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableSet;

import exm.jitopt.common.exceptions.JitRuntimeError;
import exm.jitopt.common.exceptions.UnsupportedShapeException;
import exm.jitopt.common.lang.Arg;
import exm.jitopt.common.lang.Operators;
import exm.jitopt.common.lang.TypeMap;
import exm.jitopt.common.lang.Types;
import exm.jitopt.common.lang.Types.TupleType;
import exm.jitopt.common.lang.Types.Type;
import exm.jitopt.common.lang.Var;
import exm.jitopt.ic.opt.arrayshape.CallTables.AttrCall;
import exm.jitopt.ic.tree.Expr;
import exm.jitopt.ic.tree.Expr.BinOp;
import exm.jitopt.ic.tree.Expr.Call;
import exm.jitopt.ic.tree.Expr.Cast;
import exm.jitopt.ic.tree.Expr.GetAttr;
import exm.jitopt.ic.tree.Expr.InplaceBinOp;
import exm.jitopt.ic.tree.Expr.Param;
import exm.jitopt.ic.tree.Expr.Unary;
import exm.jitopt.ic.tree.Expr.VarRef;

/**
 * Infer the shape, in terms of equivalence classes, of the array
 * produced by an expression.
 */
class ShapeInference {

  /** Attribute of array giving the transpose */
  public static final String TRANSPOSE_ATTR = "T";

  /** Attribute of array giving its shape tuple */
  public static final String SHAPE_ATTR = "shape";

  private static final Set<String> ALLOC_FUNCS =
                            ImmutableSet.of("empty", "zeros", "ones");
  private static final Set<String> ALLOC_LIKE_FUNCS =
                ImmutableSet.of("empty_like", "zeros_like", "ones_like");

  private final Logger logger;
  private final TypeMap typeMap;
  private final ShapeTable shapes;
  private final EquivClasses classes;
  private final CallTables calls;
  private final Broadcast broadcast;

  public ShapeInference(Logger logger, TypeMap typeMap, ShapeTable shapes,
          EquivClasses classes, CallTables calls, Broadcast broadcast) {
    this.logger = logger;
    this.typeMap = typeMap;
    this.shapes = shapes;
    this.classes = classes;
    this.calls = calls;
    this.broadcast = broadcast;
  }

  /**
   * @param rhs expression producing an array
   * @return shape of the result.  Classes are up to date with any
   *         merges made during inference.
   * @throws UnsupportedShapeException if no rule applies
   */
  public List<Integer> infer(Expr rhs) throws UnsupportedShapeException {
    switch (rhs.kind) {
      case PARAM:
        return paramShape((Param)rhs);
      case VAR:
        return shapes.lookup(((VarRef)rhs).var);
      case UNARY: {
        Unary unary = (Unary)rhs;
        if (!Operators.isUnaryMapOp(unary.fn)) {
          throw unsupported("unary " + unary.fn, rhs);
        }
        return shapes.lookup(unary.value);
      }
      case BINOP: {
        BinOp binop = (BinOp)rhs;
        if (!Operators.isBinaryMapOp(binop.fn)) {
          throw unsupported("binop " + binop.fn, rhs);
        }
        return broadcast.broadcast(binop.getVars());
      }
      case INPLACE_BINOP: {
        InplaceBinOp binop = (InplaceBinOp)rhs;
        if (!Operators.isBinaryMapOp(binop.immutableFn)) {
          throw unsupported("inplace_binop " + binop.fn, rhs);
        }
        return broadcast.broadcast(binop.getVars());
      }
      case ARRAYEXPR: {
        // Each distinct operand only once
        Set<Var> args = new LinkedHashSet<Var>(rhs.getVars());
        return broadcast.broadcast(new ArrayList<Var>(args));
      }
      case CAST:
        return shapes.lookup(((Cast)rhs).value);
      case GETATTR: {
        GetAttr getAttr = (GetAttr)rhs;
        if (typeMap.isArray(getAttr.value) &&
            getAttr.attr.equals(TRANSPOSE_ATTR)) {
          return transpose(getAttr.value);
        }
        throw unsupported("getattr " + getAttr.attr, rhs);
      }
      case CALL:
        return callShape((Call)rhs);
      case GLOBAL:
      case BUILD_TUPLE:
      case CONST:
      case STATIC_GETITEM:
        throw unsupported(rhs.kind.toString().toLowerCase(), rhs);
      default:
        throw new JitRuntimeError("Unknown expression kind " + rhs.kind);
    }
  }

  private List<Integer> paramShape(Param param) {
    Type t = typeMap.lookup(param.name);
    if (!Types.isArray(t)) {
      throw new JitRuntimeError("Parameter " + param.name +
                                " is not an array: " + t);
    }
    int ndims = Types.arrayRank(t);
    List<Integer> shape = new ArrayList<Integer>(ndims);
    for (int i = 0; i < ndims; i++) {
      shape.add(classes.allocate());
    }
    return shape;
  }

  private List<Integer> callShape(Call call) throws UnsupportedShapeException {
    List<Var> args = new ArrayList<Var>(call.args);
    if (calls.isMapCall(call.func)) {
      // Result takes the shape of the first argument
      if (args.isEmpty() || !typeMap.isArray(args.get(0))) {
        throw unsupported(call.func.name(), call);
      }
      return shapes.lookup(args.get(0));
    }

    String callName = calls.arrayModuleCall(call.func);
    if (callName == null) {
      AttrCall attrCall = calls.arrayAttrCall(call.func);
      if (attrCall != null) {
        // Method on array: receiver is first argument
        callName = attrCall.attr;
        args.add(0, attrCall.array);
      }
    }
    if (callName == null) {
      throw unsupported(call.func.name(), call);
    }
    return namedCallShape(callName, args);
  }

  /**
   * Shape rules for array module functions
   * @param callName
   * @param args
   * @return
   * @throws UnsupportedShapeException
   */
  List<Integer> namedCallShape(String callName, List<Var> args)
                                  throws UnsupportedShapeException {
    logger.trace("Array call " + callName + " " + args);
    if (callName.equals("transpose")) {
      if (args.size() != 1) {
        // Explicit axes permutation not handled
        throw unsupportedCall(callName, args);
      }
      return transpose(args.get(0));
    } else if (ALLOC_FUNCS.contains(callName)) {
      if (args.isEmpty()) {
        throw unsupportedCall(callName, args);
      }
      return classesFromShape(args.get(0));
    } else if (ALLOC_LIKE_FUNCS.contains(callName)) {
      if (args.isEmpty()) {
        throw unsupportedCall(callName, args);
      }
      return shapes.lookup(args.get(0));
    } else if (callName.equals("reshape")) {
      return reshape(args);
    } else if (callName.equals("dot")) {
      return dot(args);
    } else if (Operators.isUfunc(callName)) {
      return broadcast.broadcast(args);
    }
    throw unsupportedCall(callName, args);
  }

  private List<Integer> transpose(Var array) {
    List<Integer> shape = shapes.lookup(array);
    Collections.reverse(shape);
    return shape;
  }

  /**
   * New array shape from reshape(a, shape) or a.reshape(d1, d2, ...).
   * TODO: infer size of -1 dimension from the size of a
   */
  private List<Integer> reshape(List<Var> args)
                                    throws UnsupportedShapeException {
    if (args.size() < 2) {
      throw unsupportedCall("reshape", args);
    } else if (args.size() == 2) {
      return classesFromShape(args.get(1));
    }
    List<Integer> shape = new ArrayList<Integer>(args.size() - 1);
    for (Var dim: args.subList(1, args.size())) {
      if (!Types.isInt(typeMap.lookup(dim))) {
        throw unsupportedCall("reshape", args);
      }
      shape.add(newClassWithSize(Arg.createVar(dim)));
    }
    return shape;
  }

  /**
   * Matrix product.  For multi-dimensional arrays, the last dimension of
   * the first argument and the second to last dimension of the second
   * argument are summed over, so must be equal.  If the second argument
   * is 1D, its only dimension is used.  An optional third argument is the
   * output array.
   */
  private List<Integer> dot(List<Var> args) throws UnsupportedShapeException {
    if (args.size() != 2 && args.size() != 3) {
      throw unsupportedCall("dot", args);
    }
    Var in1 = args.get(0);
    Var in2 = args.get(1);
    if (!typeMap.isArray(in1) || !typeMap.isArray(in2)) {
      throw unsupportedCall("dot", args);
    }
    int ndims1 = shapes.lookup(in1).size();
    int ndims2 = shapes.lookup(in2).size();
    if (ndims1 == 0 || ndims2 == 0) {
      throw unsupportedCall("dot", args);
    }

    int c1 = shapes.lookup(in1).get(ndims1 - 1);
    int c2;
    if (ndims2 == 1) {
      c2 = shapes.lookup(in2).get(0);
    } else {
      c2 = shapes.lookup(in2).get(ndims2 - 2);
    }
    if (c1 != EquivClasses.UNKNOWN && c2 != EquivClasses.UNKNOWN) {
      classes.merge(c1, c2);
    }

    // Read after merge
    List<Integer> shape1 = shapes.lookup(in1);
    List<Integer> shape2 = shapes.lookup(in2);
    List<Integer> out = new ArrayList<Integer>();
    out.addAll(shape1.subList(0, ndims1 - 1));
    if (ndims2 > 1) {
      out.addAll(shape2.subList(0, ndims2 - 2));
      out.add(shape2.get(ndims2 - 1));
    }
    return out;
  }

  /**
   * Classes for a new array allocated with a shape argument
   * @param shapeArg integer or tuple of integers
   * @return a fresh class per dimension, backed by the argument values
   *         where they are known
   * @throws UnsupportedShapeException
   */
  private List<Integer> classesFromShape(Var shapeArg)
                                      throws UnsupportedShapeException {
    Type argType = typeMap.lookup(shapeArg);
    if (Types.isInt(argType)) {
      return Collections.singletonList(
                  newClassWithSize(Arg.createVar(shapeArg)));
    } else if (!Types.isIntTuple(argType)) {
      throw new UnsupportedShapeException(shapeArg.name(),
                    "Can't get dimensions from shape argument " + shapeArg +
                    " of type " + argType);
    }

    AttrCall attr = calls.arrayAttrCall(shapeArg);
    if (attr != null && attr.attr.equals(SHAPE_ATTR)) {
      // Same shape as existing array
      return shapes.lookup(attr.array);
    }

    int count = ((TupleType)argType).count();
    List<Arg> elems = calls.tupleElems(shapeArg);
    if (elems != null && elems.size() != count) {
      throw new JitRuntimeError("Tuple " + shapeArg + " has " + elems.size()
                      + " elements but type " + argType);
    }
    List<Integer> shape = new ArrayList<Integer>(count);
    for (int i = 0; i < count; i++) {
      if (elems != null && !isNegativeLit(elems.get(i))) {
        shape.add(newClassWithSize(elems.get(i)));
      } else {
        // Unknown or inferred (-1): sizes will be fetched from new array
        shape.add(classes.allocate());
      }
    }
    return shape;
  }

  private static boolean isNegativeLit(Arg arg) {
    return arg.isIntVal() && arg.getIntLit() < 0;
  }

  private int newClassWithSize(Arg size) {
    int c = classes.allocate();
    classes.addSize(c, size);
    return c;
  }

  private static UnsupportedShapeException unsupported(String op,
                                                       Expr expr) {
    return new UnsupportedShapeException(op,
            "Can't find shape classes for " + op + ": " + expr);
  }

  private static UnsupportedShapeException unsupportedCall(String callName,
                                                    List<Var> args) {
    return new UnsupportedShapeException(callName,
            "Unknown array call: " + callName + args);
  }
}
