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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.jitopt.common.lang.Arg;
import exm.jitopt.common.lang.TypeMap;
import exm.jitopt.common.lang.Types;
import exm.jitopt.common.lang.Types.TupleType;
import exm.jitopt.common.lang.Var;
import exm.jitopt.ic.tree.Expr;
import exm.jitopt.ic.tree.Expr.Const;
import exm.jitopt.ic.tree.Expr.GetAttr;
import exm.jitopt.ic.tree.Expr.StaticGetItem;
import exm.jitopt.ic.tree.ICInstructions.Assign;
import exm.jitopt.ic.tree.ICInstructions.Instruction;
import exm.jitopt.ic.tree.ICTree.Function;
import exm.jitopt.ic.tree.Opcode;

/**
 * Make the size of every dimension of an array available in a variable,
 * generating code to fetch it from the array where no equivalent size is
 * already known:
 * <pre>
 *   A_sh_attr0.1 = getattr(A, shape)
 *   $constA0.2 = const(0)
 *   Asize0.3 = static_getitem(A_sh_attr0.1, 0, $constA0.2)
 * </pre>
 */
class SizeMaterializer {

  static class Result {
    /** Instructions to insert after the array assignment */
    final List<Instruction> generated;

    /** Size of each dimension of the array */
    final List<Arg> sizeVars;

    Result(List<Instruction> generated, List<Arg> sizeVars) {
      this.generated = generated;
      this.sizeVars = sizeVars;
    }
  }

  private final Logger logger;
  private final Function function;
  private final EquivClasses classes;

  public SizeMaterializer(Logger logger, Function function,
                          EquivClasses classes) {
    this.logger = logger;
    this.function = function;
    this.classes = classes;
  }

  /**
   * @param array array just assigned
   * @param shape current classes of array
   * @param following instructions following the assignment in the block.
   *        Size fetches for array found at the start are reused.
   * @return
   */
  public Result materialize(Var array, List<Integer> shape,
                            List<Instruction> following) {
    Map<Integer, Var> existing = existingFetches(array, following);
    List<Instruction> generated = new ArrayList<Instruction>();
    List<Arg> sizeVars = new ArrayList<Arg>(shape.size());

    for (int i = 0; i < shape.size(); i++) {
      int c = shape.get(i);
      if (c != EquivClasses.UNKNOWN && classes.hasSize(c)) {
        sizeVars.add(classes.representative(c));
        continue;
      }

      Var sizeVar = existing.get(i);
      if (sizeVar == null) {
        sizeVar = genSizeFetch(array, shape.size(), i, generated);
      } else {
        logger.trace("Reusing size " + sizeVar + " of " + array);
      }
      if (c != EquivClasses.UNKNOWN) {
        classes.addSize(c, Arg.createVar(sizeVar));
      }
      sizeVars.add(Arg.createVar(sizeVar));
    }
    return new Result(generated, sizeVars);
  }

  private Var genSizeFetch(Var array, int ndims, int i,
                           List<Instruction> out) {
    TypeMap typeMap = function.getTypeMap();

    Var attrVar = new Var(function.uniqueVarName(
                              array.name() + "_sh_attr" + i));
    typeMap.put(attrVar, TupleType.uniTuple(Types.INT64, ndims));
    out.add(new Assign(attrVar,
                  new GetAttr(array, ShapeInference.SHAPE_ATTR)));

    Var constVar = new Var(function.uniqueVarName(
                              "$const" + array.name() + i));
    typeMap.put(constVar, Types.INT64);
    out.add(new Assign(constVar, Const.scalar(Arg.createIntLit(i))));

    Var sizeVar = new Var(function.uniqueVarName(
                              array.name() + "size" + i));
    typeMap.put(sizeVar, Types.INT64);
    StaticGetItem getItem = new StaticGetItem(attrVar, i, constVar);
    // Builtin item lookup, no signature
    function.getCallTypes().put(getItem, null);
    out.add(new Assign(sizeVar, getItem));

    logger.trace("Generated size fetch " + sizeVar + " for " + array);
    return sizeVar;
  }

  /**
   * Find size fetches of the form generated above directly following the
   * assignment of the array.
   * @return map from dimension to variable holding its size
   */
  private Map<Integer, Var> existingFetches(Var array,
                                            List<Instruction> following) {
    Map<Integer, Var> result = new HashMap<Integer, Var>();
    Set<Var> shapeVars = new HashSet<Var>();
    for (Instruction inst: following) {
      if (inst.op != Opcode.ASSIGN) {
        break;
      }
      Assign assign = (Assign)inst;
      Expr value = assign.value();
      if (value.kind == Expr.ExprKind.GETATTR) {
        GetAttr getAttr = (GetAttr)value;
        if (!getAttr.value.equals(array) ||
            !getAttr.attr.equals(ShapeInference.SHAPE_ATTR)) {
          break;
        }
        shapeVars.add(assign.target());
      } else if (value.kind == Expr.ExprKind.CONST) {
        Const c = (Const)value;
        if (c.isTuple || !c.value().isIntVal()) {
          break;
        }
      } else if (value.kind == Expr.ExprKind.STATIC_GETITEM) {
        StaticGetItem getItem = (StaticGetItem)value;
        if (!shapeVars.contains(getItem.value)) {
          break;
        }
        result.put(getItem.index, assign.target());
      } else {
        break;
      }
    }
    return result;
  }
}
