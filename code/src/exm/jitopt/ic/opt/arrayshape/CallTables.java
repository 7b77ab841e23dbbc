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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.jitopt.common.lang.Arg;
import exm.jitopt.common.lang.TypeMap;
import exm.jitopt.common.lang.Var;
import exm.jitopt.ic.tree.Expr;
import exm.jitopt.ic.tree.Expr.BuildTuple;
import exm.jitopt.ic.tree.Expr.Const;
import exm.jitopt.ic.tree.Expr.GetAttr;
import exm.jitopt.ic.tree.Expr.Global;
import exm.jitopt.ic.tree.Expr.Global.GlobalKind;
import exm.jitopt.ic.tree.ICInstructions.Assign;

/**
 * Symbol tables built up during the forward pass, used to recognise
 * operations that are spread over several generic instructions, e.g.
 * <pre>
 *   np = global(numpy)
 *   f = getattr(np, zeros)
 *   t = build_tuple(m, n)
 *   A = call f(t)
 * </pre>
 */
class CallTables {
  private final Logger logger;

  /** Name of module treated as array-math namespace */
  private final String arrayModule;

  /** Variables bound to the array module */
  private final Set<Var> arrayModuleGlobals = new LinkedHashSet<Var>();

  /** Call targets that apply a function elementwise */
  private final Set<Var> mapCalls = new LinkedHashSet<Var>();

  /** Call targets in the array module, with function name */
  private final Map<Var, String> arrayModuleCalls =
                                  new LinkedHashMap<Var, String>();

  /**
   * Attributes of arrays, e.g. t = A.sum is stored as t -> A.sum
   */
  private final Map<Var, AttrCall> arrayAttrCalls =
                                  new LinkedHashMap<Var, AttrCall>();

  /** Statically known tuples, e.g. t = (a, b) stored as t -> [a, b] */
  private final Map<Var, List<Arg>> tupleTable =
                                  new LinkedHashMap<Var, List<Arg>>();

  public CallTables(Logger logger, String arrayModule) {
    this.logger = logger;
    this.arrayModule = arrayModule;
  }

  /**
   * Update tables with information from an assignment
   * @param assign
   * @param typeMap
   */
  public void update(Assign assign, TypeMap typeMap) {
    Var lhs = assign.target();
    Expr rhs = assign.value();
    switch (rhs.kind) {
      case GLOBAL: {
        Global g = (Global)rhs;
        if (g.globalKind == GlobalKind.UFUNC) {
          logger.trace("Map-like call target: " + lhs);
          mapCalls.add(lhs);
        } else if (g.globalKind == GlobalKind.MODULE &&
                   g.valueName.equals(arrayModule)) {
          logger.trace("Array module global: " + lhs);
          arrayModuleGlobals.add(lhs);
        }
        break;
      }
      case GETATTR: {
        GetAttr getAttr = (GetAttr)rhs;
        if (arrayModuleGlobals.contains(getAttr.value)) {
          arrayModuleCalls.put(lhs, getAttr.attr);
        } else if (typeMap.isArray(getAttr.value)) {
          arrayAttrCalls.put(lhs, new AttrCall(getAttr.value, getAttr.attr));
        }
        break;
      }
      case BUILD_TUPLE:
        tupleTable.put(lhs, Arg.fromVarList(((BuildTuple)rhs).items));
        break;
      case CONST: {
        Const c = (Const)rhs;
        if (c.isTuple) {
          tupleTable.put(lhs, c.tupleValues());
        }
        break;
      }
      default:
        // Nothing to record
        break;
    }
  }

  public boolean isMapCall(Var func) {
    return mapCalls.contains(func);
  }

  /**
   * @param func
   * @return name of array module function, or null
   */
  public String arrayModuleCall(Var func) {
    return arrayModuleCalls.get(func);
  }

  /**
   * @param func
   * @return receiver array and attribute name, or null
   */
  public AttrCall arrayAttrCall(Var func) {
    return arrayAttrCalls.get(func);
  }

  /**
   * @param var
   * @return tuple elements, or null if not statically known
   */
  public List<Arg> tupleElems(Var var) {
    return tupleTable.get(var);
  }

  public Set<Var> getArrayModuleGlobals() {
    return Collections.unmodifiableSet(arrayModuleGlobals);
  }

  public Set<Var> getMapCalls() {
    return Collections.unmodifiableSet(mapCalls);
  }

  public Map<Var, String> getArrayModuleCalls() {
    return Collections.unmodifiableMap(arrayModuleCalls);
  }

  public Map<Var, AttrCall> getArrayAttrCalls() {
    return Collections.unmodifiableMap(arrayAttrCalls);
  }

  public Map<Var, List<Arg>> getTupleTable() {
    return Collections.unmodifiableMap(tupleTable);
  }

  /**
   * Attribute looked up on an array, e.g. A.shape or A.reshape
   */
  public static class AttrCall {
    public final Var array;
    public final String attr;

    public AttrCall(Var array, String attr) {
      this.array = array;
      this.attr = attr;
    }

    @Override
    public int hashCode() {
      return array.hashCode() * 31 + attr.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof AttrCall)) {
        return false;
      }
      AttrCall other = (AttrCall)obj;
      return array.equals(other.array) && attr.equals(other.attr);
    }

    @Override
    public String toString() {
      return array + "." + attr;
    }
  }
}
