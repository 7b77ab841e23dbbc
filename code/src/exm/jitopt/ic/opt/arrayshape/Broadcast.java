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
import java.util.List;

import exm.jitopt.common.exceptions.JitRuntimeError;
import exm.jitopt.common.lang.TypeMap;
import exm.jitopt.common.lang.Var;

/**
 * Apply array broadcasting rules to a set of operands, recording the
 * equalities between dimensions that the operation implies.
 *
 * Shapes are aligned on their trailing dimension and missing leading
 * dimensions are treated as size 1.  In each dimension, operands must
 * either agree or have size 1, so all non size-1 classes in a dimension
 * are merged.
 */
class Broadcast {
  private final EquivClasses classes;
  private final ShapeTable shapes;
  private final TypeMap typeMap;

  public Broadcast(EquivClasses classes, ShapeTable shapes, TypeMap typeMap) {
    this.classes = classes;
    this.shapes = shapes;
    this.typeMap = typeMap;
  }

  /**
   * @param operands at least one must be an array, others are treated
   *                 as constants
   * @return shape of result
   */
  public List<Integer> broadcast(List<Var> operands) {
    List<List<Integer>> eqs = new ArrayList<List<Integer>>(operands.size());
    boolean haveArray = false;
    for (Var operand: operands) {
      if (typeMap.isArray(operand)) {
        haveArray = true;
        eqs.add(shapes.lookup(operand));
      } else {
        eqs.add(new ArrayList<Integer>());
      }
    }
    if (!haveArray) {
      throw new JitRuntimeError("No array operand in broadcast of "
                                + operands);
    }

    int ndims = 0;
    for (List<Integer> eq: eqs) {
      ndims = Math.max(ndims, eq.size());
    }
    for (List<Integer> eq: eqs) {
      eq.addAll(0, Collections.nCopies(ndims - eq.size(),
                                       EquivClasses.SIZE_ONE));
    }

    List<Integer> out = new ArrayList<Integer>(ndims);
    for (int i = 0; i < ndims; i++) {
      // Earlier dimensions may have merged classes that appear here
      int c = classes.canonical(eqs.get(0).get(i));
      // An unknown dimension makes the result unknown, but the known
      // classes must still agree with each other
      boolean unknown = false;
      for (List<Integer> eq: eqs) {
        int e = classes.canonical(eq.get(i));
        if (e == EquivClasses.UNKNOWN) {
          unknown = true;
        } else if (e != EquivClasses.SIZE_ONE && e != c) {
          if (c == EquivClasses.SIZE_ONE || c == EquivClasses.UNKNOWN) {
            c = e;
          } else {
            c = classes.merge(c, e);
          }
        }
      }
      out.add(unknown ? EquivClasses.UNKNOWN : c);
    }
    return classes.canonicalize(out);
  }
}
