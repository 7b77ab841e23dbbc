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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import exm.jitopt.common.exceptions.JitRuntimeError;
import exm.jitopt.common.lang.Var;

/**
 * Shape vector for each array variable: one equivalence class per
 * dimension.  The length of a recorded vector never changes; the class
 * ids inside it are rewritten in place when classes are merged.
 */
class ShapeTable {

  private final Map<Var, List<Integer>> shapes =
                              new LinkedHashMap<Var, List<Integer>>();

  /**
   * @param var
   * @return copy of the recorded shape, safe to modify
   */
  public List<Integer> lookup(Var var) {
    List<Integer> shape = shapes.get(var);
    if (shape == null) {
      throw new JitRuntimeError("Unknown variable: no shape recorded for "
                                + var);
    }
    return new ArrayList<Integer>(shape);
  }

  /**
   * Record shape for variable.  If a different shape was recorded
   * earlier, e.g. from another block, the variable is downgraded to an
   * all unknown shape.
   * @param var
   * @param shape
   * @return true if recorded, false if a conflicting shape already existed
   */
  public boolean record(Var var, List<Integer> shape) {
    List<Integer> prev = shapes.get(var);
    if (prev != null && !prev.equals(shape)) {
      shapes.put(var, unknownShape(prev.size()));
      return false;
    }
    shapes.put(var, new ArrayList<Integer>(shape));
    return true;
  }

  /**
   * Rewrite all occurrences of two classes to a new class
   * @param c1
   * @param c2
   * @param merged
   */
  void renameClasses(int c1, int c2, int merged) {
    for (List<Integer> shape: shapes.values()) {
      for (int i = 0; i < shape.size(); i++) {
        int c = shape.get(i);
        if (c == c1 || c == c2) {
          shape.set(i, merged);
        }
      }
    }
  }

  public Map<Var, List<Integer>> asMap() {
    Map<Var, List<Integer>> copy = new LinkedHashMap<Var, List<Integer>>();
    for (Entry<Var, List<Integer>> e: shapes.entrySet()) {
      copy.put(e.getKey(), Collections.unmodifiableList(
                              new ArrayList<Integer>(e.getValue())));
    }
    return Collections.unmodifiableMap(copy);
  }

  public static List<Integer> unknownShape(int ndims) {
    return new ArrayList<Integer>(
            Collections.nCopies(ndims, EquivClasses.UNKNOWN));
  }
}
