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
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.jitopt.common.exceptions.JitRuntimeError;
import exm.jitopt.common.lang.Arg;

/**
 * Registry of dimension equivalence classes.  Two dimensions in the
 * same class are provably the same length at runtime.
 *
 * Merges are eager: the merged classes are replaced by a new class in
 * every recorded shape immediately, so that later instructions see the
 * merge.  Classes that were merged away are remembered so that shape
 * vectors held outside the shape table can be brought up to date with
 * canonicalize().
 */
class EquivClasses {

  /** Dimension of length 1: constants and padded broadcast dimensions */
  public static final int SIZE_ONE = 0;

  /** Dimension with no known equivalence */
  public static final int UNKNOWN = -1;

  private final Logger logger;

  private final ShapeTable shapes;

  private int nextClass = 1;

  /**
   * Representative size values for each class: variables or constants
   * whose runtime value is the length of the dimension.  Classes without
   * any representative have no entry.
   */
  private final ListMultimap<Integer, Arg> classSizes =
                                        ArrayListMultimap.create();

  /** Link from each merged-away class to the class that replaced it */
  private final Map<Integer, Integer> mergedInto =
                                        new HashMap<Integer, Integer>();

  public EquivClasses(Logger logger, ShapeTable shapes) {
    this.logger = logger;
    this.shapes = shapes;
    classSizes.put(SIZE_ONE, Arg.createIntLit(1));
  }

  /**
   * @return a fresh class, never used before
   */
  public int allocate() {
    return nextClass++;
  }

  /**
   * Merge two classes into a new class, updating all recorded shapes and
   * combining the representative sizes of both.
   * @param c1
   * @param c2
   * @return the merged class, or c1 if the classes are already the same
   */
  public int merge(int c1, int c2) {
    if (c1 == UNKNOWN || c2 == UNKNOWN) {
      throw new JitRuntimeError("Cannot merge unknown class: " + c1 + ", "
                                + c2);
    }
    if (c1 == c2) {
      return c1;
    }

    int merged = allocate();
    logger.trace("Merging classes " + c1 + " and " + c2 + " into " + merged);
    shapes.renameClasses(c1, c2, merged);

    List<Arg> sizes = new ArrayList<Arg>(classSizes.removeAll(c1));
    sizes.addAll(classSizes.removeAll(c2));
    classSizes.putAll(merged, sizes);

    mergedInto.put(c1, merged);
    mergedInto.put(c2, merged);
    return merged;
  }

  /**
   * @param c
   * @return the current class replacing c after any merges
   */
  public int canonical(int c) {
    Integer next = mergedInto.get(c);
    while (next != null) {
      c = next;
      next = mergedInto.get(c);
    }
    return c;
  }

  /**
   * Update shape vector in place to reflect merges
   * @param shape
   * @return the same vector
   */
  public List<Integer> canonicalize(List<Integer> shape) {
    for (int i = 0; i < shape.size(); i++) {
      shape.set(i, canonical(shape.get(i)));
    }
    return shape;
  }

  public boolean hasSize(int c) {
    return classSizes.containsKey(c);
  }

  /**
   * @param c
   * @return first representative size of class
   */
  public Arg representative(int c) {
    List<Arg> sizes = classSizes.get(c);
    if (sizes.isEmpty()) {
      throw new JitRuntimeError("No size recorded for class " + c);
    }
    return sizes.get(0);
  }

  public void addSize(int c, Arg size) {
    if (c == UNKNOWN) {
      throw new JitRuntimeError("Cannot add size " + size +
                                " for unknown class");
    }
    classSizes.put(c, size);
  }

  public List<Arg> getSizes(int c) {
    return new ArrayList<Arg>(classSizes.get(c));
  }

  public Map<Integer, List<Arg>> sizesAsMap() {
    Map<Integer, List<Arg>> result = new TreeMap<Integer, List<Arg>>();
    for (Integer c: classSizes.keySet()) {
      result.put(c, getSizes(c));
    }
    return result;
  }
}
