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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.jitopt.common.Logging;
import exm.jitopt.common.exceptions.UnsupportedShapeException;
import exm.jitopt.common.lang.Arg;
import exm.jitopt.common.lang.TypeMap;
import exm.jitopt.common.lang.Var;
import exm.jitopt.ic.tree.ICInstructions.Assign;
import exm.jitopt.ic.tree.ICInstructions.Instruction;
import exm.jitopt.ic.tree.ICTree.Block;
import exm.jitopt.ic.tree.ICTree.Function;
import exm.jitopt.ic.tree.Opcode;

/**
 * Array shape analysis for a single function.
 *
 * Walks the instructions of each block in order, assigning each
 * dimension of each array variable an equivalence class such that
 * dimensions in the same class have the same length at runtime.  For
 * every array assignment, a variable holding the size of each dimension
 * is made available, either by reusing a known size of an equivalent
 * dimension or by inserting code after the assignment to fetch it from
 * the array's shape.
 *
 * The function's instructions, type map and call types are modified in
 * place.  An instance holds all state for one run and should not be
 * reused.
 */
public class ArrayAnalysis {

  private final Logger logger;
  private final Function function;
  private final TypeMap typeMap;
  private final boolean debug;

  private final ShapeTable shapes;
  private final EquivClasses classes;
  private final CallTables calls;
  private final ShapeInference inference;
  private final SizeMaterializer materializer;

  /** Size of each dimension, for arrays with a consistent shape */
  private final Map<Var, List<Arg>> sizeVars =
                                    new LinkedHashMap<Var, List<Arg>>();

  /** Arrays assigned conflicting shapes */
  private final Set<Var> conflicts = new LinkedHashSet<Var>();

  public ArrayAnalysis(Logger logger, Function function, String arrayModule,
                       boolean debug) {
    this.logger = logger;
    this.function = function;
    this.typeMap = function.getTypeMap();
    this.debug = debug;
    this.shapes = new ShapeTable();
    this.classes = new EquivClasses(logger, shapes);
    this.calls = new CallTables(logger, arrayModule);
    Broadcast broadcast = new Broadcast(classes, shapes, typeMap);
    this.inference = new ShapeInference(logger, typeMap, shapes, classes,
                                        calls, broadcast);
    this.materializer = new SizeMaterializer(logger, function, classes);
  }

  public void run() {
    if (debug) {
      logger.debug("Array analysis input:\n" + function);
    }

    for (Block block: new ArrayList<Block>(function.getBlocks())) {
      List<Instruction> snapshot =
                  new ArrayList<Instruction>(block.getInstructions());
      List<Instruction> newBody = new ArrayList<Instruction>();
      for (int i = 0; i < snapshot.size(); i++) {
        Instruction inst = snapshot.get(i);
        newBody.add(inst);
        if (inst.op == Opcode.ASSIGN) {
          newBody.addAll(analyzeAssign((Assign)inst,
                              snapshot.subList(i + 1, snapshot.size())));
        }
      }
      block.replaceInstructions(newBody);
    }

    if (debug) {
      dumpTables();
    }
  }

  /**
   * @param assign
   * @param following rest of block after assign
   * @return instructions to insert after assign
   */
  private List<Instruction> analyzeAssign(Assign assign,
                                          List<Instruction> following) {
    calls.update(assign, typeMap);

    Var lhs = assign.target();
    if (!typeMap.isArray(lhs)) {
      return Collections.emptyList();
    }

    int ndims = typeMap.rank(lhs);
    List<Integer> shape;
    try {
      shape = classes.canonicalize(inference.infer(assign.value()));
      if (shape.size() != ndims) {
        throw new UnsupportedShapeException(lhs.name(), "Inferred " +
                shape.size() + " dimensions for " + lhs + " of rank " + ndims);
      }
    } catch (UnsupportedShapeException e) {
      Logging.uniqueWarn("Array analysis: no shape rule for " +
            e.getOperation() + " in function " + function.getName() +
            ", dimensions of " + lhs + " treated as unknown");
      logger.debug(e.getMessage());
      shape = ShapeTable.unknownShape(ndims);
    }
    logger.trace("Shape of " + lhs + ": " + shape);

    boolean consistent = shapes.record(lhs, shape);
    if (!consistent || conflicts.contains(lhs)) {
      if (conflicts.add(lhs)) {
        logger.warn("Array analysis: conflicting shapes for " + lhs +
                    " in function " + function.getName() +
                    ", dimensions treated as unknown");
      }
      sizeVars.remove(lhs);
      return Collections.emptyList();
    }

    SizeMaterializer.Result result = materializer.materialize(lhs,
                                                shapes.lookup(lhs), following);
    sizeVars.put(lhs, result.sizeVars);
    return result.generated;
  }

  /**
   * @param array
   * @return equivalence class of each dimension
   */
  public List<Integer> getShape(Var array) {
    return shapes.lookup(array);
  }

  public Map<Var, List<Integer>> getShapes() {
    return shapes.asMap();
  }

  /**
   * @param array
   * @return variable or constant with size of each dimension, or null
   *         if not available
   */
  public List<Arg> getSizeVars(Var array) {
    List<Arg> sizes = sizeVars.get(array);
    if (sizes == null) {
      return null;
    }
    return Collections.unmodifiableList(sizes);
  }

  /**
   * @return representative sizes for each class that has any
   */
  public Map<Integer, List<Arg>> getClassSizes() {
    return classes.sizesAsMap();
  }

  public Set<Var> getConflicts() {
    return Collections.unmodifiableSet(conflicts);
  }

  CallTables getCallTables() {
    return calls;
  }

  private void dumpTables() {
    StringBuilder sb = new StringBuilder();
    sb.append("Array analysis tables for " + function.getName() + ":\n");
    sb.append("  shapes: ");
    appendMap(sb, getShapes());
    sb.append("  class sizes: ");
    appendMap(sb, classes.sizesAsMap());
    sb.append("  array module globals: " +
              StringUtils.join(calls.getArrayModuleGlobals(), ", ") + "\n");
    sb.append("  map calls: " +
              StringUtils.join(calls.getMapCalls(), ", ") + "\n");
    sb.append("  array module calls: ");
    appendMap(sb, calls.getArrayModuleCalls());
    sb.append("  array attr calls: ");
    appendMap(sb, calls.getArrayAttrCalls());
    sb.append("  tuple table: ");
    appendMap(sb, calls.getTupleTable());
    sb.append("  conflicts: " + StringUtils.join(conflicts, ", ") + "\n");
    logger.debug(sb.toString());
  }

  private static void appendMap(StringBuilder sb, Map<?, ?> map) {
    List<String> entries = new ArrayList<String>(map.size());
    for (Entry<?, ?> e: map.entrySet()) {
      entries.add(e.getKey() + "=" + e.getValue());
    }
    sb.append("{" + StringUtils.join(entries, ", ") + "}\n");
  }
}
