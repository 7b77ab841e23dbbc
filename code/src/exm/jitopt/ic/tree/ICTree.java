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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import exm.jitopt.common.exceptions.JitRuntimeError;
import exm.jitopt.common.lang.TypeMap;
import exm.jitopt.common.lang.Var;
import exm.jitopt.ic.tree.ICInstructions.Instruction;

/**
 * This has the definitions for the top-level constructs in the intermediate
 * representation: programs, functions and basic blocks.
 */
public class ICTree {

  public static class Program {
    private final List<Function> functions = new ArrayList<Function>();

    public void addFunction(Function fn) {
      functions.add(fn);
    }

    public List<Function> getFunctions() {
      return Collections.unmodifiableList(functions);
    }

    public Function lookupFunction(String name) {
      for (Function f: functions) {
        if (f.getName().equals(name)) {
          return f;
        }
      }
      return null;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      prettyPrint(sb);
      return sb.toString();
    }

    public void prettyPrint(StringBuilder out) {
      for (Function f: functions) {
        f.prettyPrint(out);
        out.append("\n");
      }
    }

    public void log(PrintStream icOutput, String codeTitle) {
      StringBuilder ic = new StringBuilder();
      try {
        icOutput.append("\n\n" + codeTitle + ": \n" +
            "============================================\n");
        prettyPrint(ic) ;
        icOutput.append(ic.toString());
        icOutput.flush();
      } catch (RuntimeException e) {
        icOutput.append("ERROR while printing IR. Got: "
            + ic.toString());
        icOutput.flush();
        throw new JitRuntimeError("Error while printing IR: " +
        e.toString());
      }
    }
  }

  public static class Function {
    private final String name;
    private final List<Var> params;

    /** Blocks in stored order, keyed by label */
    private final Map<Integer, Block> blocks =
                              new LinkedHashMap<Integer, Block>();

    private final TypeMap typeMap;
    private final CallTypes callTypes;

    /** Counter for generating unique names */
    private long nextUniqueId = 1;

    public Function(String name, List<Var> params, TypeMap typeMap,
                    CallTypes callTypes) {
      this.name = name;
      this.params = Collections.unmodifiableList(new ArrayList<Var>(params));
      this.typeMap = typeMap;
      this.callTypes = callTypes;
    }

    public String getName() {
      return name;
    }

    public List<Var> getParams() {
      return params;
    }

    public TypeMap getTypeMap() {
      return typeMap;
    }

    public CallTypes getCallTypes() {
      return callTypes;
    }

    public void addBlock(Block block) {
      if (blocks.containsKey(block.getLabel())) {
        throw new JitRuntimeError("Duplicate block label " + block.getLabel()
                                  + " in " + name);
      }
      blocks.put(block.getLabel(), block);
    }

    public Block getBlock(int label) {
      return blocks.get(label);
    }

    /**
     * @return blocks in the order they are stored, which need not
     *         match control flow order
     */
    public Collection<Block> getBlocks() {
      return Collections.unmodifiableCollection(blocks.values());
    }

    /**
     * Create a variable name not yet used in this function
     * @param prefix
     * @return name of form prefix.N
     */
    public String uniqueVarName(String prefix) {
      String candidate;
      do {
        candidate = prefix + "." + nextUniqueId++;
      } while (typeMap.contains(candidate));
      return candidate;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      prettyPrint(sb);
      return sb.toString();
    }

    public void prettyPrint(StringBuilder out) {
      out.append("function " + name + "(" + StringUtils.join(params, ", ")
                 + ") {\n");
      for (Block b: blocks.values()) {
        b.prettyPrint(out, "  ");
      }
      out.append("}\n");
    }
  }

  public static class Block {
    private final int label;
    private final List<Instruction> instructions;

    public Block(int label) {
      this(label, new ArrayList<Instruction>());
    }

    public Block(int label, List<Instruction> instructions) {
      this.label = label;
      this.instructions = new ArrayList<Instruction>(instructions);
    }

    public int getLabel() {
      return label;
    }

    /**
     * @return unmodifiable view of the instructions
     */
    public List<Instruction> getInstructions() {
      return Collections.unmodifiableList(instructions);
    }

    public void addInstruction(Instruction inst) {
      instructions.add(inst);
    }

    /**
     * Replace the whole body of the block
     * @param newInstructions
     */
    public void replaceInstructions(List<Instruction> newInstructions) {
      instructions.clear();
      instructions.addAll(newInstructions);
    }

    public int getInstructionCount() {
      return instructions.size();
    }

    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent);
      sb.append("label " + label + ":\n");
      for (Instruction i: instructions) {
        i.prettyPrint(sb, indent + "  ");
      }
    }
  }
}
