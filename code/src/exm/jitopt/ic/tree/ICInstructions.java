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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.jitopt.common.lang.Var;

/**
 * This class contains instructions used in the intermediate representation.
 * Assignments carry an expression; the remaining instructions end a block.
 */
public class ICInstructions {

  public static abstract class Instruction {
    public final Opcode op;

    public Instruction(Opcode op) {
      super();
      this.op = op;
    }

    @Override
    public abstract String toString();

    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent);
      sb.append(this.toString());
      sb.append("\n");
    }

    /** List of variables the instruction writes */
    public abstract List<Var> getOutputs();

    /** List of variables the instruction reads */
    public abstract List<Var> getInputs();

    /**
     * @return labels of blocks control may pass to after this instruction
     */
    public List<Integer> getSuccessors() {
      return Collections.emptyList();
    }
  }

  public static class Assign extends Instruction {
    private final Var target;
    private final Expr value;

    public Assign(Var target, Expr value) {
      super(Opcode.ASSIGN);
      this.target = target;
      this.value = value;
    }

    public Var target() {
      return target;
    }

    public Expr value() {
      return value;
    }

    @Override
    public List<Var> getOutputs() {
      return Collections.singletonList(target);
    }

    @Override
    public List<Var> getInputs() {
      return value.getVars();
    }

    @Override
    public String toString() {
      return target + " = " + value;
    }
  }

  public static class Jump extends Instruction {
    private final int target;

    public Jump(int target) {
      super(Opcode.JUMP);
      this.target = target;
    }

    @Override
    public List<Var> getOutputs() {
      return Collections.emptyList();
    }

    @Override
    public List<Var> getInputs() {
      return Collections.emptyList();
    }

    @Override
    public List<Integer> getSuccessors() {
      return Collections.singletonList(target);
    }

    @Override
    public String toString() {
      return "jump " + target;
    }
  }

  public static class Branch extends Instruction {
    private final Var cond;
    private final int trueBranch;
    private final int falseBranch;

    public Branch(Var cond, int trueBranch, int falseBranch) {
      super(Opcode.BRANCH);
      this.cond = cond;
      this.trueBranch = trueBranch;
      this.falseBranch = falseBranch;
    }

    @Override
    public List<Var> getOutputs() {
      return Collections.emptyList();
    }

    @Override
    public List<Var> getInputs() {
      return Collections.singletonList(cond);
    }

    @Override
    public List<Integer> getSuccessors() {
      return Arrays.asList(trueBranch, falseBranch);
    }

    @Override
    public String toString() {
      return "branch " + cond + ", " + trueBranch + ", " + falseBranch;
    }
  }

  public static class Return extends Instruction {
    /** null if no value returned */
    private final Var value;

    public Return(Var value) {
      super(Opcode.RETURN);
      this.value = value;
    }

    @Override
    public List<Var> getOutputs() {
      return Collections.emptyList();
    }

    @Override
    public List<Var> getInputs() {
      if (value == null) {
        return Collections.emptyList();
      }
      return Collections.singletonList(value);
    }

    @Override
    public String toString() {
      return value == null ? "return" : "return " + value;
    }
  }
}
