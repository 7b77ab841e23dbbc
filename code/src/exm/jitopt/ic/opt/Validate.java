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
package exm.jitopt.ic.opt;

import org.apache.log4j.Logger;

import exm.jitopt.common.exceptions.JitRuntimeError;
import exm.jitopt.common.exceptions.UserException;
import exm.jitopt.common.lang.TypeMap;
import exm.jitopt.common.lang.Var;
import exm.jitopt.ic.tree.ICInstructions.Instruction;
import exm.jitopt.ic.tree.ICTree.Block;
import exm.jitopt.ic.tree.ICTree.Function;
import exm.jitopt.ic.tree.ICTree.Program;

/**
 * Perform some sanity checks on intermediate code:
 * - Check parameters and variables used have types
 * - Check branch targets exist
 * Variables may be reassigned, so assignment targets are not checked for
 * uniqueness.
 */
public class Validate implements OptimizerPass {

  @Override
  public String getPassName() {
    return "Validate";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  @Override
  public void optimize(Logger logger, Program program) throws UserException {
    for (Function fn: program.getFunctions()) {
      checkParams(fn);
      for (Block block: fn.getBlocks()) {
        checkBlock(logger, fn, block);
      }
    }
  }

  private void checkParams(Function fn) {
    for (Var param: fn.getParams()) {
      if (!fn.getTypeMap().contains(param.name())) {
        throw new JitRuntimeError("Parameter " + param + " of function "
                                  + fn.getName() + " has no type");
      }
    }
  }

  private void checkBlock(Logger logger, Function fn, Block block) {
    TypeMap typeMap = fn.getTypeMap();
    for (Instruction inst: block.getInstructions()) {
      for (Var in: inst.getInputs()) {
        if (!typeMap.contains(in.name())) {
          throw new JitRuntimeError("Variable " + in + " read in "
                + fn.getName() + " label " + block.getLabel() +
                " has no type: " + inst);
        }
      }
      for (Var out: inst.getOutputs()) {
        if (!typeMap.contains(out.name())) {
          throw new JitRuntimeError("Variable " + out + " assigned in "
                + fn.getName() + " label " + block.getLabel() +
                " has no type: " + inst);
        }
      }
      for (int succ: inst.getSuccessors()) {
        if (fn.getBlock(succ) == null) {
          throw new JitRuntimeError("Branch to unknown label " + succ +
                                " in " + fn.getName() + ": " + inst);
        }
      }
    }
    logger.trace("Validated " + fn.getName() + " label " + block.getLabel());
  }
}
