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

import java.io.PrintStream;

import org.apache.log4j.Logger;

import exm.jitopt.common.Settings;
import exm.jitopt.common.exceptions.UserException;
import exm.jitopt.ic.tree.ICTree.Program;

public class JitOptimizer {

  /**
   * Run the middle end passes over the program.
   *
   * NOTE: the input is modified in-place
   * @param irOutput where to log IR between passes.  Null for
   *              no output
   * @return the program
   * @throws UserException
   */
  public static Program optimize(Logger logger, PrintStream irOutput,
                                 Program prog) throws UserException {
    boolean logIR = irOutput != null;
    if (logIR) {
      prog.log(irOutput, "Initial IR before optimization");
    }

    boolean debug = Settings.getBoolean(Settings.COMPILER_DEBUG);

    OptimizerPipeline pipe = new OptimizerPipeline(irOutput);
    if (debug)
      pipe.addPass(new Validate());
    pipe.addPass(new ArrayShapeAnalysis());
    // Check generated size variables were typed
    if (debug)
      pipe.addPass(new Validate());
    pipe.runPipeline(logger, prog);

    if (logIR) {
      prog.log(irOutput, "Final optimized IR");
    }
    return prog;
  }
}
