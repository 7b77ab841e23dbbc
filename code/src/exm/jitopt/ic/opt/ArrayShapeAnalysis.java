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

import exm.jitopt.common.Settings;
import exm.jitopt.common.exceptions.UserException;
import exm.jitopt.ic.opt.OptimizerPass.FunctionOptimizerPass;
import exm.jitopt.ic.opt.arrayshape.ArrayAnalysis;
import exm.jitopt.ic.tree.ICTree.Function;

/**
 * Find equivalent array dimensions and make their sizes available in
 * variables for later passes, e.g. loop fusion of array expressions.
 */
public class ArrayShapeAnalysis extends FunctionOptimizerPass {

  @Override
  public String getPassName() {
    return "Array shape analysis";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_ARRAY_ANALYSIS;
  }

  @Override
  public void optimize(Logger logger, Function f) throws UserException {
    String arrayModule = Settings.get(Settings.ARRAY_MODULE);
    boolean debug = Settings.getBoolean(Settings.DEBUG_ARRAY_OPT);
    ArrayAnalysis analysis = new ArrayAnalysis(logger, f, arrayModule, debug);
    analysis.run();
    if (!analysis.getConflicts().isEmpty()) {
      logger.debug("Arrays with conflicting shapes in " + f.getName() + ": "
                   + analysis.getConflicts());
    }
  }
}
