package exm.jitopt.ic.opt;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.jitopt.common.Settings;
import exm.jitopt.common.exceptions.InvalidOptionException;
import exm.jitopt.common.exceptions.JitRuntimeError;
import exm.jitopt.common.exceptions.UserException;
import exm.jitopt.ic.tree.ICTree.Program;


public class OptimizerPipeline {

  public OptimizerPipeline(PrintStream irOutput) {
    this.irOutput = irOutput;
  }

  private final List<OptimizerPass> passes = new ArrayList<OptimizerPass>();

  /** Where to log IR after each pass, null for none */
  private final PrintStream irOutput;

  public void addPass(OptimizerPass pass) {
    passes.add(pass);
  }

  public void runPipeline(Logger logger, Program program) throws UserException {
    for (OptimizerPass pass: passes) {
      if (passEnabled(pass)) {
        logger.debug("Pass: " + pass.getPassName());
        pass.optimize(logger, program);
        if (irOutput != null) {
          program.log(irOutput, "IR after " + pass.getPassName());
        }
      } else {
        logger.debug("Skipping disabled pass: " + pass.getPassName());
      }
    }
  }

  public boolean passEnabled(OptimizerPass pass) {
    try {
      String key = pass.getConfigEnabledKey();
      return key == null || Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new JitRuntimeError("Expected boolean config key " +
                                pass.getConfigEnabledKey() + ": " + e.getMessage());
    }
  }
}
