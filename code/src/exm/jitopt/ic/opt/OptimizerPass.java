package exm.jitopt.ic.opt;

import org.apache.log4j.Logger;

import exm.jitopt.common.exceptions.UserException;
import exm.jitopt.ic.tree.ICTree.Block;
import exm.jitopt.ic.tree.ICTree.Function;
import exm.jitopt.ic.tree.ICTree.Program;

/**
 * A pass over the intermediate representation
 */
public interface OptimizerPass {
  public String getPassName();

  /**
   * @return setting that enables the pass, or null if always enabled
   */
  public String getConfigEnabledKey();

  public void optimize(Logger logger, Program program) throws UserException;

  /**
   * Pass that rewrites each function on its own.  Logs how many
   * instructions the pass inserted into each function.
   */
  public static abstract class FunctionOptimizerPass implements OptimizerPass {

    @Override
    public void optimize(Logger logger, Program program) throws UserException {
      for (Function f: program.getFunctions()) {
        int before = instructionCount(f);
        optimize(logger, f);
        int added = instructionCount(f) - before;
        logger.debug(getPassName() + ": " + f.getName() + " +" + added +
                     " instructions");
      }
    }

    public abstract void optimize(Logger logger, Function f)
                                                 throws UserException;

    static int instructionCount(Function f) {
      int count = 0;
      for (Block b: f.getBlocks()) {
        count += b.getInstructionCount();
      }
      return count;
    }
  }
}
