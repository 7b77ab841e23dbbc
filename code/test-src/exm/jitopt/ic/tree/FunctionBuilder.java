package exm.jitopt.ic.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import exm.jitopt.common.lang.TypeMap;
import exm.jitopt.common.lang.Types;
import exm.jitopt.common.lang.Types.ArrayType;
import exm.jitopt.common.lang.Types.FunctionType;
import exm.jitopt.common.lang.Types.Type;
import exm.jitopt.common.lang.Var;
import exm.jitopt.ic.tree.Expr.Call;
import exm.jitopt.ic.tree.Expr.GetAttr;
import exm.jitopt.ic.tree.Expr.Global;
import exm.jitopt.ic.tree.Expr.Global.GlobalKind;
import exm.jitopt.ic.tree.Expr.Param;
import exm.jitopt.ic.tree.ICInstructions.Assign;
import exm.jitopt.ic.tree.ICInstructions.Instruction;
import exm.jitopt.ic.tree.ICInstructions.Return;
import exm.jitopt.ic.tree.ICTree.Block;
import exm.jitopt.ic.tree.ICTree.Function;

/**
 * Build typed functions for tests, one block at a time
 */
public class FunctionBuilder {
  public static final Type GENERIC_FN = new FunctionType(
                          new ArrayList<Type>(), Types.FLOAT64);

  private final String name;
  private final TypeMap typeMap = new TypeMap();
  private final List<Var> params = new ArrayList<Var>();
  private final List<Block> blocks = new ArrayList<Block>();
  private Block current = null;

  public FunctionBuilder(String name) {
    this.name = name;
    block(0);
  }

  public static ArrayType array(int ndims) {
    return new ArrayType(ndims, Types.FLOAT64);
  }

  public FunctionBuilder block(int label) {
    current = new Block(label);
    blocks.add(current);
    return this;
  }

  public Var param(String paramName, Type type) {
    Var v = new Var(paramName);
    params.add(v);
    return assign(paramName, type, new Param(params.size() - 1, paramName));
  }

  public Var assign(String varName, Type type, Expr value) {
    Var v = new Var(varName);
    typeMap.put(v, type);
    current.addInstruction(new Assign(v, value));
    return v;
  }

  /**
   * Bind a function of the array module, e.g. f = np.zeros
   */
  public Var arrayModuleFn(String varName, String fnName) {
    Var module = new Var("$np_" + varName);
    if (!typeMap.contains(module.name())) {
      assign(module.name(), new Types.ModuleType("numpy"),
             new Global("np", GlobalKind.MODULE, "numpy"));
    }
    return assign(varName, GENERIC_FN, new GetAttr(module, fnName));
  }

  public Var call(String varName, Type type, Var func, Var ...args) {
    return assign(varName, type, new Call(func, Arrays.asList(args)));
  }

  public FunctionBuilder add(Instruction inst) {
    current.addInstruction(inst);
    return this;
  }

  public FunctionBuilder ret(Var v) {
    return add(new Return(v));
  }

  public Function build() {
    Function f = new Function(name, params, typeMap, new CallTypes());
    for (Block b: blocks) {
      f.addBlock(b);
    }
    return f;
  }
}
