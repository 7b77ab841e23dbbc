package exm.jitopt.ic.opt.arrayshape;

import static exm.jitopt.ic.tree.FunctionBuilder.array;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.jitopt.common.Logging;
import exm.jitopt.common.lang.Arg;
import exm.jitopt.common.lang.Types;
import exm.jitopt.common.lang.Types.TupleType;
import exm.jitopt.common.lang.Var;
import exm.jitopt.ic.tree.Expr;
import exm.jitopt.ic.tree.Expr.BinOp;
import exm.jitopt.ic.tree.Expr.GetAttr;
import exm.jitopt.ic.tree.Expr.Unary;
import exm.jitopt.ic.tree.Expr.VarRef;
import exm.jitopt.ic.tree.FunctionBuilder;
import exm.jitopt.ic.tree.ICInstructions.Assign;
import exm.jitopt.ic.tree.ICInstructions.Branch;
import exm.jitopt.ic.tree.ICInstructions.Instruction;
import exm.jitopt.ic.tree.ICInstructions.Jump;
import exm.jitopt.ic.tree.ICTree.Block;
import exm.jitopt.ic.tree.ICTree.Function;
import exm.jitopt.ic.tree.Opcode;

public class ArrayAnalysisTest {
  private static final Logger logger = Logging.getJitLogger();

  private static ArrayAnalysis analyze(Function f) {
    ArrayAnalysis analysis = new ArrayAnalysis(logger, f, "numpy", true);
    analysis.run();
    return analysis;
  }

  private static int countSizeFetches(Function f) {
    int count = 0;
    for (Block b: f.getBlocks()) {
      for (Instruction inst: b.getInstructions()) {
        if (inst.op == Opcode.ASSIGN &&
            ((Assign)inst).value().kind == Expr.ExprKind.STATIC_GETITEM) {
          count++;
        }
      }
    }
    return count;
  }

  private static List<Instruction> allInstructions(Function f) {
    List<Instruction> result = new ArrayList<Instruction>();
    for (Block b: f.getBlocks()) {
      result.addAll(b.getInstructions());
    }
    return result;
  }

  private static Function addFunction() {
    FunctionBuilder fb = new FunctionBuilder("add");
    Var a = fb.param("a", array(1));
    Var b = fb.param("b", array(1));
    Var c = fb.assign("c", array(1), new BinOp("+", a, b));
    fb.ret(c);
    return fb.build();
  }

  @Test
  public void testAddSharesClass() {
    Function f = addFunction();
    ArrayAnalysis analysis = analyze(f);
    Var a = new Var("a"), b = new Var("b"), c = new Var("c");

    List<Integer> shapeC = analysis.getShape(c);
    assertEquals("Operands and result in same class",
                 analysis.getShape(a), shapeC);
    assertEquals(analysis.getShape(b), shapeC);
    assertEquals(1, shapeC.size());

    // a and b each get a size fetch, c reuses a's
    assertEquals(2, countSizeFetches(f));
    assertEquals(Collections.singletonList(
                    Arg.createVar(new Var("asize0.3"))),
                 analysis.getSizeVars(c));
    assertEquals("Both sizes recorded for merged class",
        Arrays.asList(Arg.createVar(new Var("asize0.3")),
                      Arg.createVar(new Var("bsize0.6"))),
        analysis.getClassSizes().get(shapeC.get(0)));
    assertTrue(analysis.getConflicts().isEmpty());
  }

  @Test
  public void testGeneratedCode() {
    Function f = addFunction();
    analyze(f);

    List<Instruction> insts = f.getBlock(0).getInstructions();
    // a, 3 for size of a, b, 3 for size of b, c, return
    assertEquals(9, insts.size());
    assertEquals(new Var("a"), ((Assign)insts.get(0)).target());

    Assign attr = (Assign)insts.get(1);
    assertEquals(new Var("a_sh_attr0.1"), attr.target());
    GetAttr getAttr = (GetAttr)attr.value();
    assertEquals(new Var("a"), getAttr.value);
    assertEquals("shape", getAttr.attr);

    Assign constant = (Assign)insts.get(2);
    assertEquals(new Var("$consta0.2"), constant.target());
    assertEquals(Expr.ExprKind.CONST, constant.value().kind);

    Assign size = (Assign)insts.get(3);
    assertEquals(new Var("asize0.3"), size.target());
    assertEquals(Expr.ExprKind.STATIC_GETITEM, size.value().kind);

    assertEquals(new Var("c"), ((Assign)insts.get(7)).target());
    assertEquals(Opcode.RETURN, insts.get(8).op);

    assertEquals(TupleType.uniTuple(Types.INT64, 1),
                 f.getTypeMap().lookup("a_sh_attr0.1"));
    assertEquals(Types.INT64, f.getTypeMap().lookup("$consta0.2"));
    assertEquals(Types.INT64, f.getTypeMap().lookup("asize0.3"));

    assertTrue(f.getCallTypes().contains(size.value()));
    assertNull("Item lookup has no signature",
               f.getCallTypes().get(size.value()));
    assertEquals(2, f.getCallTypes().size());
  }

  @Test
  public void testRerunInsertsNothing() {
    Function f = addFunction();
    analyze(f);
    List<Instruction> before = allInstructions(f);

    ArrayAnalysis second = analyze(f);
    assertEquals("Second run should reuse existing size fetches",
                 before, allInstructions(f));
    assertEquals(Collections.singletonList(
                    Arg.createVar(new Var("asize0.3"))),
                 second.getSizeVars(new Var("c")));
    assertEquals(second.getShape(new Var("a")),
                 second.getShape(new Var("c")));
  }

  @Test
  public void testUnaryAndCastKeepShape() {
    FunctionBuilder fb = new FunctionBuilder("unary");
    Var a = fb.param("a", array(2));
    Var neg = fb.assign("neg", array(2), new Unary("-", a));
    Var cast = fb.assign("cast", array(2), new Expr.Cast(neg));
    Var copy = fb.assign("copy", array(2), new VarRef(cast));
    Function f = fb.build();

    ArrayAnalysis analysis = analyze(f);
    assertEquals(analysis.getShape(a), analysis.getShape(neg));
    assertEquals(analysis.getShape(a), analysis.getShape(cast));
    assertEquals(analysis.getShape(a), analysis.getShape(copy));
    assertEquals("Only sizes of a fetched", 2, countSizeFetches(f));
  }

  @Test
  public void testTransposeInvolution() {
    FunctionBuilder fb = new FunctionBuilder("transpose");
    Var a = fb.param("a", array(2));
    Var t = fb.assign("t", array(2), new GetAttr(a, "T"));
    Var tt = fb.assign("tt", array(2), new GetAttr(t, "T"));
    Function f = fb.build();

    ArrayAnalysis analysis = analyze(f);
    List<Integer> shapeA = analysis.getShape(a);
    List<Integer> reversed = new ArrayList<Integer>(shapeA);
    Collections.reverse(reversed);
    assertEquals(reversed, analysis.getShape(t));
    assertEquals(shapeA, analysis.getShape(tt));
    assertNotEquals(shapeA.get(0), shapeA.get(1));
    assertEquals(Arrays.asList(analysis.getSizeVars(a).get(1),
                               analysis.getSizeVars(a).get(0)),
                 analysis.getSizeVars(t));
  }

  @Test
  public void testConflictDowngrade() {
    FunctionBuilder fb = new FunctionBuilder("conflict");
    Var a = fb.param("a", array(1));
    Var b = fb.param("b", array(1));
    Var cond = fb.param("cond", Types.BOOL);
    fb.add(new Branch(cond, 1, 2));
    fb.block(1);
    Var c = fb.assign("c", array(1), new VarRef(a));
    fb.add(new Jump(3));
    fb.block(2);
    fb.assign("c", array(1), new VarRef(b));
    fb.add(new Jump(3));
    fb.block(3);
    fb.ret(c);
    Function f = fb.build();

    ArrayAnalysis analysis = analyze(f);
    assertEquals(Collections.singletonList(EquivClasses.UNKNOWN),
                 analysis.getShape(c));
    assertEquals(Collections.singleton(c), analysis.getConflicts());
    assertEquals(Collections.singletonList(EquivClasses.UNKNOWN),
                 analysis.getShapes().get(c));
    assertNull(analysis.getSizeVars(c));
    assertEquals("No code for conflicting assignment",
                 2, f.getBlock(2).getInstructionCount());
    assertFalse("a and b not merged",
        analysis.getShape(a).equals(analysis.getShape(b)));
  }

  @Test
  public void testUnknownCallGetsSizesFromArray() {
    FunctionBuilder fb = new FunctionBuilder("unknown");
    Var a = fb.param("a", array(1));
    Var g = fb.assign("g", FunctionBuilder.GENERIC_FN,
        new Expr.Global("mystery", Expr.Global.GlobalKind.FUNCTION, "mystery"));
    Var d = fb.call("d", array(2), g, a);
    Function f = fb.build();

    ArrayAnalysis analysis = analyze(f);
    assertEquals(Arrays.asList(EquivClasses.UNKNOWN, EquivClasses.UNKNOWN),
                 analysis.getShape(d));
    List<Arg> sizes = analysis.getSizeVars(d);
    assertEquals(2, sizes.size());
    assertTrue(sizes.get(0).isVar());
    assertTrue(sizes.get(0).getVar().name().startsWith("dsize0."));
    assertTrue(sizes.get(1).getVar().name().startsWith("dsize1."));
    assertEquals(3, countSizeFetches(f));
    assertFalse("Unknown class never gets sizes",
        analysis.getClassSizes().containsKey(EquivClasses.UNKNOWN));
    assertTrue(analysis.getConflicts().isEmpty());
  }

  @Test
  public void testRankMismatchIsUnknown() {
    FunctionBuilder fb = new FunctionBuilder("rank");
    Var a = fb.param("a", array(2));
    Var transpose = fb.arrayModuleFn("transpose", "transpose");
    Var d = fb.call("d", array(1), transpose, a);

    ArrayAnalysis analysis = analyze(fb.build());
    assertEquals(Collections.singletonList(EquivClasses.UNKNOWN),
                 analysis.getShape(d));
  }

  @Test
  public void testInplaceBinopMerges() {
    FunctionBuilder fb = new FunctionBuilder("inplace");
    Var a = fb.param("a", array(2));
    Var b = fb.param("b", array(1));
    Var c = fb.assign("c", array(2),
                      new Expr.InplaceBinOp("+=", "+", a, b));
    Function f = fb.build();

    ArrayAnalysis analysis = analyze(f);
    List<Integer> shapeA = analysis.getShape(a);
    assertEquals("Trailing dimensions aligned",
                 shapeA.get(1), analysis.getShape(b).get(0));
    assertEquals(shapeA, analysis.getShape(c));
  }

  @Test
  public void testNonMapBinopUnsupported() {
    FunctionBuilder fb = new FunctionBuilder("matmul");
    Var a = fb.param("a", array(2));
    Var b = fb.param("b", array(2));
    Var c = fb.assign("c", array(2), new BinOp("@", a, b));
    Function f = fb.build();

    ArrayAnalysis analysis = analyze(f);
    assertEquals(Arrays.asList(EquivClasses.UNKNOWN, EquivClasses.UNKNOWN),
                 analysis.getShape(c));
    assertEquals(6, countSizeFetches(f));
  }
}
