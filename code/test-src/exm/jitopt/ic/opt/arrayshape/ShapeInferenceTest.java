package exm.jitopt.ic.opt.arrayshape;

import static exm.jitopt.ic.tree.FunctionBuilder.array;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.jitopt.common.Logging;
import exm.jitopt.common.exceptions.UnsupportedShapeException;
import exm.jitopt.common.lang.Arg;
import exm.jitopt.common.lang.TypeMap;
import exm.jitopt.common.lang.Types;
import exm.jitopt.common.lang.Types.TupleType;
import exm.jitopt.common.lang.Var;
import exm.jitopt.ic.tree.Expr.ArrayExpr;
import exm.jitopt.ic.tree.Expr.ArrayExprNode;
import exm.jitopt.ic.tree.Expr.BuildTuple;
import exm.jitopt.ic.tree.Expr.Const;
import exm.jitopt.ic.tree.Expr.GetAttr;
import exm.jitopt.ic.tree.Expr.Global;
import exm.jitopt.ic.tree.Expr.Global.GlobalKind;
import exm.jitopt.ic.tree.FunctionBuilder;

public class ShapeInferenceTest {
  private static final Logger logger = Logging.getJitLogger();

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static ArrayAnalysis analyze(FunctionBuilder fb) {
    ArrayAnalysis analysis = new ArrayAnalysis(logger, fb.build(), "numpy",
                                               false);
    analysis.run();
    return analysis;
  }

  private static List<Arg> vars(Var ...vars) {
    return Arg.fromVarList(Arrays.asList(vars));
  }

  @Test
  public void testZerosFromTuple() {
    FunctionBuilder fb = new FunctionBuilder("zeros");
    Var m = fb.param("m", Types.INT64);
    Var n = fb.param("n", Types.INT64);
    Var t = fb.assign("t", TupleType.uniTuple(Types.INT64, 2),
                      new BuildTuple(Arrays.asList(m, n)));
    Var zeros = fb.arrayModuleFn("zeros", "zeros");
    Var z = fb.call("z", array(2), zeros, t);
    ArrayAnalysis analysis = analyze(fb);

    assertEquals("Sizes taken from shape argument",
                 vars(m, n), analysis.getSizeVars(z));
    assertNotEquals(analysis.getShape(z).get(0),
                    analysis.getShape(z).get(1));
  }

  @Test
  public void testOnesFromScalar() {
    FunctionBuilder fb = new FunctionBuilder("ones");
    Var n = fb.param("n", Types.INT64);
    Var ones = fb.arrayModuleFn("ones", "ones");
    Var z = fb.call("z", array(1), ones, n);
    ArrayAnalysis analysis = analyze(fb);

    assertEquals(vars(n), analysis.getSizeVars(z));
  }

  @Test
  public void testEmptyFromConstTuple() {
    FunctionBuilder fb = new FunctionBuilder("empty");
    Var t = fb.assign("t", TupleType.uniTuple(Types.INT64, 2),
        Const.tuple(Arrays.asList(Arg.createIntLit(3), Arg.createIntLit(4))));
    Var empty = fb.arrayModuleFn("empty", "empty");
    Var z = fb.call("z", array(2), empty, t);
    ArrayAnalysis analysis = analyze(fb);

    assertEquals(Arrays.asList(Arg.createIntLit(3), Arg.createIntLit(4)),
                 analysis.getSizeVars(z));
  }

  @Test
  public void testZerosFromShapeAttr() {
    FunctionBuilder fb = new FunctionBuilder("zerosShape");
    Var b = fb.param("b", array(2));
    Var s = fb.assign("s", TupleType.uniTuple(Types.INT64, 2),
                      new GetAttr(b, "shape"));
    Var zeros = fb.arrayModuleFn("zeros", "zeros");
    Var z = fb.call("z", array(2), zeros, s);
    ArrayAnalysis analysis = analyze(fb);

    assertEquals(analysis.getShape(b), analysis.getShape(z));
    assertEquals(analysis.getSizeVars(b), analysis.getSizeVars(z));
  }

  @Test
  public void testZerosFromUnknownTuple() {
    FunctionBuilder fb = new FunctionBuilder("zerosParam");
    Var t = fb.param("t", TupleType.uniTuple(Types.INT64, 2));
    Var zeros = fb.arrayModuleFn("zeros", "zeros");
    Var z = fb.call("z", array(2), zeros, t);
    ArrayAnalysis analysis = analyze(fb);

    List<Integer> shape = analysis.getShape(z);
    assertEquals(2, shape.size());
    assertTrue(shape.get(0) > 0);
    assertTrue(shape.get(1) > 0);
    assertTrue("Sizes fetched from new array",
        analysis.getSizeVars(z).get(0).getVar().name().startsWith("zsize0."));
  }

  @Test
  public void testLike() {
    FunctionBuilder fb = new FunctionBuilder("like");
    Var a = fb.param("a", array(3));
    Var like = fb.arrayModuleFn("like", "zeros_like");
    Var z = fb.call("z", array(3), like, a);
    ArrayAnalysis analysis = analyze(fb);

    assertEquals(analysis.getShape(a), analysis.getShape(z));
  }

  @Test
  public void testReshapeTuple() {
    FunctionBuilder fb = new FunctionBuilder("reshape");
    Var a = fb.param("a", array(1));
    Var m = fb.param("m", Types.INT64);
    Var n = fb.param("n", Types.INT64);
    Var t = fb.assign("t", TupleType.uniTuple(Types.INT64, 2),
                      new BuildTuple(Arrays.asList(m, n)));
    Var reshape = fb.arrayModuleFn("reshape", "reshape");
    Var r = fb.call("r", array(2), reshape, a, t);
    ArrayAnalysis analysis = analyze(fb);

    assertEquals(vars(m, n), analysis.getSizeVars(r));
  }

  @Test
  public void testReshapeInferredDimension() {
    FunctionBuilder fb = new FunctionBuilder("reshapeInferred");
    Var a = fb.param("a", array(1));
    Var t = fb.assign("t", TupleType.uniTuple(Types.INT64, 2),
        Const.tuple(Arrays.asList(Arg.createIntLit(-1), Arg.createIntLit(4))));
    Var reshape = fb.arrayModuleFn("reshape", "reshape");
    Var r = fb.call("r", array(2), reshape, a, t);
    ArrayAnalysis analysis = analyze(fb);

    List<Arg> sizes = analysis.getSizeVars(r);
    assertTrue("-1 dimension fetched from result",
               sizes.get(0).getVar().name().startsWith("rsize0."));
    assertEquals(Arg.createIntLit(4), sizes.get(1));
  }

  @Test
  public void testReshapeMethod() {
    FunctionBuilder fb = new FunctionBuilder("reshapeMethod");
    Var a = fb.param("a", array(1));
    Var m = fb.param("m", Types.INT64);
    Var n = fb.param("n", Types.INT64);
    Var reshape = fb.assign("reshape", FunctionBuilder.GENERIC_FN,
                            new GetAttr(a, "reshape"));
    Var r = fb.call("r", array(2), reshape, m, n);
    ArrayAnalysis analysis = analyze(fb);

    assertEquals(vars(m, n), analysis.getSizeVars(r));
  }

  @Test
  public void testTransposeMethod() {
    FunctionBuilder fb = new FunctionBuilder("transposeMethod");
    Var a = fb.param("a", array(2));
    Var transpose = fb.assign("transpose", FunctionBuilder.GENERIC_FN,
                              new GetAttr(a, "transpose"));
    Var t = fb.call("t", array(2), transpose);
    ArrayAnalysis analysis = analyze(fb);

    List<Integer> shapeA = analysis.getShape(a);
    assertEquals(Arrays.asList(shapeA.get(1), shapeA.get(0)),
                 analysis.getShape(t));
  }

  @Test
  public void testDotMatrix() {
    FunctionBuilder fb = new FunctionBuilder("dot");
    Var a = fb.param("a", array(2));
    Var b = fb.param("b", array(2));
    Var dot = fb.arrayModuleFn("dot", "dot");
    Var c = fb.call("c", array(2), dot, a, b);
    ArrayAnalysis analysis = analyze(fb);

    List<Integer> shapeA = analysis.getShape(a);
    List<Integer> shapeB = analysis.getShape(b);
    assertEquals("Inner dimensions merged", shapeA.get(1), shapeB.get(0));
    assertEquals(Arrays.asList(shapeA.get(0), shapeB.get(1)),
                 analysis.getShape(c));
  }

  @Test
  public void testDotVector() {
    FunctionBuilder fb = new FunctionBuilder("dotVector");
    Var a = fb.param("a", array(2));
    Var v = fb.param("v", array(1));
    Var dot = fb.assign("dot", FunctionBuilder.GENERIC_FN,
                        new GetAttr(a, "dot"));
    Var c = fb.call("c", array(1), dot, v);
    ArrayAnalysis analysis = analyze(fb);

    List<Integer> shapeA = analysis.getShape(a);
    assertEquals(shapeA.get(1), analysis.getShape(v).get(0));
    assertEquals(Collections.singletonList(shapeA.get(0)),
                 analysis.getShape(c));
  }

  @Test
  public void testUfuncBroadcast() {
    FunctionBuilder fb = new FunctionBuilder("ufunc");
    Var a = fb.param("a", array(2));
    Var b = fb.param("b", array(1));
    Var add = fb.arrayModuleFn("add", "add");
    Var c = fb.call("c", array(2), add, a, b);
    ArrayAnalysis analysis = analyze(fb);

    List<Integer> shapeA = analysis.getShape(a);
    assertEquals(shapeA.get(1), analysis.getShape(b).get(0));
    assertEquals(shapeA, analysis.getShape(c));
  }

  @Test
  public void testUfuncGlobalIsMapCall() {
    FunctionBuilder fb = new FunctionBuilder("sin");
    Var a = fb.param("a", array(2));
    Var sin = fb.assign("sin", FunctionBuilder.GENERIC_FN,
                        new Global("sin", GlobalKind.UFUNC, "sin"));
    Var c = fb.call("c", array(2), sin, a);
    ArrayAnalysis analysis = analyze(fb);

    assertEquals(analysis.getShape(a), analysis.getShape(c));
    assertTrue(analysis.getCallTables().isMapCall(sin));
  }

  @Test
  public void testMapCallScalarFirstArg() {
    FunctionBuilder fb = new FunctionBuilder("sinscalar");
    Var x = fb.param("x", Types.FLOAT64);
    Var a = fb.param("a", array(1));
    Var sin = fb.assign("sin", FunctionBuilder.GENERIC_FN,
                        new Global("sin", GlobalKind.UFUNC, "sin"));
    Var c = fb.call("c", array(1), sin, x, a);
    ArrayAnalysis analysis = analyze(fb);

    assertEquals(Collections.singletonList(EquivClasses.UNKNOWN),
                 analysis.getShape(c));
    assertTrue(analysis.getSizeVars(c).get(0).getVar().name()
                                              .startsWith("csize0."));
  }

  @Test
  public void testArrayExpr() {
    FunctionBuilder fb = new FunctionBuilder("arrayexpr");
    Var a = fb.param("a", array(1));
    Var b = fb.param("b", array(1));
    Var x = fb.param("x", Types.FLOAT64);
    ArrayExprNode tree = ArrayExprNode.op("+",
        ArrayExprNode.op("*", ArrayExprNode.leaf(a), ArrayExprNode.leaf(x)),
        ArrayExprNode.op("-", ArrayExprNode.leaf(b),
            ArrayExprNode.op("*", ArrayExprNode.leaf(a),
                             ArrayExprNode.leaf(Arg.createFloatLit(2.0)))));
    Var c = fb.assign("c", array(1), new ArrayExpr(tree));
    ArrayAnalysis analysis = analyze(fb);

    assertEquals(analysis.getShape(a), analysis.getShape(b));
    assertEquals(analysis.getShape(a), analysis.getShape(c));
  }

  @Test
  public void testUnknownNamedCall() throws UnsupportedShapeException {
    ShapeTable shapes = new ShapeTable();
    EquivClasses classes = new EquivClasses(logger, shapes);
    TypeMap typeMap = new TypeMap();
    ShapeInference inference = new ShapeInference(logger, typeMap, shapes,
        classes, new CallTables(logger, "numpy"),
        new Broadcast(classes, shapes, typeMap));
    Var a = new Var("a");
    typeMap.put(a, array(1));
    shapes.record(a, Arrays.asList(classes.allocate()));

    exception.expect(UnsupportedShapeException.class);
    inference.namedCallShape("cumsum", Arrays.asList(a));
  }

  @Test
  public void testDotWrongArgCount() throws UnsupportedShapeException {
    ShapeTable shapes = new ShapeTable();
    EquivClasses classes = new EquivClasses(logger, shapes);
    TypeMap typeMap = new TypeMap();
    ShapeInference inference = new ShapeInference(logger, typeMap, shapes,
        classes, new CallTables(logger, "numpy"),
        new Broadcast(classes, shapes, typeMap));
    Var a = new Var("a");
    typeMap.put(a, array(1));
    shapes.record(a, Arrays.asList(classes.allocate()));

    exception.expect(UnsupportedShapeException.class);
    inference.namedCallShape("dot", Arrays.asList(a));
  }
}
