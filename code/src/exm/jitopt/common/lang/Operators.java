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
package exm.jitopt.common.lang;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * This class serves to define the operators and universal functions that
 * act elementwise on arrays.  The sets mirror what the type inference
 * engine accepts for array operands.
 */
public class Operators {

  /** Unary operators applied elementwise to an array */
  private static final Set<String> unaryMapOps = ImmutableSet.of(
      "+", "-", "~", "not");

  /** Binary operators applied elementwise, with broadcasting */
  private static final Set<String> binaryMapOps = ImmutableSet.of(
      "+", "-", "*", "/", "//", "%", "**",
      "<<", ">>", "&", "|", "^",
      "==", "!=", "<", "<=", ">", ">=");

  /**
   * Universal functions of the array-math module: elementwise over all
   * positional arguments, with broadcasting
   */
  private static final Set<String> ufuncs = ImmutableSet.<String>builder()
      // math operations
      .add("add", "subtract", "multiply", "divide", "logaddexp", "logaddexp2",
           "true_divide", "floor_divide", "negative", "power", "remainder",
           "mod", "fmod", "abs", "absolute", "rint", "sign", "conj", "exp",
           "exp2", "log", "log2", "log10", "expm1", "log1p", "sqrt", "square",
           "reciprocal", "conjugate")
      // trigonometric functions
      .add("sin", "cos", "tan", "arcsin", "arccos", "arctan", "arctan2",
           "hypot", "sinh", "cosh", "tanh", "arcsinh", "arccosh", "arctanh",
           "deg2rad", "rad2deg", "degrees", "radians")
      // bit-twiddling functions
      .add("bitwise_and", "bitwise_or", "bitwise_xor", "bitwise_not",
           "invert", "left_shift", "right_shift")
      // comparison functions
      .add("greater", "greater_equal", "less", "less_equal", "not_equal",
           "equal", "logical_and", "logical_or", "logical_xor", "logical_not",
           "maximum", "minimum", "fmax", "fmin")
      // floating functions
      .add("isfinite", "isinf", "isnan", "signbit", "copysign", "nextafter",
           "modf", "ldexp", "frexp", "floor", "ceil", "trunc", "spacing")
      .build();

  public static boolean isUnaryMapOp(String fn) {
    return unaryMapOps.contains(fn);
  }

  public static boolean isBinaryMapOp(String fn) {
    return binaryMapOps.contains(fn);
  }

  public static boolean isUfunc(String name) {
    return ufuncs.contains(name);
  }
}
