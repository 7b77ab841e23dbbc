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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.jitopt.common.exceptions.JitRuntimeError;

/**
 * Static types produced by type inference and consumed by the middle end.
 *
 * The base class for variable types is Type.  Arrays carry their rank and
 * element kind, scalars an int/float/bool distinction, tuples their element
 * types.
 */
public class Types {

  /**
   * Broad categories of types
   */
  public static enum StructureType {
    SCALAR,
    ARRAY,
    TUPLE,
    FUNCTION,
    MODULE,
  }

  /**
   * Enum to represent the primitive element kinds.
   */
  public static enum PrimType {
    INT, FLOAT, BOOL;

    public String typeName() {
      switch (this) {
        case INT:
          return "int";
        case FLOAT:
          return "float";
        case BOOL:
          return "bool";
        default:
          throw new JitRuntimeError("typeName not implemented for " + this);
      }
    }
  }

  public abstract static class Type {
    public abstract StructureType structureType();

    public abstract String typeName();

    @Override
    public abstract boolean equals(Object other);

    @Override
    public abstract int hashCode();

    @Override
    public String toString() {
      return typeName();
    }
  }

  public static class ScalarType extends Type {
    private final PrimType primType;
    private final int bits;

    public ScalarType(PrimType primType, int bits) {
      this.primType = primType;
      this.bits = bits;
    }

    public PrimType primType() {
      return primType;
    }

    @Override
    public StructureType structureType() {
      return StructureType.SCALAR;
    }

    @Override
    public String typeName() {
      if (primType == PrimType.BOOL) {
        return primType.typeName();
      }
      return primType.typeName() + bits;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ScalarType)) {
        return false;
      }
      ScalarType otherT = (ScalarType) other;
      return otherT.primType == primType && otherT.bits == bits;
    }

    @Override
    public int hashCode() {
      return primType.hashCode() * 31 + bits;
    }
  }

  public static class ArrayType extends Type {
    private final int ndim;
    private final ScalarType dtype;

    public ArrayType(int ndim, ScalarType dtype) {
      if (ndim < 0) {
        throw new JitRuntimeError("Negative array rank: " + ndim);
      }
      this.ndim = ndim;
      this.dtype = dtype;
    }

    public int ndim() {
      return ndim;
    }

    @Override
    public StructureType structureType() {
      return StructureType.ARRAY;
    }

    @Override
    public String typeName() {
      return "array(" + dtype.typeName() + ", " + ndim + "d)";
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ArrayType)) {
        return false;
      }
      ArrayType otherT = (ArrayType) other;
      return otherT.ndim == ndim && otherT.dtype.equals(dtype);
    }

    @Override
    public int hashCode() {
      return dtype.hashCode() + 13 *
            (ArrayType.class.hashCode() + 13 * ndim);
    }
  }

  public static class TupleType extends Type {
    private final List<Type> elemTypes;

    public TupleType(List<Type> elemTypes) {
      this.elemTypes = Collections.unmodifiableList(
                            new ArrayList<Type>(elemTypes));
    }

    /**
     * @return tuple with count elements, all of the same type
     */
    public static TupleType uniTuple(Type elemType, int count) {
      return new TupleType(Collections.nCopies(count, elemType));
    }

    public List<Type> elemTypes() {
      return elemTypes;
    }

    public int count() {
      return elemTypes.size();
    }

    @Override
    public StructureType structureType() {
      return StructureType.TUPLE;
    }

    @Override
    public String typeName() {
      return "(" + StringUtils.join(elemTypes, ", ") + ")";
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof TupleType)) {
        return false;
      }
      return ((TupleType)other).elemTypes.equals(elemTypes);
    }

    @Override
    public int hashCode() {
      return TupleType.class.hashCode() + 13 * elemTypes.hashCode();
    }
  }

  /**
   * Type of a callable value, also used as a call signature
   */
  public static class FunctionType extends Type {
    private final List<Type> inputs;
    private final Type output;

    public FunctionType(List<Type> inputs, Type output) {
      this.inputs = Collections.unmodifiableList(new ArrayList<Type>(inputs));
      this.output = output;
    }

    @Override
    public StructureType structureType() {
      return StructureType.FUNCTION;
    }

    @Override
    public String typeName() {
      return "(" + StringUtils.join(inputs, ", ") + ") -> " + output;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof FunctionType)) {
        return false;
      }
      FunctionType otherT = (FunctionType) other;
      return otherT.inputs.equals(inputs) &&
             (output == null ? otherT.output == null :
                               output.equals(otherT.output));
    }

    @Override
    public int hashCode() {
      return inputs.hashCode() * 31 + (output == null ? 0 : output.hashCode());
    }
  }

  public static class ModuleType extends Type {
    private final String moduleName;

    public ModuleType(String moduleName) {
      this.moduleName = moduleName;
    }

    @Override
    public StructureType structureType() {
      return StructureType.MODULE;
    }

    @Override
    public String typeName() {
      return "module(" + moduleName + ")";
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ModuleType)) {
        return false;
      }
      return ((ModuleType)other).moduleName.equals(moduleName);
    }

    @Override
    public int hashCode() {
      return moduleName.hashCode();
    }
  }

  public static final ScalarType INT64 = new ScalarType(PrimType.INT, 64);
  public static final ScalarType FLOAT64 = new ScalarType(PrimType.FLOAT, 64);
  public static final ScalarType BOOL = new ScalarType(PrimType.BOOL, 8);

  public static boolean isArray(Type t) {
    return t.structureType() == StructureType.ARRAY;
  }

  public static boolean isScalar(Type t) {
    return t.structureType() == StructureType.SCALAR;
  }

  public static boolean isInt(Type t) {
    return isScalar(t) && ((ScalarType)t).primType() == PrimType.INT;
  }

  public static boolean isTuple(Type t) {
    return t.structureType() == StructureType.TUPLE;
  }

  /**
   * @return true if all tuple elements are integers
   */
  public static boolean isIntTuple(Type t) {
    if (!isTuple(t)) {
      return false;
    }
    for (Type elem: ((TupleType)t).elemTypes()) {
      if (!isInt(elem)) {
        return false;
      }
    }
    return true;
  }

  public static int arrayRank(Type t) {
    if (!isArray(t)) {
      throw new JitRuntimeError("Expected array type, but got " + t);
    }
    return ((ArrayType)t).ndim();
  }
}
