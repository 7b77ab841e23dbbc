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

import java.util.HashMap;
import java.util.Map;

import exm.jitopt.common.exceptions.JitRuntimeError;
import exm.jitopt.common.lang.Types.Type;

/**
 * Map from variable name to static type, filled by type inference.
 * Middle end passes add entries for variables they create.
 */
public class TypeMap {
  private final Map<String, Type> types = new HashMap<String, Type>();

  public void put(Var var, Type type) {
    put(var.name(), type);
  }

  public void put(String name, Type type) {
    assert(type != null) : name;
    types.put(name, type);
  }

  public boolean contains(String name) {
    return types.containsKey(name);
  }

  public Type lookup(Var var) {
    return lookup(var.name());
  }

  public Type lookup(String name) {
    Type t = types.get(name);
    if (t == null) {
      throw new JitRuntimeError("No type recorded for variable " + name);
    }
    return t;
  }

  public boolean isArray(Var var) {
    return Types.isArray(lookup(var));
  }

  public int rank(Var var) {
    return Types.arrayRank(lookup(var));
  }
}
