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
package exm.jitopt.ic.tree;

import java.util.IdentityHashMap;
import java.util.Map;

import exm.jitopt.common.lang.Types.FunctionType;

/**
 * Resolved signature for each call-like expression of a function, read
 * by lowering.  A call-like expression without a resolved signature is
 * mapped to null: lowering picks the implementation from the operand
 * types.
 */
public class CallTypes {
  private final Map<Expr, FunctionType> signatures =
                      new IdentityHashMap<Expr, FunctionType>();

  public void put(Expr expr, FunctionType signature) {
    signatures.put(expr, signature);
  }

  public boolean contains(Expr expr) {
    return signatures.containsKey(expr);
  }

  public FunctionType get(Expr expr) {
    return signatures.get(expr);
  }

  public int size() {
    return signatures.size();
  }
}
