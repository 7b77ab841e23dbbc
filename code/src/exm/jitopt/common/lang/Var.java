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

/**
 * A variable in the intermediate representation.  Variables are
 * identified by name, which is unique within a function.  Static types
 * live in the function's TypeMap, not here.
 */
public class Var implements Comparable<Var> {
  private final String name;

  public Var(String name) {
    assert(name != null);
    this.name = name;
  }

  public String name() {
    return name;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Var)) {
      return false;
    }
    return name.equals(((Var)obj).name);
  }

  @Override
  public int compareTo(Var o) {
    return name.compareTo(o.name);
  }

  @Override
  public String toString() {
    return name;
  }
}
