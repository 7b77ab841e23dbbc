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
package exm.jitopt.common.exceptions;

/**
 * No shape inference rule exists for an expression or a named call.
 * Callers fall back to an unknown shape for the assigned array.
 */
public class UnsupportedShapeException extends UserException {

  /** Name of the unsupported operation or called function */
  private final String operation;

  public UnsupportedShapeException(String operation, String message) {
    super(message);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }

  private static final long serialVersionUID = 1L;
}
