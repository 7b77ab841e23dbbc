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
package exm.jitopt.common;

import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.Sets;

/**
 * Logger shared by the optimizer passes
 */
public class Logging {
  private static final Logger logger = Logger.getLogger("exm.jitopt");

  /** Warnings already shown at warn level */
  private static final Set<String> warned = Sets.newConcurrentHashSet();

  public static Logger getJitLogger() {
    return logger;
  }

  /**
   * Warn once per distinct message; repeats go to the debug log
   * @param msg
   */
  public static void uniqueWarn(String msg) {
    if (warned.add(msg)) {
      logger.warn(msg);
    } else {
      logger.debug("Repeated warning: " + msg);
    }
  }
}
