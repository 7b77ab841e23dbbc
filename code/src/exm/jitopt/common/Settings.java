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

import java.util.Properties;

import exm.jitopt.common.exceptions.InvalidOptionException;

/**
 * General JIT middle end settings
 *
 * Every key can be overridden by a Java system property of the same name
 * when initJitProperties() is called.
 * */
public class Settings
{
  /** Master switch for the array shape analysis pass */
  public static final String OPT_ARRAY_ANALYSIS = "jit.opt.array-analysis";

  /** Dump IR and array analysis tables for each analysed function */
  public static final String DEBUG_ARRAY_OPT = "jit.debug.array-opt";

  /** Name of the module whose import is the array-math namespace */
  public static final String ARRAY_MODULE = "jit.array-module";

  /** Run IR validation between passes */
  public static final String COMPILER_DEBUG = "jit.compiler-debug";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(OPT_ARRAY_ANALYSIS, "true");
    defaults.setProperty(DEBUG_ARRAY_OPT, "false");
    defaults.setProperty(ARRAY_MODULE, "numpy");
    defaults.setProperty(COMPILER_DEBUG, "true");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initJitProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop an explicitly set value so that the default applies again
   * @param key
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    // Check that boolean values are correct
    getBoolean(OPT_ARRAY_ANALYSIS);
    getBoolean(DEBUG_ARRAY_OPT);
    getBoolean(COMPILER_DEBUG);

    String module = get(ARRAY_MODULE);
    if (module == null || module.trim().isEmpty()) {
      throw new InvalidOptionException("Expected non-empty module name for "
                                        + ARRAY_MODULE);
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
