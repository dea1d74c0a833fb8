/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.function;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.log4j.Log4j2;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ScalarFunctionExpr;
import org.fusionsql.exception.TypeCheckException;

/** Name to {@link ScalarFunction} lookup. Names are case insensitive. */
@Log4j2
public class FunctionRegistry {

  private static final FunctionRegistry BUILTINS = createDefault();

  private final Map<String, ScalarFunction> functions = new ConcurrentHashMap<>();

  /** A registry holding the built-in functions. */
  public static FunctionRegistry createDefault() {
    FunctionRegistry registry = new FunctionRegistry();
    BuiltinFunctions.register(registry);
    return registry;
  }

  /** Shared registry of built-in functions, used by the expression DSL. */
  public static FunctionRegistry builtins() {
    return BUILTINS;
  }

  public void register(ScalarFunction function) {
    ScalarFunction previous = functions.put(key(function.getName()), function);
    if (previous != null) {
      log.warn("Function {} was redefined", function.getName());
    }
  }

  /** Registers a user defined function. */
  public void register(FunctionSignature signature, ScalarFunctionImplementation implementation) {
    register(new UserDefinedFunction(signature, implementation));
  }

  public Optional<ScalarFunction> lookup(String name) {
    return Optional.ofNullable(functions.get(key(name)));
  }

  /**
   * Returns the function with the given name.
   *
   * @throws TypeCheckException if no such function exists
   */
  public ScalarFunction resolve(String name) {
    return lookup(name)
        .orElseThrow(() -> new TypeCheckException("Unknown function: " + name));
  }

  /** Builds a call expression of the named function. */
  public ScalarFunctionExpr call(String name, Expression... arguments) {
    return new ScalarFunctionExpr(resolve(name), Arrays.asList(arguments));
  }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }
}
