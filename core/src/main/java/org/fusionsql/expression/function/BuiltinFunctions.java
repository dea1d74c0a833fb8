/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.function;

import java.util.List;
import java.util.Locale;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;
import java.util.function.LongUnaryOperator;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.UtilityClass;
import org.fusionsql.data.type.DataType;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;
import org.fusionsql.data.vector.StringVector;
import org.fusionsql.expression.eval.CastKernels;
import org.fusionsql.exception.TypeCheckException;

/** Built-in scalar functions. */
@UtilityClass
public class BuiltinFunctions {

  public static void register(FunctionRegistry registry) {
    registry.register(mathFunction("sqrt", Math::sqrt, null));
    registry.register(
        mathFunction("abs", Math::abs, v -> v == Long.MIN_VALUE ? Long.MAX_VALUE : Math.abs(v)));
    registry.register(mathFunction("ceil", Math::ceil, LongUnaryOperator.identity()));
    registry.register(mathFunction("floor", Math::floor, LongUnaryOperator.identity()));
    registry.register(
        mathFunction("round", v -> (double) Math.round(v), LongUnaryOperator.identity()));
    registry.register(stringFunction("upper", s -> s.toUpperCase(Locale.ROOT)));
    registry.register(stringFunction("lower", s -> s.toLowerCase(Locale.ROOT)));
    registry.register(stringFunction("trim", String::trim));
    registry.register(
        new SimpleFunction(
            "length",
            types -> {
              requireArity("length", types, 1);
              requireType("length", types.get(0), DataType.UTF8);
              return DataType.INT64;
            },
            (args, type, rows) -> {
              ColumnVectorBuilder out = ColumnVectorBuilder.create(type, rows);
              StringVector input = (StringVector) args.get(0);
              for (int i = 0; i < rows; i++) {
                if (input.isNull(i)) {
                  out.appendNull();
                } else {
                  String value = input.getString(i);
                  out.appendLong(value.codePointCount(0, value.length()));
                }
              }
              return out.build();
            },
            true));
    registry.register(
        new SimpleFunction(
            "concat",
            types -> {
              if (types.isEmpty()) {
                throw new TypeCheckException("concat expects at least one argument");
              }
              types.forEach(t -> requireType("concat", t, DataType.UTF8));
              return DataType.UTF8;
            },
            (args, type, rows) -> {
              ColumnVectorBuilder out = ColumnVectorBuilder.create(type, rows);
              for (int i = 0; i < rows; i++) {
                StringBuilder value = new StringBuilder();
                boolean isNull = false;
                for (ColumnVector arg : args) {
                  if (arg.isNull(i)) {
                    isNull = true;
                    break;
                  }
                  value.append(((StringVector) arg).getString(i));
                }
                if (isNull) {
                  out.appendNull();
                } else {
                  out.appendString(value.toString());
                }
              }
              return out.build();
            },
            true));
    registry.register(
        new SimpleFunction(
            "coalesce",
            types -> {
              if (types.isEmpty()) {
                throw new TypeCheckException("coalesce expects at least one argument");
              }
              DataType result = types.get(0);
              for (DataType type : types.subList(1, types.size())) {
                if (type == result) {
                  continue;
                }
                result =
                    DataType.commonNumericType(result, type)
                        .orElseThrow(
                            () ->
                                new TypeCheckException(
                                    "coalesce arguments must share a type but got " + types));
              }
              return result;
            },
            (args, type, rows) -> {
              ColumnVectorBuilder out = ColumnVectorBuilder.create(type, rows);
              List<ColumnVector> coerced =
                  args.stream().map(a -> CastKernels.cast(a, type)).collect(Collectors.toList());
              for (int i = 0; i < rows; i++) {
                ColumnVector chosen = null;
                for (ColumnVector arg : coerced) {
                  if (!arg.isNull(i)) {
                    chosen = arg;
                    break;
                  }
                }
                if (chosen == null) {
                  out.appendNull();
                } else {
                  out.appendFrom(chosen, i);
                }
              }
              return out.build();
            },
            false));
  }

  /**
   * Numeric function. Integer inputs keep their type and use {@code integerOp}; without one the
   * function always produces FLOAT64.
   */
  private static ScalarFunction mathFunction(
      String name, DoubleUnaryOperator op, LongUnaryOperator integerOp) {
    return new SimpleFunction(
        name,
        types -> {
          requireArity(name, types, 1);
          DataType input = types.get(0);
          if (!input.isNumeric()) {
            throw new TypeCheckException(name + " expects a numeric argument but got " + input);
          }
          return integerOp == null || input.isFloating() ? DataType.FLOAT64 : input;
        },
        (args, type, rows) -> {
          ColumnVector input = args.get(0);
          ColumnVectorBuilder out = ColumnVectorBuilder.create(type, rows);
          for (int i = 0; i < rows; i++) {
            if (input.isNull(i)) {
              out.appendNull();
            } else if (type.isFloating()) {
              out.appendDouble(op.applyAsDouble(input.getAsDouble(i)));
            } else {
              out.appendLong(integerOp.applyAsLong(input.getAsLong(i)));
            }
          }
          return out.build();
        },
        true);
  }

  private static ScalarFunction stringFunction(String name, UnaryOperator<String> op) {
    return new SimpleFunction(
        name,
        types -> {
          requireArity(name, types, 1);
          requireType(name, types.get(0), DataType.UTF8);
          return DataType.UTF8;
        },
        (args, type, rows) -> {
          StringVector input = (StringVector) args.get(0);
          ColumnVectorBuilder out = ColumnVectorBuilder.create(type, rows);
          for (int i = 0; i < rows; i++) {
            if (input.isNull(i)) {
              out.appendNull();
            } else {
              out.appendString(op.apply(input.getString(i)));
            }
          }
          return out.build();
        },
        true);
  }

  private static void requireArity(String name, List<DataType> types, int arity) {
    if (types.size() != arity) {
      throw new TypeCheckException(
          String.format("%s expects %d argument(s) but got %d", name, arity, types.size()));
    }
  }

  private static void requireType(String name, DataType actual, DataType expected) {
    if (actual != expected) {
      throw new TypeCheckException(
          String.format("%s expects %s but got %s", name, expected, actual));
    }
  }

  @FunctionalInterface
  private interface Kernel {
    ColumnVector apply(List<ColumnVector> arguments, DataType returnType, int rowCount);
  }

  @RequiredArgsConstructor
  private static class SimpleFunction implements ScalarFunction {
    @Getter private final String name;
    private final Function<List<DataType>, DataType> returnType;
    private final Kernel kernel;
    private final boolean nullPropagating;

    @Override
    public DataType getReturnType(List<DataType> argumentTypes) {
      return returnType.apply(argumentTypes);
    }

    @Override
    public ColumnVector evaluate(List<ColumnVector> arguments, DataType type, int rowCount) {
      return kernel.apply(arguments, type, rowCount);
    }

    @Override
    public boolean isNullPropagating() {
      return nullPropagating;
    }
  }
}
