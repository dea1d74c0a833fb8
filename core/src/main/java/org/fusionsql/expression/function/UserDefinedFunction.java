/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.function;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.fusionsql.data.type.DataType;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.expression.eval.CastKernels;
import org.fusionsql.exception.TypeCheckException;

/**
 * Function registered with a {@link FunctionSignature}. Numeric arguments of another numeric type
 * are cast to the declared type before the implementation runs.
 */
@RequiredArgsConstructor
public class UserDefinedFunction implements ScalarFunction {

  @Getter private final FunctionSignature signature;
  private final ScalarFunctionImplementation implementation;

  @Override
  public String getName() {
    return signature.getName();
  }

  @Override
  public DataType getReturnType(List<DataType> argumentTypes) {
    List<DataType> declared = signature.getArgumentTypes();
    if (declared.size() != argumentTypes.size()) {
      throw new TypeCheckException(
          String.format(
              "Function %s expects %d arguments but got %d",
              getName(), declared.size(), argumentTypes.size()));
    }
    for (int i = 0; i < declared.size(); i++) {
      DataType expected = declared.get(i);
      DataType actual = argumentTypes.get(i);
      if (expected != actual && !(expected.isNumeric() && actual.isNumeric())) {
        throw new TypeCheckException(
            String.format(
                "Argument %d of %s must be %s but got %s", i + 1, getName(), expected, actual));
      }
    }
    return signature.getReturnType();
  }

  @Override
  public ColumnVector evaluate(List<ColumnVector> arguments, DataType returnType, int rowCount) {
    List<ColumnVector> coerced = new ArrayList<>(arguments.size());
    for (int i = 0; i < arguments.size(); i++) {
      coerced.add(CastKernels.cast(arguments.get(i), signature.getArgumentTypes().get(i)));
    }
    ColumnVector result = implementation.apply(coerced, rowCount);
    if (result.size() != rowCount || result.getType() != returnType) {
      throw new IllegalStateException(
          String.format(
              "Function %s returned %s rows of %s, expected %s rows of %s",
              getName(), result.size(), result.getType(), rowCount, returnType));
    }
    return result;
  }
}
