/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.function;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.fusionsql.data.type.DataType;

/** Declared name, argument types and return type of a user defined function. */
@Getter
@ToString
@EqualsAndHashCode
public class FunctionSignature {

  private final String name;
  private final List<DataType> argumentTypes;
  private final DataType returnType;

  public FunctionSignature(String name, List<DataType> argumentTypes, DataType returnType) {
    this.name = name;
    this.argumentTypes = ImmutableList.copyOf(argumentTypes);
    this.returnType = returnType;
  }
}
