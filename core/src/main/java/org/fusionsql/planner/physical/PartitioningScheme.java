/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.physical;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.exception.SchemaException;
import org.fusionsql.expression.ColumnRef;
import org.fusionsql.expression.Expression;
import org.fusionsql.expression.ExpressionUtils;

/**
 * Describes how the rows of a plan node's output are distributed over partitions. {@code
 * ROUND_ROBIN} stands for any distribution without key guarantees, such as the partitions of a
 * table scan.
 */
@EqualsAndHashCode
public class PartitioningScheme {

  /** Distribution kinds. */
  public enum Kind {
    SINGLE,
    HASH,
    ROUND_ROBIN
  }

  private final Kind kind;
  private final List<Expression> hashKeys;
  private final int partitionCount;

  private PartitioningScheme(Kind kind, List<Expression> hashKeys, int partitionCount) {
    Preconditions.checkArgument(partitionCount > 0, "Partition count must be positive");
    this.kind = kind;
    this.hashKeys = List.copyOf(hashKeys);
    this.partitionCount = partitionCount;
  }

  /** All rows in one partition. */
  public static PartitioningScheme single() {
    return new PartitioningScheme(Kind.SINGLE, List.of(), 1);
  }

  /** Rows with equal key values share a partition. */
  public static PartitioningScheme hash(List<Expression> hashKeys, int partitionCount) {
    Preconditions.checkArgument(!hashKeys.isEmpty(), "Hash partitioning requires keys");
    return new PartitioningScheme(Kind.HASH, hashKeys, partitionCount);
  }

  /** {@code partitionCount} partitions without key guarantees. */
  public static PartitioningScheme roundRobin(int partitionCount) {
    return partitionCount == 1
        ? single()
        : new PartitioningScheme(Kind.ROUND_ROBIN, List.of(), partitionCount);
  }

  public Kind getKind() {
    return kind;
  }

  /** Returns the partition key expressions. Empty for non-hash schemes. */
  public List<Expression> getHashKeys() {
    return hashKeys;
  }

  public int getPartitionCount() {
    return partitionCount;
  }

  public boolean isSingle() {
    return kind == Kind.SINGLE;
  }

  /**
   * Whether this distribution places rows with equal values of {@code keys} in the same one of
   * {@code count} partitions. Column references are compared by the column they resolve to in
   * {@code schema}.
   */
  public boolean isHashPartitionedOn(List<Expression> keys, Schema schema, int count) {
    if (kind != Kind.HASH || partitionCount != count || keys.size() != hashKeys.size()) {
      return false;
    }
    for (int i = 0; i < keys.size(); i++) {
      if (!sameKey(hashKeys.get(i), keys.get(i), schema)) {
        return false;
      }
    }
    return true;
  }

  /** Whether every hash key is one of {@code expressions}, so grouping by them is local. */
  public boolean isHashPartitionedWithin(List<Expression> expressions, Schema schema) {
    if (kind != Kind.HASH) {
      return false;
    }
    for (Expression key : hashKeys) {
      if (expressions.stream().noneMatch(e -> sameKey(key, e, schema))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Re-expresses column keys as references into {@code output}, for a node whose output carries
   * the key columns of its input unchanged. Empty if a key is not a column or is not uniquely
   * present in the output.
   */
  public static Optional<List<Expression>> columnKeys(List<Expression> keys, Schema output) {
    List<Expression> rebased = new ArrayList<>(keys.size());
    for (Expression key : keys) {
      Expression stripped = ExpressionUtils.stripAlias(key);
      if (!(stripped instanceof ColumnRef) || !stripped.isResolved()) {
        return Optional.empty();
      }
      String name = ((ColumnRef) stripped).getField().getQualifiedName();
      Optional<Integer> index;
      try {
        index = output.findIndex(name);
      } catch (SchemaException e) {
        return Optional.empty();
      }
      if (index.isEmpty()) {
        return Optional.empty();
      }
      rebased.add(new ColumnRef(name).bind(output.getField(index.get())));
    }
    return Optional.of(rebased);
  }

  private static boolean sameKey(Expression a, Expression b, Schema schema) {
    if (a instanceof ColumnRef && b instanceof ColumnRef) {
      try {
        Optional<Integer> left = schema.findIndex(((ColumnRef) a).getReference());
        return left.isPresent()
            && left.equals(schema.findIndex(((ColumnRef) b).getReference()));
      } catch (SchemaException e) {
        return false;
      }
    }
    return a.equals(b);
  }

  @Override
  public String toString() {
    switch (kind) {
      case SINGLE:
        return "single";
      case HASH:
        return "hash(" + hashKeys + ", " + partitionCount + ")";
      default:
        return "round_robin(" + partitionCount + ")";
    }
  }
}
