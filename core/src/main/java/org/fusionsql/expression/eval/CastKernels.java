/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.expression.eval;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import lombok.experimental.UtilityClass;
import org.fusionsql.data.type.DataType;
import org.fusionsql.data.vector.BooleanVector;
import org.fusionsql.data.vector.ColumnVector;
import org.fusionsql.data.vector.ColumnVectorBuilder;
import org.fusionsql.data.vector.StringVector;
import org.fusionsql.exception.CastException;

/**
 * Column conversions. Narrowing integer casts saturate at the target range, float to integer
 * truncates toward zero before saturating (NaN becomes 0), and a string that does not parse fails
 * the whole batch with a {@link CastException}.
 */
@UtilityClass
public class CastKernels {

  private static final DateTimeFormatter SQL_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSSSSS][.SSS]");

  public static ColumnVector cast(ColumnVector input, DataType target) {
    DataType source = input.getType();
    if (source == target) {
      return input;
    }
    int rows = input.size();
    ColumnVectorBuilder out = ColumnVectorBuilder.create(target, rows);
    for (int i = 0; i < rows; i++) {
      if (input.isNull(i)) {
        out.appendNull();
      } else if (target == DataType.UTF8) {
        out.appendString(format(input, i));
      } else if (source == DataType.UTF8) {
        appendParsed(out, target, ((StringVector) input).getString(i));
      } else if (source == DataType.BOOLEAN) {
        boolean value = ((BooleanVector) input).getBoolean(i);
        if (target.isFloating()) {
          out.appendDouble(value ? 1.0 : 0.0);
        } else {
          out.appendLong(value ? 1L : 0L);
        }
      } else if (target == DataType.BOOLEAN) {
        out.appendBoolean(input.getAsDouble(i) != 0.0);
      } else if (target.isFloating()) {
        out.appendDouble(input.getAsDouble(i));
      } else {
        // getAsLong truncates floats and maps NaN to 0; the builder saturates to the type
        out.appendLong(input.getAsLong(i));
      }
    }
    return out.build();
  }

  /** Casts one boxed value, used for constant folding and literals. */
  public static Object castValue(Object value, DataType source, DataType target) {
    ColumnVector single = cast(ColumnVector.constant(source, value, 1), target);
    return single.getObject(0);
  }

  private static String format(ColumnVector input, int row) {
    DataType type = input.getType();
    if (type == DataType.TIMESTAMP) {
      return Instant.EPOCH.plus(input.getAsLong(row), ChronoUnit.MICROS).toString();
    }
    return input.getObject(row).toString();
  }

  private static void appendParsed(ColumnVectorBuilder out, DataType target, String raw) {
    String text = raw.trim();
    try {
      if (target.isInteger()) {
        out.appendLong(parseInteger(text));
      } else if (target.isFloating()) {
        out.appendDouble(Double.parseDouble(text));
      } else if (target == DataType.BOOLEAN) {
        out.appendBoolean(parseBoolean(text));
      } else if (target == DataType.TIMESTAMP) {
        out.appendLong(parseTimestamp(text));
      } else {
        out.appendString(text);
      }
    } catch (NumberFormatException | DateTimeParseException | ArithmeticException e) {
      throw new CastException(String.format("Cannot cast '%s' to %s", raw, target), e);
    }
  }

  private static long parseInteger(String text) {
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException e) {
      BigDecimal decimal = new BigDecimal(text);
      if (decimal.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) {
        return Long.MAX_VALUE;
      }
      if (decimal.compareTo(BigDecimal.valueOf(Long.MIN_VALUE)) < 0) {
        return Long.MIN_VALUE;
      }
      return decimal.longValue();
    }
  }

  private static boolean parseBoolean(String text) {
    switch (text.toLowerCase(Locale.ROOT)) {
      case "true":
      case "t":
      case "1":
        return true;
      case "false":
      case "f":
      case "0":
        return false;
      default:
        throw new NumberFormatException("Not a boolean: " + text);
    }
  }

  private static long parseTimestamp(String text) {
    Instant instant;
    if (text.endsWith("Z")) {
      instant = Instant.parse(text);
    } else if (text.length() == 10) {
      instant = LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
    } else if (text.indexOf('T') > 0) {
      instant = LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
    } else {
      instant = LocalDateTime.parse(text, SQL_TIMESTAMP).toInstant(ZoneOffset.UTC);
    }
    return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
  }
}
