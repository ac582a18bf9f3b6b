package io.rbridge.rserve;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.rbridge.api.errors.UnsupportedValueTypeException;
import io.rbridge.api.values.RCharacter;
import io.rbridge.api.values.RDataFrame;
import io.rbridge.api.values.RInteger;
import io.rbridge.api.values.RList;
import io.rbridge.api.values.RLogical;
import io.rbridge.api.values.RNull;
import io.rbridge.api.values.RNumeric;
import io.rbridge.api.values.RRaw;
import io.rbridge.api.values.RUnsupported;
import io.rbridge.api.values.RValue;
import org.rosuda.REngine.REXP;
import org.rosuda.REngine.REXPDouble;
import org.rosuda.REngine.REXPFactor;
import org.rosuda.REngine.REXPGenericVector;
import org.rosuda.REngine.REXPInteger;
import org.rosuda.REngine.REXPLogical;
import org.rosuda.REngine.REXPMismatchException;
import org.rosuda.REngine.REXPNull;
import org.rosuda.REngine.REXPRaw;
import org.rosuda.REngine.REXPString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Converts between REngine's `REXP` objects and [RValue]s.
///
/// Factors become character vectors and anything inheriting `data.frame` becomes an
/// [RDataFrame]. Values with no [RValue] counterpart (closures, environments, language
/// objects) become [RUnsupported].
public final class RexpConverter {

  private RexpConverter() {
  }

  /// @param rexp a value read from Rserve
  /// @return the equivalent R value
  /// @throws UnsupportedValueTypeException if the value is malformed
  public static RValue toRValue(REXP rexp) {
    try {
      return convert(rexp);
    } catch (REXPMismatchException e) {
      throw new UnsupportedValueTypeException("Can not read R value: " + e.getMessage());
    }
  }

  private static RValue convert(REXP rexp) throws REXPMismatchException {
    if (rexp == null || rexp.isNull()) {
      return RNull.INSTANCE;
    }
    if (rexp.inherits("data.frame")) {
      return toDataFrame(rexp);
    }
    if (rexp instanceof REXPRaw raw) {
      return new RRaw(raw.asBytes());
    }
    if (rexp instanceof REXPFactor factor) {
      return new RCharacter(Arrays.asList(factor.asStrings()));
    }
    if (rexp instanceof REXPString string) {
      String[] values = string.asStrings();
      boolean[] na = string.isNA();
      List<String> list = new ArrayList<>(values.length);
      for (int i = 0; i < values.length; i++) {
        list.add(na[i] ? null : values[i]);
      }
      return new RCharacter(list);
    }
    if (rexp instanceof REXPLogical logical) {
      boolean[] na = logical.isNA();
      boolean[] truth = logical.isTRUE();
      List<Boolean> list = new ArrayList<>(na.length);
      for (int i = 0; i < na.length; i++) {
        list.add(na[i] ? null : truth[i]);
      }
      return new RLogical(list);
    }
    if (rexp instanceof REXPInteger integer) {
      int[] values = integer.asIntegers();
      boolean[] na = integer.isNA();
      List<Integer> list = new ArrayList<>(values.length);
      for (int i = 0; i < values.length; i++) {
        list.add(na[i] ? null : values[i]);
      }
      return new RInteger(list);
    }
    if (rexp instanceof REXPDouble number) {
      double[] values = number.asDoubles();
      boolean[] na = number.isNA();
      List<Double> list = new ArrayList<>(values.length);
      for (int i = 0; i < values.length; i++) {
        list.add(na[i] ? null : values[i]);
      }
      return new RNumeric(list);
    }
    if (rexp instanceof REXPGenericVector vector) {
      return toList(vector.asList());
    }
    return new RUnsupported(typeName(rexp));
  }

  private static RList toList(org.rosuda.REngine.RList list) throws REXPMismatchException {
    String[] keys = list.keys();
    RList.Builder builder = RList.builder();
    for (int i = 0; i < list.size(); i++) {
      String name = keys == null || keys[i] == null ? "" : keys[i];
      builder.add(name, convert(list.at(i)));
    }
    return builder.build();
  }

  private static RDataFrame toDataFrame(REXP rexp) throws REXPMismatchException {
    org.rosuda.REngine.RList list = rexp.asList();
    String[] keys = list.keys();
    List<String> names = new ArrayList<>(list.size());
    List<RValue> columns = new ArrayList<>(list.size());
    for (int i = 0; i < list.size(); i++) {
      names.add(keys == null || keys[i] == null ? "V" + (i + 1) : keys[i]);
      columns.add(convert(list.at(i)));
    }
    return new RDataFrame(names, columns);
  }

  private static String typeName(REXP rexp) {
    String name = rexp.getClass().getSimpleName();
    return name.startsWith("REXP") ? name.substring(4).toLowerCase() : name;
  }

  /// @param value an R value
  /// @return the REXP Rserve can assign
  /// @throws UnsupportedValueTypeException for references and unsupported values, which have no
  ///     transferable form
  public static REXP toRexp(RValue value) {
    return switch (value.kind()) {
      case NULL -> new REXPNull();
      case RAW -> new REXPRaw(((RRaw) value).bytes());
      case CHARACTER -> new REXPString(((RCharacter) value).values().toArray(new String[0]));
      case NUMERIC -> new REXPDouble(doubles(((RNumeric) value).values()));
      case INTEGER -> new REXPInteger(ints(((RInteger) value).values()));
      case LOGICAL -> new REXPLogical(logicals(((RLogical) value).values()));
      case LIST -> new REXPGenericVector(toRexpList((RList) value));
      case DATA_FRAME -> toRexpDataFrame((RDataFrame) value);
      default -> throw new UnsupportedValueTypeException(
          "Can not transfer R value of type " + value.typeName() + " through Rserve");
    };
  }

  private static org.rosuda.REngine.RList toRexpList(RList list) {
    REXP[] contents = new REXP[list.size()];
    for (int i = 0; i < list.size(); i++) {
      contents[i] = toRexp(list.get(i));
    }
    return list.isNamed()
        ? new org.rosuda.REngine.RList(contents, list.names().toArray(new String[0]))
        : new org.rosuda.REngine.RList(contents);
  }

  private static REXP toRexpDataFrame(RDataFrame frame) {
    REXP[] contents = new REXP[frame.columnCount()];
    for (int i = 0; i < contents.length; i++) {
      contents[i] = toRexp(frame.columns().get(i));
    }
    try {
      return REXP.createDataFrame(
          new org.rosuda.REngine.RList(contents, frame.columnNames().toArray(new String[0])));
    } catch (REXPMismatchException e) {
      throw new UnsupportedValueTypeException("Can not build R data frame: " + e.getMessage());
    }
  }

  private static double[] doubles(List<Double> values) {
    double[] result = new double[values.size()];
    for (int i = 0; i < result.length; i++) {
      Double v = values.get(i);
      result[i] = v == null ? REXPDouble.NA : v;
    }
    return result;
  }

  private static int[] ints(List<Integer> values) {
    int[] result = new int[values.size()];
    for (int i = 0; i < result.length; i++) {
      Integer v = values.get(i);
      result[i] = v == null ? REXPInteger.NA : v;
    }
    return result;
  }

  private static byte[] logicals(List<Boolean> values) {
    byte[] result = new byte[values.size()];
    for (int i = 0; i < result.length; i++) {
      Boolean v = values.get(i);
      result[i] = v == null ? REXPLogical.NA : v ? REXPLogical.TRUE : REXPLogical.FALSE;
    }
    return result;
  }
}
