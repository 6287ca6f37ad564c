/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.act.ciu.io;

import com.act.ciu.ConfigurationException;
import com.act.ciu.model.CIUParameters;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads CIU parameter files: one {@code name = value} per line, with blank lines and lines starting with # skipped.
 *
 * Values are cleaned up before they are bound to {@link CIUParameters}: None (any case) and empty values become null,
 * true/false (any case) become booleans, and list-valued options accept either {@code [a, b, c]} or {@code a, b, c}.
 * Everything else is left as text and converted by Jackson according to the option's type.
 */
public class CIUParametersParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CIUParametersParser.class);

  private static final String NONE = "none";

  // Options holding lists of numbers; commas in any other option (titles, say) are left alone.
  public static final Set<String> LIST_KEYS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
      "cropping_window_values",
      "gaussian_centroid_bound_filter",
      "gaussian_centroid_plot_bounds"
  )));

  private final ObjectMapper mapper = new ObjectMapper();
  private final boolean strict;

  public CIUParametersParser() {
    this(false);
  }

  /**
   * @param strict Reject parameter files that name options that do not exist, rather than warning about them.
   */
  public CIUParametersParser(boolean strict) {
    this.strict = strict;
  }

  public CIUParameters parse(File file) throws ConfigurationException {
    if (!file.isFile()) {
      throw new ConfigurationException(String.format("Parameter file %s does not exist", file.getAbsolutePath()));
    }
    try (InputStream is = new FileInputStream(file)) {
      return parse(is);
    } catch (IOException e) {
      throw new ConfigurationException(String.format("Unable to read parameter file %s", file), e);
    }
  }

  public CIUParameters parse(InputStream is) throws ConfigurationException, IOException {
    return toParameters(readRawValues(is));
  }

  /**
   * Splits a parameter file into its name/value pairs without interpreting the values.  Later lines win when a name
   * is repeated.
   */
  public Map<String, String> readRawValues(InputStream is) throws ConfigurationException, IOException {
    Map<String, String> values = new LinkedHashMap<>();
    BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
    String line;
    int lineNumber = 0;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      int eq = trimmed.indexOf('=');
      if (eq <= 0) {
        throw new ConfigurationException(
            String.format("Line %d of parameter file is not of the form 'name = value': %s", lineNumber, trimmed));
      }
      values.put(trimmed.substring(0, eq).trim(), trimmed.substring(eq + 1).trim());
    }
    return values;
  }

  /**
   * Binds raw name/value pairs to a parameters object.
   * @throws ConfigurationException if a value cannot be converted to its option's type, or in strict mode if an
   *         option name is not recognized.
   */
  public CIUParameters toParameters(Map<String, String> rawValues) throws ConfigurationException {
    Map<String, Object> cleaned = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : rawValues.entrySet()) {
      cleaned.put(entry.getKey(), cleanValue(entry.getKey(), entry.getValue()));
    }

    CIUParameters params;
    try {
      params = mapper.convertValue(cleaned, CIUParameters.class);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(String.format("Invalid parameter value: %s", e.getMessage()), e);
    }

    Set<String> unknown = params.getUnrecognizedKeys();
    if (!unknown.isEmpty()) {
      if (strict) {
        throw new ConfigurationException(
            String.format("Unrecognized parameters: %s", StringUtils.join(unknown, ", ")));
      }
      for (String key : unknown) {
        LOGGER.warn("Ignoring unrecognized parameter '%s'", key);
      }
    }
    return params;
  }

  static Object cleanValue(String key, String value) throws ConfigurationException {
    if (value == null) {
      return null;
    }
    String v = value.trim();
    if (v.isEmpty() || NONE.equalsIgnoreCase(v)) {
      return null;
    }
    if ("true".equalsIgnoreCase(v)) {
      return Boolean.TRUE;
    }
    if ("false".equalsIgnoreCase(v)) {
      return Boolean.FALSE;
    }
    if (LIST_KEYS.contains(key)) {
      return parseNumberList(key, v);
    }
    return v;
  }

  private static List<Double> parseNumberList(String key, String value) throws ConfigurationException {
    String body = value;
    if (body.startsWith("[") && body.endsWith("]")) {
      body = body.substring(1, body.length() - 1);
    }
    List<Double> out = new ArrayList<>();
    for (String part : StringUtils.split(body, ',')) {
      String p = part.trim();
      if (p.isEmpty()) {
        continue;
      }
      try {
        out.add(Double.valueOf(p));
      } catch (NumberFormatException e) {
        throw new ConfigurationException(
            String.format("Parameter %s expects a list of numbers, found '%s'", key, value), e);
      }
    }
    return out;
  }
}
