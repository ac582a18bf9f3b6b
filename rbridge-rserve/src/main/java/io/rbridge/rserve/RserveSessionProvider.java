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

import io.rbridge.api.errors.ConfigurationException;
import io.rbridge.api.session.RSession;
import io.rbridge.api.session.RSessionProvider;
import io.rbridge.api.session.SessionKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.rosuda.REngine.Rserve.RConnection;
import org.rosuda.REngine.Rserve.RserveException;

import java.util.Map;

/// Opens [RserveSession]s against a running Rserve daemon.
///
/// Options:
/// - `host`: the Rserve host, default `localhost`
/// - `port`: the Rserve port, default `6311`
/// - `user` and `password`: credentials, for daemons which require a login
@SessionKind(RserveSessionProvider.KIND)
public class RserveSessionProvider implements RSessionProvider {
  private static final Logger logger = LogManager.getLogger(RserveSessionProvider.class);

  public static final String KIND = "rserve";
  public static final String HOST = "host";
  public static final String PORT = "port";
  public static final String USER = "user";
  public static final String PASSWORD = "password";
  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 6311;

  @Override
  public RSession open(Map<String, String> options) {
    String host = options.getOrDefault(HOST, DEFAULT_HOST);
    int port = port(options.get(PORT));
    String user = options.get(USER);
    RConnection connection;
    try {
      connection = new RConnection(host, port);
    } catch (RserveException e) {
      throw new ConfigurationException(
          "Unable to connect to Rserve at " + host + ":" + port + ": " + e.getMessage(), e);
    }
    try {
      if (user != null) {
        connection.login(user, options.getOrDefault(PASSWORD, ""));
      }
      logger.info("connected to Rserve at {}:{}", host, port);
      return new RserveSession(connection);
    } catch (RserveException e) {
      connection.close();
      throw new ConfigurationException("Rserve login as '" + user + "' failed: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      connection.close();
      throw e;
    }
  }

  static int port(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT_PORT;
    }
    try {
      int port = Integer.parseInt(value.trim());
      if (port < 1 || port > 65535) {
        throw new ConfigurationException("Rserve port out of range: " + value);
      }
      return port;
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Rserve port is not a number: '" + value + "'", e);
    }
  }
}
