/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.tiling.stats;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Loads the bundled logging.properties, unless the user has named a logging
 * configuration of their own.
 *
 * @author Luke Blanshard
 */
final class LoggingSetup {
  static final String RESOURCE = "/logging.properties";

  private LoggingSetup() {}

  /** Returns true if the bundled configuration was loaded. */
  static boolean configure() {
    if (System.getProperty("java.util.logging.config.file") != null) return false;
    InputStream in = LoggingSetup.class.getResourceAsStream(RESOURCE);
    if (in == null) return false;
    try {
      try {
        LogManager.getLogManager().readConfiguration(in);
        return true;
      } finally {
        in.close();
      }
    } catch (IOException e) {
      Logger.getLogger(LoggingSetup.class.getName()).warning(
          "Unable to load " + RESOURCE + ": " + e);
      return false;
    }
  }
}
