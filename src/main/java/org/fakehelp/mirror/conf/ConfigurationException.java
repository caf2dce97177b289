/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.conf;

public class ConfigurationException extends Exception {

  public ConfigurationException() {}

  public ConfigurationException(String msg) {
    super(msg);
  }

  public ConfigurationException(String msg, Exception ex) {
    super(msg, ex);
  }

}
