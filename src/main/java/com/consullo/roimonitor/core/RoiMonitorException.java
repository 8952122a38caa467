package com.consullo.roimonitor.core;

/**
 * Base class for the checked exceptions raised by the monitoring engine.
 *
 * @since 1.0
 */
public class RoiMonitorException extends Exception {

  private static final long serialVersionUID = 1L;

  public RoiMonitorException(String message) {
    super(message);
  }

  public RoiMonitorException(String message, Throwable cause) {
    super(message, cause);
  }
}
