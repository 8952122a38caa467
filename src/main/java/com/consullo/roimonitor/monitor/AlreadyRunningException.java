package com.consullo.roimonitor.monitor;

import com.consullo.roimonitor.core.RoiMonitorException;

/**
 * Raised by {@link RoiMonitor#start} while another session is active or starting.
 *
 * @since 1.0
 */
public final class AlreadyRunningException extends RoiMonitorException {

  private static final long serialVersionUID = 1L;

  private final String sessionId;

  public AlreadyRunningException(String sessionId, MonitorState state) {
    super("A monitoring session is already " + state.name().toLowerCase(java.util.Locale.ROOT)
        + (sessionId == null ? "" : " (" + sessionId + ")"));
    this.sessionId = sessionId;
  }

  /**
   * Returns the id of the session that blocked the start, null while that session is still starting.
   *
   * @return session id or null
   */
  public String sessionId() {
    return sessionId;
  }
}
