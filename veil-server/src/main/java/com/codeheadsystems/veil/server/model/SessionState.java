package com.codeheadsystems.veil.server.model;

/**
 * Lifecycle of a {@link ChatSession}. A session is created {@link #ACTIVE}, deactivated by an
 * explicit end, an idle sweep or supersession, and only leaves the store through orphan
 * reconciliation.
 */
public enum SessionState {
  ACTIVE,
  INACTIVE
}
