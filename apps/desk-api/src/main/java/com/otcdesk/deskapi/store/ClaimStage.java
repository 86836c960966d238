package com.otcdesk.deskapi.store;

public enum ClaimStage {
  APPROVING,
  PAYING,
  CANCELLING
}
