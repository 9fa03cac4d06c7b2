package org.example.sla;

public enum TrackerState {
  STOPPED,
  RUNNING
}
