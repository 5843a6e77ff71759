package com.gentoro.jobwatch.engine;

@FunctionalInterface
public interface OperationListener {
  void onEvent(OperationEvent event);
}
