package org.alerttuning.engine.detector;

/** Connectivity check supplied by a host service that owns a datastore connection. */
@FunctionalInterface
public interface DatastoreProbe {
  boolean isConnected();
}
