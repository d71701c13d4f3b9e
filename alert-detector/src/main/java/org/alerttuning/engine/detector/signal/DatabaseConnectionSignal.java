package org.alerttuning.engine.detector.signal;

import org.alerttuning.engine.detector.DatastoreProbe;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.Severity;

public class DatabaseConnectionSignal extends Signal {
  public static final String NAME = "database_connection_issue";

  private final DatastoreProbe datastoreProbe;

  public DatabaseConnectionSignal(DatastoreProbe datastoreProbe) {
    super(NAME, AlertType.RESOURCE);
    this.datastoreProbe = datastoreProbe;
  }

  @Override
  public SignalReading evaluate(SignalContext context) {
    return datastoreProbe.isConnected()
        ? SignalReading.resolve()
        : SignalReading.fire(Severity.CRITICAL);
  }
}
