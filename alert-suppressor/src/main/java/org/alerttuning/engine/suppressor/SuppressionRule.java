package org.alerttuning.engine.suppressor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.function.Predicate;
import lombok.Getter;
import lombok.Setter;
import org.alerttuning.engine.event.datamodel.NormalizedAlertEvent;

@Getter
public class SuppressionRule {
  private final String id;
  private final String name;
  private final String reason;
  @JsonIgnore private final Predicate<NormalizedAlertEvent> condition;
  @Setter private volatile boolean enabled;

  public SuppressionRule(
      String id, String name, String reason, Predicate<NormalizedAlertEvent> condition) {
    this(id, name, reason, condition, true);
  }

  public SuppressionRule(
      String id,
      String name,
      String reason,
      Predicate<NormalizedAlertEvent> condition,
      boolean enabled) {
    this.id = id;
    this.name = name;
    this.reason = reason;
    this.condition = condition;
    this.enabled = enabled;
  }

  public boolean matches(NormalizedAlertEvent alert) {
    return enabled && condition.test(alert);
  }
}
