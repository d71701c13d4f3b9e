package org.alerttuning.engine.suppressor;

import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.alerttuning.engine.event.datamodel.AlertEvent;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.NormalizedAlertEvent;
import org.alerttuning.engine.event.datamodel.Severity;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filters noisy alerts before escalation. Maintenance windows are checked first, then the rules
 * in registration order; the first enabled rule that matches suppresses the alert. Allowed
 * alerts are remembered for duplicate detection.
 */
public class AlertSuppressor {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertSuppressor.class);

  public static final String MAINTENANCE_WINDOW_RULE = "maintenance-window";
  public static final String QUICK_RESOLVE_RULE = "quick-resolve";
  public static final String LOW_SEVERITY_OFFHOURS_RULE = "low-severity-offhours";
  public static final String DUPLICATE_ALERT_RULE = "duplicate-alert";
  public static final String VERY_LOW_ERROR_RULE = "very-low-error";
  public static final String TEST_DEV_SERVICES_RULE = "test-dev-services";

  static final long DUPLICATE_WINDOW_MILLIS = 300_000L;
  private static final int BUSINESS_HOURS_START = 9;
  private static final int BUSINESS_HOURS_END = 17;
  private static final int MIN_ERROR_COUNT = 3;

  private final Clock clock;
  private final List<SuppressionRule> rules = new CopyOnWriteArrayList<>();
  private final List<MaintenanceWindow> maintenanceWindows = new CopyOnWriteArrayList<>();
  private final ListMultimap<String, NormalizedAlertEvent> recentAlerts =
      ArrayListMultimap.create();

  public AlertSuppressor() {
    this(Clock.systemDefaultZone());
  }

  public AlertSuppressor(Clock clock) {
    this.clock = clock;
    initializeDefaultRules();
  }

  private void initializeDefaultRules() {
    rules.add(
        new SuppressionRule(
            QUICK_RESOLVE_RULE,
            "Quick Resolve Suppression",
            "Alert resolved in less than 30 seconds - likely false positive",
            alert -> alert.getEvent().isQuickResolve()));
    // business hours are judged by the current time, not the alert's
    rules.add(
        new SuppressionRule(
            LOW_SEVERITY_OFFHOURS_RULE,
            "Low Severity Off-Hours",
            "Low severity alert outside business hours (9 AM - 5 PM)",
            alert -> alert.getSeverity() == Severity.LOW && isOffHours()));
    rules.add(
        new SuppressionRule(
            DUPLICATE_ALERT_RULE,
            "Duplicate Alert Suppression",
            "Duplicate alert detected within 5-minute window",
            this::isDuplicate));
    rules.add(
        new SuppressionRule(
            VERY_LOW_ERROR_RULE,
            "Very Low Error Count",
            "Very low error count (< 3 errors) - noise threshold",
            alert ->
                alert.getAlertType() == AlertType.ERROR
                    && alert.getEvent().getErrorCount() < MIN_ERROR_COUNT));
    rules.add(
        new SuppressionRule(
            TEST_DEV_SERVICES_RULE,
            "Test/Dev Service Suppression",
            "Alert from test/dev/staging environment",
            alert -> StringUtils.containsAny(alert.getServiceName(), "test", "dev", "staging")));
  }

  public SuppressionResult shouldSuppress(NormalizedAlertEvent alert) {
    if (isInMaintenanceWindow(alert)) {
      return new SuppressionResult(
          alert, true, "Service is in maintenance window", MAINTENANCE_WINDOW_RULE);
    }

    for (SuppressionRule rule : rules) {
      if (rule.matches(alert)) {
        LOGGER.debug("Suppressed alert {} by rule:{}", alert.getAlertName(), rule.getId());
        return new SuppressionResult(alert, true, rule.getReason(), rule.getId());
      }
    }

    trackAlert(alert);
    return new SuppressionResult(alert, false, "No suppression rules matched", null);
  }

  /** Applies {@link #shouldSuppress} to each alert, keeping input order within each list. */
  public SuppressionBatchResult suppressAlerts(List<NormalizedAlertEvent> alerts) {
    List<SuppressionResult> suppressed = new ArrayList<>();
    List<SuppressionResult> allowed = new ArrayList<>();
    Map<String, Long> byRule = new LinkedHashMap<>();

    for (NormalizedAlertEvent alert : alerts) {
      SuppressionResult result = shouldSuppress(alert);
      if (result.isSuppressed()) {
        suppressed.add(result);
        byRule.merge(result.getRuleApplied(), 1L, Long::sum);
      } else {
        allowed.add(result);
      }
    }

    double suppressionRate = alerts.isEmpty() ? 0 : suppressed.size() * 100d / alerts.size();
    LOGGER.info(
        "Suppressed {} of {} alerts, by rule: {}", suppressed.size(), alerts.size(), byRule);
    return new SuppressionBatchResult(
        suppressed,
        allowed,
        new SuppressionSummary(
            alerts.size(), suppressed.size(), allowed.size(), suppressionRate, byRule));
  }

  public void addMaintenanceWindow(MaintenanceWindow maintenanceWindow) {
    maintenanceWindows.add(maintenanceWindow);
  }

  /** Appends a rule after the existing ones. */
  public void addRule(SuppressionRule rule) {
    Preconditions.checkArgument(
        rules.stream().noneMatch(existing -> existing.getId().equals(rule.getId())),
        "Duplicate suppression rule id:%s",
        rule.getId());
    rules.add(rule);
  }

  /** Unknown rule ids are ignored. */
  public void setRuleEnabled(String ruleId, boolean enabled) {
    rules.stream()
        .filter(rule -> rule.getId().equals(ruleId))
        .findFirst()
        .ifPresent(rule -> rule.setEnabled(enabled));
  }

  public List<SuppressionRule> getRules() {
    return List.copyOf(rules);
  }

  private boolean isOffHours() {
    int hour = LocalTime.now(clock).getHour();
    return hour < BUSINESS_HOURS_START || hour >= BUSINESS_HOURS_END;
  }

  private boolean isInMaintenanceWindow(NormalizedAlertEvent alert) {
    Instant eventTime = Instant.ofEpochMilli(alert.getNormalizedTimestamp());
    return maintenanceWindows.stream()
        .anyMatch(window -> window.covers(alert.getServiceName(), eventTime));
  }

  private boolean isDuplicate(NormalizedAlertEvent alert) {
    return recentAlerts.get(duplicateKey(alert)).stream()
        .anyMatch(recent -> withinDuplicateWindow(alert, recent));
  }

  private void trackAlert(NormalizedAlertEvent alert) {
    List<NormalizedAlertEvent> recent = recentAlerts.get(duplicateKey(alert));
    recent.add(alert);
    recent.removeIf(tracked -> !withinDuplicateWindow(alert, tracked));
  }

  private static boolean withinDuplicateWindow(
      NormalizedAlertEvent alert, NormalizedAlertEvent other) {
    return Math.abs(alert.getNormalizedTimestamp() - other.getNormalizedTimestamp())
        < DUPLICATE_WINDOW_MILLIS;
  }

  private static String duplicateKey(NormalizedAlertEvent alert) {
    AlertEvent event = alert.getEvent();
    return String.join(
        "-", event.getServiceName(), event.getAlertName(), event.getAlertType().getValue());
  }
}
