package org.hypertrace.logalert.datamodel;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;

/**
 * Alert rule configuration together with its cooldown state.
 *
 * <p>The rule is either armed or cooling down; the state is derived from {@code lastTriggered}
 * on every check, so no explicit transition back to armed exists. All access to {@code
 * lastTriggered} is synchronized on the rule.
 */
@Getter
public class AlertRule {
  public static final Duration DEFAULT_COOLDOWN_PERIOD = Duration.ofSeconds(300);

  private final String id;
  private final String name;
  private final String description;
  private final AlertCondition condition;
  private final Map<String, Object> parameters;
  private final AlertSeverity severity;
  private final Set<String> notifierNames;
  private final boolean enabled;
  private final Duration cooldownPeriod;

  private Instant lastTriggered;

  @Builder(toBuilder = true)
  private AlertRule(
      String id,
      String name,
      String description,
      AlertCondition condition,
      Map<String, Object> parameters,
      AlertSeverity severity,
      Collection<String> notifierNames,
      Boolean enabled,
      Duration cooldownPeriod) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "alert rule name is required");
    Preconditions.checkArgument(condition != null, "alert rule condition is required");
    this.name = name;
    this.id = Strings.isNullOrEmpty(id) ? idFromName(name) : id;
    this.description = Strings.nullToEmpty(description);
    this.condition = condition;
    this.parameters =
        parameters == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    this.severity = severity == null ? AlertSeverity.WARNING : severity;
    this.notifierNames =
        notifierNames == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(notifierNames));
    this.enabled = enabled == null || enabled;
    this.cooldownPeriod = cooldownPeriod == null ? DEFAULT_COOLDOWN_PERIOD : cooldownPeriod;
  }

  static String idFromName(String name) {
    return name.toLowerCase(Locale.ROOT).replace(" ", "_");
  }

  public synchronized Optional<Instant> getLastTriggered() {
    return Optional.ofNullable(lastTriggered);
  }

  public synchronized boolean isInCooldown(Instant now) {
    if (lastTriggered == null) {
      return false;
    }
    return Duration.between(lastTriggered, now).compareTo(cooldownPeriod) < 0;
  }

  public synchronized void markTriggered(Instant now) {
    this.lastTriggered = now;
  }

  /**
   * Moves the rule into cooldown unless it is already there.
   *
   * @return false if another caller triggered the rule within the cooldown period
   */
  public synchronized boolean tryMarkTriggered(Instant now) {
    if (isInCooldown(now)) {
      return false;
    }
    markTriggered(now);
    return true;
  }

  @Override
  public String toString() {
    return String.format(
        "AlertRule{id=%s, name=%s, condition=%s, severity=%s, enabled=%s}",
        id, name, condition.getValue(), severity.getValue(), enabled);
  }
}
