package org.hypertrace.logalert.notification.service;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.hypertrace.logalert.datamodel.AlertRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notifiers by name. Dispatch to one notifier never prevents dispatch to the next: exceptions and
 * {@code false} results are logged and counted as failures.
 */
public class NotifierRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(NotifierRegistry.class);

  static final String NOTIFICATION_FAILURE_COUNTER = "log.alert.engine.notification.failure";
  private static final String NOTIFIER_TAG = "notifier";

  private final ConcurrentMap<String, Notifier> notifiers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> notificationFailureCounter =
      new ConcurrentHashMap<>();
  private final MeterRegistry meterRegistry;

  public NotifierRegistry() {
    this(new SimpleMeterRegistry());
  }

  public NotifierRegistry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /** Registers the notifier, replacing any notifier with the same name. */
  public void addNotifier(Notifier notifier) {
    Preconditions.checkArgument(
        notifier != null && !Strings.isNullOrEmpty(notifier.getName()),
        "notifier needs a name");
    Notifier previous = notifiers.put(notifier.getName(), notifier);
    if (previous != null) {
      LOGGER.info("Replaced notifier {}", notifier.getName());
    } else {
      LOGGER.info("Added notifier {}", notifier.getName());
    }
  }

  public boolean removeNotifier(String name) {
    if (name == null) {
      return false;
    }
    boolean removed = notifiers.remove(name) != null;
    if (removed) {
      LOGGER.info("Removed notifier {}", name);
    }
    return removed;
  }

  public Optional<Notifier> getNotifier(String name) {
    return Optional.ofNullable(name == null ? null : notifiers.get(name));
  }

  /** Sorted names of the registered notifiers. */
  public List<String> getNotifierNames() {
    return notifiers.keySet().stream().sorted().collect(Collectors.toUnmodifiableList());
  }

  public DispatchSummary dispatch(AlertRule rule, Map<String, Object> context) {
    DispatchSummary.DispatchSummaryBuilder summary = DispatchSummary.builder();
    for (String notifierName : rule.getNotifierNames()) {
      Notifier notifier = notifiers.get(notifierName);
      if (notifier == null) {
        LOGGER.warn("Notifier {} of rule {} not found", notifierName, rule.getId());
        summary.missing(notifierName);
        continue;
      }
      if (send(notifier, rule, context)) {
        summary.delivered(notifierName);
      } else {
        summary.failed(notifierName);
        notificationFailureCounter
            .computeIfAbsent(
                notifierName,
                k ->
                    Counter.builder(NOTIFICATION_FAILURE_COUNTER)
                        .tag(NOTIFIER_TAG, k)
                        .register(meterRegistry))
            .increment();
      }
    }
    return summary.build();
  }

  private static boolean send(Notifier notifier, AlertRule rule, Map<String, Object> context) {
    try {
      boolean sent = notifier.send(rule, context);
      if (!sent) {
        LOGGER.error(
            "Notifier {} failed to send alert for rule {}", notifier.getName(), rule.getId());
      }
      return sent;
    } catch (RuntimeException | LinkageError | StackOverflowError e) {
      LOGGER.error(
          "Notifier {} raised an error sending alert for rule {}",
          notifier.getName(),
          rule.getId(),
          e);
      return false;
    }
  }
}
