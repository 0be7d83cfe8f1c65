package com.example;

import static java.lang.System.Logger.Level.INFO;

import java.util.Map;
import reactor.core.publisher.Mono;

/** Sink for billing audit events. */
@FunctionalInterface
public interface AuditLog {

  /**
   * Records an audit event.
   *
   * @param action event name, e.g. {@code payment.retry.success}
   * @param resourceId affected resource
   * @param details extra fields
   * @return completion of the write
   */
  Mono<Void> record(String action, String resourceId, Map<String, String> details);

  /** Audit log writing each event as an INFO log line. */
  static AuditLog logging() {
    final var logger = System.getLogger(AuditLog.class.getName());
    return (action, resourceId, details) ->
        Mono.fromRunnable(
            () ->
                logger.log(
                    INFO,
                    "audit action={0} resource={1} details={2}",
                    action,
                    resourceId,
                    String.valueOf(details)));
  }
}
