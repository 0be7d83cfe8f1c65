package com.example;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.billing.resilience.core.config.ResilienceSettings;
import com.example.billing.resilience.core.recovery.InMemoryRecoveryStateStore;
import com.example.billing.resilience.core.recovery.RecoveryStateCodec;
import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import java.util.logging.LogManager;

/**
 * Demo application: retries a payment against a gateway that times out twice, then charges a
 * second payment twice under the same idempotency key.
 *
 * <p>Settings come from {@code billing.*} system properties or {@code BILLING_*} environment
 * variables, see {@link ResilienceSettings}.
 */
public class App {

  private static final System.Logger LOGGER = System.getLogger(App.class.getName());

  /**
   * Entry point.
   *
   * @param args CLI args (unused)
   */
  public static void main(String[] args) {
    configureLogging();
    final var settings = ResilienceSettings.fromEnvironment();
    final var idempotency = settings.idempotencyManager();
    final var cleanup = idempotency.scheduleCleanup(Duration.ofMinutes(5));
    final var codec = new RecoveryStateCodec();
    final var stateStore = new InMemoryRecoveryStateStore(codec);
    final var gateway = new SimulatedPaymentGateway(2, Duration.ofMillis(50));
    final var service =
        new PaymentRecoveryService(
            gateway, settings, idempotency, stateStore, AuditLog.logging());

    try {
      final var failed = new PaymentRequest("pay_1001", "cus_42", 4_999L, "USD");
      final var retried = service.retryFailedPaymentWithRecovery(failed).block();
      LOGGER.log(INFO, "Retried payment: {0}", retried);
      service
          .recoveryState(failed.paymentId())
          .ifPresent(state -> LOGGER.log(INFO, "Recovery state: {0}", codec.toJson(state)));

      final var key = UUID.randomUUID().toString();
      final var next = new PaymentRequest("pay_1002", "cus_42", 1_250L, "USD");
      final var first = service.chargeIdempotently(key, next).block();
      final var second = service.chargeIdempotently(key, next).block();
      LOGGER.log(
          INFO,
          "Idempotent charge: first={0} second={1} gatewayCharges={2}",
          first,
          second,
          String.valueOf(gateway.charges()));
    } finally {
      cleanup.dispose();
    }
  }

  private static void configureLogging() {
    try (var config = App.class.getResourceAsStream("/logging.properties")) {
      if (config != null) LogManager.getLogManager().readConfiguration(config);
    } catch (IOException e) {
      LOGGER.log(WARNING, "Failed to load logging.properties", e);
    }
  }
}
