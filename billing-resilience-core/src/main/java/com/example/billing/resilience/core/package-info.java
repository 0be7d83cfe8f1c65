/**
 * Resilient execution of calls to unreliable billing dependencies (payment gateways, webhook
 * targets).
 *
 * <ul>
 *   <li>{@link com.example.billing.resilience.core.retry} - retry strategies and the retry
 *       executor
 *   <li>{@link com.example.billing.resilience.core.circuit} - per-dependency circuit breakers
 *   <li>{@link com.example.billing.resilience.core.idempotency} - idempotency cache
 *   <li>{@link com.example.billing.resilience.core.recovery} - primary/fallback recovery scopes
 *   <li>{@link com.example.billing.resilience.core.failure} - error taxonomy and classification
 *   <li>{@link com.example.billing.resilience.core.config} - deployment defaults
 * </ul>
 *
 * <p>{@link com.example.billing.resilience.core.ResilientCall} assembles these layers around one
 * operation.
 */
package com.example.billing.resilience.core;
