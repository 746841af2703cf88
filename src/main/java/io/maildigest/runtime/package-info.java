/**
 * Runtime orchestration package.
 *
 * <p>{@link io.maildigest.runtime.CycleOrchestrator} ties the stores and
 * collaborators into one poll cycle, {@link io.maildigest.runtime.AdaptiveClock}
 * drives it, and {@link io.maildigest.runtime.DigestActions} is the
 * consumer-facing boundary that guards lifecycle transitions.
 */
package io.maildigest.runtime;
