/**
 * Deployment request state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioning.core.statemachine.RequestStatus} - Request lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.provisioning.core.statemachine.StateTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING_APPROVAL → APPROVED (approve)
 * PENDING_APPROVAL → REJECTED (reject)
 * APPROVED → DEPLOYING (pipeline trigger succeeded)
 * DEPLOYING → COMPLETED (pipeline success)
 * DEPLOYING → FAILED (pipeline failure)
 *
 * Forbidden:
 * - REJECTED / COMPLETED / FAILED → * (terminal state)
 * - Backward transitions (e.g., APPROVED → PENDING_APPROVAL)
 * </pre>
 *
 * <p>Invalid transitions throw {@link com.ryuqq.provisioning.core.error.LifecycleException}
 * with {@code INVALID_STATE}.</p>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.statemachine;
