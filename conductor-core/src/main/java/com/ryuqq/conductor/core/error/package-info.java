/**
 * Error taxonomy package.
 *
 * <p>Every failure mode of the engine maps to one {@link com.ryuqq.conductor.core.error.ErrorCode}.
 * Exceptions are unchecked and are converted to a {@link com.ryuqq.conductor.core.error.WorkError}
 * before they would cross the Coordinator boundary.</p>
 *
 * <h2>Propagation</h2>
 * <ul>
 *   <li>Resilience and safety failures abort the current handler invocation.</li>
 *   <li>State-load, state-save and output-normalization failures are recovered locally.</li>
 *   <li>Depth, cycle and budget failures abort only the delegation that triggered them.</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.error;
