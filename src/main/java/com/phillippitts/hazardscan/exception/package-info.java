/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.hazardscan.exception.HazardScanException} - base for all errors</li>
 *   <li>{@link com.phillippitts.hazardscan.exception.InputRejectedException} - security rejection
 *       ({@link com.phillippitts.hazardscan.exception.OversizedInputException},
 *       {@link com.phillippitts.hazardscan.exception.MalformedInputException})</li>
 *   <li>{@link com.phillippitts.hazardscan.exception.ModelIntegrityViolationException} - model
 *       artifact digest mismatch; disables the tier</li>
 *   <li>{@link com.phillippitts.hazardscan.exception.BudgetExceededException} - tier-scoped,
 *       resolved inside strategy selection and fallback</li>
 *   <li>{@link com.phillippitts.hazardscan.exception.BackendException} - one attempt failed
 *       ({@link com.phillippitts.hazardscan.exception.BackendFailureException},
 *       {@link com.phillippitts.hazardscan.exception.BackendTimeoutException})</li>
 *   <li>{@link com.phillippitts.hazardscan.exception.AllBackendsFailedException} - no usable
 *       candidate anywhere in the chain</li>
 * </ul>
 *
 * <p>Only the orchestrator converts these exceptions into
 * {@link com.phillippitts.hazardscan.domain.AnalysisOutcome} failures.
 */
package com.phillippitts.hazardscan.exception;
