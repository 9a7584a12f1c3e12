/**
 * Immutable domain model shared by all orchestration components.
 *
 * <p>Records validate their invariants in compact constructors and defensively copy mutable
 * inputs (byte arrays, lists), so instances can be shared across threads and cached.
 */
package com.phillippitts.hazardscan.domain;
