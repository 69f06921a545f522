/**
 * Reusable contract tests for StateStore adapters.
 *
 * <p>Adapters subclass these classes in their own test sources and supply
 * a fresh store through {@code createStore()}.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
package com.ryuqq.transferchain.testkit.contract;
