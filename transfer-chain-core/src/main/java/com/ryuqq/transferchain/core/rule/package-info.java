/**
 * Transition rules package.
 *
 * <p>One rule per action. Each rule reads the minimal address set it needs,
 * validates its invariants and returns the complete write-set.</p>
 *
 * <h2>Per-Asset State Machine</h2>
 * <pre>
 * absent ──create──► created ──transfer──► offered(buyer)
 *                       ▲                      │
 *                       │                 acknowledge
 *                    reject                    ▼
 *                       └────────────── pending-approval ──accept──► approved (owner = buyer)
 * </pre>
 *
 * <h2>Slot Topology</h2>
 * <ul>
 *   <li>TRANSFER_ACKN: written by transfer, cleared by acknowledge</li>
 *   <li>TRANSFER_APPROVE: written by acknowledge, cleared by accept or reject</li>
 *   <li>TRANSFER: reserved, written by no rule</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Transfer Chain Team
 */
package com.ryuqq.transferchain.core.rule;
