/**
 * Namespaced ledger addresses.
 *
 * @since 1.0.0
 * @author Transfer Chain Team
 */
package com.ryuqq.transferchain.core.address;
