/**
 * 네임스페이스 설정.
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
package com.ryuqq.transferchain.core.config;
