/**
 * Decoded transaction requests.
 *
 * <p>{@link com.ryuqq.transferchain.core.request.ActionRequest} is a sealed variant with one record
 * per action. {@link com.ryuqq.transferchain.core.request.ActionRequestDecoder} turns the JSON payload
 * {@code {action, asset, owner?}} into one of them or rejects it.</p>
 *
 * @since 1.0.0
 * @author Transfer Chain Team
 */
package com.ryuqq.transferchain.core.request;
