/**
 * 상태 레코드의 정규(canonical) JSON 인코딩.
 *
 * <p>같은 레코드는 어느 노드에서든 같은 바이트로 인코딩되어야 합니다.
 * 필드와 Map 키는 알파벳 순으로 정렬되며 공백은 넣지 않습니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
package com.ryuqq.transferchain.core.codec;
