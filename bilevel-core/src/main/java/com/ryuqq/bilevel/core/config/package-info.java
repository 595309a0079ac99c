/**
 * 컨테이너 용량 설정.
 *
 * <p>{@link com.ryuqq.bilevel.core.config.Capacity}는 모든 컨테이너 생성자가 받습니다.
 * 내부 테이블을 미리 확보할 뿐이며 성장을 제한하지 않습니다.</p>
 *
 * @since 1.0.0
 * @author Bilevel Team
 */
package com.ryuqq.bilevel.core.config;
