/**
 * SPI 구현체가 공통으로 통과해야 하는 계약 테스트.
 *
 * @since 1.0.0
 */
package com.ryuqq.wordbatch.testkit.contract;
