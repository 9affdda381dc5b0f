/**
 * 테스트용 in-memory SPI 구현체.
 *
 * @since 1.0.0
 */
package com.ryuqq.wordbatch.testkit.store;
