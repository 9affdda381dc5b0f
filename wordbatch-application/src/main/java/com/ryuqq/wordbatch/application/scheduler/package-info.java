/**
 * 시간 bucket 스케줄러 포트.
 *
 * @since 1.0.0
 */
package com.ryuqq.wordbatch.application.scheduler;
