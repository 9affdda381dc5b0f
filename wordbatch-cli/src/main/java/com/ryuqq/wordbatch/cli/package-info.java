/**
 * picocli 기반 명령줄 진입점과 구성 요소 조립.
 *
 * @since 1.0.0
 */
package com.ryuqq.wordbatch.cli;
