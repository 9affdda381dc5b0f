package com.ryuqq.wordbatch.adapter.file.json;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 임시 파일에 쓰고 이름을 바꾸는 방식의 파일 교체.
 *
 * <p>쓰는 도중 프로세스가 죽어도 대상 파일은 이전 내용 그대로 남습니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public final class AtomicFiles {

    private AtomicFiles() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 대상 파일 내용을 통째로 교체.
     *
     * @param target 대상 파일
     * @param content 새 내용
     * @throws IOException 쓰기 또는 이동 실패 시
     */
    public static void write(Path target, byte[] content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
