package io.heygw44.hive.domain.community.service;

import io.heygw44.hive.global.config.CommunityProperties;
import io.heygw44.hive.global.exception.BusinessException;
import io.heygw44.hive.global.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * 커뮤니티 아바타/커버 이미지 로컬 디렉터리 저장소
 * 반환값은 image-directory 기준 상대 경로
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommunityImageStorage {

    private final CommunityProperties communityProperties;

    /**
     * 업로드 파일이 이미지인지 검증 (비어 있으면 통과)
     */
    public void validateImage(String field, MultipartFile file) {
        if (isEmpty(file)) {
            return;
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw BusinessException.invalidField(field, "이미지 파일만 업로드할 수 있습니다");
        }
    }

    /**
     * 이미지 저장
     * @return 저장된 상대 경로, 파일이 없으면 null
     */
    public String store(String kind, Long communityId, MultipartFile file) {
        if (isEmpty(file)) {
            return null;
        }
        String fileName = communityId + "-" + UUID.randomUUID() + extensionOf(file);
        Path relativePath = Paths.get(kind, fileName);
        Path target = Paths.get(communityProperties.imageDirectory()).resolve(relativePath);
        try {
            Files.createDirectories(target.getParent());
            file.transferTo(target.toAbsolutePath());
        } catch (IOException ex) {
            log.error("커뮤니티 이미지 저장 실패: communityId={}, kind={}", communityId, kind, ex);
            throw new BusinessException(ErrorCode.IMAGE_STORE_FAILED);
        }
        log.debug("커뮤니티 이미지 저장: communityId={}, path={}", communityId, relativePath);
        deleteOnRollback(target);
        return relativePath.toString().replace('\\', '/');
    }

    /**
     * 트랜잭션이 롤백되면 저장한 파일 삭제
     */
    private void deleteOnRollback(Path target) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_ROLLED_BACK) {
                    delete(target);
                }
            }
        });
    }

    private void delete(Path target) {
        try {
            Files.deleteIfExists(target);
            log.debug("롤백된 커뮤니티 이미지 삭제: path={}", target);
        } catch (IOException ex) {
            log.warn("롤백된 커뮤니티 이미지 삭제 실패: path={}", target, ex);
        }
    }

    private boolean isEmpty(MultipartFile file) {
        return file == null || file.isEmpty();
    }

    private String extensionOf(MultipartFile file) {
        String extension = StringUtils.getFilenameExtension(file.getOriginalFilename());
        return StringUtils.hasText(extension) ? "." + extension.toLowerCase() : "";
    }
}
