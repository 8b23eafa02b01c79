package io.heygw44.hive.domain.community.service;

import io.heygw44.hive.domain.community.dto.CreateCommunityRequest;
import io.heygw44.hive.domain.community.entity.Category;
import io.heygw44.hive.domain.community.repository.CategoryRepository;
import io.heygw44.hive.domain.community.repository.CommunityRepository;
import io.heygw44.hive.global.config.CommunityProperties;
import io.heygw44.hive.global.exception.BusinessException;
import io.heygw44.hive.global.exception.ErrorCode;
import io.heygw44.hive.global.response.FieldError;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 커뮤니티 생성 요청 검증기
 * 필수값/형식은 Bean Validation이 먼저 처리하고,
 * 여기서는 설정값과 DB 상태에 의존하는 규칙을 필드별로 모아서 한 번에 보고
 */
@Component
@RequiredArgsConstructor
public class CommunityCreationValidator {

    static final String NAME_TAKEN_MESSAGE = "이미 사용 중인 커뮤니티 이름입니다";

    private final CommunityRepository communityRepository;
    private final CategoryRepository categoryRepository;
    private final CommunityProperties communityProperties;

    /**
     * 생성 요청 검증
     * @return 요청한 이름에 대응하는 카테고리 엔티티
     */
    public Set<Category> validate(CreateCommunityRequest request) {
        List<FieldError> errors = new ArrayList<>();

        if (isNameTaken(request.name())) {
            errors.add(nameTakenError());
        }
        validateMaxLength("description", request.description(),
            communityProperties.descriptionMaxLength(), errors);
        validateMaxLength("rules", request.rules(),
            communityProperties.rulesMaxLength(), errors);
        Set<Category> categories = resolveCategories(request.categories(), errors);

        if (!errors.isEmpty()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, errors);
        }
        return categories;
    }

    /**
     * 이름 사용 가능 여부 검증 (형식은 DTO에서 검증됨)
     */
    public void validateNameAvailable(String name) {
        if (isNameTaken(name)) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, List.of(nameTakenError()));
        }
    }

    public static FieldError nameTakenError() {
        return new FieldError("name", NAME_TAKEN_MESSAGE);
    }

    private boolean isNameTaken(String name) {
        return communityRepository.existsByNameIgnoreCase(name);
    }

    private void validateMaxLength(String field, String value, int maxLength, List<FieldError> errors) {
        if (value != null && value.length() > maxLength) {
            errors.add(new FieldError(field, field + "은(는) " + maxLength + "자를 초과할 수 없습니다"));
        }
    }

    private Set<Category> resolveCategories(List<String> categoryNames, List<FieldError> errors) {
        int min = communityProperties.categoriesMinAmount();
        int max = communityProperties.categoriesMaxAmount();

        // 개수는 요청 목록 그대로 집계
        if (categoryNames.size() < min || categoryNames.size() > max) {
            errors.add(new FieldError("categories",
                "카테고리는 " + min + "개 이상 " + max + "개 이하로 선택해주세요"));
            return Set.of();
        }

        Set<String> names = new LinkedHashSet<>(categoryNames);
        if (names.size() != categoryNames.size()) {
            errors.add(new FieldError("categories", "같은 카테고리를 중복해서 선택할 수 없습니다"));
            return Set.of();
        }

        Set<Category> categories = new LinkedHashSet<>(categoryRepository.findByNameIn(names));
        if (categories.size() != names.size()) {
            Set<String> found = categories.stream()
                .map(Category::getName)
                .collect(Collectors.toSet());
            String missing = names.stream()
                .filter(name -> !found.contains(name))
                .collect(Collectors.joining(", "));
            errors.add(new FieldError("categories", "존재하지 않는 카테고리입니다: " + missing));
        }
        return categories;
    }
}
