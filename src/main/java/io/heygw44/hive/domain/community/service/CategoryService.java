package io.heygw44.hive.domain.community.service;

import io.heygw44.hive.domain.community.dto.CategoryResponse;
import io.heygw44.hive.domain.community.repository.CategoryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class CategoryService {

    private final CategoryRepository categoryRepository;

    /**
     * 전체 카테고리 (표시 순서대로)
     */
    public List<CategoryResponse> getCategories() {
        return categoryRepository.findAllByOrderByOrderIndexAscNameAsc().stream()
            .map(CategoryResponse::from)
            .toList();
    }
}
