package io.heygw44.hive.domain.community.repository;

import io.heygw44.hive.domain.community.entity.Category;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface CategoryRepository extends JpaRepository<Category, Long> {

    List<Category> findByNameIn(Collection<String> names);

    List<Category> findAllByOrderByOrderIndexAscNameAsc();
}
