package com.ledgerlens.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import com.ledgerlens.backend.entities.Category;
import com.ledgerlens.backend.services.statements.categorization.CategoryPair;

public interface CategoryRepository extends JpaRepository<Category, UUID> {

    Optional<Category> findFirstByNameAndParentIsNull(String name);

    Optional<Category> findFirstByNameAndParent(String name, Category parent);

    @Query("select new com.ledgerlens.backend.services.statements.categorization.CategoryPair(c.name, p.name) "
            + "from Category c left join c.parent p "
            + "order by c.name")
    List<CategoryPair> findAllPairs();
}
