package com.restaurant.analytics.infrastructure.persistence.repository;

import com.restaurant.analytics.infrastructure.persistence.entity.ProductEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProductRepository extends JpaRepository<ProductEntity, Integer> {

    @Query("SELECT DISTINCT p.category FROM ProductEntity p WHERE p.category IS NOT NULL ORDER BY p.category")
    List<String> findDistinctCategories();
}
