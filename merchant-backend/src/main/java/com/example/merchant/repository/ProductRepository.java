package com.example.merchant.repository;

import com.example.merchant.model.Product;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class ProductRepository {

    private final JdbcClient jdbcClient;

    public ProductRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    public Optional<Product> findById(Long id) {
        return jdbcClient.sql("SELECT * FROM products WHERE id = :id")
            .param("id", id)
            .query(Product.class)
            .optional();
    }

    public List<Product> findAll(String category) {
        if (category == null || category.isBlank()) {
            return jdbcClient.sql("SELECT * FROM products ORDER BY id")
                .query(Product.class)
                .list();
        }
        return jdbcClient.sql("SELECT * FROM products WHERE LOWER(category) = LOWER(:category) ORDER BY id")
            .param("category", category)
            .query(Product.class)
            .list();
    }
}
