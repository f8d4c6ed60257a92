package com.shop.stockkeeper.repository;

import com.shop.stockkeeper.model.Shop;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface ShopRepository extends JpaRepository<Shop, Long> {

    boolean existsByName(String name);

    List<Shop> findAllByOrderByNameAsc();
}
