package com.shop.stockkeeper.repository;

import com.shop.stockkeeper.dto.SalesReportRow;
import com.shop.stockkeeper.model.Sale;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SaleRepository extends JpaRepository<Sale, Long> {

    @Query("SELECT new com.shop.stockkeeper.dto.SalesReportRow(s.id, i.name, u.username, s.quantity, s.total, s.createdAt) "
            + "FROM Sale s JOIN s.item i JOIN s.user u "
            + "WHERE s.shop.id = :shopId ORDER BY s.createdAt DESC, s.id DESC")
    List<SalesReportRow> findReportRowsByShopId(@Param("shopId") Long shopId);

    long countByItemId(Long itemId);

    long countByShopId(Long shopId);
}
